package in.chartbridge.infrastructure.tradingview.session;

import com.fasterxml.jackson.databind.JsonNode;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.IndicatorPoint;
import in.chartbridge.domain.model.OhlcvBar;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.tradingview.codec.Frame;
import in.chartbridge.infrastructure.tradingview.codec.FrameDecoder;
import in.chartbridge.infrastructure.tradingview.codec.ProtocolException;
import in.chartbridge.infrastructure.tradingview.codec.WireCodec;
import in.chartbridge.infrastructure.tradingview.protocol.SessionIds;
import in.chartbridge.infrastructure.tradingview.protocol.TvCommands;
import in.chartbridge.infrastructure.tradingview.protocol.TvMessage;
import in.chartbridge.infrastructure.tradingview.protocol.TvMessageParser;
import in.chartbridge.infrastructure.tradingview.transport.Transport;
import in.chartbridge.infrastructure.tradingview.transport.TransportException;
import in.chartbridge.infrastructure.tradingview.transport.TransportListener;
import in.chartbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * State machine for one chart session over one transport.
 *
 * Lifecycle:
 * <pre>
 * ChartSession session = new ChartSession(id, transport, parser, commands, timeouts, observer, scheduler);
 * session.connect(jwt).get();                       // IDLE -> ... -> CHART_SESSION_CREATED
 * ChartData first = session.fetch(request, null).get();   // -> SYMBOL_RESOLVING -> SERIES_CREATING -> AWAITING_BARS -> READY
 * ChartData next = session.fetch(other, null).get();      // READY -> MODIFYING_SYMBOL -> AWAITING_BARS -> READY
 * session.close();                                  // -> CLOSED
 * </pre>
 *
 * One fetch at a time. All state lives under a single lock; transport callbacks,
 * timer callbacks and callers serialize on it. Futures are completed after the lock
 * is released so continuations never run inside the state machine.
 *
 * Failure handling:
 * - transport error, server close or malformed frame: CLOSED, every waiter fails with {@link TransportException}
 * - fatal server error before any symbol resolved, an auth-related error text, or a
 *   timeout with no server message at all: CLOSED, waiters fail with {@link SessionExpiredException}
 * - recoverable server error (bad symbol, bad resolution, series limit): only the current
 *   fetch fails with {@link RequestRejectedException}; the session stays usable
 */
public class ChartSession {
    private static final Logger log = LoggerFactory.getLogger(ChartSession.class);

    static final String SERIES_ID = "sds_1";
    static final String INDICATOR_KEY = "cvd";

    private static final List<String> AUTH_ERROR_MARKERS = List.of(
        "auth", "token", "unauthorized", "forbidden", "expired", "permission");

    private final String connectionId;
    private final Transport transport;
    private final TvMessageParser parser;
    private final TvCommands commands;
    private final SessionTimeouts timeouts;
    private final SessionObserver observer;
    private final ScheduledExecutorService scheduler;
    private final FrameDecoder decoder = new FrameDecoder();

    private final Object lock = new Object();
    private SessionState state = SessionState.IDLE;
    private long stateEnteredNanos = System.nanoTime();
    private String chartSessionId;
    private String serverSessionId;
    private boolean seriesCreated;
    private int seriesBarsCount;
    private boolean everResolved;
    private long messagesReceived;
    private int requestCounter;
    private String lastStudyId;
    private CompletableFuture<Void> connectFuture;
    private ActiveFetch active;
    private ScheduledFuture<?> timer;
    private long timerGeneration;
    private RuntimeException closeCause;

    public ChartSession(String connectionId,
                        Transport transport,
                        TvMessageParser parser,
                        TvCommands commands,
                        SessionTimeouts timeouts,
                        SessionObserver observer,
                        ScheduledExecutorService scheduler) {
        this.connectionId = connectionId;
        this.transport = transport;
        this.parser = parser;
        this.commands = commands;
        this.timeouts = timeouts;
        this.observer = observer;
        this.scheduler = scheduler;
    }

    // ═══════════════════════════════════════════════════════════════
    // Public API
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open the transport, send the token and create the chart session.
     *
     * The protocol has no acknowledgement for the token or the chart session, so the
     * future completes as soon as both commands are sent. A rejected token shows up
     * later as {@link SessionExpiredException} on the first fetch.
     */
    public CompletableFuture<Void> connect(String jwt) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        synchronized (lock) {
            if (state != SessionState.IDLE) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("connect() not allowed in state " + state));
            }
            connectFuture = future;
            transition(SessionState.CONNECTING);
            armTimer(timeouts.connect(), after -> failLocked(new TransportException(connectionId,
                "Connect timed out after " + timeouts.connect().toMillis() + " ms"), after));
        }

        CompletableFuture<Void> opened;
        try {
            opened = transport.open(new Listener());
        } catch (RuntimeException e) {
            fail(toTransportError(e));
            return future;
        }
        opened.whenComplete((ignored, error) -> {
            if (error != null) {
                fail(toTransportError(error));
            } else {
                onOpen(jwt);
            }
        });
        return future;
    }

    /**
     * Fetch bars (and optionally an indicator) for one symbol+resolution.
     *
     * On a fresh session the series is created; on a session that already served a
     * request the existing series is switched to the new symbol in place.
     *
     * @param script indicator script, or null to skip the indicator even if the request asks for it
     */
    public CompletableFuture<ChartData> fetch(ChartRequest request, StudyScript script) {
        CompletableFuture<ChartData> result = new CompletableFuture<>();
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (!state.acceptsRequests() || active != null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("fetch() not allowed in state " + state));
            }
            int n = ++requestCounter;
            boolean reuse = seriesCreated;
            String studyId = request.wantsIndicator() && script != null ? "st" + n : null;
            active = new ActiveFetch(request, "sds_sym_" + n, "s" + n, studyId, script, reuse, result);

            transition(reuse ? SessionState.MODIFYING_SYMBOL : SessionState.SYMBOL_RESOLVING);
            try {
                send(commands.resolveSymbol(chartSessionId, active.symbolSessionId, request.symbol()));
                armTimer(timeouts.resolve(), a -> onWaitTimeout("Symbol resolve", a));
            } catch (TransportException e) {
                failLocked(e, after);
            }
        }
        runAll(after);
        return result;
    }

    /**
     * Blocking form of {@link #fetch(ChartRequest, StudyScript)} that rethrows the typed failure.
     */
    public ChartData fetchSync(ChartRequest request, StudyScript script) {
        return Futures.await(fetch(request, script));
    }

    /**
     * Delete the chart session (best effort) and close the transport. Idempotent.
     */
    public void close() {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state == SessionState.CLOSED) {
                return;
            }
            if (chartSessionId != null && transport.isOpen()) {
                try {
                    send(commands.chartDeleteSession(chartSessionId));
                } catch (TransportException e) {
                    log.debug("[CHART SESSION] [{}] Could not delete chart session: {}", connectionId, e.getMessage());
                }
            }
            failLocked(new TransportException(connectionId, "Session closed"), after);
        }
        runAll(after);
    }

    public SessionState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * True when a new fetch can start right now over a live transport.
     */
    public boolean isUsable() {
        synchronized (lock) {
            return state.acceptsRequests() && active == null && transport.isOpen();
        }
    }

    public String connectionId() {
        return connectionId;
    }

    public String chartSessionId() {
        synchronized (lock) {
            return chartSessionId;
        }
    }

    public String serverSessionId() {
        synchronized (lock) {
            return serverSessionId;
        }
    }

    /**
     * @return why the session closed, or null while it is open
     */
    public RuntimeException closeCause() {
        synchronized (lock) {
            return closeCause;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Transport events
    // ═══════════════════════════════════════════════════════════════

    private void onOpen(String jwt) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state != SessionState.CONNECTING) {
                return;
            }
            cancelTimer();
            try {
                transition(SessionState.AUTHENTICATING);
                send(commands.setAuthToken(jwt));
                send(commands.setLocale());

                chartSessionId = SessionIds.chartSession();
                send(commands.chartCreateSession(chartSessionId));
                transition(SessionState.CHART_SESSION_CREATED);

                CompletableFuture<Void> future = connectFuture;
                after.add(() -> future.complete(null));
            } catch (TransportException e) {
                failLocked(e, after);
            }
        }
        runAll(after);
    }

    private void onText(String text) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            if (state == SessionState.CLOSED) {
                return;
            }
            try {
                for (Frame frame : decoder.feed(text)) {
                    if (frame.isPing()) {
                        // already framed
                        transport.send(WireCodec.heartbeatReply(frame));
                        log.trace("[CHART SESSION] [{}] Heartbeat {}", connectionId, frame.payload());
                        continue;
                    }
                    handleMessage(parser.parse(frame.payload()), after);
                    if (state == SessionState.CLOSED) {
                        break;
                    }
                }
            } catch (ProtocolException e) {
                failLocked(new TransportException(connectionId, "Malformed frame: " + e.getMessage(), e), after);
            } catch (TransportException e) {
                failLocked(e, after);
            }
        }
        runAll(after);
    }

    private void fail(RuntimeException error) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            failLocked(error, after);
        }
        runAll(after);
    }

    // ═══════════════════════════════════════════════════════════════
    // Message dispatch
    // ═══════════════════════════════════════════════════════════════

    private void handleMessage(TvMessage message, List<Runnable> after) {
        if (message.type() == TvMessage.Type.HANDSHAKE) {
            serverSessionId = ((TvMessage.Handshake) message).sessionId();
            log.debug("[CHART SESSION] [{}] Server session {}", connectionId, serverSessionId);
            return;
        }
        messagesReceived++;

        switch (message.type()) {
            case SYMBOL_RESOLVED -> onSymbolResolved((TvMessage.SymbolResolved) message);
            case SYMBOL_ERROR -> onSymbolError((TvMessage.SymbolError) message, after);
            case SERIES_DATA -> onSeriesData((TvMessage.SeriesData) message, after);
            case SERIES_COMPLETED -> onSeriesCompleted(after);
            case STUDY_LOADING -> onStudyLoading((TvMessage.StudyLoading) message);
            case ERROR -> onErrorMessage((TvMessage.ErrorMessage) message, after);
            default -> log.trace("[CHART SESSION] [{}] Ignoring {}", connectionId, message);
        }
    }

    private void onSymbolResolved(TvMessage.SymbolResolved message) {
        if (!isOurs(message.chartSessionId())) {
            return;
        }
        if (active == null || active.resolved || !active.symbolSessionId.equals(message.symbolSessionId())) {
            return;
        }

        active.resolved = true;
        active.metadata = message.metadata();
        everResolved = true;
        ChartRequest request = active.request;

        if (lastStudyId != null) {
            send(commands.removeStudy(chartSessionId, lastStudyId));
            lastStudyId = null;
        }

        if (active.reuse && request.barsCount() == seriesBarsCount) {
            send(commands.modifySeries(chartSessionId, SERIES_ID, active.turnaround,
                active.symbolSessionId, request.resolution()));
        } else {
            if (seriesBarsCount > 0) {
                // sds_1 exists: modify_series keeps its bar count, or it was rejected before any bar arrived
                send(commands.removeSeries(chartSessionId, SERIES_ID));
            }
            if (!active.reuse) {
                transition(SessionState.SERIES_CREATING);
            }
            send(commands.createSeries(chartSessionId, SERIES_ID, active.turnaround,
                active.symbolSessionId, request.resolution(), request.barsCount()));
            seriesBarsCount = request.barsCount();
        }

        if (active.studyId != null) {
            send(commands.createCvdStudy(chartSessionId, active.studyId, active.turnaround,
                SERIES_ID, active.script, request.indicator()));
            lastStudyId = active.studyId;
        }

        armTimer(timeouts.series(), a -> onWaitTimeout("Series data", a));
    }

    private void onSymbolError(TvMessage.SymbolError message, List<Runnable> after) {
        if (!isOurs(message.chartSessionId())) {
            return;
        }
        String symbolSession = message.symbolSessionId();
        if (active != null && (symbolSession == null || symbolSession.equals(active.symbolSessionId))) {
            log.warn("[CHART SESSION] [{}] Symbol error for {}: {}",
                connectionId, active.request.symbol(), message.reason());
            rejectActive("Symbol error: " + message.reason(), after);
        }
    }

    private void onSeriesData(TvMessage.SeriesData message, List<Runnable> after) {
        if (!isOurs(message.chartSessionId()) || active == null || !active.resolved) {
            return;
        }
        boolean forSeries = message.contains(SERIES_ID);
        boolean forStudy = active.studyId != null && message.contains(active.studyId);

        if (forSeries) {
            String turnaround = message.turnaround(SERIES_ID);
            if (turnaround != null && !turnaround.equals(active.turnaround)) {
                // late update for the previous symbol on this series
                forSeries = false;
            }
        }
        if (!forSeries && !forStudy) {
            return;
        }

        if (forSeries) {
            for (OhlcvBar bar : message.bars(SERIES_ID)) {
                active.bars.put(bar.time(), bar);
            }
            seriesCreated = true;
            if (state == SessionState.SERIES_CREATING || state == SessionState.MODIFYING_SYMBOL) {
                transition(SessionState.AWAITING_BARS);
            }
        }
        if (forStudy) {
            for (IndicatorPoint point : message.studyPoints(active.studyId)) {
                active.studyPoints.put(point.time(), point);
            }
        }

        if (state != SessionState.AWAITING_BARS) {
            return;
        }
        if (active.isComplete()) {
            settle(after);
        } else {
            armIdleTimer();
        }
    }

    private void onSeriesCompleted(List<Runnable> after) {
        if (state == SessionState.AWAITING_BARS && active != null && active.studyId == null) {
            settle(after);
        }
    }

    private void onStudyLoading(TvMessage.StudyLoading message) {
        if (active != null && active.studyId != null && active.studyId.equals(message.studyId())) {
            active.studyLoading = true;
            if (state == SessionState.AWAITING_BARS) {
                armIdleTimer();
            }
        }
    }

    private void onErrorMessage(TvMessage.ErrorMessage message, List<Runnable> after) {
        if (message.recoverable()) {
            if (active != null && "study_error".equals(message.method())) {
                log.warn("[CHART SESSION] [{}] Indicator failed for {}: {}",
                    connectionId, active.request.symbol(), message.text());
                active.indicatorError = message.text();
                if (state == SessionState.AWAITING_BARS && active.isComplete()) {
                    settle(after);
                }
                return;
            }
            log.warn("[CHART SESSION] [{}] Request rejected: {}", connectionId, message.text());
            rejectActive(message.text(), after);
            return;
        }

        log.error("[CHART SESSION] [{}] Fatal {}: {}", connectionId, message.method(), message.text());
        RuntimeException error = isAuthError(message.text()) || !everResolved
            ? new SessionExpiredException(connectionId, "Server rejected session: " + message.text())
            : new TransportException(connectionId, "Fatal protocol error: " + message.text());
        failLocked(error, after);
    }

    // ═══════════════════════════════════════════════════════════════
    // Completion paths
    // ═══════════════════════════════════════════════════════════════

    private void settle(List<Runnable> after) {
        cancelTimer();
        ActiveFetch fetch = active;
        active = null;
        transition(SessionState.READY);

        ChartRequest request = fetch.request;
        if (fetch.bars.isEmpty()) {
            RequestRejectedException error = new RequestRejectedException(connectionId, request.symbol(),
                "No bars received for " + request.resolution() + ". Symbol may be invalid or delisted");
            after.add(() -> fetch.result.completeExceptionally(error));
            return;
        }

        Map<String, List<IndicatorPoint>> indicators = Map.of();
        String indicatorError = fetch.indicatorError;
        if (fetch.studyId != null) {
            if (!fetch.studyPoints.isEmpty()) {
                indicators = Map.of(INDICATOR_KEY, new ArrayList<>(fetch.studyPoints.values()));
            } else if (indicatorError == null) {
                indicatorError = "Indicator data not received";
            }
        }

        ChartData data = new ChartData(request.symbol(), request.resolution(),
            new ArrayList<>(fetch.bars.values()), fetch.metadata, indicators, indicatorError);
        log.debug("[CHART SESSION] [{}] {} {} settled with {} bars",
            connectionId, request.symbol(), request.resolution(), data.bars().size());
        after.add(() -> fetch.result.complete(data));
    }

    private void rejectActive(String reason, List<Runnable> after) {
        if (active == null) {
            return;
        }
        cancelTimer();
        ActiveFetch fetch = active;
        active = null;
        transition(seriesCreated ? SessionState.READY : SessionState.CHART_SESSION_CREATED);

        RequestRejectedException error = new RequestRejectedException(connectionId, fetch.request.symbol(), reason);
        after.add(() -> fetch.result.completeExceptionally(error));
    }

    private void onWaitTimeout(String what, List<Runnable> after) {
        String message = what + " timed out in state " + state;
        RuntimeException error = messagesReceived == 0
            ? new SessionExpiredException(connectionId, message + " with no server response to the auth token")
            : new TransportException(connectionId, message);
        failLocked(error, after);
    }

    private void failLocked(RuntimeException error, List<Runnable> after) {
        if (state == SessionState.CLOSED) {
            return;
        }
        cancelTimer();
        closeCause = error;
        transition(SessionState.CLOSED);
        log.debug("[CHART SESSION] [{}] Closed: {}", connectionId, error.getMessage());

        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("[CHART SESSION] [{}] Transport close failed: {}", connectionId, e.getMessage());
        }

        CompletableFuture<Void> connecting = connectFuture;
        ActiveFetch fetch = active;
        active = null;

        after.add(() -> {
            if (connecting != null) {
                connecting.completeExceptionally(error);
            }
            if (fetch != null) {
                fetch.result.completeExceptionally(error);
            }
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private void transition(SessionState next) {
        SessionState previous = state;
        long now = System.nanoTime();
        Duration elapsed = Duration.ofNanos(now - stateEnteredNanos);
        state = next;
        stateEnteredNanos = now;
        try {
            observer.onTransition(new SessionTransition(connectionId, previous, next, elapsed));
        } catch (RuntimeException e) {
            log.warn("[CHART SESSION] [{}] Observer failed on {} -> {}", connectionId, previous, next, e);
        }
    }

    private void send(String payload) {
        transport.send(WireCodec.encodeText(payload));
    }

    private void armIdleTimer() {
        boolean waitingOnStudy = active.studyId != null && active.studyLoading
            && active.studyPoints.isEmpty() && active.indicatorError == null;
        armTimer(waitingOnStudy ? timeouts.study() : timeouts.idleBarWait(), this::settle);
    }

    private void armTimer(Duration delay, Consumer<List<Runnable>> onFire) {
        cancelTimer();
        long generation = timerGeneration;
        timer = scheduler.schedule(() -> {
            List<Runnable> after = new ArrayList<>();
            synchronized (lock) {
                if (generation != timerGeneration || state == SessionState.CLOSED) {
                    return;
                }
                timer = null;
                onFire.accept(after);
            }
            runAll(after);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelTimer() {
        timerGeneration++;
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private boolean isOurs(String messageChartSession) {
        return messageChartSession == null || messageChartSession.equals(chartSessionId);
    }

    private RuntimeException toTransportError(Throwable error) {
        RuntimeException cause = Futures.unwrap(error);
        if (cause instanceof TransportException || cause instanceof SessionExpiredException) {
            return cause;
        }
        return new TransportException(connectionId, "Transport failure: " + cause.getMessage(), cause);
    }

    private static boolean isAuthError(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : AUTH_ERROR_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private void runAll(List<Runnable> actions) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[CHART SESSION] [{}] Completion callback failed", connectionId, e);
            }
        }
    }

    private final class Listener implements TransportListener {
        @Override
        public void onMessage(String text) {
            onText(text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            fail(new TransportException(connectionId, "Closed by server: " + statusCode + " " + reason));
        }

        @Override
        public void onError(Throwable error) {
            fail(new TransportException(connectionId, "Transport error: " + error.getMessage(), error));
        }
    }

    /**
     * Per-request state. Owned by the session lock; replaced, never mutated, across requests.
     */
    private static final class ActiveFetch {
        final ChartRequest request;
        final String symbolSessionId;
        final String turnaround;
        final String studyId;
        final StudyScript script;
        final boolean reuse;
        final CompletableFuture<ChartData> result;
        final TreeMap<Long, OhlcvBar> bars = new TreeMap<>();
        final TreeMap<Long, IndicatorPoint> studyPoints = new TreeMap<>();

        boolean resolved;
        boolean studyLoading;
        JsonNode metadata;
        String indicatorError;

        ActiveFetch(ChartRequest request, String symbolSessionId, String turnaround, String studyId,
                    StudyScript script, boolean reuse, CompletableFuture<ChartData> result) {
            this.request = request;
            this.symbolSessionId = symbolSessionId;
            this.turnaround = turnaround;
            this.studyId = studyId;
            this.script = script;
            this.reuse = reuse;
            this.result = result;
        }

        boolean isComplete() {
            boolean barsDone = bars.size() >= request.barsCount();
            boolean studyDone = studyId == null || !studyPoints.isEmpty() || indicatorError != null;
            return barsDone && studyDone;
        }
    }
}
