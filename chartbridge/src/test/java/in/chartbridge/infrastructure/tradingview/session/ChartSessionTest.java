package in.chartbridge.infrastructure.tradingview.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.IndicatorSettings;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.tradingview.protocol.TvCommands;
import in.chartbridge.infrastructure.tradingview.protocol.TvMessageParser;
import in.chartbridge.infrastructure.tradingview.transport.FakeTransport;
import in.chartbridge.infrastructure.tradingview.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the chart session state machine through a scripted in-memory transport.
 *
 * Tests:
 * - Connect sends auth, locale and chart session commands
 * - Fresh fetch resolves, creates the series and settles on the requested count
 * - Duplicate bar times collapse, last write wins
 * - Idle timeout settles a short series
 * - Reuse switches the series with modify_series and ignores stale frames
 * - Recoverable and fatal server errors
 * - A series rejected before any bar is removed before the next create_series
 * - Transport failure, malformed frames and silent servers
 * - Heartbeat echo
 * - Indicator study data
 */
public class ChartSessionTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String JWT = "jwt-token";
    private static final StudyScript SCRIPT = new StudyScript("bmI9Ks46_abc", "STD;Cumulative%1Volume%1Delta", "7.0");

    private ScheduledExecutorService scheduler;
    private FakeTransport transport;
    private List<SessionTransition> transitions;
    private ChartSession session;

    @BeforeEach
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        transport = new FakeTransport("test-1");
        transitions = new CopyOnWriteArrayList<>();
        SessionTimeouts timeouts = new SessionTimeouts(
            Duration.ofSeconds(2), Duration.ofMillis(300), Duration.ofMillis(500),
            Duration.ofMillis(500), Duration.ofMillis(150));
        session = new ChartSession("test-1", transport, new TvMessageParser(MAPPER), new TvCommands(MAPPER),
            timeouts, transitions::add, scheduler);
    }

    @AfterEach
    public void tearDown() {
        session.close();
        scheduler.shutdownNow();
    }

    @Test
    public void testConnectSendsAuthLocaleAndChartSession() throws Exception {
        session.connect(JWT).get(1, TimeUnit.SECONDS);

        assertEquals(List.of("set_auth_token", "set_locale", "chart_create_session"), transport.sentMethods());
        assertEquals(JWT, transport.lastParams("set_auth_token").get(0).asText());
        assertEquals(session.chartSessionId(), transport.lastParams("chart_create_session").get(0).asText());
        assertTrue(session.chartSessionId().startsWith("cs_"));
        assertEquals(SessionState.CHART_SESSION_CREATED, session.state());
        assertTrue(session.isUsable());

        assertEquals(List.of(SessionState.CONNECTING, SessionState.AUTHENTICATING, SessionState.CHART_SESSION_CREATED),
            transitions.stream().map(SessionTransition::to).toList());
        assertEquals(SessionState.IDLE, transitions.get(0).from());
    }

    @Test
    public void testFreshFetchSettlesOnRequestedCount() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 3), null);

        assertEquals(SessionState.SYMBOL_RESOLVING, session.state());
        JsonNode resolve = transport.lastParams("resolve_symbol");
        assertEquals("sds_sym_1", resolve.get(1).asText());
        assertTrue(resolve.get(2).asText().contains("\"symbol\":\"NSE:TCS\""));

        resolved("sds_sym_1");
        assertEquals(SessionState.SERIES_CREATING, session.state());
        JsonNode create = transport.lastParams("create_series");
        assertEquals("sds_1", create.get(1).asText());
        assertEquals("s1", create.get(2).asText());
        assertEquals("1D", create.get(4).asText());
        assertEquals(3, create.get(5).asInt());

        bars("s1", bar(300, 12), bar(100, 10), bar(200, 11));

        ChartData data = result.get(1, TimeUnit.SECONDS);
        assertEquals(3, data.bars().size());
        assertEquals(100, data.bars().get(0).time());
        assertEquals(300, data.bars().get(2).time());
        assertEquals("NSE:TCS", data.symbol());
        assertEquals("NSE", data.metadata().path("exchange").asText());
        assertEquals(SessionState.READY, session.state());
        assertTrue(transitions.stream().anyMatch(t -> t.to() == SessionState.AWAITING_BARS));
    }

    @Test
    public void testDuplicateBarTimesLastWriteWins() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 3), null);
        resolved("sds_sym_1");

        bars("s1", bar(100, 10), bar(200, 11));
        bars("s1", bar(200, 99));
        assertFalse(result.isDone(), "two distinct bars must not satisfy a count of three");
        bars("s1", bar(300, 12));

        ChartData data = result.get(1, TimeUnit.SECONDS);
        assertEquals(3, data.bars().size());
        assertEquals(99, data.bars().get(1).close(), 0.0001);
    }

    @Test
    public void testIdleTimeoutSettlesShortSeries() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 300), null);
        resolved("sds_sym_1");
        bars("s1", bar(100, 10), bar(200, 11));

        ChartData data = result.get(2, TimeUnit.SECONDS);
        assertEquals(2, data.bars().size());
        assertEquals(SessionState.READY, session.state());
    }

    @Test
    public void testSeriesCompletedSettlesWithoutWaiting() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 300), null);
        resolved("sds_sym_1");
        bars("s1", bar(100, 10));
        transport.deliver(json("{\"m\":\"series_completed\",\"p\":[\"%s\",\"sds_1\",\"streaming\",\"s1\"]}", cs()));

        assertEquals(1, result.get(100, TimeUnit.MILLISECONDS).bars().size());
    }

    @Test
    public void testReuseModifiesSeriesAndIgnoresStaleFrames() throws Exception {
        connect();
        CompletableFuture<ChartData> first = session.fetch(ChartRequest.of("NSE:TCS", "1D", 2), null);
        resolved("sds_sym_1");
        bars("s1", bar(100, 10), bar(200, 11));
        first.get(1, TimeUnit.SECONDS);

        CompletableFuture<ChartData> second = session.fetch(ChartRequest.of("NSE:INFY", "60", 2), null);
        assertEquals(SessionState.MODIFYING_SYMBOL, session.state());
        resolved("sds_sym_2");

        JsonNode modify = transport.lastParams("modify_series");
        assertEquals("s2", modify.get(2).asText());
        assertEquals("sds_sym_2", modify.get(3).asText());
        assertEquals("60", modify.get(4).asText());
        assertEquals(1, transport.sentMethods().stream().filter("create_series"::equals).count());

        // late update for the previous symbol
        bars("s1", bar(500, 1), bar(600, 1));
        assertFalse(second.isDone());

        bars("s2", bar(1000, 50), bar(2000, 51));
        ChartData data = second.get(1, TimeUnit.SECONDS);
        assertEquals("NSE:INFY", data.symbol());
        assertEquals(List.of(1000L, 2000L), data.bars().stream().map(b -> b.time()).toList());
        assertTrue(transitions.stream().anyMatch(
            t -> t.from() == SessionState.MODIFYING_SYMBOL && t.to() == SessionState.AWAITING_BARS));
    }

    @Test
    public void testReuseWithDifferentBarsCountRecreatesSeries() throws Exception {
        connect();
        CompletableFuture<ChartData> first = session.fetch(ChartRequest.of("NSE:TCS", "1D", 1), null);
        resolved("sds_sym_1");
        bars("s1", bar(100, 10));
        first.get(1, TimeUnit.SECONDS);

        session.fetch(ChartRequest.of("NSE:TCS", "1D", 5), null);
        resolved("sds_sym_2");

        List<String> methods = transport.sentMethods();
        int remove = methods.lastIndexOf("remove_series");
        int create = methods.lastIndexOf("create_series");
        assertTrue(remove > 0 && create > remove, "expected remove_series then create_series, got " + methods);
        assertEquals(5, transport.lastParams("create_series").get(5).asInt());
    }

    @Test
    public void testSymbolErrorRejectsRequestButKeepsSession() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:NOPE", "1D", 10), null);
        transport.deliver(json("{\"m\":\"symbol_error\",\"p\":[\"%s\",\"sds_sym_1\",\"invalid symbol\"]}", cs()));

        RequestRejectedException error = assertRejected(result);
        assertTrue(error.getReason().contains("invalid symbol"));
        assertEquals(SessionState.CHART_SESSION_CREATED, session.state());
        assertTrue(session.isUsable());

        CompletableFuture<ChartData> retry = session.fetch(ChartRequest.of("NSE:TCS", "1D", 1), null);
        assertEquals("sds_sym_2", transport.lastParams("resolve_symbol").get(1).asText());
        resolved("sds_sym_2");
        bars("s2", bar(100, 10));
        assertEquals(1, retry.get(1, TimeUnit.SECONDS).bars().size());
    }

    @Test
    public void testRecoverableProtocolErrorKeepsSessionUsable() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "7X", 10), null);
        resolved("sds_sym_1");
        transport.deliver("{\"m\":\"protocol_error\",\"p\":[\"invalid resolution\"]}");

        RequestRejectedException error = assertRejected(result);
        assertTrue(error.getReason().contains("invalid resolution"));
        assertEquals(SessionState.CHART_SESSION_CREATED, session.state());
        assertTrue(session.isUsable());
    }

    @Test
    public void testRejectedSeriesIsRemovedBeforeNextCreate() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "7X", 10), null);
        resolved("sds_sym_1");
        transport.deliver("{\"m\":\"protocol_error\",\"p\":[\"invalid resolution\"]}");
        assertRejected(result);

        CompletableFuture<ChartData> retry = session.fetch(ChartRequest.of("NSE:TCS", "1D", 1), null);
        resolved("sds_sym_2");

        List<String> methods = transport.sentMethods();
        int remove = methods.lastIndexOf("remove_series");
        int create = methods.lastIndexOf("create_series");
        assertTrue(remove > methods.indexOf("create_series") && create > remove,
            "expected remove_series then create_series, got " + methods);

        bars("s2", bar(100, 10));
        assertEquals(1, retry.get(1, TimeUnit.SECONDS).bars().size());
    }

    @Test
    public void testFatalErrorBeforeResolveIsSessionExpired() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);
        transport.deliver("{\"m\":\"critical_error\",\"p\":[\"wrong data\"]}");

        assertFailsWith(SessionExpiredException.class, result);
        assertEquals(SessionState.CLOSED, session.state());
        assertTrue(transport.isClosed());
        assertFalse(session.isUsable());
    }

    @Test
    public void testTransportErrorFailsActiveFetch() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);
        resolved("sds_sym_1");
        transport.fail(new RuntimeException("connection reset"));

        assertFailsWith(TransportException.class, result);
        assertEquals(SessionState.CLOSED, session.state());
        assertInstanceOf(TransportException.class, session.closeCause());
    }

    @Test
    public void testMalformedFrameClosesSession() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);
        transport.deliverRaw("~m~abc~m~{}");

        TransportException error = assertFailsWith(TransportException.class, result);
        assertTrue(error.getMessage().contains("Malformed frame"));
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    public void testSilentServerTimesOutAsSessionExpired() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);

        assertFailsWith(SessionExpiredException.class, result);
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    public void testSeriesTimeoutAfterServerResponseIsTransportError() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);
        resolved("sds_sym_1");

        assertFailsWith(TransportException.class, result);
    }

    @Test
    public void testNoBarsIsRejected() throws Exception {
        connect();
        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:OLD", "1D", 10), null);
        resolved("sds_sym_1");
        transport.deliver(json("{\"m\":\"du\",\"p\":[\"%s\",{\"sds_1\":{\"s\":[],\"t\":\"s1\"}}]}", cs()));

        RequestRejectedException error = assertRejected(result);
        assertTrue(error.getReason().startsWith("No bars received"));
        assertEquals(SessionState.READY, session.state());
    }

    @Test
    public void testHeartbeatEchoedVerbatim() throws Exception {
        connect();
        transport.deliver("~h~42");

        List<String> sent = transport.sentPayloads();
        assertEquals("~h~42", sent.get(sent.size() - 1));
        List<String> raw = transport.sentRaw();
        assertEquals("~m~5~m~~h~42", raw.get(raw.size() - 1));
        assertEquals(SessionState.CHART_SESSION_CREATED, session.state());
    }

    @Test
    public void testHandshakeIsRecordedButDoesNotCountAsResponse() throws Exception {
        connect();
        transport.deliver("{\"session_id\":\"<0.1.2>_abc\",\"timestamp\":1700000000}");
        assertEquals("<0.1.2>_abc", session.serverSessionId());

        CompletableFuture<ChartData> result = session.fetch(ChartRequest.of("NSE:TCS", "1D", 10), null);
        assertFailsWith(SessionExpiredException.class, result);
    }

    @Test
    public void testIndicatorStudyData() throws Exception {
        connect();
        ChartRequest request = new ChartRequest("NSE:TCS", "1D", 2, new IndicatorSettings("3M", "15S"));
        CompletableFuture<ChartData> result = session.fetch(request, SCRIPT);
        resolved("sds_sym_1");

        JsonNode study = transport.lastParams("create_study");
        assertEquals("st1", study.get(1).asText());
        assertEquals(TvCommands.SCRIPT_STUDY_NAME, study.get(4).asText());
        assertEquals("3M", study.get(5).path("in_0").path("v").asText());
        assertEquals("15S", study.get(5).path("in_2").path("v").asText());

        bars("s1", bar(100, 10), bar(200, 11));
        assertFalse(result.isDone(), "study data still pending");

        transport.deliver(json("{\"m\":\"du\",\"p\":[\"%s\",{\"st1\":{\"st\":["
            + "{\"i\":0,\"v\":[100,1.5,2.5,0.5,1.0]},{\"i\":1,\"v\":[200,2.0,3.0,1.0,2.5]}]}}]}", cs()));

        ChartData data = result.get(1, TimeUnit.SECONDS);
        assertEquals(2, data.indicators().get("cvd").size());
        assertEquals(List.of(1.5, 2.5, 0.5, 1.0), data.indicators().get("cvd").get(0).values());
        assertNull(data.indicatorError());
    }

    @Test
    public void testStudyErrorKeepsBars() throws Exception {
        connect();
        ChartRequest request = new ChartRequest("NSE:TCS", "1D", 1, IndicatorSettings.defaults());
        CompletableFuture<ChartData> result = session.fetch(request, SCRIPT);
        resolved("sds_sym_1");
        bars("s1", bar(100, 10));
        transport.deliver(json("{\"m\":\"study_error\",\"p\":[\"%s\",\"st1\",\"s1\",\"script compile failed\"]}", cs()));

        ChartData data = result.get(1, TimeUnit.SECONDS);
        assertEquals(1, data.bars().size());
        assertEquals("script compile failed", data.indicatorError());
        assertTrue(data.indicators().isEmpty());
    }

    @Test
    public void testCloseIsIdempotentAndDeletesChartSession() throws Exception {
        connect();
        session.close();
        session.close();

        assertEquals(SessionState.CLOSED, session.state());
        assertEquals(1, transport.sentMethods().stream().filter("chart_delete_session"::equals).count());
        assertEquals(1, transitions.stream().filter(t -> t.to() == SessionState.CLOSED).count());
    }

    @Test
    public void testConnectFailureIsTransportError() {
        FakeTransport failing = new FakeTransport("test-2")
            .openWith(CompletableFuture.failedFuture(new java.io.IOException("refused")));
        ChartSession other = new ChartSession("test-2", failing, new TvMessageParser(MAPPER), new TvCommands(MAPPER),
            new SessionTimeouts(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1),
                Duration.ofSeconds(1), Duration.ofSeconds(1)),
            SessionObserver.NOOP, scheduler);

        assertFailsWith(TransportException.class, other.connect(JWT));
        assertEquals(SessionState.CLOSED, other.state());
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private void connect() throws Exception {
        session.connect(JWT).get(1, TimeUnit.SECONDS);
    }

    private String cs() {
        return session.chartSessionId();
    }

    private void resolved(String symbolSession) {
        transport.deliver(json("{\"m\":\"symbol_resolved\",\"p\":[\"%s\",\"%s\","
            + "{\"name\":\"TCS\",\"exchange\":\"NSE\",\"pricescale\":100}]}", cs(), symbolSession));
    }

    private void bars(String turnaround, String... rows) {
        transport.deliver(json("{\"m\":\"du\",\"p\":[\"%s\",{\"sds_1\":{\"s\":[%s],\"t\":\"%s\"}}]}",
            cs(), String.join(",", rows), turnaround));
    }

    private static String bar(long time, double close) {
        return String.format("{\"i\":0,\"v\":[%d,%s,%s,%s,%s,1000]}", time, close, close + 1, close - 1, close);
    }

    private static String json(String template, Object... args) {
        return String.format(template, args);
    }

    private static <T extends Throwable> T assertFailsWith(Class<T> type, CompletableFuture<?> future) {
        java.util.concurrent.ExecutionException error = assertThrows(java.util.concurrent.ExecutionException.class,
            () -> future.get(3, TimeUnit.SECONDS));
        return assertInstanceOf(type, error.getCause());
    }

    private static RequestRejectedException assertRejected(CompletableFuture<?> future) {
        return assertFailsWith(RequestRejectedException.class, future);
    }
}
