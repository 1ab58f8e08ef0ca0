package in.chartbridge.infrastructure.tradingview.indicator;

import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers the CVD script by loading the TradingView chart page with a browser session cookie.
 *
 * The page embeds every standard study as an encrypted blob. The longest blob whose
 * surroundings mention Cumulative Volume Delta is taken, together with the version from
 * its {@code Script$STD;...@tv-scripting-101[v.X.Y]} key.
 *
 * Results are cached in memory for 24 hours. Concurrent callers share one page fetch.
 */
public class ChartPageIndicatorConfigProvider implements IndicatorConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(ChartPageIndicatorConfigProvider.class);

    public static final String CHART_PAGE_URL = "https://www.tradingview.com/chart/";
    public static final String CVD_PINE_ID = "STD;Cumulative%1Volume%1Delta";
    public static final Duration CACHE_TTL = Duration.ofHours(24);

    private static final int FETCH_ATTEMPTS = 2;
    private static final int CONTEXT_WINDOW = 10_000;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);
    private static final String USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    private static final Pattern ENCRYPTED_SCRIPT = Pattern.compile("bmI9Ks46_[A-Za-z0-9+/=_]{1000,}");
    private static final Pattern CVD_VERSION = Pattern.compile(
        "\"Script\\$STD;Cumulative%1Volume%1Delta@tv-scripting-101\\[v\\.(\\d+\\.\\d+)\\]\"");

    private final HttpClient httpClient;
    private final String sessionId;
    private final String sessionIdSign;
    private final Duration retryDelay;
    private final Clock clock;

    private StudyScript cached;
    private Instant cachedAt;
    private CompletableFuture<StudyScript> inFlight;

    public ChartPageIndicatorConfigProvider(HttpClient httpClient, String sessionId, String sessionIdSign) {
        this(httpClient, sessionId, sessionIdSign, Duration.ofSeconds(1), Clock.systemUTC());
    }

    public ChartPageIndicatorConfigProvider(HttpClient httpClient,
                                            String sessionId,
                                            String sessionIdSign,
                                            Duration retryDelay,
                                            Clock clock) {
        this.httpClient = httpClient;
        this.sessionId = sessionId;
        this.sessionIdSign = sessionIdSign;
        this.retryDelay = retryDelay;
        this.clock = clock;
    }

    @Override
    public StudyScript getScript() {
        CompletableFuture<StudyScript> fetch;
        boolean owner = false;
        synchronized (this) {
            if (cached != null && clock.instant().isBefore(cachedAt.plus(CACHE_TTL))) {
                return cached;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            fetch = inFlight;
        }

        if (owner) {
            try {
                StudyScript script = fetchWithRetry();
                synchronized (this) {
                    cached = script;
                    cachedAt = clock.instant();
                    inFlight = null;
                }
                fetch.complete(script);
            } catch (RuntimeException e) {
                synchronized (this) {
                    inFlight = null;
                }
                fetch.completeExceptionally(e);
            }
        }
        return Futures.await(fetch);
    }

    /**
     * Drop the cached script so the next call reloads the chart page.
     */
    public synchronized void invalidate() {
        cached = null;
        cachedAt = null;
    }

    private StudyScript fetchWithRetry() {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new IndicatorConfigException("No TradingView session cookie configured (TV_SESSION_ID)");
        }

        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= FETCH_ATTEMPTS; attempt++) {
            try {
                long start = System.currentTimeMillis();
                String html = loadChartPage();
                StudyScript script = parse(html).orElseThrow(() ->
                    new IndicatorConfigException("CVD script not found in chart page"));
                log.info("[CVD CONFIG] Script v{} discovered in {} ms ({} chars)",
                    script.pineVersion(), System.currentTimeMillis() - start, script.text().length());
                return script;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("[CVD CONFIG] Attempt {}/{} failed: {}", attempt, FETCH_ATTEMPTS, e.getMessage());
                if (attempt < FETCH_ATTEMPTS && !pause()) {
                    break;
                }
            }
        }
        throw new IndicatorConfigException(
            "Failed to fetch CVD config after " + FETCH_ATTEMPTS + " attempts: " + lastError.getMessage(), lastError);
    }

    /**
     * GET the chart page as the logged-in browser user.
     */
    protected String loadChartPage() {
        String cookies = sessionIdSign == null || sessionIdSign.isEmpty()
            ? "sessionid=" + sessionId
            : "sessionid=" + sessionId + "; sessionid_sign=" + sessionIdSign;

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(CHART_PAGE_URL))
            .timeout(REQUEST_TIMEOUT)
            .header("Cookie", cookies)
            .header("User-Agent", USER_AGENT)
            .header("Accept", "text/html,application/xhtml+xml")
            .GET()
            .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IndicatorConfigException("Chart page returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new IndicatorConfigException("Chart page request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndicatorConfigException("Interrupted while loading chart page", e);
        }
    }

    /**
     * Extract the CVD script from chart page HTML.
     *
     * @return the script, or empty when no CVD blob with a version key is present
     */
    static Optional<StudyScript> parse(String html) {
        List<String> candidates = new ArrayList<>();
        Matcher matcher = ENCRYPTED_SCRIPT.matcher(html);
        while (matcher.find()) {
            candidates.add(matcher.group());
        }
        candidates.sort(Comparator.comparingInt(String::length).reversed());

        for (String text : candidates) {
            int index = html.indexOf(text);
            String context = html.substring(
                Math.max(0, index - CONTEXT_WINDOW),
                Math.min(html.length(), index + text.length() + CONTEXT_WINDOW));
            if (!context.contains("Cumulative%1Volume%1Delta") && !context.contains("Cumulative Volume Delta")) {
                continue;
            }
            Matcher version = CVD_VERSION.matcher(context);
            if (version.find()) {
                return Optional.of(new StudyScript(text, CVD_PINE_ID, version.group(1)));
            }
        }
        return Optional.empty();
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
