package in.chartbridge.infrastructure.tradingview.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.infrastructure.tradingview.codec.ProtocolException;

import java.util.List;
import java.util.Locale;

/**
 * Maps frame payloads to {@link TvMessage} variants.
 *
 * Payload shapes:
 * <pre>
 * {"session_id":"...","timestamp":...}                    handshake
 * {"m":"symbol_resolved","p":[cs, symSession, metadata]}
 * {"m":"symbol_error","p":[cs, symSession, reason]}
 * {"m":"du","p":[cs, {"sds_1":{"s":[...]}, "st1":{"st":[...]}}]}
 * {"m":"protocol_error","p":["reason"]}
 * </pre>
 */
public class TvMessageParser {

    /** Error texts that fail one request but leave the connection usable. */
    static final List<String> RECOVERABLE_PATTERNS = List.of(
        "exceed limit of series",
        "symbol not found",
        "invalid resolution",
        "invalid timeframe",
        "invalid period",
        "symbol error",
        "study error",
        "series error"
    );

    private final ObjectMapper mapper;

    public TvMessageParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ProtocolException if the payload is not valid JSON
     */
    public TvMessage parse(String payload) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed message payload: " + abbreviate(payload), e);
        }
        if (root == null || !root.isObject()) {
            return new TvMessage.Unknown(null, payload);
        }

        if (!root.has("m")) {
            if (root.has("session_id")) {
                return new TvMessage.Handshake(root.get("session_id").asText());
            }
            return new TvMessage.Unknown(null, payload);
        }

        String method = root.get("m").asText();
        JsonNode p = root.path("p");

        return switch (method) {
            case "symbol_resolved" -> new TvMessage.SymbolResolved(
                text(p, 0), text(p, 1), p.path(2));
            case "symbol_error" -> new TvMessage.SymbolError(
                text(p, 0), text(p, 1), text(p, 2));
            case "du", "timescale_update" -> new TvMessage.SeriesData(
                text(p, 0), p.path(1));
            case "series_completed" -> new TvMessage.SeriesCompleted(
                text(p, 0), text(p, 1));
            case "study_loading" -> new TvMessage.StudyLoading(
                text(p, 0), text(p, 1));
            case "protocol_error", "critical_error" -> {
                // p[0] is the chart session or the reason itself, p[1] the reason when present
                String reason = p.size() > 1 && p.get(1).isTextual() ? text(p, 1) : text(p, 0);
                String chartSession = p.size() > 1 ? text(p, 0) : null;
                yield new TvMessage.ErrorMessage(method, chartSession, reason, isRecoverable(reason));
            }
            case "series_error", "study_error" -> new TvMessage.ErrorMessage(
                method, text(p, 0), lastText(p, method.replace('_', ' ')), true);
            default -> new TvMessage.Unknown(method, payload);
        };
    }

    public static boolean isRecoverable(String errorText) {
        if (errorText == null) {
            return false;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        for (String pattern : RECOVERABLE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static String text(JsonNode array, int index) {
        JsonNode node = array.path(index);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String lastText(JsonNode array, String fallback) {
        for (int i = array.size() - 1; i > 0; i--) {
            if (array.get(i).isTextual()) {
                return array.get(i).asText();
            }
        }
        return fallback;
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 80 ? payload : payload.substring(0, 80) + "...";
    }
}
