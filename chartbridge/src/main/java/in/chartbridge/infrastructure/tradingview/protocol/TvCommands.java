package in.chartbridge.infrastructure.tradingview.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.chartbridge.domain.model.IndicatorSettings;
import in.chartbridge.domain.model.StudyScript;

/**
 * Builds outbound command payloads ({@code {"m":method,"p":[...]}}), unframed.
 */
public class TvCommands {

    /** Study name TradingView requires for Pine scripts created over the socket. */
    public static final String SCRIPT_STUDY_NAME = "Script@tv-scripting-101!";

    static final String PINE_FEATURES = "{\"indicator\":1,\"plot\":1,\"ta\":1}";

    private final ObjectMapper mapper;

    public TvCommands(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String setAuthToken(String jwt) {
        return command("set_auth_token", params().add(jwt));
    }

    public String setLocale() {
        return command("set_locale", params().add("en").add("US"));
    }

    public String chartCreateSession(String chartSessionId) {
        return command("chart_create_session", params().add(chartSessionId).add(""));
    }

    public String chartDeleteSession(String chartSessionId) {
        return command("chart_delete_session", params().add(chartSessionId));
    }

    public String resolveSymbol(String chartSessionId, String symbolSessionId, String symbol) {
        ObjectNode descriptor = mapper.createObjectNode()
            .put("symbol", symbol)
            .put("adjustment", "dividends");
        return command("resolve_symbol", params()
            .add(chartSessionId)
            .add(symbolSessionId)
            .add("=" + write(descriptor)));
    }

    public String createSeries(String chartSessionId, String seriesId, String turnaround,
                               String symbolSessionId, String resolution, int barsCount) {
        return command("create_series", params()
            .add(chartSessionId)
            .add(seriesId)
            .add(turnaround)
            .add(symbolSessionId)
            .add(resolution)
            .add(barsCount)
            .add(""));
    }

    public String modifySeries(String chartSessionId, String seriesId, String turnaround,
                               String symbolSessionId, String resolution) {
        return command("modify_series", params()
            .add(chartSessionId)
            .add(seriesId)
            .add(turnaround)
            .add(symbolSessionId)
            .add(resolution)
            .add(""));
    }

    public String removeSeries(String chartSessionId, String seriesId) {
        return command("remove_series", params().add(chartSessionId).add(seriesId));
    }

    /**
     * Cumulative Volume Delta study on top of an existing series. No bar count is sent;
     * the study follows the series.
     */
    public String createCvdStudy(String chartSessionId, String studyId, String turnaround,
                                 String seriesId, StudyScript script, IndicatorSettings settings) {
        ObjectNode config = mapper.createObjectNode();
        config.put("text", script.text());
        config.put("pineId", script.pineId());
        config.put("pineVersion", script.pineVersion());
        config.set("pineFeatures", input(PINE_FEATURES, "text"));
        config.set("in_0", input(settings.anchorPeriod(), "resolution"));
        config.set("in_1", input(settings.hasDeltaTimeframe(), "bool"));
        config.set("in_2", input(settings.hasDeltaTimeframe() ? settings.deltaTimeframe() : "", "resolution"));
        config.set("__profile", input(false, "bool"));

        return command("create_study", params()
            .add(chartSessionId)
            .add(studyId)
            .add(turnaround)
            .add(seriesId)
            .add(SCRIPT_STUDY_NAME)
            .add(config));
    }

    public String removeStudy(String chartSessionId, String studyId) {
        return command("remove_study", params().add(chartSessionId).add(studyId));
    }

    private ObjectNode input(String value, String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("v", value);
        node.put("f", true);
        node.put("t", type);
        return node;
    }

    private ObjectNode input(boolean value, String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put("v", value);
        node.put("f", true);
        node.put("t", type);
        return node;
    }

    private ArrayNode params() {
        return mapper.createArrayNode();
    }

    private String command(String method, ArrayNode params) {
        ObjectNode message = mapper.createObjectNode();
        message.put("m", method);
        message.set("p", params);
        return write(message);
    }

    private String write(Object node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize command", e);
        }
    }
}
