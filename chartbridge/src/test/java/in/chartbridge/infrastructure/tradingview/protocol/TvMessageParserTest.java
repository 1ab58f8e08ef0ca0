package in.chartbridge.infrastructure.tradingview.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.domain.model.IndicatorSettings;
import in.chartbridge.domain.model.OhlcvBar;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.tradingview.codec.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TvMessageParser and TvCommands.
 */
class TvMessageParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TvMessageParser parser = new TvMessageParser(MAPPER);
    private final TvCommands commands = new TvCommands(MAPPER);

    @Test
    void testHandshake() {
        TvMessage message = parser.parse("{\"session_id\":\"<0.1>_x\",\"timestamp\":1,\"release\":\"r\"}");

        assertEquals(TvMessage.Type.HANDSHAKE, message.type());
        assertEquals("<0.1>_x", ((TvMessage.Handshake) message).sessionId());
    }

    @Test
    void testSymbolResolved() {
        TvMessage.SymbolResolved message = (TvMessage.SymbolResolved) parser.parse(
            "{\"m\":\"symbol_resolved\",\"p\":[\"cs_1\",\"sds_sym_1\",{\"name\":\"TCS\",\"pricescale\":100}]}");

        assertEquals("cs_1", message.chartSessionId());
        assertEquals("sds_sym_1", message.symbolSessionId());
        assertEquals(100, message.metadata().path("pricescale").asInt());
    }

    @Test
    void testSeriesDataBarsAndTurnaround() {
        TvMessage.SeriesData message = (TvMessage.SeriesData) parser.parse(
            "{\"m\":\"timescale_update\",\"p\":[\"cs_1\",{\"sds_1\":{\"s\":["
                + "{\"i\":0,\"v\":[1700000000,10.5,11,10,10.75,12345]},"
                + "{\"i\":1,\"v\":[1700086400,10.75,12,10.5,11.5]},"
                + "{\"i\":2,\"v\":[1]}"
                + "],\"t\":\"s3\"}}]}");

        assertTrue(message.contains("sds_1"));
        assertFalse(message.contains("st1"));
        assertEquals("s3", message.turnaround("sds_1"));

        List<OhlcvBar> bars = message.bars("sds_1");
        assertEquals(2, bars.size(), "short rows are skipped");
        assertEquals(new OhlcvBar(1700000000L, 10.5, 11, 10, 10.75, 12345), bars.get(0));
        assertEquals(0.0, bars.get(1).volume(), "missing volume defaults to zero");
    }

    @Test
    void testStudyPoints() {
        TvMessage.SeriesData message = (TvMessage.SeriesData) parser.parse(
            "{\"m\":\"du\",\"p\":[\"cs_1\",{\"st4\":{\"st\":[{\"i\":0,\"v\":[100,1,2,-1,1.5]}]}}]}");

        assertEquals(1, message.studyPoints("st4").size());
        assertEquals(List.of(1.0, 2.0, -1.0, 1.5), message.studyPoints("st4").get(0).values());
        assertNull(message.turnaround("st4"));
    }

    @Test
    void testErrorClassification() {
        TvMessage.ErrorMessage invalid = (TvMessage.ErrorMessage) parser.parse(
            "{\"m\":\"protocol_error\",\"p\":[\"cs_1\",\"Invalid resolution: 7X\"]}");
        assertTrue(invalid.recoverable());
        assertEquals("cs_1", invalid.chartSessionId());
        assertEquals("Invalid resolution: 7X", invalid.text());

        TvMessage.ErrorMessage fatal = (TvMessage.ErrorMessage) parser.parse(
            "{\"m\":\"critical_error\",\"p\":[\"wrong data\"]}");
        assertFalse(fatal.recoverable());
        assertNull(fatal.chartSessionId());
        assertEquals("wrong data", fatal.text());

        TvMessage.ErrorMessage series = (TvMessage.ErrorMessage) parser.parse(
            "{\"m\":\"series_error\",\"p\":[\"cs_1\",\"sds_1\",\"s1\",\"resolution not allowed\"]}");
        assertTrue(series.recoverable());
        assertEquals("resolution not allowed", series.text());
    }

    @Test
    void testRecoverablePatternsAreCaseInsensitive() {
        assertTrue(TvMessageParser.isRecoverable("Exceed limit of series (max 10)"));
        assertTrue(TvMessageParser.isRecoverable("SYMBOL NOT FOUND"));
        assertFalse(TvMessageParser.isRecoverable("auth token expired"));
        assertFalse(TvMessageParser.isRecoverable(null));
    }

    @Test
    void testUnknownMessagesAreKept() {
        TvMessage message = parser.parse("{\"m\":\"quote_completed\",\"p\":[\"qs_1\",\"NSE:TCS\"]}");

        assertEquals(TvMessage.Type.UNKNOWN, message.type());
        assertEquals("quote_completed", ((TvMessage.Unknown) message).method());
        assertEquals(TvMessage.Type.UNKNOWN, parser.parse("[1,2,3]").type());
    }

    @Test
    void testMalformedJsonThrows() {
        assertThrows(ProtocolException.class, () -> parser.parse("{\"m\":"));
    }

    @Test
    void testCreateSeriesCommandShape() throws Exception {
        JsonNode node = MAPPER.readTree(commands.createSeries("cs_1", "sds_1", "s1", "sds_sym_1", "15", 300));

        assertEquals("create_series", node.get("m").asText());
        assertEquals("[\"cs_1\",\"sds_1\",\"s1\",\"sds_sym_1\",\"15\",300,\"\"]", node.get("p").toString());
    }

    @Test
    void testResolveSymbolDescriptorIsPrefixed() throws Exception {
        JsonNode node = MAPPER.readTree(commands.resolveSymbol("cs_1", "sds_sym_1", "NSE:TCS"));
        String descriptor = node.get("p").get(2).asText();

        assertTrue(descriptor.startsWith("="));
        assertEquals("NSE:TCS", MAPPER.readTree(descriptor.substring(1)).get("symbol").asText());
    }

    @Test
    void testCvdStudyWithoutDeltaDisablesCustomTimeframe() throws Exception {
        StudyScript script = new StudyScript("bmI9Ks46_x", "STD;Cumulative%1Volume%1Delta", "7.0");
        JsonNode node = MAPPER.readTree(commands.createCvdStudy("cs_1", "st1", "s1", "sds_1",
            script, IndicatorSettings.defaults()));
        JsonNode config = node.get("p").get(5);

        assertEquals("3M", config.path("in_0").path("v").asText());
        assertFalse(config.path("in_1").path("v").asBoolean());
        assertEquals("", config.path("in_2").path("v").asText());
        assertEquals("7.0", config.path("pineVersion").asText());
    }

    @Test
    void testChartSessionIds() {
        String id = SessionIds.chartSession();

        assertTrue(id.matches("cs_[A-Za-z0-9]{12}"), id);
        assertNotEquals(id, SessionIds.chartSession());
    }
}
