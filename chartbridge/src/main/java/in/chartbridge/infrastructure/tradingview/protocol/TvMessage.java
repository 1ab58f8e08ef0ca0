package in.chartbridge.infrastructure.tradingview.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import in.chartbridge.domain.model.IndicatorPoint;
import in.chartbridge.domain.model.OhlcvBar;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded inbound protocol message.
 *
 * A closed set of variants discriminated by {@link #type()}; anything the parser
 * does not recognise becomes {@link Unknown} instead of being dropped.
 */
public interface TvMessage {

    enum Type {
        HANDSHAKE,
        SYMBOL_RESOLVED,
        SYMBOL_ERROR,
        SERIES_DATA,
        SERIES_COMPLETED,
        STUDY_LOADING,
        ERROR,
        UNKNOWN
    }

    Type type();

    /**
     * First message after connect, carries the server session id.
     */
    record Handshake(String sessionId) implements TvMessage {
        @Override
        public Type type() {
            return Type.HANDSHAKE;
        }
    }

    record SymbolResolved(String chartSessionId, String symbolSessionId, JsonNode metadata) implements TvMessage {
        @Override
        public Type type() {
            return Type.SYMBOL_RESOLVED;
        }
    }

    record SymbolError(String chartSessionId, String symbolSessionId, String reason) implements TvMessage {
        @Override
        public Type type() {
            return Type.SYMBOL_ERROR;
        }
    }

    /**
     * {@code du} or {@code timescale_update}: an object keyed by series id and study id.
     */
    record SeriesData(String chartSessionId, JsonNode data) implements TvMessage {
        @Override
        public Type type() {
            return Type.SERIES_DATA;
        }

        public boolean contains(String key) {
            return data != null && data.has(key);
        }

        /**
         * Bars for a series key. Rows are {@code {i, v:[time, open, high, low, close, volume]}};
         * volume is absent for some instruments and defaults to 0.
         */
        public List<OhlcvBar> bars(String seriesId) {
            List<OhlcvBar> bars = new ArrayList<>();
            JsonNode rows = data.path(seriesId).path("s");
            for (JsonNode row : rows) {
                JsonNode v = row.path("v");
                if (v.size() < 5) {
                    continue;
                }
                bars.add(new OhlcvBar(
                    v.get(0).asLong(),
                    v.get(1).asDouble(),
                    v.get(2).asDouble(),
                    v.get(3).asDouble(),
                    v.get(4).asDouble(),
                    v.size() > 5 ? v.get(5).asDouble() : 0.0));
            }
            return bars;
        }

        /**
         * Samples for a study key. Rows are {@code {i, v:[time, value...]}}.
         */
        public List<IndicatorPoint> studyPoints(String studyId) {
            List<IndicatorPoint> points = new ArrayList<>();
            JsonNode rows = data.path(studyId).path("st");
            for (JsonNode row : rows) {
                JsonNode v = row.path("v");
                if (v.size() < 1) {
                    continue;
                }
                List<Double> values = new ArrayList<>();
                for (int i = 1; i < v.size(); i++) {
                    values.add(v.get(i).asDouble());
                }
                points.add(new IndicatorPoint(v.get(0).asLong(), values));
            }
            return points;
        }

        /**
         * Turnaround tag ({@code t}) the server attaches to series payloads, or null.
         * Tells apart bars for the current {@code modify_series} from late updates of the previous symbol.
         */
        public String turnaround(String seriesId) {
            String t = data.path(seriesId).path("t").asText("");
            return t.isEmpty() ? null : t;
        }
    }

    record SeriesCompleted(String chartSessionId, String seriesId) implements TvMessage {
        @Override
        public Type type() {
            return Type.SERIES_COMPLETED;
        }
    }

    record StudyLoading(String chartSessionId, String studyId) implements TvMessage {
        @Override
        public Type type() {
            return Type.STUDY_LOADING;
        }
    }

    /**
     * {@code protocol_error}, {@code critical_error}, {@code series_error} or {@code study_error}.
     *
     * @param recoverable true when only the in-flight request fails and the connection stays usable
     */
    record ErrorMessage(String method, String chartSessionId, String text, boolean recoverable) implements TvMessage {
        @Override
        public Type type() {
            return Type.ERROR;
        }
    }

    record Unknown(String method, String raw) implements TvMessage {
        @Override
        public Type type() {
            return Type.UNKNOWN;
        }
    }
}
