package in.chartbridge.infrastructure.tradingview.indicator;

import in.chartbridge.domain.model.StudyScript;

/**
 * Supplies the compiled CVD script a chart session needs to create the indicator study.
 */
@FunctionalInterface
public interface IndicatorConfigProvider {

    /**
     * @throws IndicatorConfigException when the script cannot be obtained
     */
    StudyScript getScript();
}
