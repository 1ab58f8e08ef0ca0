package in.chartbridge.domain.model;

/**
 * Compiled Pine script descriptor needed to create an indicator study.
 *
 * @param text        encrypted script body
 * @param pineId      study id, e.g. {@code STD;Cumulative%1Volume%1Delta}
 * @param pineVersion script version, e.g. {@code 7.0}
 */
public record StudyScript(String text, String pineId, String pineVersion) {
}
