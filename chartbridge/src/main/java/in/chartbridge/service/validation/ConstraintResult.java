package in.chartbridge.service.validation;

/**
 * Outcome of an indicator settings check.
 *
 * @param valid true when every rule passed
 * @param error the failed rule, naming the valid alternatives where there are any; null when valid
 */
public record ConstraintResult(boolean valid, String error) {

    private static final ConstraintResult OK = new ConstraintResult(true, null);

    public static ConstraintResult ok() {
        return OK;
    }

    public static ConstraintResult invalid(String error) {
        return new ConstraintResult(false, error);
    }
}
