package in.chartbridge.service.validation;

/**
 * Invalid chart or indicator parameters. A caller error: never retried.
 */
public class ConstraintViolationException extends RuntimeException {

    private final String field;

    public ConstraintViolationException(String message) {
        this(null, message);
    }

    public ConstraintViolationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return the offending request field, or null when the rule spans several fields
     */
    public String getField() {
        return field;
    }
}
