package com.di.qualitygate.rules;

/**
 * Thrown by a rule set when a staging value cannot be interpreted under its
 * declared type and no rule maps it (e.g. {@code prd_cost = "12,5x"}).
 *
 * <p>Handled by the quality gate according to the configured
 * {@link com.di.qualitygate.gate.UnparsableValuePolicy}.
 */
public class UnparsableValueException extends RuntimeException {

    private final String field;
    private final String value;

    public UnparsableValueException(String field, String value, String expectedType) {
        this(field, value, expectedType, null);
    }

    public UnparsableValueException(String field, String value, String expectedType, Throwable cause) {
        super(String.format("Cannot read %s value '%s' as %s", field, value, expectedType), cause);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
