package com.github.dimitryivaniuta.eventreg.common.error;

import lombok.Getter;

/**
 * Caller-supplied input is malformed. Carries the path of the offending field, which is
 * safe to disclose because the caller produced it.
 */
@Getter
public class ValidationException extends RegistrationException {

    /** Dotted/indexed path of the offending field, e.g. {@code query.queries[1].value}. */
    private final String field;

    /** Why the field was rejected. */
    private final Reason reason;

    public ValidationException(final String field, final Reason reason) {
        super(describe(field, reason));
        this.field = field;
        this.reason = reason;
    }

    public static ValidationException empty(final String field) {
        return new ValidationException(field, Reason.EMPTY_FIELD);
    }

    public static ValidationException invalidEnum(final String field) {
        return new ValidationException(field, Reason.INVALID_ENUM);
    }

    public static ValidationException invalidValue(final String field) {
        return new ValidationException(field, Reason.INVALID_VALUE);
    }

    public static ValidationException tooManyItems(final String field) {
        return new ValidationException(field, Reason.TOO_MANY_ITEMS);
    }

    /**
     * Prefixes the field path with an enclosing context, e.g. {@code queries[0]} becomes
     * {@code query.queries[0]} and {@code [2]} becomes {@code items[2]}.
     */
    public ValidationException withContext(final String context) {
        final String path;
        if (field == null || field.isEmpty() || field.startsWith("[")) {
            path = context + (field == null ? "" : field);
        } else {
            path = context + "." + field;
        }
        return new ValidationException(path, reason);
    }

    @Override
    public String code() {
        return "invalid_argument";
    }

    private static String describe(final String field, final Reason reason) {
        return field + " " + reason.getDescription();
    }

    /** Closed set of rejection reasons. */
    @Getter
    public enum Reason {
        EMPTY_FIELD("cannot be empty"),
        TOO_MANY_ITEMS("contains too many items"),
        INVALID_ENUM("contains invalid enum value"),
        INVALID_VALUE("contains an invalid value");

        private final String description;

        Reason(final String description) {
            this.description = description;
        }
    }
}
