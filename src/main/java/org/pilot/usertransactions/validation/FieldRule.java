package org.pilot.usertransactions.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered checks bound to one request value.
 *
 * <p>Every check always runs. An absent field adds the required message and is
 * then checked as an empty string, so it also fails each format check. A field
 * sent as JSON {@code null} counts as present and only fails the format checks.</p>
 */
public final class FieldRule {

    public static final String BODY = "body";
    public static final String QUERY = "query";
    public static final String PARAMS = "params";

    private final String param;
    private final String location;
    private final String value;
    private final boolean present;
    private String requiredMessage;
    private final List<Check> checks = new ArrayList<>();

    private FieldRule(String param, String location, String value, boolean present) {
        this.param = param;
        this.location = location;
        this.value = value;
        this.present = present;
    }

    public static FieldRule body(String param, String value, boolean present) {
        return new FieldRule(param, BODY, value, present);
    }

    public static FieldRule query(String param, String value) {
        return new FieldRule(param, QUERY, value, value != null);
    }

    public static FieldRule path(String param, String value) {
        return new FieldRule(param, PARAMS, value, value != null);
    }

    public FieldRule required(String message) {
        this.requiredMessage = message;
        return this;
    }

    public FieldRule check(Predicate<String> predicate, String message) {
        checks.add(new Check(predicate, message));
        return this;
    }

    public List<ValidationError> evaluate() {
        List<ValidationError> errors = new ArrayList<>();
        if (!present && requiredMessage != null) {
            errors.add(new ValidationError(null, requiredMessage, param, location));
        }
        String checked = value == null ? "" : value;
        for (Check c : checks) {
            if (!c.predicate.test(checked)) {
                errors.add(new ValidationError(value, c.message, param, location));
            }
        }
        return errors;
    }

    private static final class Check {
        private final Predicate<String> predicate;
        private final String message;

        private Check(Predicate<String> predicate, String message) {
            this.predicate = predicate;
            this.message = message;
        }
    }
}
