package org.pilot.usertransactions.validation;

import java.util.ArrayList;
import java.util.List;

public final class RequestValidator {

    private RequestValidator() {
    }

    /**
     * Runs every rule and collects all failures before reporting.
     *
     * @throws RequestValidationException if any rule failed
     */
    public static void validate(List<FieldRule> rules) {
        List<ValidationError> errors = collect(rules);
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
    }

    public static List<ValidationError> collect(List<FieldRule> rules) {
        List<ValidationError> errors = new ArrayList<>();
        for (FieldRule rule : rules) {
            errors.addAll(rule.evaluate());
        }
        return errors;
    }
}
