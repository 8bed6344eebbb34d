package com.shetka.error;

import java.util.List;

/**
 * Missing or blank required input fields. Rendered as 400.
 */
public class ValidationException extends ApiException {

    private final List<String> fields;

    public ValidationException(List<String> fields) {
        super(String.join(", ", fields) + " required");
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }
}
