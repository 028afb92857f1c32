package com.docledger.common.error;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when validation fails, with field-level messages.
 */
@Getter
public class ValidationException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> fieldErrors;

    /**
     * Constructor with single error message
     */
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
        this.fieldErrors = Collections.emptyMap();
    }

    /**
     * Constructor with field and single error
     */
    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_FAILED,
            String.format("Validation failed for field '%s': %s", field, message));
        this.fieldErrors = Map.of(field, List.of(message));
    }

    /**
     * Constructor with message and field errors
     */
    public ValidationException(String message, Map<String, List<String>> fieldErrors) {
        this(ErrorCode.VALIDATION_FAILED, message, fieldErrors);
    }

    protected ValidationException(ErrorCode errorCode, String message, Map<String, List<String>> fieldErrors) {
        super(errorCode, message);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (fieldErrors != null) {
            fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        }
        this.fieldErrors = Collections.unmodifiableMap(copy);
        withMetadata("fields", new ArrayList<>(copy.keySet()));
    }

    public boolean hasFieldError(String field) {
        return fieldErrors.containsKey(field);
    }
}
