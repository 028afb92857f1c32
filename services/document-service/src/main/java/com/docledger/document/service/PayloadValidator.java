package com.docledger.document.service;

import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.payload.CompletionChecks;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.domain.payload.PayloadSection;
import com.docledger.document.domain.payload.SectionType;
import com.docledger.document.exception.DocumentValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Bean Validation of payloads. Every payload must be well-formed; a payload about to be
 * completed must also carry the sections its document type requires, each passing the
 * {@link CompletionChecks} constraints.
 */
@Component
@RequiredArgsConstructor
public class PayloadValidator {

    private final Validator validator;

    public void validateWellFormed(DocumentPayload payload) {
        Map<String, List<String>> errors = new TreeMap<>();
        collect("", validator.validate(payload), errors);
        throwIfInvalid("Document payload is invalid", errors);
    }

    public void validateForCompletion(DocumentType type, DocumentPayload payload) {
        Map<String, List<String>> errors = new TreeMap<>();
        collect("", validator.validate(payload), errors);
        for (SectionType required : type.getRequiredForCompletion()) {
            PayloadSection section = payload.section(required);
            if (section == null) {
                errors.computeIfAbsent(required.getFieldName(), key -> new ArrayList<>())
                    .add("section is required for completion");
            } else {
                collect(required.getFieldName() + ".", validator.validate(section, CompletionChecks.class), errors);
            }
        }
        throwIfInvalid("Document is not ready for completion", errors);
    }

    /**
     * Validate {@code payload} for a document that will be in {@code targetStatus} once committed.
     */
    public void validateFor(DocumentStatus targetStatus, DocumentType type, DocumentPayload payload) {
        if (targetStatus == DocumentStatus.COMPLETED) {
            validateForCompletion(type, payload);
        } else {
            validateWellFormed(payload);
        }
    }

    private static <T> void collect(String prefix, Set<ConstraintViolation<T>> violations,
                                    Map<String, List<String>> errors) {
        for (ConstraintViolation<T> violation : violations) {
            String path = prefix + violation.getPropertyPath();
            List<String> messages = errors.computeIfAbsent(path, key -> new ArrayList<>());
            if (!messages.contains(violation.getMessage())) {
                messages.add(violation.getMessage());
            }
        }
    }

    private static void throwIfInvalid(String message, Map<String, List<String>> errors) {
        if (!errors.isEmpty()) {
            throw new DocumentValidationException(message, errors);
        }
    }
}
