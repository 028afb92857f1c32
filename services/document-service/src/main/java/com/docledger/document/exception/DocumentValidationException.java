package com.docledger.document.exception;

import com.docledger.common.error.ErrorCode;
import com.docledger.common.error.ValidationException;

import java.util.List;
import java.util.Map;

/**
 * Payload failed well-formedness or completion checks. Keys are dotted payload paths
 * ({@code contactInfo.email}) or section names for missing sections.
 */
public class DocumentValidationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public DocumentValidationException(String message, Map<String, List<String>> fieldErrors) {
        super(ErrorCode.VALIDATION_FAILED, message, fieldErrors);
    }
}
