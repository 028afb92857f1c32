package com.docledger.document.domain.payload;

import jakarta.validation.groups.Default;

/**
 * Validation group for constraints that only apply once a document is being completed.
 * Extends {@link Default} so completion also re-checks well-formedness.
 */
public interface CompletionChecks extends Default {
}
