package com.docledger.document.service;

import com.docledger.document.domain.Conflict;
import com.docledger.document.domain.ConflictCheck;
import com.docledger.document.domain.payload.DocumentPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Decides whether a draft may be promoted. Both versions must have been read in the same
 * transaction as the promotion attempt. The detector never resolves a conflict itself.
 */
@Component
@RequiredArgsConstructor
public class ConflictDetector {

    private final PayloadDiffer payloadDiffer;

    /**
     * @param baselineVersion  the version the draft was based on
     * @param currentVersion   the document's version under lock
     * @param baselineSnapshot ledger snapshot at {@code baselineVersion}; only read when the versions differ
     * @param currentSnapshot  the document's current payload
     */
    public ConflictCheck check(int baselineVersion, int currentVersion,
                               Supplier<DocumentPayload> baselineSnapshot, DocumentPayload currentSnapshot) {
        if (baselineVersion == currentVersion) {
            return ConflictCheck.clean();
        }
        return ConflictCheck.conflict(new Conflict(baselineVersion, currentVersion,
            payloadDiffer.diff(baselineSnapshot.get(), currentSnapshot)));
    }
}
