package com.docledger.document.domain;

import java.util.Optional;

/**
 * Outcome of comparing a draft's baseline with the document's current version.
 */
public final class ConflictCheck {

    private static final ConflictCheck CLEAN = new ConflictCheck(null);

    private final Conflict conflict;

    private ConflictCheck(Conflict conflict) {
        this.conflict = conflict;
    }

    public static ConflictCheck clean() {
        return CLEAN;
    }

    public static ConflictCheck conflict(Conflict conflict) {
        return new ConflictCheck(conflict);
    }

    public boolean isClean() {
        return conflict == null;
    }

    public Optional<Conflict> getConflict() {
        return Optional.ofNullable(conflict);
    }

    @Override
    public String toString() {
        return isClean() ? "Clean" : "Conflict" + conflict;
    }
}
