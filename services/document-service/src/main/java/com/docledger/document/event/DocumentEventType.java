package com.docledger.document.event;

public enum DocumentEventType {
    CREATED,
    VERSION_COMMITTED,
    COMPLETED,
    ROLLED_BACK,
    ARCHIVED,
    RESTORED
}
