package com.docledger.document.converter;

import com.docledger.document.domain.DocumentStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link DocumentStatus} as its lower-case value, matching the table's check constraint
 */
@Converter
public class DocumentStatusConverter implements AttributeConverter<DocumentStatus, String> {

    @Override
    public String convertToDatabaseColumn(DocumentStatus status) {
        return status != null ? status.getValue() : null;
    }

    @Override
    public DocumentStatus convertToEntityAttribute(String dbData) {
        return dbData != null ? DocumentStatus.fromValue(dbData) : null;
    }
}
