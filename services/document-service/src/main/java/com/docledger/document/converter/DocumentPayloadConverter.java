package com.docledger.document.converter;

import com.docledger.document.domain.payload.DocumentPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converter for storing document payloads, snapshots and draft deltas as JSON text
 */
@Converter
public class DocumentPayloadConverter implements AttributeConverter<DocumentPayload, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(DocumentPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : DocumentPayload.empty());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting document payload to JSON", e);
        }
    }

    @Override
    public DocumentPayload convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return DocumentPayload.empty();
        }
        try {
            return objectMapper.readValue(dbData, DocumentPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting JSON to document payload", e);
        }
    }
}
