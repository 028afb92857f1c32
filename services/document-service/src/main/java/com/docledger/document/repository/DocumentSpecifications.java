package com.docledger.document.repository;

import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Criteria for document listing. Every listing starts from {@link #ownedBy(String)}.
 */
public final class DocumentSpecifications {

    private DocumentSpecifications() {
    }

    public static Specification<Document> ownedBy(String tenantId) {
        return (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
    }

    public static Specification<Document> hasStatus(DocumentStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    /**
     * Case-insensitive match on title or document number.
     */
    public static Specification<Document> matches(String searchTerm) {
        String pattern = "%" + escapeLike(searchTerm.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
            cb.like(cb.lower(root.get("title")), pattern, '\\'),
            cb.like(cb.lower(root.get("documentNumber")), pattern, '\\'));
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
