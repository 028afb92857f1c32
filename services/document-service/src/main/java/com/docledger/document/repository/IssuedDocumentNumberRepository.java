package com.docledger.document.repository;

import com.docledger.document.domain.IssuedDocumentNumber;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface IssuedDocumentNumberRepository extends JpaRepository<IssuedDocumentNumber, UUID> {

    long countByTenantId(String tenantId);
}
