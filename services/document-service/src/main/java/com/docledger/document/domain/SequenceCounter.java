package com.docledger.document.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Next number to hand out for a (tenant, document type). Only ever changed through the
 * atomic increment in {@code SequenceCounterRepository}.
 */
@Entity
@Table(name = "sequence_counters")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceCounter {

    @EmbeddedId
    private SequenceCounterId id;

    @Column(name = "next_number", nullable = false)
    private Long nextNumber;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
