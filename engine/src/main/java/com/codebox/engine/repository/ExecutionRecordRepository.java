package com.codebox.engine.repository;

import com.codebox.engine.model.ExecutionRecord;
import com.codebox.engine.model.Language;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Ledger storage. Rows are only ever inserted; there are no update queries.
 */
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID> {

    /** Newest-first history for one caller. */
    List<ExecutionRecord> findByCallerIdOrderByCreatedAtDesc(String callerId, Pageable page);

    /** Newest-first history for one caller, restricted to a single language. */
    List<ExecutionRecord> findByCallerIdAndLanguageOrderByCreatedAtDesc(
            String callerId, Language language, Pageable page);

    long countByCallerId(String callerId);
}
