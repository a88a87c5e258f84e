package com.codebox.engine.service;

import com.codebox.engine.model.ExecutionRecord;
import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.model.Language;
import com.codebox.engine.model.SessionStats;
import com.codebox.engine.repository.ExecutionRecordRepository;
import com.codebox.engine.repository.SessionStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable record of tracked executions plus per-caller aggregates.
 *
 * {@link #record} inserts the ledger row and updates the caller's
 * {@link SessionStats} in one transaction: either both are visible or
 * neither is. Writers for the same caller are serialized twice over, by a
 * striped in-process lock (so the transaction never waits on a row lock held
 * by a sibling thread) and by SELECT ... FOR UPDATE on the stats row (for
 * other engine instances sharing the database).
 */
@Service
public class ExecutionLedger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    // Sources larger than this are stored as hash + length only.
    static final int INLINE_SOURCE_LIMIT = 4 * 1024;

    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT     = 100;

    private static final int LOCK_STRIPES = 64;

    private final ExecutionRecordRepository records;
    private final SessionStatsRepository    stats;
    private final TransactionTemplate       tx;
    private final ReentrantLock[]           stripes = new ReentrantLock[LOCK_STRIPES];

    public ExecutionLedger(ExecutionRecordRepository records,
                           SessionStatsRepository stats,
                           PlatformTransactionManager transactionManager) {
        this.records = records;
        this.stats   = stats;
        this.tx      = new TransactionTemplate(transactionManager);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Append one tracked attempt and fold it into the caller's stats.
     *
     * @throws org.springframework.dao.DataAccessException when the database
     *         rejects the write; nothing is stored in that case
     */
    public void record(ExecutionRequest request, ExecutionResult result) {
        String callerId = Objects.requireNonNull(request.callerId(), "tracked request without callerId");
        String inline = request.sourceBytes() <= INLINE_SOURCE_LIMIT ? request.sourceText() : null;
        ExecutionRecord row = new ExecutionRecord(request, result, inline, sha256(request.sourceText()));

        ReentrantLock lock = lockFor(callerId);
        lock.lock();
        try {
            tx.executeWithoutResult(status -> {
                records.save(row);
                SessionStats s = stats.findForUpdate(callerId)
                        .orElseGet(() -> new SessionStats(callerId));
                s.recordAttempt(result);
                stats.save(s);
            });
        } finally {
            lock.unlock();
        }
        log.debug("Recorded execution {} ({}) for caller {}", result.executionId(), result.status(), callerId);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** A caller's own ledger entry; other callers' entries are reported as missing. */
    @Transactional(readOnly = true)
    public Optional<ExecutionRecord> find(UUID executionId, String callerId) {
        return records.findById(executionId)
                .filter(r -> r.getCallerId().equals(callerId));
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID executionId) {
        return records.existsById(executionId);
    }

    /** Newest first. {@code limit} is clamped to 1..100, default 20. */
    @Transactional(readOnly = true)
    public List<ExecutionRecord> history(String callerId, Language language, Integer limit) {
        int size = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        PageRequest page = PageRequest.of(0, size);
        return language == null
                ? records.findByCallerIdOrderByCreatedAtDesc(callerId, page)
                : records.findByCallerIdAndLanguageOrderByCreatedAtDesc(callerId, language, page);
    }

    @Transactional(readOnly = true)
    public Optional<SessionStats> stats(String callerId) {
        return stats.findById(callerId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ReentrantLock lockFor(String callerId) {
        return stripes[Math.floorMod(callerId.hashCode(), LOCK_STRIPES)];
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
