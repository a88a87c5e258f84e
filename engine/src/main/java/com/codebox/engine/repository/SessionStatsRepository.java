package com.codebox.engine.repository;

import com.codebox.engine.model.SessionStats;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SessionStatsRepository extends JpaRepository<SessionStats, String> {

    /**
     * Read a caller's stats row with SELECT ... FOR UPDATE.
     *
     * Must run inside the ledger transaction: the row lock is held until the
     * ledger insert and the stats update commit together, so a second engine
     * instance writing for the same caller waits instead of reading a stale
     * counter.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SessionStats s WHERE s.callerId = :callerId")
    Optional<SessionStats> findForUpdate(@Param("callerId") String callerId);
}
