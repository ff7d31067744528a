package org.example.driver_ledger.repository;

import org.example.driver_ledger.model.ExpenseEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Репозиторий записей о расходах. Запросы зеркальны IncomeRepository.
 */
@Repository
public interface ExpenseRepository extends JpaRepository<ExpenseEntry, Long> {

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM ExpenseEntry e WHERE e.user.userId = :userId")
    BigDecimal sumByUser(@Param("userId") Long userId);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM ExpenseEntry e " +
            "WHERE e.user.userId = :userId AND e.timestamp >= :since")
    BigDecimal sumByUserSince(@Param("userId") Long userId, @Param("since") LocalDateTime since);

    @Query("SELECT e FROM ExpenseEntry e " +
            "WHERE e.user.userId = :userId AND e.timestamp >= :start AND e.timestamp < :endExclusive " +
            "ORDER BY e.timestamp ASC, e.id ASC")
    List<ExpenseEntry> findInRange(@Param("userId") Long userId,
                                   @Param("start") LocalDateTime start,
                                   @Param("endExclusive") LocalDateTime endExclusive);
}
