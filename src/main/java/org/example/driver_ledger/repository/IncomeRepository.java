package org.example.driver_ledger.repository;

import org.example.driver_ledger.model.IncomeEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Репозиторий записей о заработке.
 */
@Repository
public interface IncomeRepository extends JpaRepository<IncomeEntry, Long> {

    /**
     * Сумма всех доходов водителя (0 если записей нет).
     */
    @Query("SELECT COALESCE(SUM(i.amount), 0) FROM IncomeEntry i WHERE i.user.userId = :userId")
    BigDecimal sumByUser(@Param("userId") Long userId);

    /**
     * Сумма доходов водителя начиная с момента since (включительно).
     */
    @Query("SELECT COALESCE(SUM(i.amount), 0) FROM IncomeEntry i " +
            "WHERE i.user.userId = :userId AND i.timestamp >= :since")
    BigDecimal sumByUserSince(@Param("userId") Long userId, @Param("since") LocalDateTime since);

    /**
     * Доходы за период [start, endExclusive), по времени создания.
     * При одинаковом времени порядок по id (он монотонный).
     */
    @Query("SELECT i FROM IncomeEntry i " +
            "WHERE i.user.userId = :userId AND i.timestamp >= :start AND i.timestamp < :endExclusive " +
            "ORDER BY i.timestamp ASC, i.id ASC")
    List<IncomeEntry> findInRange(@Param("userId") Long userId,
                                  @Param("start") LocalDateTime start,
                                  @Param("endExclusive") LocalDateTime endExclusive);
}
