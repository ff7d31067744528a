package org.example.driver_ledger.repository;

import org.example.driver_ledger.model.LeaderboardEntry;
import org.example.driver_ledger.model.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Репозиторий для работы с таблицей users.
 *
 * <h2>Готовые методы из JpaRepository:</h2>
 * <ul>
 *   <li>{@code save(User user)} - вставка или полная перезапись по user_id (upsert)</li>
 *   <li>{@code findById(Long userId)} - найти водителя по Telegram ID</li>
 *   <li>{@code existsById(Long userId)} - зарегистрирован ли водитель</li>
 * </ul>
 *
 * @see org.example.driver_ledger.model.User
 * @see org.example.driver_ledger.service.LedgerService
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Занят ли псевдоним (без учёта регистра).
     *
     * Ищем по nickname_key - псевдониму в нижнем регистре, на нём же UNIQUE в БД.
     *
     * @param nicknameKey - результат {@code User.nicknameKey(nickname)}
     * @return true если такой псевдоним уже есть у кого-то
     */
    boolean existsByNicknameKey(String nicknameKey);

    /**
     * Рейтинг водителей по сальдо (доходы - расходы), лучшие сверху.
     *
     * Суммы считаем подзапросами по каждой таблице отдельно: JOIN incomes × expenses
     * умножил бы строки. При равном сальдо - кто раньше зарегистрировался, потом user_id.
     * Водитель без записей - сальдо 0. Сколько строк вернуть - задаёт pageable.
     */
    @Query("SELECT new org.example.driver_ledger.model.LeaderboardEntry(u.nickname, u.name, " +
            "(SELECT COALESCE(SUM(i.amount), 0) FROM IncomeEntry i WHERE i.user.userId = u.userId) - " +
            "(SELECT COALESCE(SUM(e.amount), 0) FROM ExpenseEntry e WHERE e.user.userId = u.userId)) " +
            "FROM User u " +
            "ORDER BY " +
            "(SELECT COALESCE(SUM(i2.amount), 0) FROM IncomeEntry i2 WHERE i2.user.userId = u.userId) - " +
            "(SELECT COALESCE(SUM(e2.amount), 0) FROM ExpenseEntry e2 WHERE e2.user.userId = u.userId) DESC, " +
            "u.registeredAt ASC, u.userId ASC")
    List<LeaderboardEntry> findLeaderboard(Pageable pageable);
}
