package org.example.driver_ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.exception.DuplicateNicknameException;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.model.*;
import org.example.driver_ledger.repository.ExpenseRepository;
import org.example.driver_ledger.repository.IncomeRepository;
import org.example.driver_ledger.repository.UserRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Сервис учёта: водители, доходы, расходы и запросы по ним.
 *
 * Каждый публичный метод - одна транзакция (@Transactional на классе),
 * соединение берётся из пула и гарантированно возвращается.
 * Ошибки БД (DataAccessException) не ловим - их обрабатывает UpdateDispatcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class LedgerService {

    private final UserRepository userRepository;
    private final IncomeRepository incomeRepository;
    private final ExpenseRepository expenseRepository;
    private final Clock clock;

    /**
     * Зарегистрирован ли водитель.
     */
    @Transactional(readOnly = true)
    public boolean userExists(Long userId) {
        return userRepository.existsById(userId);
    }

    @Transactional(readOnly = true)
    public Optional<User> findUser(Long userId) {
        log.debug("Поиск водителя: telegramId={}", userId);
        return userRepository.findById(userId);
    }

    /**
     * Занят ли псевдоним (без учёта регистра).
     */
    @Transactional(readOnly = true)
    public boolean nicknameTaken(String nickname) {
        return userRepository.existsByNicknameKey(User.nicknameKey(nickname));
    }

    /**
     * Сохранить водителя после регистрации (upsert).
     *
     * Перезаписываются ВСЕ поля профиля, это не частичное обновление.
     * Язык и период отчётов для существующей записи не трогаем.
     *
     * @throws DuplicateNicknameException если псевдоним за время регистрации занял кто-то другой
     */
    public User saveUser(Long userId, String tgFirstName, RegistrationDraft draft) {
        log.info("Сохранение водителя: telegramId={}, nickname={}", userId, draft.nickname());

        Optional<User> existing = userRepository.findById(userId);
        boolean nicknameBelongsToSelf = existing
                .map(u -> User.nicknameKey(u.getNickname()).equals(User.nicknameKey(draft.nickname())))
                .orElse(false);
        if (!nicknameBelongsToSelf && nicknameTaken(draft.nickname())) {
            log.warn("Псевдоним уже занят: telegramId={}, nickname={}", userId, draft.nickname());
            throw new DuplicateNicknameException(draft.nickname());
        }

        User user = existing.orElseGet(() -> User.builder().userId(userId).build());
        user.setTgFirstName(tgFirstName);
        user.setName(draft.name());
        user.setNickname(draft.nickname());
        user.setCarModel(draft.carModel());
        user.setCarNumber(draft.carNumber());
        user.setRegisteredAt(LocalDateTime.now(clock));

        User saved = userRepository.save(user);
        log.info("Водитель зарегистрирован: telegramId={}", userId);
        return saved;
    }

    /**
     * Изменить имя (псевдоним остаётся прежним).
     */
    public User updateName(Long userId, String name) {
        User user = requireUser(userId);
        user.setName(name);
        log.info("Имя водителя изменено: telegramId={}", userId);
        return userRepository.save(user);
    }

    /**
     * Изменить авто: модель и номер сразу.
     */
    public User updateVehicle(Long userId, String carModel, String carNumber) {
        User user = requireUser(userId);
        user.setCarModel(carModel);
        user.setCarNumber(carNumber);
        log.info("Авто водителя изменено: telegramId={}, carNumber={}", userId, carNumber);
        return userRepository.save(user);
    }

    public User updateLanguage(Long userId, String lang) {
        User user = requireUser(userId);
        user.setLang(lang);
        return userRepository.save(user);
    }

    public User updateReportPeriod(Long userId, String reportPeriod) {
        User user = requireUser(userId);
        user.setReportPeriod(reportPeriod);
        return userRepository.save(user);
    }

    /**
     * Записать заработок.
     *
     * @throws NotRegisteredException если водителя нет в БД
     */
    public IncomeEntry recordIncome(Long userId, BigDecimal amount, LocalDateTime timestamp) {
        requirePositive(amount);
        User user = requireUser(userId);
        IncomeEntry entry = IncomeEntry.builder()
                .user(user)
                .amount(amount)
                .timestamp(timestamp)
                .build();
        IncomeEntry saved = incomeRepository.save(entry);
        log.info("Доход записан: telegramId={}, amount={}, id={}", userId, amount, saved.getId());
        return saved;
    }

    /**
     * Записать расход с категорией.
     *
     * @throws NotRegisteredException если водителя нет в БД
     */
    public ExpenseEntry recordExpense(Long userId, BigDecimal amount, ExpenseCategory category, LocalDateTime timestamp) {
        requirePositive(amount);
        User user = requireUser(userId);
        ExpenseEntry entry = ExpenseEntry.builder()
                .user(user)
                .amount(amount)
                .category(category)
                .timestamp(timestamp)
                .build();
        ExpenseEntry saved = expenseRepository.save(entry);
        log.info("Расход записан: telegramId={}, amount={}, category={}, id={}",
                userId, amount, category.getCode(), saved.getId());
        return saved;
    }

    /**
     * Баланс водителя начиная с since (включительно). since == null - за всё время.
     */
    @Transactional(readOnly = true)
    public Balance balanceSince(Long userId, LocalDateTime since) {
        BigDecimal income;
        BigDecimal expense;
        if (since == null) {
            income = incomeRepository.sumByUser(userId);
            expense = expenseRepository.sumByUser(userId);
        } else {
            income = incomeRepository.sumByUserSince(userId, since);
            expense = expenseRepository.sumByUserSince(userId, since);
        }
        return Balance.of(zeroIfNull(income), zeroIfNull(expense));
    }

    /**
     * Рейтинг водителей по сальдо (по убыванию), не больше limit строк.
     * Порядок при равном сальдо - см. UserRepository.findLeaderboard.
     */
    @Transactional(readOnly = true)
    public List<LeaderboardEntry> topByNetBalance(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return userRepository.findLeaderboard(PageRequest.of(0, limit));
    }

    /**
     * Все записи водителя за [start, endExclusive), отсортированные по времени.
     */
    @Transactional(readOnly = true)
    public PeriodReport entriesInRange(Long userId, LocalDateTime start, LocalDateTime endExclusive) {
        List<IncomeEntry> incomes = incomeRepository.findInRange(userId, start, endExclusive);
        List<ExpenseEntry> expenses = expenseRepository.findInRange(userId, start, endExclusive);
        log.debug("Отчёт за период: telegramId={}, start={}, end={}, incomes={}, expenses={}",
                userId, start, endExclusive, incomes.size(), expenses.size());
        return new PeriodReport(start, endExclusive, incomes, expenses);
    }

    // ======= ВСПОМОГАТЕЛЬНОЕ =======

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotRegisteredException(userId));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Сумма должна быть больше нуля: " + amount);
        }
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
