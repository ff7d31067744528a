package org.example.driver_ledger.service;

import org.example.driver_ledger.exception.DuplicateNicknameException;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.model.Balance;
import org.example.driver_ledger.model.ExpenseCategory;
import org.example.driver_ledger.model.LeaderboardEntry;
import org.example.driver_ledger.model.PeriodReport;
import org.example.driver_ledger.model.RegistrationDraft;
import org.example.driver_ledger.model.User;
import org.example.driver_ledger.repository.ExpenseRepository;
import org.example.driver_ledger.repository.IncomeRepository;
import org.example.driver_ledger.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LedgerService поверх настоящей схемы (Flyway → H2 в режиме PostgreSQL).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({LedgerService.class, LedgerServiceTest.FixedClockConfig.class})
@DisplayName("LedgerService Integration Tests")
class LedgerServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 15, 12, 0);

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private IncomeRepository incomeRepository;

    @Autowired
    private ExpenseRepository expenseRepository;

    @BeforeEach
    void cleanUp() {
        expenseRepository.deleteAll();
        incomeRepository.deleteAll();
        userRepository.deleteAll();
    }

    private void register(Long userId, String nickname) {
        ledgerService.saveUser(userId, "tg" + userId, RegistrationDraft.builder()
                .name("Driver " + userId)
                .nickname(nickname)
                .carModel("Toyota Corolla")
                .carNumber("BC1234AB")
                .build());
    }

    private void insertUser(Long userId, String nickname, LocalDateTime registeredAt) {
        userRepository.save(User.builder()
                .userId(userId)
                .name("Driver " + userId)
                .nickname(nickname)
                .carModel("Skoda Octavia")
                .carNumber("AA0001AA")
                .registeredAt(registeredAt)
                .build());
    }

    @Test
    @DisplayName("Should save all profile fields with defaults")
    void shouldSaveUser() {
        register(1L, "ivan99");

        User user = ledgerService.findUser(1L).orElseThrow();
        assertThat(user.getName()).isEqualTo("Driver 1");
        assertThat(user.getNickname()).isEqualTo("ivan99");
        assertThat(user.getCarNumber()).isEqualTo("BC1234AB");
        assertThat(user.getTgFirstName()).isEqualTo("tg1");
        assertThat(user.getLang()).isEqualTo("uk");
        assertThat(user.getReportPeriod()).isEqualTo("weekly");
        assertThat(user.getRegisteredAt()).isEqualTo(NOW);
        assertThat(ledgerService.userExists(1L)).isTrue();
    }

    @Test
    @DisplayName("Nickname check should ignore case")
    void nicknameCheckShouldIgnoreCase() {
        register(1L, "Driver1");

        assertThat(ledgerService.nicknameTaken("DRIVER1")).isTrue();
        assertThat(ledgerService.nicknameTaken("driver1")).isTrue();
        assertThat(ledgerService.nicknameTaken("driver2")).isFalse();
    }

    @Test
    @DisplayName("Should reject a nickname taken by another user in any case")
    void shouldRejectForeignNickname() {
        register(1L, "Driver1");

        assertThatThrownBy(() -> register(2L, "DRIVER1"))
                .isInstanceOf(DuplicateNicknameException.class);
        assertThat(ledgerService.userExists(2L)).isFalse();
    }

    @Test
    @DisplayName("Re-registration overwrites the profile but keeps settings")
    void reRegistrationShouldOverwrite() {
        register(1L, "ivan99");
        ledgerService.updateReportPeriod(1L, "monthly");

        ledgerService.saveUser(1L, "Ivan", RegistrationDraft.builder()
                .name("Ivan Petrenko")
                .nickname("IVAN99")
                .carModel("Renault Logan")
                .carNumber("AA7777BB")
                .build());

        User user = ledgerService.findUser(1L).orElseThrow();
        assertThat(user.getName()).isEqualTo("Ivan Petrenko");
        assertThat(user.getNickname()).isEqualTo("IVAN99");
        assertThat(user.getCarModel()).isEqualTo("Renault Logan");
        assertThat(user.getReportPeriod()).isEqualTo("monthly");
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Edits touch only the edited fields")
    void editsShouldKeepNickname() {
        register(1L, "ivan99");

        ledgerService.updateName(1L, "Ivan");
        ledgerService.updateVehicle(1L, "Renault Logan", "AA7777BB");

        User user = ledgerService.findUser(1L).orElseThrow();
        assertThat(user.getName()).isEqualTo("Ivan");
        assertThat(user.getCarModel()).isEqualTo("Renault Logan");
        assertThat(user.getCarNumber()).isEqualTo("AA7777BB");
        assertThat(user.getNickname()).isEqualTo("ivan99");
    }

    @Test
    @DisplayName("Should refuse entries for unknown user")
    void shouldRefuseUnknownUser() {
        assertThatThrownBy(() -> ledgerService.recordIncome(99L, new BigDecimal("10.00"), NOW))
                .isInstanceOf(NotRegisteredException.class);
        assertThatThrownBy(() -> ledgerService.recordExpense(99L, new BigDecimal("10.00"),
                ExpenseCategory.FUEL, NOW))
                .isInstanceOf(NotRegisteredException.class);
        assertThat(incomeRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should refuse non-positive amounts")
    void shouldRefuseNonPositiveAmount() {
        register(1L, "ivan99");

        assertThatThrownBy(() -> ledgerService.recordIncome(1L, BigDecimal.ZERO, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.recordExpense(1L, new BigDecimal("-1.00"),
                ExpenseCategory.WASH, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(incomeRepository.count()).isZero();
    }

    @Test
    @DisplayName("Entry ids grow monotonically")
    void idsShouldGrow() {
        register(1L, "ivan99");

        Long first = ledgerService.recordIncome(1L, new BigDecimal("1.00"), NOW).getId();
        Long second = ledgerService.recordIncome(1L, new BigDecimal("2.00"), NOW).getId();

        assertThat(second).isGreaterThan(first);
    }

    @Test
    @DisplayName("Net equals income minus expense")
    void netShouldEqualIncomeMinusExpense() {
        register(1L, "ivan99");
        ledgerService.recordIncome(1L, new BigDecimal("100.50"), NOW.minusHours(1));
        ledgerService.recordIncome(1L, new BigDecimal("200.00"), NOW.minusDays(10));
        ledgerService.recordExpense(1L, new BigDecimal("50.00"), ExpenseCategory.FUEL, NOW.minusHours(2));

        Balance total = ledgerService.balanceSince(1L, null);

        assertThat(total.totalIncome()).isEqualByComparingTo("300.50");
        assertThat(total.totalExpense()).isEqualByComparingTo("50.00");
        assertThat(total.net()).isEqualByComparingTo("250.50");
        assertThat(total.net()).isEqualByComparingTo(total.totalIncome().subtract(total.totalExpense()));
    }

    @Test
    @DisplayName("Since filter is inclusive and skips older entries")
    void sinceShouldFilter() {
        register(1L, "ivan99");
        ledgerService.recordIncome(1L, new BigDecimal("10.00"), NOW.minusDays(1));
        ledgerService.recordIncome(1L, new BigDecimal("20.00"), NOW.minusDays(3));

        Balance day = ledgerService.balanceSince(1L, NOW.minusDays(1));

        assertThat(day.totalIncome()).isEqualByComparingTo("10.00");
        assertThat(day.totalExpense()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("User without entries has zero balance")
    void emptyBalanceShouldBeZero() {
        register(1L, "ivan99");

        Balance balance = ledgerService.balanceSince(1L, null);

        assertThat(balance.net()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should order by net, then registration time, then id")
    void shouldOrderDeterministically() {
        insertUser(1L, "late", NOW.minusDays(1));
        insertUser(2L, "early", NOW.minusDays(5));
        insertUser(3L, "rich", NOW);
        insertUser(4L, "same_time", NOW.minusDays(1));
        ledgerService.recordIncome(3L, new BigDecimal("500.00"), NOW);
        ledgerService.recordIncome(1L, new BigDecimal("100.00"), NOW);
        ledgerService.recordIncome(2L, new BigDecimal("130.00"), NOW);
        ledgerService.recordExpense(2L, new BigDecimal("30.00"), ExpenseCategory.WASH, NOW);
        ledgerService.recordIncome(4L, new BigDecimal("100.00"), NOW);

        List<LeaderboardEntry> top = ledgerService.topByNetBalance(10);

        assertThat(top).extracting(LeaderboardEntry::nickname)
                .containsExactly("rich", "early", "late", "same_time");
        assertThat(top.get(1).net()).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("Users without entries rank with zero net")
    void usersWithoutEntriesHaveZeroNet() {
        insertUser(1L, "spender", NOW.minusDays(2));
        insertUser(2L, "idle", NOW.minusDays(1));
        ledgerService.recordExpense(1L, new BigDecimal("40.00"), ExpenseCategory.REPAIR, NOW);

        List<LeaderboardEntry> top = ledgerService.topByNetBalance(10);

        assertThat(top).extracting(LeaderboardEntry::nickname).containsExactly("idle", "spender");
        assertThat(top.get(0).net()).isEqualByComparingTo("0");
        assertThat(top.get(1).net()).isEqualByComparingTo("-40.00");
    }

    @Test
    @DisplayName("Should respect limit")
    void shouldRespectLimit() {
        for (long id = 1; id <= 5; id++) {
            insertUser(id, "driver" + id, NOW.minusDays(id));
        }

        assertThat(ledgerService.topByNetBalance(3)).extracting(LeaderboardEntry::nickname)
                .containsExactly("driver5", "driver4", "driver3");
        assertThat(ledgerService.topByNetBalance(0)).isEmpty();
    }

    @Test
    @DisplayName("Several incomes and expenses of one user are not multiplied")
    void shouldNotMultiplySums() {
        insertUser(1L, "busy", NOW.minusDays(1));
        insertUser(2L, "steady", NOW.minusDays(2));
        for (int i = 0; i < 3; i++) {
            ledgerService.recordIncome(1L, new BigDecimal("10.00"), NOW);
            ledgerService.recordExpense(1L, new BigDecimal("1.00"), ExpenseCategory.FUEL, NOW);
        }
        ledgerService.recordIncome(2L, new BigDecimal("28.00"), NOW);

        List<LeaderboardEntry> top = ledgerService.topByNetBalance(10);

        assertThat(top).extracting(LeaderboardEntry::nickname).containsExactly("steady", "busy");
        assertThat(top.get(1).net()).isEqualByComparingTo("27.00");
        assertThat(top.get(1).displayName()).isEqualTo("Driver 1");
    }

    @Test
    @DisplayName("Empty store yields empty leaderboard")
    void emptyStoreShouldYieldEmptyList() {
        assertThat(ledgerService.topByNetBalance(10)).isEmpty();
    }

    @Test
    @DisplayName("Should include whole end date and exclude next day")
    void shouldRespectRangeBoundaries() {
        register(1L, "ivan99");
        LocalDateTime start = LocalDateTime.of(2025, 1, 1, 0, 0);
        LocalDateTime endExclusive = LocalDateTime.of(2025, 2, 1, 0, 0);
        ledgerService.recordIncome(1L, new BigDecimal("10.00"), start);
        ledgerService.recordIncome(1L, new BigDecimal("20.00"), LocalDateTime.of(2025, 1, 31, 23, 59));
        ledgerService.recordIncome(1L, new BigDecimal("99.00"), endExclusive);
        ledgerService.recordIncome(1L, new BigDecimal("98.00"), start.minusSeconds(1));
        ledgerService.recordExpense(1L, new BigDecimal("5.50"), ExpenseCategory.FUEL,
                LocalDateTime.of(2025, 1, 15, 8, 0));

        PeriodReport report = ledgerService.entriesInRange(1L, start, endExclusive);

        assertThat(report.incomes()).extracting(e -> e.getAmount().toPlainString())
                .containsExactly("10.00", "20.00");
        assertThat(report.expenses()).hasSize(1);
        assertThat(report.expenses().get(0).getCategory()).isEqualTo(ExpenseCategory.FUEL);
        assertThat(report.net()).isEqualByComparingTo("24.50");
    }

    @Test
    @DisplayName("Entries are ordered by time regardless of insertion order")
    void shouldOrderByTime() {
        register(1L, "ivan99");
        ledgerService.recordIncome(1L, new BigDecimal("2.00"), LocalDateTime.of(2025, 1, 2, 0, 0));
        ledgerService.recordIncome(1L, new BigDecimal("1.00"), LocalDateTime.of(2025, 1, 1, 0, 0));

        PeriodReport report = ledgerService.entriesInRange(1L,
                LocalDateTime.of(2025, 1, 1, 0, 0), LocalDateTime.of(2025, 1, 3, 0, 0));

        assertThat(report.incomes()).extracting(e -> e.getAmount().toPlainString())
                .containsExactly("1.00", "2.00");
    }

    @Test
    @DisplayName("Other users' entries are not included")
    void shouldIsolateUsers() {
        register(1L, "ivan99");
        register(2L, "petro");
        ledgerService.recordIncome(2L, new BigDecimal("10.00"), NOW);

        PeriodReport report = ledgerService.entriesInRange(1L, NOW.minusDays(1), NOW.plusDays(1));

        assertThat(report.isEmpty()).isTrue();
    }
}
