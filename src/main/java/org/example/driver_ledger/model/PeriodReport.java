package org.example.driver_ledger.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Отчёт за период [start, endExclusive): все доходы и расходы по времени.
 */
public record PeriodReport(LocalDateTime start,
                           LocalDateTime endExclusive,
                           List<IncomeEntry> incomes,
                           List<ExpenseEntry> expenses) {

    public BigDecimal totalIncome() {
        return incomes.stream()
                .map(IncomeEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalExpense() {
        return expenses.stream()
                .map(ExpenseEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Сальдо за период = сумма доходов - сумма расходов.
     */
    public BigDecimal net() {
        return totalIncome().subtract(totalExpense());
    }

    public boolean isEmpty() {
        return incomes.isEmpty() && expenses.isEmpty();
    }
}
