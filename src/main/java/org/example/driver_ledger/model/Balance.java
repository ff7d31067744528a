package org.example.driver_ledger.model;

import java.math.BigDecimal;

/**
 * Баланс за период: доходы, расходы и сальдо (доходы - расходы).
 */
public record Balance(BigDecimal totalIncome, BigDecimal totalExpense, BigDecimal net) {

    public static Balance of(BigDecimal totalIncome, BigDecimal totalExpense) {
        return new Balance(totalIncome, totalExpense, totalIncome.subtract(totalExpense));
    }
}
