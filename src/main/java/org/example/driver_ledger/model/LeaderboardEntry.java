package org.example.driver_ledger.model;

import java.math.BigDecimal;

/**
 * Строка рейтинга водителей.
 */
public record LeaderboardEntry(String nickname, String displayName, BigDecimal net) {
}
