package org.example.driver_ledger.handler;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Форматирование сумм и дат в ответах бота.
 */
final class MessageFormats {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private MessageFormats() {
    }

    /** 100.5 → "100.50" */
    static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String date(LocalDateTime timestamp) {
        return timestamp.format(DATE);
    }
}
