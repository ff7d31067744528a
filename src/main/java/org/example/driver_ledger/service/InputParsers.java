package org.example.driver_ledger.service;

import org.example.driver_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Разбор и проверка пользовательского ввода.
 *
 * Все методы чистые: на вход строка, на выход значение или ValidationException
 * с текстом, который сразу можно показать пользователю.
 */
public final class InputParsers {

    /**
     * Номер авто: 2 буквы, 4 цифры, 2 буквы. Буквы латиница или кириллица (включая І, Ї, Є, Ґ).
     */
    public static final Pattern PLATE_PATTERN = Pattern.compile(
            "^[A-ZА-ЯІЇЄҐ]{2}\\d{4}[A-ZА-ЯІЇЄҐ]{2}$");

    private static final Pattern AMOUNT_PATTERN = Pattern.compile("^\\d+(\\.\\d+)?$");

    /** NUMERIC(12,2) - максимум 10 цифр до запятой */
    private static final int MAX_INTEGER_DIGITS = 10;

    private InputParsers() {
    }

    /**
     * Непустой текст без пробелов по краям.
     */
    public static String requireText(String text, String errorMessage) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(errorMessage);
        }
        return text.trim();
    }

    /**
     * Нормализация номера: обрезаем, в верхний регистр, убираем все пробелы.
     * " bc 1234 ab " → "BC1234AB"
     */
    public static String normalizePlate(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "");
    }

    public static boolean isValidPlate(String normalizedPlate) {
        return PLATE_PATTERN.matcher(normalizedPlate).matches();
    }

    /**
     * Нормализовать и проверить номер авто.
     *
     * @return номер в виде BC1234AB
     * @throws ValidationException если не подходит под формат
     */
    public static String parsePlate(String text) {
        String plate = normalizePlate(text);
        if (!isValidPlate(plate)) {
            throw new ValidationException("Невірний формат номера. Спробуйте у форматі BC1234AB (без пробілів).");
        }
        return plate;
    }

    /**
     * Разобрать сумму. Запятая допускается как десятичный разделитель ("100,50").
     * Округляем до копеек, результат должен быть строго больше нуля.
     *
     * @throws ValidationException если это не число, число <= 0 или слишком большое
     */
    public static BigDecimal parseAmount(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Некоректна сума. Введіть число > 0.");
        }
        String normalized = text.trim().replace(",", ".");
        // Только цифры и одна точка: без знака и экспоненты ("1e9999999")
        if (!AMOUNT_PATTERN.matcher(normalized).matches()) {
            throw new ValidationException("Некоректна сума. Введіть число > 0.");
        }
        int point = normalized.indexOf('.');
        String integerPart = (point < 0 ? normalized : normalized.substring(0, point)).replaceFirst("^0+(?=.)", "");
        if (integerPart.length() > MAX_INTEGER_DIGITS) {
            throw new ValidationException("Занадто велика сума. Перевірте введене число.");
        }
        BigDecimal amount = new BigDecimal(normalized);
        BigDecimal rounded = amount.setScale(2, RoundingMode.HALF_UP);
        if (rounded.signum() <= 0) {
            throw new ValidationException("Некоректна сума. Введіть число > 0.");
        }
        if (rounded.precision() - rounded.scale() > MAX_INTEGER_DIGITS) {
            throw new ValidationException("Занадто велика сума. Перевірте введене число.");
        }
        return rounded;
    }

    /**
     * Разобрать период "YYYY-MM-DD,YYYY-MM-DD". Конечная дата включительно
     * (в запросе превращается в начало следующего дня).
     *
     * @throws ValidationException если формат неверный или начало позже конца
     */
    public static ReportPeriod parsePeriod(String text) {
        if (text == null) {
            throw new ValidationException("Невірний формат. Надішліть у вигляді: 2025-01-01,2025-01-31");
        }
        String[] parts = text.trim().split(",", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ValidationException("Невірний формат. Надішліть у вигляді: 2025-01-01,2025-01-31");
        }
        LocalDate from;
        LocalDate to;
        try {
            from = LocalDate.parse(parts[0].trim());
            to = LocalDate.parse(parts[1].trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Невірний формат дат. Спробуйте ще раз.");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Початкова дата пізніше кінцевої. Спробуйте ще раз.");
        }
        return new ReportPeriod(from, to);
    }

    /**
     * Период отчёта в днях, обе даты включительно.
     */
    public record ReportPeriod(LocalDate from, LocalDate to) {

        public LocalDateTime start() {
            return from.atStartOfDay();
        }

        /** Начало дня, следующего за конечной датой */
        public LocalDateTime endExclusive() {
            return to.plusDays(1).atStartOfDay();
        }
    }
}
