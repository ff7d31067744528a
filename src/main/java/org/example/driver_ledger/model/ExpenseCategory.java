package org.example.driver_ledger.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Категории расходов. Список фиксированный.
 *
 * code - то, что уходит в callback_data ("exp_type:fuel") и в колонку expenses.type
 * displayName - подпись на кнопке
 */
@Getter
public enum ExpenseCategory {

    FUEL("fuel", "Паливо"),
    WASH("wash", "Мийка"),
    REPAIR("repair", "Ремонт"),
    OTHER("other", "Інше");

    private final String code;
    private final String displayName;

    ExpenseCategory(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Найти категорию по коду. Неизвестный код - пустой Optional.
     */
    public static Optional<ExpenseCategory> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.code.equals(code))
                .findFirst();
    }

    /**
     * Хранение в БД по коду ("fuel"), а не по имени enum'а ("FUEL").
     */
    @Converter
    public static class CodeConverter implements AttributeConverter<ExpenseCategory, String> {

        @Override
        public String convertToDatabaseColumn(ExpenseCategory category) {
            return category == null ? null : category.getCode();
        }

        @Override
        public ExpenseCategory convertToEntityAttribute(String code) {
            if (code == null) {
                return null;
            }
            return fromCode(code)
                    .orElseThrow(() -> new IllegalStateException("Неизвестная категория расхода в БД: " + code));
        }
    }
}
