package org.example.driver_ledger.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExpenseCategory Unit Tests")
class ExpenseCategoryTest {

    @Test
    @DisplayName("Should resolve known codes only")
    void shouldResolveKnownCodes() {
        assertThat(ExpenseCategory.fromCode("fuel")).contains(ExpenseCategory.FUEL);
        assertThat(ExpenseCategory.fromCode("other")).contains(ExpenseCategory.OTHER);
        assertThat(ExpenseCategory.fromCode("FUEL")).isEmpty();
        assertThat(ExpenseCategory.fromCode("banana")).isEmpty();
        assertThat(ExpenseCategory.fromCode(null)).isEmpty();
    }

    @Test
    @DisplayName("Converter should store the code, not the enum name")
    void converterShouldUseCode() {
        ExpenseCategory.CodeConverter converter = new ExpenseCategory.CodeConverter();

        assertThat(converter.convertToDatabaseColumn(ExpenseCategory.WASH)).isEqualTo("wash");
        assertThat(converter.convertToEntityAttribute("repair")).isEqualTo(ExpenseCategory.REPAIR);
        assertThatThrownBy(() -> converter.convertToEntityAttribute("xxx"))
                .isInstanceOf(IllegalStateException.class);
    }
}
