package org.example.driver_ledger.bot;

import org.example.driver_ledger.bot.KeyboardLayout.Button;
import org.example.driver_ledger.model.ExpenseCategory;

import java.util.List;

/**
 * Все клавиатуры бота и подписи кнопок в одном месте.
 *
 * Подписи главного меню - это одновременно и триггеры: UpdateDispatcher
 * сравнивает входящий текст с ними один в один.
 */
public final class MenuKeyboards {

    public static final String ADD_INCOME = "📥 Додати заробіток";
    public static final String ADD_EXPENSE = "💸 Додати витрати";
    public static final String MY_STATS = "📊 Моя статистика";
    public static final String PERIOD_REPORT = "📅 Звіт за період";
    public static final String TOP_DRIVERS = "🏆 Топ водіїв";
    public static final String MY_CAR = "🚘 Мій автомобіль";
    public static final String SETTINGS = "⚙️ Налаштування";

    // Префиксы callback_data (формат "префикс:значение")
    public static final String EXPENSE_TYPE_PREFIX = "exp_type";
    public static final String EDIT_PREFIX = "edit";
    public static final String SET_LANG_PREFIX = "setlang";
    public static final String SET_PERIOD_PREFIX = "setperiod";

    private MenuKeyboards() {
    }

    /**
     * Главное меню (ReplyKeyboard - внизу экрана, не скрывается).
     */
    public static KeyboardLayout mainMenu() {
        return KeyboardLayout.replyMenu(List.of(
                List.of(Button.label(ADD_INCOME), Button.label(ADD_EXPENSE)),
                List.of(Button.label(MY_STATS), Button.label(PERIOD_REPORT)),
                List.of(Button.label(TOP_DRIVERS), Button.label(MY_CAR)),
                List.of(Button.label(SETTINGS))
        ));
    }

    /**
     * Категории расхода, по две в ряд.
     */
    public static KeyboardLayout expenseCategories() {
        return KeyboardLayout.inline(List.of(
                List.of(categoryButton(ExpenseCategory.FUEL), categoryButton(ExpenseCategory.WASH)),
                List.of(categoryButton(ExpenseCategory.REPAIR), categoryButton(ExpenseCategory.OTHER))
        ));
    }

    public static KeyboardLayout profileActions() {
        return KeyboardLayout.inline(List.of(
                List.of(Button.inline("Редагувати ім'я", callback(EDIT_PREFIX, "name"))),
                List.of(Button.inline("Редагувати авто", callback(EDIT_PREFIX, "car"))),
                List.of(Button.inline("Закрити", callback(EDIT_PREFIX, "close")))
        ));
    }

    public static KeyboardLayout settings() {
        return KeyboardLayout.inline(List.of(
                List.of(Button.inline("Мова: Українська", callback(SET_LANG_PREFIX, "uk"))),
                List.of(Button.inline("Період звітів: Щотижня", callback(SET_PERIOD_PREFIX, "weekly")),
                        Button.inline("Період звітів: Щомісяця", callback(SET_PERIOD_PREFIX, "monthly")))
        ));
    }

    public static String callback(String prefix, String value) {
        return prefix + ":" + value;
    }

    private static Button categoryButton(ExpenseCategory category) {
        return Button.inline(category.getDisplayName(), callback(EXPENSE_TYPE_PREFIX, category.getCode()));
    }
}
