package org.example.driver_ledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Модель водителя (User) - это Java представление таблицы users.
 *
 * <h2>Что это такое:</h2>
 * Запись появляется только когда пользователь прошёл регистрацию до конца
 * (имя → псевдоним → авто → номер). Никогда не удаляется.
 *
 * <h2>Важно:</h2>
 * <ul>
 *   <li>ID - это Telegram ID пользователя, а не сгенерированный ключ</li>
 *   <li>Псевдоним (nickname) уникален без учёта регистра и после регистрации не меняется</li>
 *   <li>Номер авто хранится уже нормализованным (BC1234AB)</li>
 * </ul>
 */
@Entity
@Table(name = "users") // название таблицы в БД (должно совпадать с миграцией!)
@Getter
@Setter
@NoArgsConstructor  // нужен для Hibernate
@AllArgsConstructor
@Builder
public class User {

    public static final String DEFAULT_LANGUAGE = "uk";
    public static final String DEFAULT_REPORT_PERIOD = "weekly";

    /**
     * Telegram ID пользователя (PRIMARY KEY).
     * Генерировать ничего не надо - ID приходит от Telegram.
     */
    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    /**
     * Имя из профиля Telegram (first_name) на момент регистрации.
     */
    @Column(name = "tg_first_name")
    private String tgFirstName;

    /**
     * Настоящее имя, которое водитель ввёл сам.
     */
    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Уникальный псевдоним для рейтинга.
     * Уникальность без учёта регистра проверяется в LedgerService ДО сохранения.
     */
    @Column(name = "nickname", nullable = false, length = 64)
    private String nickname;

    /**
     * Псевдоним в нижнем регистре. На нём висит UNIQUE в БД,
     * так что "Driver1" и "driver1" не сохранятся оба даже при гонке.
     * Заполняется сам перед INSERT/UPDATE.
     */
    @Column(name = "nickname_key", nullable = false, length = 64)
    @Setter(AccessLevel.NONE)
    private String nicknameKey;

    @Column(name = "car_model", nullable = false)
    private String carModel;

    /**
     * Номер авто в нормализованном виде: 2 буквы, 4 цифры, 2 буквы.
     */
    @Column(name = "car_number", nullable = false, length = 16)
    private String carNumber;

    @Column(name = "lang", nullable = false, length = 8)
    @Builder.Default
    private String lang = DEFAULT_LANGUAGE;

    /**
     * Периодичность отчётов: weekly / monthly.
     */
    @Column(name = "report_period", nullable = false, length = 16)
    @Builder.Default
    private String reportPeriod = DEFAULT_REPORT_PERIOD;

    /**
     * Время регистрации (UTC). Перезаписывается при повторной регистрации.
     */
    @Column(name = "registered_at", nullable = false)
    private LocalDateTime registeredAt;

    public static String nicknameKey(String nickname) {
        return nickname == null ? null : nickname.toLowerCase(Locale.ROOT);
    }

    @PrePersist
    @PreUpdate
    void syncNicknameKey() {
        this.nicknameKey = nicknameKey(nickname);
    }
}
