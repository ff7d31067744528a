package org.example.driver_ledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Запись о заработке (таблица incomes).
 *
 * После создания не меняется. Принадлежит ровно одному водителю.
 */
@Entity
@Table(name = "incomes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncomeEntry {

    /**
     * Автоинкремент из БД - монотонно растёт.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    /**
     * Водитель, которому принадлежит запись.
     * ManyToOne - у одного водителя много записей.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    /**
     * Сумма (всегда > 0, два знака после запятой).
     */
    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * Время создания записи (UTC).
     */
    @Column(name = "ts", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "note", length = 500)
    private String note;
}
