package org.example.driver_ledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Запись о расходе (таблица expenses).
 *
 * То же самое что IncomeEntry, плюс категория расхода (топливо, мойка...).
 */
@Entity
@Table(name = "expenses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * Категория расхода. В БД лежит код ("fuel"), а не имя enum'а -
     * так же как в callback_data кнопок.
     */
    @Convert(converter = ExpenseCategory.CodeConverter.class)
    @Column(name = "type", nullable = false, length = 16)
    private ExpenseCategory category;

    @Column(name = "ts", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "note", length = 500)
    private String note;
}
