package org.example.driver_ledger.model;

import lombok.Builder;

/**
 * Все поля регистрации, собранные диалогом. Сбрасывается в БД одним upsert'ом.
 */
@Builder
public record RegistrationDraft(String name, String nickname, String carModel, String carNumber) {
}
