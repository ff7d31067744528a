package org.example.driver_ledger.config;

import org.example.driver_ledger.exception.StartupConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BotConfig Unit Tests")
class BotConfigTest {

    @Test
    @DisplayName("Missing token should be a fatal startup error")
    void missingTokenShouldFail() {
        assertThatThrownBy(() -> BotConfig.requireToken(null))
                .isInstanceOf(StartupConfigException.class)
                .hasMessageContaining("BOT_TOKEN");
        assertThatThrownBy(() -> BotConfig.requireToken("  "))
                .isInstanceOf(StartupConfigException.class);
    }

    @Test
    @DisplayName("Init should fail when token property is empty")
    void initShouldFailOnEmptyToken() {
        BotConfig config = new BotConfig();
        ReflectionTestUtils.setField(config, "token", "");
        ReflectionTestUtils.setField(config, "username", "test_bot");

        assertThatThrownBy(config::init).isInstanceOf(StartupConfigException.class);
    }

    @Test
    @DisplayName("Token should be trimmed")
    void tokenShouldBeTrimmed() {
        assertThat(BotConfig.requireToken(" 123:ABC ")).isEqualTo("123:ABC");
    }
}
