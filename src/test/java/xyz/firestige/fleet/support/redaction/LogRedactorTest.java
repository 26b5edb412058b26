package xyz.firestige.fleet.support.redaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.fleet.util.TimingExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("日志脱敏测试")
class LogRedactorTest {

    @Test
    @DisplayName("场景: 键值对形式的凭据被屏蔽")
    void redactsKeyValueSecrets() {
        assertThat(LogRedactor.redact("login failed, Password=Hunter2!x"))
                .isEqualTo("login failed, password: [REDACTED]");
        assertThat(LogRedactor.redact("api_key: abc123 retry"))
                .isEqualTo("api_key: [REDACTED] retry");
    }

    @Test
    @DisplayName("场景: Bearer 凭据被屏蔽")
    void redactsBearerTokens() {
        assertThat(LogRedactor.redact("Authorization: Bearer eyJhbGciOi.abc"))
                .isEqualTo("Authorization: Bearer [REDACTED]");
    }

    @Test
    @DisplayName("场景: 长不透明串被屏蔽")
    void redactsOpaqueStrings() {
        String key = "A1b2C3d4E5f6G7h8I9j0K1l2M3n4O5p6Q7r8";

        assertThat(LogRedactor.redact("agent key " + key + " rejected"))
                .isEqualTo("agent key [REDACTED] rejected");
    }

    @Test
    @DisplayName("场景: 普通日志保持不变")
    void leavesOrdinaryTextAlone() {
        String line = "[WS-HOSP-001] Connection failed. Retrying... (Attempt 1 of 3)";

        assertThat(LogRedactor.redact(line)).isEqualTo(line);
        assertThat(LogRedactor.redact("")).isEmpty();
        assertThat(LogRedactor.redact(null)).isNull();
    }
}
