package com.example.walletbackup.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AppConfig")
class AppConfigTest {

    @Nested
    @DisplayName("padrões")
    class Defaults {

        @Test
        @DisplayName("tempos do agendador e do monitor")
        void timingDefaults() {
            AppConfig config = AppConfig.fromMap(Map.of());

            assertThat(config.debounce()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.checkInterval()).isEqualTo(Duration.ofMinutes(1));
            assertThat(config.failedBackupThreshold()).isEqualTo(Duration.ofMinutes(30));
            assertThat(config.alertCooldown()).isEqualTo(Duration.ofMinutes(10));
            assertThat(config.workerThreads()).isEqualTo(4);
        }

        @Test
        @DisplayName("storage remoto")
        void storageDefaults() {
            AppConfig config = AppConfig.fromMap(Map.of());

            assertThat(config.storageBackend()).isEqualTo("http");
            assertThat(config.storeIdPrefix()).isEqualTo("wallet_backup");
            assertThat(config.compressionEnabled()).isTrue();
            assertThat(config.zstdLevel()).isEqualTo(3);
            assertThat(config.httpTimeout()).isEqualTo(Duration.ofSeconds(30));
        }
    }

    @Nested
    @DisplayName("validação")
    class Validation {

        @Test
        @DisplayName("valores fora da faixa são limitados e inválidos voltam ao padrão")
        void clampsAndFallsBack() {
            AppConfig config = AppConfig.fromMap(Map.of(
                    AppConfig.BACKUP_WORKER_THREADS, "500",
                    AppConfig.BACKUP_CHECK_INTERVAL_MS, "10",
                    AppConfig.BACKUP_DEBOUNCE_MS, "abc"));

            assertThat(config.workerThreads()).isEqualTo(32);
            assertThat(config.checkInterval()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.debounce()).isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("backend desconhecido falha cedo")
        void rejectsUnknownBackend() {
            AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_STORE, "ftp"));

            assertThatThrownBy(config::storageBackend).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("VSS_URL exige http(s) e perde a barra final")
        void normalizesVssUrl() {
            assertThat(AppConfig.fromMap(Map.of(AppConfig.VSS_URL, "https://vss.example.com/")).vssUrl())
                    .isEqualTo("https://vss.example.com");
            assertThatThrownBy(() -> AppConfig.fromMap(Map.of(AppConfig.VSS_URL, "ftp://x")).vssUrl())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("região AWS inválida é rejeitada")
        void rejectsBadRegion() {
            AppConfig config = AppConfig.fromMap(Map.of(AppConfig.AWS_S3_REGION, "mars"));

            assertThatThrownBy(config::awsRegion).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("override tem precedência e pode ser removido")
    void overridesTakePrecedence() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_DEBOUNCE_MS, "1000"));

        config.override(AppConfig.BACKUP_DEBOUNCE_MS, "2000");
        assertThat(config.debounce()).isEqualTo(Duration.ofSeconds(2));

        config.override(AppConfig.BACKUP_DEBOUNCE_MS, null);
        assertThat(config.debounce()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("toString não expõe credenciais")
    void toStringHidesSecrets() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.AWS_ACCESS_KEY_ID, "AKIAEXEMPLO",
                AppConfig.AWS_SECRET_ACCESS_KEY, "segredo-super",
                AppConfig.BACKUP_STORE, "s3"));

        assertThat(config.toString())
                .contains("store=s3", "awsCreds=set")
                .doesNotContain("AKIAEXEMPLO", "segredo-super");
    }
}
