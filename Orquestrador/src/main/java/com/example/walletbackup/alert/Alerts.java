package com.example.walletbackup.alert;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canal de alertas para o usuário. Fire-and-forget.
 */
public final class Alerts {

    private Alerts() {}

    public enum Severity { INFO, WARNING, ERROR }

    @FunctionalInterface
    public interface AlertSink {
        void send(Severity severity, String title, String description);
    }

    /** Sink padrão quando o host não fornece um canal de UI: apenas registra no log. */
    public static final class LoggingAlertSink implements AlertSink {
        private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

        @Override
        public void send(Severity severity, String title, String description) {
            Objects.requireNonNull(severity, "severity");
            switch (severity) {
                case ERROR:
                    log.error("[ALERTA] {}: {}", title, description);
                    break;
                case WARNING:
                    log.warn("[ALERTA] {}: {}", title, description);
                    break;
                default:
                    log.info("[ALERTA] {}: {}", title, description);
            }
        }
    }
}
