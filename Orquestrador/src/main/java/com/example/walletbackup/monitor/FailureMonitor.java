package com.example.walletbackup.monitor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.walletbackup.alert.Alerts.AlertSink;
import com.example.walletbackup.alert.Alerts.Severity;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;

/**
 * Detecta categorias pendentes há mais tempo que o limite e dispara um único alerta agregado,
 * no máximo uma vez por janela de cooldown.
 */
public final class FailureMonitor {
    private static final Logger log = LoggerFactory.getLogger(FailureMonitor.class);

    static final String TITLE = "Falha no backup";

    private final BackupStatusStore statusStore;
    private final AlertSink alertSink;
    private final Clock clock;
    private final Duration threshold;
    private final Duration cooldown;
    private final Duration retryInterval;

    // guardado por this; null = nunca alertou
    private Long lastAlertAt;

    public FailureMonitor(BackupStatusStore statusStore,
                          AlertSink alertSink,
                          Clock clock,
                          Duration threshold,
                          Duration cooldown,
                          Duration retryInterval) {
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
    }

    /**
     * Uma varredura.
     *
     * @return true se um alerta foi enviado
     */
    public synchronized boolean sweep() {
        long now = clock.millis();
        List<BackupCategory> overdue = overdue(statusStore.snapshot(), now);
        if (overdue.isEmpty()) {
            return false;
        }
        if (lastAlertAt != null && now - lastAlertAt < cooldown.toMillis()) {
            log.debug("Backups atrasados {} mas alerta em cooldown", overdue);
            return false;
        }
        lastAlertAt = now;
        log.warn("Backups pendentes há mais de {} min: {}", threshold.toMinutes(), overdue);
        try {
            alertSink.send(Severity.ERROR, TITLE, description(overdue.size()));
        } catch (RuntimeException e) {
            log.warn("Canal de alerta lançou exceção: {}", e.toString());
        }
        return true;
    }

    List<BackupCategory> overdue(Map<BackupCategory, BackupStatus> statuses, long now) {
        List<BackupCategory> result = new ArrayList<>();
        statuses.forEach((category, status) -> {
            if (status.isRequired() && now - status.requiredAt() > threshold.toMillis()) {
                result.add(category);
            }
        });
        return result;
    }

    private String description(int count) {
        long minutes = Math.max(1, retryInterval.toMinutes());
        String categories = count == 1 ? "1 categoria" : count + " categorias";
        String interval = minutes == 1 ? "1 minuto" : minutes + " minutos";
        return "Não foi possível fazer backup de " + categories + ". Nova tentativa a cada " + interval + ".";
    }
}
