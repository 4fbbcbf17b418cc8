package com.example.walletbackup.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.walletbackup.alert.Alerts.AlertSink;
import com.example.walletbackup.alert.Alerts.Severity;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.StatusStore.InMemoryStatusPersistence;
import com.example.walletbackup.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FailureMonitor")
class FailureMonitorTest {

    private static final long START = 1_000_000L;

    @Mock
    private AlertSink alertSink;

    private BackupStatusStore store;
    private MutableClock clock;
    private FailureMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new BackupStatusStore(new InMemoryStatusPersistence());
        clock = new MutableClock(START);
        monitor = new FailureMonitor(store, alertSink, clock,
                Duration.ofMinutes(30), Duration.ofMinutes(10), Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("pendência há 31 minutos dispara um alerta")
    void overdueCategoryAlerts() {
        store.update(BackupCategory.WALLET, s -> new BackupStatus(false, START - 60_000L, START));
        clock.advance(Duration.ofMinutes(31));

        assertThat(monitor.sweep()).isTrue();

        verify(alertSink).send(eq(Severity.ERROR), eq("Falha no backup"), contains("1 categoria"));
    }

    @Test
    @DisplayName("pendência recente não alerta")
    void recentPendingDoesNotAlert() {
        store.update(BackupCategory.WALLET, s -> s.withRequiredAt(START));
        clock.advance(Duration.ofMinutes(29));

        assertThat(monitor.sweep()).isFalse();

        verify(alertSink, never()).send(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("categoria sincronizada há muito tempo não alerta")
    void syncedCategoryDoesNotAlert() {
        store.update(BackupCategory.SETTINGS, s -> new BackupStatus(false, START, START));
        clock.advance(Duration.ofHours(5));

        assertThat(monitor.sweep()).isFalse();
    }

    @Test
    @DisplayName("várias categorias atrasadas geram um único alerta por janela de cooldown")
    void cooldownThrottlesAlerts() {
        for (BackupCategory category : BackupCategory.managed()) {
            store.update(category, s -> s.withRequiredAt(START));
        }
        clock.advance(Duration.ofMinutes(31));

        for (int i = 0; i < 5; i++) {
            monitor.sweep();
            clock.advance(Duration.ofMinutes(1));
        }

        verify(alertSink, times(1)).send(eq(Severity.ERROR), anyString(), contains("6 categorias"));

        clock.advance(Duration.ofMinutes(6));
        assertThat(monitor.sweep()).isTrue();
        verify(alertSink, times(2)).send(eq(Severity.ERROR), anyString(), anyString());
    }

    @Test
    @DisplayName("canal de alerta que lança não propaga")
    void sinkFailureIsContained() {
        doThrow(new IllegalStateException("ui fechada")).when(alertSink).send(any(), anyString(), anyString());
        store.update(BackupCategory.ACTIVITY, s -> s.withRequiredAt(START));
        clock.advance(Duration.ofMinutes(45));

        assertThat(monitor.sweep()).isTrue();
    }
}
