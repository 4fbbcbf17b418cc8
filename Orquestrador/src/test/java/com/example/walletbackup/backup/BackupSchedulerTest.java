package com.example.walletbackup.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.example.walletbackup.backup.Backup.BackupExecutor;
import com.example.walletbackup.backup.Backup.PayloadCodec;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.StatusStore.InMemoryStatusPersistence;
import com.example.walletbackup.status.SuppressionFlags;
import com.example.walletbackup.support.FakeDataSource;
import com.example.walletbackup.support.MutableClock;
import com.example.walletbackup.support.RecordingBackupStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BackupScheduler")
class BackupSchedulerTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(300);

    private ScheduledExecutorService pool;
    private InMemoryStatusPersistence persistence;
    private BackupStatusStore store;
    private RecordingBackupStore remote;
    private SuppressionFlags flags;
    private MutableClock clock;
    private BackupExecutor executor;
    private BackupScheduler scheduler;

    @BeforeEach
    void setUp() {
        pool = Executors.newScheduledThreadPool(4);
        persistence = new InMemoryStatusPersistence();
        store = new BackupStatusStore(persistence);
        remote = new RecordingBackupStore();
        flags = new SuppressionFlags();
        clock = new MutableClock(1_000L);
        build();
    }

    private void build() {
        List<CategoryDataSource> sources = new ArrayList<>();
        for (BackupCategory category : BackupCategory.managed()) {
            sources.add(new FakeDataSource(category, category.name().toLowerCase()));
        }
        executor = new BackupExecutor(store, remote, new PayloadCodec(), clock, sources);
        scheduler = new BackupScheduler(pool, store, executor, flags, clock, DEBOUNCE);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        pool.shutdownNow();
    }

    private void markRequired(BackupCategory category, long at) {
        clock.set(at);
        store.update(category, s -> s.withRequiredAt(Math.max(s.requiredAt(), at)));
    }

    @Test
    @DisplayName("rajada de mudanças dentro do debounce gera um único backup")
    void burstCollapsesIntoOneBackup() {
        scheduler.start();

        markRequired(BackupCategory.SETTINGS, 1_005L);
        markRequired(BackupCategory.SETTINGS, 1_010L);
        markRequired(BackupCategory.SETTINGS, 1_015L);

        await().atMost(Duration.ofSeconds(3)).until(() -> remote.putCount("SETTINGS") == 1);
        await().during(Duration.ofMillis(600)).atMost(Duration.ofSeconds(2))
                .until(() -> remote.putCount("SETTINGS") == 1);
        BackupStatus status = store.status(BackupCategory.SETTINGS);
        assertThat(status.syncedAt()).isGreaterThanOrEqualTo(1_015L);
        assertThat(status.isRequired()).isFalse();
        assertThat(remote.totalPuts()).isEqualTo(1);
    }

    @Test
    @DisplayName("nada é agendado enquanto a restauração está ativa")
    void suppressedWhileRestoring() {
        scheduler.start();
        flags.beginRestore();

        markRequired(BackupCategory.WALLET, 1_100L);

        await().during(Duration.ofMillis(700)).atMost(Duration.ofSeconds(2)).until(() -> remote.totalPuts() == 0);
        assertThat(scheduler.scheduledCategories()).isEmpty();
    }

    @Test
    @DisplayName("nada é agendado enquanto o wipe está ativo")
    void suppressedWhileWiping() {
        scheduler.start();
        flags.setWiping(true);

        markRequired(BackupCategory.ACTIVITY, 1_100L);

        await().during(Duration.ofMillis(700)).atMost(Duration.ofSeconds(2)).until(() -> remote.totalPuts() == 0);
        assertThat(scheduler.scheduledCategories()).isEmpty();
    }

    @Test
    @DisplayName("start limpa running órfão e agenda pendências existentes")
    void startReconcilesStaleRunning() {
        persistence.save(Map.of(BackupCategory.ACTIVITY, new BackupStatus(true, 100L, 900L)));
        store = new BackupStatusStore(persistence);
        build();

        scheduler.start();

        await().atMost(Duration.ofSeconds(3)).until(() -> remote.putCount("ACTIVITY") == 1);
        assertThat(store.status(BackupCategory.ACTIVITY).running()).isFalse();
        assertThat(store.status(BackupCategory.ACTIVITY).isRequired()).isFalse();
    }

    @Test
    @DisplayName("no máximo um backup por categoria em execução; pendência nova reagenda ao terminar")
    void atMostOneRunningJobPerCategory() {
        CountDownLatch gate = new CountDownLatch(1);
        remote.blockPutsUntil(gate);
        scheduler.start();

        markRequired(BackupCategory.METADATA, 1_100L);
        await().atMost(Duration.ofSeconds(3)).until(() -> store.status(BackupCategory.METADATA).running());
        markRequired(BackupCategory.METADATA, 2_000L);
        markRequired(BackupCategory.METADATA, 2_100L);
        remote.blockPutsUntil(null);
        gate.countDown();

        await().atMost(Duration.ofSeconds(3)).until(() -> remote.putCount("METADATA") == 2);
        await().atMost(Duration.ofSeconds(3)).until(() -> !store.status(BackupCategory.METADATA).isRequired());
        assertThat(remote.maxConcurrentPerKey()).isEqualTo(1);
    }

    @Test
    @DisplayName("stop cancela jobs pendentes")
    void stopCancelsPendingJobs() {
        scheduler.start();
        markRequired(BackupCategory.WIDGETS, 1_100L);
        assertThat(scheduler.scheduledCategories()).containsExactly(BackupCategory.WIDGETS);

        scheduler.stop();

        assertThat(scheduler.scheduledCategories()).isEmpty();
        assertThat(scheduler.isStarted()).isFalse();
        await().during(Duration.ofMillis(700)).atMost(Duration.ofSeconds(2)).until(() -> remote.totalPuts() == 0);
    }

    @Test
    @DisplayName("stop sem start é seguro e start é idempotente")
    void lifecycleIsIdempotent() {
        scheduler.stop();
        scheduler.start();
        scheduler.start();

        markRequired(BackupCategory.SETTINGS, 1_100L);

        await().atMost(Duration.ofSeconds(3)).until(() -> remote.putCount("SETTINGS") == 1);
        await().during(Duration.ofMillis(500)).atMost(Duration.ofSeconds(2)).until(() -> remote.putCount("SETTINGS") == 1);
    }

    @Test
    @DisplayName("categoria que falhou é retentada pela varredura")
    void reschedulePendingRetriesFailure() {
        remote.failPuts(true);
        scheduler.start();
        markRequired(BackupCategory.COUNTERPARTY_SERVICE, 1_100L);
        await().atMost(Duration.ofSeconds(3)).until(() -> remote.putCount("COUNTERPARTY_SERVICE") == 1
                && !executor.isInFlight(BackupCategory.COUNTERPARTY_SERVICE)
                && scheduler.scheduledCategories().isEmpty());
        assertThat(store.status(BackupCategory.COUNTERPARTY_SERVICE).isRequired()).isTrue();

        remote.failPuts(false);
        scheduler.reschedulePending();

        await().atMost(Duration.ofSeconds(3)).until(() -> !store.status(BackupCategory.COUNTERPARTY_SERVICE).isRequired());
        assertThat(remote.putCount("COUNTERPARTY_SERVICE")).isEqualTo(2);
        assertThat(store.status(BackupCategory.COUNTERPARTY_SERVICE).requiredAt()).isEqualTo(1_100L);
    }

    @Test
    @DisplayName("scheduleAll marca e agenda todas as categorias gerenciadas")
    void scheduleAllCoversManagedCategories() {
        scheduler.start();

        scheduler.scheduleAll();

        await().atMost(Duration.ofSeconds(3)).until(() -> remote.totalPuts() == BackupCategory.managed().size());
        assertThat(remote.contains("LIGHTNING_CONNECTIONS")).isFalse();
    }
}
