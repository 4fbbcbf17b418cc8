package com.example.walletbackup;

import com.example.walletbackup.alert.Alerts.AlertSink;
import com.example.walletbackup.backup.Backup.BackupExecutor;
import com.example.walletbackup.backup.Backup.BackupOutcome;
import com.example.walletbackup.backup.Backup.PayloadCodec;
import com.example.walletbackup.backup.BackupScheduler;
import com.example.walletbackup.config.AppConfig;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.monitor.FailureMonitor;
import com.example.walletbackup.restore.Restore.RestoreOrchestrator;
import com.example.walletbackup.restore.Restore.RestoreReport;
import com.example.walletbackup.source.ChangeBinder;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.source.DataSources.ExternalSyncSource;
import com.example.walletbackup.source.DataSources.Subscription;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.StatusStore.JsonFileStatusPersistence;
import com.example.walletbackup.status.SuppressionFlags;
import com.example.walletbackup.storage.Storage.RemoteBackupStore;
import com.example.walletbackup.storage.Storage.RemoteStoreFactory;
import com.example.walletbackup.storage.Storage.StoreIdProvider;
import com.example.walletbackup.storage.Storage.StoreIdProvider.WalletSecretSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ponto de entrada do subsistema de backup da carteira. Monta os componentes e expõe o ciclo de vida
 * (observar, restaurar, resetar) para o host.
 */
public final class WalletBackupService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WalletBackupService.class);

    private final AppConfig config;
    private final BackupStatusStore statusStore;
    private final RemoteBackupStore remoteStore;
    private final SuppressionFlags flags;
    private final ScheduledExecutorService executor;
    private final BackupExecutor backupExecutor;
    private final BackupScheduler scheduler;
    private final ChangeBinder binder;
    private final RestoreOrchestrator restoreOrchestrator;
    private final FailureMonitor failureMonitor;
    private final AtomicBoolean observing = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> periodicCheck;

    public WalletBackupService(AppConfig config,
                               BackupStatusStore statusStore,
                               RemoteBackupStore remoteStore,
                               List<CategoryDataSource> sources,
                               List<ExternalSyncSource> externalSources,
                               AlertSink alertSink,
                               SuppressionFlags flags,
                               Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
        this.remoteStore = Objects.requireNonNull(remoteStore, "remoteStore");
        this.flags = Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(clock, "clock");
        PayloadCodec codec = new PayloadCodec();
        this.backupExecutor = new BackupExecutor(statusStore, remoteStore, codec, clock, sources);
        this.restoreOrchestrator = new RestoreOrchestrator(remoteStore, statusStore, flags, codec, sources);
        this.failureMonitor = new FailureMonitor(statusStore, alertSink, clock,
                config.failedBackupThreshold(), config.alertCooldown(), config.checkInterval());

        ScheduledExecutorService pool = Executors.newScheduledThreadPool(config.workerThreads(), daemonThreads());
        try {
            this.scheduler = new BackupScheduler(pool, statusStore, backupExecutor, flags, clock, config.debounce());
            this.binder = new ChangeBinder(statusStore, flags, clock, pool, sources, externalSources);
        } catch (RuntimeException e) {
            pool.shutdownNow();
            throw e;
        }
        this.executor = pool;
    }

    /**
     * Monta o serviço a partir da configuração: status em arquivo JSON e store remoto de BACKUP_STORE.
     * O host ainda precisa chamar {@link #setupRemoteStore(int)} quando a carteira estiver disponível.
     */
    public static WalletBackupService create(AppConfig config,
                                             List<CategoryDataSource> sources,
                                             List<ExternalSyncSource> externalSources,
                                             AlertSink alertSink,
                                             WalletSecretSource walletSecrets) {
        BackupStatusStore statusStore = new BackupStatusStore(new JsonFileStatusPersistence(config.statusFile()));
        StoreIdProvider storeIds = new StoreIdProvider(config.storeIdPrefix(), walletSecrets);
        RemoteBackupStore remoteStore = RemoteStoreFactory.create(config, storeIds);
        return new WalletBackupService(config, statusStore, remoteStore, sources, externalSources,
                alertSink, new SuppressionFlags(), Clock.systemUTC());
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "wallet-backup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** Associa o store remoto à carteira em background. Falhas ficam registradas no log. */
    public CompletableFuture<Void> setupRemoteStore(int walletIndex) {
        return CompletableFuture.runAsync(() -> {
            try {
                remoteStore.setup(walletIndex);
            } catch (IOException e) {
                log.error("Falha no setup do store remoto para carteira[{}]", walletIndex, e);
                throw new UncheckedIOException(e);
            }
        }, executor);
    }

    /**
     * Liga listeners, agendador e a verificação periódica. Idempotente.
     */
    public void startObserving() {
        if (!observing.compareAndSet(false, true)) {
            return;
        }
        scheduler.start();
        binder.start();
        long interval = config.checkInterval().toMillis();
        periodicCheck = executor.scheduleWithFixedDelay(this::periodicCheck, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Observação de backups iniciada");
    }

    /** Para listeners, jobs pendentes e a verificação periódica. Seguro sem start anterior. */
    public void stopObserving() {
        if (!observing.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> check = periodicCheck;
        periodicCheck = null;
        if (check != null) {
            check.cancel(false);
        }
        binder.stop();
        scheduler.stop();
        log.info("Observação de backups encerrada");
    }

    public boolean isObserving() {
        return observing.get();
    }

    private void periodicCheck() {
        try {
            scheduler.reschedulePending();
            failureMonitor.sweep();
        } catch (RuntimeException e) {
            log.warn("Verificação periódica de backup falhou: {}", e.toString());
        }
    }

    /** Marca todas as categorias como pendentes (após criar ou restaurar a carteira). */
    public void scheduleFullBackup() {
        scheduler.scheduleAll();
    }

    /** Restauração completa em background. O futuro nunca completa com exceção. */
    public CompletableFuture<RestoreReport> performFullRestore() {
        return CompletableFuture.supplyAsync(restoreOrchestrator::restoreAll, executor);
    }

    /** Backup imediato de uma categoria, sem debounce. */
    public CompletableFuture<BackupOutcome> triggerBackup(BackupCategory category) {
        Objects.requireNonNull(category, "category");
        return CompletableFuture.supplyAsync(() -> backupExecutor.execute(category), executor);
    }

    /**
     * Wipe da carteira: para a observação, volta os status ao padrão e desfaz o setup do store remoto.
     * Mudanças emitidas durante o wipe são ignoradas.
     */
    public void reset() {
        flags.setWiping(true);
        try {
            stopObserving();
            statusStore.resetAll();
            remoteStore.reset();
        } finally {
            flags.setWiping(false);
        }
        log.info("Subsistema de backup reiniciado");
    }

    public boolean isRestoring() {
        return flags.isRestoring();
    }

    /** O valor atual é entregue na inscrição. */
    public Subscription observeRestoring(Consumer<Boolean> listener) {
        return flags.restoringChanges().subscribe(listener);
    }

    public Map<BackupCategory, BackupStatus> statuses() {
        return statusStore.snapshot();
    }

    public Subscription observeStatuses(Consumer<? super Map<BackupCategory, BackupStatus>> listener) {
        return statusStore.observe(listener);
    }

    @Override
    public void close() {
        stopObserving();
        executor.shutdownNow();
        try {
            remoteStore.close();
        } catch (Exception e) {
            log.warn("Falha ao fechar store remoto: {}", e.getMessage());
        }
    }
}
