package com.example.walletbackup.backup;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.walletbackup.backup.Backup.BackupExecutor;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.Subscription;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.SuppressionFlags;

/**
 * Agenda backups por categoria com debounce.
 * <p>
 * Cada categoria tem no máximo um job: um novo gatilho cancela o job pendente e reinicia a janela.
 * O agendador reage apenas quando o par (syncedAt, requiredAt) de uma categoria muda, então as
 * transições de {@code running} feitas pelo executor não reagendam nada.
 * <p>
 * Ordem de locks: store → agendador. Nenhum método segura o monitor deste objeto enquanto chama o store.
 */
public final class BackupScheduler {
    private static final Logger log = LoggerFactory.getLogger(BackupScheduler.class);

    private final ScheduledExecutorService executor;
    private final BackupStatusStore statusStore;
    private final BackupExecutor backupExecutor;
    private final SuppressionFlags flags;
    private final Clock clock;
    private final Duration debounce;

    // guardados por this
    private final Map<BackupCategory, ScheduledJob> jobs = new EnumMap<>(BackupCategory.class);
    private final Map<BackupCategory, TriggerKey> lastSeen = new EnumMap<>(BackupCategory.class);
    private Subscription statusSubscription;
    private long nextJobId;

    public BackupScheduler(ScheduledExecutorService executor,
                           BackupStatusStore statusStore,
                           BackupExecutor backupExecutor,
                           SuppressionFlags flags,
                           Clock clock,
                           Duration debounce) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
        this.backupExecutor = Objects.requireNonNull(backupExecutor, "backupExecutor");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
    }

    /**
     * Limpa flags {@code running} órfãs e passa a observar o store. Idempotente.
     * O mapa reemitido na inscrição agenda as categorias que já estavam pendentes.
     */
    public void start() {
        synchronized (this) {
            if (statusSubscription != null) {
                return;
            }
            // reserva o slot antes de soltar o monitor; substituído logo abaixo
            statusSubscription = () -> { };
        }
        reconcileStaleRunning();
        Subscription subscription = statusStore.observe(this::onStatuses);
        boolean stoppedMeanwhile;
        synchronized (this) {
            stoppedMeanwhile = statusSubscription == null;
            if (!stoppedMeanwhile) {
                statusSubscription = subscription;
            }
        }
        if (stoppedMeanwhile) {
            subscription.close();
            return;
        }
        log.debug("Agendador de backup iniciado (debounce={}ms)", debounce.toMillis());
    }

    /** Cancela jobs pendentes e em andamento. Seguro mesmo sem start(). */
    public void stop() {
        Subscription subscription;
        synchronized (this) {
            subscription = statusSubscription;
            statusSubscription = null;
            for (ScheduledJob job : jobs.values()) {
                job.future.cancel(true);
            }
            jobs.clear();
            lastSeen.clear();
        }
        if (subscription != null) {
            subscription.close();
            log.debug("Agendador de backup parado");
        }
    }

    /**
     * Marca todas as categorias gerenciadas como pendentes; o observador agenda cada uma.
     * Usado após criar ou restaurar a carteira.
     */
    public void scheduleAll() {
        long now = clock.millis();
        for (BackupCategory category : BackupCategory.managed()) {
            statusStore.update(category, s -> s.withRequiredAt(Math.max(now, s.syncedAt() + 1)));
        }
        log.debug("Backup completo solicitado para {} categorias", BackupCategory.managed().size());
    }

    /**
     * Reagenda categorias pendentes que ficaram sem job (ex.: falha anterior). Chamado pela varredura periódica.
     */
    public void reschedulePending() {
        if (!isStarted()) {
            return;
        }
        Map<BackupCategory, BackupStatus> statuses = statusStore.snapshot();
        for (BackupCategory category : BackupCategory.managed()) {
            BackupStatus status = statuses.get(category);
            if (!isEligible(status) || backupExecutor.isInFlight(category)) {
                continue;
            }
            synchronized (this) {
                if (!jobs.containsKey(category)) {
                    log.debug("Nova tentativa de backup para '{}'", category);
                    scheduleLocked(category);
                }
            }
        }
    }

    public synchronized boolean isStarted() {
        return statusSubscription != null;
    }

    /** Categorias com job agendado ou em execução. */
    public synchronized Set<BackupCategory> scheduledCategories() {
        return jobs.isEmpty() ? EnumSet.noneOf(BackupCategory.class) : EnumSet.copyOf(jobs.keySet());
    }

    private void reconcileStaleRunning() {
        for (Map.Entry<BackupCategory, BackupStatus> entry : statusStore.snapshot().entrySet()) {
            BackupCategory category = entry.getKey();
            if (!entry.getValue().running() || backupExecutor.isInFlight(category) || hasJob(category)) {
                continue;
            }
            statusStore.update(category, s -> s.withRunning(false));
            log.warn("Flag running órfã limpa para '{}'", category);
        }
    }

    private synchronized boolean hasJob(BackupCategory category) {
        return jobs.containsKey(category);
    }

    private void onStatuses(Map<BackupCategory, BackupStatus> statuses) {
        for (BackupCategory category : BackupCategory.managed()) {
            BackupStatus status = statuses.get(category);
            TriggerKey key = new TriggerKey(status.syncedAt(), status.requiredAt());
            synchronized (this) {
                if (statusSubscription == null) {
                    return;
                }
                TriggerKey previous = lastSeen.put(category, key);
                if (key.equals(previous)) {
                    continue;
                }
                if (isEligible(status)) {
                    scheduleLocked(category);
                }
            }
        }
    }

    private boolean isEligible(BackupStatus status) {
        return status.isRequired() && !status.running() && !flags.isSuppressed();
    }

    // chamado com o monitor de this
    private void scheduleLocked(BackupCategory category) {
        ScheduledJob existing = jobs.remove(category);
        if (existing != null) {
            existing.future.cancel(false);
        }
        long id = ++nextJobId;
        try {
            ScheduledFuture<?> future = executor.schedule(() -> runJob(category, id),
                    debounce.toMillis(), TimeUnit.MILLISECONDS);
            jobs.put(category, new ScheduledJob(id, future));
            log.trace("Backup agendado para '{}' (job {})", category, id);
        } catch (RejectedExecutionException e) {
            log.debug("Executor encerrado; backup de '{}' não agendado", category);
        }
    }

    private void runJob(BackupCategory category, long id) {
        try {
            BackupStatus status = statusStore.status(category);
            if (isEligible(status)) {
                backupExecutor.execute(category);
            } else {
                log.debug("Backup de '{}' não é mais necessário", category);
            }
        } catch (RuntimeException e) {
            log.error("Job de backup falhou para '{}'", category, e);
        } finally {
            synchronized (this) {
                ScheduledJob current = jobs.get(category);
                if (current != null && current.id == id) {
                    jobs.remove(category);
                }
            }
        }
    }

    private static final class ScheduledJob {
        private final long id;
        private final ScheduledFuture<?> future;

        private ScheduledJob(long id, ScheduledFuture<?> future) {
            this.id = id;
            this.future = future;
        }
    }

    private record TriggerKey(long syncedAt, long requiredAt) {}
}
