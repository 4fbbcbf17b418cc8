package com.example.walletbackup.source;

import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.source.DataSources.ChangeSource;
import com.example.walletbackup.source.DataSources.ExternalSyncSource;
import com.example.walletbackup.source.DataSources.Subscription;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.SuppressionFlags;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liga as fontes de dados ao status: cada mudança observada marca a categoria como pendente.
 * <p>
 * A primeira emissão de cada inscrição é o valor atual e é descartada. Eventos que chegam durante
 * restore ou wipe também são descartados. A escrita do status roda no executor do subsistema
 * para não prender a thread de quem emitiu a mudança.
 */
public final class ChangeBinder {
    private static final Logger log = LoggerFactory.getLogger(ChangeBinder.class);

    private final BackupStatusStore statusStore;
    private final SuppressionFlags flags;
    private final Clock clock;
    private final Executor executor;
    private final List<CategoryDataSource> sources;
    private final List<ExternalSyncSource> externalSources;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ChangeBinder(BackupStatusStore statusStore,
                        SuppressionFlags flags,
                        Clock clock,
                        Executor executor,
                        List<CategoryDataSource> sources,
                        List<ExternalSyncSource> externalSources) {
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sources = List.copyOf(sources);
        this.externalSources = List.copyOf(externalSources);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        synchronized (subscriptions) {
            for (CategoryDataSource source : sources) {
                for (ChangeSource<?> changes : source.changeSources()) {
                    subscriptions.add(bind(source.category(), changes));
                }
            }
            for (ExternalSyncSource external : externalSources) {
                BackupCategory category = external.category();
                subscriptions.add(external.onSyncCompleted(at -> onExternalSync(category, at)));
            }
            log.debug("Iniciados {} listeners de fontes de dados", subscriptions.size());
        }
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        synchronized (subscriptions) {
            for (Subscription subscription : subscriptions) {
                subscription.close();
            }
            subscriptions.clear();
        }
        log.debug("Listeners de fontes de dados encerrados");
    }

    private Subscription bind(BackupCategory category, ChangeSource<?> changes) {
        AtomicBoolean first = new AtomicBoolean(true);
        return changes.distinctUntilChanged().subscribe(value -> {
            if (first.getAndSet(false)) {
                return;
            }
            onChange(category);
        });
    }

    private void onChange(BackupCategory category) {
        if (flags.isSuppressed()) {
            log.debug("Mudança em '{}' ignorada (restore/wipe em andamento)", category);
            return;
        }
        long now = clock.millis();
        long epoch = statusStore.epoch();
        dispatch(category, epoch, s -> s.withRequiredAt(Math.max(s.requiredAt(), now)));
    }

    private void onExternalSync(BackupCategory category, Instant completedAt) {
        if (completedAt == null || flags.isSuppressed()) {
            return;
        }
        long ts = completedAt.toEpochMilli();
        long epoch = statusStore.epoch();
        dispatch(category, epoch, s -> new BackupStatus(false, ts, ts));
    }

    /**
     * A escrita roda no executor: a supressão é verificada de novo na execução e a escrita é descartada
     * se houve wipe desde o evento.
     */
    private void dispatch(BackupCategory category, long epoch, UnaryOperator<BackupStatus> transform) {
        dispatch(() -> {
            if (flags.isSuppressed()) {
                log.debug("Atualização de '{}' descartada (restore/wipe iniciado após o evento)", category);
                return;
            }
            statusStore.updateInEpoch(epoch, category, transform)
                    .ifPresent(s -> log.trace("Status de backup atualizado: '{}' -> {}", category, s));
        });
    }

    private void dispatch(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("Falha ao atualizar status de backup: {}", e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Executor encerrado; atualização de status descartada");
        }
    }
}
