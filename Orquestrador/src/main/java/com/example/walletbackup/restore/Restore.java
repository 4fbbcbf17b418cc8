package com.example.walletbackup.restore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.walletbackup.backup.Backup.PayloadCodec;
import com.example.walletbackup.backup.Backup.PayloadEnvelope;
import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.status.SuppressionFlags;
import com.example.walletbackup.storage.Storage.RemoteBackupStore;

/**
 * Agrega as classes do fluxo de restauração completa.
 * <p>
 * Inclui:
 * 1. CategoryRestore: resultado de uma categoria.
 * 2. RestoreReport: resultado agregado.
 * 3. RestoreOrchestrator: baixa e aplica cada categoria em ordem fixa, isolando falhas.
 */
public final class Restore {

    private Restore() {}

    /** Resultado da restauração de uma categoria. */
    public static final class CategoryRestore {

        public enum Outcome { RESTORED, NOT_FOUND, FAILED, SKIPPED }

        private final BackupCategory category;
        private final Outcome outcome;
        private final long createdAt;
        private final Throwable error;

        private CategoryRestore(BackupCategory category, Outcome outcome, long createdAt, Throwable error) {
            this.category = Objects.requireNonNull(category, "category");
            this.outcome = Objects.requireNonNull(outcome, "outcome");
            this.createdAt = createdAt;
            this.error = error;
        }

        static CategoryRestore restored(BackupCategory category, long createdAt) {
            return new CategoryRestore(category, Outcome.RESTORED, createdAt, null);
        }

        static CategoryRestore notFound(BackupCategory category) {
            return new CategoryRestore(category, Outcome.NOT_FOUND, 0L, null);
        }

        static CategoryRestore failed(BackupCategory category, Throwable error) {
            return new CategoryRestore(category, Outcome.FAILED, 0L, error);
        }

        static CategoryRestore skipped(BackupCategory category) {
            return new CategoryRestore(category, Outcome.SKIPPED, 0L, null);
        }

        public BackupCategory category() { return category; }
        public Outcome outcome() { return outcome; }
        /** createdAt do payload aplicado; 0 se nada foi aplicado. */
        public long createdAt() { return createdAt; }
        public Optional<Throwable> error() { return Optional.ofNullable(error); }

        @Override
        public String toString() {
            return category + "=" + outcome;
        }
    }

    /**
     * Relatório final. {@link #success()} só é falso quando um erro inesperado escapou do
     * isolamento por categoria.
     */
    public static final class RestoreReport {
        private final List<CategoryRestore> categories;
        private final Throwable error;

        RestoreReport(List<CategoryRestore> categories, Throwable error) {
            this.categories = Collections.unmodifiableList(List.copyOf(categories));
            this.error = error;
        }

        public boolean success() { return error == null; }
        public Optional<Throwable> error() { return Optional.ofNullable(error); }
        public List<CategoryRestore> categories() { return categories; }

        public Map<BackupCategory, CategoryRestore.Outcome> outcomes() {
            Map<BackupCategory, CategoryRestore.Outcome> map = new EnumMap<>(BackupCategory.class);
            categories.forEach(c -> map.put(c.category(), c.outcome()));
            return map;
        }

        public long count(CategoryRestore.Outcome outcome) {
            return categories.stream().filter(c -> c.outcome() == outcome).count();
        }

        @Override
        public String toString() {
            return "RestoreReport{success=" + success() + ", categories=" + categories + "}";
        }
    }

    /**
     * Restaura todas as categorias a partir do último backup remoto.
     * <p>
     * Roda uma vez, cedo no desbloqueio da carteira, antes do agendador. Enquanto roda,
     * a flag de restore suprime marcação e agendamento. Categorias são processadas em sequência,
     * na ordem de {@link BackupCategory#restoreOrder()}.
     */
    public static final class RestoreOrchestrator {
        private static final Logger log = LoggerFactory.getLogger(RestoreOrchestrator.class);

        private final RemoteBackupStore remoteStore;
        private final BackupStatusStore statusStore;
        private final SuppressionFlags flags;
        private final PayloadCodec codec;
        private final Map<BackupCategory, CategoryDataSource> sources;

        public RestoreOrchestrator(RemoteBackupStore remoteStore,
                                   BackupStatusStore statusStore,
                                   SuppressionFlags flags,
                                   PayloadCodec codec,
                                   Iterable<CategoryDataSource> sources) {
            this.remoteStore = Objects.requireNonNull(remoteStore, "remoteStore");
            this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
            this.flags = Objects.requireNonNull(flags, "flags");
            this.codec = Objects.requireNonNull(codec, "codec");
            Map<BackupCategory, CategoryDataSource> byCategory = new EnumMap<>(BackupCategory.class);
            for (CategoryDataSource source : sources) {
                byCategory.put(source.category(), source);
            }
            this.sources = byCategory;
        }

        public RestoreReport restoreAll() {
            if (!flags.beginRestore()) {
                log.warn("Restauração completa ignorada: já existe uma em andamento");
                return new RestoreReport(List.of(), new IllegalStateException("Restauração já em andamento"));
            }
            log.debug("Restauração completa iniciando");
            List<CategoryRestore> results = new ArrayList<>();
            try {
                for (BackupCategory category : BackupCategory.restoreOrder()) {
                    results.add(restoreCategory(category));
                }
                RestoreReport report = new RestoreReport(results, null);
                log.info("Restauração completa concluída: restauradas={}, ausentes={}, falhas={}",
                        report.count(CategoryRestore.Outcome.RESTORED),
                        report.count(CategoryRestore.Outcome.NOT_FOUND),
                        report.count(CategoryRestore.Outcome.FAILED));
                return report;
            } catch (RuntimeException e) {
                log.warn("Erro inesperado na restauração completa", e);
                return new RestoreReport(results, e);
            } finally {
                flags.endRestore();
            }
        }

        private CategoryRestore restoreCategory(BackupCategory category) {
            CategoryDataSource source = sources.get(category);
            if (source == null) {
                log.debug("Sem fonte de dados para '{}', restauração ignorada", category);
                return CategoryRestore.skipped(category);
            }

            Optional<byte[]> payload;
            try {
                payload = remoteStore.get(category.storeKey());
            } catch (IOException | RuntimeException e) {
                log.warn("Falha ao buscar backup de '{}': {}", category, e.toString());
                return CategoryRestore.failed(category, e);
            }
            if (payload.isEmpty()) {
                log.warn("Nenhum backup remoto para '{}'", category);
                return CategoryRestore.notFound(category);
            }

            PayloadEnvelope envelope;
            try {
                envelope = codec.unwrap(category, payload.get());
                source.applyBytes(envelope.data());
            } catch (IOException | RuntimeException e) {
                log.warn("Falha ao restaurar '{}': {}", category, e.toString());
                return CategoryRestore.failed(category, e);
            }

            long createdAt = envelope.createdAt();
            statusStore.update(category, s -> new BackupStatus(false, createdAt, createdAt));
            log.info("Restauração concluída para '{}' (createdAt={})", category, createdAt);
            return CategoryRestore.restored(category, createdAt);
        }
    }
}
