package com.example.walletbackup.backup;

import java.io.IOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.status.StatusStore.BackupStatusStore;
import com.example.walletbackup.storage.Storage.RemoteBackupStore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Agrega serviços e modelos relacionados ao envio de backups.
 */
public final class Backup {

    private Backup() {}

    /**
     * Envelope versionado gravado no store remoto. {@code data} são os bytes opacos da categoria.
     */
    public record PayloadEnvelope(@JsonProperty("version") int version,
                                  @JsonProperty("category") BackupCategory category,
                                  @JsonProperty("created_at") long createdAt,
                                  @JsonProperty("data") byte[] data) {
    }

    /** Serializa/desserializa o envelope. Não interpreta o conteúdo de {@code data}. */
    public static final class PayloadCodec {

        public static final int CURRENT_VERSION = 1;

        private final ObjectMapper mapper;

        public PayloadCodec() {
            this.mapper = new ObjectMapper();
            this.mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        }

        public byte[] wrap(BackupCategory category, long createdAt, byte[] data) throws IOException {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(data, "data");
            return mapper.writeValueAsBytes(new PayloadEnvelope(CURRENT_VERSION, category, createdAt, data));
        }

        /**
         * @throws IOException se o JSON for inválido, a versão desconhecida ou a categoria não bater
         */
        public PayloadEnvelope unwrap(BackupCategory expected, byte[] payload) throws IOException {
            Objects.requireNonNull(payload, "payload");
            PayloadEnvelope envelope = mapper.readValue(payload, PayloadEnvelope.class);
            if (envelope == null) {
                throw new IOException("Payload vazio para " + expected);
            }
            if (envelope.version() != CURRENT_VERSION) {
                throw new IOException("Versão de payload não suportada: " + envelope.version());
            }
            if (envelope.category() != expected) {
                throw new IOException("Payload de " + envelope.category() + " gravado na chave de " + expected);
            }
            if (envelope.data() == null) {
                throw new IOException("Payload sem dados para " + expected);
            }
            return envelope;
        }
    }

    /** Resultado de uma execução de backup. Nunca carrega exceção em caso de sucesso. */
    public static final class BackupOutcome {

        public enum Status { SUCCESS, FAILED, SKIPPED }

        private final BackupCategory category;
        private final Status status;
        private final long syncedAt;
        private final Throwable error;
        private final String reason;

        private BackupOutcome(BackupCategory category, Status status, long syncedAt, Throwable error, String reason) {
            this.category = Objects.requireNonNull(category, "category");
            this.status = Objects.requireNonNull(status, "status");
            this.syncedAt = syncedAt;
            this.error = error;
            this.reason = reason;
        }

        public static BackupOutcome success(BackupCategory category, long syncedAt) {
            return new BackupOutcome(category, Status.SUCCESS, syncedAt, null, null);
        }

        public static BackupOutcome failed(BackupCategory category, Throwable error) {
            return new BackupOutcome(category, Status.FAILED, 0L, Objects.requireNonNull(error, "error"), error.getMessage());
        }

        public static BackupOutcome skipped(BackupCategory category, String reason) {
            return new BackupOutcome(category, Status.SKIPPED, 0L, null, reason);
        }

        public BackupCategory category() { return category; }
        public Status status() { return status; }
        public boolean isSuccess() { return status == Status.SUCCESS; }
        public long syncedAt() { return syncedAt; }
        public Optional<Throwable> error() { return Optional.ofNullable(error); }
        public Optional<String> reason() { return Optional.ofNullable(reason); }

        @Override
        public String toString() {
            return "BackupOutcome{" + category + ", " + status + (reason != null ? ", " + reason : "") + "}";
        }
    }

    /**
     * Executa o backup de uma categoria: snapshot → envelope → put remoto → status.
     * O {@code createdAt} do envelope é o mesmo instante gravado em {@code syncedAt}.
     * <p>
     * No máximo uma execução por categoria fica em andamento; chamadas concorrentes para a mesma
     * categoria retornam SKIPPED. Nunca lança: erros viram {@link BackupOutcome#failed}.
     */
    public static final class BackupExecutor {
        private static final Logger log = LoggerFactory.getLogger(BackupExecutor.class);

        private final BackupStatusStore statusStore;
        private final RemoteBackupStore remoteStore;
        private final PayloadCodec codec;
        private final Clock clock;
        private final Map<BackupCategory, CategoryDataSource> sources;
        private final Set<BackupCategory> inFlight = ConcurrentHashMap.newKeySet();

        public BackupExecutor(BackupStatusStore statusStore,
                              RemoteBackupStore remoteStore,
                              PayloadCodec codec,
                              Clock clock,
                              Iterable<CategoryDataSource> sources) {
            this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
            this.remoteStore = Objects.requireNonNull(remoteStore, "remoteStore");
            this.codec = Objects.requireNonNull(codec, "codec");
            this.clock = Objects.requireNonNull(clock, "clock");
            Map<BackupCategory, CategoryDataSource> byCategory = new EnumMap<>(BackupCategory.class);
            for (CategoryDataSource source : sources) {
                if (source.category().externallyManaged()) {
                    throw new IllegalArgumentException("Categoria gerenciada externamente não tem fonte de dados: " + source.category());
                }
                if (byCategory.put(source.category(), source) != null) {
                    throw new IllegalArgumentException("Fonte duplicada para " + source.category());
                }
            }
            this.sources = byCategory;
        }

        public boolean isInFlight(BackupCategory category) {
            return inFlight.contains(category);
        }

        public BackupOutcome execute(BackupCategory category) {
            Objects.requireNonNull(category, "category");
            if (category.externallyManaged()) {
                return BackupOutcome.skipped(category, "gerenciada externamente");
            }
            CategoryDataSource source = sources.get(category);
            if (source == null) {
                log.warn("Nenhuma fonte de dados registrada para '{}'", category);
                return BackupOutcome.skipped(category, "sem fonte de dados");
            }
            if (!inFlight.add(category)) {
                log.debug("Backup de '{}' já em andamento", category);
                return BackupOutcome.skipped(category, "já em andamento");
            }
            try {
                return run(category, source);
            } finally {
                inFlight.remove(category);
            }
        }

        private BackupOutcome run(BackupCategory category, CategoryDataSource source) {
            log.debug("Backup iniciando para '{}'", category);
            long startedAt = clock.millis();
            // Escritas terminais são descartadas se houver wipe durante o backup.
            long epoch = statusStore.epoch();
            // Se já está pendente o requiredAt fica como está, senão a idade da pendência nunca cresceria.
            if (statusStore.updateInEpoch(epoch, category, s -> s.withRunning(true)
                    .withRequiredAt(s.isRequired() ? s.requiredAt() : startedAt)).isEmpty()) {
                return BackupOutcome.skipped(category, "status reiniciados");
            }

            try {
                byte[] data = source.snapshotBytes();
                byte[] payload = codec.wrap(category, startedAt, data);
                remoteStore.put(category.storeKey(), payload);
            } catch (IOException | RuntimeException e) {
                statusStore.updateInEpoch(epoch, category, s -> s.withRunning(false));
                log.error("Backup falhou para '{}'", category, e);
                return BackupOutcome.failed(category, e);
            }

            // syncedAt é o instante do snapshot: mudança que chegou durante o put continua pendente.
            Optional<BackupStatus> done = statusStore.updateInEpoch(epoch, category,
                    s -> s.withRunning(false).withSyncedAt(startedAt));
            if (done.isEmpty()) {
                log.info("Backup de '{}' enviado, mas os status foram reiniciados durante o envio", category);
            } else {
                log.info("Backup concluído para '{}' (syncedAt={}, pendente={})",
                        category, done.get().syncedAt(), done.get().isRequired());
            }
            return BackupOutcome.success(category, startedAt);
        }
    }
}
