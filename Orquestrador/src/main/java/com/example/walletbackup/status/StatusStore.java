package com.example.walletbackup.status;

import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.model.BackupStatus;
import com.example.walletbackup.source.DataSources.Subscription;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agrega o armazenamento observável do status de backup por categoria.
 */
public final class StatusStore {

    private StatusStore() {}

    /** Persistência do mapa de status. */
    public interface StatusPersistence {

        Map<BackupCategory, BackupStatus> load() throws IOException;

        void save(Map<BackupCategory, BackupStatus> statuses) throws IOException;
    }

    /** Sem disco; usado em testes e em hosts que persistem por conta própria. */
    public static final class InMemoryStatusPersistence implements StatusPersistence {
        private volatile Map<BackupCategory, BackupStatus> saved = Map.of();

        @Override
        public Map<BackupCategory, BackupStatus> load() {
            return saved;
        }

        @Override
        public void save(Map<BackupCategory, BackupStatus> statuses) {
            saved = Map.copyOf(statuses);
        }
    }

    /**
     * Persiste o mapa em JSON. A escrita vai para um arquivo temporário e depois é movida por cima
     * do original, para que um crash no meio não deixe JSON truncado.
     */
    public static final class JsonFileStatusPersistence implements StatusPersistence {
        private static final Logger log = LoggerFactory.getLogger(JsonFileStatusPersistence.class);
        private static final TypeReference<Map<String, BackupStatus>> TYPE = new TypeReference<>() {};

        private final Path file;
        private final ObjectMapper mapper;

        public JsonFileStatusPersistence(Path file) {
            this.file = Objects.requireNonNull(file, "file");
            this.mapper = new ObjectMapper();
            this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
            this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        }

        @Override
        public Map<BackupCategory, BackupStatus> load() throws IOException {
            if (!Files.exists(file)) {
                return Map.of();
            }
            Map<String, BackupStatus> raw;
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                raw = mapper.readValue(reader, TYPE);
            }
            Map<BackupCategory, BackupStatus> result = new EnumMap<>(BackupCategory.class);
            if (raw == null) {
                return result;
            }
            raw.forEach((name, status) -> {
                try {
                    if (status != null) {
                        result.put(BackupCategory.valueOf(name), status);
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Categoria desconhecida ignorada em {}: {}", file, name);
                }
            });
            return result;
        }

        @Override
        public void save(Map<BackupCategory, BackupStatus> statuses) throws IOException {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Map<String, BackupStatus> raw = new LinkedHashMap<>();
            statuses.forEach((category, status) -> raw.put(category.name(), status));

            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), raw);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("ATOMIC_MOVE indisponível em {}, usando move simples", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    /**
     * Mapa categoria → status, persistido e observável. {@link #update} é o único ponto de escrita
     * e é serializado, então chamadores concorrentes não perdem atualizações.
     * <p>
     * Observadores são notificados dentro da seção crítica, na ordem das escritas; não devem bloquear.
     */
    public static final class BackupStatusStore {
        private static final Logger log = LoggerFactory.getLogger(BackupStatusStore.class);

        private final Object lock = new Object();
        private final StatusPersistence persistence;
        private final List<Consumer<? super Map<BackupCategory, BackupStatus>>> observers = new CopyOnWriteArrayList<>();
        private Map<BackupCategory, BackupStatus> current;
        private long epoch;

        public BackupStatusStore(StatusPersistence persistence) {
            this.persistence = Objects.requireNonNull(persistence, "persistence");
            this.current = withDefaults(loadOrEmpty());
        }

        public Map<BackupCategory, BackupStatus> snapshot() {
            synchronized (lock) {
                return current;
            }
        }

        public BackupStatus status(BackupCategory category) {
            Objects.requireNonNull(category, "category");
            synchronized (lock) {
                return current.get(category);
            }
        }

        /**
         * Inscreve um observador. O mapa atual é entregue imediatamente.
         */
        public Subscription observe(Consumer<? super Map<BackupCategory, BackupStatus>> observer) {
            Objects.requireNonNull(observer, "observer");
            synchronized (lock) {
                observers.add(observer);
                deliver(observer, current);
            }
            return () -> observers.remove(observer);
        }

        /**
         * Leitura-modificação-escrita atômica do status de uma categoria.
         * Se a transformação não muda nada, não há persistência nem emissão.
         *
         * @return o status resultante
         */
        public BackupStatus update(BackupCategory category, UnaryOperator<BackupStatus> transform) {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(transform, "transform");
            synchronized (lock) {
                BackupStatus previous = current.get(category);
                BackupStatus next = Objects.requireNonNull(transform.apply(previous), "transform retornou null");
                if (next.equals(previous)) {
                    return previous;
                }
                Map<BackupCategory, BackupStatus> updated = new EnumMap<>(current);
                updated.put(category, next);
                commit(Collections.unmodifiableMap(updated));
                return next;
            }
        }

        /**
         * Geração atual dos status. Muda a cada {@link #resetAll()}, o que permite descartar escritas
         * iniciadas antes de um wipe.
         */
        public long epoch() {
            synchronized (lock) {
                return epoch;
            }
        }

        /**
         * Como {@link #update}, mas só aplica se nenhum {@link #resetAll()} ocorreu desde {@code expectedEpoch}.
         *
         * @return o status resultante, ou vazio se a escrita foi descartada
         */
        public Optional<BackupStatus> updateInEpoch(long expectedEpoch, BackupCategory category,
                                                    UnaryOperator<BackupStatus> transform) {
            synchronized (lock) {
                if (epoch != expectedEpoch) {
                    log.debug("Escrita de status para '{}' descartada: status reiniciados depois do início", category);
                    return Optional.empty();
                }
                return Optional.of(update(category, transform));
            }
        }

        /** Volta todas as categorias ao status padrão (wipe da carteira). */
        public void resetAll() {
            synchronized (lock) {
                epoch++;
                commit(withDefaults(Map.of()));
            }
            log.info("Status de backup reiniciado para todas as categorias");
        }

        private void commit(Map<BackupCategory, BackupStatus> updated) {
            current = updated;
            try {
                persistence.save(updated);
            } catch (IOException e) {
                log.warn("Falha ao persistir status de backup (mantido em memória): {}", e.toString());
            }
            for (Consumer<? super Map<BackupCategory, BackupStatus>> observer : observers) {
                deliver(observer, updated);
            }
        }

        private void deliver(Consumer<? super Map<BackupCategory, BackupStatus>> observer,
                             Map<BackupCategory, BackupStatus> statuses) {
            try {
                observer.accept(statuses);
            } catch (RuntimeException e) {
                log.warn("Observador de status lançou exceção: {}", e.toString());
            }
        }

        private Map<BackupCategory, BackupStatus> loadOrEmpty() {
            try {
                return persistence.load();
            } catch (IOException e) {
                log.warn("Falha ao carregar status de backup persistido, usando padrão: {}", e.toString());
                return Map.of();
            }
        }

        private static Map<BackupCategory, BackupStatus> withDefaults(Map<BackupCategory, BackupStatus> loaded) {
            Map<BackupCategory, BackupStatus> map = new EnumMap<>(BackupCategory.class);
            for (BackupCategory category : BackupCategory.values()) {
                map.put(category, loaded.getOrDefault(category, BackupStatus.DEFAULT));
            }
            return Collections.unmodifiableMap(map);
        }
    }
}
