package com.example.walletbackup.storage;

import com.example.walletbackup.config.AppConfig;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centraliza abstrações e backends do armazenamento remoto de backups.
 */
public final class Storage {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");

    private Storage() {}

    /**
     * Store chave-valor remoto. Uma chave por categoria, último valor vence.
     * Ausência da chave é {@link Optional#empty()}, nunca erro.
     */
    public interface RemoteBackupStore extends AutoCloseable {

        /** Associa o store à carteira. Stores em memória não precisam. */
        default void setup(int walletIndex) throws IOException {
            // default no-op
        }

        void put(String key, byte[] value) throws IOException;

        Optional<byte[]> get(String key) throws IOException;

        /** Desfaz o setup (wipe da carteira). Não apaga dados remotos. */
        default void reset() {
            // default no-op
        }

        @Override
        default void close() throws Exception {
            // default no-op
        }
    }

    static String validateKey(String key) {
        Objects.requireNonNull(key, "key");
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Chave inválida: " + key);
        }
        return key;
    }

    // ---- Store id ------------------------------------------------------------

    /**
     * Deriva o identificador do store a partir do segredo da carteira: {@code prefix + "_" + sha256hex}.
     * Resultado em cache por índice de carteira.
     */
    public static final class StoreIdProvider {
        private static final Logger log = LoggerFactory.getLogger(StoreIdProvider.class);

        /** Fonte do segredo (ex.: mnemônico + passphrase). Retorna null se a carteira não existe. */
        @FunctionalInterface
        public interface WalletSecretSource {
            String load(int walletIndex) throws IOException;
        }

        private final String prefix;
        private final WalletSecretSource secrets;
        private final Map<Integer, String> cache = new ConcurrentHashMap<>();

        public StoreIdProvider(String prefix, WalletSecretSource secrets) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            this.secrets = Objects.requireNonNull(secrets, "secrets");
        }

        public synchronized String storeId(int walletIndex) throws IOException {
            String cached = cache.get(walletIndex);
            if (cached != null) {
                return cached;
            }
            String secret = secrets.load(walletIndex);
            if (secret == null || secret.isBlank()) {
                throw new IOException("Segredo da carteira " + walletIndex + " não encontrado");
            }
            String id = prefix + "_" + sha256Hex(secret);
            cache.put(walletIndex, id);
            log.info("Store id configurado para carteira[{}]", walletIndex);
            return id;
        }

        public void clearCache(int walletIndex) {
            cache.remove(walletIndex);
        }

        private static String sha256Hex(String value) {
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 indisponível", e);
            }
        }
    }

    // ---- Base com setup único ---------------------------------------------

    /**
     * Base dos stores remotos reais: put/get aguardam o setup (com timeout) antes de falar com o backend.
     */
    public abstract static class ScopedBackupStore implements RemoteBackupStore {
        private static final Logger log = LoggerFactory.getLogger(ScopedBackupStore.class);

        private final StoreIdProvider storeIds;
        private final Duration setupTimeout;
        private volatile CompletableFuture<String> ready = new CompletableFuture<>();
        private int walletIndex;

        protected ScopedBackupStore(StoreIdProvider storeIds, Duration setupTimeout) {
            this.storeIds = Objects.requireNonNull(storeIds, "storeIds");
            this.setupTimeout = Objects.requireNonNull(setupTimeout, "setupTimeout");
        }

        @Override
        public synchronized void setup(int walletIndex) throws IOException {
            String storeId = storeIds.storeId(walletIndex);
            CompletableFuture<String> current = ready;
            if (!current.complete(storeId) && !storeId.equals(current.getNow(null))) {
                ready = CompletableFuture.completedFuture(storeId);
            }
            this.walletIndex = walletIndex;
            log.info("{} configurado para carteira[{}]", getClass().getSimpleName(), walletIndex);
        }

        @Override
        public synchronized void reset() {
            storeIds.clearCache(walletIndex);
            CompletableFuture<String> previous = ready;
            ready = new CompletableFuture<>();
            previous.completeExceptionally(new IOException("Store remoto reiniciado"));
            log.debug("{} reiniciado", getClass().getSimpleName());
        }

        @Override
        public final void put(String key, byte[] value) throws IOException {
            Objects.requireNonNull(value, "value");
            String checked = validateKey(key);
            put(awaitStoreId(), checked, value);
        }

        @Override
        public final Optional<byte[]> get(String key) throws IOException {
            String checked = validateKey(key);
            return get(awaitStoreId(), checked);
        }

        protected abstract void put(String storeId, String key, byte[] value) throws IOException;

        protected abstract Optional<byte[]> get(String storeId, String key) throws IOException;

        private String awaitStoreId() throws IOException {
            CompletableFuture<String> current = ready;
            try {
                return current.get(setupTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrompido aguardando setup do store remoto", e);
            } catch (TimeoutException e) {
                throw new IOException("Store remoto não configurado após " + setupTimeout.toSeconds() + "s", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException io) {
                    throw io;
                }
                throw new IOException("Setup do store remoto falhou", cause);
            }
        }
    }

    // ---- HTTP (serviço chave-valor versionado) ---------------------------

    /**
     * Cliente do serviço chave-valor: {@code PUT/GET {base}/{storeId}/{key}}.
     */
    public static final class HttpBackupStore extends ScopedBackupStore {
        private static final Logger log = LoggerFactory.getLogger(HttpBackupStore.class);
        private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

        private final HttpUrl baseUrl;
        private final OkHttpClient httpClient;

        public HttpBackupStore(AppConfig config, StoreIdProvider storeIds) {
            this(config.vssUrl(), storeIds, defaultClient(config.httpTimeout()), config.httpTimeout());
        }

        /** Construtor permitindo injetar um OkHttpClient (útil para testes). */
        public HttpBackupStore(String baseUrl, StoreIdProvider storeIds, OkHttpClient httpClient, Duration setupTimeout) {
            super(storeIds, setupTimeout);
            HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl"));
            if (parsed == null) {
                throw new IllegalStateException("VSS_URL inválida");
            }
            this.baseUrl = parsed;
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        }

        private static OkHttpClient defaultClient(Duration timeout) {
            return new OkHttpClient.Builder()
                    .callTimeout(timeout.multipliedBy(2))
                    .connectTimeout(timeout)
                    .readTimeout(timeout)
                    .writeTimeout(timeout)
                    .build();
        }

        @Override
        protected void put(String storeId, String key, byte[] value) throws IOException {
            Request request = new Request.Builder()
                    .url(url(storeId, key))
                    .put(RequestBody.create(value, OCTET_STREAM))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("PUT de '" + key + "' falhou: HTTP " + response.code());
                }
            }
            log.trace("PUT '{}' ok ({} bytes)", key, value.length);
        }

        @Override
        protected Optional<byte[]> get(String storeId, String key) throws IOException {
            Request request = new Request.Builder()
                    .url(url(storeId, key))
                    .get()
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() == 404) {
                    log.trace("GET '{}': ausente", key);
                    return Optional.empty();
                }
                if (!response.isSuccessful()) {
                    throw new IOException("GET de '" + key + "' falhou: HTTP " + response.code());
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new IOException("GET de '" + key + "' sem corpo");
                }
                return Optional.of(body.bytes());
            }
        }

        private HttpUrl url(String storeId, String key) {
            return baseUrl.newBuilder()
                    .addPathSegment(storeId)
                    .addPathSegment(key)
                    .build();
        }

        @Override
        public void close() {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    // ---- S3 --------------------------------------------------------------

    /** Objeto {@code {storeId}/{key}} no bucket configurado. */
    public static final class S3BackupStore extends ScopedBackupStore {
        private static final Logger log = LoggerFactory.getLogger(S3BackupStore.class);
        private final String bucket;
        private final software.amazon.awssdk.services.s3.S3Client client;

        public S3BackupStore(AppConfig config, StoreIdProvider storeIds) {
            this(config, storeIds, createClient(config));
        }

        public S3BackupStore(AppConfig config, StoreIdProvider storeIds, software.amazon.awssdk.services.s3.S3Client client) {
            super(storeIds, config.httpTimeout());
            this.bucket = config.awsBucket();
            this.client = Objects.requireNonNull(client, "client");
        }

        @Override
        protected void put(String storeId, String key, byte[] value) throws IOException {
            String objectKey = storeId + "/" + key;
            try {
                client.putObject(software.amazon.awssdk.services.s3.model.PutObjectRequest.builder()
                                .bucket(bucket).key(objectKey).contentType("application/octet-stream").build(),
                        software.amazon.awssdk.core.sync.RequestBody.fromBytes(value));
            } catch (software.amazon.awssdk.core.exception.SdkException e) {
                throw new IOException("Falha no upload de " + objectKey + ": " + e.getMessage(), e);
            }
        }

        @Override
        protected Optional<byte[]> get(String storeId, String key) throws IOException {
            String objectKey = storeId + "/" + key;
            try {
                return Optional.of(client.getObjectAsBytes(software.amazon.awssdk.services.s3.model.GetObjectRequest.builder()
                        .bucket(bucket).key(objectKey).build()).asByteArray());
            } catch (software.amazon.awssdk.services.s3.model.NoSuchKeyException e) {
                return Optional.empty();
            } catch (software.amazon.awssdk.services.s3.model.S3Exception e) {
                if (e.statusCode() == 404) return Optional.empty();
                throw new IOException("Falha ao ler " + objectKey + ": " + e.getMessage(), e);
            } catch (software.amazon.awssdk.core.exception.SdkException e) {
                throw new IOException("Falha ao ler " + objectKey + ": " + e.getMessage(), e);
            }
        }

        @Override public void close() { try { client.close(); } catch (Exception e) { log.warn("Falha ao fechar S3Client: {}", e.getMessage()); } }

        public static software.amazon.awssdk.services.s3.S3Client createClient(AppConfig config) {
            software.amazon.awssdk.services.s3.S3ClientBuilder builder = software.amazon.awssdk.services.s3.S3Client.builder()
                    .region(software.amazon.awssdk.regions.Region.of(config.awsRegion()))
                    .credentialsProvider(credentials(config));
            config.awsEndpointOverride().ifPresent(endpoint -> builder.endpointOverride(java.net.URI.create(endpoint))
                    .forcePathStyle(true));
            return builder.build();
        }

        private static software.amazon.awssdk.auth.credentials.AwsCredentialsProvider credentials(AppConfig config) {
            if (config.awsAccessKeyId().isPresent() && config.awsSecretAccessKey().isPresent()) {
                if (config.awsSessionToken().isPresent()) {
                    return software.amazon.awssdk.auth.credentials.StaticCredentialsProvider.create(
                            software.amazon.awssdk.auth.credentials.AwsSessionCredentials.create(
                                    config.awsAccessKeyId().get(), config.awsSecretAccessKey().get(), config.awsSessionToken().get()));
                }
                return software.amazon.awssdk.auth.credentials.StaticCredentialsProvider.create(
                        software.amazon.awssdk.auth.credentials.AwsBasicCredentials.create(
                                config.awsAccessKeyId().get(), config.awsSecretAccessKey().get()));
            }
            return software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider.create();
        }
    }

    // ---- Local -----------------------------------------------------------

    /** Um arquivo por chave em {@code {baseDir}/{storeId}/}. Escrita atômica via arquivo temporário. */
    public static final class LocalBackupStore extends ScopedBackupStore {
        private final Path baseDir;

        public LocalBackupStore(AppConfig config, StoreIdProvider storeIds) {
            this(Path.of(config.localStorageDir()), storeIds, config.httpTimeout());
        }

        public LocalBackupStore(Path baseDir, StoreIdProvider storeIds, Duration setupTimeout) {
            super(storeIds, setupTimeout);
            this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        }

        @Override
        protected void put(String storeId, String key, byte[] value) throws IOException {
            Path dir = baseDir.resolve(storeId);
            Files.createDirectories(dir);
            Path target = dir.resolve(key);
            Path tmp = dir.resolve(key + ".tmp");
            Files.write(tmp, value);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        @Override
        protected Optional<byte[]> get(String storeId, String key) throws IOException {
            try {
                return Optional.of(Files.readAllBytes(baseDir.resolve(storeId).resolve(key)));
            } catch (NoSuchFileException e) {
                return Optional.empty();
            }
        }
    }

    // ---- Compressão ------------------------------------------------------

    /** Decorator que comprime os payloads com Zstd antes de delegar. */
    public static final class CompressingBackupStore implements RemoteBackupStore {
        private final RemoteBackupStore delegate;
        private final int zstdLevel;

        public CompressingBackupStore(RemoteBackupStore delegate, int zstdLevel) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
            this.zstdLevel = zstdLevel;
        }

        @Override
        public void setup(int walletIndex) throws IOException {
            delegate.setup(walletIndex);
        }

        @Override
        public void put(String key, byte[] value) throws IOException {
            Objects.requireNonNull(value, "value");
            try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
                 ZstdOutputStream zstd = new ZstdOutputStream(baos, zstdLevel)) {
                zstd.write(value);
                zstd.close();
                delegate.put(key, baos.toByteArray());
            }
        }

        @Override
        public Optional<byte[]> get(String key) throws IOException {
            Optional<byte[]> compressed = delegate.get(key);
            if (compressed.isEmpty()) {
                return Optional.empty();
            }
            try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed.get());
                 ZstdInputStream zstd = new ZstdInputStream(bais)) {
                return Optional.of(zstd.readAllBytes());
            }
        }

        @Override
        public void reset() {
            delegate.reset();
        }

        @Override
        public void close() throws Exception {
            delegate.close();
        }
    }

    // ---- Seleção do backend ---------------------------------------------

    public enum StorageBackend {
        HTTP, S3, LOCAL;

        public static StorageBackend fromConfig(AppConfig config) {
            return valueOf(config.storageBackend().toUpperCase(Locale.ROOT));
        }
    }

    /** Constrói o store configurado em BACKUP_STORE, com compressão opcional. */
    public static final class RemoteStoreFactory {
        private static final Logger log = LoggerFactory.getLogger(RemoteStoreFactory.class);

        private RemoteStoreFactory() {}

        public static RemoteBackupStore create(AppConfig config, StoreIdProvider storeIds) {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(storeIds, "storeIds");
            StorageBackend backend = StorageBackend.fromConfig(config);
            RemoteBackupStore store;
            if (backend == StorageBackend.S3) {
                store = new S3BackupStore(config, storeIds);
            } else if (backend == StorageBackend.LOCAL) {
                store = new LocalBackupStore(config, storeIds);
            } else {
                store = new HttpBackupStore(config, storeIds);
            }
            log.info("Store remoto: {} (compressão={})", backend, config.compressionEnabled());
            return config.compressionEnabled() ? new CompressingBackupStore(store, config.zstdLevel()) : store;
        }
    }
}
