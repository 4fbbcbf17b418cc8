package com.example.walletbackup.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Carrega, valida e expõe as configurações do orquestrador de backup.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar assim que possível).
 * - Precedência previsível: overrides > variáveis de ambiente > system properties > .env.
 * - Getters tipados com limites, para que valores absurdos não travem o agendador.
 * - Sem vazamento de segredos em logs (toString() sanitizado).
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Janela de debounce (ms) entre a última mudança e o envio do backup. */
    public static final String BACKUP_DEBOUNCE_MS = "BACKUP_DEBOUNCE_MS";
    /** Período (ms) da varredura de falhas e de novas tentativas. */
    public static final String BACKUP_CHECK_INTERVAL_MS = "BACKUP_CHECK_INTERVAL_MS";
    /** Tempo (ms) pendente a partir do qual uma categoria é considerada com falha. */
    public static final String BACKUP_FAILED_THRESHOLD_MS = "BACKUP_FAILED_THRESHOLD_MS";
    /** Intervalo mínimo (ms) entre dois alertas de falha. */
    public static final String BACKUP_ALERT_COOLDOWN_MS = "BACKUP_ALERT_COOLDOWN_MS";
    /** Threads do pool agendado do subsistema. */
    public static final String BACKUP_WORKER_THREADS = "BACKUP_WORKER_THREADS";
    /** Arquivo JSON com o status persistido de cada categoria. */
    public static final String BACKUP_STATUS_FILE = "BACKUP_STATUS_FILE";

    /** Backend remoto: "http" (padrão), "s3" ou "local". */
    public static final String BACKUP_STORE = "BACKUP_STORE";
    /** URL base do serviço chave-valor versionado (obrigatória para http). */
    public static final String VSS_URL = "VSS_URL";
    /** Prefixo usado na derivação do store id. */
    public static final String VSS_STORE_ID_PREFIX = "VSS_STORE_ID_PREFIX";
    /** Timeout (s) de conexão/leitura do cliente HTTP. */
    public static final String BACKUP_HTTP_TIMEOUT_SECONDS = "BACKUP_HTTP_TIMEOUT_SECONDS";

    /** Nome do bucket S3 usado como destino. */
    public static final String AWS_S3_BUCKET = "AWS_S3_BUCKET";
    /** Região do S3 (ex.: us-east-1). Validada por regex. */
    public static final String AWS_S3_REGION = "AWS_S3_REGION";
    /** Endpoint alternativo do S3 (MinIO, Wasabi, etc.). */
    public static final String AWS_S3_ENDPOINT = "AWS_S3_ENDPOINT";
    /** Credenciais AWS opcionais. NÃO logar. */
    public static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String AWS_SESSION_TOKEN = "AWS_SESSION_TOKEN";

    /** Diretório base quando BACKUP_STORE=local. */
    public static final String LOCAL_STORAGE_DIR = "LOCAL_STORAGE_DIR";

    /** Liga/desliga a compressão Zstd dos payloads. */
    public static final String BACKUP_COMPRESSION = "BACKUP_COMPRESSION";
    /** Nível do Zstd (-19..22). */
    public static final String ZSTD_LEVEL = "BACKUP_ZSTD_LEVEL";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes:
     * 1) Variáveis de ambiente
     * 2) System properties (java -Dchave=valor), apenas chaves ausentes
     * 3) Arquivo .env (se existir), apenas chaves ausentes
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>(System.getenv());

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.putIfAbsent(String.valueOf(k), String.valueOf(v));
            }
        });

        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor obrigatório; lança IllegalStateException se ausente.
     */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= AGENDAMENTO =======

    /** Debounce do agendador. Limites [0, 10 min]. Padrão 5s. */
    public Duration debounce() {
        return Duration.ofMillis(longConfig(BACKUP_DEBOUNCE_MS, 5_000L, 0L, 600_000L));
    }

    /** Período da varredura de falhas. Limites [1s, 1h]. Padrão 1 min. */
    public Duration checkInterval() {
        return Duration.ofMillis(longConfig(BACKUP_CHECK_INTERVAL_MS, 60_000L, 1_000L, 3_600_000L));
    }

    /** Tempo pendente para considerar falha. Mínimo 1s. Padrão 30 min. */
    public Duration failedBackupThreshold() {
        return Duration.ofMillis(longConfig(BACKUP_FAILED_THRESHOLD_MS, 1_800_000L, 1_000L, Long.MAX_VALUE));
    }

    /** Intervalo mínimo entre alertas. Padrão 10 min. */
    public Duration alertCooldown() {
        return Duration.ofMillis(longConfig(BACKUP_ALERT_COOLDOWN_MS, 600_000L, 0L, Long.MAX_VALUE));
    }

    /** Tamanho do pool agendado. Limites [1, 32]. */
    public int workerThreads() {
        return intConfig(BACKUP_WORKER_THREADS, 4, 1, 32);
    }

    /**
     * Arquivo de status. Padrão: $HOME/.walletbackup/backup-status.json
     */
    public Path statusFile() {
        return find(BACKUP_STATUS_FILE)
                .map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("user.home"), ".walletbackup", "backup-status.json"));
    }

    // ======= STORAGE REMOTO =======

    /**
     * Backend remoto: "http", "s3" ou "local". Qualquer outro valor falha cedo.
     */
    public String storageBackend() {
        String v = getOrDefault(BACKUP_STORE, "http").trim().toLowerCase(Locale.ROOT);
        if (!v.equals("http") && !v.equals("s3") && !v.equals("local")) {
            throw new IllegalStateException("BACKUP_STORE inválido: use 'http', 's3' ou 'local'");
        }
        return v;
    }

    /**
     * URL do serviço chave-valor: exige http(s) e remove "/" final.
     */
    public String vssUrl() {
        String raw = require(VSS_URL).trim();
        if (!raw.startsWith("http://") && !raw.startsWith("https://")) {
            throw new IllegalStateException("VSS_URL deve começar com http/https");
        }
        return raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
    }

    public String storeIdPrefix() {
        return getOrDefault(VSS_STORE_ID_PREFIX, "wallet_backup");
    }

    /** Timeout do cliente HTTP. Limites [1, 300]. Padrão 30s. */
    public Duration httpTimeout() {
        return Duration.ofSeconds(longConfig(BACKUP_HTTP_TIMEOUT_SECONDS, 30L, 1L, 300L));
    }

    public String awsBucket() {
        return require(AWS_S3_BUCKET);
    }

    /**
     * Região AWS validada por regex (ex.: us-east-1).
     */
    public String awsRegion() {
        String r = getOrDefault(AWS_S3_REGION, "us-east-1").trim().toLowerCase(Locale.ROOT);
        if (!r.matches("^[a-z]{2}-[a-z]+-\\d+$")) {
            throw new IllegalStateException("AWS_S3_REGION inválida: " + r);
        }
        return r;
    }

    public Optional<String> awsEndpointOverride() {
        return find(AWS_S3_ENDPOINT);
    }

    /** Credenciais opcionais (NÃO logar). */
    public Optional<String> awsAccessKeyId() { return find(AWS_ACCESS_KEY_ID); }
    public Optional<String> awsSecretAccessKey() { return find(AWS_SECRET_ACCESS_KEY); }
    public Optional<String> awsSessionToken() { return find(AWS_SESSION_TOKEN); }

    /**
     * Diretório base quando BACKUP_STORE=local. Padrão: $HOME/walletbackup-local
     */
    public String localStorageDir() {
        return find(LOCAL_STORAGE_DIR)
                .orElseGet(() -> System.getProperty("user.home") + "/walletbackup-local");
    }

    public boolean compressionEnabled() {
        return bool(BACKUP_COMPRESSION, true);
    }

    /** Nível de compressão Zstd: -19..22. Padrão 3. */
    public int zstdLevel() {
        return intConfig(ZSTD_LEVEL, 3, -19, 22);
    }

    // ======= HELPERS TIPADOS =======

    /**
     * Flag booleana tolerante: "true/1/yes" (case-insensitive) → true; senão, false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    /**
     * Representação segura para logs: não inclui credenciais, só "set/unset".
     */
    @Override
    public String toString() {
        String backend = safe(this::storageBackend);
        String vss = safe(() -> find(VSS_URL).orElse("unset"));
        String bucket = safe(() -> find(AWS_S3_BUCKET).orElse("unset"));

        return "AppConfig{" +
                "store=" + backend +
                ", vssUrl=" + vss +
                ", bucket=" + bucket +
                ", debounceMs=" + debounce().toMillis() +
                ", checkIntervalMs=" + checkInterval().toMillis() +
                ", workers=" + workerThreads() +
                ", compression=" + compressionEnabled() +
                ", zstd=" + zstdLevel() +
                ", awsCreds=" + (awsAccessKeyId().isPresent() ? "set" : "unset") +
                "}";
    }

    /** Helper para não explodir toString() caso getters lancem. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
