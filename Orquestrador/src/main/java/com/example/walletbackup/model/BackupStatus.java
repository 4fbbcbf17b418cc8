package com.example.walletbackup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Status de backup de uma categoria. Imutável; use os métodos {@code with*} para derivar.
 * Timestamps em epoch millis, 0 quando nunca ocorreu.
 */
public final class BackupStatus {

    public static final BackupStatus DEFAULT = new BackupStatus(false, 0L, 0L);

    private final boolean running;
    private final long syncedAt;
    private final long requiredAt;

    @JsonCreator
    public BackupStatus(@JsonProperty("running") boolean running,
                        @JsonProperty("synced_at") long syncedAt,
                        @JsonProperty("required_at") long requiredAt) {
        this.running = running;
        this.syncedAt = syncedAt;
        this.requiredAt = requiredAt;
    }

    @JsonProperty("running")
    public boolean running() { return running; }

    @JsonProperty("synced_at")
    public long syncedAt() { return syncedAt; }

    @JsonProperty("required_at")
    public long requiredAt() { return requiredAt; }

    /** Pendente: marcada como alterada depois do último envio bem-sucedido. */
    @JsonIgnore
    public boolean isRequired() {
        return requiredAt > syncedAt;
    }

    public BackupStatus withRunning(boolean value) {
        return new BackupStatus(value, syncedAt, requiredAt);
    }

    public BackupStatus withSyncedAt(long value) {
        return new BackupStatus(running, value, requiredAt);
    }

    public BackupStatus withRequiredAt(long value) {
        return new BackupStatus(running, syncedAt, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BackupStatus)) return false;
        BackupStatus other = (BackupStatus) o;
        return running == other.running && syncedAt == other.syncedAt && requiredAt == other.requiredAt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(running, syncedAt, requiredAt);
    }

    @Override
    public String toString() {
        return "BackupStatus{running=" + running + ", syncedAt=" + syncedAt + ", requiredAt=" + requiredAt + "}";
    }
}
