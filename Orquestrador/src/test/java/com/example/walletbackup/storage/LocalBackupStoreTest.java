package com.example.walletbackup.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.walletbackup.storage.Storage.LocalBackupStore;
import com.example.walletbackup.storage.Storage.StoreIdProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LocalBackupStore")
class LocalBackupStoreTest {

    @TempDir
    Path dir;

    private StoreIdProvider storeIds;
    private LocalBackupStore store;

    @BeforeEach
    void setUp() {
        storeIds = new StoreIdProvider("test", index -> "semente " + index);
        store = new LocalBackupStore(dir, storeIds, Duration.ofMillis(100));
    }

    @Test
    @DisplayName("put sobrescreve e get devolve o último valor")
    void lastWriteWins() throws IOException {
        store.setup(0);

        store.put("SETTINGS", "v1".getBytes(StandardCharsets.UTF_8));
        store.put("SETTINGS", "v2".getBytes(StandardCharsets.UTF_8));

        assertThat(store.get("SETTINGS")).hasValueSatisfying(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("v2"));
        Path storeDir = dir.resolve(storeIds.storeId(0));
        assertThat(storeDir.resolve("SETTINGS")).exists();
        assertThat(storeDir.resolve("SETTINGS.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("chave ausente é vazio, não erro")
    void missingKeyIsEmpty() throws IOException {
        store.setup(0);

        assertThat(store.get("WALLET")).isEmpty();
    }

    @Test
    @DisplayName("chave com separador de caminho é rejeitada")
    void rejectsPathTraversal() throws IOException {
        store.setup(0);

        assertThatThrownBy(() -> store.put("../fora", new byte[] {1})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("operações antes do setup falham após o timeout")
    void failsBeforeSetup() {
        assertThatThrownBy(() -> store.get("WALLET"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("não configurado");
    }

    @Test
    @DisplayName("reset desfaz o setup sem apagar os arquivos")
    void resetUndoesSetup() throws IOException {
        store.setup(0);
        store.put("WIDGETS", new byte[] {9});

        store.reset();

        assertThatThrownBy(() -> store.get("WIDGETS")).isInstanceOf(IOException.class);
        store.setup(0);
        assertThat(store.get("WIDGETS")).hasValueSatisfying(v -> assertThat(v).containsExactly(9));
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }
}
