package com.example.walletbackup.support;

import com.example.walletbackup.model.BackupCategory;
import com.example.walletbackup.source.DataSources.CategoryDataSource;
import com.example.walletbackup.source.DataSources.ChangeSource;
import com.example.walletbackup.source.DataSources.ObservableValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fonte de dados baseada em um {@link ObservableValue} de texto.
 */
public final class FakeDataSource implements CategoryDataSource {

    private final BackupCategory category;
    private final ObservableValue<String> value;
    private volatile boolean failApply;
    private volatile boolean failSnapshot;
    private volatile Consumer<BackupCategory> onApply = c -> { };

    public FakeDataSource(BackupCategory category, String initial) {
        this.category = category;
        this.value = new ObservableValue<>(initial);
    }

    @Override
    public BackupCategory category() {
        return category;
    }

    @Override
    public List<ChangeSource<?>> changeSources() {
        return List.of(value);
    }

    @Override
    public byte[] snapshotBytes() throws IOException {
        if (failSnapshot) {
            throw new IOException("snapshot falhou");
        }
        return value.get().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void applyBytes(byte[] payload) throws IOException {
        onApply.accept(category);
        if (failApply) {
            throw new IOException("dados corrompidos");
        }
        value.set(new String(payload, StandardCharsets.UTF_8));
    }

    public ObservableValue<String> value() {
        return value;
    }

    public void failApply(boolean fail) {
        this.failApply = fail;
    }

    public void failSnapshot(boolean fail) {
        this.failSnapshot = fail;
    }

    public void onApply(Consumer<BackupCategory> listener) {
        this.onApply = listener;
    }
}
