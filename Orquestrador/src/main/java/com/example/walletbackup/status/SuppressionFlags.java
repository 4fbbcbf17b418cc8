package com.example.walletbackup.status;

import com.example.walletbackup.source.DataSources.ChangeSource;
import com.example.walletbackup.source.DataSources.ObservableValue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sinais globais que suspendem marcação e agendamento de backups.
 * O restore é controlado pelo orquestrador de restauração; o wipe pelo fluxo de limpeza da carteira.
 */
public final class SuppressionFlags {

    private final AtomicBoolean restoring = new AtomicBoolean(false);
    private final AtomicBoolean wiping = new AtomicBoolean(false);
    private final ObservableValue<Boolean> restoringChanges = new ObservableValue<>(Boolean.FALSE);

    public boolean isRestoring() {
        return restoring.get();
    }

    public boolean isWiping() {
        return wiping.get();
    }

    public boolean isSuppressed() {
        return restoring.get() || wiping.get();
    }

    /**
     * Marca o início de uma restauração.
     *
     * @return false se já havia uma restauração em andamento
     */
    public boolean beginRestore() {
        if (!restoring.compareAndSet(false, true)) {
            return false;
        }
        restoringChanges.set(Boolean.TRUE);
        return true;
    }

    public void endRestore() {
        if (restoring.compareAndSet(true, false)) {
            restoringChanges.set(Boolean.FALSE);
        }
    }

    public void setWiping(boolean value) {
        wiping.set(value);
    }

    /** Emite o estado atual e cada transição de restauração. */
    public ChangeSource<Boolean> restoringChanges() {
        return restoringChanges;
    }
}
