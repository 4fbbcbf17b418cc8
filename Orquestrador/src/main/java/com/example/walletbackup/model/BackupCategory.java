package com.example.walletbackup.model;

import java.util.Arrays;
import java.util.List;

/**
 * Domínios de dados da carteira espelhados no store remoto.
 * O nome da constante é a chave remota da categoria e não deve mudar.
 */
public enum BackupCategory {
    /** Persistido pelo próprio nó Lightning; aqui só exibimos o horário do último sync. */
    LIGHTNING_CONNECTIONS(true),
    COUNTERPARTY_SERVICE(false),
    ACTIVITY(false),
    WALLET(false),
    SETTINGS(false),
    WIDGETS(false),
    METADATA(false);

    /**
     * Ordem fixa da restauração: categorias que podem rotacionar endereços ou invalidar caches
     * vêm antes das que dependem de estado derivado limpo.
     */
    private static final List<BackupCategory> RESTORE_ORDER = List.of(
            METADATA,
            SETTINGS,
            WIDGETS,
            WALLET,
            COUNTERPARTY_SERVICE,
            ACTIVITY);

    private static final List<BackupCategory> MANAGED = Arrays.stream(values())
            .filter(c -> !c.externallyManaged)
            .toList();

    private final boolean externallyManaged;

    BackupCategory(boolean externallyManaged) {
        this.externallyManaged = externallyManaged;
    }

    public boolean externallyManaged() {
        return externallyManaged;
    }

    /** Chave usada no store remoto. */
    public String storeKey() {
        return name();
    }

    /** Categorias executadas por este subsistema (exclui as gerenciadas externamente). */
    public static List<BackupCategory> managed() {
        return MANAGED;
    }

    public static List<BackupCategory> restoreOrder() {
        return RESTORE_ORDER;
    }
}
