package com.example.walletbackup.status;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SuppressionFlags")
class SuppressionFlagsTest {

    @Test
    @DisplayName("restore e wipe suprimem independentemente")
    void eitherFlagSuppresses() {
        SuppressionFlags flags = new SuppressionFlags();
        assertThat(flags.isSuppressed()).isFalse();

        flags.setWiping(true);
        assertThat(flags.isSuppressed()).isTrue();
        flags.setWiping(false);

        assertThat(flags.beginRestore()).isTrue();
        assertThat(flags.isSuppressed()).isTrue();
        flags.endRestore();
        assertThat(flags.isSuppressed()).isFalse();
    }

    @Test
    @DisplayName("segunda restauração simultânea é recusada")
    void rejectsNestedRestore() {
        SuppressionFlags flags = new SuppressionFlags();

        assertThat(flags.beginRestore()).isTrue();
        assertThat(flags.beginRestore()).isFalse();
    }

    @Test
    @DisplayName("transições de restore são observáveis")
    void restoringIsObservable() {
        SuppressionFlags flags = new SuppressionFlags();
        List<Boolean> seen = new ArrayList<>();
        flags.restoringChanges().subscribe(seen::add);

        flags.beginRestore();
        flags.endRestore();
        flags.endRestore();

        assertThat(seen).containsExactly(false, true, false);
    }
}
