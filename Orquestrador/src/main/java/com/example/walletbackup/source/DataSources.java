package com.example.walletbackup.source;

import com.example.walletbackup.model.BackupCategory;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contratos das fontes de dados observadas pelo orquestrador.
 */
public final class DataSources {

    private static final Object UNSET = new Object();

    private DataSources() {}

    /** Cancela uma inscrição. Idempotente. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Fluxo de mudanças. A primeira emissão após {@link #subscribe} é o valor atual,
     * não uma mudança nova.
     */
    @FunctionalInterface
    public interface ChangeSource<T> {

        Subscription subscribe(Consumer<? super T> listener);

        /** Projeta cada emissão; útil para descartar campos que não pertencem à categoria. */
        default <R> ChangeSource<R> map(Function<? super T, ? extends R> mapper) {
            Objects.requireNonNull(mapper, "mapper");
            return listener -> subscribe(value -> listener.accept(mapper.apply(value)));
        }

        /** Suprime emissões iguais (equals) à anterior da mesma inscrição. */
        default ChangeSource<T> distinctUntilChanged() {
            return listener -> {
                AtomicReference<Object> last = new AtomicReference<>(UNSET);
                return subscribe(value -> {
                    Object previous = last.getAndSet(value);
                    if (previous == UNSET || !Objects.equals(previous, value)) {
                        listener.accept(value);
                    }
                });
            };
        }
    }

    /**
     * Dono dos dados de uma categoria: notifica mudanças, gera o payload e aplica um payload restaurado.
     */
    public interface CategoryDataSource {

        BackupCategory category();

        /** Uma categoria pode depender de mais de uma fonte (ex.: tags + cache). */
        List<ChangeSource<?>> changeSources();

        byte[] snapshotBytes() throws IOException;

        void applyBytes(byte[] payload) throws IOException;
    }

    /**
     * Categoria persistida por outro subsistema; só informa quando o último sync terminou.
     */
    public interface ExternalSyncSource {

        BackupCategory category();

        Subscription onSyncCompleted(Consumer<Instant> listener);
    }

    /**
     * Valor observável em memória. Reemite o valor atual para novos inscritos.
     */
    public static final class ObservableValue<T> implements ChangeSource<T> {
        private static final Logger log = LoggerFactory.getLogger(ObservableValue.class);

        private final Object lock = new Object();
        private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();
        private T value;

        public ObservableValue(T initial) {
            this.value = initial;
        }

        public T get() {
            synchronized (lock) {
                return value;
            }
        }

        public void set(T newValue) {
            synchronized (lock) {
                value = newValue;
                for (Consumer<? super T> listener : listeners) {
                    deliver(listener, newValue);
                }
            }
        }

        public T update(UnaryOperator<T> transform) {
            synchronized (lock) {
                T next = transform.apply(value);
                set(next);
                return next;
            }
        }

        @Override
        public Subscription subscribe(Consumer<? super T> listener) {
            Objects.requireNonNull(listener, "listener");
            synchronized (lock) {
                listeners.add(listener);
                deliver(listener, value);
            }
            return () -> listeners.remove(listener);
        }

        private void deliver(Consumer<? super T> listener, T current) {
            try {
                listener.accept(current);
            } catch (RuntimeException e) {
                log.warn("Listener lançou exceção: {}", e.toString());
            }
        }
    }
}
