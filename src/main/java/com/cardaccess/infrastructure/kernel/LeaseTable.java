package com.cardaccess.infrastructure.kernel;

import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.port.CardLease;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Tabla de IDs con acceso exclusivo en curso.
 * Compartida por los kernels que implementan {@code readMutable}.
 */
@Slf4j
public class LeaseTable {

    private final Set<Integer> leased = ConcurrentHashMap.newKeySet();

    /**
     * Falla si el ID tiene un lease abierto.
     */
    public void checkFree(int cardId, KernelException.Operation operation) {
        if (leased.contains(cardId)) {
            throw new KernelException(operation,
                    "La tarjeta " + cardId + " está bloqueada por un acceso exclusivo", KernelException.BUSY);
        }
    }

    /**
     * Reserva el ID, lee la tarjeta y abre el lease. Si la lectura falla, la
     * reserva se libera antes de propagar el error.
     *
     * @param cardId ID a reservar
     * @param reader Lectura del estado actual
     * @param writer Escritura usada por {@link CardLease#replace(Card)}
     */
    public CardLease acquire(int cardId, IntFunction<Card> reader, Consumer<Card> writer) {
        if (!leased.add(cardId)) {
            throw KernelException.read(
                    "La tarjeta " + cardId + " ya tiene un acceso exclusivo abierto", KernelException.BUSY);
        }

        try {
            Card card = reader.apply(cardId);
            log.debug("Lease abierto sobre la tarjeta {}", cardId);
            return new TableLease(card, writer);
        } catch (RuntimeException e) {
            leased.remove(cardId);
            throw e;
        }
    }

    private final class TableLease implements CardLease {

        private final int cardId;
        private final Consumer<Card> writer;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private volatile Card current;

        private TableLease(Card card, Consumer<Card> writer) {
            this.cardId = card.getId();
            this.current = card;
            this.writer = writer;
        }

        @Override
        public Card card() {
            ensureOpen();
            return current;
        }

        @Override
        public void replace(Card card) {
            ensureOpen();
            if (card.getId() != cardId) {
                throw new IllegalArgumentException(
                        "El lease es para la tarjeta " + cardId + ", no para " + card.getId());
            }
            writer.accept(card);
            current = card;
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                leased.remove(cardId);
                log.debug("Lease liberado sobre la tarjeta {}", cardId);
            }
        }

        private void ensureOpen() {
            if (!open.get()) {
                throw new IllegalStateException("El lease de la tarjeta " + cardId + " ya fue liberado");
            }
        }
    }
}
