package com.cardaccess.application.service;

import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.infrastructure.kernel.NoopCardKernel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registro en memoria de tarjetas, indexado por ID en orden ascendente y
 * asociado a un único kernel de hardware durante toda su vida.
 * <p>
 * El registro nunca invoca al kernel: lo conserva para que el código que
 * integra eventos físicos (sondeo, lectura, escritura) lo use.
 * {@code put}/{@code unbind} son los únicos escritores.
 *
 * @param <K> Tipo de kernel de hardware
 */
@Slf4j
public class CardRegistry<K extends CardKernel> {

    private final TreeMap<Integer, Card> cards = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final K kernel;

    public CardRegistry(K kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
    }

    /**
     * Registro vacío sobre el kernel de referencia sin hardware.
     */
    public static CardRegistry<NoopCardKernel> create() {
        return new CardRegistry<>(new NoopCardKernel());
    }

    /**
     * Registro vacío sobre el kernel indicado.
     */
    public static <K extends CardKernel> CardRegistry<K> withKernel(K kernel) {
        return new CardRegistry<>(kernel);
    }

    public K kernel() {
        return kernel;
    }

    /**
     * Inserta o reemplaza la tarjeta con el mismo ID (gana la última escritura).
     *
     * @param card Tarjeta a guardar
     * @return La tarjeta reemplazada, si existía
     */
    public Optional<Card> put(Card card) {
        Objects.requireNonNull(card, "card");
        lock.writeLock().lock();
        try {
            Card previous = cards.put(card.getId(), card);
            log.debug("Tarjeta guardada: {}", card);
            return Optional.ofNullable(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Card> get(int cardId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cards.get(cardId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Elimina la tarjeta del registro.
     *
     * @param cardId ID de la tarjeta
     * @return La tarjeta eliminada, si existía
     */
    public Optional<Card> unbind(int cardId) {
        lock.writeLock().lock();
        try {
            Card removed = cards.remove(cardId);
            if (removed != null) {
                log.debug("Tarjeta desvinculada: {}", removed);
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(int cardId) {
        lock.readLock().lock();
        try {
            return cards.containsKey(cardId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copia inmutable de todas las tarjetas ordenadas por ID.
     */
    public List<Card> cards() {
        lock.readLock().lock();
        try {
            return List.copyOf(cards.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return cards.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return "CardRegistry(cards=" + size() + ")";
    }
}
