package com.cardaccess.infrastructure.kernel;

import com.cardaccess.domain.exception.ConversionException;
import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.domain.port.CardLease;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Kernel simulado: mantiene en memoria las tarjetas "presentes en el campo"
 * del lector. Útil para pruebas y entornos sin hardware físico.
 */
@Slf4j
public class InMemoryCardKernel implements CardKernel {

    // Ordenado por ID para que el sondeo notifique en orden
    private final ConcurrentSkipListMap<Integer, Card> field = new ConcurrentSkipListMap<>();
    private final Map<Integer, byte[]> payloads = new ConcurrentHashMap<>();
    private final List<Consumer<Card>> listeners = new CopyOnWriteArrayList<>();
    private final LeaseTable leases = new LeaseTable();

    /**
     * Acerca una tarjeta al lector (o actualiza la que ya estaba).
     */
    public void place(Card card) {
        field.put(card.getId(), card);
        log.debug("Tarjeta {} presente en el campo", card.getId());
    }

    /**
     * Retira una tarjeta del lector.
     */
    public Optional<Card> take(int cardId) {
        payloads.remove(cardId);
        return Optional.ofNullable(field.remove(cardId));
    }

    /**
     * Último payload crudo escrito en la tarjeta.
     */
    public Optional<byte[]> payload(int cardId) {
        return Optional.ofNullable(payloads.get(cardId)).map(byte[]::clone);
    }

    @Override
    public Card read(int cardId) {
        leases.checkFree(cardId, KernelException.Operation.READ);
        return lookup(cardId);
    }

    @Override
    public CardLease readMutable(int cardId) {
        return leases.acquire(cardId, this::lookup, this::store);
    }

    @Override
    public void write(Card card, byte[] data) {
        leases.checkFree(card.getId(), KernelException.Operation.WRITE);
        if (!field.containsKey(card.getId())) {
            throw KernelException.write("Tarjeta " + card.getId() + " no presente en el campo",
                    KernelException.NOT_FOUND);
        }

        payloads.put(card.getId(), data.clone());

        try {
            Card written = Card.decode(data);
            if (written.getId() == card.getId()) {
                field.put(card.getId(), written);
            }
        } catch (ConversionException e) {
            log.debug("Payload de la tarjeta {} no es una tarjeta codificada: {}", card.getId(), e.getMessage());
        }
    }

    @Override
    public void sense() {
        log.debug("Sondeo simulado: {} tarjetas en el campo", field.size());
        for (Card card : field.values()) {
            notifyListeners(card);
        }
    }

    private void notifyListeners(Card card) {
        for (Consumer<Card> listener : listeners) {
            try {
                listener.accept(card);
            } catch (RuntimeException e) {
                log.error("Error en listener de sondeo para la tarjeta {}: {}", card.getId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void onSensed(Consumer<Card> listener) {
        listeners.add(listener);
    }

    private Card lookup(int cardId) {
        Card card = field.get(cardId);
        if (card == null) {
            throw KernelException.read("Tarjeta " + cardId + " no presente en el campo", KernelException.NOT_FOUND);
        }
        return card;
    }

    private void store(Card card) {
        if (!field.containsKey(card.getId())) {
            throw KernelException.write("Tarjeta " + card.getId() + " retirada del campo", KernelException.NOT_FOUND);
        }
        field.put(card.getId(), card);
        payloads.put(card.getId(), card.encode());
    }

    @Override
    public String toString() {
        return "InMemoryCardKernel(cards=" + field.size() + ")";
    }
}
