package com.cardaccess.application.service;

import com.cardaccess.domain.exception.ConversionException;
import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.model.Permissions;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.domain.port.CardLease;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Servicio que conecta los eventos del hardware con el registro en memoria.
 * Coordina el flujo sondeo → decodificación → registro y la escritura de
 * tarjetas hacia el lector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardSyncService {

    private final CardRegistry<? extends CardKernel> registry;

    /**
     * Suscribe el servicio a las tarjetas detectadas por el kernel.
     */
    @PostConstruct
    public void init() {
        registry.kernel().onSensed(this::handleSensed);
        log.info("Sincronización activa sobre {}", registry.kernel());
    }

    /**
     * Guarda en el registro una tarjeta detectada por el lector.
     */
    public void handleSensed(Card card) {
        Optional<Card> previous = registry.put(card);
        if (previous.isEmpty()) {
            log.info("Nueva tarjeta registrada desde el lector: {}", card);
        } else if (!previous.get().equals(card)) {
            log.info("Tarjeta actualizada desde el lector: {} -> {}", previous.get(), card);
        }
    }

    /**
     * Decodifica un payload recibido y lo guarda en el registro.
     *
     * @param payload Bytes recibidos del hardware
     * @return Tarjeta registrada
     * @throws ConversionException si el payload no es una tarjeta válida
     */
    public Card importCard(byte[] payload) {
        Card card;
        try {
            card = Card.decode(payload);
        } catch (ConversionException e) {
            log.warn("Payload rechazado ({} bytes): {}", e.getBytes().length, e.getMessage());
            throw e;
        }

        registry.put(card);
        log.info("Tarjeta importada: {}", card);
        return card;
    }

    /**
     * Codifica una tarjeta del registro para enviarla al hardware.
     */
    public Optional<byte[]> exportCard(int cardId) {
        return registry.get(cardId).map(Card::encode);
    }

    /**
     * Codifica todas las tarjetas del registro en orden de ID.
     */
    public List<byte[]> exportAll() {
        return registry.cards().stream()
                .map(Card::encode)
                .collect(Collectors.toList());
    }

    /**
     * Lee el estado físico de una tarjeta y actualiza el registro.
     *
     * @throws KernelException si la lectura falla
     */
    public Card refresh(int cardId) {
        Card card = registry.kernel().read(cardId);
        registry.put(card);
        log.info("Tarjeta {} refrescada desde el lector", cardId);
        return card;
    }

    /**
     * Escribe en la tarjeta física el estado que tiene en el registro.
     *
     * @throws IllegalArgumentException si la tarjeta no está registrada
     * @throws KernelException          si la escritura falla
     */
    public void push(int cardId) {
        Card card = registry.get(cardId)
                .orElseThrow(() -> new IllegalArgumentException("Tarjeta no registrada: " + cardId));

        registry.kernel().write(card, card.encode());
        log.info("Tarjeta {} escrita en el lector", cardId);
    }

    /**
     * Cambia los permisos de una tarjeta física bajo acceso exclusivo y
     * registra el nuevo estado.
     *
     * @throws KernelException si la lectura o escritura falla
     */
    public Card grant(int cardId, Permissions permissions) {
        Card updated;
        try (CardLease lease = registry.kernel().readMutable(cardId)) {
            updated = lease.card().withPermissions(permissions);
            lease.replace(updated);
        }

        registry.put(updated);
        log.info("Permisos actualizados: {}", updated);
        return updated;
    }
}
