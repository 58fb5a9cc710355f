package com.cardaccess.domain.port;

import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;

import java.util.function.Consumer;

/**
 * Puerto (interfaz) hacia el sistema de bajo nivel que controla las tarjetas
 * físicas, por ejemplo un lector/escritor NFC PN532.
 * El registro no sabe si la implementación es física o simulada.
 */
public interface CardKernel {

    /**
     * Lee el estado actual de una tarjeta física.
     *
     * @param cardId ID de la tarjeta
     * @return Tarjeta leída
     * @throws KernelException con operación READ si falla el hardware o el protocolo
     */
    Card read(int cardId);

    /**
     * Lee una tarjeta obteniendo acceso exclusivo para modificarla.
     * Mientras el lease esté abierto, cualquier otra operación sobre el mismo
     * ID falla con {@link KernelException#BUSY}. Debe usarse con
     * try-with-resources.
     *
     * @param cardId ID de la tarjeta
     * @return Lease exclusivo sobre la tarjeta
     * @throws KernelException con operación READ si falla la lectura
     */
    CardLease readMutable(int cardId);

    /**
     * Envía un payload crudo a la tarjeta física.
     *
     * @param card Tarjeta destino
     * @param data Datos a escribir
     * @throws KernelException con operación WRITE si falla la escritura
     */
    void write(Card card, byte[] data);

    /**
     * Sondea la presencia de tarjetas en el campo del lector.
     * Nunca lanza excepciones y siempre termina, haya o no tarjetas.
     */
    void sense();

    /**
     * Registra un listener notificado por cada tarjeta detectada en
     * {@link #sense()}. Los kernels que no detectan tarjetas lo ignoran.
     */
    default void onSensed(Consumer<Card> listener) {
    }
}
