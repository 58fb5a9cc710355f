package com.cardaccess.domain.port;

import com.cardaccess.domain.model.Card;

/**
 * Acceso exclusivo y acotado a una tarjeta física obtenido con
 * {@link CardKernel#readMutable(int)}. Se libera al cerrarse.
 */
public interface CardLease extends AutoCloseable {

    /**
     * Estado actual de la tarjeta bajo el lease.
     *
     * @throws IllegalStateException si el lease ya fue liberado
     */
    Card card();

    /**
     * Reemplaza el estado de la tarjeta física.
     *
     * @param card Nuevo estado, con el mismo ID
     * @throws IllegalArgumentException si el ID no coincide
     * @throws IllegalStateException    si el lease ya fue liberado
     */
    void replace(Card card);

    boolean isOpen();

    /**
     * Libera el acceso exclusivo. Es idempotente.
     */
    @Override
    void close();
}
