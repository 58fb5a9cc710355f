package com.cardaccess.infrastructure.kernel;

import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.domain.port.CardLease;
import lombok.extern.slf4j.Slf4j;

/**
 * Kernel de referencia para entornos sin hardware.
 * Lectura y escritura fallan siempre con {@link KernelException#UNSUPPORTED};
 * el sondeo retorna de inmediato.
 */
@Slf4j
public class NoopCardKernel implements CardKernel {

    @Override
    public Card read(int cardId) {
        throw KernelException.read(
                "Lectura no disponible: no hay hardware configurado (tarjeta " + cardId + ")",
                KernelException.UNSUPPORTED);
    }

    @Override
    public CardLease readMutable(int cardId) {
        throw KernelException.read(
                "Lectura exclusiva no disponible: no hay hardware configurado (tarjeta " + cardId + ")",
                KernelException.UNSUPPORTED);
    }

    @Override
    public void write(Card card, byte[] data) {
        throw KernelException.write(
                "Escritura no disponible: no hay hardware configurado (tarjeta " + card.getId() + ")",
                KernelException.UNSUPPORTED);
    }

    @Override
    public void sense() {
        log.trace("Sondeo ignorado: kernel sin hardware");
    }

    @Override
    public String toString() {
        return "NoopCardKernel";
    }
}
