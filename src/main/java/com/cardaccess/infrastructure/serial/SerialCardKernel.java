package com.cardaccess.infrastructure.serial;

import com.cardaccess.domain.exception.ConversionException;
import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.exception.SerialPortException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.domain.port.CardLease;
import com.cardaccess.infrastructure.kernel.LeaseTable;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Kernel para un lector PN532 conectado a un Arduino por puerto serial.
 * <p>
 * Protocolo de líneas:
 * <ul>
 * <li>{@code R:<id>} responde {@code CARD:<json>} o {@code ERR:<code>:<mensaje>}</li>
 * <li>{@code W:<id>:<hex>} responde {@code OK} o {@code ERR:<code>:<mensaje>}</li>
 * <li>{@code S} responde cero o más {@code CARD:<json>} y luego {@code END}</li>
 * </ul>
 * Cada intercambio petición/respuesta se serializa sobre el canal.
 */
@Slf4j
public class SerialCardKernel implements CardKernel, AutoCloseable {

    static final String CARD_PREFIX = "CARD:";
    static final String ERROR_PREFIX = "ERR:";
    static final String OK = "OK";
    static final String END = "END";

    // Cota de líneas por sondeo para que sense() siempre termine
    private static final int MAX_SENSE_LINES = 256;

    private final SerialChannel channel;
    private final long responseTimeoutMillis;
    private final LeaseTable leases = new LeaseTable();
    private final List<Consumer<Card>> listeners = new CopyOnWriteArrayList<>();
    private final Object exchangeLock = new Object();

    public SerialCardKernel(SerialChannel channel, long responseTimeoutMillis) {
        this.channel = channel;
        this.responseTimeoutMillis = responseTimeoutMillis;
    }

    @Override
    public Card read(int cardId) {
        leases.checkFree(cardId, KernelException.Operation.READ);
        return readFromDevice(cardId);
    }

    @Override
    public CardLease readMutable(int cardId) {
        return leases.acquire(cardId, this::readFromDevice, card -> writeToDevice(card, card.encode()));
    }

    @Override
    public void write(Card card, byte[] data) {
        leases.checkFree(card.getId(), KernelException.Operation.WRITE);
        writeToDevice(card, data);
    }

    @Override
    public void sense() {
        synchronized (exchangeLock) {
            try {
                channel.drain();
                channel.send("S");

                for (int i = 0; i < MAX_SENSE_LINES; i++) {
                    String line = channel.receive(responseTimeoutMillis);
                    if (line == null) {
                        log.warn("Sondeo sin respuesta del lector tras {} ms", responseTimeoutMillis);
                        return;
                    }
                    if (END.equals(line)) {
                        return;
                    }
                    handleSensedLine(line);
                }
                log.warn("Sondeo cortado tras {} líneas sin recibir {}", MAX_SENSE_LINES, END);
            } catch (SerialPortException e) {
                log.error("Error de enlace durante el sondeo: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void onSensed(Consumer<Card> listener) {
        listeners.add(listener);
    }

    @Override
    public void close() {
        channel.close();
    }

    private void handleSensedLine(String line) {
        if (!line.startsWith(CARD_PREFIX)) {
            log.warn("Línea inesperada durante el sondeo: {}", line);
            return;
        }

        Card card;
        try {
            card = Card.decode(line.substring(CARD_PREFIX.length()).getBytes(StandardCharsets.UTF_8));
        } catch (ConversionException e) {
            log.warn("Tarjeta detectada ilegible ({}): {}", e.getMessage(), line);
            return;
        }

        log.info("==> Tarjeta detectada: {}", card);
        for (Consumer<Card> listener : listeners) {
            try {
                listener.accept(card);
            } catch (RuntimeException e) {
                log.error("Error en listener de sondeo para la tarjeta {}: {}", card.getId(), e.getMessage(), e);
            }
        }
    }

    private Card readFromDevice(int cardId) {
        String response = exchange("R:" + cardId, KernelException.Operation.READ);

        if (!response.startsWith(CARD_PREFIX)) {
            throw KernelException.read("Respuesta inesperada a la lectura: " + response, KernelException.BAD_RESPONSE);
        }

        Card card;
        try {
            card = Card.decode(response.substring(CARD_PREFIX.length()).getBytes(StandardCharsets.UTF_8));
        } catch (ConversionException e) {
            throw KernelException.read("Tarjeta ilegible: " + e.getMessage(), KernelException.BAD_RESPONSE, e);
        }

        if (card.getId() != cardId) {
            throw KernelException.read(
                    "Se pidió la tarjeta " + cardId + " y el lector devolvió la " + card.getId(),
                    KernelException.BAD_RESPONSE);
        }
        return card;
    }

    private void writeToDevice(Card card, byte[] data) {
        String hex = HexFormat.of().withUpperCase().formatHex(data);
        String response = exchange("W:" + card.getId() + ":" + hex, KernelException.Operation.WRITE);

        if (!OK.equals(response)) {
            throw KernelException.write("Respuesta inesperada a la escritura: " + response,
                    KernelException.BAD_RESPONSE);
        }
        log.info("Payload de {} bytes escrito en la tarjeta {}", data.length, card.getId());
    }

    /**
     * Envía una petición y devuelve la respuesta si no es un error del lector.
     */
    private String exchange(String request, KernelException.Operation operation) {
        String response;
        synchronized (exchangeLock) {
            try {
                channel.drain();
                channel.send(request);
                response = channel.receive(responseTimeoutMillis);
            } catch (SerialPortException e) {
                throw new KernelException(operation, e.getMessage(), KernelException.NO_RESPONSE, e);
            }
        }

        if (response == null) {
            throw new KernelException(operation,
                    "Sin respuesta del lector tras " + responseTimeoutMillis + " ms", KernelException.NO_RESPONSE);
        }
        if (response.startsWith(ERROR_PREFIX)) {
            throw parseDeviceError(response, operation);
        }
        return response;
    }

    private KernelException parseDeviceError(String response, KernelException.Operation operation) {
        String[] parts = response.split(":", 3);
        if (parts.length < 3) {
            return new KernelException(operation, "Error del lector mal formado: " + response,
                    KernelException.BAD_RESPONSE);
        }

        int code;
        try {
            code = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return new KernelException(operation, "Código de error ilegible: " + response,
                    KernelException.BAD_RESPONSE, e);
        }

        if (code < 0 || code > KernelException.MAX_CODE) {
            return new KernelException(operation, "Código de error fuera de rango: " + response,
                    KernelException.BAD_RESPONSE);
        }
        return new KernelException(operation, parts[2].trim(), code);
    }

    @Override
    public String toString() {
        return "SerialCardKernel";
    }
}
