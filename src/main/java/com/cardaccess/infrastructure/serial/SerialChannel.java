package com.cardaccess.infrastructure.serial;

/**
 * Canal de líneas de texto hacia el Arduino/PN532.
 */
public interface SerialChannel extends AutoCloseable {

    /**
     * Envía una línea (se agrega el salto de línea).
     *
     * @throws com.cardaccess.domain.exception.SerialPortException si el enlace falla
     */
    void send(String line);

    /**
     * Espera la siguiente línea no vacía.
     *
     * @param timeoutMillis Tiempo máximo de espera
     * @return La línea recibida, o null si se agotó el tiempo
     * @throws com.cardaccess.domain.exception.SerialPortException si el enlace falla
     */
    String receive(long timeoutMillis);

    /**
     * Descarta cualquier dato pendiente en el buffer de entrada.
     */
    void drain();

    boolean isOpen();

    @Override
    void close();
}
