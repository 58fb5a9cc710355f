package com.cardaccess.domain.exception;

import java.util.Arrays;

/**
 * Excepción lanzada cuando un buffer de bytes no se puede convertir en una
 * tarjeta. Conserva los bytes ofensivos para diagnóstico.
 */
public class ConversionException extends RuntimeException {

    private final byte[] bytes;

    public ConversionException(String message, byte[] bytes) {
        super(message);
        this.bytes = copy(bytes);
    }

    public ConversionException(String message, byte[] bytes, Throwable cause) {
        super(message, cause);
        this.bytes = copy(bytes);
    }

    /**
     * Excepción cuando el buffer no es JSON bien formado.
     */
    public static ConversionException malformed(byte[] bytes, Throwable cause) {
        return new ConversionException("No se puede convertir a tarjeta: JSON mal formado", bytes, cause);
    }

    /**
     * Excepción cuando un campo falta o tiene un tipo/valor inválido.
     */
    public static ConversionException invalidField(String field, String reason, byte[] bytes) {
        return new ConversionException(
                String.format("No se puede convertir a tarjeta: campo '%s' %s", field, reason), bytes);
    }

    /**
     * Copia de los bytes que provocaron el error.
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
    }
}
