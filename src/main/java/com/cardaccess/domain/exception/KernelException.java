package com.cardaccess.domain.exception;

import lombok.Getter;

/**
 * Excepción lanzada por un kernel de hardware cuando falla el protocolo de
 * lectura o escritura de una tarjeta física.
 * Los códigos siguen el estilo de status words ISO 7816.
 */
@Getter
public class KernelException extends RuntimeException {

    /** Función no soportada por el kernel */
    public static final int UNSUPPORTED = 0x6A81;

    /** Tarjeta no presente en el campo del lector */
    public static final int NOT_FOUND = 0x6A82;

    /** Tarjeta bloqueada por un acceso exclusivo en curso */
    public static final int BUSY = 0x6985;

    /** El dispositivo no respondió a tiempo */
    public static final int NO_RESPONSE = 0x6400;

    /** Respuesta del dispositivo ilegible */
    public static final int BAD_RESPONSE = 0x6F00;

    /** Mayor código representable en una status word */
    public static final int MAX_CODE = 0xFFFF;

    public enum Operation {
        READ,
        WRITE
    }

    private final Operation operation;
    private final String reason;
    private final int code;

    public KernelException(Operation operation, String reason, int code) {
        this(operation, reason, code, null);
    }

    public KernelException(Operation operation, String reason, int code, Throwable cause) {
        super(format(operation, reason, checkCode(code)), cause);
        this.operation = operation;
        this.reason = reason;
        this.code = code;
    }

    public static KernelException read(String reason, int code) {
        return new KernelException(Operation.READ, reason, code);
    }

    public static KernelException read(String reason, int code, Throwable cause) {
        return new KernelException(Operation.READ, reason, code, cause);
    }

    public static KernelException write(String reason, int code) {
        return new KernelException(Operation.WRITE, reason, code);
    }

    public static KernelException write(String reason, int code, Throwable cause) {
        return new KernelException(Operation.WRITE, reason, code, cause);
    }

    private static String format(Operation operation, String reason, int code) {
        String kind = operation == Operation.READ ? "ReadError" : "WriteError";
        return String.format("%s(message: %s, code: %d)", kind, reason, code);
    }

    private static int checkCode(int code) {
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException("Código de error fuera de rango (0-" + MAX_CODE + "): " + code);
        }
        return code;
    }
}
