package com.cardaccess.infrastructure.serial;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parámetros de la línea serial hacia el lector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerialSettings {

    /** Nombre del sistema del puerto (ej: COM3, /dev/ttyUSB0) */
    private String portName;

    @Builder.Default
    private int baudRate = 115200;

    @Builder.Default
    private int dataBits = 8;

    @Builder.Default
    private int stopBits = 1;

    @Builder.Default
    private int parity = 0;

    /** Tiempo máximo de espera por cada respuesta del lector */
    @Builder.Default
    private long responseTimeoutMillis = 2000;
}
