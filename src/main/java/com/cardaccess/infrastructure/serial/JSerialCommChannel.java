package com.cardaccess.infrastructure.serial;

import com.cardaccess.domain.exception.SerialPortException;
import com.fazecast.jSerialComm.SerialPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Canal serial sobre jSerialComm.
 * Lee por sondeo de {@code bytesAvailable()} y acumula hasta cada salto de línea.
 */
@Slf4j
public class JSerialCommChannel implements SerialChannel {

    private static final long POLL_INTERVAL_MILLIS = 10;

    private final SerialPort port;
    private final StringBuilder pending = new StringBuilder();

    private JSerialCommChannel(SerialPort port) {
        this.port = port;
    }

    /**
     * Configura y abre el puerto.
     *
     * @param port     Puerto encontrado por el escáner
     * @param settings Parámetros de la línea
     * @return Canal abierto
     * @throws SerialPortException si no se puede abrir el puerto
     */
    public static JSerialCommChannel open(SerialPort port, SerialSettings settings) {
        port.setBaudRate(settings.getBaudRate());
        port.setNumDataBits(settings.getDataBits());
        port.setNumStopBits(settings.getStopBits());
        port.setParity(settings.getParity());
        port.setComPortTimeouts(SerialPort.TIMEOUT_NONBLOCKING, 0, 0);

        if (!port.openPort()) {
            throw SerialPortException.cannotOpen(port.getSystemPortName());
        }

        log.info("Puerto {} abierto exitosamente a {} baudios", port.getSystemPortName(), settings.getBaudRate());
        return new JSerialCommChannel(port);
    }

    @Override
    public synchronized void send(String line) {
        ensureOpen();
        byte[] data = (line + "\n").getBytes(StandardCharsets.US_ASCII);
        int written = port.writeBytes(data, data.length);

        if (written < data.length) {
            throw SerialPortException.linkFailure(port.getSystemPortName(),
                    new IllegalStateException("Escritos " + written + " de " + data.length + " bytes"));
        }
        log.debug("Enviado al lector: {}", line);
    }

    @Override
    public synchronized String receive(long timeoutMillis) {
        ensureOpen();
        long deadline = System.currentTimeMillis() + timeoutMillis;

        while (true) {
            String line = nextPendingLine();
            if (line != null) {
                log.debug("Recibido del lector: {}", line);
                return line;
            }

            if (System.currentTimeMillis() >= deadline) {
                return null;
            }

            int available = port.bytesAvailable();
            if (available < 0) {
                throw SerialPortException.linkFailure(port.getSystemPortName(),
                        new IllegalStateException("Puerto desconectado"));
            }

            if (available > 0) {
                byte[] buffer = new byte[available];
                int read = port.readBytes(buffer, buffer.length);
                if (read > 0) {
                    pending.append(new String(buffer, 0, read, StandardCharsets.US_ASCII));
                }
            } else {
                pause();
            }
        }
    }

    @Override
    public synchronized void drain() {
        pending.setLength(0);
        int available;
        while ((available = port.bytesAvailable()) > 0) {
            byte[] discard = new byte[available];
            port.readBytes(discard, discard.length);
        }
    }

    @Override
    public boolean isOpen() {
        return port.isOpen();
    }

    @Override
    public synchronized void close() {
        if (port.isOpen()) {
            port.closePort();
            log.info("Puerto {} cerrado", port.getSystemPortName());
        }
    }

    private String nextPendingLine() {
        int newline;
        while ((newline = pending.indexOf("\n")) >= 0) {
            String line = pending.substring(0, newline).trim();
            pending.delete(0, newline + 1);
            if (!line.isEmpty()) {
                return line;
            }
        }
        return null;
    }

    private void pause() {
        try {
            Thread.sleep(POLL_INTERVAL_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SerialPortException.linkFailure(port.getSystemPortName(), e);
        }
    }

    private void ensureOpen() {
        if (!port.isOpen()) {
            throw new SerialPortException("Puerto no disponible: " + port.getSystemPortName());
        }
    }
}
