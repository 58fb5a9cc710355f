package com.cardaccess.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Escáner de puertos seriales usando jSerialComm.
 */
@Slf4j
public class SerialPortScanner {

    /**
     * Obtiene los nombres de los puertos seriales disponibles en el sistema.
     */
    public List<String> getAvailablePortNames() {
        SerialPort[] ports = SerialPort.getCommPorts();

        log.info("Escaneando puertos seriales. Encontrados: {}", ports.length);

        return Arrays.stream(ports)
                .map(SerialPort::getSystemPortName)
                .collect(Collectors.toList());
    }

    /**
     * Busca un puerto por su nombre de sistema.
     *
     * @param portName Nombre del puerto (ej: COM3)
     * @return El puerto si existe
     */
    public Optional<SerialPort> findPort(String portName) {
        if (portName == null || portName.isBlank()) {
            return Optional.empty();
        }

        for (SerialPort port : SerialPort.getCommPorts()) {
            if (port.getSystemPortName().equalsIgnoreCase(portName)) {
                return Optional.of(port);
            }
        }

        log.warn("Puerto no encontrado: {}", portName);
        return Optional.empty();
    }
}
