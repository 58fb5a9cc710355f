package com.cardaccess.config;

import com.cardaccess.application.service.CardRegistry;
import com.cardaccess.domain.exception.SerialPortException;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.infrastructure.kernel.InMemoryCardKernel;
import com.cardaccess.infrastructure.kernel.NoopCardKernel;
import com.cardaccess.infrastructure.serial.JSerialCommChannel;
import com.cardaccess.infrastructure.serial.SerialCardKernel;
import com.cardaccess.infrastructure.serial.SerialPortScanner;
import com.cardaccess.infrastructure.serial.SerialSettings;
import com.fazecast.jSerialComm.SerialPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuración del kernel de hardware y del registro de tarjetas.
 * El kernel se elige con {@code card.kernel}: noop (por defecto), memory o serial.
 */
@Configuration
@Slf4j
public class KernelConfiguration {

    @Bean
    @ConditionalOnProperty(name = "card.kernel", havingValue = "noop", matchIfMissing = true)
    public NoopCardKernel noopCardKernel() {
        log.warn("Kernel sin hardware activo: lecturas y escrituras de tarjetas fallarán");
        return new NoopCardKernel();
    }

    @Bean
    @ConditionalOnProperty(name = "card.kernel", havingValue = "memory")
    public InMemoryCardKernel inMemoryCardKernel() {
        log.info("Kernel simulado en memoria activo");
        return new InMemoryCardKernel();
    }

    @Bean
    @ConditionalOnProperty(name = "card.kernel", havingValue = "serial")
    public SerialPortScanner serialPortScanner() {
        return new SerialPortScanner();
    }

    @Bean
    @ConditionalOnProperty(name = "card.kernel", havingValue = "serial")
    public SerialSettings serialSettings(
            @Value("${serial.port:}") String portName,
            @Value("${serial.baud-rate:115200}") int baudRate,
            @Value("${serial.data-bits:8}") int dataBits,
            @Value("${serial.stop-bits:1}") int stopBits,
            @Value("${serial.parity:0}") int parity,
            @Value("${serial.response-timeout-ms:2000}") long responseTimeoutMillis) {
        return SerialSettings.builder()
                .portName(portName)
                .baudRate(baudRate)
                .dataBits(dataBits)
                .stopBits(stopBits)
                .parity(parity)
                .responseTimeoutMillis(responseTimeoutMillis)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "card.kernel", havingValue = "serial")
    public SerialCardKernel serialCardKernel(SerialPortScanner scanner, SerialSettings settings) {
        SerialPort port = scanner.findPort(settings.getPortName())
                .orElseThrow(() -> {
                    log.error("Puertos disponibles: {}", scanner.getAvailablePortNames());
                    return SerialPortException.notFound(settings.getPortName());
                });

        JSerialCommChannel channel = JSerialCommChannel.open(port, settings);
        return new SerialCardKernel(channel, settings.getResponseTimeoutMillis());
    }

    @Bean
    public CardRegistry<CardKernel> cardRegistry(CardKernel kernel) {
        log.info("Registro de tarjetas creado sobre {}", kernel);
        return CardRegistry.withKernel(kernel);
    }
}
