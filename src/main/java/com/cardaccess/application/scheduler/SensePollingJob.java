package com.cardaccess.application.scheduler;

import com.cardaccess.application.service.CardRegistry;
import com.cardaccess.domain.port.CardKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Job programado que sondea periódicamente el lector en busca de tarjetas.
 * Las tarjetas detectadas llegan al registro a través de los listeners del
 * kernel.
 */
@Component
@ConditionalOnProperty(name = "card.sense.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SensePollingJob {

    private final CardRegistry<? extends CardKernel> registry;

    @Scheduled(fixedDelayString = "${card.sense.interval-ms:1000}")
    public void poll() {
        log.trace("Sondeando lector...");
        registry.kernel().sense();
    }
}
