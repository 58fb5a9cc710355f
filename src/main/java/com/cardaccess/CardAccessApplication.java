package com.cardaccess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Card Access Registry - Aplicación Principal
 *
 * Registro de tarjetas de control de acceso con:
 * - Permisos por tarjeta como máscara de bits
 * - Kernel de hardware intercambiable (sin hardware, simulado o PN532 serial)
 * - Codificación JSON de tarjetas para el lector
 */
@SpringBootApplication
@EnableScheduling
public class CardAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardAccessApplication.class, args);
    }
}
