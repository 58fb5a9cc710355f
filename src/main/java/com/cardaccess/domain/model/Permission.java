package com.cardaccess.domain.model;

/**
 * Enum que representa las capacidades de acceso que puede tener una tarjeta.
 * Cada capacidad ocupa un bit independiente dentro de la máscara de permisos.
 */
public enum Permission {

    /** Sin permisos. Es un flag propio, no el conjunto vacío */
    NONE(1 << 0),

    /** Permiso para tarjetas regulares */
    REGULAR(1 << 1),

    /** Permiso para el personal de soporte IT */
    IT_SUPPORT(1 << 2),

    /** Permiso para operar el sistema de puertas */
    OPEN_DOORS(1 << 3),

    /** Permiso de administrador */
    ADMIN(1 << 4),

    /** Permiso que omite todas las restricciones */
    SUPER_ADMIN(1 << 5);

    private final int bit;

    Permission(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }
}
