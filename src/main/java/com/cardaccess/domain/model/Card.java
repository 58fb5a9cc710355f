package com.cardaccess.domain.model;

import com.cardaccess.domain.codec.CardJsonCodec;
import com.cardaccess.domain.exception.ConversionException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Modelo de dominio que representa una tarjeta de acceso física.
 * Es un valor inmutable: para cambiar permisos se reemplaza la tarjeta.
 * La validación del constructor garantiza que toda tarjeta es codificable.
 */
@Getter
@EqualsAndHashCode
public final class Card {

    public static final int MIN_ID = 0;
    public static final int MAX_ID = 0xFFFF;

    /** Identificador de 16 bits sin signo, único dentro de un registro */
    private final int id;

    /** Permisos asociados a la tarjeta */
    private final Permissions permissions;

    /**
     * Crea una nueva tarjeta.
     *
     * @param id          Identificador (0-65535)
     * @param permissions Permisos de la tarjeta
     * @throws IllegalArgumentException si el id está fuera de rango
     */
    public Card(int id, Permissions permissions) {
        if (id < MIN_ID || id > MAX_ID) {
            throw new IllegalArgumentException("ID de tarjeta fuera de rango (0-65535): " + id);
        }
        this.id = id;
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    /**
     * Tarjeta por defecto: id 0 con permiso regular.
     */
    public static Card defaultCard() {
        return new Card(0, Permissions.REGULAR);
    }

    /**
     * Verifica si la tarjeta tiene todos los permisos solicitados.
     */
    public boolean is(Permissions requested) {
        return permissions.contains(requested);
    }

    public boolean is(Permission flag) {
        return permissions.contains(flag);
    }

    /**
     * Nueva tarjeta con el mismo id y otros permisos.
     */
    public Card withPermissions(Permissions newPermissions) {
        return new Card(id, newPermissions);
    }

    /**
     * Convierte la tarjeta al payload de bytes listo para enviar al hardware.
     */
    public byte[] encode() {
        return CardJsonCodec.encode(this);
    }

    /**
     * Reconstruye una tarjeta desde bytes recibidos del hardware.
     *
     * @throws ConversionException si el buffer no es una tarjeta válida
     */
    public static Card decode(byte[] bytes) {
        return CardJsonCodec.decode(bytes);
    }

    @Override
    public String toString() {
        return "Card(id=" + id + ", permissions=" + permissions + ")";
    }
}
