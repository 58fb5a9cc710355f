package com.cardaccess.domain.model;

import lombok.EqualsAndHashCode;

import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Conjunto inmutable de permisos representado como máscara de bits.
 * Todas las operaciones devuelven un nuevo valor; la igualdad es bit a bit.
 */
@EqualsAndHashCode
public final class Permissions {

    /** Máscara con todos los bits reconocidos */
    public static final int KNOWN_BITS = computeKnownBits();

    private static final Permissions EMPTY = new Permissions(0);
    private static final Permissions ALL = new Permissions(KNOWN_BITS);

    public static final Permissions NONE = of(Permission.NONE);
    public static final Permissions REGULAR = of(Permission.REGULAR);
    public static final Permissions IT_SUPPORT = of(Permission.IT_SUPPORT);
    public static final Permissions OPEN_DOORS = of(Permission.OPEN_DOORS);
    public static final Permissions ADMIN = of(Permission.ADMIN);
    public static final Permissions SUPER_ADMIN = of(Permission.SUPER_ADMIN);

    private final int bits;

    private Permissions(int bits) {
        this.bits = bits;
    }

    /**
     * Construye un conjunto a partir de los flags indicados.
     */
    public static Permissions of(Permission... flags) {
        int bits = 0;
        for (Permission flag : flags) {
            bits |= flag.bit();
        }
        return new Permissions(bits);
    }

    /**
     * Construye un conjunto a partir de una máscara cruda.
     *
     * @param bits Máscara de bits
     * @return Conjunto equivalente
     * @throws IllegalArgumentException si la máscara contiene bits no reconocidos
     */
    public static Permissions fromBits(int bits) {
        if ((bits & ~KNOWN_BITS) != 0) {
            throw new IllegalArgumentException(
                    String.format("Bits de permiso no reconocidos: 0x%X", bits & ~KNOWN_BITS));
        }
        return new Permissions(bits);
    }

    public static Permissions empty() {
        return EMPTY;
    }

    public static Permissions all() {
        return ALL;
    }

    /**
     * Todos los permisos excepto {@link Permission#NONE}.
     */
    public static Permissions privileged() {
        return ALL.symmetricDifference(NONE);
    }

    public int bits() {
        return bits;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    /**
     * Verifica si todos los bits de {@code other} están presentes.
     */
    public boolean contains(Permissions other) {
        return (bits & other.bits) == other.bits;
    }

    public boolean contains(Permission flag) {
        return (bits & flag.bit()) != 0;
    }

    public Permissions union(Permissions other) {
        return new Permissions(bits | other.bits);
    }

    public Permissions intersect(Permissions other) {
        return new Permissions(bits & other.bits);
    }

    public Permissions difference(Permissions other) {
        return new Permissions(bits & ~other.bits);
    }

    public Permissions symmetricDifference(Permissions other) {
        return new Permissions(bits ^ other.bits);
    }

    /**
     * Copia de los flags activos en orden de bit.
     */
    public Set<Permission> flags() {
        EnumSet<Permission> flags = EnumSet.noneOf(Permission.class);
        for (Permission flag : Permission.values()) {
            if (contains(flag)) {
                flags.add(flag);
            }
        }
        return flags;
    }

    @Override
    public String toString() {
        if (bits == 0) {
            return "EMPTY";
        }
        StringJoiner joiner = new StringJoiner(" | ");
        flags().forEach(flag -> joiner.add(flag.name()));
        return joiner.toString();
    }

    private static int computeKnownBits() {
        int bits = 0;
        for (Permission flag : Permission.values()) {
            bits |= flag.bit();
        }
        return bits;
    }
}
