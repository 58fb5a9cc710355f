package com.cardaccess.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Permissions")
class PermissionsTest {

    private static List<Permissions> everySet() {
        List<Permissions> sets = new ArrayList<>();
        for (int bits = 0; bits <= Permissions.KNOWN_BITS; bits++) {
            sets.add(Permissions.fromBits(bits));
        }
        return sets;
    }

    @Nested
    @DisplayName("set algebra")
    class Algebra {

        @Test
        @DisplayName("union contains both operands")
        void unionContainsBothOperands() {
            for (Permissions a : everySet()) {
                for (Permissions b : everySet()) {
                    Permissions union = a.union(b);
                    assertThat(union.contains(a)).isTrue();
                    assertThat(union.contains(b)).isTrue();
                }
            }
        }

        @Test
        @DisplayName("intersect with itself is identity")
        void intersectIsIdempotent() {
            for (Permissions a : everySet()) {
                assertThat(a.intersect(a)).isEqualTo(a);
            }
        }

        @Test
        @DisplayName("difference removes the other operand's bits")
        void differenceRemovesBits() {
            Permissions set = Permissions.of(Permission.REGULAR, Permission.ADMIN, Permission.OPEN_DOORS);

            Permissions result = set.difference(Permissions.ADMIN);

            assertThat(result).isEqualTo(Permissions.of(Permission.REGULAR, Permission.OPEN_DOORS));
            assertThat(result.contains(Permission.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("symmetric difference keeps bits set in exactly one operand")
        void symmetricDifference() {
            Permissions a = Permissions.of(Permission.REGULAR, Permission.ADMIN);
            Permissions b = Permissions.of(Permission.ADMIN, Permission.IT_SUPPORT);

            assertThat(a.symmetricDifference(b))
                    .isEqualTo(Permissions.of(Permission.REGULAR, Permission.IT_SUPPORT));
        }

        @Test
        @DisplayName("operations never mutate the receiver")
        void operationsReturnNewValues() {
            Permissions regular = Permissions.REGULAR;

            regular.union(Permissions.ADMIN);
            regular.difference(Permissions.REGULAR);

            assertThat(regular.bits()).isEqualTo(Permission.REGULAR.bit());
        }

        @Test
        @DisplayName("every set contains the empty set")
        void containsEmpty() {
            for (Permissions a : everySet()) {
                assertThat(a.contains(Permissions.empty())).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("privileged")
    class Privileged {

        @Test
        @DisplayName("never contains NONE")
        void neverContainsNone() {
            assertThat(Permissions.privileged().contains(Permissions.NONE)).isFalse();
            assertThat(Permissions.privileged().contains(Permission.NONE)).isFalse();
        }

        @Test
        @DisplayName("contains every other flag")
        void containsOtherFlags() {
            assertThat(Permissions.privileged().flags())
                    .containsExactly(Permission.REGULAR, Permission.IT_SUPPORT, Permission.OPEN_DOORS,
                            Permission.ADMIN, Permission.SUPER_ADMIN);
        }
    }

    @Nested
    @DisplayName("fromBits")
    class FromBits {

        @Test
        @DisplayName("accepts every recognized combination")
        void acceptsKnownBits() {
            assertThat(Permissions.fromBits(0b111111)).isEqualTo(Permissions.all());
            assertThat(Permissions.fromBits(0)).isEqualTo(Permissions.empty());
        }

        @Test
        @DisplayName("rejects bits outside the six flags")
        void rejectsUnknownBits() {
            assertThatThrownBy(() -> Permissions.fromBits(64))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("0x40");
            assertThatThrownBy(() -> Permissions.fromBits(Permission.REGULAR.bit() | 128))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("NONE is a flag of its own, distinct from the empty set")
    void noneIsNotEmpty() {
        assertThat(Permissions.NONE.isEmpty()).isFalse();
        assertThat(Permissions.NONE).isNotEqualTo(Permissions.empty());
        assertThat(Permissions.NONE.bits()).isEqualTo(1);
    }

    @Test
    @DisplayName("renders flag names joined by a pipe")
    void rendersFlagNames() {
        assertThat(Permissions.of(Permission.ADMIN, Permission.REGULAR)).hasToString("REGULAR | ADMIN");
        assertThat(Permissions.empty()).hasToString("EMPTY");
    }
}
