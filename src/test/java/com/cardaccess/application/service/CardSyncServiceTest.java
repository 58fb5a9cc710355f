package com.cardaccess.application.service;

import com.cardaccess.domain.exception.ConversionException;
import com.cardaccess.domain.exception.KernelException;
import com.cardaccess.domain.model.Card;
import com.cardaccess.domain.model.Permission;
import com.cardaccess.domain.model.Permissions;
import com.cardaccess.domain.port.CardKernel;
import com.cardaccess.domain.port.CardLease;
import com.cardaccess.infrastructure.kernel.InMemoryCardKernel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CardSyncService")
class CardSyncServiceTest {

    @Mock
    private CardKernel kernel;

    @Mock
    private CardLease lease;

    private CardRegistry<CardKernel> registry;
    private CardSyncService service;

    @BeforeEach
    void setUp() {
        registry = CardRegistry.withKernel(kernel);
        service = new CardSyncService(registry);
    }

    @Nested
    @DisplayName("import and export")
    class ImportExport {

        @Test
        @DisplayName("importCard decodes and stores the card")
        void importStoresCard() {
            Card card = service.importCard("{\"id\":12,\"permissions\":10}".getBytes(StandardCharsets.UTF_8));

            assertThat(card).isEqualTo(new Card(12, Permissions.of(Permission.REGULAR, Permission.OPEN_DOORS)));
            assertThat(registry.get(12)).contains(card);
        }

        @Test
        @DisplayName("importCard propagates ConversionException and stores nothing")
        void importRejectsBadPayload() {
            byte[] payload = "{\"id\": 1, \"permissions\": 64}".getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> service.importCard(payload))
                    .isInstanceOf(ConversionException.class);
            assertThat(registry.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("exportCard encodes a registered card")
        void exportCard() {
            registry.put(new Card(4, Permissions.ADMIN));

            assertThat(service.exportCard(4))
                    .hasValueSatisfying(bytes -> assertThat(Card.decode(bytes)).isEqualTo(new Card(4, Permissions.ADMIN)));
            assertThat(service.exportCard(5)).isEmpty();
        }

        @Test
        @DisplayName("exportAll encodes every card in id order")
        void exportAll() {
            registry.put(new Card(9, Permissions.REGULAR));
            registry.put(new Card(1, Permissions.ADMIN));

            assertThat(service.exportAll())
                    .extracting(bytes -> Card.decode(bytes).getId())
                    .containsExactly(1, 9);
        }
    }

    @Nested
    @DisplayName("kernel bridge")
    class KernelBridge {

        @Test
        @DisplayName("refresh reads the physical card and stores it")
        void refreshStoresCard() {
            Card physical = new Card(8, Permissions.IT_SUPPORT);
            when(kernel.read(8)).thenReturn(physical);

            assertThat(service.refresh(8)).isEqualTo(physical);
            assertThat(registry.get(8)).contains(physical);
        }

        @Test
        @DisplayName("refresh propagates KernelException and leaves the registry untouched")
        void refreshPropagatesKernelError() {
            registry.put(new Card(8, Permissions.REGULAR));
            when(kernel.read(8)).thenThrow(KernelException.read("timeout", KernelException.NO_RESPONSE));

            assertThatThrownBy(() -> service.refresh(8))
                    .isInstanceOf(KernelException.class)
                    .hasMessage("ReadError(message: timeout, code: 25600)");
            assertThat(registry.get(8)).contains(new Card(8, Permissions.REGULAR));
        }

        @Test
        @DisplayName("push writes the encoded card to the kernel")
        void pushWritesEncodedCard() {
            Card card = new Card(2, Permissions.REGULAR);
            registry.put(card);

            service.push(2);

            verify(kernel).write(eq(card), eq(card.encode()));
        }

        @Test
        @DisplayName("push of an unknown card never reaches the kernel")
        void pushUnknownCard() {
            assertThatThrownBy(() -> service.push(2))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(kernel, never()).write(any(), any());
        }

        @Test
        @DisplayName("push propagates write failures")
        void pushPropagatesWriteFailure() {
            Card card = new Card(2, Permissions.REGULAR);
            registry.put(card);
            doThrow(KernelException.write("bad checksum", 0x6581)).when(kernel).write(eq(card), any());

            assertThatThrownBy(() -> service.push(2))
                    .isInstanceOfSatisfying(KernelException.class, e -> {
                        assertThat(e.getOperation()).isEqualTo(KernelException.Operation.WRITE);
                        assertThat(e.getCode()).isEqualTo(0x6581);
                    });
        }

        @Test
        @DisplayName("grant replaces the card under a lease and releases it")
        void grantUsesLease() {
            when(kernel.readMutable(6)).thenReturn(lease);
            when(lease.card()).thenReturn(new Card(6, Permissions.REGULAR));

            Card updated = service.grant(6, Permissions.of(Permission.REGULAR, Permission.OPEN_DOORS));

            assertThat(updated).isEqualTo(new Card(6, Permissions.of(Permission.REGULAR, Permission.OPEN_DOORS)));
            assertThat(registry.get(6)).contains(updated);
            InOrder order = inOrder(lease);
            order.verify(lease).replace(updated);
            order.verify(lease).close();
        }

        @Test
        @DisplayName("grant releases the lease when the write fails")
        void grantReleasesOnFailure() {
            when(kernel.readMutable(6)).thenReturn(lease);
            when(lease.card()).thenReturn(new Card(6, Permissions.REGULAR));
            doThrow(KernelException.write("device absent", KernelException.NOT_FOUND)).when(lease).replace(any());

            assertThatThrownBy(() -> service.grant(6, Permissions.ADMIN))
                    .isInstanceOf(KernelException.class);

            verify(lease).close();
            assertThat(registry.contains(6)).isFalse();
        }
    }

    @Test
    @DisplayName("cards sensed by the kernel end up in the registry")
    void sensedCardsAreRegistered() {
        InMemoryCardKernel simulated = new InMemoryCardKernel();
        CardRegistry<InMemoryCardKernel> simulatedRegistry = CardRegistry.withKernel(simulated);
        CardSyncService sync = new CardSyncService(simulatedRegistry);
        sync.init();

        simulated.place(new Card(30, Permissions.REGULAR));
        simulated.place(new Card(20, Permissions.ADMIN));
        simulated.sense();

        assertThat(simulatedRegistry.cards())
                .containsExactly(new Card(20, Permissions.ADMIN), new Card(30, Permissions.REGULAR));
    }
}
