package com.acme.delivery.processor.services;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.domain.OutboxEntry;
import com.acme.delivery.domain.OutboxOptions;
import com.acme.delivery.domain.OutboxStatus;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.repository.OutboxRepository;
import com.acme.delivery.repository.UnitOfWork;
import com.acme.delivery.repository.UnitOfWorkFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxServiceImpl Tests")
class OutboxServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private OutboxRepository repository;
    @Mock
    private UnitOfWorkFactory unitOfWorkFactory;
    @Mock
    private UnitOfWork unitOfWork;

    private OutboxServiceImpl service;

    @BeforeEach
    void setup() {
        service = new OutboxServiceImpl(repository, unitOfWorkFactory, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should insert a pending entry in the caller's unit of work")
    void testAddInUnitOfWork() {
        // Given
        Envelope envelope = Envelope.create("OrderPlaced", "{\"orderId\":42}".getBytes());
        OutboxOptions options = new OutboxOptions("orders", 7, 2, null);

        // When
        String id = service.add(envelope, options, unitOfWork);

        // Then
        ArgumentCaptor<OutboxEntry> captor = ArgumentCaptor.forClass(OutboxEntry.class);
        verify(repository).insert(captor.capture(), eq(unitOfWork));
        OutboxEntry entry = captor.getValue();
        assertThat(entry.getId()).isEqualTo(id);
        assertThat(entry.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(entry.getDestination()).isEqualTo("queue:orders");
        assertThat(entry.getPriority()).isEqualTo(7);
        assertThat(entry.getMaxRetries()).isEqualTo(2);
        assertThat(entry.getCreatedAt()).isEqualTo(NOW);
        assertThat(entry.getNextRetryAt()).isNull();
        Envelope stored = Jsons.fromJson(entry.getPayload(), Envelope.class);
        assertThat(stored.messageId()).isEqualTo(envelope.messageId());
        assertThat(stored.destination()).isEqualTo(TransportAddress.queue("orders"));
    }

    @Test
    @DisplayName("should postpone the first attempt when a delay is given")
    void testDelay() {
        // Given
        Envelope envelope = Envelope.create("OrderPlaced", new byte[0]);

        // When
        service.add(envelope, OutboxOptions.to("topic:order-events").withDelay(Duration.ofMinutes(5)), unitOfWork);

        // Then
        ArgumentCaptor<OutboxEntry> captor = ArgumentCaptor.forClass(OutboxEntry.class);
        verify(repository).insert(captor.capture(), eq(unitOfWork));
        assertThat(captor.getValue().getNextRetryAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(captor.getValue().getDestination()).isEqualTo("topic:order-events");
    }

    @Test
    @DisplayName("should open its own transaction without a unit of work")
    void testAddWithoutUnitOfWork() {
        // Given
        when(unitOfWorkFactory.inTransaction(any())).thenAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            Function<UnitOfWork, Object> work = invocation.getArgument(0);
            return work.apply(unitOfWork);
        });

        // When
        String id = service.add(Envelope.create("OrderPlaced", new byte[0]), OutboxOptions.to("orders"));

        // Then
        assertThat(id).isNotBlank();
        verify(repository).insert(any(OutboxEntry.class), eq(unitOfWork));
    }

    @Test
    @DisplayName("should reject a malformed destination before touching storage")
    void testInvalidDestination() {
        assertThatThrownBy(() -> service.add(
                Envelope.create("OrderPlaced", new byte[0]), OutboxOptions.to("queue:"), unitOfWork))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repository);
    }
}
