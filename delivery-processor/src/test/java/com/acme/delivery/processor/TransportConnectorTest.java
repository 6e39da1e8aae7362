package com.acme.delivery.processor;

import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.transport.Transport;
import io.micronaut.context.BeanContext;
import io.micronaut.context.event.StartupEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TransportConnector Tests")
class TransportConnectorTest {

    @Mock
    private Transport transport;

    private TransportConnector connector;

    @BeforeEach
    void setup() {
        TransportOptions options = new TransportOptions();
        options.setDrainTimeout(Duration.ofMillis(100));
        connector = new TransportConnector(transport, options);
        lenient().when(transport.getName()).thenReturn("in-memory");
    }

    @Test
    @DisplayName("should connect the transport on startup")
    void testConnectOnStartup() {
        // Given
        when(transport.connect()).thenReturn(CompletableFuture.completedFuture(null));

        // When
        connector.onApplicationEvent(new StartupEvent(mock(BeanContext.class)));

        // Then
        verify(transport).connect();
    }

    @Test
    @DisplayName("should keep starting when the initial connect fails")
    void testConnectFailure() {
        // Given
        when(transport.connect()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("refused")));

        // When / Then
        assertThatCode(() -> connector.onApplicationEvent(new StartupEvent(mock(BeanContext.class))))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should give up waiting for a disconnect after the drain timeout")
    void testShutdownTimeout() {
        // Given
        when(transport.disconnect()).thenReturn(new CompletableFuture<>());

        // When / Then
        assertThatCode(() -> connector.shutdown()).doesNotThrowAnyException();
        verify(transport).disconnect();
    }
}
