package com.acme.delivery.processor;

import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.transport.Transport;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects the transport once the context is up and disconnects it on shutdown. A failed initial
 * connect does not stop the application; the transport reports FAULTED and sends fail fast.
 */
@Singleton
public class TransportConnector implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(TransportConnector.class);

  private final Transport transport;
  private final TransportOptions options;

  public TransportConnector(Transport transport, TransportOptions options) {
    this.transport = transport;
    this.options = options;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    transport
        .connect()
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                LOG.error("Transport {} failed to connect", transport.getName(), error);
              } else {
                LOG.info("Transport {} connected", transport.getName());
              }
            });
  }

  @PreDestroy
  void shutdown() {
    LOG.info("Disconnecting transport {}", transport.getName());
    try {
      transport.disconnect().get(options.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException e) {
      LOG.warn("Transport {} did not disconnect cleanly", transport.getName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
