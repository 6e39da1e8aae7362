package com.acme.delivery.message;

import com.acme.delivery.core.PoisonMessageException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version-keyed table of explicit converters. A converter registered for {@code (type, n)} turns a
 * version {@code n} message into version {@code n + 1}; {@link #upgrade} chains them until the
 * target version is reached. The current version travels in the {@value
 * MessageHeaders#MESSAGE_VERSION} header; a message without the header is version 1.
 */
public class MessageConverterRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(MessageConverterRegistry.class);

  private final Map<Key, MessageConverter> converters = new ConcurrentHashMap<>();

  private record Key(String messageType, int fromVersion) {}

  public MessageConverterRegistry register(
      String messageType, int fromVersion, MessageConverter converter) {
    if (fromVersion < 1) {
      throw new IllegalArgumentException("fromVersion must be >= 1, was " + fromVersion);
    }
    MessageConverter previous = converters.putIfAbsent(new Key(messageType, fromVersion), converter);
    if (previous != null) {
      throw new IllegalStateException(
          "Converter already registered for " + messageType + " v" + fromVersion);
    }
    return this;
  }

  public static int versionOf(Envelope envelope) {
    return envelope
        .getHeader(MessageHeaders.MESSAGE_VERSION)
        .map(h -> (int) h.asLong())
        .orElse(1);
  }

  /**
   * Upgrades {@code envelope} to {@code targetVersion}.
   *
   * @throws PoisonMessageException if a step in the chain has no converter, or the message is
   *     newer than the target
   */
  public Envelope upgrade(Envelope envelope, int targetVersion) {
    int version = versionOf(envelope);
    if (version > targetVersion) {
      throw new PoisonMessageException(
          envelope.messageType() + " v" + version + " is newer than supported v" + targetVersion);
    }
    Envelope current = envelope;
    while (version < targetVersion) {
      MessageConverter converter = converters.get(new Key(envelope.messageType(), version));
      if (converter == null) {
        throw new PoisonMessageException(
            "No converter for " + envelope.messageType() + " v" + version + " -> v" + (version + 1));
      }
      current = converter.convert(current).withHeader(MessageHeaders.MESSAGE_VERSION, (long) version + 1);
      version++;
    }
    if (current != envelope) {
      LOG.debug(
          "Upgraded {} {} to v{}", envelope.messageType(), envelope.messageId(), targetVersion);
    }
    return current;
  }
}
