package com.acme.delivery.message;

/** Upgrades one message type from a single version to the next. */
@FunctionalInterface
public interface MessageConverter {
  Envelope convert(Envelope envelope);
}
