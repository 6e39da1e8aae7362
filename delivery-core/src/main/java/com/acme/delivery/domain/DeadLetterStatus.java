package com.acme.delivery.domain;

public enum DeadLetterStatus {
  ACTIVE,
  RETRIED,
  DISCARDED,
  EXPIRED
}
