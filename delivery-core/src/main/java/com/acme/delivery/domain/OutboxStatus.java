package com.acme.delivery.domain;

public enum OutboxStatus {
  PENDING,
  PROCESSING,
  PROCESSED,
  FAILED
}
