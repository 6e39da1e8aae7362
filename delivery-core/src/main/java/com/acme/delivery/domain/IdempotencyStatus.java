package com.acme.delivery.domain;

public enum IdempotencyStatus {
  SUCCESS,
  FAILURE
}
