package com.acme.delivery.transport;

import com.acme.delivery.retry.RetryPolicy;
import java.time.Duration;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Subscription settings recognised by every transport. */
@Getter
@Setter
@NoArgsConstructor
public class ConsumerOptions {

  private String consumerId = UUID.randomUUID().toString();
  private String group;
  private int concurrentMessageLimit = 1;
  private int prefetchCount = 10;
  private boolean autoAcknowledge = true;
  private boolean requeueOnFailure = true;
  private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
  private Duration messageLockDuration = Duration.ofMinutes(5);
  private boolean batchingEnabled = false;
  private int maxBatchSize = 100;
  private Duration batchTimeout = Duration.ofSeconds(1);
  private boolean startImmediately = true;

  public static ConsumerOptions defaults() {
    return new ConsumerOptions();
  }

  public void validate() {
    if (concurrentMessageLimit < 1) {
      throw new IllegalArgumentException(
          "concurrentMessageLimit must be >= 1, was " + concurrentMessageLimit);
    }
    if (prefetchCount < 1) {
      throw new IllegalArgumentException("prefetchCount must be >= 1, was " + prefetchCount);
    }
    if (batchingEnabled && maxBatchSize < 1) {
      throw new IllegalArgumentException("maxBatchSize must be >= 1, was " + maxBatchSize);
    }
  }
}
