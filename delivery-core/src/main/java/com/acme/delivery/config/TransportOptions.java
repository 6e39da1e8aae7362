package com.acme.delivery.config;

import com.acme.delivery.retry.RetryPolicy;
import java.time.Duration;

/**
 * Connection, pooling and reconnection settings for a transport. Pure POJO - no framework
 * dependencies.
 */
public class TransportOptions {

  private String name = "default";
  private boolean autoReconnect = true;
  private Duration connectionTimeout = Duration.ofSeconds(30);
  private Duration requestTimeout = Duration.ofSeconds(30);
  private Duration consumerStopTimeout = Duration.ofSeconds(30);
  private Duration drainTimeout = Duration.ofSeconds(30);
  private int minPoolSize = 1;
  private int maxPoolSize = 10;
  private Duration connectionIdleTimeout = Duration.ofMinutes(5);
  private int maxQueueLength = 10_000;
  private boolean dropWhenFull = false;
  private Reconnect reconnect = new Reconnect();

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public boolean isAutoReconnect() {
    return autoReconnect;
  }

  public void setAutoReconnect(boolean autoReconnect) {
    this.autoReconnect = autoReconnect;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public Duration getConsumerStopTimeout() {
    return consumerStopTimeout;
  }

  public void setConsumerStopTimeout(Duration consumerStopTimeout) {
    this.consumerStopTimeout = consumerStopTimeout;
  }

  public Duration getDrainTimeout() {
    return drainTimeout;
  }

  public void setDrainTimeout(Duration drainTimeout) {
    this.drainTimeout = drainTimeout;
  }

  public int getMinPoolSize() {
    return minPoolSize;
  }

  public void setMinPoolSize(int minPoolSize) {
    this.minPoolSize = minPoolSize;
  }

  public int getMaxPoolSize() {
    return maxPoolSize;
  }

  public void setMaxPoolSize(int maxPoolSize) {
    this.maxPoolSize = maxPoolSize;
  }

  public Duration getConnectionIdleTimeout() {
    return connectionIdleTimeout;
  }

  public void setConnectionIdleTimeout(Duration connectionIdleTimeout) {
    this.connectionIdleTimeout = connectionIdleTimeout;
  }

  public int getMaxQueueLength() {
    return maxQueueLength;
  }

  public void setMaxQueueLength(int maxQueueLength) {
    this.maxQueueLength = maxQueueLength;
  }

  public boolean isDropWhenFull() {
    return dropWhenFull;
  }

  public void setDropWhenFull(boolean dropWhenFull) {
    this.dropWhenFull = dropWhenFull;
  }

  public Reconnect getReconnect() {
    return reconnect;
  }

  public void setReconnect(Reconnect reconnect) {
    this.reconnect = reconnect;
  }

  /** Reconnection schedule. Defaults to infinite attempts, 5s doubling up to one minute. */
  public static class Reconnect {
    private int maxAttempts = RetryPolicy.INFINITE;
    private Duration initialDelay = Duration.ofSeconds(5);
    private Duration maxDelay = Duration.ofMinutes(1);
    private boolean exponentialBackoff = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public boolean isExponentialBackoff() {
      return exponentialBackoff;
    }

    public void setExponentialBackoff(boolean exponentialBackoff) {
      this.exponentialBackoff = exponentialBackoff;
    }

    public RetryPolicy toRetryPolicy() {
      return new RetryPolicy(maxAttempts, initialDelay, maxDelay, exponentialBackoff);
    }
  }
}
