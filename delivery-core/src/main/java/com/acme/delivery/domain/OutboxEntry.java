package com.acme.delivery.domain;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outbox domain entity (pure domain object, no persistence annotations). Created PENDING on
 * enqueue and mutated only by the relay. {@code claimToken}, {@code claimedBy} and {@code
 * lockedUntil} describe the current lease while PROCESSING.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEntry {

    private String id;
    private String messageType;
    private String payload;
    private String destination;
    private int priority;
    private OutboxStatus status;
    private int retryCount;
    private Integer maxRetries;
    private Instant createdAt;
    private Instant processedAt;
    private Instant nextRetryAt;
    private String lastError;
    private String claimedBy;
    private String claimToken;
    private Instant lockedUntil;

    /**
     * Deserializes the stored envelope.
     *
     * @throws com.acme.delivery.core.PoisonMessageException if the payload is not a valid envelope
     */
    public Envelope envelope() {
        return Jsons.fromJson(payload, Envelope.class);
    }

    public TransportAddress destinationAddress() {
        return TransportAddress.parse(destination);
    }

    public boolean isTerminal() {
        return status == OutboxStatus.PROCESSED || status == OutboxStatus.FAILED;
    }
}
