package com.acme.delivery.domain;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.message.Envelope;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Dead letter domain entity (pure domain object, no persistence annotations). Starts ACTIVE and
 * moves once to RETRIED, DISCARDED or EXPIRED; entries are never reused.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {

    private String id;
    private String messagePayload;
    private String messageType;
    private String reason;
    private String component;
    private int retryCount;
    private Instant failureTime;
    private DeadLetterStatus status;
    private Instant createdAt;
    private Instant retriedAt;
    private Instant discardedAt;
    private String exceptionMessage;
    private Map<String, String> metadata;

    public Envelope envelope() {
        return Jsons.fromJson(messagePayload, Envelope.class);
    }
}
