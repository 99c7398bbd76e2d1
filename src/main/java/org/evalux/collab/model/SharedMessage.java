package org.evalux.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class SharedMessage {
    UUID id;
    UUID userId;
    Instant timestamp;
    String content;
    boolean fromAssistant;
}
