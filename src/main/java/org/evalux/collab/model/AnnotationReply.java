package org.evalux.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnnotationReply {
    UUID id;
    UUID userId;
    Instant createdAt;
    String content;
}
