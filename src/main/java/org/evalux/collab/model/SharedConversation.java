package org.evalux.collab.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Conversation diffusée dans la session. Seul un résumé part dans l'événement. */
@Value
@Builder
@Jacksonized
public class SharedConversation {
    UUID id;
    String title;
    Instant createdAt;
    UUID createdBy;
    @Singular
    List<SharedMessage> messages;
}
