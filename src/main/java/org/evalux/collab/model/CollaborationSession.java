package org.evalux.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/** Instantané d'une session : la fermeture produit une nouvelle instance CLOSED. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CollaborationSession {
    UUID id;
    String name;
    Instant createdAt;
    UUID createdBy;
    SessionStatus status;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
