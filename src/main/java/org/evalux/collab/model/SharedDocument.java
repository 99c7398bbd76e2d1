package org.evalux.collab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Métadonnées d'un document partagé. Le contenu vit dans le ReplicatedDocument associé.
 * Les instances rendues par le DocumentStore sont des copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SharedDocument {
    private UUID id;
    private UUID sessionId;      // session dans laquelle le document a été créé
    private String title;
    private Instant createdAt;
    private UUID createdBy;
    private Instant lastModifiedAt;
    private UUID lastModifiedBy;
    private int version;         // commence à 1, +1 par édition acceptée
}
