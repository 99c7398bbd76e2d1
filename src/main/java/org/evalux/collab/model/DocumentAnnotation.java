package org.evalux.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Annotation ancrée sur une position fixée à la création. La position n'est jamais
 * recalée après des insertions ou suppressions : elle peut donc pointer à côté du
 * texte visé une fois le document modifié.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DocumentAnnotation {
    UUID id;
    UUID userId;
    Instant createdAt;
    AnnotationType type;
    int position;
    String content;
    @Builder.Default
    List<AnnotationReply> replies = List.of();

    /** Copie de l'annotation avec la réponse ajoutée en fin de liste. */
    public DocumentAnnotation withReply(AnnotationReply reply) {
        List<AnnotationReply> all = replies == null ? new ArrayList<>() : new ArrayList<>(replies);
        all.add(reply);
        return toBuilder().replies(List.copyOf(all)).build();
    }
}
