package org.evalux.collab.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Une édition positionnelle. Pour DELETE et REPLACE, la longueur de la plage visée
 * est celle de {@code content}, pas celle du texte réellement présent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EditOperation {
    @NonNull EditOperationType type;
    int position;
    @NonNull String content;
    Instant timestamp;
    UUID userId;

    public static EditOperation insert(UUID userId, int position, String text) {
        return of(EditOperationType.INSERT, userId, position, text);
    }

    public static EditOperation delete(UUID userId, int position, String removed) {
        return of(EditOperationType.DELETE, userId, position, removed);
    }

    public static EditOperation replace(UUID userId, int position, String replacement) {
        return of(EditOperationType.REPLACE, userId, position, replacement);
    }

    private static EditOperation of(EditOperationType type, UUID userId, int position, String content) {
        return EditOperation.builder()
                .type(type)
                .userId(userId)
                .position(position)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public String describe() {
        return switch (type) {
            case INSERT -> "Inserted \"" + content + "\" at position " + position;
            case DELETE -> "Deleted \"" + content + "\" at position " + position;
            case REPLACE -> "Replaced with \"" + content + "\" at position " + position;
        };
    }
}
