package org.evalux.collab.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.evalux.collab.model.AccessRole;
import org.evalux.collab.model.AnnotationType;
import org.evalux.collab.model.EditOperation;

import java.time.Instant;
import java.util.UUID;

/** Événement sur un document partagé, même principe que {@link SessionUpdate}. */
@Value
@Builder
@Jacksonized
public class DocumentUpdate {
    DocumentUpdateType type;
    UUID documentId;
    UUID userId;
    Instant occurredAt;
    Payload payload;

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = DocumentCreated.class, name = "documentCreated"),
            @JsonSubTypes.Type(value = DocumentShared.class, name = "documentShared"),
            @JsonSubTypes.Type(value = DocumentEdited.class, name = "documentEdited"),
            @JsonSubTypes.Type(value = AnnotationAdded.class, name = "annotationAdded"),
            @JsonSubTypes.Type(value = AnnotationReplied.class, name = "annotationReplied")
    })
    public sealed interface Payload
            permits DocumentCreated, DocumentShared, DocumentEdited, AnnotationAdded, AnnotationReplied {}

    public record DocumentCreated(String title, String creatorName) implements Payload {}
    public record DocumentShared(String title, String userName, AccessRole role) implements Payload {}
    public record DocumentEdited(String title, String userName, EditOperation operation, int version) implements Payload {}
    public record AnnotationAdded(String title, String userName, UUID annotationId,
                                  AnnotationType annotationType, int position) implements Payload {}
    public record AnnotationReplied(String title, String userName, UUID annotationId, UUID replyId) implements Payload {}

    public static DocumentUpdate documentCreated(UUID documentId, UUID userId, DocumentCreated p) {
        return of(DocumentUpdateType.DOCUMENT_CREATED, documentId, userId, p);
    }

    public static DocumentUpdate documentShared(UUID documentId, UUID userId, DocumentShared p) {
        return of(DocumentUpdateType.DOCUMENT_SHARED, documentId, userId, p);
    }

    public static DocumentUpdate documentEdited(UUID documentId, UUID userId, DocumentEdited p) {
        return of(DocumentUpdateType.DOCUMENT_EDITED, documentId, userId, p);
    }

    public static DocumentUpdate annotationAdded(UUID documentId, UUID userId, AnnotationAdded p) {
        return of(DocumentUpdateType.ANNOTATION_ADDED, documentId, userId, p);
    }

    public static DocumentUpdate annotationReplied(UUID documentId, UUID userId, AnnotationReplied p) {
        return of(DocumentUpdateType.ANNOTATION_REPLIED, documentId, userId, p);
    }

    private static DocumentUpdate of(DocumentUpdateType type, UUID documentId, UUID userId, Payload p) {
        return DocumentUpdate.builder()
                .type(type)
                .documentId(documentId)
                .userId(userId)
                .occurredAt(Instant.now())
                .payload(p)
                .build();
    }
}
