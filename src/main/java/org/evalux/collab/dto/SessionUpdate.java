package org.evalux.collab.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Événement de session. {@code payload} porte les champs propres à chaque type ;
 * utiliser les fabriques statiques pour garder type et payload cohérents.
 */
@Value
@Builder
@Jacksonized
public class SessionUpdate {
    SessionUpdateType type;
    UUID sessionId;
    Instant occurredAt;
    Payload payload;

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = SessionCreated.class, name = "sessionCreated"),
            @JsonSubTypes.Type(value = UserJoined.class, name = "userJoined"),
            @JsonSubTypes.Type(value = UserLeft.class, name = "userLeft"),
            @JsonSubTypes.Type(value = SessionClosed.class, name = "sessionClosed"),
            @JsonSubTypes.Type(value = ConversationShared.class, name = "conversationShared")
    })
    public sealed interface Payload
            permits SessionCreated, UserJoined, UserLeft, SessionClosed, ConversationShared {}

    public record SessionCreated(String name, UUID creatorId, String creatorName) implements Payload {}
    public record UserJoined(UUID userId, String userName) implements Payload {}
    public record UserLeft(UUID userId, String userName) implements Payload {}
    /** {@code replaced} : fermée parce qu'une nouvelle session a été créée. */
    public record SessionClosed(String name, boolean replaced) implements Payload {}
    public record ConversationShared(UUID conversationId, String title, UUID userId,
                                     String userName, int messageCount) implements Payload {}

    public static SessionUpdate sessionCreated(UUID sessionId, SessionCreated p) {
        return of(SessionUpdateType.SESSION_CREATED, sessionId, p);
    }

    public static SessionUpdate userJoined(UUID sessionId, UserJoined p) {
        return of(SessionUpdateType.USER_JOINED, sessionId, p);
    }

    public static SessionUpdate userLeft(UUID sessionId, UserLeft p) {
        return of(SessionUpdateType.USER_LEFT, sessionId, p);
    }

    public static SessionUpdate sessionClosed(UUID sessionId, SessionClosed p) {
        return of(SessionUpdateType.SESSION_CLOSED, sessionId, p);
    }

    public static SessionUpdate conversationShared(UUID sessionId, ConversationShared p) {
        return of(SessionUpdateType.CONVERSATION_SHARED, sessionId, p);
    }

    private static SessionUpdate of(SessionUpdateType type, UUID sessionId, Payload p) {
        return SessionUpdate.builder()
                .type(type)
                .sessionId(sessionId)
                .occurredAt(Instant.now())
                .payload(p)
                .build();
    }
}
