package org.evalux.collab.service.session;

import lombok.extern.slf4j.Slf4j;
import org.evalux.collab.dto.SessionUpdate;
import org.evalux.collab.events.EventBus;
import org.evalux.collab.model.CollaborationSession;
import org.evalux.collab.model.CollaborationUser;
import org.evalux.collab.model.SessionStatus;
import org.evalux.collab.model.SharedConversation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session de collaboration courante et participants connectés.
 * <p>
 * Une seule session active par instance. Aucune synchronisation interne : l'hôte doit
 * sérialiser les appels (voir {@code CollaborationService}).
 */
@Slf4j
@Service
public class SessionRegistry {

    public static final String UNKNOWN_USER = "Unknown User";

    private final EventBus events;
    private final String unknownUserName;

    private volatile CollaborationSession current;
    private final Map<UUID, CollaborationUser> connected = new LinkedHashMap<>();
    // tous les utilisateurs déjà vus, pour résoudre les noms après leur départ
    private final Map<UUID, CollaborationUser> directory = new ConcurrentHashMap<>();

    @Autowired
    public SessionRegistry(EventBus events,
                           @Value("${collab.history.unknown-user-name:" + UNKNOWN_USER + "}")
                           String unknownUserName) {
        this.events = events;
        this.unknownUserName = unknownUserName;
    }

    public SessionRegistry(EventBus events) {
        this(events, UNKNOWN_USER);
    }

    // ------------------------------------------------------------
    public CollaborationSession createSession(String name, CollaborationUser creator) {
        Objects.requireNonNull(creator, "créateur manquant");

        CollaborationSession previous = current;
        if (previous != null && previous.isActive()) {
            close(previous, true);
        }

        CollaborationSession session = CollaborationSession.builder()
                .id(UUID.randomUUID())
                .name(name)
                .createdAt(Instant.now())
                .createdBy(creator.getId())
                .status(SessionStatus.ACTIVE)
                .build();

        current = session;
        connected.clear();
        connected.put(creator.getId(), creator);
        directory.put(creator.getId(), creator);

        log.info("Session {} '{}' créée par {}", session.getId(), name, creator.getName());
        events.publish(SessionUpdate.sessionCreated(session.getId(),
                new SessionUpdate.SessionCreated(name, creator.getId(), creator.getName())));
        return session;
    }

    /** @return false si {@code sessionId} n'est pas la session active */
    public boolean joinSession(UUID sessionId, CollaborationUser user) {
        CollaborationSession session = current;
        if (session == null || !session.isActive() || !session.getId().equals(sessionId)) {
            log.debug("Join refusé pour {} : session {} inconnue ou fermée", user != null ? user.getId() : null, sessionId);
            return false;
        }
        Objects.requireNonNull(user, "utilisateur manquant");

        directory.put(user.getId(), user);
        if (connected.containsKey(user.getId())) {
            return true;
        }
        connected.put(user.getId(), user);

        log.info("{} a rejoint la session {}", user.getName(), sessionId);
        events.publish(SessionUpdate.userJoined(sessionId,
                new SessionUpdate.UserJoined(user.getId(), user.getName())));
        return true;
    }

    public void leaveSession(CollaborationUser user) {
        CollaborationSession session = current;
        if (session == null || !session.isActive() || user == null) return;
        if (connected.remove(user.getId()) == null) return;

        log.info("{} a quitté la session {}", user.getName(), session.getId());
        events.publish(SessionUpdate.userLeft(session.getId(),
                new SessionUpdate.UserLeft(user.getId(), user.getName())));

        if (connected.isEmpty()) {
            close(session, false);
        }
    }

    // les documents ne sont pas touchés ici
    private void close(CollaborationSession session, boolean replaced) {
        current = session.toBuilder().status(SessionStatus.CLOSED).build();
        connected.clear();
        log.info("Session {} fermée{}", session.getId(), replaced ? " (remplacée)" : "");
        events.publish(SessionUpdate.sessionClosed(session.getId(),
                new SessionUpdate.SessionClosed(session.getName(), replaced)));
    }

    /** Diffuse une conversation dans la session active. */
    public boolean shareConversation(SharedConversation conversation, UUID userId) {
        CollaborationSession session = current;
        if (session == null || !session.isActive() || conversation == null) return false;

        events.publish(SessionUpdate.conversationShared(session.getId(),
                new SessionUpdate.ConversationShared(
                        conversation.getId(),
                        conversation.getTitle(),
                        userId,
                        displayName(userId),
                        conversation.getMessages().size())));
        return true;
    }

    // ------------------------------------------------------------
    public Set<CollaborationUser> getConnectedUsers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(connected.values()));
    }

    public Optional<CollaborationSession> getActiveSession() {
        return Optional.ofNullable(current).filter(CollaborationSession::isActive);
    }

    /** Dernière session créée, active ou fermée. */
    public Optional<CollaborationSession> getCurrentSession() {
        return Optional.ofNullable(current);
    }

    public boolean isActive(UUID sessionId) {
        CollaborationSession session = current;
        return session != null && session.isActive() && session.getId().equals(sessionId);
    }

    public String displayName(UUID userId) {
        if (userId == null) return unknownUserName;
        CollaborationUser u = directory.get(userId);
        return u != null && u.getName() != null ? u.getName() : unknownUserName;
    }
}
