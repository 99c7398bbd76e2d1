package org.evalux.collab.service;

import lombok.RequiredArgsConstructor;
import org.evalux.collab.dto.msg.*;
import org.evalux.collab.model.AccessRole;
import org.evalux.collab.model.CollaborationSession;
import org.evalux.collab.model.CollaborationUser;
import org.evalux.collab.model.SharedDocument;
import org.evalux.collab.service.document.DocumentStore;
import org.evalux.collab.service.session.SessionRegistry;
import org.evalux.collab.service.util.Locks;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Point d'entrée de l'hôte, sûr entre threads.
 * <p>
 * SessionRegistry et DocumentStore ne se verrouillent pas eux-mêmes : ici, les appels de
 * session (et la création de document, qui lit la session active) passent sous le verrou
 * de session, et chaque appel sur un document sous le verrou de ce document. L'ordre
 * d'acquisition des verrous d'un document donne l'ordre total de ses éditions.
 */
@Service
@RequiredArgsConstructor
public class CollaborationService {

    private final SessionRegistry sessions;
    private final DocumentStore documents;
    private final Locks locks;

    // ------------------------------------------------------------
    // Session
    // ------------------------------------------------------------
    public CollaborationSession createSession(CreateSessionMsg msg) {
        synchronized (locks.session()) {
            return sessions.createSession(msg.getName(), msg.getUser());
        }
    }

    public boolean join(JoinSessionMsg msg) {
        synchronized (locks.session()) {
            return sessions.joinSession(msg.getSessionId(), msg.getUser());
        }
    }

    /** Le départ ne vaut que pour la session active ; un sessionId périmé est ignoré. */
    public void leave(LeaveSessionMsg msg) {
        synchronized (locks.session()) {
            if (msg.getSessionId() != null && !sessions.isActive(msg.getSessionId())) return;
            sessions.leaveSession(msg.getUser());
        }
    }

    public Set<CollaborationUser> connectedUsers() {
        synchronized (locks.session()) {
            return sessions.getConnectedUsers();
        }
    }

    public boolean shareConversation(ShareConversationMsg msg) {
        synchronized (locks.session()) {
            if (msg.getSessionId() != null && !sessions.isActive(msg.getSessionId())) return false;
            return sessions.shareConversation(msg.getConversation(), msg.getUserId());
        }
    }

    // ------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------
    public SharedDocument createDocument(CreateDocumentMsg msg) {
        synchronized (locks.session()) {
            return documents.createSharedDocument(msg.getTitle(), msg.getContent(), msg.getUser());
        }
    }

    /** Partage par un OWNER du document uniquement. */
    public boolean share(ShareDocumentMsg msg) {
        synchronized (locks.of(msg.getDocumentId())) {
            if (!documents.hasAccess(msg.getUserId(), msg.getDocumentId(), AccessRole.OWNER)) {
                return false;
            }
            return documents.shareDocument(msg.getDocumentId(), msg.getTargetUserId(), msg.getRole());
        }
    }

    public boolean edit(EditMsg msg) {
        Objects.requireNonNull(msg.getOperation(), "operation manquante");
        synchronized (locks.of(msg.getDocumentId())) {
            return documents.applyEdit(msg.getDocumentId(), msg.getUserId(), msg.getOperation());
        }
    }

    public boolean annotate(AnnotateMsg msg) {
        synchronized (locks.of(msg.getDocumentId())) {
            return documents.addAnnotation(msg.getDocumentId(), msg.getUserId(), msg.getAnnotation());
        }
    }

    public boolean reply(ReplyMsg msg) {
        synchronized (locks.of(msg.getDocumentId())) {
            return documents.addReply(msg.getDocumentId(), msg.getAnnotationId(), msg.getUserId(), msg.getReply());
        }
    }

    public String content(UUID documentId) {
        synchronized (locks.of(documentId)) {
            return documents.getDocumentContent(documentId).orElse(null);
        }
    }
}
