package org.evalux.collab.service.document;

import lombok.extern.slf4j.Slf4j;
import org.evalux.collab.dto.DocumentUpdate;
import org.evalux.collab.events.EventBus;
import org.evalux.collab.exception.NoActiveSessionException;
import org.evalux.collab.model.AccessRole;
import org.evalux.collab.model.AnnotationReply;
import org.evalux.collab.model.CollaborationSession;
import org.evalux.collab.model.CollaborationUser;
import org.evalux.collab.model.DocumentAnnotation;
import org.evalux.collab.model.EditHistoryItem;
import org.evalux.collab.model.EditOperation;
import org.evalux.collab.model.SharedDocument;
import org.evalux.collab.service.access.AccessControlTable;
import org.evalux.collab.service.session.SessionRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registre des documents partagés. Chaque document possède son ACL et sa réplique ;
 * toute mutation passe par ici et est refusée (false, aucun changement) si le rôle de
 * l'appelant ne suffit pas.
 * <p>
 * L'état d'un document n'est pas synchronisé : l'hôte sérialise les appels par document.
 */
@Slf4j
@Service
public class DocumentStore {

    private final SessionRegistry sessions;
    private final EventBus events;
    private final boolean lockOnSessionClose;

    private final Map<UUID, Entry> documents = new ConcurrentHashMap<>();

    private static final class Entry {
        private SharedDocument document;
        private final AccessControlTable acl;
        private final ReplicatedDocument replica;

        private Entry(SharedDocument document, AccessControlTable acl, ReplicatedDocument replica) {
            this.document = document;
            this.acl = acl;
            this.replica = replica;
        }
    }

    @Autowired
    public DocumentStore(SessionRegistry sessions, EventBus events,
                         @Value("${collab.documents.lock-on-session-close:false}") boolean lockOnSessionClose) {
        this.sessions = sessions;
        this.events = events;
        this.lockOnSessionClose = lockOnSessionClose;
    }

    public DocumentStore(SessionRegistry sessions, EventBus events) {
        this(sessions, events, false);
    }

    // ------------------------------------------------------------
    // Création / partage
    // ------------------------------------------------------------

    /**
     * Crée un document dans la session active, version 1, créateur OWNER.
     *
     * @throws NoActiveSessionException si aucune session n'est active
     */
    public SharedDocument createSharedDocument(String title, String content, CollaborationUser creator) {
        Objects.requireNonNull(creator, "créateur manquant");
        CollaborationSession session = sessions.getActiveSession()
                .orElseThrow(NoActiveSessionException::new);

        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        SharedDocument doc = SharedDocument.builder()
                .id(id)
                .sessionId(session.getId())
                .title(title)
                .createdAt(now)
                .createdBy(creator.getId())
                .lastModifiedAt(now)
                .lastModifiedBy(creator.getId())
                .version(1)
                .build();

        documents.put(id, new Entry(doc, AccessControlTable.ownedBy(id, creator.getId()),
                new ReplicatedDocument(id, content)));

        log.info("Document {} '{}' créé par {}", id, title, creator.getName());
        events.publish(DocumentUpdate.documentCreated(id, creator.getId(),
                new DocumentUpdate.DocumentCreated(title, creator.getName())));
        return doc.toBuilder().build();
    }

    /** Ajoute ou remplace le rôle d'un utilisateur. False si le document est inconnu. */
    public boolean shareDocument(UUID documentId, UUID userId, AccessRole role) {
        Entry e = find(documentId);
        if (e == null) return false;

        e.acl.grant(userId, role);
        log.debug("Document {} partagé avec {} en {}", documentId, userId, role);
        events.publish(DocumentUpdate.documentShared(documentId, userId,
                new DocumentUpdate.DocumentShared(e.document.getTitle(), sessions.displayName(userId), role)));
        return true;
    }

    public boolean hasAccess(UUID userId, UUID documentId, AccessRole requiredRole) {
        Entry e = find(documentId);
        return e != null && e.acl.allows(userId, requiredRole);
    }

    public Optional<AccessRole> getRole(UUID documentId, UUID userId) {
        Entry e = find(documentId);
        return e == null ? Optional.empty() : e.acl.roleOf(userId);
    }

    // ------------------------------------------------------------
    // Édition
    // ------------------------------------------------------------

    /**
     * Applique une édition si l'appelant est au moins EDITOR. La version augmente de 1
     * exactement quand la méthode renvoie true.
     */
    public boolean applyEdit(UUID documentId, UUID userId, EditOperation operation) {
        Objects.requireNonNull(operation, "operation manquante");
        Entry e = find(documentId);
        if (e == null) return false;

        if (!e.acl.allows(userId, AccessRole.EDITOR)) {
            log.warn("Édition refusée sur {} pour {} (rôle insuffisant)", documentId, userId);
            return false;
        }
        if (isLocked(e)) {
            log.warn("Édition refusée sur {} : session d'origine fermée", documentId);
            return false;
        }

        EditOperation op = Objects.equals(operation.getUserId(), userId)
                ? operation
                : operation.toBuilder().userId(userId).build();
        String userName = sessions.displayName(userId);

        e.replica.applyOperation(op, userName);
        e.document = e.document.toBuilder()
                .version(e.document.getVersion() + 1)
                .lastModifiedAt(Instant.now())
                .lastModifiedBy(userId)
                .build();

        log.debug("Document {} v{} : {}", documentId, e.document.getVersion(), op.describe());
        events.publish(DocumentUpdate.documentEdited(documentId, userId,
                new DocumentUpdate.DocumentEdited(e.document.getTitle(), userName, op, e.document.getVersion())));
        return true;
    }

    // ------------------------------------------------------------
    // Annotations
    // ------------------------------------------------------------

    /** Ajoute une annotation (rôle VIEWER minimum). La position est conservée telle quelle. */
    public boolean addAnnotation(UUID documentId, UUID userId, DocumentAnnotation annotation) {
        Objects.requireNonNull(annotation, "annotation manquante");
        Entry e = find(documentId);
        if (e == null || !e.acl.allows(userId, AccessRole.VIEWER) || isLocked(e)) return false;

        DocumentAnnotation a = annotation.toBuilder()
                .id(annotation.getId() != null ? annotation.getId() : UUID.randomUUID())
                .userId(userId)
                .createdAt(annotation.getCreatedAt() != null ? annotation.getCreatedAt() : Instant.now())
                // copie : la liste de l'appelant ne doit pas pouvoir effacer les réponses stockées
                .replies(annotation.getReplies() == null ? List.of() : List.copyOf(annotation.getReplies()))
                .build();
        e.replica.addAnnotation(a);

        events.publish(DocumentUpdate.annotationAdded(documentId, userId,
                new DocumentUpdate.AnnotationAdded(e.document.getTitle(), sessions.displayName(userId),
                        a.getId(), a.getType(), a.getPosition())));
        return true;
    }

    public boolean addReply(UUID documentId, UUID annotationId, UUID userId, AnnotationReply reply) {
        Objects.requireNonNull(reply, "réponse manquante");
        Entry e = find(documentId);
        if (e == null || !e.acl.allows(userId, AccessRole.VIEWER) || isLocked(e)) return false;

        AnnotationReply r = reply.toBuilder()
                .id(reply.getId() != null ? reply.getId() : UUID.randomUUID())
                .userId(userId)
                .createdAt(reply.getCreatedAt() != null ? reply.getCreatedAt() : Instant.now())
                .build();
        if (!e.replica.addReply(annotationId, r)) return false;

        events.publish(DocumentUpdate.annotationReplied(documentId, userId,
                new DocumentUpdate.AnnotationReplied(e.document.getTitle(), sessions.displayName(userId),
                        annotationId, r.getId())));
        return true;
    }

    // ConcurrentHashMap refuse les clés null
    private Entry find(UUID documentId) {
        return documentId == null ? null : documents.get(documentId);
    }

    private boolean isLocked(Entry e) {
        return lockOnSessionClose && !sessions.isActive(e.document.getSessionId());
    }

    // ------------------------------------------------------------
    // Lecture
    // ------------------------------------------------------------

    public Map<UUID, SharedDocument> getSharedDocuments() {
        Map<UUID, SharedDocument> out = new LinkedHashMap<>();
        documents.forEach((id, e) -> out.put(id, e.document.toBuilder().build()));
        return out;
    }

    public Optional<SharedDocument> getSharedDocument(UUID documentId) {
        return Optional.ofNullable(find(documentId)).map(e -> e.document.toBuilder().build());
    }

    public Optional<String> getDocumentContent(UUID documentId) {
        return Optional.ofNullable(find(documentId)).map(e -> e.replica.getContent());
    }

    public List<EditHistoryItem> getEditHistory(UUID documentId) {
        Entry e = find(documentId);
        return e == null ? List.of() : e.replica.getHistory();
    }

    public List<DocumentAnnotation> getAnnotations(UUID documentId) {
        Entry e = find(documentId);
        return e == null ? List.of() : e.replica.getAnnotations();
    }
}
