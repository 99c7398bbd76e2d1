package org.evalux.collab.service;

import org.evalux.collab.dto.DocumentUpdate;
import org.evalux.collab.dto.DocumentUpdateType;
import org.evalux.collab.dto.SessionUpdate;
import org.evalux.collab.dto.SessionUpdateType;
import org.evalux.collab.dto.msg.*;
import org.evalux.collab.events.EventBus;
import org.evalux.collab.exception.NoActiveSessionException;
import org.evalux.collab.model.*;
import org.evalux.collab.service.document.DocumentStore;
import org.evalux.collab.service.session.SessionRegistry;
import org.evalux.collab.service.util.Locks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/** Scénarios de bout en bout avec les vrais composants. */
class CollaborationServiceTest {

    EventBus bus;
    SessionRegistry sessions;
    DocumentStore documents;
    CollaborationService service;

    List<SessionUpdate> sessionEvents = new ArrayList<>();
    List<DocumentUpdate> documentEvents = new ArrayList<>();

    CollaborationUser alice = user("Alice");
    CollaborationUser bob = user("Bob");

    @BeforeEach
    void init() {
        bus = new EventBus();
        sessions = new SessionRegistry(bus);
        documents = new DocumentStore(sessions, bus);
        service = new CollaborationService(sessions, documents, new Locks());
        bus.onSessionUpdate(sessionEvents::add);
        bus.onDocumentUpdate(documentEvents::add);
    }

    @Test
    void scenario_designSync() {
        CollaborationSession s = service.createSession(CreateSessionMsg.builder().name("Design Sync").user(alice).build());
        assertThat(service.join(JoinSessionMsg.builder().sessionId(s.getId()).user(bob).build())).isTrue();

        SharedDocument doc = service.createDocument(CreateDocumentMsg.builder()
                .sessionId(s.getId()).title("Spec").content("Hello").user(alice).build());
        assertThat(doc.getVersion()).isEqualTo(1);

        // Bob n'a aucun rôle : refus
        assertThat(service.edit(edit(doc, bob, EditOperation.delete(bob.getId(), 0, "H")))).isFalse();
        assertThat(documents.getSharedDocument(doc.getId()).orElseThrow().getVersion()).isEqualTo(1);

        assertThat(service.share(ShareDocumentMsg.builder().documentId(doc.getId())
                .userId(alice.getId()).targetUserId(bob.getId()).role(AccessRole.EDITOR).build())).isTrue();

        assertThat(service.edit(edit(doc, bob, EditOperation.insert(bob.getId(), 5, " World")))).isTrue();
        assertThat(service.content(doc.getId())).isEqualTo("Hello World");
        assertThat(documents.getSharedDocument(doc.getId()).orElseThrow().getVersion()).isEqualTo(2);
        assertThat(documentEvents).last()
                .satisfies(e -> {
                    assertThat(e.getType()).isEqualTo(DocumentUpdateType.DOCUMENT_EDITED);
                    assertThat(((DocumentUpdate.DocumentEdited) e.getPayload()).version()).isEqualTo(2);
                });

        service.leave(LeaveSessionMsg.builder().sessionId(s.getId()).user(alice).build());
        assertThat(sessions.getCurrentSession().orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);

        service.leave(LeaveSessionMsg.builder().sessionId(s.getId()).user(bob).build());
        assertThat(sessions.getCurrentSession().orElseThrow().getStatus()).isEqualTo(SessionStatus.CLOSED);

        assertThat(sessionEvents).extracting(SessionUpdate::getType).containsExactly(
                SessionUpdateType.SESSION_CREATED, SessionUpdateType.USER_JOINED,
                SessionUpdateType.USER_LEFT, SessionUpdateType.USER_LEFT, SessionUpdateType.SESSION_CLOSED);

        // le document survit à la session
        assertThat(service.edit(edit(doc, bob, EditOperation.insert(bob.getId(), 11, "!")))).isTrue();
        assertThat(service.content(doc.getId())).isEqualTo("Hello World!");
    }

    @Test
    void join_sansSession_falseSansException() {
        assertThatCode(() -> assertThat(service.join(JoinSessionMsg.builder()
                .sessionId(UUID.randomUUID()).user(bob).build())).isFalse())
                .doesNotThrowAnyException();
    }

    @Test
    void createDocument_sansSession_exceptionRecuperable() {
        assertThatThrownBy(() -> service.createDocument(CreateDocumentMsg.builder()
                .title("Spec").content("x").user(alice).build()))
                .isInstanceOf(NoActiveSessionException.class);

        // le service reste utilisable
        CollaborationSession s = service.createSession(CreateSessionMsg.builder().name("S").user(alice).build());
        assertThat(s.isActive()).isTrue();
    }

    @Test
    void share_parNonOwner_refuse() {
        CollaborationSession s = service.createSession(CreateSessionMsg.builder().name("S").user(alice).build());
        service.join(JoinSessionMsg.builder().sessionId(s.getId()).user(bob).build());
        SharedDocument doc = service.createDocument(CreateDocumentMsg.builder().title("Spec").content("x").user(alice).build());
        documents.shareDocument(doc.getId(), bob.getId(), AccessRole.EDITOR);

        boolean ok = service.share(ShareDocumentMsg.builder().documentId(doc.getId())
                .userId(bob.getId()).targetUserId(bob.getId()).role(AccessRole.OWNER).build());

        assertThat(ok).isFalse();
        assertThat(documents.getRole(doc.getId(), bob.getId())).contains(AccessRole.EDITOR);
    }

    @Test
    void annotateEtReply() {
        service.createSession(CreateSessionMsg.builder().name("S").user(alice).build());
        SharedDocument doc = service.createDocument(CreateDocumentMsg.builder().title("Spec").content("Hello").user(alice).build());
        UUID noteId = UUID.randomUUID();

        assertThat(service.annotate(AnnotateMsg.builder().documentId(doc.getId()).userId(alice.getId())
                .annotation(DocumentAnnotation.builder().id(noteId).type(AnnotationType.HIGHLIGHT)
                        .position(1).content("ici").build())
                .build())).isTrue();
        assertThat(service.reply(ReplyMsg.builder().documentId(doc.getId()).userId(alice.getId())
                .annotationId(noteId).reply(AnnotationReply.builder().content("corrigé").build()).build())).isTrue();

        assertThat(documents.getAnnotations(doc.getId())).singleElement()
                .satisfies(a -> assertThat(a.getReplies()).hasSize(1));
    }

    @Test
    void shareConversation_sessionPerimee_false() {
        CollaborationSession s = service.createSession(CreateSessionMsg.builder().name("S").user(alice).build());
        SharedConversation c = SharedConversation.builder().id(UUID.randomUUID()).title("Chat").build();

        assertThat(service.shareConversation(ShareConversationMsg.builder()
                .sessionId(UUID.randomUUID()).userId(alice.getId()).conversation(c).build())).isFalse();
        assertThat(service.shareConversation(ShareConversationMsg.builder()
                .sessionId(s.getId()).userId(alice.getId()).conversation(c).build())).isTrue();
    }

    @Test
    void editionsConcurrentes_serialiseesParDocument() throws Exception {
        service.createSession(CreateSessionMsg.builder().name("S").user(alice).build());
        SharedDocument doc = service.createDocument(CreateDocumentMsg.builder().title("Spec").content("").user(alice).build());

        int n = 200;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < n; i++) {
            pool.submit(() -> service.edit(edit(doc, alice, EditOperation.insert(alice.getId(), 0, "x"))));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(service.content(doc.getId())).hasSize(n);
        assertThat(documents.getSharedDocument(doc.getId()).orElseThrow().getVersion()).isEqualTo(1 + n);
        assertThat(documents.getEditHistory(doc.getId())).hasSize(n);
    }

    // --------------------------------------------------------------
    private static EditMsg edit(SharedDocument doc, CollaborationUser user, EditOperation op) {
        return EditMsg.builder().documentId(doc.getId()).userId(user.getId()).operation(op).timestamp(Instant.now()).build();
    }

    private static CollaborationUser user(String name) {
        return CollaborationUser.builder()
                .id(UUID.randomUUID())
                .name(name)
                .email(name.toLowerCase() + "@example.com")
                .build();
    }
}
