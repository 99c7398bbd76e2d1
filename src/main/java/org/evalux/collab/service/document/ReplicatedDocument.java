package org.evalux.collab.service.document;

import org.evalux.collab.model.AnnotationReply;
import org.evalux.collab.model.DocumentAnnotation;
import org.evalux.collab.model.EditHistoryItem;
import org.evalux.collab.model.EditOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Réplique en mémoire d'un document : contenu, journal d'opérations, annotations.
 * <p>
 * Les opérations sont appliquées dans l'ordre d'appel, qui fait foi. Il n'y a aucune
 * fusion entre répliques divergentes : deux répliques ne convergent que si toutes les
 * éditions passent par la même instance, dans le même ordre.
 * <p>
 * Les positions sont comptées en points de code et ramenées dans {@code [0, longueur]}
 * au lieu d'être refusées. Pour DELETE et REPLACE, la longueur de la plage vient du
 * texte porté par l'opération ; une position périmée peut donc effacer le mauvais texte.
 * <p>
 * Non thread-safe.
 */
public class ReplicatedDocument {

    public static final String UNKNOWN_USER = "Unknown User";

    private final UUID documentId;
    private String content;
    private final List<EditHistoryItem> history = new ArrayList<>();
    private final List<DocumentAnnotation> annotations = new ArrayList<>();

    public ReplicatedDocument(UUID documentId, String initialContent) {
        this.documentId = documentId;
        this.content = initialContent != null ? initialContent : "";
    }

    public UUID getDocumentId() { return documentId; }

    public void applyOperation(EditOperation op) {
        applyOperation(op, UNKNOWN_USER);
    }

    public void applyOperation(EditOperation op, String userName) {
        Objects.requireNonNull(op, "operation manquante");
        content = apply(content, op);
        history.add(new EditHistoryItem(op, userName));
    }

    /** Applique une opération à un texte, sans effet de bord. */
    public static String apply(String text, EditOperation op) {
        int length = text.codePointCount(0, text.length());
        int start = clamp(op.getPosition(), 0, length);
        int run = Math.min(op.getContent().codePointCount(0, op.getContent().length()), length - start);

        return switch (op.getType()) {
            case INSERT -> splice(text, start, start, op.getContent());
            case DELETE -> splice(text, start, start + run, "");
            case REPLACE -> splice(text, start, start + run, op.getContent());
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String splice(String text, int fromCp, int toCp, String with) {
        int from = text.offsetByCodePoints(0, fromCp);
        int to = text.offsetByCodePoints(from, toCp - fromCp);
        return text.substring(0, from) + with + text.substring(to);
    }

    public void addAnnotation(DocumentAnnotation annotation) {
        annotations.add(Objects.requireNonNull(annotation, "annotation manquante"));
    }

    /** @return false si l'annotation n'existe pas */
    public boolean addReply(UUID annotationId, AnnotationReply reply) {
        for (int i = 0; i < annotations.size(); i++) {
            DocumentAnnotation a = annotations.get(i);
            if (a.getId() != null && a.getId().equals(annotationId)) {
                annotations.set(i, a.withReply(reply));
                return true;
            }
        }
        return false;
    }

    public String getContent() { return content; }

    public List<EditHistoryItem> getHistory() { return List.copyOf(history); }

    public List<EditOperation> getOperations() {
        return history.stream().map(EditHistoryItem::getOperation).toList();
    }

    public List<DocumentAnnotation> getAnnotations() { return List.copyOf(annotations); }
}
