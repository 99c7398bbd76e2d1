package org.evalux.collab.events;

import lombok.extern.slf4j.Slf4j;
import org.evalux.collab.dto.DocumentUpdate;
import org.evalux.collab.dto.SessionUpdate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Diffusion synchrone des événements de session et de document.
 * <p>
 * Chaque publication est livrée, sur le thread appelant, aux abonnés présents au moment
 * de l'appel. Pas de tampon ni de rejeu : un abonné arrivé après coup ne voit rien
 * de ce qui a déjà été publié.
 */
@Slf4j
@Component
public class EventBus {

    private final List<Consumer<SessionUpdate>> sessionListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<DocumentUpdate>> documentListeners = new CopyOnWriteArrayList<>();

    /** Poignée de désabonnement. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    public Subscription onSessionUpdate(Consumer<SessionUpdate> listener) {
        sessionListeners.add(listener);
        return () -> sessionListeners.remove(listener);
    }

    public Subscription onDocumentUpdate(Consumer<DocumentUpdate> listener) {
        documentListeners.add(listener);
        return () -> documentListeners.remove(listener);
    }

    public void publish(SessionUpdate update) {
        deliver(sessionListeners, update);
    }

    public void publish(DocumentUpdate update) {
        deliver(documentListeners, update);
    }

    // l'itération d'une CopyOnWriteArrayList se fait sur un instantané
    private <T> void deliver(List<Consumer<T>> listeners, T update) {
        for (Consumer<T> l : listeners) {
            try {
                l.accept(update);
            } catch (RuntimeException ex) {
                log.warn("Abonné en échec sur {} : {}", update, ex.getMessage(), ex);
            }
        }
    }
}
