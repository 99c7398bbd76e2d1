package org.evalux.collab.exception;

/** Création de document demandée alors qu'aucune session n'est active. */
public class NoActiveSessionException extends IllegalStateException {
    public NoActiveSessionException() {
        super("Aucune session active : créez ou rejoignez une session avant de partager un document");
    }
}
