package org.evalux.collab.model;

/**
 * Rôles sur un document partagé, du plus faible au plus fort.
 * L'ordre des constantes EST l'ordre des droits : OWNER ⊇ EDITOR ⊇ VIEWER.
 */
public enum AccessRole {
    VIEWER,
    EDITOR,
    OWNER;

    /** Vrai si ce rôle couvre le rôle demandé. */
    public boolean satisfies(AccessRole required) {
        return compareTo(required) >= 0;
    }
}
