package org.evalux.collab.service.access;

import org.evalux.collab.model.AccessRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * ACL d'un document : utilisateur -> rôle. Pas de synchronisation interne,
 * l'appelant sérialise les accès au document.
 */
public class AccessControlTable {

    private final UUID documentId;
    private final Map<UUID, AccessRole> roles = new LinkedHashMap<>();

    public AccessControlTable(UUID documentId) {
        this.documentId = documentId;
    }

    /** Table initiale d'un document : le créateur seul, en OWNER. */
    public static AccessControlTable ownedBy(UUID documentId, UUID ownerId) {
        AccessControlTable acl = new AccessControlTable(documentId);
        acl.grant(ownerId, AccessRole.OWNER);
        return acl;
    }

    public UUID getDocumentId() { return documentId; }

    /** Ajoute ou remplace le rôle de l'utilisateur. */
    public void grant(UUID userId, AccessRole role) {
        roles.put(Objects.requireNonNull(userId, "userId manquant"),
                  Objects.requireNonNull(role, "role manquant"));
    }

    public Optional<AccessRole> roleOf(UUID userId) {
        return Optional.ofNullable(roles.get(userId));
    }

    public boolean allows(UUID userId, AccessRole required) {
        return roleOf(userId).map(r -> r.satisfies(required)).orElse(false);
    }

    public Map<UUID, AccessRole> entries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }
}
