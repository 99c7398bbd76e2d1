package org.evalux.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/** Identité fournie par l'appelant : ce module n'authentifie personne. */
@Value
@Builder
@Jacksonized
public class CollaborationUser {
    UUID id;
    String name;
    String email;
    String avatarUrl; // optionnel
}
