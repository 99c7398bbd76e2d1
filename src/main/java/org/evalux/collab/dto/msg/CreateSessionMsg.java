package org.evalux.collab.dto.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.evalux.collab.model.*;

import java.time.Instant;
import java.util.UUID;

/** Créer une session ; l'émetteur en devient le premier participant. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionMsg {
    private String name;
    private CollaborationUser user;
    private Instant timestamp;
}
