package org.evalux.collab.dto.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.evalux.collab.model.*;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDocumentMsg {
    private UUID sessionId;
    private String title;
    private String content;
    private CollaborationUser user;
    private Instant timestamp;
}
