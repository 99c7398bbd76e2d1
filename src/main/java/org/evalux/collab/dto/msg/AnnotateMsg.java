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
public class AnnotateMsg {
    private UUID documentId;
    private UUID userId;
    private DocumentAnnotation annotation;
    private Instant timestamp;
}
