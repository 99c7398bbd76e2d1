package org.evalux.collab.dto;

public enum DocumentUpdateType { DOCUMENT_CREATED, DOCUMENT_SHARED, DOCUMENT_EDITED, ANNOTATION_ADDED, ANNOTATION_REPLIED }
