package org.evalux.collab.model;

public enum AnnotationType { COMMENT, HIGHLIGHT, SUGGESTION, DRAWING }
