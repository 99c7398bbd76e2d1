package org.evalux.collab.model;

public enum SessionStatus { ACTIVE, CLOSED }
