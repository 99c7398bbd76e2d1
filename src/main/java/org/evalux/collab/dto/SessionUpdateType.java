package org.evalux.collab.dto;

public enum SessionUpdateType { SESSION_CREATED, USER_JOINED, USER_LEFT, SESSION_CLOSED, CONVERSATION_SHARED }
