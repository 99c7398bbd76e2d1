package org.evalux.collab.model;

public enum EditOperationType { INSERT, DELETE, REPLACE }
