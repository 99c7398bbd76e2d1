package org.evalux.collab.model;

import lombok.Value;

@Value
public class EditHistoryItem {
    EditOperation operation;
    String userName;
}
