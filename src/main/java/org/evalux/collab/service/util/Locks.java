package org.evalux.collab.service.util;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;

/** Verrous de l'hôte : un verrou global de session + verrous striés par document. */
@Component
public class Locks {
    private final Object session = new Object();
    private final Object[] stripes = new Object[128];
    public Locks() { for (int i=0;i<stripes.length;i++) stripes[i] = new Object(); }

    public Object session() { return session; }

    public Object of(UUID documentId) {
        int idx = Objects.hashCode(documentId) & (stripes.length - 1);
        return stripes[idx];
    }
}
