package org.evalux.collab.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.collab.dto.DocumentUpdate;
import org.evalux.collab.dto.SessionUpdate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Trace chaque événement publié. */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLogListener {

    private final EventBus events;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    @PostConstruct
    void subscribe() {
        subscriptions.add(events.onSessionUpdate(this::onSessionUpdate));
        subscriptions.add(events.onDocumentUpdate(this::onDocumentUpdate));
    }

    @PreDestroy
    void unsubscribe() {
        subscriptions.forEach(EventBus.Subscription::close);
        subscriptions.clear();
    }

    void onSessionUpdate(SessionUpdate u) {
        log.info("[session {}] {} {}", u.getSessionId(), u.getType(), u.getPayload());
    }

    void onDocumentUpdate(DocumentUpdate u) {
        log.info("[document {}] {} par {} {}", u.getDocumentId(), u.getType(), u.getUserId(), u.getPayload());
    }
}
