package org.evalux.collab.service.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON des messages et événements qui traversent une frontière de process.
 * Le transport lui-même reste à la charge de l'hôte.
 */
@Component
@RequiredArgsConstructor
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public String encode(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message non sérialisable : " + message.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message illisible pour " + type.getSimpleName(), e);
        }
    }
}
