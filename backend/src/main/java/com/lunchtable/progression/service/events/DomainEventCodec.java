package com.lunchtable.progression.service.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Optional;

public final class DomainEventCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final Map<String, Class<? extends DomainEvent>> EVENT_TYPES = Map.of(
            DomainEvent.KIND_GAME_ENDED, DomainEvent.GameEnded.class,
            DomainEvent.KIND_STORY_STAGE_COMPLETED, DomainEvent.StoryStageCompleted.class
    );

    private DomainEventCodec() {
    }

    public static JsonNode toPayload(DomainEvent event) {
        return OBJECT_MAPPER.valueToTree(event);
    }

    /**
     * @return empty when the kind is not one this service handles
     * @throws IllegalArgumentException when a known kind carries a malformed payload
     */
    public static Optional<DomainEvent> fromEnvelope(String kind, JsonNode payload) {
        Class<? extends DomainEvent> type = kind == null ? null : EVENT_TYPES.get(kind);
        if (type == null) {
            return Optional.empty();
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Domain event " + kind + " payload must be an object");
        }
        DomainEvent event;
        try {
            event = OBJECT_MAPPER.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("Malformed " + kind + " payload: " + ex.getMessage(), ex);
        }
        if (event.eventId() == null) {
            throw new IllegalArgumentException("Domain event " + kind + " is missing eventId");
        }
        return Optional.of(event);
    }
}
