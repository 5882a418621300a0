package com.lunchtable.progression.service.scheduling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Map;

/**
 * Maps deferred tasks to (type, payload) pairs for the outbox table and the Redis queue.
 */
public final class DeferredTaskCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    private static final Map<String, Class<? extends DeferredTask>> TASK_TYPES = Map.of(
            DeferredTask.TYPE_POLL_PURCHASE_CONFIRMATION, DeferredTask.PollPurchaseConfirmation.class,
            DeferredTask.TYPE_DISPATCH_DOMAIN_EVENT, DeferredTask.DispatchDomainEvent.class,
            DeferredTask.TYPE_REFRESH_TOKEN_BALANCE, DeferredTask.RefreshTokenBalance.class,
            DeferredTask.TYPE_NOTIFY_PLAYER, DeferredTask.NotifyPlayer.class
    );

    private DeferredTaskCodec() {
    }

    public static JsonNode toPayload(DeferredTask task) {
        if (task == null) {
            throw new IllegalArgumentException("Deferred task is required");
        }
        return OBJECT_MAPPER.valueToTree(task);
    }

    public static DeferredTask fromPayload(String taskType, JsonNode payload) {
        Class<? extends DeferredTask> taskClass = TASK_TYPES.get(taskType);
        if (taskClass == null) {
            throw new IllegalArgumentException("Unknown deferred task type: " + taskType);
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Deferred task payload must be an object for type " + taskType);
        }
        try {
            return OBJECT_MAPPER.treeToValue(payload, taskClass);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed payload for deferred task type " + taskType, ex);
        }
    }
}
