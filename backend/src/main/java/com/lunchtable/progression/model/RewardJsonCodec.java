package com.lunchtable.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses reward payloads stored as jsonb. Accepts a single reward object or an array of them.
 */
public final class RewardJsonCodec {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_AMOUNT = "amount";
    private static final String FIELD_QUANTITY = "quantity";
    private static final String FIELD_CARD_DEFINITION_ID = "cardDefinitionId";
    private static final String FIELD_PACK_TYPE = "packType";
    private static final String FIELD_TITLE_ID = "titleId";
    private static final String FIELD_AVATAR_ID = "avatarId";

    private RewardJsonCodec() {
    }

    public static List<Reward> fromJson(JsonNode rewardsJson) {
        if (rewardsJson == null || rewardsJson.isNull() || rewardsJson.isMissingNode()) {
            return List.of();
        }
        if (rewardsJson.isObject()) {
            return List.of(parseReward(rewardsJson));
        }
        if (!rewardsJson.isArray()) {
            throw new IllegalArgumentException("Reward payload must be an object or an array");
        }
        List<Reward> rewards = new ArrayList<>(rewardsJson.size());
        for (JsonNode rewardJson : rewardsJson) {
            rewards.add(parseReward(rewardJson));
        }
        return List.copyOf(rewards);
    }

    public static ArrayNode toJson(List<Reward> rewards) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (Reward reward : rewards) {
            array.add(toJson(reward));
        }
        return array;
    }

    public static ObjectNode toJson(Reward reward) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(FIELD_TYPE, reward.type());
        if (reward instanceof Reward.Gold gold) {
            node.put(FIELD_AMOUNT, gold.amount());
        } else if (reward instanceof Reward.Gems gems) {
            node.put(FIELD_AMOUNT, gems.amount());
        } else if (reward instanceof Reward.Xp xp) {
            node.put(FIELD_AMOUNT, xp.amount());
        } else if (reward instanceof Reward.Card card) {
            node.put(FIELD_CARD_DEFINITION_ID, card.cardDefinitionId());
            node.put(FIELD_QUANTITY, card.quantity());
        } else if (reward instanceof Reward.Pack pack) {
            node.put(FIELD_PACK_TYPE, pack.packType());
            node.put(FIELD_QUANTITY, pack.quantity());
        } else if (reward instanceof Reward.Title title) {
            node.put(FIELD_TITLE_ID, title.titleId());
        } else if (reward instanceof Reward.Avatar avatar) {
            node.put(FIELD_AVATAR_ID, avatar.avatarId());
        }
        return node;
    }

    private static Reward parseReward(JsonNode rewardJson) {
        if (rewardJson == null || !rewardJson.isObject()) {
            throw new IllegalArgumentException("Reward entry must be an object");
        }
        String type = requireText(rewardJson, FIELD_TYPE).toUpperCase(Locale.ROOT);
        return switch (type) {
            case "GOLD" -> new Reward.Gold(requireAmount(rewardJson));
            case "GEMS" -> new Reward.Gems(requireAmount(rewardJson));
            case "XP" -> new Reward.Xp(requireAmount(rewardJson));
            case "CARD" -> new Reward.Card(requireText(rewardJson, FIELD_CARD_DEFINITION_ID), optionalQuantity(rewardJson));
            case "PACK" -> new Reward.Pack(requireText(rewardJson, FIELD_PACK_TYPE), optionalQuantity(rewardJson));
            case "TITLE" -> new Reward.Title(requireText(rewardJson, FIELD_TITLE_ID));
            case "AVATAR" -> new Reward.Avatar(requireText(rewardJson, FIELD_AVATAR_ID));
            default -> throw new IllegalArgumentException("Unsupported reward type: " + type);
        };
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Reward field '" + field + "' must be a non-blank string");
        }
        return value.asText().trim();
    }

    private static long requireAmount(JsonNode node) {
        JsonNode value = node.get(FIELD_AMOUNT);
        if (value == null || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("Reward field 'amount' must be an integer");
        }
        return value.asLong();
    }

    private static int optionalQuantity(JsonNode node) {
        JsonNode value = node.get(FIELD_QUANTITY);
        if (value == null || value.isNull()) {
            return 1;
        }
        if (!value.isIntegralNumber() || value.asInt() <= 0) {
            throw new IllegalArgumentException("Reward field 'quantity' must be a positive integer");
        }
        return value.asInt();
    }
}
