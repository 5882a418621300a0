package com.lunchtable.progression.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RewardJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesArrayOfMixedRewards() throws Exception {
        JsonNode json = objectMapper.readTree("""
                [
                  {"type":"GOLD","amount":100},
                  {"type":"gems","amount":5},
                  {"type":"XP","amount":50},
                  {"type":"CARD","cardDefinitionId":"ranked_promo_01"},
                  {"type":"PACK","packType":"standard","quantity":2},
                  {"type":"TITLE","titleId":"veteran"},
                  {"type":"AVATAR","avatarId":"champion_crest"}
                ]
                """);

        List<Reward> rewards = RewardJsonCodec.fromJson(json);

        assertEquals(List.of(
                new Reward.Gold(100),
                new Reward.Gems(5),
                new Reward.Xp(50),
                new Reward.Card("ranked_promo_01", 1),
                new Reward.Pack("standard", 2),
                new Reward.Title("veteran"),
                new Reward.Avatar("champion_crest")
        ), rewards);
    }

    @Test
    void parsesSingleObjectAsOneReward() throws Exception {
        List<Reward> rewards = RewardJsonCodec.fromJson(objectMapper.readTree("{\"type\":\"GEMS\",\"amount\":25}"));

        assertEquals(List.of(new Reward.Gems(25)), rewards);
    }

    @Test
    void treatsNullPayloadAsNoRewards() {
        assertTrue(RewardJsonCodec.fromJson(null).isEmpty());
        assertTrue(RewardJsonCodec.fromJson(NullNode.getInstance()).isEmpty());
    }

    @Test
    void rejectsUnknownTypeAndMalformedFields() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> RewardJsonCodec.fromJson(objectMapper.readTree("{\"type\":\"DIAMONDS\",\"amount\":1}")));
        assertThrows(IllegalArgumentException.class,
                () -> RewardJsonCodec.fromJson(objectMapper.readTree("{\"type\":\"GOLD\",\"amount\":1.5}")));
        assertThrows(IllegalArgumentException.class,
                () -> RewardJsonCodec.fromJson(objectMapper.readTree("{\"type\":\"PACK\",\"packType\":\"standard\",\"quantity\":0}")));
        assertThrows(IllegalArgumentException.class,
                () -> RewardJsonCodec.fromJson(objectMapper.readTree("\"GOLD\"")));
    }

    @Test
    void writesTypeTaggedJson() {
        JsonNode json = RewardJsonCodec.toJson(new Reward.Card("starter_dragon", 3));

        assertEquals("CARD", json.get("type").asText());
        assertEquals("starter_dragon", json.get("cardDefinitionId").asText());
        assertEquals(3, json.get("quantity").asInt());
    }
}
