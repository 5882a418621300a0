package com.lunchtable.progression.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One reward component. Quest, achievement and tier payloads are lists of these.
 * Serializes with the same field names {@link RewardJsonCodec} reads.
 */
public sealed interface Reward {

    String type();

    record Gold(long amount) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "GOLD";
        }
    }

    record Gems(long amount) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "GEMS";
        }
    }

    record Xp(long amount) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "XP";
        }
    }

    record Card(String cardDefinitionId, int quantity) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "CARD";
        }
    }

    record Pack(String packType, int quantity) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "PACK";
        }
    }

    record Title(String titleId) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "TITLE";
        }
    }

    record Avatar(String avatarId) implements Reward {
        @Override
        @JsonProperty("type")
        public String type() {
            return "AVATAR";
        }
    }
}
