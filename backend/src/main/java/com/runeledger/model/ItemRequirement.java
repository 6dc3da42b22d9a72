package com.runeledger.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single prerequisite attached to an item or a quest. Stored as JSON tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ItemRequirement.Level.class, name = "LEVEL"),
        @JsonSubTypes.Type(value = ItemRequirement.Quest.class, name = "QUEST"),
        @JsonSubTypes.Type(value = ItemRequirement.Item.class, name = "ITEM")
})
public interface ItemRequirement {

    String describe();

    record Level(SkillType skill, int level) implements ItemRequirement {
        @Override
        public String describe() {
            return "level " + level + " " + skill.name().toLowerCase();
        }
    }

    record Quest(int questId) implements ItemRequirement {
        @Override
        public String describe() {
            return "completion of quest " + questId;
        }
    }

    record Item(int itemId, int quantity) implements ItemRequirement {
        @Override
        public String describe() {
            return quantity + " x item " + itemId;
        }
    }
}
