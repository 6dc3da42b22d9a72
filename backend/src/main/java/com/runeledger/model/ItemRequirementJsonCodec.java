package com.runeledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ItemRequirementJsonCodec {

    private ItemRequirementJsonCodec() {
    }

    public static List<ItemRequirement> fromJson(JsonNode requirementsJson) {
        if (requirementsJson == null || requirementsJson.isNull() || requirementsJson.isMissingNode()) {
            return List.of();
        }
        if (!requirementsJson.isArray()) {
            throw new IllegalArgumentException("requirements must be a JSON array");
        }

        List<ItemRequirement> requirements = new ArrayList<>(requirementsJson.size());
        for (JsonNode node : requirementsJson) {
            requirements.add(parseRequirement(node));
        }
        return List.copyOf(requirements);
    }

    public static JsonNode toJson(List<ItemRequirement> requirements) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        if (requirements == null) {
            return array;
        }
        for (ItemRequirement requirement : requirements) {
            ObjectNode node = array.addObject();
            if (requirement instanceof ItemRequirement.Level level) {
                node.put("type", "LEVEL");
                node.put("skill", level.skill().name());
                node.put("level", level.level());
            } else if (requirement instanceof ItemRequirement.Quest quest) {
                node.put("type", "QUEST");
                node.put("questId", quest.questId());
            } else if (requirement instanceof ItemRequirement.Item item) {
                node.put("type", "ITEM");
                node.put("itemId", item.itemId());
                node.put("quantity", item.quantity());
            } else {
                throw new IllegalArgumentException("Unsupported requirement type: " + requirement.getClass().getName());
            }
        }
        return array;
    }

    private static ItemRequirement parseRequirement(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("each requirement must be a JSON object");
        }
        String type = requiredText(node, "type").toUpperCase(Locale.ROOT);
        return switch (type) {
            case "LEVEL" -> {
                SkillType skill = parseSkill(requiredText(node, "skill"));
                int level = requiredInt(node, "level");
                if (level < 1 || level > 99) {
                    throw new IllegalArgumentException("level requirement must be between 1 and 99");
                }
                yield new ItemRequirement.Level(skill, level);
            }
            case "QUEST" -> new ItemRequirement.Quest(requiredPositiveInt(node, "questId"));
            case "ITEM" -> new ItemRequirement.Item(
                    requiredPositiveInt(node, "itemId"),
                    requiredPositiveInt(node, "quantity")
            );
            default -> throw new IllegalArgumentException("Unknown requirement type: " + type);
        };
    }

    private static SkillType parseSkill(String value) {
        try {
            return SkillType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown skill in requirement: " + value, e);
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("requirement." + field + " is required");
        }
        return value.asText().trim();
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("requirement." + field + " must be an integer");
        }
        return value.intValue();
    }

    private static int requiredPositiveInt(JsonNode node, String field) {
        int value = requiredInt(node, field);
        if (value <= 0) {
            throw new IllegalArgumentException("requirement." + field + " must be positive");
        }
        return value;
    }
}
