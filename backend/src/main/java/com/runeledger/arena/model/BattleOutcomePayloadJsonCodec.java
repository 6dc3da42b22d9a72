package com.runeledger.arena.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Set;

/**
 * Parses and validates strict battle outcome payloads.
 */
public final class BattleOutcomePayloadJsonCodec {

    private static final String FIELD_TURNS = "turns";
    private static final String FIELD_DURATION_SECONDS = "duration_seconds";
    private static final String FIELD_PARTICIPANT_A = "participant_a";
    private static final String FIELD_PARTICIPANT_B = "participant_b";
    private static final String FIELD_NOTES = "notes";

    private static final String FIELD_DAMAGE_DEALT = "damage_dealt";
    private static final String FIELD_DAMAGE_TAKEN = "damage_taken";

    private static final Set<String> ALLOWED_TOP_LEVEL_FIELDS = Set.of(
            FIELD_TURNS,
            FIELD_DURATION_SECONDS,
            FIELD_PARTICIPANT_A,
            FIELD_PARTICIPANT_B,
            FIELD_NOTES
    );

    private static final Set<String> ALLOWED_TALLY_FIELDS = Set.of(
            FIELD_DAMAGE_DEALT,
            FIELD_DAMAGE_TAKEN
    );

    private static final int MAX_NOTES_LENGTH = 2000;

    private BattleOutcomePayloadJsonCodec() {
    }

    public static BattleOutcomePayload fromJson(JsonNode payloadJson) {
        if (payloadJson == null || payloadJson.isNull() || payloadJson.isMissingNode()) {
            return BattleOutcomePayload.empty();
        }
        if (!payloadJson.isObject()) {
            throw new IllegalArgumentException("Battle outcome payload must be a JSON object");
        }
        rejectUnexpectedFields(payloadJson, ALLOWED_TOP_LEVEL_FIELDS, "outcome payload");

        int turns = optionalNonNegativeInt(payloadJson, FIELD_TURNS);
        int durationSeconds = optionalNonNegativeInt(payloadJson, FIELD_DURATION_SECONDS);
        BattleOutcomePayload.CombatantTally participantA = parseTally(payloadJson, FIELD_PARTICIPANT_A);
        BattleOutcomePayload.CombatantTally participantB = parseTally(payloadJson, FIELD_PARTICIPANT_B);
        String notes = optionalText(payloadJson, FIELD_NOTES);

        return new BattleOutcomePayload(turns, durationSeconds, participantA, participantB, notes);
    }

    public static ObjectNode toJson(BattleOutcomePayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Battle outcome payload is required");
        }
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(FIELD_TURNS, payload.turns());
        root.put(FIELD_DURATION_SECONDS, payload.durationSeconds());
        writeTally(root.putObject(FIELD_PARTICIPANT_A), payload.participantA());
        writeTally(root.putObject(FIELD_PARTICIPANT_B), payload.participantB());
        if (payload.notes() != null) {
            root.put(FIELD_NOTES, payload.notes());
        }
        return root;
    }

    private static void writeTally(ObjectNode node, BattleOutcomePayload.CombatantTally tally) {
        node.put(FIELD_DAMAGE_DEALT, tally.damageDealt());
        node.put(FIELD_DAMAGE_TAKEN, tally.damageTaken());
    }

    private static BattleOutcomePayload.CombatantTally parseTally(JsonNode root, String fieldName) {
        JsonNode node = root.get(fieldName);
        if (node == null || node.isNull()) {
            return BattleOutcomePayload.CombatantTally.NONE;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(fieldName + " must be an object");
        }
        rejectUnexpectedFields(node, ALLOWED_TALLY_FIELDS, fieldName);
        return new BattleOutcomePayload.CombatantTally(
                optionalNonNegativeLong(node, FIELD_DAMAGE_DEALT, fieldName),
                optionalNonNegativeLong(node, FIELD_DAMAGE_TAKEN, fieldName)
        );
    }

    private static int optionalNonNegativeInt(JsonNode node, String fieldName) {
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
            throw new IllegalArgumentException(fieldName + " must be a non-negative integer");
        }
        return value.intValue();
    }

    private static long optionalNonNegativeLong(JsonNode node, String fieldName, String parent) {
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull()) {
            return 0L;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong() || value.longValue() < 0) {
            throw new IllegalArgumentException(parent + "." + fieldName + " must be a non-negative integer");
        }
        return value.longValue();
    }

    private static String optionalText(JsonNode node, String fieldName) {
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException(fieldName + " must be a string");
        }
        String text = value.asText();
        if (text.length() > MAX_NOTES_LENGTH) {
            throw new IllegalArgumentException(fieldName + " must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        return text;
    }

    private static void rejectUnexpectedFields(JsonNode node, Set<String> allowedFields, String context) {
        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext()) {
            String fieldName = fieldNames.next();
            if (!allowedFields.contains(fieldName)) {
                throw new IllegalArgumentException("Unexpected field in " + context + ": " + fieldName);
            }
        }
    }
}
