package com.ai.salesagent.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The seven intents a turn can be routed by. Declaration order is the match order
 * used when parsing a free-text classifier reply.
 */
public enum ConversationIntent {
    GREETING("greeting"),
    GATHERING_PREFERENCES("gathering_preferences"),
    SEARCHING_PROPERTIES("searching_properties"),
    ANSWERING_QUESTION("answering_question"),
    BOOKING_VISIT("booking_visit"),
    COLLECTING_LEAD_INFO("collecting_lead_info"),
    GENERAL_CONVERSATION("general_conversation");

    private final String key;

    ConversationIntent(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static ConversationIntent fromKey(String key) {
        if (key == null) return GENERAL_CONVERSATION;
        for (ConversationIntent intent : values()) {
            if (intent.key.equalsIgnoreCase(key.trim())) return intent;
        }
        return GENERAL_CONVERSATION;
    }

    /**
     * First intent whose key occurs in the normalized reply; general conversation otherwise.
     */
    public static ConversationIntent parseReply(String reply) {
        if (reply == null) return GENERAL_CONVERSATION;
        String normalized = reply.trim().toLowerCase(Locale.ROOT).replace(".", "").replace(",", "");
        for (ConversationIntent intent : values()) {
            if (normalized.contains(intent.key)) return intent;
        }
        return GENERAL_CONVERSATION;
    }

    public boolean isBookingFlow() {
        return this == BOOKING_VISIT || this == COLLECTING_LEAD_INFO;
    }

    public boolean isPropertyFlow() {
        return this == GATHERING_PREFERENCES || this == SEARCHING_PROPERTIES;
    }
}
