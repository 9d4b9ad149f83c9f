package com.ai.salesagent.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/** Input to one orchestrator turn: the new message plus state loaded from the conversation. */
@Getter
@Builder
@AllArgsConstructor
public class TurnRequest {

    private final String message;
    private final String conversationId;
    private final List<ChatMessage> history;
    private final PropertyPreferences preferences;
    private final LeadInfo leadInfo;
    private final List<PropertyMatch> recommendedProperties;
    private final String bookingProject;
}
