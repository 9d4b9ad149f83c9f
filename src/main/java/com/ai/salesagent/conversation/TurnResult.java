package com.ai.salesagent.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class TurnResult {

    private final String response;
    private final ConversationIntent intent;
    private final PropertyPreferences preferences;
    private final LeadInfo leadInfo;
    @Builder.Default
    private final List<PropertyMatch> recommendedProperties = new ArrayList<>();
    private final boolean bookingConfirmed;
    private final String bookingProject;
    private final boolean searchPerformed;
    private final String error;

    public boolean isFailed() {
        return error != null;
    }

    public static TurnResult failed(String response, String error) {
        return TurnResult.builder().response(response).error(error).build();
    }
}
