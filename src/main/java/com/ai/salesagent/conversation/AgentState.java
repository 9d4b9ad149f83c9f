package com.ai.salesagent.conversation;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single turn as it moves through the orchestrator graph.
 * Created from a {@link TurnRequest}, discarded once the {@link TurnResult} is built.
 */
@Getter
@Setter
public class AgentState {

    private final String userMessage;
    private final String conversationId;
    private final List<ChatMessage> history;

    private PropertyPreferences preferences;
    private LeadInfo leadInfo;
    private ConversationIntent intent;
    private List<PropertyMatch> recommendedProperties;
    /** True once search_properties ran in this turn, even with no matches. */
    private boolean searchPerformed;
    private List<Map<String, Object>> sqlResults;
    private String webSearchResults;
    private String response = "";
    private boolean bookingConfirmed;
    private String bookingProject;
    private List<String> missingInfo = new ArrayList<>();

    public AgentState(TurnRequest request) {
        this.userMessage = request.getMessage() != null ? request.getMessage() : "";
        this.conversationId = request.getConversationId();
        this.history = request.getHistory() != null ? List.copyOf(request.getHistory()) : Collections.emptyList();
        this.preferences = request.getPreferences() != null ? request.getPreferences().copy() : new PropertyPreferences();
        this.leadInfo = request.getLeadInfo() != null ? request.getLeadInfo().copy() : new LeadInfo();
        this.recommendedProperties = request.getRecommendedProperties() != null
                ? new ArrayList<>(request.getRecommendedProperties()) : new ArrayList<>();
        this.bookingProject = request.getBookingProject();
    }

    /** Last {@code n} history entries as "role: content" lines. */
    public List<String> recentTranscript(int n) {
        int start = Math.max(0, history.size() - n);
        List<String> lines = new ArrayList<>();
        for (int i = start; i < history.size(); i++) {
            lines.add(history.get(i).toTranscriptLine());
        }
        return lines;
    }

    public boolean hasResponse() {
        return response != null && !response.isEmpty();
    }

    public String firstRecommendedProjectName() {
        if (recommendedProperties == null || recommendedProperties.isEmpty()) return null;
        return recommendedProperties.get(0).getProjectName();
    }

    public TurnResult toResult() {
        return TurnResult.builder()
                .response(response)
                .intent(intent)
                .preferences(preferences)
                .leadInfo(leadInfo)
                .recommendedProperties(recommendedProperties)
                .bookingConfirmed(bookingConfirmed)
                .bookingProject(bookingProject)
                .searchPerformed(searchPerformed)
                .build();
    }
}
