package com.ai.salesagent.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * State carried between turns, stored as JSON on the conversation row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationContext {

    @Builder.Default
    private PropertyPreferences preferences = new PropertyPreferences();

    @Builder.Default
    private LeadInfo leadInfo = new LeadInfo();

    @Builder.Default
    private List<PropertyMatch> recommendedProperties = new ArrayList<>();

    private String bookingProject;

    /**
     * Shallow merge: each non-null top-level field of {@code update} replaces the current one.
     */
    public ConversationContext mergedWith(ConversationContext update) {
        ConversationContext merged = toBuilder().build();
        if (update == null) return merged;
        if (update.preferences != null) merged.preferences = update.preferences.copy();
        if (update.leadInfo != null) merged.leadInfo = update.leadInfo.copy();
        if (update.recommendedProperties != null) merged.recommendedProperties = new ArrayList<>(update.recommendedProperties);
        if (update.bookingProject != null) merged.bookingProject = update.bookingProject;
        return merged;
    }
}
