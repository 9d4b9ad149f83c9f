package com.ai.salesagent.service;

import com.ai.salesagent.conversation.AgentState;
import com.ai.salesagent.conversation.ChatMessage;
import com.ai.salesagent.conversation.ConversationIntent;
import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.conversation.PropertyMatch;
import com.ai.salesagent.conversation.PropertyPreferences;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the prompt for the generate_response node from the turn state.
 */
@Component
public class ResponseComposer {

    static final int CONTEXT_MESSAGES = 4;
    static final int PROPERTIES_IN_PROMPT = 3;
    static final String DEFAULT_PROPERTY_NAME = "the selected property";

    private final PromptTemplates prompts;
    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public ResponseComposer(PromptTemplates prompts) {
        this.prompts = prompts;
    }

    public List<ChatMessage> buildMessages(AgentState state) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(prompts.system()));
        messages.add(ChatMessage.user(userPrompt(state)));
        return messages;
    }

    String userPrompt(AgentState state) {
        ConversationIntent intent = state.getIntent() != null ? state.getIntent() : ConversationIntent.GENERAL_CONVERSATION;
        String message = state.getUserMessage();

        if (intent.isPropertyFlow()) {
            PropertyPreferences prefs = state.getPreferences();
            List<PropertyMatch> properties = state.getRecommendedProperties();
            if (properties != null && !properties.isEmpty()) {
                return prompts.recommendation(toJson(prefs, true), formatProperties(properties));
            }
            if (!state.getMissingInfo().isEmpty()) {
                return prompts.askMissing(toJson(prefs, false), state.getMissingInfo());
            }
            return prompts.noResults();
        }

        if (intent == ConversationIntent.ANSWERING_QUESTION) {
            String propertyInfo = state.getSqlResults() != null && !state.getSqlResults().isEmpty()
                    ? toJson(state.getSqlResults(), true)
                    : "No database results";
            String web = StringUtils.isNotBlank(state.getWebSearchResults())
                    ? state.getWebSearchResults()
                    : "No web search performed";
            return prompts.question(message, propertyInfo, web);
        }

        if (intent.isBookingFlow()) {
            LeadInfo lead = state.getLeadInfo();
            String propertyName = StringUtils.defaultIfBlank(state.getBookingProject(), DEFAULT_PROPERTY_NAME);
            if (state.isBookingConfirmed()) {
                return prompts.bookingConfirmed(propertyName, lead.getFullName(), lead.getEmail());
            }
            String missing = state.getMissingInfo().isEmpty() ? "none" : String.join(", ", state.getMissingInfo());
            return prompts.booking(propertyName, toJson(lead, false), missing);
        }

        List<String> recent = state.recentTranscript(CONTEXT_MESSAGES);
        return prompts.general(message, recent.isEmpty() ? "No previous context" : String.join("\n", recent));
    }

    /** Top properties as markdown bullets: name, price, bedrooms, city. */
    static String formatProperties(List<PropertyMatch> properties) {
        List<String> lines = new ArrayList<>();
        for (PropertyMatch p : properties.subList(0, Math.min(PROPERTIES_IN_PROMPT, properties.size()))) {
            double price = p.getPriceUsd() != null ? p.getPriceUsd() : 0d;
            lines.add(String.format(Locale.US, "- **%s**: $%,.0f, %s bed, %s",
                    p.getProjectName(),
                    price,
                    p.getBedrooms() != null ? p.getBedrooms().toString() : "N/A",
                    StringUtils.defaultIfBlank(p.getCity(), "Unknown")));
        }
        return String.join("\n", lines);
    }

    private String toJson(Object value, boolean pretty) {
        try {
            return pretty
                    ? mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value)
                    : mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
