package com.ai.salesagent.service;

import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.conversation.PropertyPreferences;
import com.ai.salesagent.exception.LlmUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slot filling: asks the LLM for the preference and contact fields mentioned in a
 * message. Only the values found in this message are returned; callers merge them.
 */
@Service
public class SlotExtractionService {

    private static final Logger log = LoggerFactory.getLogger(SlotExtractionService.class);

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d ()-]{7,}\\d");

    private final LlmService llmService;
    private final PromptTemplates prompts;
    private final JsonReplyParser parser;
    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public SlotExtractionService(LlmService llmService, PromptTemplates prompts, JsonReplyParser parser) {
        this.llmService = llmService;
        this.prompts = prompts;
        this.parser = parser;
    }

    public PropertyPreferences extractPreferences(String message, PropertyPreferences previous) {
        String reply = llmService.complete(prompts.preferenceExtraction(message, toJson(previous)), 0.0);
        ObjectNode node = parser.extractObject(reply);
        PropertyPreferences extracted = PropertyPreferences.builder()
                .city(parser.text(node, "city"))
                .minBudget(parser.number(node, "min_budget"))
                .maxBudget(parser.number(node, "max_budget"))
                .bedrooms(parser.integer(node, "bedrooms"))
                .propertyType(parser.text(node, "property_type"))
                .build();
        log.debug("Extracted preferences: {}", extracted);
        return extracted;
    }

    /**
     * Contact fields from the message. Without an LLM, email and phone are still picked
     * up by pattern.
     */
    public LeadInfo extractLeadInfo(String message, LeadInfo previous) {
        try {
            String reply = llmService.complete(prompts.leadExtraction(message, toJson(previous)), 0.0);
            ObjectNode node = parser.extractObject(reply);
            return LeadInfo.builder()
                    .firstName(parser.text(node, "first_name"))
                    .lastName(parser.text(node, "last_name"))
                    .email(parser.text(node, "email"))
                    .phone(parser.text(node, "phone"))
                    .build();
        } catch (LlmUnavailableException ex) {
            log.warn("Lead extraction via LLM failed, using patterns: {}", ex.getMessage());
            return extractLeadInfoByPattern(message);
        }
    }

    LeadInfo extractLeadInfoByPattern(String message) {
        LeadInfo info = new LeadInfo();
        if (message == null) return info;
        Matcher email = EMAIL.matcher(message);
        if (email.find()) info.setEmail(email.group());
        Matcher phone = PHONE.matcher(message);
        if (phone.find()) info.setPhone(phone.group().trim());
        return info;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
