package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ConversationIntent;
import com.ai.salesagent.exception.LlmUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies each turn into one of the seven {@link ConversationIntent}s. The LLM decides;
 * keyword rules take over when it is not configured or the call fails.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final Pattern EMAIL = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"
    );

    /** International numbers, numbers after a phone word, or local numbers starting with 0. */
    private static final Pattern PHONE = Pattern.compile(
            "\\+\\d[\\d ()-]{6,}\\d"
            + "|\\b(phone|mobile|whatsapp|wa|number|hp|telp)\\b[^\\d]{0,20}\\d[\\d ()-]{6,}\\d"
            + "|\\b0\\d{9,12}\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PROVIDE_NAME = Pattern.compile(
            "\\b(my name is|name's|call me|nama saya)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GREETING = Pattern.compile(
            "^\\s*(hi|hello|hey|halo|hai|good (morning|afternoon|evening)|selamat (pagi|siang|sore|malam))\\b[\\s!.,]*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern BOOKING = Pattern.compile(
            "\\b(book|booking|visit|viewing|schedule)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AFFIRMATION = Pattern.compile(
            "\\b(yes|yeah|sure|ok|oke|okay|mau|iya|boleh)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PREFERENCES = Pattern.compile(
            "\\b\\d+\\s*(bed|beds|bedroom|bedrooms|br|kamar)\\b|\\b(budget|under|below|between)\\b|\\$\\s*\\d"
            + "|\\b\\d+\\s*(k|m|million|juta)\\b|\\b(apartment|villa|house)s?\\b"
            + "|\\d[\\d,.]*\\s*(-|to)\\s*\\$?\\d",
            Pattern.CASE_INSENSITIVE
    );

    /** "in Dubai", "di Jakarta": a capitalized place name after a location preposition. */
    private static final Pattern CITY = Pattern.compile(
            "\\b(in|di)\\s+\\p{Lu}\\p{L}+"
    );

    private static final Pattern SEARCH = Pattern.compile(
            "\\b(show|find|search|list|recommend|options|cari|lihat)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern QUESTION = Pattern.compile(
            "\\b(near|nearby|school|transport|area|neighbou?rhood|around|amenit(y|ies)|facilit(y|ies)|feature|completion|when|how much|what|which|does|is there)\\b|\\?",
            Pattern.CASE_INSENSITIVE
    );

    private final LlmService llmService;
    private final PromptTemplates prompts;

    public IntentClassifier(LlmService llmService, PromptTemplates prompts) {
        this.llmService = llmService;
        this.prompts = prompts;
    }

    public ConversationIntent classify(String message, List<String> recentTranscript) {
        if (llmService.isConfigured()) {
            try {
                String context = recentTranscript == null || recentTranscript.isEmpty()
                        ? "No previous context"
                        : String.join("\n", recentTranscript);
                String reply = llmService.complete(prompts.intentClassification(message, context), 0.0);
                ConversationIntent intent = ConversationIntent.parseReply(reply);
                log.info("Classified intent: {}", intent.getKey());
                return intent;
            } catch (LlmUnavailableException ex) {
                log.warn("Intent classification via LLM failed, using keyword rules: {}", ex.getMessage());
            }
        }
        ConversationIntent intent = classifyByKeywords(message);
        log.info("Classified intent (keywords): {}", intent.getKey());
        return intent;
    }

    /**
     * Keyword rules in priority order: contact details, affirmations and booking words,
     * greetings, preference mentions (city, budget, bedrooms), search requests, questions.
     */
    public ConversationIntent classifyByKeywords(String message) {
        if (message == null || message.isBlank()) return ConversationIntent.GENERAL_CONVERSATION;
        String t = message.trim();

        if (EMAIL.matcher(t).find() || PROVIDE_NAME.matcher(t).find() || PHONE.matcher(t).find()) {
            return ConversationIntent.COLLECTING_LEAD_INFO;
        }
        if (AFFIRMATION.matcher(t).find() || BOOKING.matcher(t).find()) {
            return ConversationIntent.BOOKING_VISIT;
        }
        if (GREETING.matcher(t).find()) {
            return ConversationIntent.GREETING;
        }
        if (CITY.matcher(t).find() || PREFERENCES.matcher(t).find()) {
            return ConversationIntent.GATHERING_PREFERENCES;
        }
        if (SEARCH.matcher(t).find()) {
            return ConversationIntent.SEARCHING_PROPERTIES;
        }
        if (QUESTION.matcher(t).find()) {
            return ConversationIntent.ANSWERING_QUESTION;
        }
        return ConversationIntent.GENERAL_CONVERSATION;
    }
}
