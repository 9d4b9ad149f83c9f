package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ConversationIntent;
import com.ai.salesagent.exception.LlmUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentClassifierTest {

    @Mock
    private LlmService llmService;

    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(llmService, new PromptTemplates("Silvy", "Silver Land Properties"));
    }

    @Test
    void usesLlmReplyWhenConfigured() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(contains("No previous context"), eq(0.0))).thenReturn("searching_properties");

        assertThat(classifier.classify("show me something", Collections.emptyList()))
                .isEqualTo(ConversationIntent.SEARCHING_PROPERTIES);
    }

    @Test
    void passesRecentTranscriptAsContext() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(contains("assistant: Which city?"), eq(0.0))).thenReturn("gathering_preferences");

        assertThat(classifier.classify("Dubai", List.of("user: hi", "assistant: Which city?")))
                .isEqualTo(ConversationIntent.GATHERING_PREFERENCES);
    }

    @Test
    void fallsBackToKeywordsWhenLlmFails() {
        when(llmService.isConfigured()).thenReturn(true);
        when(llmService.complete(anyString(), anyDouble())).thenThrow(new LlmUnavailableException("down"));

        assertThat(classifier.classify("hello", Collections.emptyList())).isEqualTo(ConversationIntent.GREETING);
    }

    @Test
    void skipsLlmWhenNotConfigured() {
        when(llmService.isConfigured()).thenReturn(false);

        assertThat(classifier.classify("book a viewing please", Collections.emptyList()))
                .isEqualTo(ConversationIntent.BOOKING_VISIT);
        verify(llmService, never()).complete(anyString(), anyDouble());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Hi!|greeting",
            "good morning|greeting",
            "my email is john@example.com|collecting_lead_info",
            "My name is John Doe|collecting_lead_info",
            "call me on +971 50 123 4567|collecting_lead_info",
            "I would like to schedule a visit|booking_visit",
            "2 bedroom apartment in Dubai|gathering_preferences",
            "budget is around 500k|gathering_preferences",
            "yes please|booking_visit",
            "show me what you have|searching_properties",
            "are there schools nearby?|answering_question",
            "thanks a lot|general_conversation",
            "My budget is 300000 - 500000|gathering_preferences",
            "Looking for something in Dubai|gathering_preferences",
            "I want to live in Chicago|gathering_preferences",
            "yes, 2 bedrooms|booking_visit",
            "hi, can I book a viewing|booking_visit",
            "my number is 0812 3456 7890|collecting_lead_info"
    })
    void keywordRules(String message, String expected) {
        assertThat(classifier.classifyByKeywords(message)).isEqualTo(ConversationIntent.fromKey(expected));
    }
}
