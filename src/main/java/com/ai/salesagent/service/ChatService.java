package com.ai.salesagent.service;

import com.ai.salesagent.conversation.ChatMessage;
import com.ai.salesagent.conversation.ConversationContext;
import com.ai.salesagent.conversation.LeadInfo;
import com.ai.salesagent.conversation.PropertyMatch;
import com.ai.salesagent.conversation.StreamEvent;
import com.ai.salesagent.conversation.TurnRequest;
import com.ai.salesagent.conversation.TurnResult;
import com.ai.salesagent.dto.ChatMetadata;
import com.ai.salesagent.dto.ChatRequest;
import com.ai.salesagent.dto.ChatResponse;
import com.ai.salesagent.dto.ProjectSummary;
import com.ai.salesagent.entity.Conversation;
import com.ai.salesagent.entity.Lead;
import com.ai.salesagent.entity.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Glue between the HTTP layer, conversation storage and the orchestrator.
 * Loads state before a turn and persists messages, context, lead and booking after it.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final ConversationService conversationService;
    private final ConversationOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final TaskExecutor streamExecutor;
    private final long streamTimeoutMs;

    public ChatService(ConversationService conversationService,
                       ConversationOrchestrator orchestrator,
                       ObjectMapper objectMapper,
                       @Qualifier("chatStreamExecutor") TaskExecutor streamExecutor,
                       @Value("${agent.stream.timeout-ms:120000}") long streamTimeoutMs) {
        this.conversationService = conversationService;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    public ChatResponse chat(ChatRequest request) {
        UUID conversationId = request.getConversationId();
        Conversation conversation = conversationService.require(conversationId);
        TurnRequest turn = prepareTurn(conversation, request.getMessage());

        TurnResult result = orchestrator.process(turn);
        if (result.isFailed()) {
            log.warn("[{}] Turn failed: {}", conversationId, result.getError());
        }
        completeTurn(conversationId, result);

        List<PropertyMatch> recommended = turnRecommendations(result);
        return ChatResponse.builder()
                .response(result.getResponse())
                .conversationId(conversationId)
                .recommendedProjects(recommended.isEmpty() ? null
                        : recommended.stream().map(ProjectSummary::from).collect(Collectors.toList()))
                .metadata(new ChatMetadata(
                        result.getIntent() != null ? result.getIntent().getKey() : null,
                        result.isBookingConfirmed()))
                .build();
    }

    /**
     * Streams the turn as server-sent events. The conversation is checked before the
     * emitter is returned, so an unknown id still fails with 404.
     */
    public SseEmitter chatStream(ChatRequest request) {
        UUID conversationId = request.getConversationId();
        Conversation conversation = conversationService.require(conversationId);
        TurnRequest turn = prepareTurn(conversation, request.getMessage());

        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        AtomicBoolean open = new AtomicBoolean(true);
        emitter.onTimeout(() -> {
            log.warn("[{}] Stream timed out", conversationId);
            open.set(false);
            emitter.complete();
        });
        emitter.onCompletion(() -> open.set(false));

        try {
            streamExecutor.execute(() -> runStream(turn, emitter, open, conversationId));
        } catch (TaskRejectedException e) {
            log.error("[{}] Stream rejected, executor saturated", conversationId, e);
            send(emitter, open, conversationId, StreamEvent.error("Server busy, please retry"));
            emitter.complete();
        }
        return emitter;
    }

    private void runStream(TurnRequest turn, SseEmitter emitter, AtomicBoolean open, UUID conversationId) {
        TurnResult result = orchestrator.processStream(turn, event -> send(emitter, open, conversationId, event));
        try {
            if (StringUtils.isNotBlank(result.getResponse())) {
                completeTurn(conversationId, result);
            }
        } catch (RuntimeException e) {
            log.error("[{}] Failed to persist streamed turn", conversationId, e);
        } finally {
            if (open.get()) emitter.complete();
        }
    }

    TurnRequest prepareTurn(Conversation conversation, String message) {
        UUID conversationId = conversation.getId();
        List<ChatMessage> history = conversationService.getMessages(conversationId, ConversationService.DEFAULT_HISTORY_LIMIT);
        ConversationContext context = conversation.getContext() != null ? conversation.getContext() : new ConversationContext();

        conversationService.addMessage(conversationId, Message.ROLE_USER, message, null);

        return TurnRequest.builder()
                .message(message)
                .conversationId(conversationId.toString())
                .history(history)
                .preferences(context.getPreferences())
                .leadInfo(context.getLeadInfo())
                .recommendedProperties(context.getRecommendedProperties())
                .bookingProject(context.getBookingProject())
                .build();
    }

    void completeTurn(UUID conversationId, TurnResult result) {
        List<PropertyMatch> recommended = turnRecommendations(result);

        Map<String, Object> extraData = new LinkedHashMap<>();
        extraData.put("intent", result.getIntent() != null ? result.getIntent().getKey() : null);
        extraData.put("recommended_properties",
                recommended.stream().map(PropertyMatch::getProjectName).collect(Collectors.toList()));
        conversationService.addMessage(conversationId, Message.ROLE_ASSISTANT, result.getResponse(), extraData);

        // previous recommendations survive a turn that did not search
        conversationService.updateContext(conversationId, ConversationContext.builder()
                .preferences(result.getPreferences())
                .leadInfo(result.getLeadInfo())
                .recommendedProperties(result.isSearchPerformed() ? recommended : null)
                .bookingProject(result.getBookingProject())
                .build());

        if (result.isBookingConfirmed()) {
            persistBooking(conversationId, result);
        }
    }

    private void persistBooking(UUID conversationId, TurnResult result) {
        LeadInfo leadInfo = result.getLeadInfo();
        if (leadInfo == null || StringUtils.isBlank(leadInfo.getEmail())) return;

        try {
            Lead lead = conversationService.getOrCreateLead(conversationId, leadInfo);
            if (result.getPreferences() != null && !result.getPreferences().isEmpty()) {
                conversationService.updateLeadPreferences(lead.getId(), result.getPreferences().toMap());
            }
            if (StringUtils.isNotBlank(result.getBookingProject())) {
                conversationService.findProjectByName(result.getBookingProject()).ifPresentOrElse(
                        project -> conversationService.createBooking(lead.getId(), project.getId(), null),
                        () -> log.warn("[{}] Booking project not found: {}", conversationId, result.getBookingProject()));
            }
        } catch (RuntimeException e) {
            log.error("[{}] Failed to persist lead/booking", conversationId, e);
        }
    }

    private void send(SseEmitter emitter, AtomicBoolean open, UUID conversationId, StreamEvent event) {
        if (!open.get()) return;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.getType().getKey());
        payload.put("data", event.getType() == StreamEvent.Type.PROPERTIES ? summaries(event.getData()) : event.getData());
        try {
            emitter.send(SseEmitter.event().data(objectMapper.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            log.error("[{}] Could not serialize {} event", conversationId, event.getType().getKey(), e);
        } catch (IOException | IllegalStateException e) {
            log.info("[{}] Client went away: {}", conversationId, e.getMessage());
            open.set(false);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object summaries(Object data) {
        if (!(data instanceof List)) return data;
        return ((List<PropertyMatch>) data).stream().map(ProjectSummary::from).collect(Collectors.toList());
    }

    private static List<PropertyMatch> turnRecommendations(TurnResult result) {
        if (!result.isSearchPerformed() || result.getRecommendedProperties() == null) {
            return Collections.emptyList();
        }
        return result.getRecommendedProperties();
    }
}
