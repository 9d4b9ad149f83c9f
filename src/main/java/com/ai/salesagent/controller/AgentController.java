package com.ai.salesagent.controller;

import com.ai.salesagent.dto.ChatRequest;
import com.ai.salesagent.dto.ChatResponse;
import com.ai.salesagent.service.ChatService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final ChatService chatService;

    public AgentController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping("/chat")
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        log.info("[{}] Chat: {}", request.getConversationId(), request.getMessage());
        return chatService.chat(request);
    }

    /** Server-sent events. Errors raised before the stream opens are returned as JSON. */
    @PostMapping("/chat/stream")
    public SseEmitter chatStream(@Valid @RequestBody ChatRequest request) {
        log.info("[{}] Chat stream: {}", request.getConversationId(), request.getMessage());
        return chatService.chatStream(request);
    }
}
