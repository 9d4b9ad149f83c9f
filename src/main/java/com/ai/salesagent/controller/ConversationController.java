package com.ai.salesagent.controller;

import com.ai.salesagent.dto.ConversationResponse;
import com.ai.salesagent.dto.MessageResponse;
import com.ai.salesagent.exception.ConversationNotFoundException;
import com.ai.salesagent.service.ConversationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping
    public ConversationResponse create() {
        return ConversationResponse.from(conversationService.create());
    }

    @GetMapping("/{id}")
    public ConversationResponse get(@PathVariable("id") UUID id) {
        return conversationService.get(id)
                .map(ConversationResponse::from)
                .orElseThrow(() -> new ConversationNotFoundException(id));
    }

    @GetMapping("/{id}/messages")
    public List<MessageResponse> messages(@PathVariable("id") UUID id) {
        return conversationService.listMessages(id).stream()
                .map(MessageResponse::from)
                .collect(Collectors.toList());
    }
}
