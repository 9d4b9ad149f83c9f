package com.ai.salesagent.dto;

import com.ai.salesagent.conversation.ConversationContext;
import com.ai.salesagent.entity.Conversation;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

    private UUID id;
    private String status;
    private ConversationContext context;
    private Instant createdAt;

    public static ConversationResponse from(Conversation conversation) {
        return new ConversationResponse(
                conversation.getId(),
                conversation.getStatus(),
                conversation.getContext() != null ? conversation.getContext() : new ConversationContext(),
                conversation.getCreatedAt());
    }
}
