package com.ai.salesagent.dto;

import com.ai.salesagent.entity.Message;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

    private String role;
    private String content;
    private Map<String, Object> extraData;
    private Instant createdAt;

    public static MessageResponse from(Message message) {
        return new MessageResponse(message.getRole(), message.getContent(),
                message.getExtraData(), message.getCreatedAt());
    }
}
