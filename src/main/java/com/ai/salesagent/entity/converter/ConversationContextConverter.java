package com.ai.salesagent.entity.converter;

import com.ai.salesagent.conversation.ConversationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.Converter;

@Converter
public class ConversationContextConverter extends JsonColumnConverter<ConversationContext> {

    @Override
    protected JavaType type(ObjectMapper mapper) {
        return mapper.constructType(ConversationContext.class);
    }

    @Override
    protected ConversationContext empty() {
        return new ConversationContext();
    }
}
