package com.ai.salesagent.conversation;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One server-sent event of a streamed turn.
 */
@Getter
@AllArgsConstructor
public class StreamEvent {

    public enum Type {
        INTENT("intent"),
        PROPERTIES("properties"),
        CONTENT("content"),
        DONE("done"),
        ERROR("error");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    private final Type type;
    private final Object data;

    public static StreamEvent intent(ConversationIntent intent) {
        return new StreamEvent(Type.INTENT, intent.getKey());
    }

    public static StreamEvent content(String chunk) {
        return new StreamEvent(Type.CONTENT, chunk);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, message);
    }
}
