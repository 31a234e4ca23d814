package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Message content: either plain text or an ordered list of typed blocks.
 * Exactly one of {@link #text()} and a non-empty {@link #blocks()} is set.
 */
@JsonDeserialize(using = MessageContent.Deserializer.class)
public record MessageContent(String text, List<ContentBlock> blocks) {

    private static final MessageContent EMPTY = new MessageContent(null, List.of());

    public MessageContent {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static MessageContent ofText(String text) {
        return new MessageContent(text, List.of());
    }

    public static MessageContent ofBlocks(List<ContentBlock> blocks) {
        return new MessageContent(null, blocks);
    }

    public static MessageContent empty() {
        return EMPTY;
    }

    /**
     * Accepts a JSON string or array; any other shape yields empty content.
     */
    public static final class Deserializer extends StdDeserializer<MessageContent> {

        public Deserializer() {
            super(MessageContent.class);
        }

        @Override
        public MessageContent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_STRING) {
                return ofText(p.getText());
            }
            if (token == JsonToken.START_ARRAY) {
                JavaType listType = ctxt.getTypeFactory()
                        .constructCollectionType(List.class, ContentBlock.class);
                List<ContentBlock> blocks = ctxt.readValue(p, listType);
                return ofBlocks(blocks.stream().filter(Objects::nonNull).toList());
            }
            p.skipChildren();
            return EMPTY;
        }
    }
}
