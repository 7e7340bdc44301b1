package com.collabim.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;

/**
 * 将“语义为 ID 的 long/Long 字段”序列化为字符串，避免 JS Number 精度丢失。
 *
 * <p>按字段名判定：{@code id}、以 {@code Id} 结尾（conversationId/identityId/...）、
 * 以 {@code By} 结尾（readBy）。计数类字段（unreadCount/total）保持 number。</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (asString) {
            gen.writeString(Long.toString(value));
        } else {
            gen.writeNumber(value);
        }
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) {
        if (property == null) {
            return this;
        }
        return new IdLongJsonSerializer(isIdFieldName(property.getName()));
    }

    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith("id") || lower.endsWith("by");
    }
}
