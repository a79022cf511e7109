package com.intteq.universal.pubsub.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.universal.pubsub.annotation.MessageAttribute;
import com.intteq.universal.pubsub.exception.MessageDecodeException;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON {@link MessageDecoder} backed by Jackson.
 *
 * <p>The payload is read as JSON into the target type, then every field annotated with
 * {@link MessageAttribute} is overwritten with the matching attribute, if present.
 */
@RequiredArgsConstructor
public class JacksonMessageDecoder implements MessageDecoder {

    private final ObjectMapper objectMapper;

    /** Attribute-bound fields per message class. */
    private final Map<Class<?>, List<Field>> attributeFields = new ConcurrentHashMap<>();

    @Override
    public <T> T decode(Map<String, String> attributes, byte[] payload, Type messageType) {
        JavaType javaType = objectMapper.getTypeFactory().constructType(messageType);

        if (payload == null || payload.length == 0) {
            throw new MessageDecodeException("empty payload for message type " + javaType);
        }

        T message;
        try {
            message = objectMapper.readValue(payload, javaType);
        } catch (IOException e) {
            throw new MessageDecodeException("failed to decode payload as " + javaType, e);
        }

        if (message == null) {
            throw new MessageDecodeException("payload decoded to null for message type " + javaType);
        }

        bindAttributes(message, attributes);
        return message;
    }

    private void bindAttributes(Object message, Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return;
        }

        for (Field field : attributeFields.computeIfAbsent(message.getClass(), JacksonMessageDecoder::findAttributeFields)) {
            String name = field.getAnnotation(MessageAttribute.class).value();
            String raw = attributes.get(name);
            if (raw == null) {
                continue;
            }

            try {
                Object value = field.getType() == String.class
                        ? raw
                        : objectMapper.convertValue(raw, objectMapper.getTypeFactory().constructType(field.getGenericType()));
                field.set(message, value);
            } catch (IllegalArgumentException | IllegalAccessException e) {
                throw new MessageDecodeException(
                        "failed to bind attribute '" + name + "' to field " + field.getName(), e);
            }
        }
    }

    private static List<Field> findAttributeFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (!field.isAnnotationPresent(MessageAttribute.class)) continue;

                if (Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers())) {
                    throw new MessageDecodeException(
                            "@MessageAttribute field " + c.getName() + "#" + field.getName()
                                    + " must be a non-static, non-final instance field");
                }
                field.setAccessible(true);
                fields.add(field);
            }
        }
        return List.copyOf(fields);
    }
}
