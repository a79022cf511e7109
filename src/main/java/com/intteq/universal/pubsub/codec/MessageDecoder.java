package com.intteq.universal.pubsub.codec;

import com.intteq.universal.pubsub.exception.MessageDecodeException;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * Turns a delivered envelope (attributes + payload) into a typed message.
 *
 * <p>Applications may replace the default JSON decoder by declaring their own bean,
 * for instance to select a format from a content-type attribute.
 */
public interface MessageDecoder {

    /**
     * @param attributes  transport attributes of the delivery
     * @param payload     raw message body
     * @param messageType target type
     * @return the decoded message, never {@code null}
     * @throws MessageDecodeException if the envelope cannot be decoded
     */
    <T> T decode(Map<String, String> attributes, byte[] payload, Type messageType);
}
