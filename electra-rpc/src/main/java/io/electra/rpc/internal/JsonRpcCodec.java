// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.internal;

import static io.electra.rpc.internal.RpcUtils.MAPPER;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.electra.core.error.TransportException;
import io.electra.rpc.InboundMessage;
import io.electra.rpc.JsonRpcError;
import io.electra.rpc.JsonRpcNotification;
import io.electra.rpc.JsonRpcRequest;
import io.electra.rpc.JsonRpcResponse;
import org.jspecify.annotations.Nullable;

/**
 * Encodes requests to, and decodes frames from, the newline-delimited
 * JSON-RPC stream. Framing itself (the trailing newline) belongs to the
 * transport.
 */
public final class JsonRpcCodec {

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private JsonRpcCodec() {
    }

    public static String encodeRequest(final long id, final String method, final List<?> params) {
        try {
            return MAPPER.writeValueAsString(new JsonRpcRequest(method, params, id));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize params of " + method, e);
        }
    }

    /**
     * Decodes one frame. A JSON array (a batch response) yields one message
     * per element.
     *
     * @throws TransportException if the frame is not JSON or is neither a
     *                            response nor a notification
     */
    public static List<InboundMessage> decode(final String frame) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed frame from server: " + abbreviate(frame), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new TransportException("Empty frame from server");
        }
        if (root.isArray()) {
            final List<InboundMessage> messages = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                messages.add(decodeMessage(element, frame));
            }
            return messages;
        }
        return List.of(decodeMessage(root, frame));
    }

    private static InboundMessage decodeMessage(final JsonNode node, final String frame) {
        if (!node.isObject()) {
            throw new TransportException("Unexpected frame from server: " + abbreviate(frame));
        }
        final JsonNode idNode = node.get("id");
        if (idNode != null && !idNode.isNull()) {
            return new JsonRpcResponse(parseId(idNode), toObject(node.get("result")), toError(node.get("error")));
        }
        final JsonNode methodNode = node.get("method");
        if (methodNode != null && methodNode.isTextual()) {
            return new JsonRpcNotification(methodNode.asText(), toParams(node.get("params")), toError(node.get("error")));
        }
        throw new TransportException("Frame is neither a response nor a notification: " + abbreviate(frame));
    }

    private static @Nullable Long parseId(final JsonNode idNode) {
        if (idNode.canConvertToLong()) {
            return idNode.asLong();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<Object> toParams(final @Nullable JsonNode params) {
        if (params == null || params.isNull()) {
            return List.of();
        }
        if (params.isArray()) {
            return MAPPER.convertValue(params, LIST_TYPE);
        }
        final List<Object> single = new ArrayList<>(1);
        single.add(toObject(params));
        return single;
    }

    private static @Nullable Object toObject(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new TransportException("Unreadable value in frame: " + abbreviate(node.toString()), e);
        }
    }

    private static @Nullable JsonRpcError toError(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            final int code = node.path("code").asInt(JsonRpcError.UNKNOWN_CODE);
            final JsonNode message = node.get("message");
            final String text = message == null || message.isNull() ? node.toString() : message.asText();
            return new JsonRpcError(code, text, toObject(node.get("data")));
        }
        if (node.isTextual()) {
            return new JsonRpcError(JsonRpcError.UNKNOWN_CODE, node.asText(), null);
        }
        return new JsonRpcError(JsonRpcError.UNKNOWN_CODE, node.toString(), null);
    }

    private static String abbreviate(final String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
