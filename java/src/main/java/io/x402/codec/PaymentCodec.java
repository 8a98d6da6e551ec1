package io.x402.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.x402.exception.MalformedPayloadException;
import io.x402.model.PaymentPayload;
import io.x402.model.SettlementResponseHeader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;
import java.util.Map;

/**
 * Base64 JSON encoding of the {@code X-PAYMENT} and {@code X-PAYMENT-RESPONSE}
 * header values.
 *
 * <p>Encoding is canonical: object properties follow the declared schema order
 * and map entries are sorted, so two structurally equal payloads encode to the
 * same string. Decoding checks shape only; whether the content is acceptable is
 * decided by the verifier of the payload's network family.
 */
public final class PaymentCodec {

    /** Target type for converting typed payload views into the open payload map. */
    public static final TypeReference<Map<String, Object>> PAYLOAD_MAP = new TypeReference<>() {};

    private PaymentCodec() {}

    public static String encode(PaymentPayload payload) {
        return base64(payload);
    }

    public static PaymentPayload decode(String header) throws MalformedPayloadException {
        JsonNode node = readTree(header);
        if (!node.isObject()) {
            throw new MalformedPayloadException("Payment header is not a JSON object");
        }
        JsonNode body = node.get("payload");
        if (body == null || !body.isObject()) {
            throw new MalformedPayloadException("Payment header has no payload object");
        }
        if (!textual(node, "scheme") || !textual(node, "network")) {
            throw new MalformedPayloadException("Payment header is missing scheme or network");
        }
        JsonNode version = node.get("x402Version");
        if (version == null || !version.canConvertToInt()) {
            throw new MalformedPayloadException("Payment header is missing x402Version");
        }
        try {
            return Json.MAPPER.treeToValue(node, PaymentPayload.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Payment header does not match the payload schema", e);
        }
    }

    public static String encodeSettlement(SettlementResponseHeader header) {
        return base64(header);
    }

    public static SettlementResponseHeader decodeSettlement(String header) throws MalformedPayloadException {
        JsonNode node = readTree(header);
        if (!node.isObject()) {
            throw new MalformedPayloadException("Settlement header is not a JSON object");
        }
        try {
            return Json.MAPPER.treeToValue(node, SettlementResponseHeader.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Settlement header does not match the response schema", e);
        }
    }

    private static String base64(Object value) {
        try {
            return Base64.getEncoder().encodeToString(Json.MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static JsonNode readTree(String header) throws MalformedPayloadException {
        if (header == null || header.isBlank()) {
            throw new MalformedPayloadException("Header value is empty");
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(header.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Header value is not valid base64", e);
        }
        try {
            return Json.MAPPER.readTree(json);
        } catch (IOException e) {
            throw new MalformedPayloadException("Header value is not valid JSON", e);
        }
    }

    private static boolean textual(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual();
    }
}
