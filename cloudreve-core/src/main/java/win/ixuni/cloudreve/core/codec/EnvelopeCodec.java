package win.ixuni.cloudreve.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudreve.core.exception.ApiException;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.transport.TransportResponse;
import win.ixuni.cloudreve.core.util.JsonUtils;

import java.util.Optional;

/**
 * Decoder of the {@code {code, msg, data}} envelope
 * <p>
 * Classification rules:
 * <ul>
 *     <li>non-2xx: a decodable envelope with a non-zero code wins, otherwise the HTTP status
 *     becomes the code and the trimmed body the message</li>
 *     <li>2xx with a non-zero code: {@link ApiException}</li>
 *     <li>a payload is expected but {@code data} is absent: {@link DecodeException}</li>
 * </ul>
 * Never retries.
 */
@Slf4j
public final class EnvelopeCodec {

    private EnvelopeCodec() {
    }

    /**
     * Check the response and return its envelope
     */
    public static ApiEnvelope decodeEnvelope(TransportResponse response) {
        if (!response.isSuccessful()) {
            throw errorFor(response);
        }
        ApiEnvelope envelope = tryParse(response)
                .orElseThrow(() -> new DecodeException("Response is not a valid envelope (HTTP "
                        + response.getStatus() + "): " + abbreviate(response.bodyAsString())));
        if (!envelope.isSuccess()) {
            throw new ApiException(envelope.getCode(), envelope.getMsg(), response.getStatus());
        }
        return envelope;
    }

    /**
     * Check the response, ignoring any payload
     */
    public static void decodeAck(TransportResponse response) {
        decodeEnvelope(response);
    }

    public static <T> T decodePayload(TransportResponse response, Class<T> type) {
        return JsonUtils.convert(requireData(decodeEnvelope(response)), type);
    }

    public static <T> T decodePayload(TransportResponse response, TypeReference<T> type) {
        return JsonUtils.convert(requireData(decodeEnvelope(response)), type);
    }

    /**
     * Build the error for a non-2xx response
     */
    public static ApiException errorFor(TransportResponse response) {
        Optional<ApiEnvelope> envelope = tryParse(response);
        if (envelope.isPresent() && !envelope.get().isSuccess()) {
            return new ApiException(envelope.get().getCode(), envelope.get().getMsg(), response.getStatus());
        }
        return new ApiException(response.getStatus(), response.bodyAsString().trim(), response.getStatus());
    }

    /**
     * Parse the body as an envelope, empty when it is not JSON or lacks a code
     */
    public static Optional<ApiEnvelope> tryParse(TransportResponse response) {
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            return Optional.empty();
        }
        try {
            JsonNode tree = JsonUtils.readTree(body);
            if (tree == null || !tree.isObject() || !tree.has("code")) {
                return Optional.empty();
            }
            return Optional.of(JsonUtils.convert(tree, ApiEnvelope.class));
        } catch (DecodeException e) {
            log.trace("Body is not an envelope: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static JsonNode requireData(ApiEnvelope envelope) {
        if (!envelope.hasData()) {
            String msg = envelope.getMsg() == null || envelope.getMsg().isEmpty() ? "" : ": " + envelope.getMsg();
            throw new DecodeException("Empty response" + msg);
        }
        return envelope.getData();
    }

    private static String abbreviate(String body) {
        String trimmed = body.trim();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }
}
