package win.ixuni.cloudreve.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.cloudreve.core.exception.ApiException;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.transport.TransportResponse;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private static TransportResponse response(int status, String body) {
        return TransportResponse.builder()
                .status(status)
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    @DisplayName("Non-JSON error body: HTTP status becomes the code, trimmed body the message")
    void plainTextErrorBody() {
        ApiException e = assertThrows(ApiException.class,
                () -> EnvelopeCodec.decodeAck(response(404, "  404 page not found\n")));

        assertEquals(404, e.getCode());
        assertEquals(404, e.getHttpStatus());
        assertEquals("404 page not found", e.getMessage());
    }

    @Test
    @DisplayName("A structured error body on a non-2xx status keeps the server code")
    void envelopeOnErrorStatus() {
        ApiException e = assertThrows(ApiException.class,
                () -> EnvelopeCodec.decodeAck(response(401, "{\"code\":401,\"msg\":\"Login required\"}")));

        assertEquals(401, e.getCode());
        assertEquals("Login required", e.getMessage());
    }

    @Test
    void nonZeroCodeOnSuccessStatus() {
        ApiException e = assertThrows(ApiException.class,
                () -> EnvelopeCodec.decodeAck(response(200, "{\"code\":40004,\"msg\":\"not found\"}")));

        assertEquals(40004, e.getCode());
        assertEquals(200, e.getHttpStatus());
        assertEquals("not found", e.getMessage());
        assertEquals("ApiError", e.getErrorCode());
    }

    @Test
    void missingDataIsAnEmptyResponse() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> EnvelopeCodec.decodePayload(response(200, "{\"code\":0,\"msg\":\"\",\"data\":null}"), Map.class));

        assertTrue(e.getMessage().startsWith("Empty response"), e.getMessage());
    }

    @Test
    void ackIgnoresData() {
        assertDoesNotThrow(() -> EnvelopeCodec.decodeAck(response(200, "{\"code\":0,\"msg\":\"\"}")));
    }

    @Test
    void decodesPayload() {
        List<String> names = EnvelopeCodec.decodePayload(
                response(200, "{\"code\":0,\"msg\":\"\",\"data\":[\"a\",\"b\"]}"), new TypeReference<List<String>>() {
                });

        assertEquals(List.of("a", "b"), names);
    }

    @Test
    @DisplayName("HTML on a 2xx status is a decode error")
    void garbageOnSuccessStatus() {
        assertThrows(DecodeException.class, () -> EnvelopeCodec.decodeAck(response(200, "<html></html>")));
    }
}
