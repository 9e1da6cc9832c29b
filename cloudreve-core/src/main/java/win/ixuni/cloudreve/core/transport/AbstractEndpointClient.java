package win.ixuni.cloudreve.core.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.codec.EnvelopeCodec;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.util.JsonUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Shared plumbing of the per-version endpoint clients
 * <p>
 * Builds {@code {baseUrl}/api/{version}/{endpoint}} URLs, serializes JSON bodies, lets the
 * subclass attach its credentials and runs the response through {@link EnvelopeCodec}.
 */
@Slf4j
public abstract class AbstractEndpointClient {

    protected static final String JSON = "application/json";

    @Getter
    private final String baseUrl;

    @Getter
    private final ApiVersion apiVersion;

    protected final HttpTransport transport;

    @Getter
    protected final SessionCredentials credentials;

    protected AbstractEndpointClient(String baseUrl, ApiVersion apiVersion,
                                     HttpTransport transport, SessionCredentials credentials) {
        this.baseUrl = baseUrl;
        this.apiVersion = apiVersion;
        this.transport = transport;
        this.credentials = credentials;
    }

    /**
     * Attach the credential header, if any
     */
    protected abstract void applyAuth(TransportRequest.TransportRequestBuilder builder);

    // ============ URL 工具方法 ============

    /**
     * Absolute URL of an API endpoint
     */
    public String url(String endpoint) {
        String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
        return baseUrl + "/api/" + apiVersion.getId() + "/" + path;
    }

    /**
     * Percent-encode one query or path value (spaces as %20)
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Percent-encode a path keeping '/' as separator
     */
    public static String encodePath(String path) {
        String[] segments = path.split("/", -1);
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : segments) {
            joiner.add(encode(segment));
        }
        return joiner.toString();
    }

    /**
     * Query string from ordered parameters, null values skipped; empty when nothing remains
     */
    public static String query(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner("&", "?", "");
        joiner.setEmptyValue("");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(encode(key) + "=" + encode(value.toString()));
            }
        });
        return joiner.toString();
    }

    // ============ Request helpers ============

    protected Mono<TransportResponse> exchange(String method, String endpoint, Object jsonBody) {
        return Mono.defer(() -> {
            TransportRequest.TransportRequestBuilder builder = TransportRequest.builder()
                    .method(method)
                    .url(url(endpoint))
                    .header("Accept", JSON);
            if (jsonBody != null) {
                builder.header("Content-Type", JSON).body(JsonUtils.toJsonBytes(jsonBody));
            }
            return send(builder);
        });
    }

    protected Mono<TransportResponse> exchangeBytes(String method, String endpoint, byte[] body) {
        return Mono.defer(() -> send(TransportRequest.builder()
                .method(method)
                .url(url(endpoint))
                .header("Content-Type", "application/octet-stream")
                .body(body)));
    }

    private Mono<TransportResponse> send(TransportRequest.TransportRequestBuilder builder) {
        applyAuth(builder);
        TransportRequest request = builder.build();
        log.debug("{} {}", request.getMethod(), request.getUrl());
        return transport.send(request);
    }

    protected <T> Mono<T> payload(String method, String endpoint, Object body, Class<T> type) {
        return exchange(method, endpoint, body)
                .map(response -> EnvelopeCodec.decodePayload(response, type));
    }

    protected <T> Mono<T> payload(String method, String endpoint, Object body, TypeReference<T> type) {
        return exchange(method, endpoint, body)
                .map(response -> EnvelopeCodec.decodePayload(response, type));
    }

    protected Mono<Void> ack(String method, String endpoint, Object body) {
        return exchange(method, endpoint, body)
                .doOnNext(EnvelopeCodec::decodeAck)
                .then();
    }

    protected <T> Mono<T> get(String endpoint, Class<T> type) {
        return payload("GET", endpoint, null, type);
    }

    protected <T> Mono<T> get(String endpoint, TypeReference<T> type) {
        return payload("GET", endpoint, null, type);
    }

    /**
     * Liveness probe: GET /site/ping, emitting the reported server version
     */
    public Mono<String> ping() {
        return exchange("GET", "/site/ping", null)
                .map(response -> {
                    var envelope = EnvelopeCodec.decodeEnvelope(response);
                    if (envelope.hasData() && envelope.getData().isTextual()) {
                        return envelope.getData().asText();
                    }
                    return envelope.getMsg() == null ? "" : envelope.getMsg();
                });
    }
}
