package win.ixuni.cloudreve.test;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.exception.TransportException;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.core.transport.TransportRequest;
import win.ixuni.cloudreve.core.transport.TransportResponse;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 录制型 HTTP 传输替身
 * <p>
 * Serves canned responses keyed by method and endpoint path and records every request in
 * order. Endpoint paths are matched without the {@code /api/v3} or {@code /api/v4} prefix and
 * without the query string, e.g. {@code on("GET", "/directory/docs")}.
 * <p>
 * A stub holding several responses hands them out in turn and repeats the last one.
 * Later stubs take precedence over earlier ones. Unmatched requests get a plain-text 404.
 */
@Slf4j
public class FakeHttpTransport implements HttpTransport {

    private static final Pattern API_PREFIX = Pattern.compile("^/api/v\\d+");

    private final List<Stub> stubs = new ArrayList<>();
    private final List<TransportRequest> requests = Collections.synchronizedList(new ArrayList<>());

    @Override
    public Mono<TransportResponse> send(TransportRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            Stub stub = find(request);
            if (stub == null) {
                log.debug("No stub for {} {}", request.getMethod(), endpoint(request));
                return Mono.just(text(404, "404 page not found"));
            }
            return stub.next();
        });
    }

    // ============ Stubbing ============

    public synchronized Stub on(String method, String endpoint) {
        return on(method, endpoint, request -> true);
    }

    /**
     * Stub that also requires the extra predicate, e.g. a query parameter value
     */
    public synchronized Stub on(String method, String endpoint, Predicate<TransportRequest> condition) {
        Stub stub = new Stub(method, endpoint, condition);
        stubs.add(stub);
        return stub;
    }

    private synchronized Stub find(TransportRequest request) {
        for (int i = stubs.size() - 1; i >= 0; i--) {
            if (stubs.get(i).matches(request)) {
                return stubs.get(i);
            }
        }
        return null;
    }

    // ============ Recording ============

    public List<TransportRequest> getRequests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    /**
     * Recorded requests as {@code "METHOD /endpoint"} lines, in order
     */
    public List<String> requestLines() {
        return getRequests().stream()
                .map(request -> request.getMethod() + " " + endpoint(request))
                .collect(Collectors.toList());
    }

    public List<TransportRequest> requests(String method, String endpoint) {
        return getRequests().stream()
                .filter(request -> request.getMethod().equals(method) && endpoint(request).equals(endpoint))
                .collect(Collectors.toList());
    }

    public TransportRequest lastRequest() {
        List<TransportRequest> recorded = getRequests();
        if (recorded.isEmpty()) {
            throw new IllegalStateException("No request was sent");
        }
        return recorded.get(recorded.size() - 1);
    }

    public void reset() {
        requests.clear();
    }

    /**
     * Endpoint path of a request: URL path without the API version prefix
     */
    public static String endpoint(TransportRequest request) {
        String path = request.uri().getPath();
        return API_PREFIX.matcher(path).replaceFirst("");
    }

    // ============ Response builders ============

    public static TransportResponse json(int status, String body) {
        return TransportResponse.builder()
                .status(status)
                .header("Content-Type", List.of("application/json"))
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    public static TransportResponse text(int status, String body) {
        return TransportResponse.builder()
                .status(status)
                .header("Content-Type", List.of("text/plain"))
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    /**
     * Canned response source of one endpoint
     */
    public static class Stub {

        private final String method;
        private final String endpoint;
        private final Predicate<TransportRequest> condition;
        private final Deque<Mono<TransportResponse>> responses = new ArrayDeque<>();

        private Stub(String method, String endpoint, Predicate<TransportRequest> condition) {
            this.method = method;
            this.endpoint = endpoint;
            this.condition = condition;
        }

        private boolean matches(TransportRequest request) {
            return method.equals(request.getMethod())
                    && endpoint.equals(endpoint(request))
                    && condition.test(request);
        }

        private synchronized Mono<TransportResponse> next() {
            if (responses.isEmpty()) {
                return Mono.just(json(200, Envelopes.ack()));
            }
            return responses.size() > 1 ? responses.poll() : responses.peek();
        }

        public synchronized Stub respond(TransportResponse response) {
            responses.add(Mono.just(response));
            return this;
        }

        /**
         * HTTP 200 envelope carrying {@code data}
         */
        public Stub ok(String dataJson) {
            return respond(json(200, Envelopes.ok(dataJson)));
        }

        /**
         * HTTP 200 envelope without data
         */
        public Stub ack() {
            return respond(json(200, Envelopes.ack()));
        }

        /**
         * HTTP 200 envelope with a non-zero code
         */
        public Stub apiError(int code, String msg) {
            return respond(json(200, Envelopes.error(code, msg)));
        }

        public Stub status(int status, String body) {
            return respond(text(status, body));
        }

        public Stub withCookie(String setCookie) {
            synchronized (this) {
                Mono<TransportResponse> last = responses.pollLast();
                if (last == null) {
                    throw new IllegalStateException("Add a response before its cookie");
                }
                responses.add(last.map(response -> TransportResponse.builder()
                        .status(response.getStatus())
                        .headers(response.getHeaders())
                        .header("Set-Cookie", List.of(setCookie))
                        .body(response.getBody())
                        .build()));
            }
            return this;
        }

        /**
         * Simulate a connection failure
         */
        public synchronized Stub fail() {
            IOException cause = new ConnectException("Connection refused");
            responses.add(Mono.error(new TransportException(cause.getMessage(), cause)));
            return this;
        }
    }
}
