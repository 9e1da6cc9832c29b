package win.ixuni.cloudreve.core.transport;

import reactor.core.publisher.Mono;

/**
 * HTTP transport boundary
 * <p>
 * Sends one request and emits the raw response whatever its status.
 * Connection-level failures are signalled as {@code TransportException}. Implementations never retry.
 */
public interface HttpTransport {

    /**
     * Send a request
     *
     * @param request method, absolute URL, headers and optional body
     * @return raw status, headers and body
     */
    Mono<TransportResponse> send(TransportRequest request);
}
