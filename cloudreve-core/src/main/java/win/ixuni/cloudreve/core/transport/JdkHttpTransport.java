package win.ixuni.cloudreve.core.transport;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.config.ClientProperties;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.exception.TransportException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * Default transport on the JDK HTTP client
 * <p>
 * Requests are sent with {@code sendAsync} and adapted to a {@link Mono}.
 * Redirects are not followed: download endpoints answer with the URL in the body.
 */
@Slf4j
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public JdkHttpTransport(DriverConfig config) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofMillis(config.getLong(
                                ClientProperties.CONNECT_TIMEOUT_MS, ClientProperties.DEFAULT_CONNECT_TIMEOUT_MS)))
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build(),
                Duration.ofMillis(config.getLong(
                        ClientProperties.REQUEST_TIMEOUT_MS, ClientProperties.DEFAULT_REQUEST_TIMEOUT_MS)),
                config.getString(ClientProperties.USER_AGENT, ClientProperties.DEFAULT_USER_AGENT));
    }

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout, String userAgent) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    @Override
    public Mono<TransportResponse> send(TransportRequest request) {
        return Mono.fromCallable(() -> toHttpRequest(request))
                .flatMap(httpRequest -> Mono.fromFuture(() ->
                        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())))
                .map(this::toTransportResponse)
                .onErrorMap(this::isTransportFailure, e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.debug("{} {} failed: {}", request.getMethod(), request.getUrl(), cause.toString());
                    return new TransportException(request.getMethod() + " " + request.getUrl()
                            + ": " + cause.getMessage(), cause);
                });
    }

    private HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.BodyPublisher publisher = request.getBody() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.getBody());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .method(request.getMethod(), publisher);
        request.getHeaders().forEach(builder::header);
        return builder.build();
    }

    private TransportResponse toTransportResponse(HttpResponse<byte[]> response) {
        return TransportResponse.builder()
                .status(response.statusCode())
                .headers(response.headers().map())
                .body(response.body())
                .build();
    }

    private boolean isTransportFailure(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause instanceof IOException || cause instanceof IllegalArgumentException;
    }
}
