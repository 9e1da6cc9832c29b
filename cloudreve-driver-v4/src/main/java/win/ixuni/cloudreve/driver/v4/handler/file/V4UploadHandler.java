package win.ixuni.cloudreve.driver.v4.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.UploadOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.core.util.UploadChunks;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Requests;
import win.ixuni.cloudreve.driver.v4.model.V4UploadSession;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 上传处理器
 * <p>
 * Opens an upload session for the target URI and sends the chunks in order. A failed chunk
 * aborts the session on the server (best-effort) and the chunk error is propagated.
 * Without an explicit policy the parent directory's storage policy is used, falling back to
 * {@value #DEFAULT_POLICY} when the listing carries none or cannot be read.
 */
@Slf4j
public class V4UploadHandler extends AbstractV4Handler<UploadOperation, Void> {

    static final String DEFAULT_POLICY = "default";

    @Override
    protected Mono<Void> doHandle(UploadOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "upload to");
        String uri = V4Uris.pathToUri(path);
        byte[] content = operation.getContent() == null ? new byte[0] : operation.getContent();
        V4ApiClient client = context.getClient();

        Mono<String> policy = operation.getPolicyId() != null
                ? Mono.just(operation.getPolicyId())
                : parentPolicy(client, CloudrevePaths.parent(path));

        return policy.flatMap(policyId -> client.createUploadSession(V4Requests.Upload.builder()
                        .uri(uri)
                        .size(content.length)
                        .policyId(policyId)
                        .build()))
                .flatMap(session -> uploadChunks(client, session, content)
                        .onErrorResume(e -> abort(client, session, uri).then(Mono.error(e))));
    }

    private Mono<String> parentPolicy(V4ApiClient client, String parent) {
        return client.list(V4Uris.pathToUri(parent), null, 1, null)
                .map(listing -> listing.getStoragePolicyId() != null ? listing.getStoragePolicyId() : DEFAULT_POLICY)
                .onErrorResume(e -> {
                    log.debug("Could not read storage policy of {}: {}", parent, e.getMessage());
                    return Mono.just(DEFAULT_POLICY);
                });
    }

    private Mono<Void> uploadChunks(V4ApiClient client, V4UploadSession session, byte[] content) {
        int chunks = UploadChunks.count(content.length, session.getChunkSize());
        log.debug("Uploading {} bytes in {} chunk(s) to session {}", content.length, chunks, session.getSessionId());
        return Flux.range(0, chunks)
                .concatMap(index -> client.uploadChunk(session.getSessionId(), index,
                        UploadChunks.slice(content, session.getChunkSize(), index)))
                .then();
    }

    private Mono<Void> abort(V4ApiClient client, V4UploadSession session, String uri) {
        return client.deleteUploadSession(session.getSessionId(), uri)
                .onErrorResume(e -> {
                    log.warn("Could not abort upload session {}: {}", session.getSessionId(), e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Class<UploadOperation> getOperationType() {
        return UploadOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.UPLOAD);
    }
}
