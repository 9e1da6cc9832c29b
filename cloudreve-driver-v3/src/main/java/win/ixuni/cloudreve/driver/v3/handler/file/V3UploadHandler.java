package win.ixuni.cloudreve.driver.v3.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.UploadOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.core.util.UploadChunks;
import win.ixuni.cloudreve.driver.v3.client.V3ApiClient;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Policy;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;
import win.ixuni.cloudreve.driver.v3.model.V3UploadSession;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 上传处理器
 * <p>
 * Opens an upload session in the parent directory, posts the chunks in order and, on
 * OneDrive policies, calls the finish callback (best-effort). The parent directory is always
 * listed: its policy supplies the type that decides the callback, and its id unless the caller
 * names one.
 */
@Slf4j
public class V3UploadHandler extends AbstractV3Handler<UploadOperation, Void> {

    @Override
    protected Mono<Void> doHandle(UploadOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "upload to");
        String parent = CloudrevePaths.parent(path);
        String name = CloudrevePaths.name(path);
        byte[] content = operation.getContent() == null ? new byte[0] : operation.getContent();
        V3ApiClient client = context.getClient();

        Mono<V3Policy> policy = client.listDirectory(parent)
                .map(listing -> withId(listing.getPolicy(), operation.getPolicyId()));

        return policy.flatMap(resolved -> client.createUploadSession(V3Requests.Upload.builder()
                                .path(parent)
                                .size(content.length)
                                .name(name)
                                .policyId(resolved.getId())
                                .lastModified(System.currentTimeMillis())
                                .mimeType("")
                                .build())
                        .flatMap(session -> uploadChunks(client, session, content)
                                .then(finish(client, session, resolved))));
    }

    private Mono<Void> uploadChunks(V3ApiClient client, V3UploadSession session, byte[] content) {
        int chunks = UploadChunks.count(content.length, session.getChunkSize());
        log.debug("Uploading {} bytes in {} chunk(s) to session {}", content.length, chunks, session.getSessionId());
        return Flux.range(0, chunks)
                .concatMap(index -> client.uploadChunk(session.getSessionId(), index,
                        UploadChunks.slice(content, session.getChunkSize(), index)))
                .then();
    }

    private Mono<Void> finish(V3ApiClient client, V3UploadSession session, V3Policy policy) {
        if (!V3Policy.TYPE_ONEDRIVE.equalsIgnoreCase(policy.getType())) {
            return Mono.empty();
        }
        return client.finishOneDriveUpload(session.getSessionId())
                .onErrorResume(e -> {
                    log.warn("OneDrive finish callback failed for session {}: {}", session.getSessionId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private static V3Policy withId(V3Policy listed, String explicitId) {
        V3Policy policy = new V3Policy();
        if (listed != null) {
            policy.setId(listed.getId());
            policy.setName(listed.getName());
            policy.setType(listed.getType());
        }
        if (explicitId != null) {
            policy.setId(explicitId);
        }
        return policy;
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
