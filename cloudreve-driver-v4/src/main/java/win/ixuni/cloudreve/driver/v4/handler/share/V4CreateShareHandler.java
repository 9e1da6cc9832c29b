package win.ixuni.cloudreve.driver.v4.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.share.CreateShareOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 创建分享处理器
 * <p>
 * Shares are readable by everyone; a password makes the link private. Emits the share URL.
 */
public class V4CreateShareHandler extends AbstractV4Handler<CreateShareOperation, String> {

    @Override
    protected Mono<String> doHandle(CreateShareOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "share");
        return context.getClient().createShare(V4Requests.Share.builder()
                .permissions(V4Requests.Permissions.readForAll())
                .uri(V4Uris.pathToUri(path))
                .privateLink(operation.getPassword() != null)
                .expire(operation.getExpiresIn())
                .password(operation.getPassword())
                .build());
    }

    @Override
    public Class<CreateShareOperation> getOperationType() {
        return CreateShareOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SHARE);
    }
}
