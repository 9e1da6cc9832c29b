package win.ixuni.cloudreve.driver.v3.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.share.CreateShareOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 创建分享处理器，返回分享 key
 */
public class V3CreateShareHandler extends AbstractV3Handler<CreateShareOperation, String> {

    @Override
    protected Mono<String> doHandle(CreateShareOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "share");
        return context.getResolver().resolve(path)
                .flatMap(object -> context.getClient().createShare(V3Requests.Share.builder()
                        .id(object.getId())
                        .dir(object.isFolder())
                        .password(operation.getPassword() == null ? "" : operation.getPassword())
                        .downloads(0)
                        .expire(operation.getExpiresIn() == null ? 0 : operation.getExpiresIn())
                        .preview(true)
                        .build()));
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
