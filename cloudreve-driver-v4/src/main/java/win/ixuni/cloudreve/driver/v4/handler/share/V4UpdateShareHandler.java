package win.ixuni.cloudreve.driver.v4.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.ShareUpdate;
import win.ixuni.cloudreve.core.operation.share.UpdateShareOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 修改分享
 * <p>
 * The server keeps the shared URI, so the body carries an empty one.
 */
public class V4UpdateShareHandler extends AbstractV4Handler<UpdateShareOperation, Void> {

    @Override
    protected Mono<Void> doHandle(UpdateShareOperation operation, V4DriverContext context) {
        String shareId = CloudrevePaths.requireText(operation.getShareId(), "shareId");
        ShareUpdate update = operation.getUpdate() == null ? ShareUpdate.builder().build() : operation.getUpdate();
        return context.getClient().editShare(shareId, V4Requests.Share.builder()
                .permissions(V4Requests.Permissions.readForAll())
                .uri("")
                .privateLink(update.getPassword() != null ? Boolean.TRUE : null)
                .expire(update.getExpiresIn())
                .password(update.getPassword())
                .build());
    }

    @Override
    public Class<UpdateShareOperation> getOperationType() {
        return UpdateShareOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SHARE_MANAGEMENT);
    }
}
