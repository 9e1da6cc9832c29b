package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.DeleteOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * V4 删除处理器
 * <p>
 * Files and folders share the same endpoint, no type lookup is needed.
 */
public class V4DeleteHandler extends AbstractV4Handler<DeleteOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "delete");
        return context.getClient().delete(List.of(V4Uris.pathToUri(path)));
    }

    @Override
    public Class<DeleteOperation> getOperationType() {
        return DeleteOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
