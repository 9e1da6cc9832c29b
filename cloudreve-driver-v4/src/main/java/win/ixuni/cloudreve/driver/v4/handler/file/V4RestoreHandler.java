package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.operation.file.RestoreOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 回收站还原
 * <p>
 * Accepts plain paths as well as trash URIs; URIs pass through untouched.
 */
public class V4RestoreHandler extends AbstractV4Handler<RestoreOperation, Void> {

    @Override
    protected Mono<Void> doHandle(RestoreOperation operation, V4DriverContext context) {
        if (operation.getPaths() == null || operation.getPaths().isEmpty()) {
            throw new InvalidArgumentException("Nothing to restore");
        }
        return context.getClient().restore(V4Uris.pathsToUris(operation.getPaths()));
    }

    @Override
    public Class<RestoreOperation> getOperationType() {
        return RestoreOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.TRASH);
    }
}
