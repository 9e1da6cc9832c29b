package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.DeleteOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 删除处理器：先解析 ID，再按文件/目录分别提交
 */
public class V3DeleteHandler extends AbstractV3Handler<DeleteOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "delete");
        return context.getResolver().resolve(path)
                .flatMap(object -> {
                    V3Requests.SourceItems src = V3Requests.SourceItems.of(object);
                    return context.getClient().delete(src.getItems(), src.getDirs());
                });
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
