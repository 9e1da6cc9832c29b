package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.core.operation.file.GetFileInfoOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3FileInfo;

import java.util.EnumSet;
import java.util.Set;

public class V3GetFileInfoHandler extends AbstractV3Handler<GetFileInfoOperation, FileInfo> {

    @Override
    protected Mono<FileInfo> doHandle(GetFileInfoOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.normalize(operation.getPath());
        return context.getResolver().resolve(path)
                .map(object -> new V3FileInfo(path, object));
    }

    @Override
    public Class<GetFileInfoOperation> getOperationType() {
        return GetFileInfoOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
