package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.core.operation.file.GetFileInfoOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4FileInfo;

import java.util.EnumSet;
import java.util.Set;

public class V4GetFileInfoHandler extends AbstractV4Handler<GetFileInfoOperation, FileInfo> {

    @Override
    protected Mono<FileInfo> doHandle(GetFileInfoOperation operation, V4DriverContext context) {
        return context.getClient().fileInfo(V4Uris.pathToUri(operation.getPath()))
                .map(V4FileInfo::new);
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
