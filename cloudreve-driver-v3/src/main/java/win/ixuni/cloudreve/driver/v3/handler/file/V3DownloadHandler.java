package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.operation.file.DownloadOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

public class V3DownloadHandler extends AbstractV3Handler<DownloadOperation, String> {

    @Override
    protected Mono<String> doHandle(DownloadOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "download");
        return context.getResolver().resolve(path)
                .flatMap(object -> {
                    if (object.isFolder()) {
                        return Mono.error(new InvalidArgumentException("Cannot download a directory: " + path));
                    }
                    return context.getClient().downloadUrl(object.getId());
                });
    }

    @Override
    public Class<DownloadOperation> getOperationType() {
        return DownloadOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.DOWNLOAD);
    }
}
