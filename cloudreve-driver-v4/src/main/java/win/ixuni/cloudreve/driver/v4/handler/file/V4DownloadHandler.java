package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.DownloadOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 下载处理器，返回服务端签发的第一个下载地址
 */
public class V4DownloadHandler extends AbstractV4Handler<DownloadOperation, String> {

    @Override
    protected Mono<String> doHandle(DownloadOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "download");
        return context.getClient().downloadUrl(V4Uris.pathToUri(path));
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
