package win.ixuni.cloudreve.driver.v3.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.file.ListFilesOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 列目录处理器
 * <p>
 * The legacy listing is never paginated: page and page size are ignored and the whole
 * directory is returned.
 */
@Slf4j
public class V3ListFilesHandler extends AbstractV3Handler<ListFilesOperation, FileList> {

    @Override
    protected Mono<FileList> doHandle(ListFilesOperation operation, V3DriverContext context) {
        if (operation.getPage() != null || operation.getPageSize() != null) {
            log.debug("V3 listing has no pagination, ignoring page={} pageSize={}",
                    operation.getPage(), operation.getPageSize());
        }
        return context.getClient().listDirectory(operation.getPath())
                .cast(FileList.class);
    }

    @Override
    public Class<ListFilesOperation> getOperationType() {
        return ListFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
