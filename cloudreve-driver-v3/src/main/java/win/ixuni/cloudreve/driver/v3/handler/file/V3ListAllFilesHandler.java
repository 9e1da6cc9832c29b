package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.file.ListAllFilesOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * A single full listing
 */
public class V3ListAllFilesHandler extends AbstractV3Handler<ListAllFilesOperation, FileList> {

    @Override
    protected Mono<FileList> doHandle(ListAllFilesOperation operation, V3DriverContext context) {
        return context.getClient().listDirectory(operation.getPath())
                .cast(FileList.class);
    }

    @Override
    public Class<ListAllFilesOperation> getOperationType() {
        return ListAllFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
