package win.ixuni.cloudreve.driver.v3.handler.user;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.StorageQuota;
import win.ixuni.cloudreve.core.operation.user.GetStorageQuotaOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

public class V3GetStorageQuotaHandler extends AbstractV3Handler<GetStorageQuotaOperation, StorageQuota> {

    @Override
    protected Mono<StorageQuota> doHandle(GetStorageQuotaOperation operation, V3DriverContext context) {
        return context.getClient().storage()
                .map(storage -> StorageQuota.of(storage.getUsed(), storage.getTotal()));
    }

    @Override
    public Class<GetStorageQuotaOperation> getOperationType() {
        return GetStorageQuotaOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.USER);
    }
}
