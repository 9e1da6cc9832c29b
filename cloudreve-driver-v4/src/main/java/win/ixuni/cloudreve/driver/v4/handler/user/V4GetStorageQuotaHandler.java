package win.ixuni.cloudreve.driver.v4.handler.user;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.StorageQuota;
import win.ixuni.cloudreve.core.operation.user.GetStorageQuotaOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4GetStorageQuotaHandler extends AbstractV4Handler<GetStorageQuotaOperation, StorageQuota> {

    @Override
    protected Mono<StorageQuota> doHandle(GetStorageQuotaOperation operation, V4DriverContext context) {
        return context.getClient().capacity()
                .map(quota -> StorageQuota.of(quota.getUsed(), quota.getTotal()));
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
