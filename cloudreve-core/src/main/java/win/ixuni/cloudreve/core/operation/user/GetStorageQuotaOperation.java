package win.ixuni.cloudreve.core.operation.user;

import lombok.Value;
import win.ixuni.cloudreve.core.model.StorageQuota;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 获取存储容量
 */
@Value
public class GetStorageQuotaOperation implements Operation<StorageQuota> {
}
