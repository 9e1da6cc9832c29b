package win.ixuni.cloudreve.core.model;

import lombok.Value;

/**
 * Storage usage in bytes
 */
@Value
public class StorageQuota {

    long used;

    long total;

    long free;

    /**
     * Quota with {@code free} derived from total and used, never negative
     */
    public static StorageQuota of(long used, long total) {
        return new StorageQuota(used, total, Math.max(total - used, 0L));
    }
}
