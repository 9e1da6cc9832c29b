package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 批量删除结果
 * <p>
 * Per-path outcome of a batch delete; one failing path never aborts the others.
 */
@Value
@Builder
public class BatchDeleteResult {

    /**
     * Paths deleted successfully
     */
    @Singular("deletedPath")
    List<String> deleted;

    /**
     * Paths that could not be deleted
     */
    @Singular
    List<Failure> failures;

    public int getSuccessCount() {
        return deleted.size();
    }

    public int getFailureCount() {
        return failures.size();
    }

    public boolean isAllSucceeded() {
        return failures.isEmpty();
    }

    @Value
    public static class Failure {

        String path;

        String message;
    }
}
