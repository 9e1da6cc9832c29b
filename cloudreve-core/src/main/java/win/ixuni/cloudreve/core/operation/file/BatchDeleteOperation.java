package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.model.BatchDeleteResult;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * 批量删除操作
 */
@Value
public class BatchDeleteOperation implements Operation<BatchDeleteResult> {

    List<String> paths;
}
