package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 删除文件或目录
 */
@Value
public class DeleteOperation implements Operation<Void> {

    /**
     * Path or resource URI
     */
    String path;
}
