package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 创建目录
 */
@Value
public class CreateDirectoryOperation implements Operation<Void> {

    String path;
}
