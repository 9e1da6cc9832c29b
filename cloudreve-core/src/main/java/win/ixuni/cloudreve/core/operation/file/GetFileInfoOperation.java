package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 获取文件信息
 */
@Value
public class GetFileInfoOperation implements Operation<FileInfo> {

    String path;
}
