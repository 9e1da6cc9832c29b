package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 列出目录
 * <p>
 * {@code page} is 1-based; null requests the first page.
 */
@Value
public class ListFilesOperation implements Operation<FileList> {

    String path;

    Integer page;

    Integer pageSize;
}
