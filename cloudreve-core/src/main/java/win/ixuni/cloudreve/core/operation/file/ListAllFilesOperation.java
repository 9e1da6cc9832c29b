package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Lists a directory following every page
 */
@Value
public class ListAllFilesOperation implements Operation<FileList> {

    String path;
}
