package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Creates a download URL
 */
@Value
public class DownloadOperation implements Operation<String> {

    String path;
}
