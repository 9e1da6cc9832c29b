package win.ixuni.cloudreve.core.operation.share;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Deletes a share link
 */
@Value
public class DeleteShareOperation implements Operation<Void> {

    String shareId;
}
