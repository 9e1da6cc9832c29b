package win.ixuni.cloudreve.core.operation.share;

import lombok.Value;
import win.ixuni.cloudreve.core.model.ShareUpdate;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Edits a share link
 */
@Value
public class UpdateShareOperation implements Operation<Void> {

    String shareId;

    ShareUpdate update;
}
