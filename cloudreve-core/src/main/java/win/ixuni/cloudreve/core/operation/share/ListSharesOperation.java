package win.ixuni.cloudreve.core.operation.share;

import lombok.Value;
import win.ixuni.cloudreve.core.model.ShareItem;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * Lists the share links of the current user
 */
@Value
public class ListSharesOperation implements Operation<List<ShareItem>> {
}
