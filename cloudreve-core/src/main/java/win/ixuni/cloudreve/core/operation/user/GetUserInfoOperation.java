package win.ixuni.cloudreve.core.operation.user;

import lombok.Value;
import win.ixuni.cloudreve.core.model.UserInfo;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Profile of the logged-in user
 */
@Value
public class GetUserInfoOperation implements Operation<UserInfo> {
}
