package win.ixuni.cloudreve.core.operation.session;

import lombok.Value;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 登录操作
 * <p>
 * Stores the resulting session cookie or bearer token in the driver credentials.
 */
@Value
public class LoginOperation implements Operation<LoginResponse> {

    /**
     * Login e-mail (V3 user name)
     */
    String email;

    String password;
}
