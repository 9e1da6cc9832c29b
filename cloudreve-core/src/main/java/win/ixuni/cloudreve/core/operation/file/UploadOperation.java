package win.ixuni.cloudreve.core.operation.file;

import lombok.Value;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 上传文件
 */
@Value
public class UploadOperation implements Operation<Void> {

    /**
     * Full path of the file to create
     */
    String path;

    byte[] content;

    /**
     * Storage policy; null picks the policy of the parent directory
     */
    String policyId;
}
