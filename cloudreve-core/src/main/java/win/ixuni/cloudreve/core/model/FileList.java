package win.ixuni.cloudreve.core.model;

import win.ixuni.cloudreve.core.driver.ApiVersion;

import java.util.List;

/**
 * Directory listing
 * <p>
 * Implemented by the V3 directory list and the V4 list response; the underlying record stays
 * reachable by casting on {@link #getApiVersion()}.
 */
public interface FileList {

    ApiVersion getApiVersion();

    /**
     * Parent reference reported by the server: the directory name (V4) or its identifier (V3)
     */
    String getParentName();

    List<FileItem> getItems();

    /**
     * Identifier of the storage policy governing the directory, null when the server sent none
     */
    String getStoragePolicyId();

    default int getTotalCount() {
        return getItems().size();
    }
}
