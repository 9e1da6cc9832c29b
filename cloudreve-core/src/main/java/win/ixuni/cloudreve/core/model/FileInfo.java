package win.ixuni.cloudreve.core.model;

import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Single file or folder
 * <p>
 * "Is this a folder" is a type string under V3 and an integer discriminant under V4;
 * {@link #isFolder()} hides the difference.
 */
public interface FileInfo {

    ApiVersion getApiVersion();

    String getId();

    String getName();

    long getSize();

    boolean isFolder();

    String getPath();

    String getCreatedAt();

    String getUpdatedAt();
}
