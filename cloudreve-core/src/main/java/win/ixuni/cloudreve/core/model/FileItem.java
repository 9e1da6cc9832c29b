package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Version-neutral entry of a directory listing
 */
@Value
@Builder
public class FileItem {

    String name;

    boolean folder;

    long size;
}
