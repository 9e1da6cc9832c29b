package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.FileItem;

/**
 * Entry of a V3 directory listing
 * <p>
 * {@code id} is the only handle the V3 mutation endpoints accept.
 */
@Data
@NoArgsConstructor
public class V3Object {

    public static final String TYPE_DIR = "dir";

    /**
     * Older servers and some call sites use this spelling
     */
    public static final String TYPE_FOLDER = "folder";

    private String id;

    private String name;

    private String path;

    private boolean thumb;

    private long size;

    @JsonProperty("type")
    private String type;

    /**
     * 修改时间
     */
    private String date;

    @JsonProperty("create_date")
    private String createDate;

    @JsonProperty("source_enabled")
    private boolean sourceEnabled;

    @JsonIgnore
    public boolean isFolder() {
        return TYPE_DIR.equals(type) || TYPE_FOLDER.equals(type);
    }

    public FileItem toFileItem() {
        return FileItem.builder()
                .name(name)
                .folder(isFolder())
                .size(size)
                .build();
    }
}
