package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.FileItem;

/**
 * V4 文件对象
 * <p>
 * {@code type} is 0 for a file and 1 for a folder; {@code path} is the resource URI.
 */
@Data
@NoArgsConstructor
public class V4File {

    public static final int TYPE_FILE = 0;
    public static final int TYPE_FOLDER = 1;

    private int type;

    private String id;

    private String name;

    private String permission;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    private long size;

    private JsonNode metadata;

    /**
     * Resource URI of the entry
     */
    private String path;

    private String capability;

    private boolean owned;

    @JsonProperty("primary_entity")
    private String primaryEntity;

    @JsonIgnore
    public boolean isFolder() {
        return type == TYPE_FOLDER;
    }

    public FileItem toFileItem() {
        return FileItem.builder()
                .name(name)
                .folder(isFolder())
                .size(size)
                .build();
    }
}
