package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.FileItem;
import win.ixuni.cloudreve.core.model.FileList;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response of {@code GET /file}
 */
@Data
@NoArgsConstructor
public class V4ListResponse implements FileList {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<V4File> files = new ArrayList<>();

    private V4File parent;

    private V4Pagination pagination = new V4Pagination();

    @JsonProperty("storage_policy")
    private V4StoragePolicy storagePolicy;

    @JsonProperty("context_hint")
    private String contextHint;

    @JsonProperty("mixed_type")
    private boolean mixedType;

    public void setPagination(V4Pagination pagination) {
        this.pagination = pagination == null ? new V4Pagination() : pagination;
    }

    /**
     * Same parent and policy with other entries, used for merged and out-of-range pages
     */
    public V4ListResponse withFiles(List<V4File> entries) {
        V4ListResponse copy = new V4ListResponse();
        copy.setFiles(new ArrayList<>(entries));
        copy.setParent(parent);
        copy.setPagination(pagination);
        copy.setStoragePolicy(storagePolicy);
        copy.setContextHint(contextHint);
        copy.setMixedType(mixedType);
        return copy;
    }

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @JsonIgnore
    @Override
    public String getParentName() {
        return parent == null ? null : parent.getName();
    }

    @JsonIgnore
    @Override
    public List<FileItem> getItems() {
        return files.stream().map(V4File::toFileItem).collect(Collectors.toList());
    }

    @JsonIgnore
    @Override
    public String getStoragePolicyId() {
        return storagePolicy == null ? null : storagePolicy.getId();
    }
}
