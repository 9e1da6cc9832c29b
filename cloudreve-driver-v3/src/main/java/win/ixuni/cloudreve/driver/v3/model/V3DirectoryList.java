package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.model.FileItem;
import win.ixuni.cloudreve.core.model.FileList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Response of {@code GET /directory{path}}; the legacy protocol has no pagination
 */
@Data
@NoArgsConstructor
public class V3DirectoryList implements FileList {

    /**
     * Identifier of the listed directory
     */
    private String parent;

    private List<V3Object> objects = new ArrayList<>();

    private V3Policy policy;

    @JsonIgnore
    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @JsonIgnore
    @Override
    public String getParentName() {
        return parent;
    }

    @JsonIgnore
    @Override
    public List<FileItem> getItems() {
        return objects.stream().map(V3Object::toFileItem).collect(Collectors.toList());
    }

    @JsonIgnore
    @Override
    public String getStoragePolicyId() {
        return policy == null ? null : policy.getId();
    }

    /**
     * Entry with exactly this name
     */
    public Optional<V3Object> find(String name) {
        return objects.stream().filter(object -> name.equals(object.getName())).findFirst();
    }
}
