package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * V3 请求体定义
 */
public final class V3Requests {

    private V3Requests() {
    }

    @Value
    public static class Login {
        @JsonProperty("userName")
        String userName;
        @JsonProperty("Password")
        String password;
        @JsonProperty("captchaCode")
        String captchaCode;
    }

    @Value
    public static class CreateDirectory {
        String path;
    }

    /**
     * Objects of one mutation, split by kind
     */
    @Value
    public static class SourceItems {
        List<String> dirs;
        List<String> items;

        public static SourceItems of(V3Object object) {
            return object.isFolder()
                    ? new SourceItems(List.of(object.getId()), List.of())
                    : new SourceItems(List.of(), List.of(object.getId()));
        }
    }

    @Value
    public static class Rename {
        String action;
        SourceItems src;
        @JsonProperty("new_name")
        String newName;
    }

    @Value
    public static class Move {
        String action;
        @JsonProperty("src_dir")
        String srcDir;
        SourceItems src;
        String dst;
    }

    @Value
    public static class Copy {
        @JsonProperty("src_dir")
        String srcDir;
        SourceItems src;
        String dst;
    }

    @Value
    public static class Delete {
        List<String> items;
        List<String> dirs;
        boolean force;
        boolean unlink;
    }

    @Value
    @Builder
    public static class Upload {
        /**
         * Parent directory, not the file path
         */
        String path;
        long size;
        String name;
        @JsonProperty("policy_id")
        String policyId;
        @JsonProperty("last_modified")
        long lastModified;
        @JsonProperty("mime_type")
        String mimeType;
    }

    @Value
    @Builder
    public static class Share {
        String id;
        @JsonProperty("is_dir")
        boolean dir;
        String password;
        int downloads;
        int expire;
        boolean preview;
    }

    @Value
    public static class Aria2Create {
        String dst;
        List<String> url;
    }
}
