package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * V4 请求体
 * <p>
 * Null fields are left out of the JSON.
 */
public final class V4Requests {

    private V4Requests() {
    }

    @Value
    public static class Login {
        String email;
        String password;
    }

    @Value
    public static class RefreshToken {
        @JsonProperty("refresh_token")
        String refreshToken;
    }

    @Value
    public static class CreateFile {
        String uri;
        String type;

        public static CreateFile folder(String uri) {
            return new CreateFile(uri, "folder");
        }
    }

    /**
     * Move or, with {@code copy}, copy into the directory {@code dst}
     */
    @Value
    public static class Move {
        List<String> uris;
        String dst;
        boolean copy;
    }

    @Value
    public static class Rename {
        String uri;
        @JsonProperty("new_name")
        String newName;
    }

    /**
     * Body of delete and restore
     */
    @Value
    public static class Uris {
        List<String> uris;
    }

    @Value
    @Builder
    public static class Upload {
        String uri;
        long size;
        @JsonProperty("policy_id")
        String policyId;
        @JsonProperty("last_modified")
        Long lastModified;
        @JsonProperty("mime_type")
        String mimeType;
    }

    @Value
    public static class DeleteUpload {
        String id;
        String uri;
    }

    @Value
    public static class FileUrl {
        List<String> uris;
        boolean download;
        boolean redirect;
    }

    /**
     * Read access for everyone, the only permission set the client creates
     */
    @Value
    public static class Permissions {
        @JsonProperty("user_explicit")
        Map<String, Object> userExplicit;
        @JsonProperty("group_explicit")
        Map<String, Object> groupExplicit;
        @JsonProperty("same_group")
        String sameGroup;
        String other;
        String anonymous;
        String everyone;

        public static Permissions readForAll() {
            return new Permissions(Map.of(), Map.of(), "read", "read", "read", "read");
        }
    }

    @Value
    @Builder
    public static class Share {
        Permissions permissions;
        String uri;
        @JsonProperty("is_private")
        Boolean privateLink;
        Integer expire;
        String password;
    }

    @Value
    public static class DavAccount {
        String uri;
        String name;
        Boolean readonly;
        Boolean proxy;
    }

    @Value
    public static class Download {
        String dst;
        List<String> src;
    }

    @Value
    public static class Archive {
        List<String> src;
        String dst;
    }

    @Value
    public static class Extract {
        List<String> src;
        String dst;
        String password;
    }

    @Value
    public static class Relocate {
        List<String> src;
        @JsonProperty("dst_policy_id")
        String dstPolicyId;
    }
}
