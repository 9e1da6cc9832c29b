package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pagination block of V4 list responses
 * <p>
 * File listings report the cursor as {@code next_token}, the share and WebDAV listings as
 * {@code next_page_token}; {@link #cursor()} reads whichever is present.
 */
@Data
@NoArgsConstructor
public class V4Pagination {

    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total_items")
    private Long totalItems;

    @JsonProperty("next_token")
    private String nextToken;

    @JsonProperty("next_page_token")
    private String nextPageToken;

    @JsonProperty("is_cursor")
    private boolean cursorMode;

    public String cursor() {
        String token = nextToken != null ? nextToken : nextPageToken;
        return token == null || token.isEmpty() ? null : token;
    }
}
