package win.ixuni.cloudreve.driver.v4.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code POST /file/url}
 */
@Data
@NoArgsConstructor
public class V4FileUrls {

    private List<Entry> urls = new ArrayList<>();

    private String expires;

    @Data
    @NoArgsConstructor
    public static class Entry {

        private String url;
    }
}
