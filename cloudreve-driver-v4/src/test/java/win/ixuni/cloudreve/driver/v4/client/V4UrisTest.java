package win.ixuni.cloudreve.driver.v4.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.exception.InvalidUriException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class V4UrisTest {

    @Test
    @DisplayName("路径转换为 URI")
    void pathToUri() {
        assertEquals("cloudreve://my/", V4Uris.pathToUri("/"));
        assertEquals("cloudreve://my/docs/a.txt", V4Uris.pathToUri("/docs/a.txt"));
        assertEquals("cloudreve://my/docs", V4Uris.pathToUri("docs/"));
        assertEquals("cloudreve://my/my docs", V4Uris.pathToUri("/my docs"));
    }

    @Test
    @DisplayName("Values that already are URIs pass through unchanged")
    void pathToUriIsIdempotent() {
        String uri = V4Uris.pathToUri("/docs/a.txt");
        assertEquals(uri, V4Uris.pathToUri(uri));
        assertEquals("cloudreve://trash/x", V4Uris.pathToUri("cloudreve://trash/x"));
        assertEquals(List.of("cloudreve://my/a", "cloudreve://my/b"), V4Uris.pathsToUris(List.of("/a", "cloudreve://my/b")));
    }

    @Test
    void uriToPathRoundTrip() {
        assertEquals("/", V4Uris.uriToPath(V4Uris.pathToUri("/")));
        assertEquals("/docs/a.txt", V4Uris.uriToPath(V4Uris.pathToUri("/docs/a.txt")));
        assertEquals("/docs", V4Uris.uriToPath(V4Uris.pathToUri("docs/")));
    }

    @Test
    @DisplayName("URIs outside the user scope are rejected")
    void uriToPathRejectsForeignUris() {
        assertThrows(InvalidUriException.class, () -> V4Uris.uriToPath("/docs/a.txt"));
        assertThrows(InvalidUriException.class, () -> V4Uris.uriToPath("cloudreve://trash/a.txt"));
        assertThrows(InvalidUriException.class, () -> V4Uris.uriToPath(null));
    }

    @Test
    void canonicalPathComparesBothForms() {
        assertEquals(V4Uris.canonicalPath("/docs/"), V4Uris.canonicalPath("cloudreve://my/docs"));
        assertEquals("/", V4Uris.canonicalPath("cloudreve://my/"));
    }

    @Test
    @DisplayName("Canonical form of a mutation target")
    void canonicalPathOfUris() {
        assertEquals("/", V4Uris.canonicalPath("cloudreve://my"));
        assertEquals("/docs/a.txt", V4Uris.canonicalPath("cloudreve://my/docs/a.txt/"));
        assertThrows(InvalidUriException.class, () -> V4Uris.canonicalPath("cloudreve://trash/x"));
    }

    @Test
    void requireNotRootRejectsRootUri() {
        assertEquals("/docs", V4Uris.requireNotRoot("cloudreve://my/docs", "delete"));
        assertThrows(InvalidArgumentException.class, () -> V4Uris.requireNotRoot("cloudreve://my/", "delete"));
        assertThrows(InvalidArgumentException.class, () -> V4Uris.requireNotRoot("/", "delete"));
    }
}
