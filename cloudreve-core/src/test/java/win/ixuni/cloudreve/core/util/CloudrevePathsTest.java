package win.ixuni.cloudreve.core.util;

import org.junit.jupiter.api.Test;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;

import static org.junit.jupiter.api.Assertions.*;

class CloudrevePathsTest {

    @Test
    void normalize() {
        assertEquals("/", CloudrevePaths.normalize(null));
        assertEquals("/", CloudrevePaths.normalize(""));
        assertEquals("/", CloudrevePaths.normalize("/"));
        assertEquals("/docs", CloudrevePaths.normalize("docs/"));
        assertEquals("/docs/a.txt", CloudrevePaths.normalize("/docs/a.txt"));
    }

    @Test
    void parentAndName() {
        assertEquals("/docs", CloudrevePaths.parent("/docs/a.txt"));
        assertEquals("/", CloudrevePaths.parent("/a.txt"));
        assertEquals("/", CloudrevePaths.parent("/"));
        assertEquals("a.txt", CloudrevePaths.name("/docs/a.txt"));
        assertEquals("", CloudrevePaths.name("/"));
        assertEquals("/a.txt", CloudrevePaths.join("/", "a.txt"));
        assertEquals("/docs/a.txt", CloudrevePaths.join("/docs/", "a.txt"));
    }

    @Test
    void renameInPlace() {
        assertTrue(CloudrevePaths.isRenameInPlace("/docs/a.txt", "/docs/b.txt"));
        assertFalse(CloudrevePaths.isRenameInPlace("/docs/a.txt", "/archive/a.txt"));
        assertFalse(CloudrevePaths.isRenameInPlace("/docs/a.txt", "/docs/a.txt"));
    }

    @Test
    void targetDirectory() {
        assertEquals("/archive", CloudrevePaths.targetDirectory("/docs/a.txt", "/archive/a.txt"));
        assertEquals("/archive", CloudrevePaths.targetDirectory("/docs/a.txt", "/archive"));
        assertEquals("/", CloudrevePaths.targetDirectory("/docs/a.txt", "/"));
        assertEquals("/", CloudrevePaths.targetDirectory("/docs/a.txt", "/a.txt"));
    }

    @Test
    void rootIsNotMutable() {
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
                () -> CloudrevePaths.requireNotRoot("/", "delete"));
        assertEquals("Cannot delete root directory", e.getMessage());
        assertEquals("/docs", CloudrevePaths.requireNotRoot("docs/", "delete"));
    }

    @Test
    void requireText() {
        assertThrows(InvalidArgumentException.class, () -> CloudrevePaths.requireText("  ", "name"));
        assertThrows(InvalidArgumentException.class, () -> CloudrevePaths.requireText(null, "name"));
        assertEquals("b.txt", CloudrevePaths.requireText("b.txt", "name"));
    }
}
