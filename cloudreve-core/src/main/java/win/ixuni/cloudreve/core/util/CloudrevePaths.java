package win.ixuni.cloudreve.core.util;

import win.ixuni.cloudreve.core.exception.InvalidArgumentException;

/**
 * Filesystem-style path helpers shared by both drivers
 * <p>
 * Paths are '/'-separated and absolute after {@link #normalize(String)}: leading '/',
 * no trailing '/' except for the root itself.
 */
public final class CloudrevePaths {

    public static final String ROOT = "/";

    private CloudrevePaths() {
    }

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return ROOT;
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static boolean isRoot(String path) {
        return ROOT.equals(normalize(path));
    }

    /**
     * Parent directory; the parent of the root is the root
     */
    public static String parent(String path) {
        String normalized = normalize(path);
        int pos = normalized.lastIndexOf('/');
        return pos <= 0 ? ROOT : normalized.substring(0, pos);
    }

    /**
     * Last path segment; empty for the root
     */
    public static String name(String path) {
        String normalized = normalize(path);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    public static String join(String directory, String name) {
        String dir = normalize(directory);
        return ROOT.equals(dir) ? "/" + name : dir + "/" + name;
    }

    /**
     * Whether moving {@code source} to {@code destination} stays in one directory under a new name
     */
    public static boolean isRenameInPlace(String source, String destination) {
        return parent(source).equals(parent(destination)) && !name(source).equals(name(destination));
    }

    /**
     * Directory that receives a moved or copied entry
     * <p>
     * A destination ending in the source name designates the entry itself, so its parent is the
     * target; any other destination is the target directory.
     */
    public static String targetDirectory(String source, String destination) {
        String dest = normalize(destination);
        if (!isRoot(dest) && name(dest).equals(name(source))) {
            return parent(dest);
        }
        return dest;
    }

    /**
     * Reject a mutation of the root directory before any request is made
     *
     * @param path   target path
     * @param action verb used in the message, e.g. "delete"
     * @return the normalized path
     */
    public static String requireNotRoot(String path, String action) {
        String normalized = normalize(path);
        if (ROOT.equals(normalized)) {
            throw new InvalidArgumentException("Cannot " + action + " root directory");
        }
        return normalized;
    }

    public static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException(field + " must not be empty");
        }
        return value;
    }
}
