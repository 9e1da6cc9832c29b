package win.ixuni.cloudreve.driver.v4.client;

import win.ixuni.cloudreve.core.exception.InvalidUriException;
import win.ixuni.cloudreve.core.util.CloudrevePaths;

import java.util.List;
import java.util.stream.Collectors;

/**
 * V4 资源 URI 工具
 * <p>
 * Every V4 endpoint addresses files by {@code cloudreve://my/<path>}.
 * {@link #pathToUri(String)} is idempotent and {@link #uriToPath(String)} is its inverse.
 */
public final class V4Uris {

    public static final String SCHEME = "cloudreve://";

    /**
     * Scope prefix of the current user's files
     */
    public static final String PREFIX = SCHEME + "my/";

    private V4Uris() {
    }

    /**
     * Path to URI; a value that already carries the scheme is returned unchanged
     * <p>
     * The path is normalized first, so {@code "docs/"} and {@code "/docs"} give the same URI.
     */
    public static String pathToUri(String path) {
        if (path != null && path.startsWith(SCHEME)) {
            return path;
        }
        return PREFIX + CloudrevePaths.normalize(path).substring(1);
    }

    public static List<String> pathsToUris(List<String> paths) {
        return paths.stream().map(V4Uris::pathToUri).collect(Collectors.toList());
    }

    /**
     * URI to path with a single leading separator; {@code cloudreve://my/} becomes {@code /}
     *
     * @throws InvalidUriException if the value does not start with {@link #PREFIX}
     */
    public static String uriToPath(String uri) {
        if (uri == null || !uri.startsWith(PREFIX)) {
            throw new InvalidUriException(uri, PREFIX);
        }
        return uri.substring(PREFIX.length() - 1);
    }

    /**
     * Canonical path of either form, used to compare locations and to derive parents and names
     *
     * @throws InvalidUriException for a URI outside the user's own scope
     */
    public static String canonicalPath(String pathOrUri) {
        if (pathOrUri != null && pathOrUri.startsWith(SCHEME)) {
            String uri = pathOrUri.equals(PREFIX.substring(0, PREFIX.length() - 1)) ? PREFIX : pathOrUri;
            return CloudrevePaths.normalize(uriToPath(uri));
        }
        return CloudrevePaths.normalize(pathOrUri);
    }

    /**
     * Canonical path of a mutation target, rejecting the root in either form
     *
     * @param action verb used in the message, e.g. "delete"
     */
    public static String requireNotRoot(String pathOrUri, String action) {
        return CloudrevePaths.requireNotRoot(canonicalPath(pathOrUri), action);
    }
}
