package win.ixuni.cloudreve.core.config;

/**
 * Property keys understood by the drivers and the default transport
 */
public final class ClientProperties {

    private ClientProperties() {
    }

    public static final String CONNECT_TIMEOUT_MS = "connect-timeout-ms";
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

    public static final String REQUEST_TIMEOUT_MS = "request-timeout-ms";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 60_000L;

    public static final String USER_AGENT = "user-agent";
    public static final String DEFAULT_USER_AGENT = "cloudreve-chimera";

    /**
     * Page size used when following the whole V4 listing chain
     */
    public static final String LIST_PAGE_SIZE = "list-page-size";
    public static final int DEFAULT_LIST_PAGE_SIZE = 100;

    /**
     * Page size used when looking up a WebDAV account before an update
     */
    public static final String DAV_LOOKUP_PAGE_SIZE = "dav-lookup-page-size";
    public static final int DEFAULT_DAV_LOOKUP_PAGE_SIZE = 100;

    /**
     * Name prefix of the temporary directory used by the emulated copy
     */
    public static final String TEMP_DIR_PREFIX = "temp-dir-prefix";
    public static final String DEFAULT_TEMP_DIR_PREFIX = ".cloudreve-copy-";
}
