package win.ixuni.cloudreve.core.driver;

import java.util.Set;

/**
 * Driver capability descriptor
 * <p>
 * Lets callers ask up front whether the active protocol version can perform a family of
 * operations instead of waiting for an {@code OperationNotSupportedException}.
 */
public interface DriverCapabilities {

    /**
     * Driver capability enumeration
     */
    enum Capability {
        /**
         * Login, logout, token handling
         */
        SESSION,

        /**
         * Renewing an access token with a refresh token
         */
        TOKEN_REFRESH,

        /**
         * Listing and file information
         */
        READ,

        /**
         * Create directory, delete, rename, move
         */
        WRITE,

        /**
         * Copy
         */
        COPY,

        /**
         * Batch delete with per-item report
         */
        BATCH_DELETE,

        /**
         * Upload sessions
         */
        UPLOAD,

        /**
         * Download URLs
         */
        DOWNLOAD,

        /**
         * Trash restore
         */
        TRASH,

        /**
         * Creating share links
         */
        SHARE,

        /**
         * Listing, editing and deleting share links
         */
        SHARE_MANAGEMENT,

        /**
         * Listing WebDAV accounts
         */
        WEBDAV,

        /**
         * Creating, updating and deleting WebDAV accounts
         */
        WEBDAV_MANAGEMENT,

        /**
         * User profile and storage quota
         */
        USER,

        /**
         * Site ping and configuration
         */
        SITE,

        /**
         * Server side remote downloads
         */
        REMOTE_DOWNLOAD,

        /**
         * Archive, extract and relocate workflows
         */
        WORKFLOW
    }

    /**
     * Get the set of capabilities supported by this driver
     *
     * @return the set of supported capabilities
     */
    Set<Capability> getCapabilities();

    /**
     * Check whether a specific capability is supported
     *
     * @param capability the capability to check
     * @return true if supported
     */
    default boolean supports(Capability capability) {
        return getCapabilities().contains(capability);
    }

    /**
     * Check whether all specified capabilities are supported
     *
     * @param capabilities the capabilities to check
     * @return true if all are supported
     */
    default boolean supportsAll(Capability... capabilities) {
        Set<Capability> caps = getCapabilities();
        for (Capability cap : capabilities) {
            if (!caps.contains(cap)) {
                return false;
            }
        }
        return true;
    }
}
