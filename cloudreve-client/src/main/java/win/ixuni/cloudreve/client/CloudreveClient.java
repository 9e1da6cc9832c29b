package win.ixuni.cloudreve.client;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.CloudreveDriver;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.BatchDeleteResult;
import win.ixuni.cloudreve.core.model.DavAccount;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.model.LoginResponse;
import win.ixuni.cloudreve.core.model.ShareItem;
import win.ixuni.cloudreve.core.model.ShareUpdate;
import win.ixuni.cloudreve.core.model.SiteConfig;
import win.ixuni.cloudreve.core.model.StorageQuota;
import win.ixuni.cloudreve.core.model.TaskProgress;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.model.TokenInfo;
import win.ixuni.cloudreve.core.model.TokenPair;
import win.ixuni.cloudreve.core.model.UserInfo;
import win.ixuni.cloudreve.core.operation.dav.CreateDavAccountOperation;
import win.ixuni.cloudreve.core.operation.dav.DeleteDavAccountOperation;
import win.ixuni.cloudreve.core.operation.dav.ListDavAccountsOperation;
import win.ixuni.cloudreve.core.operation.dav.UpdateDavAccountOperation;
import win.ixuni.cloudreve.core.operation.file.BatchDeleteOperation;
import win.ixuni.cloudreve.core.operation.file.CopyOperation;
import win.ixuni.cloudreve.core.operation.file.CreateDirectoryOperation;
import win.ixuni.cloudreve.core.operation.file.DeleteOperation;
import win.ixuni.cloudreve.core.operation.file.DownloadOperation;
import win.ixuni.cloudreve.core.operation.file.GetFileInfoOperation;
import win.ixuni.cloudreve.core.operation.file.ListAllFilesOperation;
import win.ixuni.cloudreve.core.operation.file.ListFilesOperation;
import win.ixuni.cloudreve.core.operation.file.MoveOperation;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.operation.file.RestoreOperation;
import win.ixuni.cloudreve.core.operation.file.UploadOperation;
import win.ixuni.cloudreve.core.operation.session.LoginOperation;
import win.ixuni.cloudreve.core.operation.session.LogoutOperation;
import win.ixuni.cloudreve.core.operation.session.RefreshTokenOperation;
import win.ixuni.cloudreve.core.operation.share.CreateShareOperation;
import win.ixuni.cloudreve.core.operation.share.DeleteShareOperation;
import win.ixuni.cloudreve.core.operation.share.ListSharesOperation;
import win.ixuni.cloudreve.core.operation.share.UpdateShareOperation;
import win.ixuni.cloudreve.core.operation.site.GetSiteConfigOperation;
import win.ixuni.cloudreve.core.operation.site.PingOperation;
import win.ixuni.cloudreve.core.operation.task.CancelTaskOperation;
import win.ixuni.cloudreve.core.operation.task.CreateArchiveOperation;
import win.ixuni.cloudreve.core.operation.task.CreateRemoteDownloadOperation;
import win.ixuni.cloudreve.core.operation.task.ExtractArchiveOperation;
import win.ixuni.cloudreve.core.operation.task.GetTaskProgressOperation;
import win.ixuni.cloudreve.core.operation.task.ListTasksOperation;
import win.ixuni.cloudreve.core.operation.task.RelocateOperation;
import win.ixuni.cloudreve.core.operation.user.GetStorageQuotaOperation;
import win.ixuni.cloudreve.core.operation.user.GetUserInfoOperation;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.core.transport.JdkHttpTransport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cloudreve 统一客户端
 * <p>
 * Path-addressed, version-agnostic facade over exactly one live driver (V3 or V4). Every
 * method turns its arguments into an operation and hands it to the driver; the driver's
 * handlers do the protocol translation. Operations the active version cannot perform fail
 * with {@link win.ixuni.cloudreve.core.exception.OperationNotSupportedException}.
 * <p>
 * Obtain an instance through {@link #builder()}:
 * <pre>{@code
 * CloudreveClient client = CloudreveClient.builder()
 *         .baseUrl("https://cloud.example.com")
 *         .connect()
 *         .block();
 * }</pre>
 */
public class CloudreveClient {

    private final CloudreveDriver driver;

    private final String baseUrl;

    CloudreveClient(CloudreveDriver driver, String baseUrl) {
        this.driver = driver;
        this.baseUrl = baseUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wrap an already created driver
     */
    public static CloudreveClient of(CloudreveDriver driver) {
        return new CloudreveClient(driver, driver.getDriverContext().getConfig().getBaseUrl());
    }

    // ==================== Metadata ====================

    public ApiVersion getApiVersion() {
        return driver.getApiVersion();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean supports(Capability capability) {
        return driver.supports(capability);
    }

    public CloudreveDriver getDriver() {
        return driver;
    }

    // ==================== Session ====================

    public Mono<LoginResponse> login(String email, String password) {
        return driver.execute(new LoginOperation(email, password));
    }

    public Mono<Void> logout() {
        return driver.execute(new LogoutOperation());
    }

    /**
     * Current credential, tagged with the protocol it belongs to
     */
    public Optional<TokenInfo> getToken() {
        Optional<String> token = credentials().getAccessToken();
        if (getApiVersion() == ApiVersion.V3) {
            return token.map(TokenInfo::v3Session);
        }
        return token.map(TokenInfo::v4Jwt);
    }

    /**
     * Install a credential obtained earlier, e.g. from a token cache
     *
     * @throws InvalidArgumentException if the token belongs to the other protocol version
     */
    public void setToken(TokenInfo token) {
        if (token == null || token.getValue() == null) {
            throw new InvalidArgumentException("Token must not be null");
        }
        if (token.getApiVersion() != getApiVersion()) {
            throw new InvalidArgumentException("Cannot use a " + token.getApiVersion()
                    + " token with a " + getApiVersion() + " server");
        }
        credentials().setAccessToken(token.getValue());
    }

    /**
     * V3 session cookie value; always empty on V4
     */
    public Optional<String> getSessionCookie() {
        if (getApiVersion() != ApiVersion.V3) {
            return Optional.empty();
        }
        return credentials().getAccessToken();
    }

    public Mono<TokenPair> refreshToken(String refreshToken) {
        return driver.execute(new RefreshTokenOperation(refreshToken));
    }

    // ==================== Site ====================

    public Mono<String> ping() {
        return driver.execute(new PingOperation());
    }

    public Mono<String> getServerVersion() {
        return ping();
    }

    public Mono<SiteConfig> getSiteConfig(String section) {
        return driver.execute(new GetSiteConfigOperation(section));
    }

    public Mono<SiteConfig> getSiteConfig() {
        return getSiteConfig(null);
    }

    // ==================== Files ====================

    /**
     * 列出目录的一页
     *
     * @param path     directory path
     * @param page     1-based page, null for the first one
     * @param pageSize page size, null for the server default
     */
    public Mono<FileList> listFiles(String path, Integer page, Integer pageSize) {
        return driver.execute(new ListFilesOperation(path, page, pageSize));
    }

    public Mono<FileList> listFiles(String path) {
        return listFiles(path, null, null);
    }

    /**
     * 列出目录的全部条目
     * <p>
     * Follows the whole pagination chain; parent and policy metadata come from the first page.
     */
    public Mono<FileList> listFilesAll(String path) {
        return driver.execute(new ListAllFilesOperation(path));
    }

    public Mono<Void> createDirectory(String path) {
        return driver.execute(new CreateDirectoryOperation(path));
    }

    public Mono<Void> delete(String path) {
        return driver.execute(new DeleteOperation(path));
    }

    /**
     * Delete several paths, collecting per-path failures instead of aborting
     */
    public Mono<BatchDeleteResult> batchDelete(List<String> paths) {
        return driver.execute(new BatchDeleteOperation(paths));
    }

    public Mono<FileInfo> getFileInfo(String path) {
        return driver.execute(new GetFileInfoOperation(path));
    }

    public Mono<Void> rename(String path, String newName) {
        return driver.execute(new RenameOperation(path, newName));
    }

    /**
     * Move a file; a same-directory move with a new name is a rename
     */
    public Mono<Void> move(String source, String destination) {
        return driver.execute(new MoveOperation(source, destination));
    }

    /**
     * 复制文件
     * <p>
     * On V4 a same-directory copy under a new name runs as a sequence of calls through a
     * temporary directory. The sequence has no rollback: if a middle step fails the temporary
     * directory is left behind on the server.
     */
    public Mono<Void> copy(String source, String destination) {
        return driver.execute(new CopyOperation(source, destination));
    }

    public Mono<Void> upload(String path, byte[] content, String policyId) {
        return driver.execute(new UploadOperation(path, content, policyId));
    }

    public Mono<Void> upload(String path, byte[] content) {
        return upload(path, content, null);
    }

    /**
     * @return a download URL for the file
     */
    public Mono<String> download(String path) {
        return driver.execute(new DownloadOperation(path));
    }

    public Mono<Void> restore(List<String> paths) {
        return driver.execute(new RestoreOperation(paths));
    }

    // ==================== Shares ====================

    /**
     * @param expiresIn seconds until expiry, null for never
     * @param password  share password, null for a public link
     */
    public Mono<String> createShare(String path, Integer expiresIn, String password) {
        return driver.execute(new CreateShareOperation(path, expiresIn, password));
    }

    public Mono<List<ShareItem>> listShares() {
        return driver.execute(new ListSharesOperation());
    }

    public Mono<Void> updateShare(String shareId, ShareUpdate update) {
        return driver.execute(new UpdateShareOperation(shareId, update));
    }

    public Mono<Void> deleteShare(String shareId) {
        return driver.execute(new DeleteShareOperation(shareId));
    }

    // ==================== WebDAV ====================

    public Mono<List<DavAccount>> listDavAccounts() {
        return driver.execute(new ListDavAccountsOperation(null));
    }

    public Mono<Void> createDavAccount(String root, String name, boolean readOnly, boolean proxy) {
        return driver.execute(new CreateDavAccountOperation(root, name, readOnly, proxy));
    }

    /**
     * Null arguments keep the account's current value
     */
    public Mono<Void> updateDavAccount(String accountId, String root, String name, Boolean readOnly, Boolean proxy) {
        return driver.execute(new UpdateDavAccountOperation(accountId, root, name, readOnly, proxy));
    }

    public Mono<Void> deleteDavAccount(String accountId) {
        return driver.execute(new DeleteDavAccountOperation(accountId));
    }

    // ==================== User ====================

    public Mono<UserInfo> getUserInfo() {
        return driver.execute(new GetUserInfoOperation());
    }

    public Mono<StorageQuota> getStorageQuota() {
        return driver.execute(new GetStorageQuotaOperation());
    }

    // ==================== Tasks & workflows ====================

    public Mono<List<TaskRecord>> createRemoteDownload(String destination, List<String> urls) {
        return driver.execute(new CreateRemoteDownloadOperation(destination, urls));
    }

    public Mono<List<TaskRecord>> listTasks(String category, Integer pageSize) {
        return driver.execute(new ListTasksOperation(category, pageSize));
    }

    public Mono<TaskProgress> getTaskProgress(String taskId) {
        return driver.execute(new GetTaskProgressOperation(taskId));
    }

    public Mono<Void> cancelTask(String taskId) {
        return driver.execute(new CancelTaskOperation(taskId));
    }

    public Mono<TaskRecord> createArchive(List<String> sources, String destination) {
        return driver.execute(new CreateArchiveOperation(sources, destination));
    }

    public Mono<TaskRecord> extractArchive(String source, String destination, String password) {
        return driver.execute(new ExtractArchiveOperation(source, destination, password));
    }

    public Mono<TaskRecord> relocate(List<String> sources, String policyId) {
        return driver.execute(new RelocateOperation(sources, policyId));
    }

    // ==================== Lifecycle ====================

    public Mono<Void> close() {
        return driver.shutdown();
    }

    private SessionCredentials credentials() {
        return driver.getDriverContext().getCredentials();
    }

    /**
     * 客户端构建器
     */
    public static class Builder {

        private static final String DEFAULT_NAME = "cloudreve";

        private String name = DEFAULT_NAME;
        private String baseUrl;
        private ApiVersion apiVersion;
        private HttpTransport transport;
        private final Map<String, Object> properties = new HashMap<>();

        Builder() {
        }

        /**
         * Server root URL, e.g. {@code https://cloud.example.com}; trailing slashes are trimmed
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Skip detection and speak this version
         */
        public Builder apiVersion(ApiVersion apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Instance name used in log lines
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @see win.ixuni.cloudreve.core.config.ClientProperties
         */
        public Builder property(String key, Object value) {
            this.properties.put(key, value);
            return this;
        }

        public Builder properties(Map<String, ?> properties) {
            this.properties.putAll(properties);
            return this;
        }

        /**
         * Create the client, probing the server unless a version was given
         *
         * @return client bound to the detected driver
         */
        public Mono<CloudreveClient> connect() {
            return Mono.defer(() -> {
                DriverConfig config = toConfig();
                HttpTransport effective = transport != null ? transport : new JdkHttpTransport(config);
                VersionDetector detector = new VersionDetector(config, effective);
                Mono<CloudreveDriver> driver = apiVersion != null
                        ? Mono.fromCallable(() -> detector.create(apiVersion))
                        : detector.detect();
                return driver.map(d -> new CloudreveClient(d, config.getBaseUrl()));
            });
        }

        DriverConfig toConfig() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new InvalidArgumentException("Base URL is required");
            }
            DriverConfig config = new DriverConfig();
            config.setName(name);
            config.setBaseUrl(baseUrl.trim());
            config.setProperties(new HashMap<>(properties));
            return config;
        }
    }
}
