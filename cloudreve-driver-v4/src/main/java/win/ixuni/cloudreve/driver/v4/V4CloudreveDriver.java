package win.ixuni.cloudreve.driver.v4;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.AbstractCloudreveDriver;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.dav.*;
import win.ixuni.cloudreve.driver.v4.handler.file.*;
import win.ixuni.cloudreve.driver.v4.handler.session.V4LoginHandler;
import win.ixuni.cloudreve.driver.v4.handler.session.V4LogoutHandler;
import win.ixuni.cloudreve.driver.v4.handler.session.V4RefreshTokenHandler;
import win.ixuni.cloudreve.driver.v4.handler.share.*;
import win.ixuni.cloudreve.driver.v4.handler.site.V4GetSiteConfigHandler;
import win.ixuni.cloudreve.driver.v4.handler.site.V4PingHandler;
import win.ixuni.cloudreve.driver.v4.handler.task.*;
import win.ixuni.cloudreve.driver.v4.handler.user.V4GetStorageQuotaHandler;
import win.ixuni.cloudreve.driver.v4.handler.user.V4GetUserInfoHandler;

/**
 * Cloudreve V4 驱动
 * <p>
 * Speaks the current protocol: JWT bearer tokens, resources addressed by
 * {@code cloudreve://my/...} URIs. Copy with rename is emulated on top of move, rename and
 * delete; everything else maps onto a single endpoint.
 */
@Slf4j
public class V4CloudreveDriver extends AbstractCloudreveDriver {

    @Getter
    private final DriverConfig config;

    private final V4DriverContext driverContext;

    public V4CloudreveDriver(DriverConfig config, HttpTransport transport) {
        this.config = config;

        SessionCredentials credentials = new SessionCredentials();
        V4ApiClient client = new V4ApiClient(config.getBaseUrl(), transport, credentials);

        this.driverContext = V4DriverContext.builder()
                .config(config)
                .credentials(credentials)
                .client(client)
                .build();

        registerHandlers();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        // Session & site handlers (5)
        getHandlerRegistry().register(new V4LoginHandler());
        getHandlerRegistry().register(new V4LogoutHandler());
        getHandlerRegistry().register(new V4RefreshTokenHandler());
        getHandlerRegistry().register(new V4PingHandler());
        getHandlerRegistry().register(new V4GetSiteConfigHandler());

        // File handlers (12)
        getHandlerRegistry().register(new V4ListFilesHandler());
        getHandlerRegistry().register(new V4ListAllFilesHandler());
        getHandlerRegistry().register(new V4CreateDirectoryHandler());
        getHandlerRegistry().register(new V4DeleteHandler());
        getHandlerRegistry().register(new V4BatchDeleteHandler());
        getHandlerRegistry().register(new V4GetFileInfoHandler());
        getHandlerRegistry().register(new V4RenameHandler());
        getHandlerRegistry().register(new V4MoveHandler());
        getHandlerRegistry().register(new V4CopyHandler());
        getHandlerRegistry().register(new V4UploadHandler());
        getHandlerRegistry().register(new V4DownloadHandler());
        getHandlerRegistry().register(new V4RestoreHandler());

        // Share handlers (4)
        getHandlerRegistry().register(new V4CreateShareHandler());
        getHandlerRegistry().register(new V4ListSharesHandler());
        getHandlerRegistry().register(new V4UpdateShareHandler());
        getHandlerRegistry().register(new V4DeleteShareHandler());

        // WebDAV handlers (4)
        getHandlerRegistry().register(new V4ListDavAccountsHandler());
        getHandlerRegistry().register(new V4CreateDavAccountHandler());
        getHandlerRegistry().register(new V4UpdateDavAccountHandler());
        getHandlerRegistry().register(new V4DeleteDavAccountHandler());

        // User handlers (2)
        getHandlerRegistry().register(new V4GetUserInfoHandler());
        getHandlerRegistry().register(new V4GetStorageQuotaHandler());

        // Workflow handlers (7)
        getHandlerRegistry().register(new V4CreateRemoteDownloadHandler());
        getHandlerRegistry().register(new V4ListTasksHandler());
        getHandlerRegistry().register(new V4CancelTaskHandler());
        getHandlerRegistry().register(new V4CreateArchiveHandler());
        getHandlerRegistry().register(new V4ExtractArchiveHandler());
        getHandlerRegistry().register(new V4RelocateHandler());
        getHandlerRegistry().register(new V4GetTaskProgressHandler());

        log.info("V4 driver {} ready with capabilities {}", config.getName(), getCapabilities());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V4;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down V4 driver: {}", config.getName());
        return super.shutdown();
    }
}
