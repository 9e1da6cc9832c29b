package win.ixuni.cloudreve.driver.v3;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.core.driver.AbstractCloudreveDriver;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.operation.DriverContext;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.driver.v3.client.V3ApiClient;
import win.ixuni.cloudreve.driver.v3.client.V3ObjectResolver;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.dav.V3ListDavAccountsHandler;
import win.ixuni.cloudreve.driver.v3.handler.file.*;
import win.ixuni.cloudreve.driver.v3.handler.session.V3LoginHandler;
import win.ixuni.cloudreve.driver.v3.handler.session.V3LogoutHandler;
import win.ixuni.cloudreve.driver.v3.handler.share.V3CreateShareHandler;
import win.ixuni.cloudreve.driver.v3.handler.share.V3DeleteShareHandler;
import win.ixuni.cloudreve.driver.v3.handler.share.V3ListSharesHandler;
import win.ixuni.cloudreve.driver.v3.handler.site.V3GetSiteConfigHandler;
import win.ixuni.cloudreve.driver.v3.handler.site.V3PingHandler;
import win.ixuni.cloudreve.driver.v3.handler.task.V3CancelTaskHandler;
import win.ixuni.cloudreve.driver.v3.handler.task.V3CreateRemoteDownloadHandler;
import win.ixuni.cloudreve.driver.v3.handler.task.V3ListTasksHandler;
import win.ixuni.cloudreve.driver.v3.handler.user.V3GetStorageQuotaHandler;
import win.ixuni.cloudreve.driver.v3.handler.user.V3GetUserInfoHandler;

/**
 * Cloudreve V3 驱动
 * <p>
 * Speaks the legacy protocol: cookie session, mutations addressed by object ID.
 * Operations without a V3 equivalent (token refresh, restore, share editing, WebDAV account
 * mutation, archive workflows) have no handler and fail as unsupported.
 */
@Slf4j
public class V3CloudreveDriver extends AbstractCloudreveDriver {

    @Getter
    private final DriverConfig config;

    private final V3DriverContext driverContext;

    public V3CloudreveDriver(DriverConfig config, HttpTransport transport) {
        this.config = config;

        SessionCredentials credentials = new SessionCredentials();
        V3ApiClient client = new V3ApiClient(config.getBaseUrl(), transport, credentials);

        this.driverContext = V3DriverContext.builder()
                .config(config)
                .credentials(credentials)
                .client(client)
                .resolver(new V3ObjectResolver(client))
                .build();

        registerHandlers();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        // Session & site handlers (4)
        getHandlerRegistry().register(new V3LoginHandler());
        getHandlerRegistry().register(new V3LogoutHandler());
        getHandlerRegistry().register(new V3PingHandler());
        getHandlerRegistry().register(new V3GetSiteConfigHandler());

        // File handlers (11)
        getHandlerRegistry().register(new V3ListFilesHandler());
        getHandlerRegistry().register(new V3ListAllFilesHandler());
        getHandlerRegistry().register(new V3CreateDirectoryHandler());
        getHandlerRegistry().register(new V3DeleteHandler());
        getHandlerRegistry().register(new V3BatchDeleteHandler());
        getHandlerRegistry().register(new V3GetFileInfoHandler());
        getHandlerRegistry().register(new V3RenameHandler());
        getHandlerRegistry().register(new V3MoveHandler());
        getHandlerRegistry().register(new V3CopyHandler());
        getHandlerRegistry().register(new V3UploadHandler());
        getHandlerRegistry().register(new V3DownloadHandler());

        // Share & WebDAV handlers (4)
        getHandlerRegistry().register(new V3CreateShareHandler());
        getHandlerRegistry().register(new V3ListSharesHandler());
        getHandlerRegistry().register(new V3DeleteShareHandler());
        getHandlerRegistry().register(new V3ListDavAccountsHandler());

        // User & aria2 handlers (5)
        getHandlerRegistry().register(new V3GetUserInfoHandler());
        getHandlerRegistry().register(new V3GetStorageQuotaHandler());
        getHandlerRegistry().register(new V3CreateRemoteDownloadHandler());
        getHandlerRegistry().register(new V3ListTasksHandler());
        getHandlerRegistry().register(new V3CancelTaskHandler());

        log.info("V3 driver {} ready with capabilities {}", config.getName(), getCapabilities());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public ApiVersion getApiVersion() {
        return ApiVersion.V3;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down V3 driver: {}", config.getName());
        return super.shutdown();
    }
}
