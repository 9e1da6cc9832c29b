package win.ixuni.cloudreve.driver.v4.handler.dav;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.ResourceNotFoundException;
import win.ixuni.cloudreve.core.operation.dav.UpdateDavAccountOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4DavAccount;
import win.ixuni.cloudreve.driver.v4.model.V4Requests;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * V4 修改 WebDAV 账户
 * <p>
 * The update replaces root and name, so the current account is looked up first and its
 * values fill whatever the caller left out. Read-only and proxy flags are only sent when set.
 */
@Slf4j
public class V4UpdateDavAccountHandler extends AbstractV4Handler<UpdateDavAccountOperation, Void> {

    @Override
    protected Mono<Void> doHandle(UpdateDavAccountOperation operation, V4DriverContext context) {
        String accountId = CloudrevePaths.requireText(operation.getAccountId(), "accountId");
        V4ApiClient client = context.getClient();

        return find(client, accountId, context.getDavLookupPageSize(), null)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(accountId,
                        "WebDAV account not found: " + accountId)))
                .flatMap(current -> client.updateDavAccount(accountId, new V4Requests.DavAccount(
                        V4Uris.pathToUri(operation.getRoot() != null ? operation.getRoot() : current.getUri()),
                        operation.getName() != null ? operation.getName() : current.getName(),
                        operation.getReadOnly(),
                        operation.getProxy())));
    }

    private Mono<V4DavAccount> find(V4ApiClient client, String accountId, int pageSize, String token) {
        return client.davAccounts(pageSize, token)
                .flatMap(page -> {
                    for (V4DavAccount account : page.getAccounts()) {
                        if (accountId.equals(account.getId())) {
                            return Mono.just(account);
                        }
                    }
                    String next = page.getPagination().cursor();
                    if (next == null || Objects.equals(next, token)) {
                        return Mono.empty();
                    }
                    log.debug("WebDAV account {} not on this page, following cursor", accountId);
                    return find(client, accountId, pageSize, next);
                });
    }

    @Override
    public Class<UpdateDavAccountOperation> getOperationType() {
        return UpdateDavAccountOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WEBDAV_MANAGEMENT);
    }
}
