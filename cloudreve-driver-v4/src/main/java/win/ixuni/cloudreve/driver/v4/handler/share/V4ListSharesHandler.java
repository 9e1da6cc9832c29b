package win.ixuni.cloudreve.driver.v4.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.ShareItem;
import win.ixuni.cloudreve.core.operation.share.ListSharesOperation;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * V4 分享列表，沿 cursor 拉取全部分享
 */
public class V4ListSharesHandler extends AbstractV4Handler<ListSharesOperation, List<ShareItem>> {

    static final int PAGE_SIZE = 50;

    @Override
    protected Mono<List<ShareItem>> doHandle(ListSharesOperation operation, V4DriverContext context) {
        List<ShareItem> shares = new ArrayList<>();
        return fetch(context.getClient(), null, null, shares)
                .then(Mono.fromCallable(() -> shares));
    }

    private Mono<Void> fetch(V4ApiClient client, String token, String previous, List<ShareItem> shares) {
        return client.listShares(PAGE_SIZE, token)
                .flatMap(page -> {
                    shares.addAll(page.getShares());
                    String next = page.getPagination().cursor();
                    if (next == null || Objects.equals(next, token) || Objects.equals(next, previous)) {
                        return Mono.<Void>empty();
                    }
                    return fetch(client, next, token, shares);
                });
    }

    @Override
    public Class<ListSharesOperation> getOperationType() {
        return ListSharesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SHARE_MANAGEMENT);
    }
}
