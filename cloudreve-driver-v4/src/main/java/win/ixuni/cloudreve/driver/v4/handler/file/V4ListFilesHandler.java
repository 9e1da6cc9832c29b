package win.ixuni.cloudreve.driver.v4.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.file.ListFilesOperation;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4ListResponse;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * V4 列目录处理器
 * <p>
 * Pages are 1-based. The first page is always fetched without a page parameter; its
 * pagination block decides how later pages are reached. In cursor mode page N replays the
 * token chain N-1 times, in offset mode it is requested directly with {@code page=N}.
 * A page past the end of a cursor chain comes back empty.
 */
@Slf4j
public class V4ListFilesHandler extends AbstractV4Handler<ListFilesOperation, FileList> {

    @Override
    protected Mono<FileList> doHandle(ListFilesOperation operation, V4DriverContext context) {
        Integer page = operation.getPage();
        if (page != null && page < 1) {
            throw new InvalidArgumentException("Page must be 1 or greater: " + page);
        }
        String uri = V4Uris.pathToUri(operation.getPath());
        Integer pageSize = operation.getPageSize();
        V4ApiClient client = context.getClient();

        Mono<V4ListResponse> first = client.list(uri, null, pageSize, null);
        if (page == null || page == 1) {
            return first.cast(FileList.class);
        }

        return first.flatMap(probe -> {
            if (probe.getPagination().isCursorMode()) {
                log.debug("Cursor pagination for {}, replaying {} page(s)", uri, page - 1);
                return followCursor(client, uri, pageSize, probe, page - 1);
            }
            return client.list(uri, page, pageSize, null);
        }).cast(FileList.class);
    }

    private Mono<V4ListResponse> followCursor(V4ApiClient client, String uri, Integer pageSize,
                                              V4ListResponse current, int remaining) {
        if (remaining == 0) {
            return Mono.just(current);
        }
        String token = current.getPagination().cursor();
        if (token == null) {
            return Mono.just(current.withFiles(Collections.emptyList()));
        }
        return client.list(uri, null, pageSize, token)
                .flatMap(next -> followCursor(client, uri, pageSize, next, remaining - 1));
    }

    @Override
    public Class<ListFilesOperation> getOperationType() {
        return ListFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
