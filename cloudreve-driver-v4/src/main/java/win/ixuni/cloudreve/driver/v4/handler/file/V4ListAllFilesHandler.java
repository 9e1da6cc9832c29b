package win.ixuni.cloudreve.driver.v4.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.operation.file.ListAllFilesOperation;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4File;
import win.ixuni.cloudreve.driver.v4.model.V4ListResponse;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * V4 全量列目录
 * <p>
 * Follows the cursor or offset chain to the end and merges every page into one listing
 * that keeps the first page's parent and storage policy. The offset chain also stops when a
 * page starts with the same entry as the page before it (a server ignoring the page index)
 * and after {@link #MAX_PAGES} pages.
 */
@Slf4j
public class V4ListAllFilesHandler extends AbstractV4Handler<ListAllFilesOperation, FileList> {

    static final int MAX_PAGES = 10_000;

    @Override
    protected Mono<FileList> doHandle(ListAllFilesOperation operation, V4DriverContext context) {
        String uri = V4Uris.pathToUri(operation.getPath());
        int pageSize = context.getListPageSize();
        V4ApiClient client = context.getClient();

        return client.list(uri, null, pageSize, null)
                .flatMap(first -> {
                    List<V4File> files = new ArrayList<>(first.getFiles());
                    Mono<Void> rest = first.getPagination().isCursorMode()
                            ? cursorPages(client, uri, pageSize, first.getPagination().cursor(), null, files)
                            : offsetPages(client, uri, pageSize, first.getPagination().getTotalItems(),
                                    first.getFiles(), first.getPagination().getPage() + 1, 1, files);
                    return rest.then(Mono.fromCallable(() -> {
                        log.debug("Listed {} entries under {}", files.size(), uri);
                        return (FileList) first.withFiles(files);
                    }));
                });
    }

    private Mono<Void> cursorPages(V4ApiClient client, String uri, int pageSize, String token,
                                   String previous, List<V4File> files) {
        // 服务端重复返回同一 token 时停止，避免死循环
        if (token == null || Objects.equals(token, previous)) {
            return Mono.empty();
        }
        return client.list(uri, null, pageSize, token)
                .flatMap(page -> {
                    files.addAll(page.getFiles());
                    return cursorPages(client, uri, pageSize, page.getPagination().cursor(), token, files);
                });
    }

    /**
     * Offset chain; the next index follows the server's own page counter
     */
    private Mono<Void> offsetPages(V4ApiClient client, String uri, int pageSize, Long totalItems,
                                   List<V4File> last, int nextPage, int fetched, List<V4File> files) {
        if (!hasMore(totalItems, pageSize, files.size(), last.size())) {
            return Mono.empty();
        }
        if (fetched >= MAX_PAGES) {
            log.warn("Stopped listing {} after {} pages", uri, fetched);
            return Mono.empty();
        }
        return client.list(uri, nextPage, pageSize, null)
                .flatMap(page -> {
                    if (page.getFiles().isEmpty()) {
                        return Mono.<Void>empty();
                    }
                    if (sameStart(last, page.getFiles())) {
                        log.warn("Page {} of {} repeats the previous page, stopping", nextPage, uri);
                        return Mono.<Void>empty();
                    }
                    files.addAll(page.getFiles());
                    return offsetPages(client, uri, pageSize, page.getPagination().getTotalItems(),
                            page.getFiles(), nextPage + 1, fetched + 1, files);
                });
    }

    private static boolean sameStart(List<V4File> previous, List<V4File> page) {
        V4File a = previous.get(0);
        V4File b = page.get(0);
        return Objects.equals(a.getPath(), b.getPath()) && Objects.equals(a.getName(), b.getName());
    }

    /**
     * A full page with items still missing from the reported total means another page exists
     */
    private static boolean hasMore(Long totalItems, int pageSize, int accumulated, int lastCount) {
        if (lastCount < pageSize) {
            return false;
        }
        return totalItems == null || accumulated < totalItems;
    }

    @Override
    public Class<ListAllFilesOperation> getOperationType() {
        return ListAllFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
