package win.ixuni.cloudreve.driver.v3.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.exception.ResourceNotFoundException;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.model.V3DirectoryList;
import win.ixuni.cloudreve.driver.v3.model.V3Object;

import java.util.stream.Collectors;

/**
 * 路径到对象 ID 的解析器
 * <p>
 * Lists the parent directory and scans it for the leaf name. Nothing is cached: every call
 * lists again, so an identifier never outlives the operation that asked for it.
 */
@Slf4j
@RequiredArgsConstructor
public class V3ObjectResolver {

    /**
     * Names quoted in a "not found" hint
     */
    private static final int HINT_LIMIT = 10;

    private final V3ApiClient client;

    public Mono<V3Object> resolve(String path) {
        return resolve(path, false);
    }

    /**
     * Resolve and, when the name is missing, list some of the names that do exist
     */
    public Mono<V3Object> resolveWithHint(String path) {
        return resolve(path, true);
    }

    private Mono<V3Object> resolve(String path, boolean hint) {
        String normalized = CloudrevePaths.normalize(path);
        String parent = CloudrevePaths.parent(normalized);
        String name = CloudrevePaths.name(normalized);
        return client.listDirectory(parent)
                .flatMap(listing -> find(listing, normalized, name, hint));
    }

    /**
     * Look a name up in a listing already fetched for its parent
     */
    public Mono<V3Object> find(V3DirectoryList listing, String path, String name, boolean hint) {
        return listing.find(name)
                .map(object -> {
                    log.debug("Resolved {} to id {}", path, object.getId());
                    return Mono.just(object);
                })
                .orElseGet(() -> Mono.error(hint
                        ? new ResourceNotFoundException(path, "File not found: " + path + availableNames(listing))
                        : new ResourceNotFoundException(path)));
    }

    private static String availableNames(V3DirectoryList listing) {
        if (listing.getObjects().isEmpty()) {
            return " (directory is empty)";
        }
        String names = listing.getObjects().stream()
                .limit(HINT_LIMIT)
                .map(V3Object::getName)
                .collect(Collectors.joining(", "));
        return " (available: " + names + (listing.getObjects().size() > HINT_LIMIT ? ", ..." : "") + ")";
    }
}
