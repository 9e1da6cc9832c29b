package win.ixuni.cloudreve.driver.v4.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.codec.EnvelopeCodec;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.transport.AbstractEndpointClient;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.core.transport.TransportRequest;
import win.ixuni.cloudreve.driver.v4.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cloudreve V4 endpoint client
 * <p>
 * Bearer-token authentication; every file endpoint takes resource URIs
 * (see {@link V4Uris}), so callers pass URIs, never plain paths.
 */
@Slf4j
public class V4ApiClient extends AbstractEndpointClient {

    public V4ApiClient(String baseUrl, HttpTransport transport, SessionCredentials credentials) {
        super(baseUrl, ApiVersion.V4, transport, credentials);
    }

    @Override
    protected void applyAuth(TransportRequest.TransportRequestBuilder builder) {
        credentials.getAccessToken()
                .ifPresent(token -> builder.header("Authorization", "Bearer " + token));
    }

    // ============ Session ============

    /**
     * POST /session/token; stores the token pair and the user
     */
    public Mono<V4LoginResponse> login(String email, String password) {
        return Mono.defer(() -> {
            credentials.clear();
            return payload("POST", "/session/token", new V4Requests.Login(email, password), V4LoginResponse.class);
        }).doOnNext(login -> {
            V4Token token = login.getToken();
            if (token == null || token.getAccessToken() == null || login.getUser() == null) {
                throw new DecodeException("Login response carried no access token or user");
            }
            credentials.update(token.getAccessToken(), token.getRefreshToken(), login.getUser().toUserInfo());
            log.debug("V4 token issued for {}, access expires {}", login.getUser().getEmail(), token.getAccessExpires());
        });
    }

    /**
     * POST /session/token/refresh; replaces both tokens, keeps the user
     */
    public Mono<V4Token> refreshToken(String refreshToken) {
        return payload("POST", "/session/token/refresh", new V4Requests.RefreshToken(refreshToken), V4Token.class)
                .doOnNext(token -> {
                    credentials.setAccessToken(token.getAccessToken());
                    credentials.setRefreshToken(token.getRefreshToken());
                });
    }

    public Mono<Void> logout() {
        return Mono.defer(() -> ack("DELETE", "/session/token",
                credentials.getRefreshToken().map(V4Requests.RefreshToken::new).orElse(null)));
    }

    // ============ Files ============

    /**
     * GET /file; {@code nextPageToken} selects a cursor page, {@code page} an offset page
     */
    public Mono<V4ListResponse> list(String uri, Integer page, Integer pageSize, String nextPageToken) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("uri", uri);
        params.put("page", page);
        params.put("page_size", pageSize);
        params.put("next_page_token", nextPageToken);
        return get("/file" + query(params), V4ListResponse.class);
    }

    public Mono<V4File> fileInfo(String uri) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("uri", uri);
        params.put("extended", false);
        return get("/file/info" + query(params), V4File.class);
    }

    public Mono<Void> createFolder(String uri) {
        return ack("POST", "/file/create", V4Requests.CreateFile.folder(uri));
    }

    /**
     * POST /file/move into the directory {@code dstUri}; {@code copy} keeps the sources
     */
    public Mono<Void> move(List<String> uris, String dstUri, boolean copy) {
        return ack("POST", "/file/move", new V4Requests.Move(uris, dstUri, copy));
    }

    public Mono<Void> rename(String uri, String newName) {
        return ack("POST", "/file/rename", new V4Requests.Rename(uri, newName));
    }

    public Mono<Void> delete(List<String> uris) {
        return ack("DELETE", "/file", new V4Requests.Uris(uris));
    }

    public Mono<Void> restore(List<String> uris) {
        return ack("POST", "/file/restore", new V4Requests.Uris(uris));
    }

    // ============ Upload & download ============

    public Mono<V4UploadSession> createUploadSession(V4Requests.Upload request) {
        return payload("PUT", "/file/upload", request, V4UploadSession.class);
    }

    public Mono<Void> uploadChunk(String sessionId, int index, byte[] chunk) {
        return exchangeBytes("POST", "/file/upload/" + encode(sessionId) + "/" + index, chunk)
                .doOnNext(EnvelopeCodec::decodeAck)
                .then();
    }

    public Mono<Void> deleteUploadSession(String sessionId, String uri) {
        return ack("DELETE", "/file/upload", new V4Requests.DeleteUpload(sessionId, uri));
    }

    /**
     * POST /file/url, emitting the first download URL
     */
    public Mono<String> downloadUrl(String uri) {
        return payload("POST", "/file/url", new V4Requests.FileUrl(List.of(uri), true, true), V4FileUrls.class)
                .map(urls -> urls.getUrls().stream()
                        .map(V4FileUrls.Entry::getUrl)
                        .filter(url -> url != null && !url.isEmpty())
                        .findFirst()
                        .orElseThrow(() -> new DecodeException("No download URL returned for " + uri)));
    }

    // ============ Share ============

    /**
     * PUT /share, emitting the share URL
     */
    public Mono<String> createShare(V4Requests.Share request) {
        return payload("PUT", "/share", request, String.class);
    }

    public Mono<V4ShareList> listShares(int pageSize, String nextPageToken) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page_size", pageSize);
        params.put("next_page_token", nextPageToken);
        return get("/share" + query(params), V4ShareList.class);
    }

    public Mono<Void> editShare(String id, V4Requests.Share request) {
        return ack("POST", "/share/" + encode(id), request);
    }

    public Mono<Void> deleteShare(String id) {
        return ack("DELETE", "/share/" + encode(id), null);
    }

    // ============ WebDAV ============

    public Mono<V4DavAccountList> davAccounts(int pageSize, String nextPageToken) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page_size", pageSize);
        params.put("next_page_token", nextPageToken);
        return get("/devices/dav" + query(params), V4DavAccountList.class);
    }

    public Mono<Void> createDavAccount(V4Requests.DavAccount request) {
        return ack("PUT", "/devices/dav", request);
    }

    public Mono<Void> updateDavAccount(String id, V4Requests.DavAccount request) {
        return ack("PATCH", "/devices/dav/" + encode(id), request);
    }

    public Mono<Void> deleteDavAccount(String id) {
        return ack("DELETE", "/devices/dav/" + encode(id), null);
    }

    // ============ User & site ============

    public Mono<V4Quota> capacity() {
        return get("/user/capacity", V4Quota.class);
    }

    public Mono<V4User> userInfo(String userId) {
        return get("/user/info/" + encode(userId), V4User.class);
    }

    public Mono<JsonNode> siteConfig(String section) {
        return get("/site/config/" + encode(section), JsonNode.class);
    }

    // ============ Workflow ============

    public Mono<List<V4Task>> createRemoteDownload(String dstUri, List<String> urls) {
        return payload("POST", "/workflow/download", new V4Requests.Download(dstUri, urls),
                new TypeReference<List<V4Task>>() {
                });
    }

    public Mono<V4Task> createArchive(List<String> srcUris, String dstUri) {
        return payload("POST", "/workflow/archive", new V4Requests.Archive(srcUris, dstUri), V4Task.class);
    }

    public Mono<V4Task> extractArchive(String srcUri, String dstUri, String password) {
        return payload("POST", "/workflow/extract",
                new V4Requests.Extract(List.of(srcUri), dstUri, password), V4Task.class);
    }

    public Mono<V4Task> relocate(List<String> srcUris, String policyId) {
        return payload("POST", "/workflow/relocate", new V4Requests.Relocate(srcUris, policyId), V4Task.class);
    }

    public Mono<V4TaskList> tasks(int pageSize, String category) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page_size", pageSize);
        params.put("category", category);
        return get("/workflow" + query(params), V4TaskList.class);
    }

    public Mono<V4Progress> progress(String taskId) {
        return get("/workflow/progress/" + encode(taskId), V4Progress.class);
    }

    public Mono<Void> cancelDownload(String taskId) {
        return ack("DELETE", "/workflow/download/" + encode(taskId), null);
    }
}
