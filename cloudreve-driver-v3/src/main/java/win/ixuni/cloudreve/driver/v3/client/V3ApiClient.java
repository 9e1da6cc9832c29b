package win.ixuni.cloudreve.driver.v3.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.codec.ApiEnvelope;
import win.ixuni.cloudreve.core.codec.EnvelopeCodec;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.core.transport.AbstractEndpointClient;
import win.ixuni.cloudreve.core.transport.HttpTransport;
import win.ixuni.cloudreve.core.transport.TransportRequest;
import win.ixuni.cloudreve.core.transport.TransportResponse;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.model.V3Aria2Task;
import win.ixuni.cloudreve.driver.v3.model.V3DirectoryList;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;
import win.ixuni.cloudreve.driver.v3.model.V3Share;
import win.ixuni.cloudreve.driver.v3.model.V3ShareList;
import win.ixuni.cloudreve.driver.v3.model.V3StorageInfo;
import win.ixuni.cloudreve.driver.v3.model.V3UploadSession;
import win.ixuni.cloudreve.driver.v3.model.V3User;
import win.ixuni.cloudreve.driver.v3.model.V3WebdavAccount;
import win.ixuni.cloudreve.driver.v3.model.V3WebdavAccountList;

import java.util.List;
import java.util.Optional;

/**
 * V3 (legacy) endpoint client
 * <p>
 * One thin method per endpoint. Authentication is the {@code cloudreve-session} cookie
 * captured from the login response and replayed on every request.
 */
@Slf4j
public class V3ApiClient extends AbstractEndpointClient {

    public static final String SESSION_COOKIE = "cloudreve-session";

    public V3ApiClient(String baseUrl, HttpTransport transport, SessionCredentials credentials) {
        super(baseUrl, ApiVersion.V3, transport, credentials);
    }

    @Override
    protected void applyAuth(TransportRequest.TransportRequestBuilder builder) {
        credentials.getAccessToken()
                .ifPresent(session -> builder.header("Cookie", SESSION_COOKIE + "=" + session));
    }

    // ============ Session ============

    /**
     * POST /user/session; keeps the session cookie of the response
     */
    public Mono<V3User> login(String email, String password) {
        return Mono.defer(() -> {
            credentials.clear();
            return exchange("POST", "/user/session", new V3Requests.Login(email, password, ""));
        }).map(response -> {
            V3User user = EnvelopeCodec.decodePayload(response, V3User.class);
            String session = extractSessionCookie(response)
                    .orElseThrow(() -> new DecodeException("Login response carried no " + SESSION_COOKIE + " cookie"));
            credentials.update(session, null, user.toUserInfo());
            log.debug("V3 session established for {}", user.getUserName());
            return user;
        });
    }

    public Mono<Void> logout() {
        return ack("DELETE", "/user/session", null);
    }

    static Optional<String> extractSessionCookie(TransportResponse response) {
        for (String header : response.headerValues("Set-Cookie")) {
            for (String part : header.split(";")) {
                String trimmed = part.trim();
                if (trimmed.startsWith(SESSION_COOKIE + "=")) {
                    return Optional.of(trimmed.substring(SESSION_COOKIE.length() + 1));
                }
            }
        }
        return Optional.empty();
    }

    // ============ Directory & object ============

    public Mono<V3DirectoryList> listDirectory(String path) {
        String normalized = CloudrevePaths.normalize(path);
        String endpoint = CloudrevePaths.isRoot(normalized) ? "/directory/" : "/directory" + encodePath(normalized);
        return get(endpoint, V3DirectoryList.class);
    }

    public Mono<Void> createDirectory(String path) {
        return ack("PUT", "/directory", new V3Requests.CreateDirectory(CloudrevePaths.normalize(path)));
    }

    public Mono<Void> rename(V3Requests.SourceItems src, String newName) {
        return ack("POST", "/object/rename", new V3Requests.Rename("rename", src, newName));
    }

    public Mono<Void> move(String srcDir, V3Requests.SourceItems src, String dstDir) {
        return ack("PATCH", "/object", new V3Requests.Move("move", srcDir, src, dstDir));
    }

    public Mono<Void> copy(String srcDir, V3Requests.SourceItems src, String dstDir) {
        return ack("POST", "/object/copy", new V3Requests.Copy(srcDir, src, dstDir));
    }

    public Mono<Void> delete(List<String> items, List<String> dirs) {
        return ack("DELETE", "/object", new V3Requests.Delete(items, dirs, true, false));
    }

    // ============ Upload & download ============

    public Mono<V3UploadSession> createUploadSession(V3Requests.Upload request) {
        return payload("PUT", "/file/upload", request, V3UploadSession.class);
    }

    public Mono<Void> uploadChunk(String sessionId, int index, byte[] chunk) {
        return exchangeBytes("POST", "/file/upload/" + encode(sessionId) + "/" + index, chunk)
                .doOnNext(EnvelopeCodec::decodeAck)
                .then();
    }

    /**
     * Completes an upload on OneDrive-backed policies
     */
    public Mono<Void> finishOneDriveUpload(String sessionId) {
        return ack("POST", "/callback/onedrive/finish/" + encode(sessionId), null);
    }

    /**
     * PUT /file/download/{id}; relative URLs are resolved against the base URL
     */
    public Mono<String> downloadUrl(String id) {
        return payload("PUT", "/file/download/" + encode(id), null, JsonNode.class)
                .map(data -> {
                    String url = data.isTextual() ? data.asText() : data.path("url").asText("");
                    if (url.isEmpty()) {
                        throw new DecodeException("No download URL returned");
                    }
                    return url.startsWith("http") ? url : getBaseUrl() + url;
                });
    }

    // ============ Share ============

    /**
     * POST /share, emitting the share key
     * <p>
     * The server answers with the share URL as data, an object carrying {@code key}, or on some
     * deployments a bare URL outside any envelope.
     */
    public Mono<String> createShare(V3Requests.Share request) {
        return exchange("POST", "/share", request)
                .map(response -> {
                    Optional<ApiEnvelope> envelope = EnvelopeCodec.tryParse(response);
                    if (envelope.isEmpty()) {
                        if (!response.isSuccessful()) {
                            throw EnvelopeCodec.errorFor(response);
                        }
                        return lastSegment(response.bodyAsString().trim());
                    }
                    JsonNode data = EnvelopeCodec.decodeEnvelope(response).getData();
                    if (data == null || data.isNull()) {
                        throw new DecodeException("Empty response: share key missing");
                    }
                    return data.isTextual() ? lastSegment(data.asText()) : data.path("key").asText();
                });
    }

    public Mono<List<V3Share>> listShares() {
        return get("/share", V3ShareList.class)
                .map(list -> {
                    list.getItems().forEach(share -> share.setUrl(getBaseUrl() + "/s/" + share.getKey()));
                    return list.getItems();
                });
    }

    public Mono<Void> deleteShare(String key) {
        return ack("DELETE", "/share/" + encode(key), null);
    }

    private static String lastSegment(String url) {
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    // ============ User & site ============

    public Mono<V3StorageInfo> storage() {
        return get("/user/storage", V3StorageInfo.class);
    }

    public Mono<List<V3WebdavAccount>> webdavAccounts() {
        return get("/webdav/accounts", V3WebdavAccountList.class)
                .map(V3WebdavAccountList::getAccounts);
    }

    public Mono<JsonNode> siteConfig() {
        return get("/site/config", JsonNode.class);
    }

    // ============ Aria2 ============

    public Mono<Void> createRemoteDownload(String dst, List<String> urls) {
        return ack("POST", "/aria2/url", new V3Requests.Aria2Create(dst, urls));
    }

    public Mono<List<V3Aria2Task>> downloading() {
        return get("/aria2/downloading", new TypeReference<List<V3Aria2Task>>() {
        });
    }

    public Mono<List<V3Aria2Task>> finished() {
        return get("/aria2/finished", new TypeReference<List<V3Aria2Task>>() {
        });
    }

    public Mono<Void> cancelTask(String gid) {
        return ack("DELETE", "/aria2/task/" + encode(gid), null);
    }
}
