package win.ixuni.cloudreve.driver.v4;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import win.ixuni.cloudreve.core.config.ClientProperties;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.ApiException;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.exception.NotAuthenticatedException;
import win.ixuni.cloudreve.core.exception.ResourceNotFoundException;
import win.ixuni.cloudreve.core.model.FileItem;
import win.ixuni.cloudreve.core.model.FileList;
import win.ixuni.cloudreve.core.model.ShareUpdate;
import win.ixuni.cloudreve.core.model.TaskStatus;
import win.ixuni.cloudreve.core.operation.dav.UpdateDavAccountOperation;
import win.ixuni.cloudreve.core.operation.file.*;
import win.ixuni.cloudreve.core.operation.session.LoginOperation;
import win.ixuni.cloudreve.core.operation.session.LogoutOperation;
import win.ixuni.cloudreve.core.operation.session.RefreshTokenOperation;
import win.ixuni.cloudreve.core.operation.share.CreateShareOperation;
import win.ixuni.cloudreve.core.operation.share.ListSharesOperation;
import win.ixuni.cloudreve.core.operation.share.UpdateShareOperation;
import win.ixuni.cloudreve.core.operation.site.GetSiteConfigOperation;
import win.ixuni.cloudreve.core.operation.task.GetTaskProgressOperation;
import win.ixuni.cloudreve.core.operation.task.ListTasksOperation;
import win.ixuni.cloudreve.core.operation.user.GetStorageQuotaOperation;
import win.ixuni.cloudreve.core.operation.user.GetUserInfoOperation;
import win.ixuni.cloudreve.core.transport.TransportRequest;
import win.ixuni.cloudreve.test.FakeHttpTransport;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static win.ixuni.cloudreve.driver.v4.V4TestSupport.*;

/**
 * V4 驱动端到端测试
 * <p>
 * Runs operations through the registry against a recording transport.
 */
class V4CloudreveDriverTest {

    private FakeHttpTransport transport;
    private V4CloudreveDriver driver;

    @BeforeEach
    void setUp() {
        transport = new FakeHttpTransport();
        driver = V4TestSupport.driver(transport);
    }

    private static List<String> names(FileList listing) {
        return listing.getItems().stream().map(FileItem::getName).collect(Collectors.toList());
    }

    private static Map.Entry<String, String> line(TransportRequest request) {
        return Map.entry(request.getMethod() + " " + FakeHttpTransport.endpoint(request), request.bodyAsString());
    }

    // ==================== Driver ====================

    @Test
    @DisplayName("驱动信息与能力集")
    void driverDescribesItself() {
        assertEquals(ApiVersion.V4, driver.getApiVersion());
        assertEquals("v4-test", driver.getDriverName());
        assertEquals(BASE_URL, driver.getConfig().getBaseUrl());
        assertTrue(driver.supportsAll(Capability.SESSION, Capability.TOKEN_REFRESH, Capability.READ,
                Capability.WRITE, Capability.COPY, Capability.BATCH_DELETE, Capability.UPLOAD,
                Capability.DOWNLOAD, Capability.TRASH, Capability.SHARE, Capability.SHARE_MANAGEMENT,
                Capability.WEBDAV, Capability.WEBDAV_MANAGEMENT, Capability.USER, Capability.SITE,
                Capability.REMOTE_DOWNLOAD, Capability.WORKFLOW));
    }

    // ==================== Session ====================

    @Test
    void loginThenRefreshWithStoredToken() {
        transport.on("POST", "/session/token").ok(LOGIN);
        transport.on("POST", "/session/token/refresh")
                .ok("{\"access_token\":\"acc-2\",\"refresh_token\":\"ref-2\",\"access_expires\":\"2030-01-01T01:00:00Z\"}");

        StepVerifier.create(driver.execute(new LoginOperation("alice@example.com", "secret")))
                .assertNext(login -> {
                    assertEquals(ApiVersion.V4, login.getApiVersion());
                    assertEquals("alice@example.com", login.getEmail());
                })
                .verifyComplete();

        StepVerifier.create(driver.execute(new RefreshTokenOperation(null)))
                .assertNext(pair -> {
                    assertEquals("acc-2", pair.getAccessToken());
                    assertEquals("ref-2", pair.getRefreshToken());
                })
                .verifyComplete();
        assertEquals("{\"refresh_token\":\"ref-1\"}", transport.lastRequest().bodyAsString());
    }

    @Test
    @DisplayName("Refresh without any refresh token fails before sending")
    void refreshWithoutToken() {
        StepVerifier.create(driver.execute(new RefreshTokenOperation(null)))
                .expectError(NotAuthenticatedException.class)
                .verify();
        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void userInfoUsesLoggedInUserId() {
        StepVerifier.create(driver.execute(new GetUserInfoOperation()))
                .expectError(NotAuthenticatedException.class)
                .verify();

        transport.on("POST", "/session/token").ok(LOGIN);
        transport.on("GET", "/user/info/lpsa")
                .ok("{\"id\":\"lpsa\",\"email\":\"alice@example.com\",\"nickname\":\"Alice B\",\"group\":{\"id\":\"2\",\"name\":\"Pro\"}}");
        driver.execute(new LoginOperation("alice@example.com", "secret")).block();

        StepVerifier.create(driver.execute(new GetUserInfoOperation()))
                .assertNext(user -> {
                    assertEquals("Alice B", user.getNickname());
                    assertEquals("Pro", user.getGroup());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Logout clears local tokens even when the server call fails")
    void logoutAlwaysClearsTokens() {
        transport.on("POST", "/session/token").ok(LOGIN);
        transport.on("DELETE", "/session/token").status(500, "boom");
        driver.execute(new LoginOperation("alice@example.com", "secret")).block();

        StepVerifier.create(driver.execute(new LogoutOperation()))
                .expectError(ApiException.class)
                .verify();

        StepVerifier.create(driver.execute(new RefreshTokenOperation(null)))
                .expectError(NotAuthenticatedException.class)
                .verify();
    }

    // ==================== Listing ====================

    @Test
    @DisplayName("游标分页：第 2 页携带 next_page_token")
    void cursorPagination() {
        transport.on("GET", "/file", noQuery("next_page_token")).ok(listing(cursorPage("T1"), "a", "b"));
        transport.on("GET", "/file", query("next_page_token", "T1")).ok(listing(cursorPage(null), "c"));

        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", 2, null)))
                .assertNext(listing -> assertEquals(List.of("c"), names(listing)))
                .verifyComplete();

        List<TransportRequest> requests = transport.getRequests();
        assertEquals(2, requests.size());
        assertEquals("cloudreve://my/docs", requests.get(0).queryParameter("uri"));
        assertNull(requests.get(0).queryParameter("page"));
        assertEquals("T1", requests.get(1).queryParameter("next_page_token"));
        assertNull(requests.get(1).queryParameter("page"));
    }

    @Test
    @DisplayName("Offset pagination requests the page directly")
    void offsetPagination() {
        transport.on("GET", "/file", noQuery("page")).ok(listing(offsetPage(0, 2, 5L), "a", "b"));
        transport.on("GET", "/file", query("page", "2")).ok(listing(offsetPage(2, 2, 5L), "e"));

        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", 2, 2)))
                .assertNext(listing -> assertEquals(List.of("e"), names(listing)))
                .verifyComplete();

        TransportRequest second = transport.lastRequest();
        assertEquals("2", second.queryParameter("page"));
        assertEquals("2", second.queryParameter("page_size"));
        assertNull(second.queryParameter("next_page_token"));
    }

    @Test
    void firstPageIsASingleRequest() {
        transport.on("GET", "/file").ok(listing(cursorPage("T1"), "a", "b"));

        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", null, null)))
                .assertNext(listing -> {
                    assertEquals(List.of("a", "b"), names(listing));
                    assertEquals("docs", listing.getParentName());
                    assertEquals("pol-1", listing.getStoragePolicyId());
                })
                .verifyComplete();
        assertEquals(1, transport.getRequests().size());
    }

    @Test
    @DisplayName("A page past the end of the cursor chain is empty")
    void pagePastCursorEnd() {
        transport.on("GET", "/file", noQuery("next_page_token")).ok(listing(cursorPage("T1"), "a", "b"));
        transport.on("GET", "/file", query("next_page_token", "T1")).ok(listing(cursorPage(null), "c"));

        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", 3, null)))
                .assertNext(listing -> {
                    assertTrue(listing.getItems().isEmpty());
                    assertEquals("docs", listing.getParentName());
                })
                .verifyComplete();
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void pageBelowOneIsRejected() {
        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", 0, null)))
                .expectError(InvalidArgumentException.class)
                .verify();
        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    @DisplayName("全量列目录沿游标合并所有页")
    void listAllFollowsCursor() {
        transport.on("GET", "/file", noQuery("next_page_token")).ok(listing(cursorPage("T1"), "a", "b"));
        transport.on("GET", "/file", query("next_page_token", "T1")).ok(listing(cursorPage("T2"), "c", "d"));
        transport.on("GET", "/file", query("next_page_token", "T2")).ok(listing(cursorPage(null), "e"));

        StepVerifier.create(driver.execute(new ListAllFilesOperation("/docs")))
                .assertNext(listing -> {
                    assertEquals(List.of("a", "b", "c", "d", "e"), names(listing));
                    assertEquals(5, listing.getTotalCount());
                    assertEquals("pol-1", listing.getStoragePolicyId());
                })
                .verifyComplete();

        assertEquals(3, transport.getRequests().size());
        assertEquals("100", transport.getRequests().get(0).queryParameter("page_size"));
    }

    @Test
    void listAllFollowsOffsetPages() {
        driver = V4TestSupport.driver(transport, Map.of(ClientProperties.LIST_PAGE_SIZE, 2));
        transport.on("GET", "/file", noQuery("page")).ok(listing(offsetPage(0, 2, 5L), "a", "b"));
        transport.on("GET", "/file", query("page", "1")).ok(listing(offsetPage(1, 2, 5L), "c", "d"));
        transport.on("GET", "/file", query("page", "2")).ok(listing(offsetPage(2, 2, 5L), "e"));

        StepVerifier.create(driver.execute(new ListAllFilesOperation("/docs")))
                .assertNext(listing -> assertEquals(List.of("a", "b", "c", "d", "e"), names(listing)))
                .verifyComplete();

        assertEquals(3, transport.getRequests().size());
        assertTrue(transport.getRequests().stream().allMatch(r -> "2".equals(r.queryParameter("page_size"))));
    }

    @Test
    @DisplayName("Offset chain stops on an empty page when no total is reported")
    void listAllStopsOnEmptyPage() {
        driver = V4TestSupport.driver(transport, Map.of(ClientProperties.LIST_PAGE_SIZE, 2));
        transport.on("GET", "/file", noQuery("page")).ok(listing(offsetPage(0, 2, null), "a", "b"));
        transport.on("GET", "/file", query("page", "1")).ok(listing(offsetPage(1, 2, null)));

        StepVerifier.create(driver.execute(new ListAllFilesOperation("/docs")))
                .assertNext(listing -> assertEquals(List.of("a", "b"), names(listing)))
                .verifyComplete();
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    @DisplayName("Offset chain stops when the server keeps returning the same page")
    void listAllStopsOnRepeatedPage() {
        driver = V4TestSupport.driver(transport, Map.of(ClientProperties.LIST_PAGE_SIZE, 2));
        transport.on("GET", "/file").ok(listing(offsetPage(0, 2, null), "a", "b"));

        StepVerifier.create(driver.execute(new ListAllFilesOperation("/docs")))
                .assertNext(listing -> assertEquals(List.of("a", "b"), names(listing)))
                .verifyComplete();
        assertEquals(2, transport.getRequests().size());
        assertEquals("1", transport.lastRequest().queryParameter("page"));
    }

    @Test
    void nullFilesAndPaginationReadAsEmpty() {
        transport.on("GET", "/file").ok("{\"files\":null,\"pagination\":null,\"parent\":null}");

        StepVerifier.create(driver.execute(new ListAllFilesOperation("/docs")))
                .assertNext(listing -> assertTrue(listing.getItems().isEmpty()))
                .verifyComplete();
        StepVerifier.create(driver.execute(new ListFilesOperation("/docs", null, null)))
                .assertNext(listing -> assertTrue(listing.getItems().isEmpty()))
                .verifyComplete();
        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void fileInfoMapsUriToPath() {
        transport.on("GET", "/file/info", query("uri", "cloudreve://my/docs/a.txt"))
                .ok(file("a.txt", 0, 42, "cloudreve://my/docs/a.txt"));

        StepVerifier.create(driver.execute(new GetFileInfoOperation("/docs/a.txt")))
                .assertNext(info -> {
                    assertEquals("a.txt", info.getName());
                    assertEquals("/docs/a.txt", info.getPath());
                    assertEquals(42, info.getSize());
                    assertFalse(info.isFolder());
                })
                .verifyComplete();
    }

    // ==================== Move & copy ====================

    @Test
    @DisplayName("同目录移动即重命名")
    void moveInSameDirectoryRenames() {
        transport.on("POST", "/file/rename").ack();

        driver.execute(new MoveOperation("/docs/a.txt", "/docs/b.txt")).block();

        assertEquals(Map.entry("POST /file/rename", "{\"uri\":\"cloudreve://my/docs/a.txt\",\"new_name\":\"b.txt\"}"),
                line(transport.lastRequest()));
    }

    @Test
    void moveToOtherDirectory() {
        transport.on("POST", "/file/move").ack();

        driver.execute(new MoveOperation("/docs/a.txt", "/other")).block();
        driver.execute(new MoveOperation("/docs/a.txt", "/other/a.txt")).block();

        String expected = "{\"uris\":[\"cloudreve://my/docs/a.txt\"],\"dst\":\"cloudreve://my/other\",\"copy\":false}";
        assertEquals(List.of(expected, expected), transport.getRequests().stream()
                .map(TransportRequest::bodyAsString).collect(Collectors.toList()));
    }

    @Test
    void moveRootIsRejected() {
        StepVerifier.create(driver.execute(new MoveOperation("/", "/other")))
                .expectError(InvalidArgumentException.class)
                .verify();
    }

    @Test
    void copyToOtherDirectoryIsOneCall() {
        transport.on("POST", "/file/move").ack();

        driver.execute(new CopyOperation("/docs/a.txt", "/other")).block();

        assertEquals(List.of("POST /file/move"), transport.requestLines());
        assertTrue(transport.lastRequest().bodyAsString().contains("\"copy\":true"));
    }

    @Test
    @DisplayName("A destination naming an existing sibling folder is a plain copy into it")
    void copyIntoExistingSiblingFolder() {
        stubCopySteps();
        transport.on("GET", "/file/info").ok(file("archive", 1, 0, "cloudreve://my/docs/archive"));

        StepVerifier.create(driver.execute(new CopyOperation("/docs/a.txt", "/docs/archive")))
                .verifyComplete();

        assertEquals(List.of("GET /file/info", "POST /file/move"), transport.requestLines());
        assertEquals("{\"uris\":[\"cloudreve://my/docs/a.txt\"],\"dst\":\"cloudreve://my/docs/archive\",\"copy\":true}",
                transport.lastRequest().bodyAsString());
    }

    @Test
    @DisplayName("同目录改名复制：经临时目录的七步序列")
    void copyWithRenameSequence() {
        stubCopySteps();

        StepVerifier.create(driver.execute(new CopyOperation("/docs/a.txt", "/docs/a_copy.txt")))
                .verifyComplete();

        assertEquals(List.of("GET /file/info", "POST /file/create", "POST /file/move", "POST /file/rename",
                "POST /file/move", "POST /file/rename", "DELETE /file"), transport.requestLines());

        List<TransportRequest> requests = transport.getRequests();
        assertEquals("cloudreve://my/docs/a_copy.txt", requests.get(0).queryParameter("uri"));
        String create = requests.get(1).bodyAsString();
        assertTrue(create.contains("\"uri\":\"cloudreve://my/docs/.cloudreve-copy-"), create);
        assertTrue(create.contains("\"type\":\"folder\""), create);
        assertTrue(requests.get(2).bodyAsString().contains("\"copy\":true"));
        assertTrue(requests.get(3).bodyAsString().contains("\"new_name\":\"a_copy.txt.tmp-"));
        assertTrue(requests.get(4).bodyAsString().contains("\"dst\":\"cloudreve://my/docs\""));
        assertTrue(requests.get(4).bodyAsString().contains("\"copy\":false"));
        assertTrue(requests.get(5).bodyAsString().endsWith("\"new_name\":\"a_copy.txt\"}"));
        assertTrue(requests.get(6).bodyAsString().contains("cloudreve://my/docs/.cloudreve-copy-"));
    }

    @Test
    void copyWithRenameReplacesExistingDestination() {
        stubCopySteps();
        transport.on("GET", "/file/info").ok(file("a_copy.txt", 0, 3, "cloudreve://my/docs/a_copy.txt"));

        driver.execute(new CopyOperation("/docs/a.txt", "/docs/a_copy.txt")).block();

        List<String> lines = transport.requestLines();
        assertEquals(List.of("GET /file/info", "DELETE /file", "POST /file/create"), lines.subList(0, 3));
        assertEquals("{\"uris\":[\"cloudreve://my/docs/a_copy.txt\"]}", transport.getRequests().get(1).bodyAsString());
        assertEquals(8, lines.size());
    }

    @Test
    @DisplayName("A failed move back leaves the temporary directory behind")
    void copyWithRenameLeaksOnFailure() {
        stubCopySteps();
        transport.on("POST", "/file/move", request -> request.bodyAsString().contains("\"copy\":false"))
                .apiError(40004, "Object existed");

        StepVerifier.create(driver.execute(new CopyOperation("/docs/a.txt", "/docs/a_copy.txt")))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ApiException.class, e);
                    assertEquals(40004, ((ApiException) e).getCode());
                })
                .verify();

        assertEquals(List.of("GET /file/info", "POST /file/create", "POST /file/move", "POST /file/rename",
                "POST /file/move"), transport.requestLines());
    }

    @Test
    void cleanupFailureIsNotSurfaced() {
        stubCopySteps();
        transport.on("DELETE", "/file").status(500, "boom");

        StepVerifier.create(driver.execute(new CopyOperation("/docs/a.txt", "/docs/a_copy.txt")))
                .verifyComplete();
        assertEquals("DELETE /file", transport.requestLines().get(6));
    }

    private void stubCopySteps() {
        transport.on("POST", "/file/create").ack();
        transport.on("POST", "/file/move").ack();
        transport.on("POST", "/file/rename").ack();
        transport.on("DELETE", "/file").ack();
    }

    // ==================== Delete ====================

    @Test
    void batchDeleteInOneCall() {
        transport.on("DELETE", "/file").ack();

        StepVerifier.create(driver.execute(new BatchDeleteOperation(List.of("/a.txt", "/docs/b"))))
                .assertNext(result -> {
                    assertTrue(result.isAllSucceeded());
                    assertEquals(List.of("/a.txt", "/docs/b"), result.getDeleted());
                })
                .verifyComplete();

        assertEquals("{\"uris\":[\"cloudreve://my/a.txt\",\"cloudreve://my/docs/b\"]}",
                transport.lastRequest().bodyAsString());
    }

    @Test
    @DisplayName("批量删除失败后逐个重试并记录失败路径")
    void batchDeleteFallsBackToSingleDeletes() {
        transport.on("DELETE", "/file").ack();
        transport.on("DELETE", "/file", request -> request.bodyAsString().contains("b.txt"))
                .apiError(40016, "File not found");

        StepVerifier.create(driver.execute(new BatchDeleteOperation(List.of("/a.txt", "/", "/b.txt"))))
                .assertNext(result -> {
                    assertEquals(List.of("/a.txt"), result.getDeleted());
                    assertEquals(2, result.getFailureCount());
                    assertEquals("/", result.getFailures().get(0).getPath());
                    assertEquals("/b.txt", result.getFailures().get(1).getPath());
                    assertEquals("File not found", result.getFailures().get(1).getMessage());
                })
                .verifyComplete();

        assertEquals(List.of("DELETE /file", "DELETE /file", "DELETE /file"), transport.requestLines());
    }

    @Test
    void deleteRootIsRejected() {
        StepVerifier.create(driver.execute(new DeleteOperation("/")))
                .expectError(InvalidArgumentException.class)
                .verify();
    }

    // ==================== Resource URIs ====================

    @Test
    @DisplayName("Resource URIs are accepted wherever a path is")
    void deleteAcceptsUri() {
        transport.on("DELETE", "/file").ack();

        driver.execute(new DeleteOperation("cloudreve://my/docs/a.txt")).block();

        assertEquals("{\"uris\":[\"cloudreve://my/docs/a.txt\"]}", transport.lastRequest().bodyAsString());
    }

    @Test
    void moveAndRenameAcceptUris() {
        transport.on("POST", "/file/rename").ack();
        transport.on("POST", "/file/move").ack();

        driver.execute(new MoveOperation("cloudreve://my/docs/a.txt", "cloudreve://my/docs/b.txt")).block();
        driver.execute(new RenameOperation("cloudreve://my/docs/a.txt", "c.txt")).block();
        driver.execute(new MoveOperation("cloudreve://my/docs/a.txt", "cloudreve://my/other")).block();

        List<String> bodies = transport.getRequests().stream()
                .map(TransportRequest::bodyAsString).collect(Collectors.toList());
        assertEquals("{\"uri\":\"cloudreve://my/docs/a.txt\",\"new_name\":\"b.txt\"}", bodies.get(0));
        assertEquals("{\"uri\":\"cloudreve://my/docs/a.txt\",\"new_name\":\"c.txt\"}", bodies.get(1));
        assertEquals("{\"uris\":[\"cloudreve://my/docs/a.txt\"],\"dst\":\"cloudreve://my/other\",\"copy\":false}",
                bodies.get(2));
    }

    @Test
    void copyAcceptsUris() {
        transport.on("POST", "/file/move").ack();

        driver.execute(new CopyOperation("cloudreve://my/docs/a.txt", "cloudreve://my/other")).block();

        assertEquals("{\"uris\":[\"cloudreve://my/docs/a.txt\"],\"dst\":\"cloudreve://my/other\",\"copy\":true}",
                transport.lastRequest().bodyAsString());
    }

    @Test
    void batchDeleteAcceptsUris() {
        transport.on("DELETE", "/file").ack();

        StepVerifier.create(driver.execute(new BatchDeleteOperation(
                        List.of("cloudreve://my/a.txt", "cloudreve://my/", "cloudreve://trash/x"))))
                .assertNext(result -> {
                    assertEquals(List.of("/a.txt"), result.getDeleted());
                    assertEquals(2, result.getFailureCount());
                    assertEquals("cloudreve://my/", result.getFailures().get(0).getPath());
                    assertEquals("cloudreve://trash/x", result.getFailures().get(1).getPath());
                })
                .verifyComplete();

        assertEquals("{\"uris\":[\"cloudreve://my/a.txt\"]}", transport.lastRequest().bodyAsString());
    }

    @Test
    @DisplayName("The root URI is guarded like the root path")
    void rootUriIsRejected() {
        StepVerifier.create(driver.execute(new DeleteOperation("cloudreve://my/")))
                .expectError(InvalidArgumentException.class)
                .verify();
        StepVerifier.create(driver.execute(new DeleteOperation("cloudreve://my")))
                .expectError(InvalidArgumentException.class)
                .verify();
        StepVerifier.create(driver.execute(new MoveOperation("cloudreve://my/", "/other")))
                .expectError(InvalidArgumentException.class)
                .verify();
        assertTrue(transport.getRequests().isEmpty());
    }

    // ==================== Upload ====================

    @Test
    @DisplayName("上传：策略取自父目录，分片按序发送")
    void uploadUsesParentPolicyAndChunks() {
        transport.on("GET", "/file").ok(listing(cursorPage(null), "x"));
        transport.on("PUT", "/file/upload").ok("{\"session_id\":\"s1\",\"chunk_size\":4,\"expires\":0}");
        transport.on("POST", "/file/upload/s1/0").ack();
        transport.on("POST", "/file/upload/s1/1").ack();
        transport.on("POST", "/file/upload/s1/2").ack();

        StepVerifier.create(driver.execute(new UploadOperation("/docs/a.bin", "0123456789".getBytes(), null)))
                .verifyComplete();

        assertEquals(List.of("GET /file", "PUT /file/upload", "POST /file/upload/s1/0",
                "POST /file/upload/s1/1", "POST /file/upload/s1/2"), transport.requestLines());
        assertEquals("1", transport.getRequests().get(0).queryParameter("page_size"));
        assertEquals("{\"uri\":\"cloudreve://my/docs/a.bin\",\"size\":10,\"policy_id\":\"pol-1\"}",
                transport.getRequests().get(1).bodyAsString());
        assertEquals("89", new String(transport.lastRequest().getBody()));
    }

    @Test
    void uploadFallsBackToDefaultPolicy() {
        transport.on("PUT", "/file/upload").ok("{\"session_id\":\"s1\",\"chunk_size\":0}");
        transport.on("POST", "/file/upload/s1/0").ack();

        driver.execute(new UploadOperation("/a.bin", "abc".getBytes(), null)).block();

        assertTrue(transport.getRequests().get(1).bodyAsString().contains("\"policy_id\":\"default\""));
    }

    @Test
    @DisplayName("A failed chunk aborts the upload session and propagates")
    void uploadAbortsSessionOnChunkFailure() {
        transport.on("PUT", "/file/upload").ok("{\"session_id\":\"s1\",\"chunk_size\":4}");
        transport.on("POST", "/file/upload/s1/0").ack();
        transport.on("POST", "/file/upload/s1/1").apiError(40001, "Chunk rejected");
        transport.on("DELETE", "/file/upload").ack();

        StepVerifier.create(driver.execute(new UploadOperation("/docs/a.bin", "0123456789".getBytes(), "pol-9")))
                .expectErrorSatisfies(e -> assertEquals("Chunk rejected", e.getMessage()))
                .verify();

        assertEquals(List.of("PUT /file/upload", "POST /file/upload/s1/0", "POST /file/upload/s1/1",
                "DELETE /file/upload"), transport.requestLines());
        assertEquals("{\"id\":\"s1\",\"uri\":\"cloudreve://my/docs/a.bin\"}", transport.lastRequest().bodyAsString());
    }

    // ==================== Share ====================

    @Test
    void createShareWithPassword() {
        transport.on("PUT", "/share").ok("\"https://cloud.test/s/Xy1\"");

        StepVerifier.create(driver.execute(new CreateShareOperation("/docs/a.txt", 3600, "pw")))
                .expectNext("https://cloud.test/s/Xy1")
                .verifyComplete();

        String body = transport.lastRequest().bodyAsString();
        assertTrue(body.contains("\"uri\":\"cloudreve://my/docs/a.txt\""));
        assertTrue(body.contains("\"is_private\":true"));
        assertTrue(body.contains("\"expire\":3600"));
        assertTrue(body.contains("\"password\":\"pw\""));
    }

    @Test
    void updateShareSendsEmptyUri() {
        transport.on("POST", "/share/s9").ack();

        driver.execute(new UpdateShareOperation("s9", ShareUpdate.builder().expiresIn(60).build())).block();

        String body = transport.lastRequest().bodyAsString();
        assertTrue(body.contains("\"uri\":\"\""));
        assertTrue(body.contains("\"expire\":60"));
        assertFalse(body.contains("is_private"));
    }

    @Test
    @DisplayName("Share listing follows the cursor")
    void listSharesFollowsCursor() {
        transport.on("GET", "/share", noQuery("next_page_token"))
                .ok("{\"shares\":[{\"id\":\"s1\",\"name\":\"a\"}],\"pagination\":{\"next_page_token\":\"N\"}}");
        transport.on("GET", "/share", query("next_page_token", "N"))
                .ok("{\"shares\":[{\"id\":\"s2\",\"name\":\"b\"}],\"pagination\":{}}");

        StepVerifier.create(driver.execute(new ListSharesOperation()))
                .assertNext(shares -> assertEquals(2, shares.size()))
                .verifyComplete();
        assertEquals("50", transport.getRequests().get(0).queryParameter("page_size"));
    }

    // ==================== WebDAV ====================

    @Test
    @DisplayName("修改 WebDAV 账户：翻页查找并保留原有根目录")
    void updateDavAccountLooksUpCurrentValues() {
        transport.on("GET", "/devices/dav", noQuery("next_page_token"))
                .ok("{\"accounts\":[{\"id\":\"d1\",\"name\":\"one\",\"uri\":\"cloudreve://my/\"}],"
                        + "\"pagination\":{\"next_page_token\":\"N\"}}");
        transport.on("GET", "/devices/dav", query("next_page_token", "N"))
                .ok("{\"accounts\":[{\"id\":\"d2\",\"name\":\"old\",\"uri\":\"cloudreve://my/dav\"}],\"pagination\":{}}");
        transport.on("PATCH", "/devices/dav/d2").ack();

        driver.execute(new UpdateDavAccountOperation("d2", null, "new", true, null)).block();

        assertEquals(Map.entry("PATCH /devices/dav/d2", "{\"uri\":\"cloudreve://my/dav\",\"name\":\"new\",\"readonly\":true}"),
                line(transport.lastRequest()));
    }

    @Test
    void updateUnknownDavAccount() {
        transport.on("GET", "/devices/dav").ok("{\"accounts\":[],\"pagination\":{}}");

        StepVerifier.create(driver.execute(new UpdateDavAccountOperation("zz", "/x", null, null, null)))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ResourceNotFoundException.class, e);
                    assertEquals("WebDAV account not found: zz", e.getMessage());
                })
                .verify();
        assertEquals(List.of("GET /devices/dav"), transport.requestLines());
    }

    // ==================== User, site & tasks ====================

    @Test
    void storageQuota() {
        transport.on("GET", "/user/capacity").ok("{\"used\":30,\"total\":100}");

        StepVerifier.create(driver.execute(new GetStorageQuotaOperation()))
                .assertNext(quota -> {
                    assertEquals(30, quota.getUsed());
                    assertEquals(70, quota.getFree());
                })
                .verifyComplete();
    }

    @Test
    void siteConfigDefaultsToBasicSection() {
        transport.on("GET", "/site/config/basic").ok("{\"title\":\"Cloudreve\"}");

        StepVerifier.create(driver.execute(new GetSiteConfigOperation(null)))
                .assertNext(config -> {
                    assertEquals("basic", config.getSection());
                    assertEquals("Cloudreve", config.getValues().get("title").asText());
                })
                .verifyComplete();
    }

    @Test
    void listTasksDefaults() {
        transport.on("GET", "/workflow")
                .ok("{\"tasks\":[{\"id\":\"t1\",\"type\":\"remote_download\",\"status\":\"processing\"}],\"pagination\":{}}");

        StepVerifier.create(driver.execute(new ListTasksOperation(null, null)))
                .assertNext(tasks -> assertEquals(TaskStatus.PROCESSING, tasks.get(0).getStatus()))
                .verifyComplete();

        assertEquals("general", transport.lastRequest().queryParameter("category"));
        assertEquals("100", transport.lastRequest().queryParameter("page_size"));
    }

    @Test
    void taskProgress() {
        transport.on("GET", "/workflow/progress/t1").ok("{\"total\":200,\"current\":50}");

        StepVerifier.create(driver.execute(new GetTaskProgressOperation("t1")))
                .assertNext(progress -> {
                    assertEquals("t1", progress.getTaskId());
                    assertEquals(0.25, progress.getProgress(), 1e-9);
                })
                .verifyComplete();
    }
}
