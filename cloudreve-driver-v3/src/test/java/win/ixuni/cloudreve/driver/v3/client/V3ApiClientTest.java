package win.ixuni.cloudreve.driver.v3.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import win.ixuni.cloudreve.core.auth.SessionCredentials;
import win.ixuni.cloudreve.core.exception.ApiException;
import win.ixuni.cloudreve.core.exception.DecodeException;
import win.ixuni.cloudreve.driver.v3.V3TestSupport;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;
import win.ixuni.cloudreve.test.FakeHttpTransport;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class V3ApiClientTest {

    private static final String USER = "{\"id\":\"u1\",\"user_name\":\"alice@example.com\",\"nickname\":\"Alice\","
            + "\"status\":0,\"created_at\":\"2024-01-01\",\"group\":{\"id\":2,\"name\":\"User\"}}";

    private FakeHttpTransport transport;
    private SessionCredentials credentials;
    private V3ApiClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeHttpTransport();
        credentials = new SessionCredentials();
        client = new V3ApiClient(V3TestSupport.BASE_URL, transport, credentials);
    }

    // ==================== Session ====================

    @Test
    @DisplayName("登录后保存并回放会话 Cookie")
    void loginCapturesSessionCookie() {
        transport.on("POST", "/user/session").ok(USER)
                .withCookie("cloudreve-session=abc123; Path=/; HttpOnly");
        transport.on("GET", "/user/storage").ok("{\"used\":1,\"free\":9,\"total\":10}");

        StepVerifier.create(client.login("alice@example.com", "secret"))
                .assertNext(user -> assertEquals("Alice", user.getNickname()))
                .verifyComplete();

        assertEquals("abc123", credentials.getAccessToken().orElseThrow());
        assertEquals("alice@example.com", credentials.getUser().orElseThrow().getEmail());
        String body = transport.lastRequest().bodyAsString();
        assertTrue(body.contains("\"userName\":\"alice@example.com\""));
        assertTrue(body.contains("\"Password\":\"secret\""));

        client.storage().block();
        assertEquals("cloudreve-session=abc123", transport.lastRequest().getHeaders().get("Cookie"));
    }

    @Test
    @DisplayName("Login clears the previous session before sending")
    void loginStartsWithoutOldCookie() {
        credentials.setAccessToken("stale");
        transport.on("POST", "/user/session").apiError(40001, "wrong password");

        StepVerifier.create(client.login("alice@example.com", "bad"))
                .expectError(ApiException.class)
                .verify();

        assertNull(transport.lastRequest().getHeaders().get("Cookie"));
        assertTrue(credentials.getAccessToken().isEmpty());
    }

    @Test
    @DisplayName("Login without the session cookie is a decode error")
    void loginWithoutCookieFails() {
        transport.on("POST", "/user/session").ok(USER);

        StepVerifier.create(client.login("alice@example.com", "secret"))
                .expectError(DecodeException.class)
                .verify();
    }

    // ==================== Share ====================

    @Test
    @DisplayName("Share key taken from the URL returned as data")
    void shareKeyFromUrlData() {
        transport.on("POST", "/share").ok("\"http://cloud.test/s/Kx9a\"");

        StepVerifier.create(client.createShare(share()))
                .expectNext("Kx9a")
                .verifyComplete();
    }

    @Test
    @DisplayName("Share key taken from an object payload")
    void shareKeyFromObject() {
        transport.on("POST", "/share").ok("{\"key\":\"K42\"}");

        StepVerifier.create(client.createShare(share()))
                .expectNext("K42")
                .verifyComplete();
    }

    @Test
    @DisplayName("Plain URL body outside an envelope")
    void shareKeyFromPlainBody() {
        transport.on("POST", "/share").respond(FakeHttpTransport.text(200, "http://cloud.test/s/plain1\n"));

        StepVerifier.create(client.createShare(share()))
                .expectNext("plain1")
                .verifyComplete();
    }

    @Test
    void listSharesFillsPublicUrl() {
        transport.on("GET", "/share").ok("{\"items\":[{\"key\":\"K1\",\"is_dir\":false,\"create_date\":\"2024\","
                + "\"expire\":-1,\"expired\":false,\"source\":{\"name\":\"a.txt\",\"size\":3}}],\"total\":1}");

        StepVerifier.create(client.listShares())
                .assertNext(shares -> {
                    assertEquals(1, shares.size());
                    assertEquals("K1", shares.get(0).getId());
                    assertEquals("a.txt", shares.get(0).getName());
                    assertEquals("http://cloud.test/s/K1", shares.get(0).getUrl());
                })
                .verifyComplete();
    }

    // ==================== Download ====================

    @Test
    @DisplayName("Relative download URL is prefixed with the base URL")
    void relativeDownloadUrl() {
        transport.on("PUT", "/file/download/X1").ok("\"/api/v3/file/get/1/a.txt?sign=s\"");

        StepVerifier.create(client.downloadUrl("X1"))
                .expectNext("http://cloud.test/api/v3/file/get/1/a.txt?sign=s")
                .verifyComplete();
    }

    @Test
    void absoluteDownloadUrlKept() {
        transport.on("PUT", "/file/download/X1").ok("{\"url\":\"https://cdn.test/a.txt\"}");

        StepVerifier.create(client.downloadUrl("X1"))
                .expectNext("https://cdn.test/a.txt")
                .verifyComplete();
    }

    @Test
    void deleteSendsSeparateLists() {
        transport.on("DELETE", "/object").ack();

        client.delete(List.of("X1"), List.of("X2")).block();

        String body = transport.lastRequest().bodyAsString();
        assertTrue(body.contains("\"items\":[\"X1\"]"));
        assertTrue(body.contains("\"dirs\":[\"X2\"]"));
        assertTrue(body.contains("\"force\":true"));
        assertTrue(body.contains("\"unlink\":false"));
    }

    private static V3Requests.Share share() {
        return V3Requests.Share.builder().id("X1").password("").preview(true).build();
    }
}
