package uitrace.device;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uitrace.model.ActionOutcome;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NativeBackend} using WireMock in place of the
 * on-device automation agent.
 */
public class NativeBackendTest {

    private WireMockServer wireMock;
    private NativeBackend backend;

    @BeforeClass
    public void setup() {
        wireMock = new WireMockServer(0);
        wireMock.start();
        backend = new NativeBackend("http://localhost:" + wireMock.port() + "/", 5);
    }

    @AfterClass
    public void teardown() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeMethod
    public void reset() {
        wireMock.resetAll();
    }

    private void stubRpc(String method, String responseJson) {
        wireMock.stubFor(post(urlEqualTo("/jsonrpc/0"))
                .withRequestBody(matchingJsonPath("$.method", equalTo(method)))
                .willReturn(okJson(responseJson)));
    }

    // ── Connection ────────────────────────────────────────────────────────

    @Test(description = "Ping answering 200 means connected")
    public void ensureConnected_pingOk() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(aResponse().withStatus(200).withBody("pong")));

        backend.ensureConnected();
    }

    @Test(description = "Ping failure is a connection error")
    public void ensureConnected_pingFails() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(backend::ensureConnected)
                .isInstanceOf(DeviceConnectionException.class)
                .hasMessageContaining("502");
    }

    // ── Capture ───────────────────────────────────────────────────────────

    @Test(description = "Hierarchy is the result of dumpWindowHierarchy")
    public void dumpHierarchy() throws IOException {
        stubRpc("dumpWindowHierarchy", """
                {"jsonrpc":"2.0","id":1,"result":"<hierarchy rotation=\\"0\\"></hierarchy>"}
                """);

        assertThat(backend.dumpHierarchy()).isEqualTo("<hierarchy rotation=\"0\"></hierarchy>");
        wireMock.verify(postRequestedFor(urlEqualTo("/jsonrpc/0"))
                .withRequestBody(equalToJson("{\"jsonrpc\":\"2.0\",\"method\":\"dumpWindowHierarchy\",\"params\":[false]}",
                        false, true)));
    }

    @Test(description = "JSON-RPC error member becomes an IOException")
    public void rpcError() {
        stubRpc("dumpWindowHierarchy", """
                {"jsonrpc":"2.0","id":1,"error":{"code":-32001,"message":"UiAutomation not connected"}}
                """);

        assertThatThrownBy(backend::dumpHierarchy)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("UiAutomation not connected");
    }

    @Test(description = "Base64 JPEG screenshot is re-encoded as PNG")
    public void screenshot_reencodedAsPng() throws IOException {
        BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream jpeg = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", jpeg);
        String b64 = Base64.getEncoder().encodeToString(jpeg.toByteArray());
        stubRpc("takeScreenshot", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"" + b64 + "\"}");

        byte[] png = backend.screenshot();

        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
    }

    @Test(description = "Foreground activity is read through the agent shell endpoint")
    public void foregroundActivity_viaShell() throws IOException {
        wireMock.stubFor(get(urlPathEqualTo("/shell"))
                .withQueryParam("command", equalTo("dumpsys activity"))
                .willReturn(okJson("""
                        {"exitCode":0,"output":"  mResumedActivity: ActivityRecord{1 u0 com.example.notes/.MainActivity t1}\\n"}
                        """)));

        assertThat(backend.foregroundActivity()).isEqualTo("com.example.notes.MainActivity");
    }

    // ── Actions ───────────────────────────────────────────────────────────

    @Test(description = "Swipe duration is converted to 5 ms steps")
    public void swipe_steps() {
        stubRpc("swipe", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":true}");

        ActionOutcome outcome = backend.swipe(100, 200, 100, 600, 800);

        assertThat(outcome.ok()).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/jsonrpc/0"))
                .withRequestBody(equalToJson("{\"method\":\"swipe\",\"params\":[100,200,100,600,160]}", true, true)));
    }

    @Test(description = "Step count never drops below one")
    public void steps_minimumOne() {
        assertThat(NativeBackend.steps(3)).isEqualTo(1);
        assertThat(NativeBackend.steps(1000)).isEqualTo(200);
    }

    @Test(description = "A false result or HTTP error is a soft action failure")
    public void action_failures_areSoft() {
        stubRpc("click", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":false}");
        assertThat(backend.tap(1, 1).ok()).isFalse();

        wireMock.stubFor(post(urlEqualTo("/jsonrpc/0"))
                .withRequestBody(matchingJsonPath("$.method", equalTo("pressKey")))
                .willReturn(aResponse().withStatus(500).withBody("boom")));
        ActionOutcome back = backend.back();
        assertThat(back.ok()).isFalse();
        assertThat(back.error()).contains("HTTP 500");
    }

    @Test(description = "Text input escapes spaces and goes through the shell endpoint")
    public void inputText_viaShell() {
        wireMock.stubFor(get(urlPathEqualTo("/shell"))
                .withQueryParam("command", equalTo("input text hello%sworld"))
                .willReturn(okJson("{\"exitCode\":0,\"output\":\"\"}")));

        assertThat(backend.inputText("hello world").ok()).isTrue();
    }
}
