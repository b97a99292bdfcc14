package com.profilescheduler.orchestrator.mdm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceManagementClientTest {

    private MockWebServer server;
    private DeviceManagementClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = clientWithKey("api-key-123");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void listDevices_followsPaginationAndAuthenticates() throws Exception {
        server.enqueue(json("""
                {"data":[{"id":1,"type":"device","attributes":{"name":"Lab iPad"}},
                         {"id":2,"type":"device","attributes":{"name":"Lab Mac"}}],
                 "has_more":true}
                """));
        server.enqueue(json("""
                {"data":[{"id":3,"type":"device","attributes":{"name":"Front desk"}}],
                 "has_more":false}
                """));

        List<Device> devices = client.listDevices();

        assertThat(devices).containsExactly(
                new Device("1", "Lab iPad"),
                new Device("2", "Lab Mac"),
                new Device("3", "Front desk"));

        RecordedRequest first = server.takeRequest();
        assertThat(first.getMethod()).isEqualTo("GET");
        assertThat(first.getPath()).isEqualTo("/api/v1/devices?limit=2");
        String expectedAuth = "Basic " + Base64.getEncoder()
                .encodeToString("api-key-123:".getBytes(StandardCharsets.UTF_8));
        assertThat(first.getHeader("Authorization")).isEqualTo(expectedAuth);

        RecordedRequest second = server.takeRequest();
        assertThat(second.getPath()).isEqualTo("/api/v1/devices?limit=2&starting_after=2");
    }

    @Test
    void listDevices_emptyDirectory_returnsEmpty() {
        server.enqueue(json("{\"data\":[],\"has_more\":false}"));

        assertThat(client.listDevices()).isEmpty();
    }

    @Test
    void listDevices_errorStatus_throwsWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        assertThatThrownBy(() -> client.listDevices())
                .isInstanceOf(MdmApiException.class)
                .hasMessageContaining("HTTP 401")
                .satisfies(e -> assertThat(((MdmApiException) e).statusCode()).isEqualTo(401));
    }

    @Test
    void pushProfile_postsToProfileDevicePath() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));

        client.pushProfile("55", "101");

        RecordedRequest req = server.takeRequest();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getPath()).isEqualTo("/api/v1/profiles/55/devices/101");
    }

    @Test
    void pushProfile_errorStatus_carriesStatusAndBody() {
        server.enqueue(new MockResponse().setResponseCode(422).setBody("profile not assignable"));

        assertThatThrownBy(() -> client.pushProfile("55", "101"))
                .isInstanceOf(MdmApiException.class)
                .hasMessageContaining("422")
                .hasMessageContaining("profile not assignable");
    }

    @Test
    void isConfigured_falseWithoutKey() {
        assertThat(client.isConfigured()).isTrue();
        assertThat(clientWithKey("").isConfigured()).isFalse();
        assertThat(clientWithKey(null).isConfigured()).isFalse();
    }

    private DeviceManagementClient clientWithKey(String key) {
        return new DeviceManagementClient(server.url("/api/v1").toString(), key,
                Duration.ofSeconds(5), 2, new ObjectMapper());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
