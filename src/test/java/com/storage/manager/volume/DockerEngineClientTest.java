package com.storage.manager.volume;

import com.storage.manager.core.exception.TransientInfraException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DockerEngineClient against canned Engine API responses.
 */
@DisplayName("DockerEngineClient")
class DockerEngineClientTest {

    private MockWebServer server;
    private DockerEngineClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = DockerEngineClient.builder()
                .baseUrl(server.url("/").toString())
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void respond(int status, String body) {
        server.enqueue(new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body));
    }

    @Test
    @DisplayName("inspects a volume")
    void inspectVolume() throws InterruptedException {
        respond(200, "{\"Name\":\"logs\",\"Driver\":\"local\",\"Mountpoint\":\"/var/lib/docker/volumes/logs/_data\"," +
                "\"CreatedAt\":\"2026-01-02T03:04:05Z\",\"Labels\":null,\"Scope\":\"local\"}");

        VolumeInfo volume = client.inspectVolume("logs").orElseThrow();

        assertEquals("logs", volume.name());
        assertEquals("local", volume.driver());
        assertEquals("/var/lib/docker/volumes/logs/_data", volume.mountpoint());
        assertEquals(Instant.parse("2026-01-02T03:04:05Z"), volume.createdAt());
        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/volumes/logs", request.getPath());
    }

    @Test
    @DisplayName("an unknown volume is empty, not an error")
    void unknownVolume() {
        respond(404, "{\"message\":\"get nope: no such volume\"}");

        assertEquals(Optional.empty(), client.inspectVolume("nope"));
    }

    @Test
    @DisplayName("lists volumes with offset creation times")
    void listVolumes() {
        respond(200, "{\"Volumes\":[" +
                "{\"Name\":\"a\",\"Driver\":\"local\",\"Mountpoint\":\"/m/a\",\"CreatedAt\":\"2026-01-02T05:04:05+02:00\"}," +
                "{\"Name\":\"b\",\"Driver\":\"nfs\",\"Mountpoint\":\"/m/b\",\"CreatedAt\":\"garbage\"}" +
                "],\"Warnings\":null}");

        List<VolumeInfo> volumes = client.listVolumes();

        assertEquals(2, volumes.size());
        assertEquals(Instant.parse("2026-01-02T03:04:05Z"), volumes.get(0).createdAt());
        assertNull(volumes.get(1).createdAt());
        assertEquals("nfs", volumes.get(1).driver());
    }

    @Test
    @DisplayName("lists all containers with labels and named volume mounts")
    void listContainers() throws InterruptedException {
        respond(200, "[{\"Id\":\"abc123\",\"Names\":[\"/web\"]," +
                "\"Labels\":{\"storage-manager.0.volume\":\"logs\"}," +
                "\"Mounts\":[{\"Type\":\"volume\",\"Name\":\"logs\"},{\"Type\":\"bind\",\"Source\":\"/etc\"}]}," +
                "{\"Id\":\"def456\",\"Names\":[],\"Labels\":{},\"Mounts\":[]}]");

        List<ContainerInfo> containers = client.listContainers();

        assertEquals(2, containers.size());
        ContainerInfo web = containers.get(0);
        assertEquals("web", web.name());
        assertEquals(Map.of("storage-manager.0.volume", "logs"), web.labels());
        assertEquals(List.of("logs"), web.volumeNames());
        assertEquals("def456", containers.get(1).name());
        assertEquals("/containers/json?all=1", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("server errors and malformed bodies are transient failures")
    void failures() {
        respond(500, "{\"message\":\"boom\"}");
        assertThrows(TransientInfraException.class, () -> client.listVolumes());

        respond(200, "not json");
        assertThrows(TransientInfraException.class, () -> client.listContainers());
    }

    @Test
    @DisplayName("availability follows the ping endpoint and never throws")
    void availability() throws IOException {
        respond(200, "OK");
        assertTrue(client.isAvailable());

        server.shutdown();
        assertFalse(client.isAvailable());
        assertThrows(TransientInfraException.class, () -> client.listVolumes());
    }
}
