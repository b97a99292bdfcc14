package com.profilescheduler.orchestrator.mdm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import com.profilescheduler.orchestrator.mdm.dto.DeviceListResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the device-management (SimpleMDM-style) REST API.
 *
 * Only two operations are consumed:
 *   GET  /devices                                   list the device directory
 *   POST /profiles/{profileId}/devices/{deviceId}   apply a profile to one device
 *
 * Both authenticate with HTTP Basic, the API key as user and an empty
 * password. Every request carries the configured timeout so one slow call
 * cannot stall a run.
 *
 * Called from worker pool threads, so blocking I/O here is acceptable.
 */
@Component
public class DeviceManagementClient {

    private static final Logger log = LoggerFactory.getLogger(DeviceManagementClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     requestTimeout;
    private final int          pageSize;

    public DeviceManagementClient(
            @Value("${profilescheduler.mdm.base-url}") String baseUrl,
            @Value("${profilescheduler.mdm.api-key:}") String apiKey,
            @Value("${profilescheduler.mdm.request-timeout:PT30S}") Duration requestTimeout,
            @Value("${profilescheduler.mdm.page-size:100}") int pageSize,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey         = apiKey;
        this.requestTimeout = requestTimeout;
        this.pageSize       = pageSize;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** False when no API key is configured; the engine refuses to run then. */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    // ------------------------------------------------------------------
    // Device directory
    // ------------------------------------------------------------------

    /**
     * Fetch the whole device directory, following has_more / starting_after
     * pagination until the last page.
     *
     * @throws MdmApiException on any non-2xx response, transport error or
     *                         unparseable body
     */
    public List<Device> listDevices() {
        List<Device> devices = new ArrayList<>();
        String startingAfter = null;
        while (true) {
            String path = "/devices?limit=" + pageSize
                    + (startingAfter == null ? "" : "&starting_after=" + encode(startingAfter));
            String body = send(request(path).GET().build(), "listDevices");

            DeviceListResponse page;
            try {
                page = json.readValue(body, DeviceListResponse.class);
            } catch (JsonProcessingException e) {
                throw new MdmApiException("Failed to parse listDevices response", e);
            }
            if (page.data() == null || page.data().isEmpty()) {
                break;
            }
            page.data().forEach(entry -> devices.add(entry.toDevice()));
            if (!page.hasMore()) {
                break;
            }
            startingAfter = page.data().get(page.data().size() - 1).id();
        }
        log.debug("Fetched {} devices from the device directory", devices.size());
        return devices;
    }

    // ------------------------------------------------------------------
    // Profile push
    // ------------------------------------------------------------------

    /**
     * Apply a configuration profile to one device.
     *
     * @throws MdmApiException with the response status and body on non-2xx,
     *                         or wrapping the transport failure
     */
    public void pushProfile(String profileId, String deviceId) {
        String path = "/profiles/" + encode(profileId) + "/devices/" + encode(deviceId);
        send(request(path).POST(HttpRequest.BodyPublishers.noBody()).build(),
                "pushProfile " + profileId + " → device " + deviceId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String path) {
        String credentials = Base64.getEncoder()
                .encodeToString((apiKey + ":").getBytes(StandardCharsets.UTF_8));
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Basic " + credentials)
                .header("Content-Type",  "application/json")
                .header("Accept",        "application/json");
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new MdmApiException(resp.statusCode(),
                        opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (MdmApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MdmApiException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new MdmApiException(opName + " failed", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
