package com.profilescheduler.orchestrator.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the device_filter JSON blob into a {@link DeviceFilter}.
 *
 * Accepted shape:
 * <pre>
 *   { "nameContains": "lab-", "groupIds": [12, 40] }
 * </pre>
 * Both keys are optional; unknown keys are ignored. A blank column means
 * "no filter" and yields {@link Optional#empty()}.
 */
@Component
public class DeviceFilterParser {

    static final String NAME_CONTAINS = "nameContains";
    static final String GROUP_IDS     = "groupIds";

    private final ObjectMapper json;

    public DeviceFilterParser(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * @throws DeviceFilterException if the blob is not a JSON object or a
     *                               known key has the wrong type
     */
    public Optional<DeviceFilter> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = json.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DeviceFilterException("Device filter is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DeviceFilterException("Device filter must be a JSON object");
        }

        List<DeviceFilter> parts = new ArrayList<>();

        JsonNode groups = root.get(GROUP_IDS);
        if (groups != null && !groups.isNull()) {
            if (!groups.isArray()) {
                throw new DeviceFilterException("'" + GROUP_IDS + "' must be an array");
            }
            if (!groups.isEmpty()) {
                Set<String> ids = new LinkedHashSet<>();
                groups.forEach(g -> ids.add(g.asText()));
                parts.add(new DeviceFilter.GroupIds(Set.copyOf(ids)));
            }
        }

        JsonNode name = root.get(NAME_CONTAINS);
        if (name != null && !name.isNull()) {
            if (!name.isTextual()) {
                throw new DeviceFilterException("'" + NAME_CONTAINS + "' must be a string");
            }
            // Empty fragment matches everything, same as leaving the key out.
            if (!name.asText().isEmpty()) {
                parts.add(new DeviceFilter.NameContains(name.asText()));
            }
        }

        if (parts.isEmpty()) return Optional.of(DeviceFilter.MATCH_ALL);
        if (parts.size() == 1) return Optional.of(parts.get(0));
        return Optional.of(new DeviceFilter.All(List.copyOf(parts)));
    }
}
