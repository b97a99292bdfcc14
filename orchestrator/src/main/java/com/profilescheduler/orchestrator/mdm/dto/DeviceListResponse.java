package com.profilescheduler.orchestrator.mdm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of GET /devices.
 *
 * Wire shape: { data: [{ id, attributes: { name, ... } }], has_more }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceListResponse(
        List<Entry> data,
        @JsonProperty("has_more") boolean hasMore
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String id, Attributes attributes) {

        public Device toDevice() {
            return new Device(id, attributes == null ? null : attributes.name());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attributes(String name) {}
}
