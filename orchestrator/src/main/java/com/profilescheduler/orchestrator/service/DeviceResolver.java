package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.filter.DeviceFilter;
import com.profilescheduler.orchestrator.filter.DeviceFilterParser;
import com.profilescheduler.orchestrator.mdm.DeviceManagementClient;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a schedule's device_filter to the concrete target devices.
 *
 * Never throws: a filter that cannot be parsed, or a directory fetch that
 * fails, yields an empty list. A broken filter must reach nobody, never
 * everybody.
 */
@Service
public class DeviceResolver {

    private static final Logger log = LoggerFactory.getLogger(DeviceResolver.class);

    private final DeviceManagementClient mdm;
    private final DeviceFilterParser     parser;

    public DeviceResolver(DeviceManagementClient mdm, DeviceFilterParser parser) {
        this.mdm    = mdm;
        this.parser = parser;
    }

    public List<Device> resolve(UUID scheduleId, String rawFilter) {
        try {
            Optional<DeviceFilter> filter = parser.parse(rawFilter);
            List<Device> directory = mdm.listDevices();
            if (filter.isEmpty()) {
                return directory;
            }
            if (filter.get() instanceof DeviceFilter.GroupIds
                    || filter.get() instanceof DeviceFilter.All) {
                log.debug("Schedule {}: groupIds filter is not evaluated, ignoring it", scheduleId);
            }
            List<Device> targets = directory.stream()
                    .filter(filter.get()::matches)
                    .toList();
            log.debug("Schedule {}: filter matched {}/{} devices", scheduleId, targets.size(), directory.size());
            return targets;
        } catch (Exception e) {
            log.warn("Schedule {}: could not resolve target devices, targeting none: {}",
                    scheduleId, e.getMessage());
            return List.of();
        }
    }
}
