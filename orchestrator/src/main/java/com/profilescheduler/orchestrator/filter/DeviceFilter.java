package com.profilescheduler.orchestrator.filter;

import com.profilescheduler.orchestrator.mdm.dto.Device;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed form of a schedule's device_filter blob.
 *
 * Variants:
 *   {@link NameContains}  case-insensitive substring on the device name
 *   {@link GroupIds}      group membership; accepted but not evaluated yet
 *   {@link All}           conjunction of the keys present in one blob
 *   {@link MatchAll}      empty blob, selects the whole directory
 */
public interface DeviceFilter {

    boolean matches(Device device);

    DeviceFilter MATCH_ALL = new MatchAll();

    record MatchAll() implements DeviceFilter {
        @Override
        public boolean matches(Device device) { return true; }
    }

    record NameContains(String fragment) implements DeviceFilter {
        @Override
        public boolean matches(Device device) {
            // A device without a name cannot contain the fragment.
            return device.name() != null
                    && device.name().toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Group membership needs a per-group lookup against the device-management
     * API that the engine does not perform, so this predicate lets every
     * device through. Schedules relying on it reach the whole (or name-filtered)
     * directory.
     */
    record GroupIds(Set<String> ids) implements DeviceFilter {
        @Override
        public boolean matches(Device device) { return true; }
    }

    record All(List<DeviceFilter> parts) implements DeviceFilter {
        @Override
        public boolean matches(Device device) {
            return parts.stream().allMatch(p -> p.matches(device));
        }
    }
}
