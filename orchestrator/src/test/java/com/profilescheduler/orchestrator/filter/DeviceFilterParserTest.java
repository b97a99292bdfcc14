package com.profilescheduler.orchestrator.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceFilterParserTest {

    DeviceFilterParser parser = new DeviceFilterParser(new ObjectMapper());

    @Test
    void blankOrNull_meansNoFilter() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("  ")).isEmpty();
    }

    @Test
    void emptyObject_matchesEverything() {
        assertThat(parser.parse("{}")).contains(DeviceFilter.MATCH_ALL);
    }

    @Test
    void nameContains_caseInsensitiveSubstring() {
        DeviceFilter filter = parser.parse("{\"nameContains\":\"LAB\"}").orElseThrow();

        assertThat(filter).isInstanceOf(DeviceFilter.NameContains.class);
        assertThat(filter.matches(new Device("1", "ipad-lab-04"))).isTrue();
        assertThat(filter.matches(new Device("2", "front-desk"))).isFalse();
        assertThat(filter.matches(new Device("3", null))).isFalse();
    }

    @Test
    void groupIds_acceptedButLetsEveryDeviceThrough() {
        DeviceFilter filter = parser.parse("{\"groupIds\":[12, \"40\"]}").orElseThrow();

        assertThat(filter).isInstanceOf(DeviceFilter.GroupIds.class);
        assertThat(((DeviceFilter.GroupIds) filter).ids()).containsExactlyInAnyOrder("12", "40");
        assertThat(filter.matches(new Device("1", "anything"))).isTrue();
    }

    @Test
    void groupIdsAndName_combineWithAnd() {
        DeviceFilter filter = parser.parse("{\"groupIds\":[1],\"nameContains\":\"mac\"}").orElseThrow();

        assertThat(filter).isInstanceOf(DeviceFilter.All.class);
        assertThat(filter.matches(new Device("1", "MacBook"))).isTrue();
        assertThat(filter.matches(new Device("2", "iPhone"))).isFalse();
    }

    @Test
    void unknownKeys_areIgnored() {
        assertThat(parser.parse("{\"ipRange\":\"10.0.0.0/8\"}")).contains(DeviceFilter.MATCH_ALL);
    }

    @Test
    void invalidJson_isMalformed() {
        assertThatThrownBy(() -> parser.parse("{nameContains: lab"))
                .isInstanceOf(DeviceFilterException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void nonObjectJson_isMalformed() {
        assertThatThrownBy(() -> parser.parse("[\"lab\"]")).isInstanceOf(DeviceFilterException.class);
        assertThatThrownBy(() -> parser.parse("null")).isInstanceOf(DeviceFilterException.class);
    }

    @Test
    void wronglyTypedKeys_areMalformed() {
        assertThatThrownBy(() -> parser.parse("{\"nameContains\":42}"))
                .isInstanceOf(DeviceFilterException.class)
                .hasMessageContaining("nameContains");
        assertThatThrownBy(() -> parser.parse("{\"groupIds\":\"12\"}"))
                .isInstanceOf(DeviceFilterException.class)
                .hasMessageContaining("groupIds");
    }
}
