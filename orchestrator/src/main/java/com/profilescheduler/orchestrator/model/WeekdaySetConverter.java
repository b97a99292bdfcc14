package com.profilescheduler.orchestrator.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Maps the recurrence_days column ("1,3,5") to a sorted set of weekday
 * indices, 0 = Sunday … 6 = Saturday. Entries outside 0..6 are dropped.
 */
@Converter
public class WeekdaySetConverter implements AttributeConverter<Set<Integer>, String> {

    @Override
    public String convertToDatabaseColumn(Set<Integer> days) {
        if (days == null || days.isEmpty()) return null;
        return new TreeSet<>(days).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<Integer> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return Collections.emptySortedSet();
        SortedSet<Integer> days = new TreeSet<>();
        Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(s -> s.matches("\\d+"))
                .map(Integer::valueOf)
                .filter(d -> d >= 0 && d <= 6)
                .forEach(days::add);
        return Collections.unmodifiableSortedSet(days);
    }
}
