package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.model.FeatureFact;
import com.propertyintel.housekeeping.model.NightsSummary;
import com.propertyintel.housekeeping.model.RoomNights;
import com.propertyintel.housekeeping.model.RoomUsageFact;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Nights rolled up by room type, by feature token and by room.
 */
@Component
public class RoomUsageAggregator {

    static final Comparator<NightsSummary> MOST_NIGHTS = Comparator
            .comparingDouble(NightsSummary::getTotalNights).reversed()
            .thenComparing(Comparator.comparingLong(NightsSummary::getCount).reversed())
            .thenComparing(NightsSummary::getKey);

    public List<NightsSummary> byRoomType(List<RoomUsageFact> facts) {
        return summarize(facts, RoomUsageFact::roomType, RoomUsageFact::roomNumber, RoomUsageFact::getNights)
                .stream().sorted(MOST_NIGHTS).toList();
    }

    public List<NightsSummary> byFeature(List<FeatureFact> features) {
        return summarize(features, FeatureFact::feature, FeatureFact::roomNumber, FeatureFact::nights)
                .stream().sorted(MOST_NIGHTS).toList();
    }

    /** Features with the most nights; equal totals keep first-seen order. */
    public List<NightsSummary> topFeatures(List<FeatureFact> features, int n) {
        return summarize(features, FeatureFact::feature, FeatureFact::roomNumber, FeatureFact::nights)
                .stream()
                .sorted(Comparator.comparingDouble(NightsSummary::getTotalNights).reversed())
                .limit(Math.max(1, n))
                .toList();
    }

    /** One entry per Room Number in first-seen order. */
    public List<RoomNights> byRoom(List<RoomUsageFact> facts) {
        Map<String, List<RoomUsageFact>> rooms = facts.stream()
                .collect(Collectors.groupingBy(RoomUsageFact::roomNumber, LinkedHashMap::new, Collectors.toList()));

        return rooms.entrySet().stream()
                .map(e -> new RoomNights(
                        e.getKey(),
                        e.getValue().get(0).roomType(),
                        e.getValue().size(),
                        e.getValue().stream().mapToDouble(RoomUsageFact::getNights).sum()))
                .toList();
    }

    /** Rooms with the most nights; equal totals keep first-seen order. */
    public List<RoomNights> topRooms(List<RoomUsageFact> facts, int n) {
        return byRoom(facts).stream()
                .sorted(Comparator.comparingDouble(RoomNights::getTotalNights).reversed())
                .limit(Math.max(1, n))
                .toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> List<NightsSummary> summarize(List<T> items,
                                              Function<T, String> key,
                                              Function<T, String> room,
                                              ToDoubleFunction<T> nights) {
        Map<String, List<T>> groups = items.stream()
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.toList()));

        return groups.entrySet().stream()
                .map(e -> {
                    Set<String> rooms = new HashSet<>();
                    double total = 0;
                    for (T item : e.getValue()) {
                        rooms.add(room.apply(item));
                        total += nights.applyAsDouble(item);
                    }
                    return new NightsSummary(e.getKey(), e.getValue().size(), rooms.size(),
                            Numbers.round(total, 4), Numbers.ratio(total, rooms.size(), 2));
                })
                .toList();
    }
}
