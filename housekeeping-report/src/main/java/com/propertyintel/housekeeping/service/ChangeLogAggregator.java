package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.model.ChangeSummary;
import com.propertyintel.housekeeping.model.HousekeepingFact;
import com.propertyintel.housekeeping.model.TransitionMatrix;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grouped views over housekeeping facts. Every view is a partition of the fact
 * table: group row counts always add up to the number of facts.
 */
@Component
public class ChangeLogAggregator {

    /** Group key for facts whose Date could not be read. Sorts after every real day. */
    public static final String UNPARSED_DAY = "(unparsed)";

    static final Comparator<ChangeSummary> MOST_CHANGED = Comparator
            .comparingLong(ChangeSummary::getChanged).reversed()
            .thenComparing(Comparator.comparingLong(ChangeSummary::getRows).reversed())
            .thenComparing(ChangeSummary::getKey);

    static final Comparator<ChangeSummary> MOST_ACTIVE = Comparator
            .comparingLong(ChangeSummary::getRows).reversed()
            .thenComparing(Comparator.comparingLong(ChangeSummary::getChanged).reversed())
            .thenComparing(ChangeSummary::getKey);

    /** Chronological, unreadable dates last. */
    public List<ChangeSummary> byDay(List<HousekeepingFact> facts) {
        Map<LocalDate, List<HousekeepingFact>> days = new TreeMap<>();
        List<HousekeepingFact> unparsed = new ArrayList<>();
        for (HousekeepingFact f : facts) {
            f.day().ifPresentOrElse(
                    d -> days.computeIfAbsent(d, k -> new ArrayList<>()).add(f),
                    () -> unparsed.add(f));
        }

        List<ChangeSummary> result = new ArrayList<>();
        days.forEach((day, group) -> result.add(summarize(day.toString(), group)));
        if (!unparsed.isEmpty()) {
            result.add(summarize(UNPARSED_DAY, unparsed));
        }
        return List.copyOf(result);
    }

    /** Most changed room types first, ties broken by volume. */
    public List<ChangeSummary> byRoomType(List<HousekeepingFact> facts) {
        return group(facts, f -> f.getRow().getRoomType(), MOST_CHANGED);
    }

    /** Grouped by Housekeeper After, the person who closed the change. */
    public List<ChangeSummary> byClosingHousekeeper(List<HousekeepingFact> facts) {
        return group(facts, f -> f.getRow().getHousekeeperAfter(), MOST_CHANGED);
    }

    /** Most active usernames first. */
    public List<ChangeSummary> byUsername(List<HousekeepingFact> facts) {
        return group(facts, f -> f.getRow().getUsername(), MOST_ACTIVE);
    }

    public TransitionMatrix transitionMatrix(List<HousekeepingFact> facts) {
        Set<String> before = new TreeSet<>();
        Set<String> after = new TreeSet<>();
        Map<String, Map<String, Long>> counts = new TreeMap<>();

        for (HousekeepingFact f : facts) {
            String b = f.getRow().getHskStatusBefore();
            String a = f.getRow().getHskStatusAfter();
            before.add(b);
            after.add(a);
            counts.computeIfAbsent(b, k -> new TreeMap<>()).merge(a, 1L, Long::sum);
        }
        return new TransitionMatrix(List.copyOf(before), List.copyOf(after), counts);
    }

    /** Transition labels of rows that actually changed status, most frequent first. */
    public Map<String, Long> changedTransitions(List<HousekeepingFact> facts) {
        Map<String, Long> counts = facts.stream()
                .filter(HousekeepingFact::isChanged)
                .collect(Collectors.groupingBy(HousekeepingFact::getTransition, TreeMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (x, y) -> x, LinkedHashMap::new));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ChangeSummary> group(List<HousekeepingFact> facts,
                                      Function<HousekeepingFact, String> key,
                                      Comparator<ChangeSummary> order) {
        Map<String, List<HousekeepingFact>> groups = facts.stream()
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.toList()));

        return groups.entrySet().stream()
                .map(e -> summarize(e.getKey(), e.getValue()))
                .sorted(order)
                .toList();
    }

    private ChangeSummary summarize(String key, List<HousekeepingFact> group) {
        Set<String> rooms = new HashSet<>();
        long changed = 0;
        for (HousekeepingFact f : group) {
            rooms.add(f.roomNumber());
            if (f.isChanged()) changed++;
        }
        return new ChangeSummary(key, group.size(), rooms.size(), changed,
                Numbers.ratio(changed, group.size(), 4));
    }
}
