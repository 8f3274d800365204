package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.model.HousekeepingFact;
import com.propertyintel.housekeeping.model.RotationQuality;
import com.propertyintel.housekeeping.model.RotationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Scores how well each username rotates through rooms instead of re-working the same ones.
 *
 * Uniqueness rate (distinct rooms / actions) drives the quality band and the callouts.
 * Randomness (1 - Herfindahl index of the room-visit shares) rewards an even spread
 * and is ranked separately; neither metric replaces the other.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RotationScorer {

    /** Worst rotation first; among equal rates the user with more volume surfaces first. */
    static final Comparator<RotationRecord> WORST_ROTATION_FIRST = Comparator
            .comparingDouble(RotationRecord::getRoomUniquenessRate)
            .thenComparing(Comparator.comparingLong(RotationRecord::getTotalActions).reversed())
            .thenComparing(RotationRecord::getUsername);

    private final HousekeepingReportProperties properties;

    public List<RotationRecord> score(List<HousekeepingFact> facts) {
        Map<String, List<HousekeepingFact>> byUser = facts.stream()
                .collect(Collectors.groupingBy(f -> f.getRow().getUsername(), LinkedHashMap::new, Collectors.toList()));

        List<RotationRecord> unranked = new ArrayList<>();
        byUser.forEach((username, actions) -> unranked.add(scoreUser(username, actions)));

        Map<Double, Integer> ranks = denseRanks(unranked);

        List<RotationRecord> records = unranked.stream()
                .map(r -> r.toBuilder().roomRandomnessRank(ranks.get(r.getRoomRandomness())).build())
                .sorted(WORST_ROTATION_FIRST)
                .toList();

        log.info("Scored room rotation for {} usernames", records.size());
        return records;
    }

    /**
     * Users worth a human look: at least the configured number of actions,
     * worst rotation first, capped at the configured callout size.
     */
    public List<RotationRecord> callouts(List<RotationRecord> records) {
        HousekeepingReportProperties.Rotation cfg = properties.getRotation();
        return records.stream()
                .filter(r -> r.getTotalActions() >= cfg.getCalloutMinActions())
                .sorted(WORST_ROTATION_FIRST)
                .limit(Math.max(0, cfg.getCalloutLimit()))
                .toList();
    }

    public RotationQuality classify(double rate) {
        HousekeepingReportProperties.Rotation cfg = properties.getRotation();
        if (rate < cfg.getVeryLowUpper()) return RotationQuality.VERY_LOW;
        if (rate < cfg.getLowUpper()) return RotationQuality.LOW;
        if (rate < cfg.getModerateUpper()) return RotationQuality.MODERATE;
        return RotationQuality.HIGH;
    }

    /** 1 - sum over rooms of (visits / total)^2; 0 when there are no actions. */
    static double randomness(Map<String, Long> visitsPerRoom, long totalActions) {
        if (totalActions == 0) return 0.0;
        double herfindahl = 0.0;
        for (long visits : visitsPerRoom.values()) {
            double share = (double) visits / totalActions;
            herfindahl += share * share;
        }
        return Math.min(1.0, Math.max(0.0, 1.0 - herfindahl));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RotationRecord scoreUser(String username, List<HousekeepingFact> actions) {
        Map<String, Long> visits = new HashMap<>();
        long changes = 0;
        for (HousekeepingFact f : actions) {
            visits.merge(f.roomNumber(), 1L, Long::sum);
            if (f.isChanged()) changes++;
        }

        long total = actions.size();
        double rate = total == 0 ? 0.0 : (double) visits.size() / total;

        // bands apply to the exact rate; only the stored value is rounded
        return RotationRecord.builder()
                .username(username)
                .totalActions(total)
                .uniqueRooms(visits.size())
                .statusChanges(changes)
                .roomUniquenessRate(Numbers.round(rate, 3))
                .rotationQuality(classify(rate))
                .roomRandomness(Numbers.round(randomness(visits, total), 4))
                .build();
    }

    /** Distinct randomness values ranked high to low, 1-indexed, ties share a rank. */
    private Map<Double, Integer> denseRanks(List<RotationRecord> records) {
        TreeSet<Double> distinct = records.stream()
                .map(RotationRecord::getRoomRandomness)
                .collect(Collectors.toCollection(TreeSet::new));

        Map<Double, Integer> ranks = new HashMap<>();
        int rank = 1;
        for (Double value : distinct.descendingSet()) {
            ranks.put(value, rank++);
        }
        return ranks;
    }
}
