package dev.sidechain.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-outcome recipient counts for one dispatched event.
 */
public record FanoutReport(String eventId, String type, int recipients, Map<FanoutOutcome, Integer> outcomes) {

    public static FanoutReport of(String eventId, String type, List<FanoutOutcome> results) {
        Map<FanoutOutcome, Integer> counts = new EnumMap<>(FanoutOutcome.class);
        for (FanoutOutcome outcome : FanoutOutcome.values()) {
            counts.put(outcome, 0);
        }
        for (FanoutOutcome result : results) {
            counts.merge(result, 1, Integer::sum);
        }
        return new FanoutReport(eventId, type, results.size(), Collections.unmodifiableMap(counts));
    }

    public int count(FanoutOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }
}
