package com.spendradar.session;

import com.spendradar.categorization.VendorMap;
import com.spendradar.domain.MappingRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule list, vendor map and closed category list captured for one categorization session.
 * Arbitration reads one consistent snapshot; confirmed corrections swap in the learner's output.
 */
public final class CategorizationSession {

    private final Instant openedAt;
    private volatile Snapshot snapshot;

    public CategorizationSession(List<MappingRule> rules, VendorMap vendorMap, List<String> categories) {
        this.openedAt = Instant.now();
        this.snapshot = new Snapshot(copy(rules), vendorMap == null ? VendorMap.empty() : vendorMap.copy(), copy(categories));
    }

    /**
     * Rules, vendor map and categories as one consistent triple. The vendor map must not be mutated.
     */
    public Snapshot snapshot() {
        return snapshot;
    }

    public List<MappingRule> rules() {
        return snapshot.rules();
    }

    public VendorMap vendorMap() {
        return snapshot.vendorMap();
    }

    public List<String> categories() {
        return snapshot.categories();
    }

    public Instant openedAt() {
        return openedAt;
    }

    /**
     * Publishes new rule and vendor tables after a learning event. A confirmed category that was not yet
     * in the closed list joins it.
     */
    public synchronized void replace(List<MappingRule> rules, VendorMap vendorMap, String confirmedCategory) {
        List<String> categories = snapshot.categories();
        if (confirmedCategory != null && !confirmedCategory.isBlank() && !categories.contains(confirmedCategory.strip())) {
            List<String> extended = new ArrayList<>(categories);
            extended.add(confirmedCategory.strip());
            categories = extended;
        }
        this.snapshot = new Snapshot(copy(rules), vendorMap.copy(), copy(categories));
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Tables published together.
     */
    public record Snapshot(List<MappingRule> rules, VendorMap vendorMap, List<String> categories) {
    }
}
