package com.spendradar.categorization;

import com.spendradar.domain.Transaction;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vendor phrase → category lookup used by the fuzzy tier. Insertion-ordered so equal-score lookups
 * resolve deterministically. Blank keys and blank categories are never admitted.
 */
public final class VendorMap {

    private static final int MIN_VENDOR_PREFIX_LENGTH = 3;

    private final Map<String, String> entries;

    private VendorMap(Map<String, String> entries) {
        this.entries = entries;
    }

    public static VendorMap empty() {
        return new VendorMap(new LinkedHashMap<>());
    }

    public static VendorMap of(Map<String, String> source) {
        VendorMap map = empty();
        if (source != null) {
            source.forEach(map::put);
        }
        return map;
    }

    /**
     * Builds the map from previously categorized transactions: key is the lower-cased description,
     * kept only when its first three words form something longer than two characters. Later rows win.
     */
    public static VendorMap fromTransactions(Collection<Transaction> transactions) {
        VendorMap map = empty();
        if (transactions == null) {
            return map;
        }
        for (Transaction tx : transactions) {
            if (tx == null || !tx.isCategorized() || tx.getDescription() == null) {
                continue;
            }
            String description = tx.getDescription().strip().toLowerCase(Locale.ROOT);
            String[] words = description.split("\\s+");
            String prefix = String.join(" ", Arrays.copyOf(words, Math.min(3, words.length)));
            if (prefix.length() >= MIN_VENDOR_PREFIX_LENGTH) {
                map.put(description, tx.getCategory());
            }
        }
        return map;
    }

    /**
     * Adds or replaces a mapping. Returns false when key or category is blank.
     */
    public boolean put(String vendor, String category) {
        if (vendor == null || vendor.isBlank() || category == null || category.isBlank()) {
            return false;
        }
        entries.put(vendor.strip(), category.strip());
        return true;
    }

    public Optional<String> get(String vendor) {
        return Optional.ofNullable(vendor == null ? null : entries.get(vendor));
    }

    public boolean containsVendor(String vendor) {
        return vendor != null && entries.containsKey(vendor);
    }

    public Set<String> vendors() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public VendorMap copy() {
        return new VendorMap(new LinkedHashMap<>(entries));
    }
}
