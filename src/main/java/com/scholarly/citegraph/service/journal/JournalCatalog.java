package com.scholarly.citegraph.service.journal;

import java.util.*;

/**
 * Immutable ISSN lookup tables: journal names and the DOI prefix shared by a journal's articles.
 */
public final class JournalCatalog {

    public static final String UNKNOWN_JOURNAL = "Unknown";

    private final Map<String, String> journalNames;
    private final Map<String, String> doiPrefixes;

    /**
     * Entries with a null or blank ISSN or value are dropped.
     */
    public JournalCatalog(Map<String, String> journalNames, Map<String, String> doiPrefixes) {
        this.journalNames = usable(journalNames);
        this.doiPrefixes = usable(doiPrefixes);
    }

    private static Map<String, String> usable(Map<String, String> table) {
        Map<String, String> kept = new HashMap<>();
        if (table != null) {
            table.forEach((issn, value) -> {
                if (issn != null && !issn.isBlank() && value != null && !value.isBlank()) {
                    kept.put(issn, value);
                }
            });
        }
        return Map.copyOf(kept);
    }

    public static JournalCatalog empty() {
        return new JournalCatalog(Map.of(), Map.of());
    }

    public Optional<String> journalName(String issn) {
        return Optional.ofNullable(journalNames.get(issn));
    }

    public Optional<String> doiPrefix(String issn) {
        return Optional.ofNullable(doiPrefixes.get(issn));
    }

    /**
     * ISSNs whose DOI prefix is a prefix of the given identifier, sorted for stable shard order.
     */
    public List<String> issnsForIdentifier(String id) {
        if (id == null) {
            return List.of();
        }
        List<String> issns = new ArrayList<>();
        for (Map.Entry<String, String> entry : doiPrefixes.entrySet()) {
            if (!entry.getValue().isEmpty() && id.startsWith(entry.getValue())) {
                issns.add(entry.getKey());
            }
        }
        Collections.sort(issns);
        return issns;
    }

    /**
     * Journal name of the longest DOI prefix matching the identifier.
     */
    public Optional<String> journalNameForIdentifier(String id) {
        String bestIssn = null;
        int bestLength = -1;
        for (String issn : issnsForIdentifier(id)) {
            int length = doiPrefixes.get(issn).length();
            if (length > bestLength) {
                bestIssn = issn;
                bestLength = length;
            }
        }
        return bestIssn == null ? Optional.empty() : journalName(bestIssn);
    }

    public Set<String> knownIssns() {
        Set<String> issns = new TreeSet<>(journalNames.keySet());
        issns.addAll(doiPrefixes.keySet());
        return issns;
    }

    /**
     * Copy of this catalog with the given prefixes replacing the configured ones per ISSN.
     */
    public JournalCatalog withDoiPrefixes(Map<String, String> overrides) {
        Map<String, String> merged = new HashMap<>(doiPrefixes);
        merged.putAll(usable(overrides));
        return new JournalCatalog(journalNames, merged);
    }
}
