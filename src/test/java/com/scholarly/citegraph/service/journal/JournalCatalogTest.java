package com.scholarly.citegraph.service.journal;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JournalCatalogTest {

    private final JournalCatalog catalog = new JournalCatalog(
            Map.of("1476-4687", "Nature",
                    "2041-1723", "Nature Communications",
                    "2399-3650", "Communications Physics"),
            Map.of("1476-4687", "10.1038/",
                    "2041-1723", "10.1038/s41467-",
                    "2399-3650", "10.1038/s42005-"));

    @Test
    void matchesEveryJournalWhosePrefixFits() {
        assertThat(catalog.issnsForIdentifier("10.1038/s41467-020-1"))
                .containsExactly("1476-4687", "2041-1723");
        assertThat(catalog.issnsForIdentifier("10.1126/science.1")).isEmpty();
        assertThat(catalog.issnsForIdentifier(null)).isEmpty();
    }

    @Test
    void namesJournalByLongestPrefix() {
        assertThat(catalog.journalNameForIdentifier("10.1038/s41467-020-1")).contains("Nature Communications");
        assertThat(catalog.journalNameForIdentifier("10.1038/nature123")).contains("Nature");
        assertThat(catalog.journalNameForIdentifier("10.1103/PhysRevLett.1")).isEmpty();
    }

    @Test
    void overlaysComputedPrefixes() {
        JournalCatalog updated = catalog.withDoiPrefixes(Map.of("2399-3650", "10.1038/s42005-02", "0031-9007", "10.1103/PhysRevLett."));

        assertThat(updated.doiPrefix("2399-3650")).contains("10.1038/s42005-02");
        assertThat(updated.doiPrefix("0031-9007")).contains("10.1103/PhysRevLett.");
        assertThat(updated.knownIssns()).contains("0031-9007", "1476-4687");
        assertThat(catalog.doiPrefix("0031-9007")).isEmpty();
    }

    @Test
    void dropsNullAndBlankEntries() {
        Map<String, String> names = new HashMap<>();
        names.put("2399-3650", null);
        names.put("0036-8075", "Science");
        names.put(" ", "Blank");

        JournalCatalog partial = new JournalCatalog(names, Map.of());
        Map<String, String> overrides = new HashMap<>();
        overrides.put("2399-3650", null);

        assertThat(partial.knownIssns()).containsExactly("0036-8075");
        assertThat(catalog.withDoiPrefixes(overrides).doiPrefix("2399-3650")).contains("10.1038/s42005-");
    }
}
