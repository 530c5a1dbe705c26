package org.metalineage.pipeline.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.consensus.ConsensusSettings;
import org.metalineage.pipeline.consensus.LineageConsensusEngine;
import org.metalineage.pipeline.taxonomy.Rank;
import org.metalineage.pipeline.taxonomy.TestTaxonomy;

@Tag("unit")
class ProfileAggregatorTest {

    private List<ClassificationResult> results;

    @BeforeEach
    void setUp() {
        LineageConsensusEngine engine = new LineageConsensusEngine(TestTaxonomy.ncbiLike(), ConsensusSettings.DEFAULTS);
        results = List.of(
                engine.assign("q1", 562, 0.9),
                engine.assign("q2", 511145, 0.8),
                engine.assign("q3", 543, 0.5),
                engine.assign("q4", 1423, 0.7),
                ClassificationResult.unclassified("q5"));
    }

    private static Map<Rank, Double> totalsByRank(List<ProfileEntry> entries) {
        Map<Rank, Double> totals = new EnumMap<>(Rank.class);
        for (ProfileEntry entry : entries) {
            totals.merge(entry.rank(), entry.percentage(), Double::sum);
        }
        return totals;
    }

    private static ProfileEntry entry(List<ProfileEntry> entries, Rank rank, int taxid) {
        return entries.stream().filter(e -> e.rank() == rank && e.taxid() == taxid).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Percentages are relative to all queries by default")
    void percentagesOverAllQueries() {
        List<ProfileEntry> profile = new ProfileAggregator(false).aggregate(results);

        assertThat(entry(profile, Rank.SUPERKINGDOM, 2).percentage()).isCloseTo(80.0, within(1e-9));
        assertThat(entry(profile, Rank.FAMILY, 543).percentage()).isCloseTo(60.0, within(1e-9));
        assertThat(entry(profile, Rank.SPECIES, 562).percentage()).isCloseTo(40.0, within(1e-9));
        assertThat(entry(profile, Rank.SPECIES, 1423).percentage()).isCloseTo(20.0, within(1e-9));
        assertThat(totalsByRank(profile).get(Rank.SPECIES)).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void strainAssignmentsCountTowardTheirSpecies() {
        List<ProfileEntry> profile = new ProfileAggregator(false).aggregate(results);

        assertThat(profile).noneMatch(e -> e.rank() == Rank.STRAIN);
        assertThat(entry(profile, Rank.GENUS, 561).percentage()).isCloseTo(40.0, within(1e-9));
    }

    @Test
    void pathsSkipRanksMissingFromTheLineage() {
        List<ProfileEntry> profile = new ProfileAggregator(false).aggregate(results);

        ProfileEntry bacillus = entry(profile, Rank.GENUS, 1386);
        assertThat(bacillus.taxPath()).isEqualTo("2|1239|1386");
        assertThat(bacillus.taxPathSn()).isEqualTo("Bacteria|Firmicutes|Bacillus");
        assertThat(profile).noneMatch(e -> e.rank() == Rank.CLASS && e.taxid() == 1239);
    }

    @Test
    void renormalizedRanksSumToHundred() {
        List<ProfileEntry> profile = new ProfileAggregator(true).aggregate(results);

        Map<Rank, Double> totals = totalsByRank(profile);
        for (Rank rank : totals.keySet()) {
            assertThat(totals.get(rank)).isCloseTo(100.0, within(1e-9));
        }
        assertThat(entry(profile, Rank.SPECIES, 562).percentage()).isCloseTo(200.0 / 3, within(1e-9));
    }

    @Test
    void rowsOrderedByRankThenPercentageThenTaxid() {
        List<ProfileEntry> profile = new ProfileAggregator(false).aggregate(results);

        assertThat(profile).extracting(ProfileEntry::rank).isSorted();
        assertThat(profile.stream().filter(e -> e.rank() == Rank.PHYLUM).map(ProfileEntry::taxid))
                .containsExactly(1224, 1239);
    }

    @Test
    void emptyInputGivesEmptyProfile() {
        assertThat(new ProfileAggregator(false).aggregate(List.of())).isEmpty();
        assertThat(new ProfileAggregator(false).aggregate(List.of(ClassificationResult.unclassified("q")))).isEmpty();
    }
}
