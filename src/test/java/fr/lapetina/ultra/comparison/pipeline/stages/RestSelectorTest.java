package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.ClusterEntry;
import fr.lapetina.ultra.comparison.domain.model.ClusteredRest;
import fr.lapetina.ultra.comparison.domain.model.Confidence;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RestEvent;
import fr.lapetina.ultra.comparison.domain.model.RestPlaceholder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static fr.lapetina.ultra.comparison.pipeline.stages.TestAnalyses.rest;
import static org.assertj.core.api.Assertions.assertThat;

class RestSelectorTest {

    private RestSelector selector;

    @BeforeEach
    void setUp() {
        selector = new RestSelector();
    }

    private static RestCluster cluster(ClusteredRest... members) {
        double mean = 0.0;
        for (ClusteredRest member : members) {
            mean += member.mile();
        }
        return new RestCluster(members[0].event().aidStationIdentity(), mean / members.length, List.of(members));
    }

    @Nested
    @DisplayName("Representative choice")
    class RepresentativeTests {

        @Test
        @DisplayName("should prefer high confidence regardless of appearance order")
        void shouldPreferHighConfidence() {
            RestEvent low = rest(77.0, "Whiskey Row", Confidence.LOW, 30.0);
            RestEvent high = rest(78.0, "Whiskey Row", Confidence.HIGH, 5.0);

            ClusterEntry lowFirst = selector.select(cluster(
                    new ClusteredRest("Z", low, 0), new ClusteredRest("Z", high, 1)), "Z");
            ClusterEntry highFirst = selector.select(cluster(
                    new ClusteredRest("Z", high, 0), new ClusteredRest("Z", low, 1)), "Z");

            assertThat(lowFirst).isEqualTo(high);
            assertThat(highFirst).isEqualTo(high);
        }

        @Test
        @DisplayName("should prefer the higher rest pace on equal confidence")
        void shouldPreferHigherRestPace() {
            RestEvent slow = rest(40.0, "Camp", Confidence.MEDIUM, 12.0);
            RestEvent stopped = rest(41.0, "Camp", Confidence.MEDIUM, 28.0);

            ClusterEntry selected = selector.select(cluster(
                    new ClusteredRest("Z", slow, 0), new ClusteredRest("Z", stopped, 1)), "Z");

            assertThat(selected).isEqualTo(stopped);
        }

        @Test
        @DisplayName("should prefer the rest closest to the cluster mean on equal confidence and pace")
        void shouldPreferClosestToMean() {
            RestEvent early = rest(10.0, "Camp", Confidence.MEDIUM, 20.0);
            RestEvent late = rest(13.0, "Camp", Confidence.MEDIUM, 20.0);
            RestEvent other = rest(12.0, "Camp", Confidence.MEDIUM, 20.0);

            // mean is 11.67: 13.0 is closer than 10.0
            ClusterEntry selected = selector.select(cluster(
                    new ClusteredRest("Z", early, 0),
                    new ClusteredRest("W", other, 1),
                    new ClusteredRest("Z", late, 2)), "Z");

            assertThat(selected).isEqualTo(late);
        }

        @Test
        @DisplayName("should prefer the lower mile when equally close to the mean")
        void shouldPreferLowerMileOnEqualDistance() {
            RestEvent before = rest(10.0, "Camp", Confidence.MEDIUM, 20.0);
            RestEvent after = rest(12.0, "Camp", Confidence.MEDIUM, 20.0);

            ClusterEntry selected = selector.select(cluster(
                    new ClusteredRest("Z", after, 0), new ClusteredRest("Z", before, 1)), "Z");

            assertThat(selected).isEqualTo(before);
        }

        @Test
        @DisplayName("should return the only rest of a runner unchanged")
        void shouldReturnSingleRest() {
            RestEvent only = rest(60.0, "Camp", Confidence.LOW, 0.0);
            RestEvent other = rest(61.0, "Camp", Confidence.HIGH, 30.0);

            ClusterEntry selected = selector.select(cluster(
                    new ClusteredRest("Z", only, 0), new ClusteredRest("W", other, 1)), "Z");

            assertThat(selected).isSameAs(only);
        }
    }

    @Nested
    @DisplayName("Placeholders")
    class PlaceholderTests {

        @Test
        @DisplayName("should emit a placeholder at the cluster mean for a runner without rest")
        void shouldEmitPlaceholder() {
            RestCluster cluster = cluster(
                    new ClusteredRest("X", rest(77.3, "Whiskey Row"), 0),
                    new ClusteredRest("Y", rest(79.0, "Whiskey Row"), 1));

            ClusterEntry entry = selector.select(cluster, "W");

            assertThat(entry.isPlaceholder()).isTrue();
            RestPlaceholder placeholder = (RestPlaceholder) entry;
            assertThat(placeholder.mile()).isEqualTo(cluster.meanMile());
            assertThat(placeholder.aidStation()).isEqualTo("Whiskey Row");
            assertThat(placeholder.reason()).isEqualTo(RestPlaceholder.NO_REST_DETECTED);
        }

        @Test
        @DisplayName("should name the unknown station when no member has one")
        void shouldUseUnknownStation() {
            RestCluster cluster = cluster(new ClusteredRest("X", rest(30.0, null), 0));

            RestPlaceholder placeholder = (RestPlaceholder) selector.select(cluster, "W");

            assertThat(placeholder.aidStation()).isEqualTo(RestEvent.UNKNOWN_AID_STATION);
        }

        @Test
        @DisplayName("should return exactly one entry per runner")
        void shouldReturnOneEntryPerRunner() {
            RestCluster cluster = cluster(
                    new ClusteredRest("X", rest(77.3, "Whiskey Row"), 0),
                    new ClusteredRest("X", rest(78.3, "Whiskey Row"), 1),
                    new ClusteredRest("Y", rest(79.0, "Whiskey Row"), 2));

            Map<String, ClusterEntry> selected = selector.selectAll(cluster, List.of("X", "Y", "W"));

            assertThat(selected).containsOnlyKeys("X", "Y", "W");
            assertThat(selected.keySet()).containsExactly("X", "Y", "W");
            assertThat(selected.get("X").isPlaceholder()).isFalse();
            assertThat(selected.get("Y").isPlaceholder()).isFalse();
            assertThat(selected.get("W").isPlaceholder()).isTrue();
        }
    }

    @Test
    @DisplayName("should select the same rest for any member order")
    void shouldBeIndependentOfMemberOrder() {
        Random random = new Random(42);
        Confidence[] tiers = Confidence.values();

        for (int round = 0; round < 200; round++) {
            List<ClusteredRest> members = new ArrayList<>();
            int size = 2 + random.nextInt(5);
            for (int i = 0; i < size; i++) {
                RestEvent event = rest(
                        50.0 + random.nextInt(3),
                        "Camp",
                        tiers[random.nextInt(tiers.length)],
                        random.nextInt(3) * 10.0);
                members.add(new ClusteredRest("Z", event, i));
            }

            ClusterEntry expected = selector.select(
                    cluster(members.toArray(new ClusteredRest[0])), "Z");

            for (int shuffle = 0; shuffle < 5; shuffle++) {
                List<ClusteredRest> reordered = new ArrayList<>(members);
                Collections.shuffle(reordered, random);
                ClusterEntry selected = selector.select(
                        cluster(reordered.toArray(new ClusteredRest[0])), "Z");
                assertThat(selected).isEqualTo(expected);
            }
        }
    }

    @Test
    @DisplayName("should order any two distinct members strictly and antisymmetrically")
    void shouldOrderMembersTotally() {
        double mean = 50.0;
        List<ClusteredRest> members = new ArrayList<>();
        int index = 0;
        // every (confidence, pace, mile) triple twice, so only the encounter index separates the copies
        for (int copy = 0; copy < 2; copy++) {
            for (Confidence confidence : Confidence.values()) {
                for (double pace : new double[]{0.0, 10.0, 20.0}) {
                    for (double mile : new double[]{48.0, 49.5, 50.5, 52.0}) {
                        members.add(new ClusteredRest("Z", rest(mile, "Camp", confidence, pace), index++));
                    }
                }
            }
        }

        Comparator<ClusteredRest> preference = RestSelector.preference(mean);

        for (ClusteredRest a : members) {
            assertThat(preference.compare(a, a)).isZero();
            for (ClusteredRest b : members) {
                if (a == b) {
                    continue;
                }
                int ab = Integer.signum(preference.compare(a, b));
                int ba = Integer.signum(preference.compare(b, a));
                assertThat(ab).as("%s vs %s", a, b).isNotZero();
                assertThat(ab).as("%s vs %s", a, b).isEqualTo(-ba);
            }
        }
    }
}
