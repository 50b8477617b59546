package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.ClusteredRest;
import fr.lapetina.ultra.comparison.domain.model.Confidence;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RestEvent;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.lapetina.ultra.comparison.pipeline.stages.TestAnalyses.rest;
import static fr.lapetina.ultra.comparison.pipeline.stages.TestAnalyses.withRests;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RestPeriodClustererTest {

    private RestPeriodClusterer clusterer;

    @BeforeEach
    void setUp() {
        clusterer = new RestPeriodClusterer();
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("should merge nearby rests at the same aid station")
        void shouldMergeNearbyRestsAtSameStation() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(77.3, "Whiskey Row", Confidence.HIGH, 25.0)),
                    withRests("Y", rest(79.0, "Whiskey Row", Confidence.MEDIUM, 0.0))
            ));

            assertThat(clusters).hasSize(1);
            RestCluster cluster = clusters.get(0);
            assertThat(cluster.meanMile()).isCloseTo(78.15, within(1e-9));
            assertThat(cluster.aidStation()).isEqualTo("Whiskey Row");
            assertThat(cluster.membersFor("X")).hasSize(1);
            assertThat(cluster.membersFor("Y")).hasSize(1);
        }

        @Test
        @DisplayName("should keep rests at different aid stations apart even at the same mile")
        void shouldSeparateDifferentStations() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(50.0, "Crown King")),
                    withRests("Y", rest(50.5, "Lane Mountain"))
            ));

            assertThat(clusters).hasSize(2);
        }

        @Test
        @DisplayName("should split rests further apart than the threshold")
        void shouldSplitDistantRests() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(20.0, "Camp")),
                    withRests("Y", rest(25.1, "Camp"))
            ));

            assertThat(clusters).hasSize(2);
        }

        @Test
        @DisplayName("should include a rest exactly at the threshold")
        void shouldIncludeRestAtThreshold() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(20.0, "Camp")),
                    withRests("Y", rest(25.0, "Camp"))
            ));

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).meanMile()).isEqualTo(22.5);
        }

        @Test
        @DisplayName("should group unnamed rests under the unknown identity")
        void shouldGroupUnnamedRests() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(30.0, null)),
                    withRests("Y", rest(31.0, null)),
                    withRests("Z", rest(30.5, "Camp"))
            ));

            assertThat(clusters).hasSize(2);
            assertThat(clusters).extracting(RestCluster::aidStation)
                    .containsExactlyInAnyOrder(RestEvent.UNKNOWN_AID_STATION, "Camp");
        }

        @Test
        @DisplayName("should skip rests without a mile")
        void shouldSkipRestsWithoutMile() {
            RestEvent noMile = RestEvent.builder().nearbyAidStation("Camp").build();

            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", noMile, rest(12.0, "Camp"))
            ));

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).members()).hasSize(1);
        }

        @Test
        @DisplayName("should return no clusters when nobody rested")
        void shouldReturnEmptyWithoutRests() {
            assertThat(clusterer.cluster(List.of(withRests("X"), RunnerAnalysis.absent("Y")))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should sort clusters by mean mile")
        void shouldSortByMeanMile() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(90.0, "Finish"), rest(10.0, "Start")),
                    withRests("Y", rest(50.0, "Middle"))
            ));

            assertThat(clusters).extracting(RestCluster::meanMile).containsExactly(10.0, 50.0, 90.0);
        }

        @Test
        @DisplayName("should place events by the running mean at the time they are processed")
        void shouldUseRunningMean() {
            // 0 and 4 merge (mean 2); 8 is then 6 miles from the mean although only 4 from mile 4
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(8.0, "Camp")),
                    withRests("Y", rest(4.0, "Camp")),
                    withRests("Z", rest(0.0001, "Camp"))
            ));

            assertThat(clusters).hasSize(2);
            assertThat(clusters.get(0).members()).extracting(ClusteredRest::runnerId)
                    .containsExactly("Z", "Y");
            assertThat(clusters.get(1).members()).extracting(ClusteredRest::runnerId)
                    .containsExactly("X");
        }

        @Test
        @DisplayName("should produce identical clusters on repeated runs")
        void shouldBeDeterministic() {
            List<RunnerAnalysis> runners = List.of(
                    withRests("X", rest(77.3, "Whiskey Row"), rest(120.0, "Finish")),
                    withRests("Y", rest(79.0, "Whiskey Row"), rest(118.0, "Finish")),
                    withRests("Z", rest(78.0, "Whiskey Row"))
            );

            assertThat(clusterer.cluster(runners)).isEqualTo(clusterer.cluster(runners));
        }

        @Test
        @DisplayName("should number encounters in selection then event order")
        void shouldNumberEncounters() {
            List<RestCluster> clusters = clusterer.cluster(List.of(
                    withRests("X", rest(10.0, "A"), rest(40.0, "B")),
                    withRests("Y", rest(20.0, "C"))
            ));

            assertThat(clusters).flatExtracting(RestCluster::members)
                    .extracting(ClusteredRest::encounterIndex)
                    .containsExactly(0, 2, 1);
        }
    }

    @Test
    @DisplayName("should honour a configured threshold")
    void shouldHonourConfiguredThreshold() {
        RestPeriodClusterer strict = new RestPeriodClusterer(1.0);

        List<RestCluster> clusters = strict.cluster(List.of(
                withRests("X", rest(77.3, "Whiskey Row")),
                withRests("Y", rest(79.0, "Whiskey Row"))
        ));

        assertThat(clusters).hasSize(2);
    }

    @Test
    @DisplayName("should reject a non-positive threshold")
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new RestPeriodClusterer(0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RestPeriodClusterer(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
