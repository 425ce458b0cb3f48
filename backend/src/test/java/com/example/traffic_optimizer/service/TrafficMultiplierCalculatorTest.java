package com.example.traffic_optimizer.service;

import com.example.traffic_optimizer.entity.RegionDataSet;
import com.example.traffic_optimizer.entity.enumclass.ConstructionStatus;
import com.example.traffic_optimizer.repository.RegionFixtures;
import com.example.traffic_optimizer.repository.RegionProfileStore;
import com.example.traffic_optimizer.service.dto.TrafficMultiplierResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.traffic_optimizer.repository.RegionFixtures.TEST_CITY;
import static com.example.traffic_optimizer.repository.RegionFixtures.construction;
import static com.example.traffic_optimizer.repository.RegionFixtures.festival;
import static com.example.traffic_optimizer.repository.RegionFixtures.testCity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrafficMultiplierCalculatorTest {

    private static final int WEDNESDAY = 3;
    private static final int SATURDAY = 6;
    private static final int SUNDAY = 0;

    private final RegionProfileStore store = RegionFixtures.storeOf(testCity());
    private final TrafficMultiplierCalculator calculator =
            new TrafficMultiplierCalculator(RegionFixtures.registryOf(store));

    @Test
    void weekdayMorningPeak_appliesSeverity() {
        TrafficMultiplierResult result = calculator.computeMultiplier(TEST_CITY, 9, WEDNESDAY, 3);

        assertThat(result.getMultiplier()).isEqualTo(1.9);
        assertThat(result.getContributingFactors()).containsExactly("Morning peak hour");
        assertThat(result.isCityDataAvailable()).isTrue();
    }

    @Test
    void peakWindowIsClosedInterval() {
        assertThat(calculator.computeMultiplier(TEST_CITY, 8, WEDNESDAY, 3).getMultiplier()).isEqualTo(1.9);
        assertThat(calculator.computeMultiplier(TEST_CITY, 10, WEDNESDAY, 3).getMultiplier()).isEqualTo(1.9);
        assertThat(calculator.computeMultiplier(TEST_CITY, 11, WEDNESDAY, 3).getMultiplier()).isEqualTo(1.0);
        assertThat(calculator.computeMultiplier(TEST_CITY, 20, WEDNESDAY, 3).getContributingFactors())
                .containsExactly("Evening peak hour");
    }

    @Test
    void saturdayMorningPeak_stacksWeekendDiscount() {
        // 1.9 × 0.7 = 1.33
        TrafficMultiplierResult result = calculator.computeMultiplier(TEST_CITY, 9, SATURDAY, 3);

        assertThat(result.getMultiplier()).isEqualTo(1.33);
        assertThat(result.getContributingFactors())
                .containsExactly("Morning peak hour", "Weekend - reduced traffic");
    }

    @Test
    void night_appliesDiscount() {
        assertThat(calculator.computeMultiplier(TEST_CITY, 23, WEDNESDAY, 3).getMultiplier()).isEqualTo(0.6);
        assertThat(calculator.computeMultiplier(TEST_CITY, 5, WEDNESDAY, 3).getMultiplier()).isEqualTo(0.6);
        assertThat(calculator.computeMultiplier(TEST_CITY, 6, WEDNESDAY, 3).getMultiplier()).isEqualTo(1.0);
        // 0.6 × 0.7 = 0.42
        assertThat(calculator.computeMultiplier(TEST_CITY, 2, SUNDAY, 3).getMultiplier()).isEqualTo(0.42);
    }

    @Test
    void unknownCity_neverFails() {
        TrafficMultiplierResult result = calculator.computeMultiplier("Atlantis", 9, WEDNESDAY, 3);

        assertThat(result.getMultiplier()).isEqualTo(1.2);
        assertThat(result.getContributingFactors()).containsExactly("no city data");
        assertThat(result.isCityDataAvailable()).isFalse();
    }

    @Test
    void festival_contributesThirtyPercentOfAverageExcess() {
        RegionProfileStore festive = RegionProfileStore.of(RegionDataSet.builder()
                .cities(List.of(testCity()))
                .festivals(List.of(festival("Diwali", 2.0, 10, 11), festival("Durga Puja", 3.0, 9, 10)))
                .build());

        // 평균 2.5 → 1 + 1.5 × 0.3 = 1.45
        TrafficMultiplierResult result = calculator.computeMultiplier(festive, TEST_CITY, 13, WEDNESDAY, 10);

        assertThat(result.getMultiplier()).isEqualTo(1.45);
        assertThat(result.getContributingFactors()).containsExactly("Festival season: Diwali, Durga Puja");
    }

    @Test
    void festival_lookAheadFromPreviousMonth() {
        RegionProfileStore festive = RegionProfileStore.of(RegionDataSet.builder()
                .cities(List.of(testCity()))
                .festivals(List.of(festival("Diwali", 2.0, 11)))
                .build());

        assertThat(calculator.computeMultiplier(festive, TEST_CITY, 13, WEDNESDAY, 10).getMultiplier()).isEqualTo(1.3);
        assertThat(calculator.computeMultiplier(festive, TEST_CITY, 13, WEDNESDAY, 9).getMultiplier()).isEqualTo(1.0);
    }

    @Test
    void construction_appliesOnlyAboveTenMinuteAverage() {
        RegionProfileStore heavy = RegionProfileStore.of(RegionDataSet.builder()
                .cities(List.of(testCity()))
                .constructionZones(List.of(
                        construction("c1", TEST_CITY, "Ring Road", ConstructionStatus.ACTIVE, 15, List.of()),
                        construction("c2", TEST_CITY, "Lake Road", ConstructionStatus.DELAYED, 20, List.of()),
                        construction("c3", TEST_CITY, "Old Bridge", ConstructionStatus.COMPLETED, 0, List.of())))
                .build());
        RegionProfileStore light = RegionProfileStore.of(RegionDataSet.builder()
                .cities(List.of(testCity()))
                .constructionZones(List.of(
                        construction("c1", TEST_CITY, "Ring Road", ConstructionStatus.ACTIVE, 10, List.of())))
                .build());

        TrafficMultiplierResult heavyResult = calculator.computeMultiplier(heavy, TEST_CITY, 13, WEDNESDAY, 3);
        assertThat(heavyResult.getMultiplier()).isEqualTo(1.15);
        assertThat(heavyResult.getContributingFactors()).containsExactly("Active construction: Ring Road, Lake Road");

        assertThat(calculator.computeMultiplier(light, TEST_CITY, 13, WEDNESDAY, 3).getMultiplier()).isEqualTo(1.0);
    }

    @Test
    void factorsRecordedInApplicationOrder() {
        RegionProfileStore all = RegionProfileStore.of(RegionDataSet.builder()
                .cities(List.of(testCity()))
                .festivals(List.of(festival("Holi", 2.0, 3)))
                .constructionZones(List.of(
                        construction("c1", TEST_CITY, "Ring Road", ConstructionStatus.ACTIVE, 30, List.of())))
                .build());

        TrafficMultiplierResult result = calculator.computeMultiplier(all, TEST_CITY, 18, SATURDAY, 3);

        assertThat(result.getContributingFactors()).containsExactly(
                "Evening peak hour", "Weekend - reduced traffic", "Festival season: Holi", "Active construction: Ring Road");
        // 2.0 × 0.7 × 1.3 × 1.15 = 2.093
        assertThat(result.getMultiplier()).isEqualTo(2.09);
    }

    @Test
    void sameInputs_sameOutput() {
        TrafficMultiplierResult first = calculator.computeMultiplier(TEST_CITY, 18, WEDNESDAY, 7);
        TrafficMultiplierResult second = calculator.computeMultiplier(TEST_CITY, 18, WEDNESDAY, 7);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void outOfRangeArguments_rejected() {
        assertThatThrownBy(() -> calculator.computeMultiplier(TEST_CITY, 24, WEDNESDAY, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.computeMultiplier(TEST_CITY, 9, 7, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.computeMultiplier(TEST_CITY, 9, WEDNESDAY, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
