package com.cloud.costspike.engine;

import com.cloud.costspike.model.CostRecord;
import com.cloud.costspike.model.FeaturizedRecord;
import com.cloud.costspike.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureBuilderTest {

    private final FeatureBuilder builder = new FeatureBuilder(7, 3);

    @Test
    void build_calendarFeatures_mondayIsZero() {
        List<CostRecord> records = List.of(
                TestDataFactory.createRecord("EC2", LocalDate.of(2025, 1, 1), 1),   // Wednesday
                TestDataFactory.createRecord("EC2", LocalDate.of(2025, 1, 5), 1),   // Sunday
                TestDataFactory.createRecord("EC2", LocalDate.of(2025, 1, 6), 1));  // Monday

        List<FeaturizedRecord> out = builder.build(records);

        assertThat(out).extracting(FeaturizedRecord::getDayOfWeek).containsExactly(2, 6, 0);
        assertThat(out).extracting(FeaturizedRecord::getDayOfMonth).containsExactly(1, 5, 6);
        assertThat(out).extracting(FeaturizedRecord::getMonth).containsExactly(1, 1, 1);
    }

    @Test
    void build_rollingStats_undefinedUntilThreeObservations() {
        List<FeaturizedRecord> out = builder.build(TestDataFactory.createSeries("EC2", 10, 20, 30, 40));

        assertThat(out.get(0).getRollingMean7()).isNull();
        assertThat(out.get(1).getRollingMean7()).isNull();
        assertThat(out.get(1).getRollingStd7()).isNull();
        assertThat(out.get(0).getCostVsRollMean()).isEqualTo(0.0);
        assertThat(out.get(1).getRollStdFilled()).isEqualTo(0.0);

        assertThat(out.get(2).getRollingMean7()).isCloseTo(20.0, within(1e-12));
        assertThat(out.get(2).getRollingStd7()).isCloseTo(10.0, within(1e-12));
        assertThat(out.get(2).getCostVsRollMean()).isCloseTo(10.0, within(1e-12));

        assertThat(out.get(3).getRollingMean7()).isCloseTo(25.0, within(1e-12));
        assertThat(out.get(3).getRollingStd7()).isCloseTo(Math.sqrt(500.0 / 3.0), within(1e-12));
        assertThat(out.get(3).getRollStdFilled()).isEqualTo(out.get(3).getRollingStd7());
    }

    @Test
    void build_rollingWindow_countsRowsNotCalendarDays() {
        // Nine rows with large date gaps; the window for the last one is rows 3..9
        List<CostRecord> records = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            records.add(TestDataFactory.createRecord("EC2", LocalDate.of(2025, 1, 1).plusDays(i * 10L), i));
        }

        List<FeaturizedRecord> out = builder.build(records);

        assertThat(out.get(8).getRollingMean7()).isCloseTo(6.0, within(1e-12));
    }

    @Test
    void build_pctChange_zeroForFirstRowAndZeroPrevious() {
        List<FeaturizedRecord> out = builder.build(TestDataFactory.createSeries("EC2", 4, 0, 5, 10, 5));

        assertThat(out).extracting(FeaturizedRecord::getPctChange)
                .containsExactly(0.0, -1.0, 0.0, 1.0, -0.5);
    }

    @Test
    void build_groupsPerService_noLeakAcrossServices() {
        List<CostRecord> records = new ArrayList<>();
        records.addAll(TestDataFactory.createSeries("EC2", 100, 100, 100));
        records.addAll(TestDataFactory.createSeries("S3", 1, 2));

        List<FeaturizedRecord> out = builder.build(records);

        assertThat(out).extracting(FeaturizedRecord::getService).containsExactly("EC2", "EC2", "EC2", "S3", "S3");
        assertThat(out.get(2).getRollingMean7()).isEqualTo(100.0);
        // S3's first row does not see EC2's history
        assertThat(out.get(3).getPctChange()).isEqualTo(0.0);
        assertThat(out.get(4).getPctChange()).isEqualTo(1.0);
        assertThat(out.get(4).getRollingMean7()).isNull();
    }

    @Test
    void build_laterMutation_doesNotChangeEarlierFeatures() {
        List<CostRecord> original = TestDataFactory.createSeries("EC2", 5, 7, 6, 9, 8, 12, 11, 10);
        List<CostRecord> mutated = new ArrayList<>(original);
        mutated.set(7, TestDataFactory.createRecord("EC2", original.get(7).getDate(), 5000));

        List<FeaturizedRecord> before = builder.build(original);
        List<FeaturizedRecord> after = builder.build(mutated);

        for (int i = 0; i < 7; i++) {
            assertThat(after.get(i)).isEqualTo(before.get(i));
        }
        assertThat(after.get(7).getRollingMean7()).isNotEqualTo(before.get(7).getRollingMean7());
    }

    @Test
    void featureVector_hasSevenColumnsInOrder() {
        List<FeaturizedRecord> out = builder.build(TestDataFactory.createSeries("EC2", 10, 10, 10, 40));

        double[] v = out.get(3).featureVector();

        assertThat(v).hasSize(FeaturizedRecord.FEATURE_COUNT);
        assertThat(v[0]).isEqualTo(40.0);
        assertThat(v[1]).isEqualTo(5.0);  // 2025-01-04 is a Saturday
        assertThat(v[2]).isEqualTo(4.0);
        assertThat(v[3]).isEqualTo(1.0);
        assertThat(v[4]).isCloseTo(3.0, within(1e-12));
        assertThat(v[5]).isCloseTo(40.0 - 17.5, within(1e-12));
        assertThat(v[6]).isCloseTo(15.0, within(1e-12));
    }
}
