package com.csvslicer.slicer;

import com.csvslicer.exception.SlicerConfigException;
import com.csvslicer.model.Bucket;
import com.csvslicer.model.BucketPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketKeyDeriverTest {

    private static final Path OUTPUT = Path.of("out");
    private static final String DAILY_PATH = "%Y/%m/data_%Y%m%d.csv";

    private final BucketKeyDeriver deriver = new BucketKeyDeriver();

    private final List<ZonedDateTime> index = List.of(
            at(1, 0, 0),
            at(1, 5, 0),
            at(2, 0, 0),
            at(1, 23, 59));

    @Test
    @DisplayName("Pairs distinct paths with distinct group keys in first-seen order")
    void derive_pairsPathsAndGroups() {
        BucketPlan plan = deriver.derive(index, DAILY_PATH, "%Y%m%d", OUTPUT);

        assertThat(plan.paths()).containsExactly(
                Path.of("out/2024/01/data_20240101.csv"),
                Path.of("out/2024/01/data_20240102.csv"));
        assertThat(plan.groupKeys()).containsExactly("20240101", "20240102");
        assertThat(plan.buckets()).extracting(Bucket::rowPositions)
                .containsExactly(List.of(0, 1, 3), List.of(2));
    }

    @Test
    @DisplayName("Every row lands in exactly one bucket")
    void derive_partitionsAllRows() {
        BucketPlan plan = deriver.derive(index, "%Y%m%d%H.csv", "%Y%m%d%H", OUTPUT);

        assertThat(plan.buckets()).flatExtracting(Bucket::rowPositions).containsExactlyInAnyOrder(0, 1, 2, 3);
        assertThat(plan.buckets()).hasSize(4);
    }

    @Test
    @DisplayName("A group format finer than the path format is rejected")
    void derive_rejectsFinerGroups() {
        assertThatThrownBy(() -> deriver.derive(index, DAILY_PATH, "%Y%m%d%H", OUTPUT))
                .isInstanceOf(SlicerConfigException.class)
                .hasMessageContaining("data row 1");
    }

    @Test
    @DisplayName("A group format coarser than the path format is rejected")
    void derive_rejectsCoarserGroups() {
        assertThatThrownBy(() -> deriver.derive(index, DAILY_PATH, "%Y%m", OUTPUT))
                .isInstanceOf(SlicerConfigException.class)
                .hasMessageContaining("do not produce matching buckets");
    }

    @Test
    @DisplayName("An empty index produces an empty plan")
    void derive_emptyIndex() {
        BucketPlan plan = deriver.derive(List.of(), DAILY_PATH, "%Y%m%d", OUTPUT);

        assertThat(plan.buckets()).isEmpty();
    }

    private static ZonedDateTime at(int day, int hour, int minute) {
        return ZonedDateTime.of(2024, 1, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }
}
