package com.txradar.pipeline.category;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.CategoryType;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import com.txradar.pipeline.config.CategoryProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.txradar.pipeline.PipelineFixtures.bankRow;
import static com.txradar.pipeline.PipelineFixtures.debits;
import static com.txradar.pipeline.PipelineFixtures.normalize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CategoryProfilerTest {

    private final CategoryProfiler profiler = new CategoryProfiler(new CategoryMetadataRegistry(new CategoryProperties()));

    @Test
    @DisplayName("population mean and std over the category, attached to each row")
    void meanAndStd() {
        TransactionBatch batch = normalize(debits("Dining", 10, 20, 30));

        Map<String, CategoryProfile> profiles = profiler.apply(batch);

        CategoryProfile dining = profiles.get("Dining");
        assertThat(dining.rowCount()).isEqualTo(3);
        assertThat(dining.meanNet()).isCloseTo(-20d, within(1e-9));
        assertThat(dining.stdNet()).isCloseTo(Math.sqrt(200d / 3d), within(1e-9));
        TransactionRecord r = batch.getRecords().get(0);
        assertThat(r.getCatNetMean()).isEqualTo(dining.meanNet());
        assertThat(r.getCatNetStd()).isEqualTo(dining.stdNet());
        assertThat(r.getCatRowCount()).isEqualTo(3L);
        assertThat(r.getCategoryType()).isEqualTo(CategoryType.FOOD_BEVERAGE);
        assertThat(r.getCategoryPriority()).isEqualTo(CategoryMetadata.LOW);
    }

    @Test
    @DisplayName("single-row category has std 0")
    void singleRowStdIsZero() {
        TransactionBatch batch = normalize(debits("Health Care", 80));

        Map<String, CategoryProfile> profiles = profiler.apply(batch);

        assertThat(profiles.get("Health Care").stdNet()).isZero();
        assertThat(batch.getRecords().get(0).isCategoryTaxDeductible()).isTrue();
    }

    @Test
    @DisplayName("unknown and missing categories default to UNKNOWN / low / not deductible")
    void unknownCategories() {
        TransactionBatch batch = normalize(List.of(
                bankRow(0, "2024-01-01", "Mystery", "Crypto", "5", null),
                bankRow(1, "2024-01-02", "No category", null, "7", null)
        ));

        Map<String, CategoryProfile> profiles = profiler.apply(batch);

        assertThat(profiles).containsKeys("Crypto", CategoryProfiler.NO_CATEGORY);
        for (TransactionRecord r : batch.getRecords()) {
            assertThat(r.getCategoryType()).isEqualTo(CategoryType.UNKNOWN);
            assertThat(r.getCategoryPriority()).isEqualTo(CategoryMetadata.LOW);
            assertThat(r.isCategoryTaxDeductible()).isFalse();
        }
        assertThat(batch.getDiagnostics().get(PipelineDiagnostics.UNKNOWN_CATEGORY)).isEqualTo(1);
    }

    @Test
    @DisplayName("rows without a net amount count toward row_count but not toward the statistics")
    void unparseableAmountsExcludedFromStats() {
        TransactionBatch batch = normalize(List.of(
                bankRow(0, "2024-01-01", "A", "Other", "10", null),
                bankRow(1, "2024-01-02", "B", "Other", "oops", null),
                bankRow(2, "2024-01-03", "C", "Other", "30", null)
        ));

        CategoryProfile other = profiler.apply(batch).get("Other");

        assertThat(other.rowCount()).isEqualTo(3);
        assertThat(other.meanNet()).isCloseTo(-20d, within(1e-9));
        assertThat(other.stdNet()).isCloseTo(10d, within(1e-9));
    }

    @Test
    @DisplayName("configured metadata overrides and extends the built-in table")
    void configuredMetadata() {
        CategoryProperties properties = new CategoryProperties();
        CategoryProperties.Entry entry = new CategoryProperties.Entry();
        entry.setType(CategoryType.SERVICE);
        entry.setPriority(1);
        entry.setTaxDeductible(true);
        properties.getMetadata().put("Consulting", entry);
        CategoryMetadataRegistry registry = new CategoryMetadataRegistry(properties);

        assertThat(registry.isKnown("Consulting")).isTrue();
        assertThat(registry.lookup("Consulting")).isEqualTo(new CategoryMetadata(CategoryType.SERVICE, 1, true));
        assertThat(registry.lookup("Merchandise").type()).isEqualTo(CategoryType.RETAIL);
        assertThat(registry.lookup(null)).isEqualTo(CategoryMetadata.UNKNOWN);
    }
}
