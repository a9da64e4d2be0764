package dev.pekelund.finsight.documents.tabular;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ColumnMapperTest {

    private final ColumnMapper mapper = new ColumnMapper(MappingWeights.defaults());

    @Test
    void autoMapsRosterHeadersWithHighConfidence() {
        AutoMappingResult result = mapper.map(List.of("Employee Name", "Job Title", "Annual Salary"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        assertThat(result.mapping().targetFor("Employee Name")).isEqualTo("name");
        assertThat(result.mapping().targetFor("Job Title")).isEqualTo("role");
        assertThat(result.mapping().targetFor("Annual Salary")).isEqualTo("annual_salary");
        assertThat(result.columnConfidences()).containsEntry("Annual Salary", 1.0);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.8);
        assertThat(result.requiredFieldsMapped()).isEqualTo(2);
        assertThat(result.hasAllRequiredFields()).isTrue();
        assertThat(result.shouldAutoApply()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void neverAssignsOneFieldTwice() {
        AutoMappingResult result = mapper.map(List.of("Name", "Employee Name", "Full Name", "Role"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        List<String> targets = result.mapping().assignments().values().stream()
            .filter(target -> !TabularDocumentType.IGNORE.equals(target))
            .toList();
        assertThat(targets).doesNotHaveDuplicates();
        assertThat(result.mapping().targetFor("Name")).isEqualTo("name");
        assertThat(result.mapping().targetFor("Employee Name")).isEqualTo(TabularDocumentType.IGNORE);
    }

    @Test
    void doesNotAutoApplyWhenRequiredFieldIsMissing() {
        AutoMappingResult result = mapper.map(List.of("Employee Name", "Annual Salary"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        assertThat(result.requiredFieldsMapped()).isEqualTo(1);
        assertThat(result.totalRequiredFields()).isEqualTo(2);
        assertThat(result.hasAllRequiredFields()).isFalse();
        assertThat(result.shouldAutoApply()).isFalse();
    }

    @Test
    void doesNotAutoApplyBelowThresholdAndWarnsOnWeakRequiredMatches() {
        AutoMappingResult result = mapper.map(List.of("Staff Member Name", "Position Held"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        assertThat(result.hasAllRequiredFields()).isTrue();
        assertThat(result.confidence()).isEqualTo(0.7);
        assertThat(result.shouldAutoApply()).isFalse();
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.confidenceLabel()).isEqualTo("Moderate confidence");
    }

    @Test
    void unmatchedHeadersAreIgnoredAndExcludedFromConfidence() {
        AutoMappingResult result = mapper.map(List.of("Employee Name", "Job Title", "Favourite Colour"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        assertThat(result.mapping().targetFor("Favourite Colour")).isEqualTo(TabularDocumentType.IGNORE);
        assertThat(result.columnConfidences()).doesNotContainKey("Favourite Colour");
        assertThat(result.shouldAutoApply()).isTrue();
    }

    @Test
    void thresholdComesFromWeights() {
        ColumnMapper strict = new ColumnMapper(new MappingWeights(1.0, 0.85, 0.7, 0.7, 0.95));

        AutoMappingResult result = strict.map(List.of("Employee Name", "Job Title", "Annual Salary"),
            TabularDocumentType.EMPLOYEE_ROSTER);

        assertThat(result.hasAllRequiredFields()).isTrue();
        assertThat(result.shouldAutoApply()).isFalse();
    }

    @Test
    void unknownTypeMapsEverythingToIgnore() {
        AutoMappingResult result = mapper.map(List.of("A", "B"), TabularDocumentType.UNKNOWN);

        assertThat(result.mapping().assignments()).containsOnly(
            Map.entry("A", TabularDocumentType.IGNORE), Map.entry("B", TabularDocumentType.IGNORE));
        assertThat(result.confidence()).isEqualTo(0.7);
    }

    @Test
    void mappingRejectsDuplicateTargets() {
        assertThatThrownBy(() -> new ColumnMapping(Map.of("Name", "name", "Full Name", "name")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }
}
