package com.aura.backend.service;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.dto.ApiErrorDetail;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.RawTable;
import com.aura.backend.model.ValidatedTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionValidatorTest {

    private final IngestionValidator validator = new IngestionValidator(new PipelineProperties());

    @Test
    void acceptsTableWithIdentifierColumn() {
        RawTable raw = new RawTable(
                List.of("customerID", "tenure", "Contract"),
                List.of(List.of("A", "3", "Month-to-month"), List.of("B", "40", "Two year")));

        ValidatedTable table = validator.validate(raw);

        assertThat(table.idColumn()).isEqualTo("customerID");
        assertThat(table.customerIds()).containsExactly("A", "B");
        assertThat(table.records().get(0).features()).containsEntry("tenure", "3").doesNotContainKey("customerID");
        assertThat(table.qualityScore()).isEqualTo(1.0);
        assertThat(table.warnings()).isEmpty();
    }

    @Test
    void missingIdentifierColumnNamesTheColumn() {
        RawTable raw = new RawTable(List.of("tenure", "Contract"), List.of(List.of("3", "One year")));

        assertThatThrownBy(() -> validator.validate(raw))
                .hasMessageContaining("customerID")
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getDetails())
                        .extracting(ApiErrorDetail::getField)
                        .containsExactly("customerID"));
    }

    @Test
    void aliasIsRenamedToCanonicalColumn() {
        RawTable raw = new RawTable(List.of("Customer_ID", "tenure"), List.of(List.of("X1", "12")));

        ValidatedTable table = validator.validate(raw);

        assertThat(table.columns()).containsExactly("customerID", "tenure");
        assertThat(table.customerIds()).containsExactly("X1");
    }

    @Test
    void rejectsEmptyTable() {
        assertThatThrownBy(() -> validator.validate(new RawTable(List.of(), List.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> validator.validate(new RawTable(List.of("customerID"), List.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no data rows");
    }

    @Test
    void rejectsDuplicateIdentifiersListingEachOnce() {
        RawTable raw = new RawTable(List.of("customerID", "tenure"), List.of(
                List.of("A", "1"), List.of("B", "2"), List.of("A", "3"), List.of("A", "4"), List.of("B", "5")));

        assertThatThrownBy(() -> validator.validate(raw))
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getDetails())
                        .extracting(ApiErrorDetail::getIssue)
                        .containsExactly("duplicate identifier A", "duplicate identifier B"));
    }

    @Test
    void rejectsBlankIdentifierAndOverlongRows() {
        RawTable raw = new RawTable(List.of("customerID", "tenure"), List.of(
                List.of(" ", "1"), List.of("B", "2", "extra")));

        assertThatThrownBy(() -> validator.validate(raw))
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getDetails())
                        .extracting(ApiErrorDetail::getField)
                        .containsExactly("row 1", "row 2"));
    }

    @Test
    void rejectsRepeatedHeaderNames() {
        RawTable raw = new RawTable(List.of("customerID", "tenure", "TENURE"), List.of(List.of("A", "1", "2")));

        assertThatThrownBy(() -> validator.validate(raw))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("header");
    }

    @Test
    void warnsOnSparseDataAndNonNumericValues() {
        RawTable raw = new RawTable(List.of("customerID", "tenure", "MonthlyCharges"), List.of(
                List.of("A", "abc", ""),
                List.of("B", "", "")));

        ValidatedTable table = validator.validate(raw);

        assertThat(table.qualityScore()).isCloseTo(0.5, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(table.warnings()).anyMatch(w -> w.startsWith("Data quality score is low"));
        assertThat(table.warnings()).contains("Column tenure has 1 non-numeric values");
    }

    @Test
    void shortRowsArePaddedWithBlanks() {
        RawTable raw = new RawTable(List.of("customerID", "tenure", "Contract"), List.of(List.of("A")));

        ValidatedTable table = validator.validate(raw);

        assertThat(table.records().get(0).features()).containsEntry("tenure", "").containsEntry("Contract", "");
    }
}
