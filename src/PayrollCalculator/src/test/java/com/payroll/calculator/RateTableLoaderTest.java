package com.payroll.calculator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateTableLoaderTest {

    @Test
    void fromClasspath_bundledTableMatchesBuiltIn() {
        RateTable loaded = RateTableLoader.fromClasspath(RateTableLoader.STANDARD_RESOURCE);

        assertThat(loaded).isEqualTo(RateTable.standard());
        assertThat(loaded.getIncomeTaxBrackets()).hasSize(7);
        assertThat(loaded.getIncomeTaxBrackets().get(6).getMax()).isNull();
    }

    @Test
    void fromClasspath_readsAlternativeTable() {
        RateTable flat = RateTableLoader.fromClasspath("rate-tables/flat-2025.json");

        assertThat(flat.getVersion()).isEqualTo("2025-flat");
        assertThat(flat.getStandardMonthlyHours()).isEqualByComparingTo("150");
        assertThat(new DeductionCalculator(flat).incomeTax(new BigDecimal("100000"), 0)).isEqualByComparingTo("10000");
    }

    @Test
    void fromClasspath_rejectsGapBetweenBrackets() {
        assertThatThrownBy(() -> RateTableLoader.fromClasspath("rate-tables/gap-in-brackets.json"))
            .isInstanceOf(RateTableException.class)
            .hasMessageContaining("gap-in-brackets.json")
            .hasMessageContaining("starts at 90000");
    }

    @Test
    void fromClasspath_missingResource() {
        assertThatThrownBy(() -> RateTableLoader.fromClasspath("rate-tables/nope.json"))
            .isInstanceOf(RateTableException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void fromFile_readsTableFromDisk(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rates.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("rate-tables/flat-2025.json")) {
            Files.copy(in, file);
        }

        assertThat(RateTableLoader.fromPathOrStandard(file.toString()).getVersion()).isEqualTo("2025-flat");
    }

    @Test
    void fromFile_missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> RateTableLoader.fromFile(dir.resolve("absent.json")))
            .isInstanceOf(RateTableException.class);
    }

    @Test
    void fromPathOrStandard_fallsBackToBundledTable() {
        assertThat(RateTableLoader.fromPathOrStandard(null)).isEqualTo(RateTable.standard());
        assertThat(RateTableLoader.fromPathOrStandard("  ")).isEqualTo(RateTable.standard());
    }

    @Test
    void rateTable_rejectsMissingFields() {
        RateTable standard = RateTable.standard();

        assertThatThrownBy(() -> new RateTable(null, standard.getStandardMonthlyHours(), standard.getInsuranceRates(),
            standard.getOvertimeRates(), standard.getExtendedOvertimeThresholdHours(),
            standard.getDependentDeduction(), standard.getLongCareMinimumAge(), standard.getIncomeTaxBrackets()))
            .isInstanceOf(RateTableException.class)
            .hasMessageContaining("version");
    }
}
