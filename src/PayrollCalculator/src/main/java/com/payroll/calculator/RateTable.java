package com.payroll.calculator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Insurance rates, premium multipliers and the withholding bracket table used by one payroll run.
 *
 * <p>Instances are immutable and validated on construction, so an engine holding one sees the same
 * rates for the whole of every calculation. New rates mean a new table with a new {@code version}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RateTable {

    // 2024 employee-side rates (Kyokai Kenpo general, employees' pension, general business employment insurance)
    private static final RateTable STANDARD = new RateTable(
        "2024",
        new BigDecimal("160"),
        new InsuranceRates(new BigDecimal("0.0495"), new BigDecimal("0.0915"),
            new BigDecimal("0.003"), new BigDecimal("0.0123")),
        new OvertimeRates(new BigDecimal("1.25"), new BigDecimal("1.50"),
            new BigDecimal("1.25"), new BigDecimal("1.35")),
        new BigDecimal("60"),
        new BigDecimal("38000"),
        40,
        List.of(
            new TaxBracket(new BigDecimal("0"), new BigDecimal("88000"), new BigDecimal("0"), new BigDecimal("0")),
            new TaxBracket(new BigDecimal("88000"), new BigDecimal("162000"), new BigDecimal("0.05"), new BigDecimal("4400")),
            new TaxBracket(new BigDecimal("162000"), new BigDecimal("270000"), new BigDecimal("0.10"), new BigDecimal("12500")),
            new TaxBracket(new BigDecimal("270000"), new BigDecimal("350000"), new BigDecimal("0.15"), new BigDecimal("26000")),
            new TaxBracket(new BigDecimal("350000"), new BigDecimal("450000"), new BigDecimal("0.20"), new BigDecimal("43500")),
            new TaxBracket(new BigDecimal("450000"), new BigDecimal("550000"), new BigDecimal("0.25"), new BigDecimal("66000")),
            new TaxBracket(new BigDecimal("550000"), null, new BigDecimal("0.30"), new BigDecimal("93500"))
        ));

    private final String version;
    private final BigDecimal standardMonthlyHours;
    private final InsuranceRates insuranceRates;
    private final OvertimeRates overtimeRates;
    private final BigDecimal extendedOvertimeThresholdHours;
    private final BigDecimal dependentDeduction;
    private final int longCareMinimumAge;
    private final List<TaxBracket> incomeTaxBrackets;

    @JsonCreator
    public RateTable(@JsonProperty("version") String version,
                     @JsonProperty("standardMonthlyHours") BigDecimal standardMonthlyHours,
                     @JsonProperty("insuranceRates") InsuranceRates insuranceRates,
                     @JsonProperty("overtimeRates") OvertimeRates overtimeRates,
                     @JsonProperty("extendedOvertimeThresholdHours") BigDecimal extendedOvertimeThresholdHours,
                     @JsonProperty("dependentDeduction") BigDecimal dependentDeduction,
                     @JsonProperty("longCareMinimumAge") int longCareMinimumAge,
                     @JsonProperty("incomeTaxBrackets") List<TaxBracket> incomeTaxBrackets) {
        this.version = require(version, "version");
        this.standardMonthlyHours = requirePositive(standardMonthlyHours, "standardMonthlyHours");
        this.insuranceRates = require(insuranceRates, "insuranceRates");
        this.overtimeRates = require(overtimeRates, "overtimeRates");
        this.extendedOvertimeThresholdHours = requireNonNegative(extendedOvertimeThresholdHours, "extendedOvertimeThresholdHours");
        this.dependentDeduction = requireNonNegative(dependentDeduction, "dependentDeduction");
        if (longCareMinimumAge < 0) {
            throw new RateTableException("longCareMinimumAge must not be negative: " + longCareMinimumAge);
        }
        this.longCareMinimumAge = longCareMinimumAge;
        this.incomeTaxBrackets = validateBrackets(incomeTaxBrackets);
    }

    /** The 2024 table the payroll run ships with. */
    public static RateTable standard() {
        return STANDARD;
    }

    public String getVersion() { return version; }

    public BigDecimal getStandardMonthlyHours() { return standardMonthlyHours; }

    public InsuranceRates getInsuranceRates() { return insuranceRates; }

    public OvertimeRates getOvertimeRates() { return overtimeRates; }

    /** Monthly overtime hours paid at the normal premium before the extended premium applies. */
    public BigDecimal getExtendedOvertimeThresholdHours() { return extendedOvertimeThresholdHours; }

    /** Amount subtracted from taxable income per dependent before the bracket lookup. */
    public BigDecimal getDependentDeduction() { return dependentDeduction; }

    public int getLongCareMinimumAge() { return longCareMinimumAge; }

    /** Ascending, contiguous, and open-ended in the last bracket. */
    public List<TaxBracket> getIncomeTaxBrackets() { return incomeTaxBrackets; }

    private static List<TaxBracket> validateBrackets(List<TaxBracket> brackets) {
        if (brackets == null || brackets.isEmpty()) {
            throw new RateTableException("incomeTaxBrackets must not be empty");
        }
        List<TaxBracket> copy = new ArrayList<>(brackets.size());
        BigDecimal expectedMin = null;
        for (int i = 0; i < brackets.size(); i++) {
            TaxBracket bracket = require(brackets.get(i), "incomeTaxBrackets[" + i + "]");
            boolean last = i == brackets.size() - 1;
            if (expectedMin != null && bracket.getMin().compareTo(expectedMin) != 0) {
                throw new RateTableException("incomeTaxBrackets[" + i + "] starts at " + bracket.getMin().toPlainString()
                    + " but the previous bracket ends at " + expectedMin.toPlainString());
            }
            if (bracket.getMax() == null) {
                if (!last) {
                    throw new RateTableException("incomeTaxBrackets[" + i + "] is open-ended but is not the last bracket");
                }
            } else {
                if (last) {
                    throw new RateTableException("the last income tax bracket must be open-ended");
                }
                if (bracket.getMax().compareTo(bracket.getMin()) <= 0) {
                    throw new RateTableException("incomeTaxBrackets[" + i + "] is empty or reversed");
                }
            }
            expectedMin = bracket.getMax();
            copy.add(bracket);
        }
        return Collections.unmodifiableList(copy);
    }

    private static <T> T require(T value, String name) {
        if (value == null) throw new RateTableException(name + " is required");
        return value;
    }

    private static BigDecimal requireNonNegative(BigDecimal value, String name) {
        require(value, name);
        if (value.signum() < 0) throw new RateTableException(name + " must not be negative: " + value.toPlainString());
        return value;
    }

    private static BigDecimal requirePositive(BigDecimal value, String name) {
        require(value, name);
        if (value.signum() <= 0) throw new RateTableException(name + " must be positive: " + value.toPlainString());
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateTable)) return false;
        RateTable that = (RateTable) o;
        return longCareMinimumAge == that.longCareMinimumAge
            && version.equals(that.version)
            && standardMonthlyHours.compareTo(that.standardMonthlyHours) == 0
            && insuranceRates.equals(that.insuranceRates)
            && overtimeRates.equals(that.overtimeRates)
            && extendedOvertimeThresholdHours.compareTo(that.extendedOvertimeThresholdHours) == 0
            && dependentDeduction.compareTo(that.dependentDeduction) == 0
            && incomeTaxBrackets.equals(that.incomeTaxBrackets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, longCareMinimumAge, incomeTaxBrackets.size());
    }

    @Override
    public String toString() {
        return "RateTable{version=" + version + ", brackets=" + incomeTaxBrackets.size() + '}';
    }

    /**
     * Employee-side insurance rates as listed. Health, pension and long-term care are split with the
     * employer; employment insurance is listed as the employee's share already.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InsuranceRates {
        private final BigDecimal health;
        private final BigDecimal pension;
        private final BigDecimal employment;
        private final BigDecimal longCare;

        @JsonCreator
        public InsuranceRates(@JsonProperty("health") BigDecimal health,
                              @JsonProperty("pension") BigDecimal pension,
                              @JsonProperty("employment") BigDecimal employment,
                              @JsonProperty("longCare") BigDecimal longCare) {
            this.health = requireNonNegative(health, "insuranceRates.health");
            this.pension = requireNonNegative(pension, "insuranceRates.pension");
            this.employment = requireNonNegative(employment, "insuranceRates.employment");
            this.longCare = requireNonNegative(longCare, "insuranceRates.longCare");
        }

        public BigDecimal getHealth() { return health; }
        public BigDecimal getPension() { return pension; }
        public BigDecimal getEmployment() { return employment; }
        public BigDecimal getLongCare() { return longCare; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof InsuranceRates)) return false;
            InsuranceRates that = (InsuranceRates) o;
            return health.compareTo(that.health) == 0
                && pension.compareTo(that.pension) == 0
                && employment.compareTo(that.employment) == 0
                && longCare.compareTo(that.longCare) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(health.stripTrailingZeros(), pension.stripTrailingZeros(),
                employment.stripTrailingZeros(), longCare.stripTrailingZeros());
        }
    }

    /**
     * Premium multipliers over the hourly rate. {@code night} is the total multiplier for a night
     * hour; only the part above 1 is paid as the night premium.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OvertimeRates {
        private final BigDecimal normal;
        private final BigDecimal extended;
        private final BigDecimal night;
        private final BigDecimal holiday;

        @JsonCreator
        public OvertimeRates(@JsonProperty("normal") BigDecimal normal,
                             @JsonProperty("extended") BigDecimal extended,
                             @JsonProperty("night") BigDecimal night,
                             @JsonProperty("holiday") BigDecimal holiday) {
            this.normal = requireNonNegative(normal, "overtimeRates.normal");
            this.extended = requireNonNegative(extended, "overtimeRates.extended");
            this.night = requireNonNegative(night, "overtimeRates.night");
            this.holiday = requireNonNegative(holiday, "overtimeRates.holiday");
        }

        public BigDecimal getNormal() { return normal; }
        public BigDecimal getExtended() { return extended; }
        public BigDecimal getNight() { return night; }
        public BigDecimal getHoliday() { return holiday; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OvertimeRates)) return false;
            OvertimeRates that = (OvertimeRates) o;
            return normal.compareTo(that.normal) == 0
                && extended.compareTo(that.extended) == 0
                && night.compareTo(that.night) == 0
                && holiday.compareTo(that.holiday) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(normal.stripTrailingZeros(), extended.stripTrailingZeros(),
                night.stripTrailingZeros(), holiday.stripTrailingZeros());
        }
    }

    /**
     * Half-open income range {@code [min, max)} with its marginal rate and fixed subtraction.
     * A null {@code max} means the range has no upper bound.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TaxBracket {
        private final BigDecimal min;
        private final BigDecimal max;
        private final BigDecimal rate;
        private final BigDecimal deduction;

        @JsonCreator
        public TaxBracket(@JsonProperty("min") BigDecimal min,
                          @JsonProperty("max") BigDecimal max,
                          @JsonProperty("rate") BigDecimal rate,
                          @JsonProperty("deduction") BigDecimal deduction) {
            this.min = requireNonNegative(min, "bracket.min");
            this.max = max;
            this.rate = requireNonNegative(rate, "bracket.rate");
            this.deduction = requireNonNegative(deduction, "bracket.deduction");
        }

        public boolean contains(BigDecimal income) {
            return income.compareTo(min) >= 0 && (max == null || income.compareTo(max) < 0);
        }

        public BigDecimal getMin() { return min; }
        public BigDecimal getMax() { return max; }
        public BigDecimal getRate() { return rate; }
        public BigDecimal getDeduction() { return deduction; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaxBracket)) return false;
            TaxBracket that = (TaxBracket) o;
            return min.compareTo(that.min) == 0
                && (max == null ? that.max == null : that.max != null && max.compareTo(that.max) == 0)
                && rate.compareTo(that.rate) == 0
                && deduction.compareTo(that.deduction) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(min.stripTrailingZeros(), rate.stripTrailingZeros());
        }

        @Override
        public String toString() {
            return "[" + min.toPlainString() + ", " + (max == null ? "∞" : max.toPlainString()) + ") @ "
                + rate.toPlainString() + " - " + deduction.toPlainString();
        }
    }
}
