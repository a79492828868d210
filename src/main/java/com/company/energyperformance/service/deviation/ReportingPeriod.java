package com.company.energyperformance.service.deviation;

import com.company.energyperformance.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A calendar reporting period in UTC: a quarter ({@code Q1}..{@code Q4}), a year
 * ({@code annual}), a month ({@code 1}..{@code 12}) or an explicit {@code YYYY-MM}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ReportingPeriod {

    private static final Pattern QUARTER = Pattern.compile("Q([1-4])");
    private static final Pattern MONTH_NUMBER = Pattern.compile("(\\d{1,2})");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})-(\\d{2})");

    private final String label;
    private final Instant start;
    private final Instant end;
    private final boolean composite;

    private ReportingPeriod(String label, LocalDate startDate, LocalDate endDate, boolean composite) {
        this.label = label;
        this.start = startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        this.end = endDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        this.composite = composite;
    }

    public static ReportingPeriod parse(int year, String period) {
        if (year < 1970 || year > 9999) {
            throw new ValidationException("Year out of range: " + year);
        }
        if (period == null || period.isBlank()) {
            throw new ValidationException("Reporting period is required");
        }
        String value = period.trim().toUpperCase(Locale.ROOT);

        if ("ANNUAL".equals(value) || "YEAR".equals(value)) {
            return new ReportingPeriod(String.valueOf(year),
                    LocalDate.of(year, 1, 1), LocalDate.of(year + 1, 1, 1), true);
        }

        Matcher quarter = QUARTER.matcher(value);
        if (quarter.matches()) {
            int q = Integer.parseInt(quarter.group(1));
            LocalDate first = LocalDate.of(year, (q - 1) * 3 + 1, 1);
            return new ReportingPeriod(year + "-Q" + q, first, first.plusMonths(3), true);
        }

        Matcher monthNumber = MONTH_NUMBER.matcher(value);
        if (monthNumber.matches()) {
            return month(YearMonth.of(year, checkedMonth(Integer.parseInt(monthNumber.group(1)), period)));
        }

        Matcher yearMonth = YEAR_MONTH.matcher(value);
        if (yearMonth.matches()) {
            int explicitYear = Integer.parseInt(yearMonth.group(1));
            if (explicitYear != year) {
                throw new ValidationException("Period " + period + " is not in year " + year,
                        Map.of("year", year, "period", period));
            }
            return month(YearMonth.of(explicitYear, checkedMonth(Integer.parseInt(yearMonth.group(2)), period)));
        }

        throw new ValidationException("Unrecognized reporting period: " + period,
                Map.of("period", period, "accepted", List.of("Q1", "Q2", "Q3", "Q4", "annual", "1-12", "YYYY-MM")));
    }

    /**
     * Calendar months covered by a quarter or a year, in order; empty for a single month
     */
    public List<ReportingPeriod> monthlyBreakdown() {
        List<ReportingPeriod> months = new ArrayList<>();
        if (!composite) {
            return months;
        }
        YearMonth cursor = YearMonth.from(start.atZone(ZoneOffset.UTC));
        YearMonth last = YearMonth.from(end.atZone(ZoneOffset.UTC));
        while (cursor.isBefore(last)) {
            months.add(month(cursor));
            cursor = cursor.plusMonths(1);
        }
        return months;
    }

    private static ReportingPeriod month(YearMonth month) {
        return new ReportingPeriod(month.toString(), month.atDay(1), month.plusMonths(1).atDay(1), false);
    }

    private static int checkedMonth(int month, String period) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Month out of range in period " + period);
        }
        return month;
    }
}
