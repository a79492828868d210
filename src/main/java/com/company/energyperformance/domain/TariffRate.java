package com.company.energyperformance.domain;

import com.company.energyperformance.domain.enums.EnergySourceType;
import lombok.*;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-of-use tariff entry. An empty day list means every day; an end time
 * earlier than the start time wraps past midnight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TariffRate implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long tariffId;
    private String name;
    private String region;
    private EnergySourceType energySourceType;
    private LocalDate validFrom;
    private LocalDate validTo;
    @Builder.Default
    private List<DayOfWeek> daysOfWeek = new ArrayList<>();
    private LocalTime startTime;
    private LocalTime endTime;
    private double rate;
    private int priority;

    public boolean appliesAt(ZonedDateTime localTime) {
        LocalDate date = localTime.toLocalDate();
        if (validFrom != null && date.isBefore(validFrom)) {
            return false;
        }
        if (validTo != null && date.isAfter(validTo)) {
            return false;
        }
        if (daysOfWeek != null && !daysOfWeek.isEmpty() && !daysOfWeek.contains(localTime.getDayOfWeek())) {
            return false;
        }
        if (startTime == null || endTime == null || startTime.equals(endTime)) {
            return true;
        }
        LocalTime time = localTime.toLocalTime();
        if (startTime.isBefore(endTime)) {
            return !time.isBefore(startTime) && time.isBefore(endTime);
        }
        return !time.isBefore(startTime) || time.isBefore(endTime);
    }
}
