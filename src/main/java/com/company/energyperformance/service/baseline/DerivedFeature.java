package com.company.energyperformance.service.baseline;

import com.company.energyperformance.domain.RollupRow;
import com.company.energyperformance.domain.enums.ReadingChannel;

import java.time.Duration;

/**
 * Features that are not a plain aggregate of one channel. Degree-hours use the bucket's mean
 * outdoor temperature against an 18 °C base.
 */
public enum DerivedFeature {

    HEATING_DEGREE_HOURS {
        @Override
        public Double extract(RollupRow row, double ratedCapacityKw) {
            Double temp = row.mean(ReadingChannel.OUTDOOR_TEMP_C);
            return temp == null ? null : Math.max(0.0, BASE_TEMP_C - temp) * hours(row);
        }
    },

    COOLING_DEGREE_HOURS {
        @Override
        public Double extract(RollupRow row, double ratedCapacityKw) {
            Double temp = row.mean(ReadingChannel.OUTDOOR_TEMP_C);
            return temp == null ? null : Math.max(0.0, temp - BASE_TEMP_C) * hours(row);
        }
    },

    // Mean demand over combined nameplate capacity of the members
    LOAD_FACTOR {
        @Override
        public Double extract(RollupRow row, double ratedCapacityKw) {
            Double power = row.mean(ReadingChannel.POWER_KW);
            if (power == null || ratedCapacityKw <= 0) {
                return null;
            }
            return power / ratedCapacityKw;
        }
    };

    public static final double BASE_TEMP_C = 18.0;

    public abstract Double extract(RollupRow row, double ratedCapacityKw);

    private static double hours(RollupRow row) {
        return Duration.between(row.getBucketStart(), row.getBucketEnd()).getSeconds() / 3600.0;
    }
}
