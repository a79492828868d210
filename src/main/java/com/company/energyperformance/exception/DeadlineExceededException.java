package com.company.energyperformance.exception;

import java.time.Duration;
import java.util.Map;

public class DeadlineExceededException extends EnergyPerformanceException {

    public DeadlineExceededException(String operation, Duration deadline) {
        super(ErrorKind.DEADLINE_EXCEEDED,
                operation + " exceeded its deadline of " + deadline.toMillis() + "ms; nothing was persisted",
                Map.of("deadlineMs", deadline.toMillis()));
    }
}
