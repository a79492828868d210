package com.company.energyperformance.exception;

import java.util.Collections;

/**
 * I/O failure against the raw, rollup or model store. Retried on the next scheduled tick.
 */
public class TransientStoreException extends EnergyPerformanceException {

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_STORE, message, Collections.emptyMap(), cause);
    }
}
