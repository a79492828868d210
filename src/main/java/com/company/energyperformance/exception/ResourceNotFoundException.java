package com.company.energyperformance.exception;

public class ResourceNotFoundException extends EnergyPerformanceException {

    public ResourceNotFoundException(String resource, Object id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
