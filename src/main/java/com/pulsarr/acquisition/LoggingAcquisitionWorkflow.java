package com.pulsarr.acquisition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workflow that records the add call in the log without contacting any instance.
 */
public class LoggingAcquisitionWorkflow implements AcquisitionWorkflow {

    private static final Logger log = LoggerFactory.getLogger(LoggingAcquisitionWorkflow.class);

    @Override
    public void acquire(AcquisitionRequest request) {
        log.info("Adding {} '{}' to {} instance {} (profile={}, rootFolder={}, tags={})",
                request.contentType().value(), request.title(), request.targetType().value(),
                request.routing().instanceId(), request.routing().qualityProfile(),
                request.routing().rootFolder(), request.routing().tags());
    }
}
