package com.pulsarr.acquisition;

/**
 * Issues the add call against a download-manager instance. Translating the routing into
 * the target's request shape is the implementation's concern.
 */
public interface AcquisitionWorkflow {

    /**
     * @throws RuntimeException when the instance could not be reached or refused the item
     */
    void acquire(AcquisitionRequest request);
}
