package com.pulsarr.support;

import com.pulsarr.acquisition.AcquisitionRequest;
import com.pulsarr.acquisition.AcquisitionWorkflow;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records add calls; instances listed as failing throw instead.
 */
public class RecordingAcquisitionWorkflow implements AcquisitionWorkflow {

    private final List<AcquisitionRequest> requests = new CopyOnWriteArrayList<>();
    private final Set<Integer> failingInstances = ConcurrentHashMap.newKeySet();

    public void failFor(int instanceId) {
        failingInstances.add(instanceId);
    }

    public List<AcquisitionRequest> requests() {
        return List.copyOf(requests);
    }

    @Override
    public void acquire(AcquisitionRequest request) {
        if (failingInstances.contains(request.routing().instanceId())) {
            throw new IllegalStateException("instance " + request.routing().instanceId() + " unreachable");
        }
        requests.add(request);
    }
}
