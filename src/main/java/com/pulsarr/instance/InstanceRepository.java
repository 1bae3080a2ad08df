package com.pulsarr.instance;

import com.pulsarr.core.TargetType;

import java.util.List;
import java.util.Optional;

/**
 * Storage of download-manager instances.
 */
public interface InstanceRepository {

    Optional<Instance> findById(int id);

    List<Instance> findEnabled(TargetType type);

    /**
     * The enabled default instance of a type, if one is configured.
     */
    Optional<Instance> findDefault(TargetType type);

    List<Instance> findAll();

    Instance save(Instance instance);
}
