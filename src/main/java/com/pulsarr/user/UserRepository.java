package com.pulsarr.user;

import java.util.Optional;

/**
 * Storage of users referenced by quotas and approval requests.
 */
public interface UserRepository {

    Optional<RouterUser> findById(int id);

    default boolean exists(int id) {
        return findById(id).isPresent();
    }

    RouterUser save(RouterUser user);
}
