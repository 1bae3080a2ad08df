package com.pulsarr.core;

import com.pulsarr.exception.PersistenceException;
import org.springframework.jdbc.support.KeyHolder;

import java.util.Map;

/**
 * Reads the generated {@code id} column after an insert. Drivers may return other
 * defaulted columns alongside it, so the key is looked up by name.
 */
public final class GeneratedKeys {

    private GeneratedKeys() {
    }

    public static long id(KeyHolder keyHolder, String description) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys != null) {
            for (Map.Entry<String, Object> entry : keys.entrySet()) {
                if ("id".equalsIgnoreCase(entry.getKey()) && entry.getValue() instanceof Number number) {
                    return number.longValue();
                }
            }
        }
        throw new PersistenceException("No id generated for " + description);
    }
}
