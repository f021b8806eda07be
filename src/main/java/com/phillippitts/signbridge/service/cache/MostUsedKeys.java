package com.phillippitts.signbridge.service.cache;

import java.util.List;

/**
 * Most frequently read keys per namespace, highest usage first.
 */
public record MostUsedKeys(List<String> signs, List<String> animations) {

    public MostUsedKeys {
        signs = List.copyOf(signs);
        animations = List.copyOf(animations);
    }
}
