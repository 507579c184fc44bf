package com.whereq.modelhub.registry;

import com.whereq.modelhub.capability.ModelCapability;

/**
 * Work done against a model's handle while the registry holds it in use
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ModelAction<T> {
    T apply(ModelCapability capability, Object handle) throws Exception;
}
