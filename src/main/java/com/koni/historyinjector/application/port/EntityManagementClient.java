package com.koni.historyinjector.application.port;

import com.koni.historyinjector.domain.exception.EntityCreationFailedException;

import java.util.Map;

/**
 * Port to the target application's entity management API.
 * Implemented by infrastructure adapters (e.g. the Home Assistant REST client).
 */
public interface EntityManagementClient {

    /**
     * Makes the entity known to the target application.
     * Returns normally if the entity already exists.
     *
     * @param entityId the entity to create
     * @param initialAttributes attributes to register the entity with, may be empty
     * @throws EntityCreationFailedException if the entity could not be created within the retry budget
     */
    void createEntity(String entityId, Map<String, Object> initialAttributes);
}
