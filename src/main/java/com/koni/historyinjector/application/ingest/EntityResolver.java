package com.koni.historyinjector.application.ingest;

import com.koni.historyinjector.application.port.EntityManagementClient;
import com.koni.historyinjector.domain.exception.EntityCreationFailedException;
import com.koni.historyinjector.domain.exception.EntityNotFoundException;
import com.koni.historyinjector.domain.model.EntityMetadata;
import com.koni.historyinjector.domain.repository.HistorySchemaAdapter;
import com.koni.historyinjector.infrastructure.observability.InjectionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves entity ids to the store's internal identifiers.
 *
 * Resolved entities are cached for the lifetime of the process and only dropped by
 * {@link #refresh(String)} or {@link #refreshAll()}. Concurrent cache misses for the same entity
 * share one in-flight resolution, so the entity management API is called at most once per entity
 * no matter how many records race for it.
 */
@Slf4j
@Component
public class EntityResolver {

    private final HistorySchemaAdapter schemaAdapter;
    private final StoreTransactions storeTransactions;
    private final EntityManagementClient entityManagementClient;
    private final InjectionMetrics metrics;
    private final boolean createMissingEntities;
    private final Duration resolveTimeout;

    private final ConcurrentMap<String, EntityMetadata> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<EntityMetadata>> inFlight = new ConcurrentHashMap<>();

    public EntityResolver(
            HistorySchemaAdapter schemaAdapter,
            StoreTransactions storeTransactions,
            EntityManagementClient entityManagementClient,
            InjectionMetrics metrics,
            @Value("${injector.create-missing-entities:true}") boolean createMissingEntities,
            @Value("${injector.entity-resolve-timeout:60s}") Duration resolveTimeout) {
        this.schemaAdapter = schemaAdapter;
        this.storeTransactions = storeTransactions;
        this.entityManagementClient = entityManagementClient;
        this.metrics = metrics;
        this.createMissingEntities = createMissingEntities;
        this.resolveTimeout = resolveTimeout;
    }

    /**
     * Resolves an entity, creating it through the entity management API when it is unknown
     * and creation is enabled.
     *
     * @param entityId the entity to resolve
     * @param initialAttributes attributes used if the entity has to be created
     * @return the cached or newly resolved metadata
     * @throws EntityNotFoundException if the entity is unknown and creation is disabled
     * @throws EntityCreationFailedException if creation failed after the bounded retries
     */
    public EntityMetadata resolve(String entityId, Map<String, Object> initialAttributes) {
        EntityMetadata cached = cache.get(entityId);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<EntityMetadata> flight = new CompletableFuture<>();
        CompletableFuture<EntityMetadata> existingFlight = inFlight.putIfAbsent(entityId, flight);
        if (existingFlight != null) {
            log.debug("Waiting for in-flight resolution of entityId={}", entityId);
            return await(entityId, existingFlight);
        }

        try {
            // another flight may have completed between the cache check and winning this one
            EntityMetadata metadata = cache.get(entityId);
            if (metadata == null) {
                metadata = load(entityId, initialAttributes);
                cache.put(entityId, metadata);
            }
            flight.complete(metadata);
            return metadata;
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(entityId, flight);
        }
    }

    private EntityMetadata load(String entityId, Map<String, Object> initialAttributes) {
        Optional<Long> metadataId = storeTransactions.execute("look up entity " + entityId,
                status -> schemaAdapter.findMetadataId(entityId));
        if (metadataId.isPresent()) {
            log.debug("Entity found in store: entityId={}, metadataId={}", entityId, metadataId.get());
            return new EntityMetadata(entityId, metadataId.get(), EntityMetadata.Origin.EXISTING);
        }

        if (!createMissingEntities) {
            throw new EntityNotFoundException("Entity " + entityId + " does not exist and creation is disabled");
        }

        log.info("Entity {} does not exist, creating it", entityId);
        entityManagementClient.createEntity(entityId, initialAttributes);
        long internalId = storeTransactions.execute("register entity " + entityId,
                status -> schemaAdapter.registerMetadata(entityId));
        metrics.recordEntityCreated();
        log.info("Entity created: entityId={}, metadataId={}", entityId, internalId);
        return new EntityMetadata(entityId, internalId, EntityMetadata.Origin.API_CREATED);
    }

    private EntityMetadata await(String entityId, CompletableFuture<EntityMetadata> flight) {
        try {
            return flight.get(resolveTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EntityCreationFailedException("Resolution of " + entityId + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new EntityCreationFailedException("Timed out waiting for in-flight resolution of " + entityId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EntityCreationFailedException("Interrupted while resolving " + entityId, e);
        }
    }

    /**
     * Drops one entity from the cache so the next record re-resolves it against the store.
     *
     * @return true if the entity was cached
     */
    public boolean refresh(String entityId) {
        boolean removed = cache.remove(entityId) != null;
        log.info("Entity cache refresh: entityId={}, wasCached={}", entityId, removed);
        return removed;
    }

    /**
     * Clears the whole cache.
     *
     * @return the number of entries dropped
     */
    public int refreshAll() {
        int size = cache.size();
        cache.clear();
        log.info("Entity cache cleared: {} entries dropped", size);
        return size;
    }

    /**
     * @return a snapshot of the cached entities ordered by entity id
     */
    public List<EntityMetadata> cachedEntities() {
        List<EntityMetadata> entities = new ArrayList<>(cache.values());
        entities.sort(Comparator.comparing(EntityMetadata::getEntityId));
        return entities;
    }
}
