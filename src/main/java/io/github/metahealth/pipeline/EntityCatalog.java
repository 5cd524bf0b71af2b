package io.github.metahealth.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.metahealth.registry.RegistryEntity;
import io.github.metahealth.schema.MetadataSchema;
import io.github.metahealth.stats.EntityStats;
import io.github.metahealth.stats.StatsFactory;
import io.github.metahealth.stats.StatsFinalizer;
import io.github.metahealth.stats.TreeMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider and client entries of a run, seeded from the registry listings.
 *
 * <p>Only entities known to the registry receive statistics. Not thread-safe; the catalog is
 * owned by the thread reducing file results.</p>
 */
public class EntityCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(EntityCatalog.class);

    public static final String AGGREGATE_PROVIDER_ID = "aggregate";
    public static final String AGGREGATE_CLIENT_ID = "aggregate.all";

    static final String AGGREGATE_PROVIDER_SYMBOL = "AGGREGATE";
    static final String AGGREGATE_PROVIDER_NAME = "All DataCite Organizations (All Providers Aggregated)";
    static final String AGGREGATE_CLIENT_SYMBOL = "AGGREGATE.ALL";
    static final String AGGREGATE_CLIENT_NAME = "All DataCite Repositories (All Clients Aggregated)";

    private final MetadataSchema schema;
    private final Map<String, EntityEntry> providers = new LinkedHashMap<>();
    private final Map<String, EntityEntry> clients = new LinkedHashMap<>();

    public EntityCatalog(MetadataSchema schema) {
        this.schema = schema;
    }

    /**
     * Creates one entry per listed provider and client. A client is linked to its provider when
     * the provider is listed too.
     */
    public static EntityCatalog fromRegistry(MetadataSchema schema, List<RegistryEntity> providerListing,
                                             List<RegistryEntity> clientListing) {
        EntityCatalog catalog = new EntityCatalog(schema);
        for (RegistryEntity provider : providerListing) {
            catalog.providers.put(provider.id(), catalog.newEntry(provider.id(), EntityType.PROVIDER,
                    provider.attributes(), null));
        }
        for (RegistryEntity client : clientListing) {
            catalog.clients.put(client.id(), catalog.newEntry(client.id(), EntityType.CLIENT,
                    client.attributes(), client.providerId()));
            EntityEntry provider = client.providerId() == null ? null : catalog.providers.get(client.providerId());
            if (provider != null) {
                provider.addClientId(client.id());
            }
        }
        LOG.info("Catalog seeded with {} providers and {} clients", catalog.providers.size(), catalog.clients.size());
        return catalog;
    }

    private EntityEntry newEntry(String id, EntityType type, ObjectNode attributes, String providerId) {
        ObjectNode copy = attributes == null ? JsonNodeFactory.instance.objectNode() : attributes.deepCopy();
        return new EntityEntry(id, type, copy, providerId, StatsFactory.createEmptyEntityStats(schema));
    }

    /**
     * Merges partial statistics into a provider entry.
     *
     * @return false when the provider is unknown and the partial was ignored
     */
    public boolean mergeProviderStats(String providerId, EntityStats partial) {
        return merge(providers, providerId, partial);
    }

    /**
     * Merges partial statistics into a client entry.
     *
     * @return false when the client is unknown and the partial was ignored
     */
    public boolean mergeClientStats(String clientId, EntityStats partial) {
        return merge(clients, clientId, partial);
    }

    private static boolean merge(Map<String, EntityEntry> entries, String id, EntityStats partial) {
        EntityEntry entry = entries.get(id);
        if (entry == null) {
            LOG.debug("Ignoring statistics for unknown id {}", id);
            return false;
        }
        entry.setStats(TreeMerger.mergeEntityStats(entry.getStats(), partial));
        return true;
    }

    /**
     * Drops every entry without records.
     */
    public void filterActiveOnly() {
        int providersBefore = providers.size();
        int clientsBefore = clients.size();
        providers.values().removeIf(entry -> entry.getRecordCount() == 0);
        clients.values().removeIf(entry -> entry.getRecordCount() == 0);
        LOG.info("Kept {}/{} providers and {}/{} clients with records",
                providers.size(), providersBefore, clients.size(), clientsBefore);
    }

    /**
     * Adds the {@value #AGGREGATE_PROVIDER_ID} provider and the {@value #AGGREGATE_CLIENT_ID}
     * client, holding the merge of every current provider and client respectively.
     */
    public void createAggregateEntries() {
        EntityStats allProviders = mergeAll(providers.values());
        EntityStats allClients = mergeAll(clients.values());

        EntityEntry aggregateProvider = new EntityEntry(AGGREGATE_PROVIDER_ID, EntityType.PROVIDER,
                aggregateAttributes(AGGREGATE_PROVIDER_SYMBOL, AGGREGATE_PROVIDER_NAME), null, allProviders);
        aggregateProvider.addClientId(AGGREGATE_CLIENT_ID);

        EntityEntry aggregateClient = new EntityEntry(AGGREGATE_CLIENT_ID, EntityType.CLIENT,
                aggregateAttributes(AGGREGATE_CLIENT_SYMBOL, AGGREGATE_CLIENT_NAME), null, allClients);

        providers.put(AGGREGATE_PROVIDER_ID, aggregateProvider);
        clients.put(AGGREGATE_CLIENT_ID, aggregateClient);
    }

    private EntityStats mergeAll(Collection<EntityEntry> entries) {
        EntityStats merged = StatsFactory.createEmptyEntityStats(schema);
        for (EntityEntry entry : entries) {
            merged = TreeMerger.mergeEntityStats(merged, entry.getStats());
        }
        return merged;
    }

    private static ObjectNode aggregateAttributes(String symbol, String name) {
        ObjectNode attributes = JsonNodeFactory.instance.objectNode();
        attributes.put("symbol", symbol);
        attributes.put("name", name);
        return attributes;
    }

    /**
     * Prunes and rounds the statistics of every entry.
     */
    public void finalizeAll(int scale) {
        for (EntityEntry entry : providers.values()) {
            StatsFinalizer.finalizeStats(entry.getStats(), scale);
        }
        for (EntityEntry entry : clients.values()) {
            StatsFinalizer.finalizeStats(entry.getStats(), scale);
        }
    }

    public Collection<EntityEntry> getProviders() {
        return Collections.unmodifiableCollection(providers.values());
    }

    public Collection<EntityEntry> getClients() {
        return Collections.unmodifiableCollection(clients.values());
    }

    public EntityEntry getProvider(String id) {
        return providers.get(id);
    }

    public EntityEntry getClient(String id) {
        return clients.get(id);
    }
}
