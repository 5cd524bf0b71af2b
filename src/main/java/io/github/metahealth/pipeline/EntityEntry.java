package io.github.metahealth.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.metahealth.stats.EntityStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A provider or client together with its accumulated statistics.
 *
 * <p>Entries are owned by the thread reducing results; they are not thread-safe.</p>
 */
public final class EntityEntry {

    private final String id;
    private final EntityType type;
    private final ObjectNode attributes;
    private final String providerId;
    private final List<String> clientIds;
    private EntityStats stats;

    EntityEntry(String id, EntityType type, ObjectNode attributes, String providerId, EntityStats stats) {
        this.id = id;
        this.type = type;
        this.attributes = attributes;
        this.providerId = providerId;
        this.clientIds = new ArrayList<>();
        this.stats = stats;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public ObjectNode getAttributes() {
        return attributes;
    }

    /**
     * Owning provider of a client; always null for providers.
     */
    public String getProviderId() {
        return providerId;
    }

    /**
     * Clients of a provider in registry order; always empty for clients.
     */
    public List<String> getClientIds() {
        return Collections.unmodifiableList(clientIds);
    }

    public EntityStats getStats() {
        return stats;
    }

    void addClientId(String clientId) {
        clientIds.add(clientId);
    }

    void setStats(EntityStats stats) {
        this.stats = stats;
    }

    public long getRecordCount() {
        return stats.getSummary().getRecordCount();
    }

    @Override
    public String toString() {
        return type.getWireName() + "/" + id + "[records=" + getRecordCount() + "]";
    }
}
