package io.github.metahealth.stats;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Statistics of one provider or client: a summary over all of its records plus one tree per
 * resource type.
 */
public final class EntityStats {

    private final StatsTree summary;
    private final Map<String, StatsTree> byResourceType;

    EntityStats(StatsTree summary) {
        this.summary = summary;
        this.byResourceType = new TreeMap<>();
    }

    public StatsTree getSummary() {
        return summary;
    }

    public Map<String, StatsTree> getByResourceType() {
        return Collections.unmodifiableMap(byResourceType);
    }

    public StatsTree getResourceType(String resourceType) {
        return byResourceType.get(resourceType);
    }

    void putResourceType(String resourceType, StatsTree tree) {
        byResourceType.put(resourceType, tree);
    }

    Map<String, StatsTree> resourceTypes() {
        return byResourceType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityStats)) return false;
        EntityStats that = (EntityStats) o;
        return summary.equals(that.summary) && byResourceType.equals(that.byResourceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, byResourceType);
    }

    @Override
    public String toString() {
        return "EntityStats[summary=" + summary + ", resourceTypes=" + byResourceType.keySet() + "]";
    }
}
