package io.github.metahealth.registry;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A provider or client as listed by the registry.
 *
 * @param id         registry identifier
 * @param attributes descriptive attributes, passed through to the output untouched
 * @param providerId owning provider of a client, null for providers
 */
public record RegistryEntity(String id, ObjectNode attributes, String providerId) {
}
