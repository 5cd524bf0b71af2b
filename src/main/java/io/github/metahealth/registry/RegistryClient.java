package io.github.metahealth.registry;

import java.util.List;

/**
 * Source of the providers and clients statistics are reported for.
 */
public interface RegistryClient {

    List<RegistryEntity> listProviders();

    List<RegistryEntity> listClients();
}
