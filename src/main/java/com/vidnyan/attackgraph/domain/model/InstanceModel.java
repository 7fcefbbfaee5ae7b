package com.vidnyan.attackgraph.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Query interface over an instance model: the assets of a concrete system,
 * their associations and the attackers placed on them.
 */
public interface InstanceModel {

    String name();

    List<Asset> assets();

    List<AttackerDefinition> attackers();

    /**
     * Assets associated to {@code asset} through the association field {@code fieldName}.
     * Order follows the model; an asset associated twice is returned twice.
     */
    List<Asset> getAssociatedAssetsByFieldName(Asset asset, String fieldName);

    /**
     * Declared property value of an asset, e.g. the status of a defense.
     */
    Optional<Object> getProperty(Asset asset, String propertyName);

    Optional<Asset> getAssetByName(String name);

    Optional<Asset> getAssetById(long id);
}
