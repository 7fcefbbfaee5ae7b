package com.vidnyan.attackgraph.adapter.out.model;

import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.AttackerDefinition;
import com.vidnyan.attackgraph.domain.model.InstanceModel;

import java.util.*;

/**
 * Instance model held in memory.
 *
 * An association instance links a group of left assets to a group of right
 * assets. A right asset reaches the left group through {@code leftField}, a
 * left asset reaches the right group through {@code rightField}.
 */
public class InMemoryInstanceModel implements InstanceModel {

    private final String name;
    private final List<Asset> assets;
    private final Map<Long, Asset> assetsById;
    private final Map<String, Asset> assetsByName;
    private final List<ModelAssociation> associations;
    private final List<AttackerDefinition> attackers;

    public record ModelAssociation(
        String name,
        String leftField,
        List<Asset> leftAssets,
        String rightField,
        List<Asset> rightAssets
    ) {
        public ModelAssociation {
            leftAssets = List.copyOf(leftAssets);
            rightAssets = List.copyOf(rightAssets);
        }
    }

    private InMemoryInstanceModel(Builder builder) {
        this.name = builder.name;
        this.assets = List.copyOf(builder.assets.values());
        this.assetsById = Map.copyOf(builder.assets);
        Map<String, Asset> byName = new HashMap<>();
        for (Asset asset : assets) {
            byName.put(asset.name(), asset);
        }
        this.assetsByName = byName;
        this.associations = List.copyOf(builder.associations);
        this.attackers = List.copyOf(builder.attackers);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Asset> assets() {
        return assets;
    }

    @Override
    public List<AttackerDefinition> attackers() {
        return attackers;
    }

    public List<ModelAssociation> associations() {
        return associations;
    }

    @Override
    public List<Asset> getAssociatedAssetsByFieldName(Asset asset, String fieldName) {
        List<Asset> associated = new ArrayList<>();
        for (ModelAssociation association : associations) {
            if (fieldName.equals(association.leftField()) && contains(association.rightAssets(), asset)) {
                associated.addAll(association.leftAssets());
            }
            if (fieldName.equals(association.rightField()) && contains(association.leftAssets(), asset)) {
                associated.addAll(association.rightAssets());
            }
        }
        return associated;
    }

    @Override
    public Optional<Object> getProperty(Asset asset, String propertyName) {
        Asset known = assetsById.getOrDefault(asset.id(), asset);
        return Optional.ofNullable(known.properties().get(propertyName));
    }

    @Override
    public Optional<Asset> getAssetByName(String name) {
        return Optional.ofNullable(assetsByName.get(name));
    }

    @Override
    public Optional<Asset> getAssetById(long id) {
        return Optional.ofNullable(assetsById.get(id));
    }

    private static boolean contains(List<Asset> assets, Asset asset) {
        return assets.stream().anyMatch(a -> a.id() == asset.id());
    }

    public static class Builder {
        private final String name;
        private final Map<Long, Asset> assets = new LinkedHashMap<>();
        private final Set<String> assetNames = new HashSet<>();
        private final List<ModelAssociation> associations = new ArrayList<>();
        private final List<AttackerDefinition> attackers = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * @throws IllegalArgumentException if the id or the name is already used
         */
        public Builder addAsset(Asset asset) {
            if (assets.containsKey(asset.id())) {
                throw new IllegalArgumentException("Asset id " + asset.id() + " already in use");
            }
            if (!assetNames.add(asset.name())) {
                throw new IllegalArgumentException("Asset name already in use: " + asset.name());
            }
            assets.put(asset.id(), asset);
            return this;
        }

        public Builder addAssociation(
                String associationName,
                String leftField, List<Asset> leftAssets,
                String rightField, List<Asset> rightAssets
        ) {
            associations.add(new ModelAssociation(associationName, leftField, leftAssets, rightField, rightAssets));
            return this;
        }

        public Builder addAttacker(AttackerDefinition attacker) {
            attackers.add(attacker);
            return this;
        }

        public InMemoryInstanceModel build() {
            return new InMemoryInstanceModel(this);
        }
    }
}
