package com.vidnyan.attackgraph.application.port.out;

import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.model.InstanceModel;

import java.nio.file.Path;

/**
 * Port for persisting attack graphs.
 * The file extension selects the format.
 */
public interface AttackGraphRepository {

    void save(AttackGraph graph, Path path);

    /**
     * Load a graph. Without a model the nodes carry no asset.
     * @param model model to re-attach assets from, may be null
     */
    AttackGraph load(Path path, InstanceModel model);
}
