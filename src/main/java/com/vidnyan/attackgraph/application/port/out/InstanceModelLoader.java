package com.vidnyan.attackgraph.application.port.out;

import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.model.InstanceModel;

import java.nio.file.Path;

/**
 * Port for loading an instance model.
 */
public interface InstanceModelLoader {

    /**
     * Load the model at the given path. Asset types are checked against the language.
     */
    InstanceModel load(Path path, LanguageSpecification language);
}
