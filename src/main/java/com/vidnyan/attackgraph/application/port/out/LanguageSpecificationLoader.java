package com.vidnyan.attackgraph.application.port.out;

import com.vidnyan.attackgraph.domain.language.LanguageSpecification;

import java.nio.file.Path;

/**
 * Port for loading a compiled language specification.
 * Implemented by adapters that read langspec files or archives.
 */
public interface LanguageSpecificationLoader {

    /**
     * Load the specification stored at the given path.
     * @throws com.vidnyan.attackgraph.domain.language.LanguageSpecificationException if the content is invalid
     */
    LanguageSpecification load(Path path);
}
