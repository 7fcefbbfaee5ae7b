package com.vidnyan.attackgraph.domain.language;

/**
 * Thrown when a language specification cannot be read or is queried for
 * something it does not declare.
 */
public class LanguageSpecificationException extends RuntimeException {

    public LanguageSpecificationException(String message) {
        super(message);
    }

    public LanguageSpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
