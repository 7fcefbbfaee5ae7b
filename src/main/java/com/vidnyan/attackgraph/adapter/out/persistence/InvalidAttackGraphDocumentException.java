package com.vidnyan.attackgraph.adapter.out.persistence;

/**
 * A persisted attack graph refers to steps, attackers or assets it does not contain.
 */
public class InvalidAttackGraphDocumentException extends RuntimeException {

    public InvalidAttackGraphDocumentException(String message) {
        super(message);
    }
}
