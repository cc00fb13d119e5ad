package com.metadata.disambiguation.ids;

import com.metadata.disambiguation.core.model.Candidate;

/**
 * Resolves an opaque public id to the persisted record it references.
 */
public interface ObfuscatedIdResolver {

    /**
     * @param id the opaque id carried by an incoming node
     * @return the referenced record
     * @throws InvalidIdException if the id is malformed or references nothing
     */
    Candidate resolve(String id) throws InvalidIdException;
}
