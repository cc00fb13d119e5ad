package com.metadata.disambiguation.names;

/**
 * Parses free-text personal names into structured components.
 */
public interface NameParser {

    /**
     * Parses a name. Null or blank input yields {@link HumanName#EMPTY}.
     *
     * @param name the raw name
     * @return the parsed components, never null
     */
    HumanName parse(String name);
}
