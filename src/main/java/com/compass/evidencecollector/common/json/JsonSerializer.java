package com.compass.evidencecollector.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its compact JSON representation.
     *
     * @throws com.compass.evidencecollector.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);
}
