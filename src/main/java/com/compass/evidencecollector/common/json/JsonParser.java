package com.compass.evidencecollector.common.json;

/**
 * Defines the contract for parsing JSON data, such as queue message bodies and stored job results.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.compass.evidencecollector.exception.json.JsonParsingException if the JSON is
     *                                                                           unreadable.
     */
    <T> T parseObject(String json, Class<T> valueType);
}
