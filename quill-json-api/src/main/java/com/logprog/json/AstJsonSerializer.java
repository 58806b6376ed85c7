package com.logprog.json;

import com.logprog.ast.Node;

/**
 * Writes AST nodes as JSON. Each node becomes an object whose {@code type} property
 * names its variant.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and everything below it to compact JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node to indented JSON, for reading by people.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
