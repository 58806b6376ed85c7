package com.logprog.json;

import com.logprog.ast.Node;
import com.logprog.ast.StatementList;

/**
 * Interface for deserializing AST nodes from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a whole program, whose root is a StatementList.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized program
     * @throws AstJsonException if deserialization fails or the root is not a StatementList
     */
    StatementList deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to whichever node variant its {@code type} names.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    Node deserializeNode(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
