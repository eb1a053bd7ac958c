package com.esfront.json;

import com.esfront.TokenAndSpan;
import com.esfront.ast.Node;

import java.util.List;

/**
 * Interface for serializing AST nodes and token streams to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a lexer token stream, error tokens included, to a JSON array.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeTokens(List<TokenAndSpan> tokens) throws AstJsonException;
}
