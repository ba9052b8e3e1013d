package com.qamigrate.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Creates canonical nodes with deterministic ids of the form {@code <lowercased-type>_<sequence>}.
 *
 * The sequence belongs to this instance; use one builder per source file so that an
 * identical traversal order yields identical ids.
 */
public class AstBuilder {

    private int counter = 0;
    private final Map<String, AstNode> nodesById = new LinkedHashMap<>();

    public AstNode createNode(String type, Map<String, PropertyValue> properties, AstNode parent) {
        return createNode(type, null, properties, parent, null);
    }

    public AstNode createNode(String type, String name, Map<String, PropertyValue> properties, AstNode parent) {
        return createNode(type, name, properties, parent, null);
    }

    public AstNode createNode(String type, String name, Map<String, PropertyValue> properties,
                              AstNode parent, AstLocation location) {
        if (type == null || type.isEmpty()) {
            throw new AstStructureException("Cannot create a node with an empty type");
        }
        String id = nextId(type);
        AstNode node = new AstNode(id, type, name, properties, location, null);
        nodesById.put(id, node);
        if (parent != null) {
            parent.addChild(node);
        }
        return node;
    }

    /**
     * Wraps a finished root; performs no mutation.
     */
    public AstTree buildTree(AstNode root, String language, String filePath) {
        return new AstTree(root, language, filePath);
    }

    /** Nodes created so far, in creation order. */
    public Map<String, AstNode> createdNodes() {
        return Collections.unmodifiableMap(nodesById);
    }

    private String nextId(String type) {
        counter++;
        return type.toLowerCase(Locale.ROOT) + "_" + counter;
    }
}
