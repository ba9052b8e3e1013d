package com.qamigrate.compiler.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read-only lookup over one tree: id -> node and type -> nodes.
 * Building the index rejects duplicate ids.
 */
public final class AstIndex {

    private final Map<String, AstNode> byId = new LinkedHashMap<>();
    private final Map<String, List<AstNode>> byType = new LinkedHashMap<>();

    public AstIndex(AstTree tree) {
        for (AstNode node : tree.walk()) {
            if (byId.containsKey(node.getId())) {
                throw new AstStructureException("Duplicate AST node id detected: " + node.getId()
                        + " in " + tree.getFilePath());
            }
            byId.put(node.getId(), node);
            byType.computeIfAbsent(node.getType(), t -> new ArrayList<>()).add(node);
        }
    }

    public AstNode get(String id) {
        return byId.get(id);
    }

    public AstNode require(String id) {
        AstNode node = byId.get(id);
        if (node == null) {
            throw new NoSuchElementException("AST node not found: " + id);
        }
        return node;
    }

    public AstNode parentOf(AstNode node) {
        return node.getParentId() == null ? null : byId.get(node.getParentId());
    }

    /** Nearest ancestor of one of the given types, or {@code null}. */
    public AstNode nearestAncestor(AstNode node, Collection<String> types) {
        AstNode current = parentOf(node);
        while (current != null) {
            if (types.contains(current.getType())) {
                return current;
            }
            current = parentOf(current);
        }
        return null;
    }

    public List<AstNode> byType(String type) {
        return List.copyOf(byType.getOrDefault(type, Collections.emptyList()));
    }

    public int size() {
        return byId.size();
    }
}
