package com.qamigrate.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, language-agnostic AST node.
 *
 * Children are owned by the node; {@code parentId} is a plain back reference used for
 * upward lookup through {@link AstIndex}. Structural invariants are enforced here:
 * id and type are non-empty, a node never owns itself, and a child belongs to one parent.
 */
public final class AstNode {

    private final String id;
    private final String type;
    private final String name;
    private final Map<String, PropertyValue> properties;
    private final List<AstNode> children = new ArrayList<>();
    private final AstLocation location;
    private final Map<String, Object> metadata;
    private String parentId;

    public AstNode(String id, String type, String name,
                   Map<String, PropertyValue> properties,
                   AstLocation location,
                   Map<String, Object> metadata) {
        if (id == null || id.isEmpty()) {
            throw new AstStructureException("AstNode.id cannot be empty");
        }
        if (type == null || type.isEmpty()) {
            throw new AstStructureException("AstNode.type cannot be empty (node " + id + ")");
        }
        this.id = id;
        this.type = type;
        this.name = name;
        this.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
        this.location = location;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public AstNode(String id, String type, String name, Map<String, PropertyValue> properties) {
        this(id, type, name, properties, null, null);
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public String getName() { return name; }
    public String getParentId() { return parentId; }
    public AstLocation getLocation() { return location; }

    public Map<String, PropertyValue> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** String value of a property, or {@code null} if missing or not a string. */
    public String property(String key) {
        PropertyValue value = properties.get(key);
        return value != null ? value.asString() : null;
    }

    public PropertyValue propertyValue(String key) {
        PropertyValue value = properties.get(key);
        return value != null ? value : PropertyValue.absent();
    }

    public boolean hasType(String candidate) {
        return type.equals(candidate);
    }

    /**
     * Attach {@code child} as the last child of this node and set its parent id.
     *
     * @throws AstStructureException on self-attachment or if the child already has a parent,
     *         including this node
     */
    public void addChild(AstNode child) {
        if (child == null) {
            throw new AstStructureException("Cannot attach a null child to " + id);
        }
        if (child == this || child.id.equals(id)) {
            throw new AstStructureException("Node " + id + " cannot be its own child");
        }
        if (child.parentId != null) {
            throw new AstStructureException("Child " + child.id + " already belongs to "
                    + child.parentId + ", cannot attach to " + id);
        }
        child.parentId = id;
        children.add(child);
    }

    /** Depth-first, pre-order traversal starting at this node. */
    public List<AstNode> walk() {
        List<AstNode> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    /** Depth-first, post-order traversal: every node after its descendants. */
    public List<AstNode> walkPostOrder() {
        List<AstNode> out = new ArrayList<>();
        collectPostOrder(this, out);
        return out;
    }

    private static void collectPostOrder(AstNode node, List<AstNode> out) {
        for (AstNode child : node.children) {
            collectPostOrder(child, out);
        }
        out.add(node);
    }

    private static void collect(AstNode node, List<AstNode> out) {
        out.add(node);
        for (AstNode child : node.children) {
            collect(child, out);
        }
    }

    @Override
    public String toString() {
        return "AstNode{" + id + ", type=" + type + (name != null ? ", name=" + name : "") + "}";
    }
}
