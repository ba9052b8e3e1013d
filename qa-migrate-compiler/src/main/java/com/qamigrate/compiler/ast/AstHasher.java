package com.qamigrate.compiler.ast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bottom-up structural hash of a subtree.
 *
 * The payload of a node is its type, its attributes sorted by key (properties plus the
 * declared name) and the ordered hashes of its children, serialized as compact JSON.
 * Ids, parent ids, locations and metadata never enter the payload.
 */
public class AstHasher {

    private static final Gson CANONICAL = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    public String hashTree(AstTree tree) {
        return hashNode(tree.getRoot());
    }

    public String hashNode(AstNode node) {
        JsonArray childHashes = new JsonArray();
        for (AstNode child : node.getChildren()) {
            childHashes.add(hashNode(child));
        }

        // declared name is hashed under "@name"
        Map<String, JsonElement> sorted = new TreeMap<>();
        for (Map.Entry<String, PropertyValue> e : node.getProperties().entrySet()) {
            sorted.put(e.getKey(), e.getValue().toJson());
        }
        sorted.put("@name", node.getName() == null ? JsonNull.INSTANCE : new JsonPrimitive(node.getName()));
        JsonObject attributes = new JsonObject();
        sorted.forEach(attributes::add);

        // keys inserted in sorted order: attributes, children, type
        JsonObject payload = new JsonObject();
        payload.add("attributes", attributes);
        payload.add("children", childHashes);
        payload.addProperty("type", node.getType());

        return sha256(CANONICAL.toJson(payload));
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
