package com.qamigrate.compiler.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes IR to pretty-printed JSON with object keys sorted at every level and
 * {@code null} values kept, so that unchanged input produces byte-identical files.
 *
 * The whole document is rendered before the file system is touched, then written to a
 * temporary sibling and moved into place; a failure never leaves a partial file.
 */
public class IrWriter {

    public static class IrWriteException extends RuntimeException {
        public IrWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public void write(Path outputPath, Object data) {
        String json = render(data);

        Path target = outputPath.toAbsolutePath();
        Path dir = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            IrWriteException failure = new IrWriteException("Failed to write IR to " + target + ": " + e.getMessage(), e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
        System.err.println("[qa-migrate] IR written: " + target);
    }

    /** The exact text {@link #write} puts on disk. */
    public String render(Object data) {
        JsonElement tree;
        try {
            tree = GSON.toJsonTree(data);
        } catch (RuntimeException e) {
            throw new IrWriteException("IR is not JSON-serializable: " + e.getMessage(), e);
        }
        return GSON.toJson(sortKeys(tree)) + "\n";
    }

    static JsonElement sortKeys(JsonElement element) {
        if (element.isJsonObject()) {
            Map<String, JsonElement> sorted = new TreeMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                sorted.put(entry.getKey(), sortKeys(entry.getValue()));
            }
            JsonObject out = new JsonObject();
            sorted.forEach(out::add);
            return out;
        }
        if (element.isJsonArray()) {
            JsonArray out = new JsonArray();
            for (JsonElement item : element.getAsJsonArray()) {
                out.add(sortKeys(item));
            }
            return out;
        }
        return element;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
