package org.stellora.runtime.contracts;

import java.util.Map;

import org.stellora.runtime.model.ResourceKind;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * JSON form of a {@link GalaxySnapshot}. Enum values are written by name, resource maps
 * as objects keyed by kind name, and {@code null} fields (an UNKNOWN actor's strategy,
 * an explorer without rejections) are omitted.
 */
public final class GalaxySnapshotJson {

    private static final Gson GSON = new Gson();
    private static final Gson PRETTY_GSON = new GsonBuilder().setPrettyPrinting().create();

    private GalaxySnapshotJson() {
    }

    public static String toJson(GalaxySnapshot snapshot) {
        return GSON.toJson(snapshot);
    }

    public static String toPrettyJson(GalaxySnapshot snapshot) {
        return PRETTY_GSON.toJson(snapshot);
    }

    /**
     * @param json A document produced by {@link #toJson(GalaxySnapshot)}.
     * @return The snapshot.
     * @throws IllegalArgumentException if the document is not a valid snapshot.
     */
    public static GalaxySnapshot fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid snapshot document: " + e.getMessage(), e);
        }
        if (root.isJsonNull()) {
            throw new IllegalArgumentException("Empty snapshot document");
        }
        validate(root);
        try {
            return GSON.fromJson(root, GalaxySnapshot.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid snapshot document: " + e.getMessage(), e);
        }
    }

    // Record constructors reject null lists and null map entries with exceptions Gson does not wrap.
    private static void validate(JsonElement root) {
        if (!root.isJsonObject()) {
            throw invalid("expected an object");
        }
        JsonObject document = root.getAsJsonObject();
        JsonElement tick = document.get("tick");
        if (tick == null || !tick.isJsonPrimitive() || !tick.getAsJsonPrimitive().isNumber()) {
            throw invalid("'tick' must be a number");
        }
        for (JsonElement planet : array(document, "planets")) {
            JsonObject fields = object(planet, "planets");
            counts(fields, "inventory");
            kinds(fields, "supportedKinds");
        }
        for (JsonElement explorer : array(document, "explorers")) {
            counts(object(explorer, "explorers"), "inventory");
        }
        for (JsonElement id : array(document, "criticalNodes")) {
            if (!id.isJsonPrimitive() || !id.getAsJsonPrimitive().isNumber()) {
                throw invalid("'criticalNodes' must hold planet ids");
            }
        }
    }

    private static JsonArray array(JsonObject document, String name) {
        JsonElement element = document.get(name);
        if (element == null || !element.isJsonArray()) {
            throw invalid("'" + name + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static JsonObject object(JsonElement element, String owner) {
        if (!element.isJsonObject()) {
            throw invalid("'" + owner + "' must hold objects");
        }
        return element.getAsJsonObject();
    }

    private static void counts(JsonObject fields, String name) {
        JsonElement element = fields.get(name);
        if (element == null || element.isJsonNull()) {
            return;
        }
        if (!element.isJsonObject()) {
            throw invalid("'" + name + "' must be an object");
        }
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            kind(entry.getKey());
            JsonElement count = entry.getValue();
            if (!count.isJsonPrimitive() || !count.getAsJsonPrimitive().isNumber()) {
                throw invalid("count of " + entry.getKey() + " must be a number");
            }
        }
    }

    private static void kinds(JsonObject fields, String name) {
        JsonElement element = fields.get(name);
        if (element == null || element.isJsonNull()) {
            return;
        }
        if (!element.isJsonArray()) {
            throw invalid("'" + name + "' must be an array");
        }
        for (JsonElement kind : element.getAsJsonArray()) {
            if (!kind.isJsonPrimitive() || !kind.getAsJsonPrimitive().isString()) {
                throw invalid("'" + name + "' must hold resource names");
            }
            kind(kind.getAsString());
        }
    }

    private static void kind(String name) {
        try {
            ResourceKind.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw invalid("unknown resource " + name);
        }
    }

    private static IllegalArgumentException invalid(String detail) {
        return new IllegalArgumentException("Invalid snapshot document: " + detail);
    }
}
