package io.tsformula.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A registered formula: a named derived series defined by an expression.
 *
 * @param name           unique series name (never shared with a primary series)
 * @param text           canonical source text, as produced by the serializer
 * @param contentHash    hash of the fully expanded, serialized tree
 * @param coreMetadata   derived core metadata, or {@code null} when the leaves' timezone
 *                       awareness is unknown
 * @param userMetadata   opaque user metadata (a JSON object, never {@code null})
 */
public record Formula(
        String name, String text, String contentHash, SeriesMetadata coreMetadata, ObjectNode userMetadata) {

    public Formula {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
        userMetadata = userMetadata != null ? userMetadata.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public Formula withText(String newText, String newHash) {
        return new Formula(name, newText, newHash, coreMetadata, userMetadata);
    }

    public Formula withName(String newName) {
        return new Formula(newName, text, contentHash, coreMetadata, userMetadata);
    }

    public Formula withContentHash(String newHash) {
        return new Formula(name, text, newHash, coreMetadata, userMetadata);
    }

    public Formula withUserMetadata(ObjectNode metadata) {
        return new Formula(name, text, contentHash, coreMetadata, metadata);
    }

    /**
     * Returns user metadata merged with the core metadata; core keys win. Returns a fresh copy the
     * caller may mutate.
     */
    public ObjectNode metadata() {
        ObjectNode merged = userMetadata.deepCopy();
        if (coreMetadata != null) {
            merged.setAll(coreMetadata.toJson());
        }
        return merged;
    }
}
