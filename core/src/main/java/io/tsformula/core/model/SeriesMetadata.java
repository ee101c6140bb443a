package io.tsformula.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Core (internal) metadata of a series: timezone awareness and the index / value types it
 * produces. For formulas it is derived at registration time from the metadata of the leaves.
 *
 * @param tzaware    whether the value dates carry a timezone
 * @param indexType  logical index type
 * @param valueType  logical value type
 * @param indexDtype physical index type tag
 * @param valueDtype physical value type tag
 */
public record SeriesMetadata(
        boolean tzaware, String indexType, String valueType, String indexDtype, String valueDtype) {

    /** Metadata of a float series with a tz-aware (UTC) index. */
    public static final SeriesMetadata TZAWARE =
            new SeriesMetadata(true, "datetime64[ns, UTC]", "float64", "|M8[ns]", "<f8");

    /** Metadata of a float series with a naive index. */
    public static final SeriesMetadata NAIVE =
            new SeriesMetadata(false, "datetime64[ns]", "float64", "<M8[ns]", "<f8");

    /** Returns the default core metadata for the given awareness. */
    public static SeriesMetadata defaults(boolean tzaware) {
        return tzaware ? TZAWARE : NAIVE;
    }

    /** Renders this metadata as the JSON object stored next to user metadata. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("tzaware", tzaware);
        node.put("index_type", indexType);
        node.put("value_type", valueType);
        node.put("index_dtype", indexDtype);
        node.put("value_dtype", valueDtype);
        return node;
    }
}
