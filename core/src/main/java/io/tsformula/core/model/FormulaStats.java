package io.tsformula.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structural statistics of a formula's dependency tree.
 *
 * @param name        the formula name
 * @param degree      maximum depth of named formula references below the formula (1 when the
 *                    formula only references primaries)
 * @param namedNodes  formula names reached, with the number of times each is referenced
 * @param primaries   primary series reached, with the number of times each is referenced
 * @param autotrophic autotrophic operator name to the serialized call sites found in the fully
 *                    expanded tree
 */
public record FormulaStats(
        String name,
        int degree,
        SortedMap<String, Integer> namedNodes,
        SortedMap<String, Integer> primaries,
        SortedMap<String, List<String>> autotrophic) {

    private static final ObjectMapper JSON = new ObjectMapper();

    public FormulaStats {
        namedNodes = Collections.unmodifiableSortedMap(new TreeMap<>(namedNodes));
        primaries = Collections.unmodifiableSortedMap(new TreeMap<>(primaries));
        TreeMap<String, List<String>> autos = new TreeMap<>();
        autotrophic.forEach((k, v) -> autos.put(k, List.copyOf(v)));
        autotrophic = Collections.unmodifiableSortedMap(autos);
    }

    /** Total number of named formula references (with repetitions). */
    public int namedNodeCount() {
        return namedNodes.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Total number of primary references (with repetitions). */
    public int primaryCount() {
        return primaries.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Renders the statistics as a JSON object. */
    public ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        node.put("name", name);
        node.put("degree", degree);
        node.set("named-nodes", JSON.valueToTree(Map.copyOf(namedNodes)));
        node.set("primaries", JSON.valueToTree(Map.copyOf(primaries)));
        node.set("autotrophic", JSON.valueToTree(Map.copyOf(autotrophic)));
        return node;
    }
}
