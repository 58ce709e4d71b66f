package io.decisionflow.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.decisionflow.core.model.DecisionEdge;
import io.decisionflow.core.model.DecisionGraph;
import io.decisionflow.core.model.DecisionNode;
import io.decisionflow.core.model.NodeContent;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link DecisionGraph} in the execution engine's JSON shape: {@code {"nodes": [...],
 * "edges": [...]}} with camelCase member names and a {@code type} tag on every node.
 *
 * <p>Thread-safe.
 */
public final class DecisionGraphWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DecisionGraphWriter() {}

    public static ObjectNode toJson(DecisionGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode nodes = root.putArray("nodes");
        graph.nodes().forEach(node -> nodes.add(nodeToJson(node)));
        ArrayNode edges = root.putArray("edges");
        graph.edges().forEach(edge -> edges.add(edgeToJson(edge)));
        return root;
    }

    /** Serializes the graph to a compact JSON string. */
    public static String write(DecisionGraph graph) {
        try {
            return MAPPER.writeValueAsString(toJson(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize decision graph", e);
        }
    }

    private static ObjectNode nodeToJson(DecisionNode node) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("id", node.id());
        json.put("name", node.name());
        NodeContent content = node.content();
        json.put("type", content.type());
        if (content instanceof NodeContent.DecisionTable table) {
            ObjectNode body = json.putObject("content");
            body.put("hitPolicy", table.hitPolicy().wireName());
            ArrayNode rules = body.putArray("rules");
            table.rules().forEach(row -> rules.add(rowToJson(row)));
            fieldsToJson(body.putArray("inputs"), table.inputs());
            fieldsToJson(body.putArray("outputs"), table.outputs());
        } else if (content instanceof NodeContent.Expression expression) {
            ArrayNode expressions = json.putObject("content").putArray("expressions");
            for (NodeContent.NamedExpression named : expression.expressions()) {
                expressions.addObject()
                        .put("id", named.id())
                        .put("key", named.key())
                        .put("value", named.value());
            }
        } else if (content instanceof NodeContent.Function function) {
            json.put("content", function.source());
        }
        return json;
    }

    private static ObjectNode rowToJson(Map<String, String> row) {
        ObjectNode json = MAPPER.createObjectNode();
        row.forEach(json::put);
        return json;
    }

    private static void fieldsToJson(ArrayNode target, List<NodeContent.Field> fields) {
        for (NodeContent.Field field : fields) {
            ObjectNode json = target.addObject().put("id", field.id()).put("name", field.name());
            if (field.field() != null) {
                json.put("field", field.field());
            }
        }
    }

    private static ObjectNode edgeToJson(DecisionEdge edge) {
        ObjectNode json = MAPPER.createObjectNode()
                .put("id", edge.id())
                .put("sourceId", edge.sourceId())
                .put("targetId", edge.targetId());
        edge.handle().ifPresent(handle -> json.put("sourceHandle", handle));
        return json;
    }
}
