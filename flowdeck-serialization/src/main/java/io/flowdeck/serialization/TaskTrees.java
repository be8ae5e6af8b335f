package io.flowdeck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowdeck.core.task.Task;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Shape checks and conversions for the JSON trees that hold nested tasks.
///
/// Each reader returns `null` when the tree does not have the expected shape, so callers can
/// keep the original value instead of failing.
final class TaskTrees {

    private TaskTrees() {}

    /// `[task, ...]`
    static List<Task> readTaskList(ObjectMapper mapper, JsonNode node)
            throws JsonProcessingException {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<Task> tasks = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            if (!child.isObject()) {
                return null;
            }
            tasks.add(mapper.treeToValue(child, Task.class));
        }
        return tasks;
    }

    /// `{label: [task, ...], ...}`
    static Map<String, List<Task>> readCaseMap(ObjectMapper mapper, JsonNode node)
            throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, List<Task>> cases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            List<Task> children = readTaskList(mapper, entry.getValue());
            if (children == null) {
                return null;
            }
            cases.put(entry.getKey(), children);
        }
        return cases;
    }

    /// `[[task, ...], ...]`
    static List<List<Task>> readBranches(ObjectMapper mapper, JsonNode node)
            throws JsonProcessingException {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<List<Task>> branches = new ArrayList<>(node.size());
        for (JsonNode branch : node) {
            List<Task> children = readTaskList(mapper, branch);
            if (children == null) {
                return null;
            }
            branches.add(children);
        }
        return branches;
    }

    /// Converts an arbitrary tree to plain Java values (maps, lists, strings, numbers).
    static Object toPlainValue(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, Object.class);
    }
}
