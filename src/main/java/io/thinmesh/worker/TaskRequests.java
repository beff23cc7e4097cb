package io.thinmesh.worker;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.thinmesh.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * JSON request body shared by script executors and the HTTP model gateway.
 */
final class TaskRequests {
    private TaskRequests() {
    }

    static byte[] toJson(TaskContext context) {
        Base64.Encoder b64 = Base64.getEncoder();
        ObjectNode root = Jsons.compactMapper().createObjectNode();
        root.put("run_id", context.runId());
        root.put("task_key", context.taskKey());
        root.put("task_type", context.taskType());
        root.put("attempt", context.attempt());
        root.put("params_base64", b64.encodeToString(context.params()));
        ArrayNode inputs = root.putArray("inputs");
        for (int i = 0; i < context.inputs().size(); i++) {
            ObjectNode input = inputs.addObject();
            input.put("hash", context.inputHashes().get(i));
            input.put("content_base64", b64.encodeToString(context.input(i)));
        }
        return Jsons.toCompactJson(root).getBytes(StandardCharsets.UTF_8);
    }
}
