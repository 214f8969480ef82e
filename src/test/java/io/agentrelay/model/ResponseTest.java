package io.agentrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class ResponseTest {

    @Test
    void serializesWireFieldNames() throws Exception {
        Response response = Response.timeout(
                "orchestrator_agent",
                Map.of("workflow_type", "project_initialization"),
                "Workflow 'project_initialization' timed out after 0.2 seconds",
                PartialProgress.of(List.of("generate_plan"), 0.2)
        );

        JsonNode json = Jsons.mapper().readTree(Jsons.toJson(response));

        Assertions.assertEquals("orchestrator_agent", json.path("agent_id").asText());
        Assertions.assertEquals("timeout", json.path("status").asText());
        Assertions.assertEquals(1, json.path("partial_progress").path("total_steps_completed").asInt());
        Assertions.assertEquals("generate_plan", json.path("partial_progress").path("completed_steps").get(0).asText());
        Assertions.assertEquals(0.2, json.path("partial_progress").path("timeout_seconds").asDouble(), 1e-9);
        Assertions.assertFalse(json.has("success"));
    }

    @Test
    void omitsPartialProgressOutsideTimeouts() throws Exception {
        JsonNode json = Jsons.mapper().readTree(Jsons.toJson(Response.success("echo", Map.of("n", 1))));

        Assertions.assertFalse(json.has("partial_progress"));
        Assertions.assertEquals("success", json.path("status").asText());
        Assertions.assertTrue(json.has("error"));
    }

    @Test
    void rejectsPartialProgressOnNonTimeoutStatus() {
        PartialProgress progress = PartialProgress.of(List.of(), 1.0);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Response("a", null, ResponseStatus.ERROR, Map.of(), "x", progress));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Response("a", null, null, Map.of(), null, null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> Response.timeout("a", Map.of(), "late", null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new PartialProgress(List.of("a"), 2, 1.0));
    }

    @Test
    void messageRoundTripsThroughJson() throws Exception {
        Message message = Message.of("generate_plan", Map.of("project", "apollo"));

        Message parsed = Jsons.mapper().readValue(Jsons.toJson(message), Message.class);

        Assertions.assertEquals(message, parsed);
        Assertions.assertEquals(ResponseStatus.PENDING, ResponseStatus.fromString("PENDING"));
    }
}
