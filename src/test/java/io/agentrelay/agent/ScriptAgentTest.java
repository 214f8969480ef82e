package io.agentrelay.agent;

import io.agentrelay.model.Message;
import io.agentrelay.model.Response;
import io.agentrelay.model.ResponseStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@DisabledOnOs(OS.WINDOWS)
final class ScriptAgentTest {

    @Test
    void parsesJsonObjectFromStdout() throws Exception {
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", "cat > /dev/null; echo '{\"ok\":true,\"n\":3}'"), 5_000L);

        Response response = agent.process(Message.of("job", Map.of("x", 1)));

        Assertions.assertEquals(ResponseStatus.SUCCESS, response.status());
        Assertions.assertEquals(Boolean.TRUE, response.data().get("ok"));
        Assertions.assertEquals(3, response.data().get("n"));
    }

    @Test
    void receivesMessageJsonOnStdin() throws Exception {
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", "read -r line; printf '{\"echoed\":%s}' \"$line\""), 5_000L);

        Response response = agent.process(Message.of("job", Map.of("x", 1)));

        Assertions.assertEquals(ResponseStatus.SUCCESS, response.status());
        @SuppressWarnings("unchecked")
        Map<String, Object> echoed = (Map<String, Object>) response.data().get("echoed");
        Assertions.assertEquals("job", echoed.get("type"));
        Assertions.assertEquals(Map.of("x", 1), echoed.get("data"));
    }

    @Test
    void outputLargerThanPipeBufferIsReadWithoutTimingOut() throws Exception {
        String script = "cat > /dev/null; printf '{\"blob\":\"'; head -c 200000 /dev/zero | tr '\\0' a; printf '\"}'";
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", script), 5_000L);

        long started = System.nanoTime();
        Response response = agent.process(Message.of("job", Map.of()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assertions.assertEquals(ResponseStatus.SUCCESS, response.status(), response.error());
        Assertions.assertEquals(200_000, ((String) response.data().get("blob")).length());
        Assertions.assertTrue(elapsedMs < 4_000L, "took " + elapsedMs + " ms");
    }

    @Test
    void emptyOutputIsSuccessWithEmptyData() throws Exception {
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", "cat > /dev/null"), 5_000L);

        Response response = agent.process(Message.of("job", Map.of()));

        Assertions.assertEquals(ResponseStatus.SUCCESS, response.status());
        Assertions.assertEquals(Map.of(), response.data());
    }

    @Test
    void nonZeroExitAndNonJsonOutputAreErrors() throws Exception {
        ScriptAgent failing = new ScriptAgent("script", List.of("sh", "-c", "cat > /dev/null; echo broken; exit 3"), 5_000L);
        ScriptAgent chatty = new ScriptAgent("script", List.of("sh", "-c", "cat > /dev/null; echo hello"), 5_000L);

        Response failed = failing.process(Message.of("job", Map.of()));
        Response garbled = chatty.process(Message.of("job", Map.of()));

        Assertions.assertEquals(ResponseStatus.ERROR, failed.status());
        Assertions.assertTrue(failed.error().startsWith("script exit=3"), failed.error());
        Assertions.assertTrue(failed.error().contains("broken"), failed.error());
        Assertions.assertEquals(ResponseStatus.ERROR, garbled.status());
        Assertions.assertTrue(garbled.error().startsWith("script output is not a JSON object"), garbled.error());
    }

    @Test
    void slowScriptTimesOutWithErrorResponse() throws Exception {
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", "sleep 5"), 1_000L);

        long startedAt = System.nanoTime();
        Response response = agent.process(Message.of("job", Map.of()));

        Assertions.assertEquals(ResponseStatus.ERROR, response.status());
        Assertions.assertTrue(response.error().startsWith("script timeout"), response.error());
        Assertions.assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt) < 4_000L);
    }

    @Test
    void interruptionPropagatesAndStopsTheProcess() throws Exception {
        ScriptAgent agent = new ScriptAgent("script", List.of("sh", "-c", "sleep 10"), 30_000L);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread runner = new Thread(() -> {
            try {
                agent.process(Message.of("job", Map.of()));
            } catch (Throwable t) {
                thrown.set(t);
            } finally {
                done.countDown();
            }
        });
        runner.start();
        Thread.sleep(300L);
        runner.interrupt();

        Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
        Assertions.assertTrue(thrown.get() instanceof InterruptedException);
    }

    @Test
    void rejectsInvalidDefinitions() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptAgent(" ", List.of("sh"), 1_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptAgent("script", List.of(), 1_000L));
        Assertions.assertEquals(1_000L, new ScriptAgent("script", List.of("sh"), 10L).timeoutMs());
    }
}
