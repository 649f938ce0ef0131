import com.fluxo.script.FluxoScript;
import com.fluxo.script.rpc.FluxoRpcServer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FluxoRpcServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private FluxoRpcServer server;

    @BeforeEach
    void setUp() {
        server = new FluxoRpcServer(0, 1, FluxoScript::new);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.close();
    }

    @Test
    void ping_answersPong() throws Exception {
        ObjectNode resp = server.process(om.readTree("{\"id\":1,\"method\":\"ping\"}"));
        assertEquals(1, resp.get("id").asInt());
        assertTrue(resp.get("ok").asBoolean());
        assertEquals("pong", resp.get("result").asText());
    }

    @Test
    void execute_returnsTheEventLog() throws Exception {
        String req = "{\"id\":\"r1\",\"method\":\"execute\",\"args\":{\"entryPoint\":\"/s.fxo\",\"files\":["
                + "{\"path\":\"/s.fxo\",\"code\":\"import from \\\"/m\\\" { add }\\nconsole.log(add(2,3))\"},"
                + "{\"path\":\"/m.fxm\",\"code\":\"module m { export function add(a,b){ return a+b } }\"}]}}";

        ObjectNode resp = server.process(om.readTree(req));

        assertTrue(resp.get("ok").asBoolean(), resp.toString());
        JsonNode events = resp.get("result").get("events");
        assertEquals(1, events.size());
        assertEquals("log", events.get(0).get("kind").asText());
        assertEquals("5", events.get(0).get("message").asText());
        assertEquals("/s.fxo", events.get(0).get("sourceFile").asText());
    }

    @Test
    void execute_withoutFiles_isRejected() throws Exception {
        ObjectNode resp = server.process(om.readTree("{\"method\":\"execute\",\"args\":{}}"));
        assertFalse(resp.get("ok").asBoolean());
        assertTrue(resp.get("error").asText().contains("files"));
    }

    @Test
    void unknownMethod_isAnError() throws Exception {
        ObjectNode resp = server.process(om.readTree("{\"method\":\"dance\"}"));
        assertFalse(resp.get("ok").asBoolean());
        assertEquals("Unknown method: dance", resp.get("error").asText());
    }
}
