import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.panini.script.PaniniScript;
import com.panini.script.server.PaniniHttpServer;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class PaniniHttpServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private PaniniHttpServer server;

    @BeforeEach
    void start() throws Exception {
        server = new PaniniHttpServer(new PaniniScript(), 0, 2);
        server.start();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private HttpResponse<String> post(String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/api/run"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Test
    void runReturnsOutputAndErrors() throws Exception {
        String code = "x = 2\nदर्श(x + 3)\nbogus\n";
        HttpResponse<String> resp = post(om.writeValueAsString(om.createObjectNode().put("code", code)));
        assertEquals(200, resp.statusCode());

        JsonNode json = om.readTree(resp.body());
        assertEquals("5\n", json.get("output").asText());
        assertEquals(1, json.get("errors").size());
        assertEquals("Line 3: अज्ञाता आज्ञा: bogus", json.get("errors").get(0).asText());
    }

    @Test
    void requestsDoNotShareState() throws Exception {
        post(om.writeValueAsString(om.createObjectNode().put("code", "x = 1")));
        HttpResponse<String> resp = post(om.writeValueAsString(om.createObjectNode().put("code", "दर्श(x)")));
        assertEquals("null\n", om.readTree(resp.body()).get("output").asText());
    }

    @Test
    void missingCodeIsBadRequest() throws Exception {
        HttpResponse<String> resp = post("{\"source\": \"x = 1\"}");
        assertEquals(400, resp.statusCode());
        assertTrue(om.readTree(resp.body()).has("error"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        assertEquals(400, post("{not json").statusCode());
    }

    @Test
    void getOnRunIsNotAllowed() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/api/run")).GET().build();
        assertEquals(405, client.send(req, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void health() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/health")).GET().build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, resp.statusCode());
        JsonNode json = om.readTree(resp.body());
        assertEquals("healthy", json.get("status").asText());
        assertEquals("paanini-ide", json.get("service").asText());
        assertEquals(PaniniScript.VERSION, json.get("version").asText());
    }
}
