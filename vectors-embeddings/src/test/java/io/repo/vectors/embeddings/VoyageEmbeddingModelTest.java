package io.repo.vectors.embeddings;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

import static org.junit.jupiter.api.Assertions.*;

class VoyageEmbeddingModelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Deque<Integer> statuses = new ConcurrentLinkedDeque<>();
    private final List<JsonNode> requests = new ArrayList<>();
    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", exchange -> {
            JsonNode request = mapper.readTree(exchange.getRequestBody());
            synchronized (requests) {
                requests.add(request);
            }
            Integer status = statuses.poll();
            int code = status != null ? status : 200;

            String body;
            if (code == 200) {
                StringBuilder data = new StringBuilder();
                int inputs = request.get("input").size();
                // Reverse order, the client must sort by index
                for (int i = inputs - 1; i >= 0; i--) {
                    if (data.length() > 0) data.append(',');
                    data.append("{\"index\":").append(i).append(",\"embedding\":[").append(i).append(",1.0]}");
                }
                body = "{\"data\":[" + data + "],\"usage\":{\"total_tokens\":7}}";
            } else {
                body = "{\"detail\":\"error\"}";
            }

            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(code, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private VoyageEmbeddingModel model() {
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/embeddings");
        return new VoyageEmbeddingModel(EmbeddingConfig.voyage()
            .withApiKey("test-key")
            .withDimensions(2)
            .withEndpoint(endpoint)
            .withMaxRetries(2));
    }

    @Test
    void testEmbedBatchSortsByIndex() {
        List<float[]> vectors = model().embedBatch(List.of("first", "second", "third"));

        assertEquals(3, vectors.size());
        assertArrayEquals(new float[]{0f, 1f}, vectors.get(0));
        assertArrayEquals(new float[]{2f, 1f}, vectors.get(2));
    }

    @Test
    void testRequestFields() {
        model().embedBatch(List.of("loadConfig"));
        model().embedQueries(List.of("where is config loaded"));

        JsonNode document = requests.get(0);
        assertEquals("voyage-code-3", document.get("model").asText());
        assertEquals("document", document.get("input_type").asText());
        assertEquals(2, document.get("output_dimension").asInt());
        assertEquals("load Config", document.get("input").get(0).asText());

        assertEquals("query", requests.get(1).get("input_type").asText());
    }

    @Test
    void testRetriesRateLimit() {
        statuses.add(429);

        List<float[]> vectors = model().embedBatch(List.of("text"));

        assertEquals(1, vectors.size());
        assertEquals(2, requests.size());
    }

    @Test
    void testClientErrorIsNotRetried() {
        statuses.add(401);

        EmbeddingApiException e = assertThrows(EmbeddingApiException.class,
            () -> model().embedBatch(List.of("text")));

        assertEquals(401, e.getStatusCode());
        assertEquals(1, requests.size());
    }

    @Test
    void testGivesUpAfterMaxRetries() {
        statuses.add(503);
        statuses.add(503);

        EmbeddingApiException e = assertThrows(EmbeddingApiException.class,
            () -> model().embedBatch(List.of("text")));

        assertEquals(503, e.getStatusCode());
        assertEquals(2, requests.size());
    }

    @Test
    void testModelAliasesAndId() {
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/embeddings");
        VoyageEmbeddingModel lite = new VoyageEmbeddingModel(EmbeddingConfig.voyage()
            .withApiKey("test-key").withModel("lite").withEndpoint(endpoint));

        assertEquals("voyage:voyage-3.5-lite:1024", lite.getModelId());
    }
}
