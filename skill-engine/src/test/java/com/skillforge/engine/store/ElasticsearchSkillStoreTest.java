package com.skillforge.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs ElasticsearchSkillStore against an in-process HTTP stub that answers
 * canned responses per "METHOD path" and records every request it sees.
 * Queued responses for a route are served first, one per request.
 */
class ElasticsearchSkillStoreTest {

    private HttpServer               server;
    private ElasticsearchSkillStore  store;
    private final Map<String, Canned>        routes   = new ConcurrentHashMap<>();
    private final Map<String, Deque<Canned>> queued   = new ConcurrentHashMap<>();
    private final List<Recorded>             requests = new CopyOnWriteArrayList<>();

    private record Canned(int status, String body) {}

    private record Recorded(String method, String path, String authorization, String body) {}

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::answer);
        server.start();
        store = new ElasticsearchSkillStore("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "k3y", "agent_skills", "agent_skill_files", ".elser-2-elasticsearch", new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // Store lifecycle
    // ------------------------------------------------------------------

    @Test
    void ensureStores_createsOnlyMissingIndices() {
        routes.put("HEAD /agent_skills", new Canned(200, null));
        routes.put("HEAD /agent_skill_files", new Canned(404, null));
        routes.put("PUT /agent_skill_files", new Canned(200, "{\"acknowledged\":true}"));

        List<String> created = store.ensureStores();

        assertThat(created).containsExactly("agent_skill_files");
        assertThat(requests).extracting(Recorded::method).containsExactly("HEAD", "HEAD", "PUT");
        assertThat(requests.get(2).body()).contains("\"mappings\"");
        assertThat(requests).extracting(Recorded::authorization).containsOnly("ApiKey k3y");
    }

    @Test
    void deleteStores_neverCreated_deletesNothing() {
        routes.put("HEAD /agent_skills", new Canned(404, null));
        routes.put("HEAD /agent_skill_files", new Canned(404, null));

        assertThat(store.deleteStores()).isEmpty();
        assertThat(store.storesExist()).isFalse();
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Test
    void upsertSkill_writesNewFilesThenMetadataThenDropsOtherRevisions() {
        routes.put("POST /_bulk", new Canned(200, "{\"errors\":false,\"items\":[]}"));
        routes.put("PUT /agent_skills/_doc/alpha", new Canned(200, "{\"result\":\"updated\"}"));
        routes.put("POST /agent_skill_files/_delete_by_query", new Canned(200, "{\"deleted\":2}"));
        SkillMetadata meta = new SkillMetadata("alpha", "Alpha", "", null, "general", List.of(), "system",
                "1.0", 5.0, 0, 1.0, null, 1, "r2", Instant.EPOCH, Instant.EPOCH);
        SkillFile file = new SkillFile("alpha", "SKILL.md", "SKILL.md", "md", "# Alpha\n", 8, Instant.EPOCH, "r2");

        store.upsertSkill(meta, List.of(file));

        assertThat(requests).extracting(r -> r.method() + " " + r.path()).containsExactly(
                "POST /_bulk",
                "PUT /agent_skills/_doc/alpha",
                "POST /agent_skill_files/_delete_by_query");
        assertThat(requests.get(0).body()).contains("\"_id\":\"alpha_r2_SKILL.md\"");
        assertThat(requests.get(1).body()).contains("\"file_count\":1").contains("\"revision\":\"r2\"");
        assertThat(requests.get(2).body())
                .contains("\"term\":{\"skill_id\":\"alpha\"}")
                .contains("\"must_not\":[{\"term\":{\"revision\":\"r2\"}}]");
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Test
    void findFiles_moreThanOneResultWindow_pagesWithSearchAfter() {
        StringBuilder full = new StringBuilder("{\"hits\":{\"hits\":[");
        for (int i = 0; i < ElasticsearchSkillStore.MAX_RESULT_WINDOW; i++) {
            if (i > 0) full.append(',');
            full.append(fileHit(String.format("f%04d.txt", i)));
        }
        full.append("]}}");
        queued.put("POST /agent_skill_files/_search", new ConcurrentLinkedDeque<>(List.of(
                new Canned(200, full.toString()),
                new Canned(200, "{\"hits\":{\"hits\":[" + fileHit("g0000.txt") + "]}}"))));

        List<SkillFile> files = store.findFiles("big");

        assertThat(files).hasSize(ElasticsearchSkillStore.MAX_RESULT_WINDOW + 1);
        assertThat(files.get(files.size() - 1).filePath()).isEqualTo("g0000.txt");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(0).body()).doesNotContain("search_after");
        assertThat(requests.get(1).body()).contains("\"search_after\":[\"f0999.txt\",\"r1\"]");
    }

    @Test
    void listSkillIds_lastPageShort_stopsWithoutAnotherRequest() {
        routes.put("POST /agent_skills/_search", new Canned(200, """
                {"hits":{"hits":[
                  {"_id":"a","_source":{"skill_id":"a"},"sort":["a"]},
                  {"_id":"b","_source":{"skill_id":"b"},"sort":["b"]}
                ]}}
                """));

        assertThat(store.listSkillIds()).containsExactly("a", "b");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).body()).contains("\"sort\":[{\"skill_id\":\"asc\"}]");
    }

    @Test
    void keywordSearch_parsesHitsWithScores() {
        routes.put("POST /agent_skills/_search", new Canned(200, """
                {"hits":{"hits":[
                  {"_id":"adjudicate-storm-claim","_score":7.5,"_source":{
                    "skill_id":"adjudicate-storm-claim","name":"Adjudicate Storm Claim",
                    "domain":"insurance","tags":["claims","storm"],"rating":4.8,
                    "created_at":"2026-01-05T10:00:00Z"}}
                ]}}
                """));

        List<ScoredSkill> hits = store.keywordSearch("storm damage", SkillFilter.domain("Insurance"), 5);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).score()).isEqualTo(7.5);
        SkillMetadata skill = hits.get(0).metadata();
        assertThat(skill.skillId()).isEqualTo("adjudicate-storm-claim");
        assertThat(skill.tags()).containsExactly("claims", "storm");
        assertThat(skill.usageCount()).isZero();
        assertThat(requests.get(0).body())
                .contains("\"multi_match\"")
                .contains("\"term\":{\"domain\":\"insurance\"}");
    }

    @Test
    void reads_missingIndex_returnEmpty() {
        routes.put("POST /agent_skills/_search", new Canned(404, "{\"error\":{\"type\":\"index_not_found_exception\"}}"));
        routes.put("POST /agent_skill_files/_search", new Canned(404, "{\"error\":{\"type\":\"index_not_found_exception\"}}"));

        assertThat(store.listSkillIds()).isEmpty();
        assertThat(store.findFiles("verify-expense-policy")).isEmpty();
        assertThat(store.list(SkillFilter.NONE, 10)).isEmpty();
    }

    @Test
    void findMetadata_missingDocument_returnsEmpty() {
        routes.put("GET /agent_skills/_doc/ghost", new Canned(404, "{\"_id\":\"ghost\",\"found\":false}"));

        Optional<SkillMetadata> found = store.findMetadata("ghost");

        assertThat(found).isEmpty();
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void serverError_raisesStoreUnavailable() {
        routes.put("POST /agent_skills/_search", new Canned(503, "{\"error\":\"cluster_block_exception\"}"));

        assertThatThrownBy(() -> store.similaritySearch("storm", SkillFilter.NONE, 5))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("similaritySearch")
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void unreachableCluster_raisesStoreUnavailable() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        ElasticsearchSkillStore offline = new ElasticsearchSkillStore("http://127.0.0.1:" + port,
                null, "agent_skills", "agent_skill_files", ".elser-2-elasticsearch", new ObjectMapper());

        assertThatThrownBy(offline::listSkillIds)
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("cannot reach Elasticsearch");
    }

    // ------------------------------------------------------------------
    // Stub
    // ------------------------------------------------------------------

    private static String fileHit(String path) {
        return "{\"_source\":{\"skill_id\":\"big\",\"file_name\":\"" + path + "\",\"file_path\":\"" + path
                + "\",\"file_type\":\"txt\",\"file_content\":\"x\",\"file_size_bytes\":1,\"revision\":\"r1\"},"
                + "\"sort\":[\"" + path + "\",\"r1\"]}";
    }

    private void answer(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path   = exchange.getRequestURI().getPath();
        String body   = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(method, path, exchange.getRequestHeaders().getFirst("Authorization"), body));

        Deque<Canned> pending = queued.get(method + " " + path);
        Canned canned = pending != null && !pending.isEmpty()
                ? pending.poll()
                : routes.getOrDefault(method + " " + path, new Canned(404, "{}"));
        if (canned.body() == null || method.equals("HEAD")) {
            exchange.sendResponseHeaders(canned.status(), -1);
            exchange.close();
            return;
        }
        byte[] bytes = canned.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(canned.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
