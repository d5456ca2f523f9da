package com.skillforge.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.model.SkillMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Record Stores backed by two Elasticsearch indices.
 *
 * Talks to the REST API directly with java.net.http.HttpClient and Jackson,
 * the same way the rest of the service talks HTTP. Index mappings are loaded
 * from {@code classpath:elasticsearch/<index>.json}; the metadata index
 * carries a {@code semantic_text} field ({@code semantic_content}) whose
 * embeddings the cluster computes with the configured inference endpoint.
 *
 * Unbounded reads (a skill's files, every skill id, a domain listing) page
 * through the index with {@code search_after} on a unique sort, so they are
 * never cut off at the result window.
 *
 * HTTP 404 on a read means the index was never created and yields an empty
 * result. Connection failures and 5xx responses raise
 * {@link StoreUnavailableException}.
 */
public class ElasticsearchSkillStore implements SkillStore {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchSkillStore.class);

    static final int              MAX_RESULT_WINDOW = 1000;
    private static final Duration REQUEST_TIMEOUT   = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       metadataIndex;
    private final String       filesIndex;
    private final String       inferenceId;

    public ElasticsearchSkillStore(String baseUrl,
                                   String apiKey,
                                   String metadataIndex,
                                   String filesIndex,
                                   String inferenceId,
                                   ObjectMapper objectMapper) {
        this.baseUrl       = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey        = apiKey;
        this.metadataIndex = metadataIndex;
        this.filesIndex    = filesIndex;
        this.inferenceId   = inferenceId;
        this.json          = objectMapper;
        this.http          = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override public String metadataStoreName() { return metadataIndex; }
    @Override public String fileStoreName()     { return filesIndex; }

    // ------------------------------------------------------------------
    // Store lifecycle
    // ------------------------------------------------------------------

    @Override
    public boolean storesExist() {
        return indexExists(metadataIndex) && indexExists(filesIndex);
    }

    @Override
    public List<String> ensureStores() {
        List<String> created = new ArrayList<>();
        for (String index : List.of(metadataIndex, filesIndex)) {
            if (indexExists(index)) {
                log.info("Index '{}' already exists", index);
                continue;
            }
            log.info("Creating index '{}'...", index);
            send("PUT", "/" + index, mappingFor(index), "createIndex", index);
            created.add(index);
        }
        return created;
    }

    @Override
    public List<String> deleteStores() {
        List<String> deleted = new ArrayList<>();
        for (String index : List.of(metadataIndex, filesIndex)) {
            if (!indexExists(index)) {
                log.info("Index '{}' does not exist, skipping", index);
                continue;
            }
            log.info("Deleting index '{}'...", index);
            send("DELETE", "/" + index, null, "deleteIndex", index);
            deleted.add(index);
        }
        return deleted;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public void upsertSkill(SkillMetadata skill, List<SkillFile> files) {
        String key = "skill_id=" + skill.skillId();

        // New files land beside the old set under revision-qualified ids, the
        // metadata switches to the new revision, and only then is the old set dropped.
        if (!files.isEmpty()) {
            StringBuilder bulk = new StringBuilder();
            for (SkillFile f : files) {
                ObjectNode action = json.createObjectNode();
                action.putObject("index")
                        .put("_index", filesIndex)
                        .put("_id", f.documentId());
                bulk.append(action).append('\n').append(fileDocument(f)).append('\n');
            }
            JsonNode resp = send("POST", "/_bulk?refresh=true", bulk.toString(), "indexFiles", key,
                    "application/x-ndjson");
            if (resp.path("errors").asBoolean(false)) {
                throw new StoreUnavailableException("indexFiles", key,
                        "bulk request reported item failures: " + firstBulkError(resp));
            }
        }

        send("PUT", "/" + metadataIndex + "/_doc/" + encode(skill.skillId()) + "?refresh=true",
                metadataDocument(skill).toString(), "indexMetadata", key);

        ObjectNode stale = json.createObjectNode();
        ObjectNode bool = stale.putObject("query").putObject("bool");
        bool.putArray("filter").addObject().putObject("term").put("skill_id", skill.skillId());
        bool.putArray("must_not").addObject().putObject("term").put("revision", skill.revision());
        send("POST", "/" + filesIndex + "/_delete_by_query?refresh=true&conflicts=proceed",
                stale.toString(), "deleteStaleFiles", key);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<SkillMetadata> findMetadata(String skillId) {
        JsonNode resp = sendAllowMissing("GET", "/" + metadataIndex + "/_doc/" + encode(skillId), null,
                "getMetadata", "skill_id=" + skillId);
        if (resp == null || !resp.path("found").asBoolean(false)) {
            return Optional.empty();
        }
        return Optional.of(toMetadata(resp.path("_source")));
    }

    @Override
    public List<SkillFile> findFiles(String skillId) {
        ObjectNode query = json.createObjectNode();
        query.putObject("term").put("skill_id", skillId);
        ArrayNode sort = json.createArrayNode();
        sort.addObject().put("file_path", "asc");
        sort.addObject().put("revision", "asc");
        List<SkillFile> out = new ArrayList<>();
        for (JsonNode hit : searchAll(filesIndex, query, sort, null, Integer.MAX_VALUE,
                "getFiles", "skill_id=" + skillId)) {
            out.add(toFile(hit.path("_source")));
        }
        return out;
    }

    @Override
    public List<String> listSkillIds() {
        ObjectNode query = json.createObjectNode();
        query.putObject("match_all");
        ArrayNode sort = json.createArrayNode();
        sort.addObject().put("skill_id", "asc");
        ArrayNode source = json.createArrayNode().add("skill_id");
        List<String> ids = new ArrayList<>();
        for (JsonNode hit : searchAll(metadataIndex, query, sort, source, Integer.MAX_VALUE,
                "listSkills", metadataIndex)) {
            ids.add(hit.path("_source").path("skill_id").asText(hit.path("_id").asText()));
        }
        return ids;
    }

    @Override
    public List<ScoredSkill> keywordSearch(String query, SkillFilter filter, int limit) {
        ObjectNode mm = json.createObjectNode();
        ObjectNode multiMatch = mm.putObject("multi_match");
        multiMatch.put("query", query);
        multiMatch.putArray("fields").add("name^2").add("description");
        return scoredSearch(mm, filter, limit, "keywordSearch");
    }

    @Override
    public List<ScoredSkill> similaritySearch(String query, SkillFilter filter, int limit) {
        ObjectNode match = json.createObjectNode();
        match.putObject("match").putObject("semantic_content").put("query", query);
        return scoredSearch(match, filter, limit, "similaritySearch");
    }

    @Override
    public List<SkillMetadata> list(SkillFilter filter, int limit) {
        ObjectNode query = json.createObjectNode();
        addFilters(query.putObject("bool"), filter);
        ArrayNode sort = json.createArrayNode();
        sort.addObject().put("rating", "desc");
        sort.addObject().put("skill_id", "asc");
        List<SkillMetadata> out = new ArrayList<>();
        for (JsonNode hit : searchAll(metadataIndex, query, sort, null, limit,
                "listSkills", describe(filter))) {
            out.add(toMetadata(hit.path("_source")));
        }
        return out;
    }

    private List<ScoredSkill> scoredSearch(ObjectNode must, SkillFilter filter, int limit, String operation) {
        if (limit > MAX_RESULT_WINDOW) {
            log.warn("{} asked for {} hits; relevance results stop at {}", operation, limit, MAX_RESULT_WINDOW);
        }
        ObjectNode body = json.createObjectNode();
        body.put("size", Math.min(limit, MAX_RESULT_WINDOW));
        ObjectNode bool = body.putObject("query").putObject("bool");
        bool.putArray("must").add(must);
        addFilters(bool, filter);
        JsonNode resp = sendAllowMissing("POST", "/" + metadataIndex + "/_search", body.toString(),
                operation, describe(filter));
        List<ScoredSkill> out = new ArrayList<>();
        if (resp == null) return out;
        for (JsonNode hit : resp.path("hits").path("hits")) {
            out.add(new ScoredSkill(toMetadata(hit.path("_source")), hit.path("_score").asDouble(0)));
        }
        return out;
    }

    /**
     * Collects up to {@code limit} hits, one result window at a time. The
     * last sort key must be unique per document so pages never overlap.
     *
     * @return the hits in sort order; empty if the index does not exist
     */
    private List<JsonNode> searchAll(String index, JsonNode query, ArrayNode sort, JsonNode source,
                                     int limit, String operation, String key) {
        List<JsonNode> hits = new ArrayList<>();
        JsonNode searchAfter = null;
        while (hits.size() < limit) {
            int size = Math.min(limit - hits.size(), MAX_RESULT_WINDOW);
            ObjectNode body = json.createObjectNode();
            body.put("size", size);
            if (source != null) body.set("_source", source);
            body.set("query", query);
            body.set("sort", sort);
            if (searchAfter != null) body.set("search_after", searchAfter);

            JsonNode resp = sendAllowMissing("POST", "/" + index + "/_search", body.toString(), operation, key);
            if (resp == null) break;
            JsonNode page = resp.path("hits").path("hits");
            page.forEach(hits::add);
            if (page.size() < size) break;

            searchAfter = page.get(page.size() - 1).path("sort");
            if (!searchAfter.isArray() || searchAfter.isEmpty()) {
                log.warn("{} on '{}' returned a full page without sort values; stopping at {} hits",
                        operation, index, hits.size());
                break;
            }
        }
        return hits;
    }

    private void addFilters(ObjectNode bool, SkillFilter filter) {
        ArrayNode filters = bool.putArray("filter");
        if (filter.domain() != null) {
            filters.addObject().putObject("term").put("domain", filter.domain());
        }
        if (filter.tags().isEmpty()) return;
        if (filter.matchAllTags()) {
            filter.tags().forEach(t -> filters.addObject().putObject("term").put("tags", t));
        } else {
            ArrayNode any = filters.addObject().putObject("terms").putArray("tags");
            filter.tags().forEach(any::add);
        }
    }

    // ------------------------------------------------------------------
    // Document mapping
    // ------------------------------------------------------------------

    private ObjectNode metadataDocument(SkillMetadata s) {
        ObjectNode doc = json.createObjectNode();
        doc.put("skill_id",          s.skillId());
        doc.put("name",              s.name());
        doc.put("description",       s.description());
        doc.put("short_description", s.shortDescription());
        doc.put("domain",            s.domain());
        ArrayNode tags = doc.putArray("tags");
        s.tags().forEach(tags::add);
        doc.put("author",            s.author());
        doc.put("version",           s.version());
        doc.put("rating",            s.rating());
        doc.put("usage_count",       s.usageCount());
        doc.put("success_rate",      s.successRate());
        doc.put("searchable_text",   s.searchableText());
        doc.put("semantic_content",  s.searchableText());
        doc.put("file_count",        s.fileCount());
        doc.put("revision",          s.revision());
        doc.put("created_at",        s.createdAt() == null ? null : s.createdAt().toString());
        doc.put("updated_at",        s.updatedAt() == null ? null : s.updatedAt().toString());
        return doc;
    }

    private ObjectNode fileDocument(SkillFile f) {
        ObjectNode doc = json.createObjectNode();
        doc.put("skill_id",        f.skillId());
        doc.put("file_name",       f.fileName());
        doc.put("file_path",       f.filePath());
        doc.put("file_type",       f.fileType());
        doc.put("file_content",    f.fileContent());
        doc.put("file_size_bytes", f.fileSizeBytes());
        doc.put("created_at",      f.createdAt() == null ? null : f.createdAt().toString());
        doc.put("revision",        f.revision());
        return doc;
    }

    private static SkillMetadata toMetadata(JsonNode src) {
        List<String> tags = new ArrayList<>();
        src.path("tags").forEach(t -> tags.add(t.asText()));
        return new SkillMetadata(
                src.path("skill_id").asText(),
                text(src, "name"),
                text(src, "description"),
                text(src, "short_description"),
                text(src, "domain"),
                tags,
                text(src, "author"),
                text(src, "version"),
                src.path("rating").asDouble(5.0),
                src.path("usage_count").asLong(0),
                src.path("success_rate").asDouble(1.0),
                text(src, "searchable_text"),
                src.path("file_count").asInt(-1),
                text(src, "revision"),
                instant(src, "created_at"),
                instant(src, "updated_at"));
    }

    private static SkillFile toFile(JsonNode src) {
        return new SkillFile(
                src.path("skill_id").asText(),
                src.path("file_name").asText(),
                text(src, "file_path"),
                text(src, "file_type"),
                text(src, "file_content"),
                src.path("file_size_bytes").asLong(0),
                instant(src, "created_at"),
                text(src, "revision"));
    }

    private static String text(JsonNode src, String field) {
        JsonNode v = src.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static Instant instant(JsonNode src, String field) {
        String v = text(src, field);
        return v == null ? null : Instant.parse(v);
    }

    // ------------------------------------------------------------------
    // HTTP helpers
    // ------------------------------------------------------------------

    private boolean indexExists(String index) {
        HttpResponse<String> resp = exchange("HEAD", "/" + index, null, "indexExists", index,
                "application/json");
        return resp.statusCode() == 200;
    }

    private JsonNode send(String method, String path, String body, String operation, String key) {
        return send(method, path, body, operation, key, "application/json");
    }

    private JsonNode send(String method, String path, String body, String operation, String key,
                          String contentType) {
        HttpResponse<String> resp = exchange(method, path, body, operation, key, contentType);
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new StoreUnavailableException(operation, key,
                    "HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return parse(resp.body(), operation, key);
    }

    /** Like {@link #send} but maps 404 (missing index or document) to null. */
    private JsonNode sendAllowMissing(String method, String path, String body, String operation, String key) {
        HttpResponse<String> resp = exchange(method, path, body, operation, key, "application/json");
        if (resp.statusCode() == 404) {
            JsonNode parsed = parse(resp.body(), operation, key);
            // A missing document on GET _doc still reports found=false with 404.
            return parsed.has("found") ? parsed : null;
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new StoreUnavailableException(operation, key,
                    "HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return parse(resp.body(), operation, key);
    }

    private HttpResponse<String> exchange(String method, String path, String body, String operation,
                                          String key, String contentType) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            req.header("Content-Type", contentType);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            req.header("Authorization", "ApiKey " + apiKey);
        }
        try {
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() >= 500) {
                throw new StoreUnavailableException(operation, key,
                        "HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp;
        } catch (IOException e) {
            throw new StoreUnavailableException(operation, key,
                    "cannot reach Elasticsearch at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation, key, "interrupted", e);
        }
    }

    private JsonNode parse(String body, String operation, String key) {
        if (body == null || body.isBlank()) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException(operation, key, "unparseable response body", e);
        }
    }

    private String mappingFor(String index) {
        String resource = "/elasticsearch/" + (index.equals(metadataIndex) ? "agent_skills" : "agent_skill_files")
                + ".json";
        try (InputStream in = ElasticsearchSkillStore.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("index mapping " + resource + " missing from classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).replace("${INFERENCE_ID}", inferenceId);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read index mapping " + resource, e);
        }
    }

    private static String firstBulkError(JsonNode resp) {
        for (JsonNode item : resp.path("items")) {
            JsonNode error = item.path("index").path("error");
            if (!error.isMissingNode()) {
                return error.path("reason").asText(error.toString());
            }
        }
        return "unknown";
    }

    private static String describe(SkillFilter filter) {
        return "domain=" + filter.domain() + ",tags=" + filter.tags();
    }

    private static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
