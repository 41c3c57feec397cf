package org.carball.designer.workload;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.OperationType;
import org.carball.designer.model.workload.PredicateType;
import org.carball.designer.model.workload.Session;
import org.carball.designer.model.workload.Workload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a captured trace and its sampled dataset from an exported JSON file.
 *
 * <pre>
 * {
 *   "export_metadata": {"database_name": "blog", "export_timestamp": "...", "sample_rate": 100},
 *   "sessions": [{"session_id": 1, "start_time": ..., "end_time": ..., "operations": [...]}],
 *   "dataset": {"articles": [{"_id": 1, ...}]}
 * }
 * </pre>
 *
 * Trace timestamps may be ISO-8601 strings or epoch seconds. Dataset values written as
 * extended JSON dates, {@code {"$date": ...}}, are read as instants; a numeric
 * {@code $date} (plain or {@code $numberLong}) is epoch milliseconds.
 */
@Slf4j
public class TraceFileConnector {

    private static final String DATE_KEY = "$date";
    private static final String NUMBER_LONG_KEY = "$numberLong";
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final JsonNode exportData;

    public TraceFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Trace export file not found: " + path);
        }
        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
        log.info("Loaded trace export {}", path);
    }

    /**
     * Gets export metadata including database name and export timestamp.
     */
    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("database_name").asText(),
                metadata.path("export_timestamp").asText(null),
                metadata.path("sample_rate").asInt(100)
        );
    }

    public Workload getWorkload() {
        List<Session> sessions = new ArrayList<>();
        for (JsonNode sessionNode : exportData.get("sessions")) {
            sessions.add(parseSession(sessionNode));
        }
        Workload workload = new Workload(sessions);
        log.info("Read {} sessions with {} operations", sessions.size(), workload.operationCount());
        return workload;
    }

    /**
     * Sampled documents per collection, in file order.
     */
    public Map<String, List<Map<String, Object>>> getDataset() {
        Map<String, List<Map<String, Object>>> dataset = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> collections = exportData.get("dataset").fields();
        while (collections.hasNext()) {
            Map.Entry<String, JsonNode> collection = collections.next();
            List<Map<String, Object>> rows = new ArrayList<>();
            for (JsonNode row : collection.getValue()) {
                rows.add(toDocument(row));
            }
            dataset.put(collection.getKey(), Collections.unmodifiableList(rows));
            log.debug("Collection '{}': {} sampled documents", collection.getKey(), rows.size());
        }
        return Collections.unmodifiableMap(dataset);
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in trace export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in trace export file");
        }
        if (!metadata.has("database_name")) {
            throw new IllegalStateException("Missing required metadata field: database_name");
        }

        JsonNode sessions = exportData.get("sessions");
        if (sessions == null || !sessions.isArray()) {
            throw new IllegalStateException("Missing or invalid sessions section in trace export file");
        }

        JsonNode dataset = exportData.get("dataset");
        if (dataset == null || !dataset.isObject()) {
            throw new IllegalStateException("Missing or invalid dataset section in trace export file");
        }
    }

    private Session parseSession(JsonNode sessionNode) {
        List<Operation> operations = new ArrayList<>();
        JsonNode operationNodes = sessionNode.get("operations");
        if (operationNodes != null) {
            for (JsonNode operationNode : operationNodes) {
                operations.add(parseOperation(operationNode));
            }
        }
        return Session.builder()
                .sessionId(sessionNode.path("session_id").asLong())
                .clientAddress(sessionNode.path("ip_client").asText(null))
                .serverAddress(sessionNode.path("ip_server").asText(null))
                .startTime(parseTime(sessionNode, "start_time"))
                .endTime(parseTime(sessionNode, "end_time"))
                .operations(operations)
                .build();
    }

    private Operation parseOperation(JsonNode node) {
        Map<String, PredicateType> predicates = new LinkedHashMap<>();
        JsonNode predicateNodes = node.get("predicates");
        if (predicateNodes != null) {
            predicateNodes.fields().forEachRemaining(entry ->
                    predicates.put(entry.getKey(), parsePredicateType(entry.getValue().asText())));
        }

        List<Map<String, Object>> content = new ArrayList<>();
        JsonNode contentNodes = node.get("query_content");
        if (contentNodes != null) {
            for (JsonNode document : contentNodes) {
                content.add(toDocument(document));
            }
        }

        return Operation.builder()
                .collection(requireText(node, "collection"))
                .type(parseOperationType(requireText(node, "type")))
                .predicates(predicates)
                .queryContent(content)
                .responseSize(node.path("response_size").asLong(0))
                .queryTime(parseTime(node, "query_time"))
                .respTime(parseTime(node, "resp_time"))
                .build();
    }

    static OperationType parseOperationType(String value) {
        String name = value.startsWith("$") ? value.substring(1) : value;
        try {
            return OperationType.valueOf(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown operation type: " + value, e);
        }
    }

    static PredicateType parsePredicateType(String value) {
        switch (value.toLowerCase()) {
            case "eq":
            case "equality":
                return PredicateType.EQUALITY;
            case "range":
                return PredicateType.RANGE;
            case "regex":
                return PredicateType.REGEX;
            default:
                throw new IllegalStateException("Unknown predicate type: " + value);
        }
    }

    private Instant parseTime(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Missing required timestamp: " + field);
        }
        return objectMapper.convertValue(value, Instant.class);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Missing required operation field: " + field);
        }
        return value.asText();
    }

    private Map<String, Object> toDocument(JsonNode node) {
        Map<String, Object> document = objectMapper.convertValue(node, DOCUMENT_TYPE);
        document.replaceAll((key, value) -> normalizeValue(value));
        return document;
    }

    @SuppressWarnings("unchecked")
    private Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            if (map.size() == 1 && map.containsKey(DATE_KEY)) {
                return toInstant(map.get(DATE_KEY));
            }
            Map<String, Object> nested = (Map<String, Object>) map;
            nested.replaceAll((key, nestedValue) -> normalizeValue(nestedValue));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> elements = (List<Object>) list;
            elements.replaceAll(this::normalizeValue);
            return elements;
        }
        return value;
    }

    private Instant toInstant(Object date) {
        if (date instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        if (date instanceof Map<?, ?> wrapper && wrapper.containsKey(NUMBER_LONG_KEY)) {
            return Instant.ofEpochMilli(Long.parseLong(String.valueOf(wrapper.get(NUMBER_LONG_KEY))));
        }
        return objectMapper.convertValue(date, Instant.class);
    }

    /**
     * Metadata about the trace export.
     */
    public record ExportMetadata(String databaseName, String exportTimestamp, int sampleRate) {
    }
}
