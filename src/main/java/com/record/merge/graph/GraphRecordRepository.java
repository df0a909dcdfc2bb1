package com.record.merge.graph;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.store.RecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * FalkorDB-backed implementation of RecordRepository.
 * Persists each record as a :CrmRecord node; attributes become {@code attr_}-prefixed node properties
 * so they can never collide with the bookkeeping properties.
 */
public class GraphRecordRepository implements RecordRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphRecordRepository.class);

    static final String ATTRIBUTE_PREFIX = "attr_";
    private static final Pattern SAFE_ATTRIBUTE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final GraphConnection connection;

    public GraphRecordRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public CrmRecord save(CrmRecord record) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("id", record.getId());
        props.put("recordType", record.getType().name());
        props.put("tags", List.copyOf(record.getTags()));
        props.put("createdAt", record.getCreatedAt().toString());
        props.put("updatedAt", record.getUpdatedAt().toString());
        record.getAttributes().forEach((name, value) -> {
            // absent properties read back as null
            if (value != null) {
                props.put(propertyName(name), value);
            }
        });

        String query = """
                MERGE (r:CrmRecord {id: $id, recordType: $recordType})
                SET r = $props
                """;
        connection.execute(query, Map.of(
                "id", record.getId(),
                "recordType", record.getType().name(),
                "props", props
        ));
        log.debug("Saved {} {}", record.getType().getLabel(), record.getId());
        return record;
    }

    @Override
    public Optional<CrmRecord> findById(RecordType type, String id) {
        String query = """
                MATCH (r:CrmRecord {id: $id, recordType: $recordType})
                RETURN properties(r) AS props
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "id", id,
                "recordType", type.name()
        ));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToRecord(rows.get(0)));
    }

    @Override
    public boolean delete(RecordType type, String id) {
        if (!exists(type, id)) {
            return false;
        }
        String query = """
                MATCH (r:CrmRecord {id: $id, recordType: $recordType})
                DELETE r
                """;
        connection.execute(query, Map.of("id", id, "recordType", type.name()));
        log.debug("Deleted {} {}", type.getLabel(), id);
        return true;
    }

    @Override
    public List<CrmRecord> findByAttribute(RecordType type, String attribute, Object value) {
        String query = """
                MATCH (r:CrmRecord {recordType: $recordType})
                WHERE r.%s = $value
                RETURN properties(r) AS props
                ORDER BY r.createdAt ASC
                """.formatted(propertyName(attribute));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("recordType", type.name());
        params.put("value", value);
        return connection.query(query, params).stream().map(this::mapToRecord).toList();
    }

    @Override
    public List<String> reassignReference(RecordType type, String attribute, String fromValue, String toValue) {
        String query = """
                MATCH (r:CrmRecord {recordType: $recordType})
                WHERE r.%s = $fromValue
                RETURN r.id AS id
                """.formatted(propertyName(attribute));
        List<String> ids = connection.query(query, Map.of(
                "recordType", type.name(),
                "fromValue", fromValue
        )).stream().map(row -> (String) row.get("id")).toList();

        if (!ids.isEmpty()) {
            assignReference(type, attribute, ids, toValue);
        }
        return ids;
    }

    @Override
    public void assignReference(RecordType type, String attribute, Collection<String> ids, String value) {
        if (ids.isEmpty()) {
            return;
        }
        String query = """
                MATCH (r:CrmRecord {recordType: $recordType})
                WHERE r.id IN $ids
                SET r.%s = $value, r.updatedAt = $updatedAt
                """.formatted(propertyName(attribute));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("recordType", type.name());
        params.put("ids", List.copyOf(ids));
        params.put("value", value);
        params.put("updatedAt", Instant.now().toString());
        connection.execute(query, params);
        log.debug("Set {}.{} on {} records", type.getLabel(), attribute, ids.size());
    }

    @Override
    public int count(RecordType type) {
        String query = """
                MATCH (r:CrmRecord {recordType: $recordType})
                RETURN count(r) AS cnt
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of("recordType", type.name()));
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).intValue();
    }

    static String propertyName(String attribute) {
        if (attribute == null || !SAFE_ATTRIBUTE.matcher(attribute).matches()) {
            throw new IllegalArgumentException("Invalid attribute name: " + attribute);
        }
        return ATTRIBUTE_PREFIX + attribute;
    }

    @SuppressWarnings("unchecked")
    private CrmRecord mapToRecord(Map<String, Object> row) {
        Map<String, Object> props = (Map<String, Object>) row.get("props");
        CrmRecord.Builder builder = CrmRecord.builder()
                .id((String) props.get("id"))
                .type(RecordType.valueOf((String) props.get("recordType")));

        Object tags = props.get("tags");
        if (tags instanceof Collection<?> tagValues) {
            tagValues.forEach(tag -> builder.tag(String.valueOf(tag)));
        }
        Object createdAt = props.get("createdAt");
        if (createdAt != null) {
            builder.createdAt(Instant.parse(createdAt.toString()));
        }
        Object updatedAt = props.get("updatedAt");
        if (updatedAt != null) {
            builder.updatedAt(Instant.parse(updatedAt.toString()));
        }
        props.forEach((key, value) -> {
            if (key.startsWith(ATTRIBUTE_PREFIX)) {
                builder.attribute(key.substring(ATTRIBUTE_PREFIX.length()), value);
            }
        });
        return builder.build();
    }
}
