package com.record.merge.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.store.ChildRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed implementation of ChildRecordRepository.
 * Persists children as :ChildRecord nodes keyed by owner; the attribute payload is stored as a JSON string.
 */
public class GraphChildRecordRepository implements ChildRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphChildRecordRepository.class);
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphChildRecordRepository(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public GraphChildRecordRepository(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChildRecord save(ChildRecord child) {
        String query = """
                MERGE (c:ChildRecord {id: $id})
                SET c.association = $association,
                    c.ownerType = $ownerType,
                    c.ownerId = $ownerId,
                    c.attributes = $attributes,
                    c.createdAt = $createdAt
                """;
        connection.execute(query, Map.of(
                "id", child.id(),
                "association", child.association().name(),
                "ownerType", child.ownerType().name(),
                "ownerId", child.ownerId(),
                "attributes", serializeAttributes(child.attributes()),
                "createdAt", child.createdAt().toString()
        ));
        log.debug("Saved {} child {} for {} {}", child.association().getLabel(), child.id(),
                child.ownerType().getLabel(), child.ownerId());
        return child;
    }

    @Override
    public Optional<ChildRecord> findById(String id) {
        String query = """
                MATCH (c:ChildRecord {id: $id})
                RETURN c.id AS id, c.association AS association, c.ownerType AS ownerType,
                       c.ownerId AS ownerId, c.attributes AS attributes, c.createdAt AS createdAt
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of("id", id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToChild(rows.get(0)));
    }

    @Override
    public List<ChildRecord> findByOwner(Association association, RecordType ownerType, String ownerId) {
        String query = """
                MATCH (c:ChildRecord {association: $association, ownerType: $ownerType, ownerId: $ownerId})
                RETURN c.id AS id, c.association AS association, c.ownerType AS ownerType,
                       c.ownerId AS ownerId, c.attributes AS attributes, c.createdAt AS createdAt
                ORDER BY c.createdAt ASC
                """;
        return connection.query(query, Map.of(
                "association", association.name(),
                "ownerType", ownerType.name(),
                "ownerId", ownerId
        )).stream().map(this::mapToChild).toList();
    }

    @Override
    public List<String> reassignOwner(Association association, RecordType ownerType,
                                      String fromOwnerId, String toOwnerId) {
        List<String> ids = findByOwner(association, ownerType, fromOwnerId).stream()
                .map(ChildRecord::id)
                .toList();
        assignOwner(ids, toOwnerId);
        return ids;
    }

    @Override
    public void assignOwner(Collection<String> childIds, String ownerId) {
        if (childIds.isEmpty()) {
            return;
        }
        String query = """
                MATCH (c:ChildRecord)
                WHERE c.id IN $ids
                SET c.ownerId = $ownerId
                """;
        connection.execute(query, Map.of(
                "ids", List.copyOf(childIds),
                "ownerId", ownerId
        ));
        log.debug("Assigned {} children to owner {}", childIds.size(), ownerId);
    }

    @Override
    public boolean delete(String id) {
        if (findById(id).isEmpty()) {
            return false;
        }
        connection.execute("MATCH (c:ChildRecord {id: $id}) DELETE c", Map.of("id", id));
        return true;
    }

    private ChildRecord mapToChild(Map<String, Object> row) {
        String createdAt = (String) row.get("createdAt");
        return new ChildRecord(
                (String) row.get("id"),
                Association.valueOf((String) row.get("association")),
                RecordType.valueOf((String) row.get("ownerType")),
                (String) row.get("ownerId"),
                deserializeAttributes((String) row.get("attributes")),
                createdAt != null ? Instant.parse(createdAt) : Instant.now()
        );
    }

    private String serializeAttributes(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Child attributes are not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> deserializeAttributes(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize child attributes: {}", e.getMessage());
            return Map.of();
        }
    }
}
