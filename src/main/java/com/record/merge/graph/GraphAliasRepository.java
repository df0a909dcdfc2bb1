package com.record.merge.graph;

import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;
import com.record.merge.store.AliasRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed implementation of AliasRepository.
 * Persists aliases as :RecordAlias nodes.
 */
public class GraphAliasRepository implements AliasRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAliasRepository.class);

    private static final String RETURN_ALIAS = """
            RETURN a.id AS id, a.recordType AS recordType, a.destroyedId AS destroyedId,
                   a.targetId AS targetId, a.createdAt AS createdAt
            """;

    private final GraphConnection connection;

    public GraphAliasRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public RecordAlias save(RecordAlias alias) {
        String query = """
                MERGE (a:RecordAlias {id: $id})
                SET a.recordType = $recordType,
                    a.destroyedId = $destroyedId,
                    a.targetId = $targetId,
                    a.createdAt = $createdAt
                """;
        connection.execute(query, Map.of(
                "id", alias.id(),
                "recordType", alias.recordType().name(),
                "destroyedId", alias.destroyedId(),
                "targetId", alias.targetId(),
                "createdAt", alias.createdAt().toString()
        ));
        log.debug("Saved alias {} -> {} ({})", alias.destroyedId(), alias.targetId(), alias.recordType());
        return alias;
    }

    @Override
    public Optional<RecordAlias> findById(String id) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (a:RecordAlias {id: $id})\n" + RETURN_ALIAS, Map.of("id", id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToAlias(rows.get(0)));
    }

    @Override
    public Optional<RecordAlias> findByDestroyedId(RecordType type, String destroyedId) {
        String query = "MATCH (a:RecordAlias {recordType: $recordType, destroyedId: $destroyedId})\n"
                + RETURN_ALIAS + "ORDER BY a.createdAt ASC\nLIMIT 1";
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "recordType", type.name(),
                "destroyedId", destroyedId
        ));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToAlias(rows.get(0)));
    }

    @Override
    public List<RecordAlias> findByTargetId(RecordType type, String targetId) {
        String query = "MATCH (a:RecordAlias {recordType: $recordType, targetId: $targetId})\n"
                + RETURN_ALIAS + "ORDER BY a.createdAt ASC";
        return connection.query(query, Map.of(
                "recordType", type.name(),
                "targetId", targetId
        )).stream().map(this::mapToAlias).toList();
    }

    @Override
    public boolean delete(String id) {
        if (findById(id).isEmpty()) {
            return false;
        }
        connection.execute("MATCH (a:RecordAlias {id: $id}) DELETE a", Map.of("id", id));
        return true;
    }

    @Override
    public int count(RecordType type) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (a:RecordAlias {recordType: $recordType}) RETURN count(a) AS cnt",
                Map.of("recordType", type.name()));
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).intValue();
    }

    private RecordAlias mapToAlias(Map<String, Object> row) {
        String createdAt = (String) row.get("createdAt");
        return new RecordAlias(
                (String) row.get("id"),
                RecordType.valueOf((String) row.get("recordType")),
                (String) row.get("destroyedId"),
                (String) row.get("targetId"),
                createdAt != null ? Instant.parse(createdAt) : Instant.now()
        );
    }
}
