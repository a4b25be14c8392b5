package io.certcsi.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.certcsi.observation.model.Entity;
import io.certcsi.observation.model.EntityCount;
import io.certcsi.observation.model.EntityTimeline;
import io.certcsi.observation.model.EntityType;
import io.certcsi.observation.model.Event;
import io.certcsi.observation.model.EventType;
import io.certcsi.observation.model.TestCase;
import io.certcsi.observation.model.TestRun;
import io.certcsi.store.EventStore;
import io.certcsi.store.EventStoreException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link EventStore} backed by a relational database through Spring's {@link JdbcTemplate}.
 * <p>
 * The DDL in {@code schema.sql} is portable between PostgreSQL (production) and H2 (tests).
 */
public final class JdbcEventStore implements EventStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

  static final String SCHEMA_RESOURCE = "io/certcsi/store/jdbc/schema.sql";

  private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {};

  private static final String INSERT_ENTITY_SQL = """
      INSERT INTO entities (
        k8s_uid,
        name,
        type,
        test_case_id
      ) VALUES (?, ?, ?, ?)
      """;

  private static final String INSERT_EVENT_SQL = """
      INSERT INTO events (
        name,
        test_case_id,
        entity_uid,
        type,
        ts
      ) VALUES (?, ?, ?, ?, ?)
      """;

  private static final String INSERT_ENTITY_COUNT_SQL = """
      INSERT INTO entity_counts (
        test_case_id,
        ts,
        pods_creating,
        pods_ready,
        pods_terminating,
        pvc_creating,
        pvc_bound,
        pvc_terminating
      ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private static final String SELECT_TEST_CASE_SQL = """
      SELECT id, run_id, name, parameters, started_at, ended_at, success, error_message
      FROM test_cases
      """;

  private final DataSource dataSource;
  private final JdbcTemplate jdbc;
  private final TransactionTemplate transactions;
  private final ObjectMapper mapper;

  public JdbcEventStore(DataSource dataSource, ObjectMapper mapper) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.jdbc = new JdbcTemplate(dataSource);
    this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
  }

  /**
   * Creates the tables if they do not exist yet.
   */
  public void initializeSchema() {
    try {
      new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)).execute(dataSource);
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to initialize event store schema", e);
    }
  }

  @Override
  public void saveEntities(List<Entity> entities) {
    Objects.requireNonNull(entities, "entities");
    // One statement per row so a duplicate does not abort the rest of the batch.
    for (Entity entity : entities) {
      try {
        jdbc.update(INSERT_ENTITY_SQL,
            entity.k8sUid(),
            entity.name(),
            entity.type().name(),
            entity.testCaseId());
      } catch (DuplicateKeyException e) {
        log.debug("Entity {} ({}) already stored for test case {}",
            entity.name(), entity.k8sUid(), entity.testCaseId());
      } catch (DataAccessException e) {
        throw new EventStoreException("Failed to save entity " + entity.name(), e);
      }
    }
  }

  @Override
  public void saveEvents(List<Event> events) {
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      return;
    }
    try {
      transactions.executeWithoutResult(status ->
          jdbc.batchUpdate(INSERT_EVENT_SQL, events, events.size(), (PreparedStatement ps, Event event) -> {
            ps.setString(1, event.name());
            ps.setLong(2, event.testCaseId());
            ps.setString(3, event.entityUid());
            ps.setString(4, event.type().name());
            ps.setTimestamp(5, Timestamp.from(event.timestamp()));
          }));
      log.debug("Saved {} events", events.size());
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to save batch of " + events.size() + " events", e);
    }
  }

  @Override
  public void saveEntityCounts(List<EntityCount> counts) {
    Objects.requireNonNull(counts, "counts");
    if (counts.isEmpty()) {
      return;
    }
    try {
      transactions.executeWithoutResult(status ->
          jdbc.batchUpdate(INSERT_ENTITY_COUNT_SQL, counts, counts.size(), (PreparedStatement ps, EntityCount count) -> {
            ps.setLong(1, count.testCaseId());
            ps.setTimestamp(2, Timestamp.from(count.timestamp()));
            ps.setInt(3, count.podsCreating());
            ps.setInt(4, count.podsReady());
            ps.setInt(5, count.podsTerminating());
            ps.setInt(6, count.pvcCreating());
            ps.setInt(7, count.pvcBound());
            ps.setInt(8, count.pvcTerminating());
          }));
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to save batch of " + counts.size() + " entity counts", e);
    }
  }

  @Override
  public TestRun createTestRun(String name, String storageClass, String clusterAddress, Instant startedAt) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(startedAt, "startedAt");
    long id = insertReturningId(
        "INSERT INTO test_runs (name, started_at, storage_class, cluster_address) VALUES (?, ?, ?, ?)",
        ps -> {
          ps.setString(1, name);
          ps.setTimestamp(2, Timestamp.from(startedAt));
          ps.setString(3, storageClass);
          ps.setString(4, clusterAddress);
        },
        "test run " + name);
    return new TestRun(id, name, startedAt, storageClass, clusterAddress);
  }

  @Override
  public TestCase createTestCase(long runId, String name, Map<String, Object> parameters, Instant startedAt) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(startedAt, "startedAt");
    String parametersJson = toJson(parameters);
    long id = insertReturningId(
        "INSERT INTO test_cases (run_id, name, parameters, started_at) VALUES (?, ?, ?, ?)",
        ps -> {
          ps.setLong(1, runId);
          ps.setString(2, name);
          ps.setString(3, parametersJson);
          ps.setTimestamp(4, Timestamp.from(startedAt));
        },
        "test case " + name);
    return new TestCase(id, runId, name, parameters, startedAt, null, false, null);
  }

  @Override
  public void completeTestCase(long testCaseId, Instant endedAt, boolean success, String errorMessage) {
    Objects.requireNonNull(endedAt, "endedAt");
    try {
      int updated = jdbc.update(
          "UPDATE test_cases SET ended_at = ?, success = ?, error_message = ? WHERE id = ?",
          Timestamp.from(endedAt), success, errorMessage, testCaseId);
      if (updated == 0) {
        log.warn("No test case {} to complete", testCaseId);
      }
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to complete test case " + testCaseId, e);
    }
  }

  @Override
  public Optional<TestRun> findTestRun(String name) {
    Objects.requireNonNull(name, "name");
    try {
      List<TestRun> runs = jdbc.query(
          "SELECT id, name, started_at, storage_class, cluster_address FROM test_runs WHERE name = ?",
          (rs, row) -> new TestRun(
              rs.getLong("id"),
              rs.getString("name"),
              instant(rs, "started_at"),
              rs.getString("storage_class"),
              rs.getString("cluster_address")),
          name);
      return runs.stream().findFirst();
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to read test run " + name, e);
    }
  }

  @Override
  public Optional<TestCase> findTestCase(long testCaseId) {
    try {
      return jdbc.query(SELECT_TEST_CASE_SQL + "WHERE id = ?", this::mapTestCase, testCaseId)
          .stream()
          .findFirst();
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to read test case " + testCaseId, e);
    }
  }

  @Override
  public List<TestCase> findTestCases(long runId) {
    try {
      return jdbc.query(SELECT_TEST_CASE_SQL + "WHERE run_id = ? ORDER BY started_at, id", this::mapTestCase, runId);
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to read test cases of run " + runId, e);
    }
  }

  @Override
  public List<EntityTimeline> loadTimelines(long testCaseId) {
    try {
      List<Entity> entities = jdbc.query("""
              SELECT k8s_uid, name, type, test_case_id
              FROM entities
              WHERE test_case_id = ?
                 OR k8s_uid IN (SELECT entity_uid FROM events WHERE test_case_id = ?)
              ORDER BY type, name
              """,
          (rs, row) -> new Entity(
              rs.getString("k8s_uid"),
              rs.getString("name"),
              EntityType.valueOf(rs.getString("type")),
              rs.getLong("test_case_id")),
          testCaseId, testCaseId);
      if (entities.isEmpty()) {
        return List.of();
      }
      Map<String, List<Event>> eventsByEntity = new LinkedHashMap<>();
      jdbc.query("""
              SELECT name, test_case_id, entity_uid, type, ts
              FROM events
              WHERE test_case_id = ?
              ORDER BY ts, id
              """,
          (ResultSet rs) -> {
            Event event = new Event(
                rs.getString("name"),
                rs.getLong("test_case_id"),
                rs.getString("entity_uid"),
                EventType.valueOf(rs.getString("type")),
                instant(rs, "ts"));
            eventsByEntity.computeIfAbsent(event.entityUid(), uid -> new ArrayList<>()).add(event);
          },
          testCaseId);
      List<EntityTimeline> timelines = new ArrayList<>(entities.size());
      for (Entity entity : entities) {
        timelines.add(new EntityTimeline(entity, eventsByEntity.getOrDefault(entity.k8sUid(), List.of())));
      }
      return timelines;
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to load timelines of test case " + testCaseId, e);
    }
  }

  @Override
  public List<EntityCount> loadEntityCounts(long testCaseId) {
    try {
      return jdbc.query("""
              SELECT test_case_id, ts, pods_creating, pods_ready, pods_terminating,
                     pvc_creating, pvc_bound, pvc_terminating
              FROM entity_counts
              WHERE test_case_id = ?
              ORDER BY ts, id
              """,
          (rs, row) -> new EntityCount(
              rs.getLong("test_case_id"),
              instant(rs, "ts"),
              rs.getInt("pods_creating"),
              rs.getInt("pods_ready"),
              rs.getInt("pods_terminating"),
              rs.getInt("pvc_creating"),
              rs.getInt("pvc_bound"),
              rs.getInt("pvc_terminating")),
          testCaseId);
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to load entity counts of test case " + testCaseId, e);
    }
  }

  private long insertReturningId(String sql, StatementBinder binder, String description) {
    KeyHolder keys = new GeneratedKeyHolder();
    try {
      jdbc.update(connection -> {
        PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
        binder.bind(ps);
        return ps;
      }, keys);
    } catch (DataAccessException e) {
      throw new EventStoreException("Failed to create " + description, e);
    }
    // Some drivers return every column of the inserted row; the key map is case-insensitive.
    Map<String, Object> generated = keys.getKeys();
    Object key = generated != null ? generated.get("id") : null;
    if (!(key instanceof Number number)) {
      throw new EventStoreException("No id generated for " + description, null);
    }
    return number.longValue();
  }

  private TestCase mapTestCase(ResultSet rs, int row) throws SQLException {
    Timestamp endedAt = rs.getTimestamp("ended_at");
    return new TestCase(
        rs.getLong("id"),
        rs.getLong("run_id"),
        rs.getString("name"),
        fromJson(rs.getString("parameters")),
        instant(rs, "started_at"),
        endedAt != null ? endedAt.toInstant() : null,
        rs.getBoolean("success"),
        rs.getString("error_message"));
  }

  private String toJson(Map<String, Object> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(parameters);
    } catch (JsonProcessingException e) {
      throw new EventStoreException("Test case parameters are not serializable", e);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, PARAMETERS_TYPE);
    } catch (JsonProcessingException e) {
      throw new EventStoreException("Stored test case parameters are not valid JSON", e);
    }
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    return rs.getTimestamp(column).toInstant();
  }

  @FunctionalInterface
  private interface StatementBinder {
    void bind(PreparedStatement ps) throws SQLException;
  }
}
