package com.foreman.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.error.StoreException;
import com.foreman.core.model.Agent;
import com.foreman.core.model.AgentStatus;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-based {@link ProjectStore} backed by an embedded SQLite file in the project directory.
 * <p>
 * One row per session, agent, task and report; list-valued task columns and report
 * payloads are stored as JSON text. Every public method runs in its own transaction and
 * rolls back on failure, so a task is never left half-updated.
 * <p>
 * The tables are created automatically via {@link #createTables()}.
 */
public class JdbcProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of("""
            CREATE TABLE IF NOT EXISTS sessions (
                session_id    TEXT PRIMARY KEY,
                created_at    TEXT NOT NULL,
                project_goal  TEXT NOT NULL,
                current_phase TEXT NOT NULL,
                paused        INTEGER NOT NULL DEFAULT 0
            )
            """, """
            CREATE TABLE IF NOT EXISTS agents (
                session_id TEXT NOT NULL REFERENCES sessions(session_id),
                agent_id   TEXT NOT NULL,
                role       TEXT NOT NULL,
                started_at TEXT NOT NULL,
                status     TEXT NOT NULL,
                retired_at TEXT,
                PRIMARY KEY (session_id, agent_id)
            )
            """, """
            CREATE TABLE IF NOT EXISTS tasks (
                session_id        TEXT NOT NULL REFERENCES sessions(session_id),
                task_id           TEXT NOT NULL,
                agent_role        TEXT NOT NULL,
                description       TEXT,
                status            TEXT NOT NULL,
                dependencies      TEXT NOT NULL,
                priority          INTEGER NOT NULL DEFAULT 0,
                retry_count       INTEGER NOT NULL DEFAULT 0,
                attempt           INTEGER NOT NULL DEFAULT 0,
                created_at        TEXT NOT NULL,
                started_at        TEXT,
                completed_at      TEXT,
                assigned_agent_id TEXT,
                blocked_reason    TEXT,
                history           TEXT NOT NULL,
                artifact_summary  TEXT,
                PRIMARY KEY (session_id, task_id)
            )
            """, """
            CREATE TABLE IF NOT EXISTS reports (
                id              INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id      TEXT NOT NULL REFERENCES sessions(session_id),
                timestamp       TEXT NOT NULL,
                phase           TEXT NOT NULL,
                completed_tasks INTEGER NOT NULL,
                data            TEXT NOT NULL
            )
            """);

    /** Stores created before attempts were tracked lack the column. */
    private static final String ADD_ATTEMPT_COLUMN_SQL = """
            ALTER TABLE tasks ADD COLUMN attempt INTEGER NOT NULL DEFAULT 0
            """;

    private static final String INSERT_SESSION_SQL = """
            INSERT INTO sessions (session_id, created_at, project_goal, current_phase, paused)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SESSION_SQL = """
            UPDATE sessions SET current_phase = ?, paused = ? WHERE session_id = ?
            """;

    private static final String SELECT_SESSION_SQL = """
            SELECT session_id, created_at, project_goal, current_phase, paused
            FROM sessions WHERE session_id = ?
            """;

    private static final String SELECT_SESSIONS_SQL = """
            SELECT session_id, created_at, project_goal, current_phase, paused
            FROM sessions ORDER BY session_id
            """;

    private static final String UPSERT_AGENT_SQL = """
            INSERT INTO agents (session_id, agent_id, role, started_at, status, retired_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, agent_id)
            DO UPDATE SET role = excluded.role,
                          status = excluded.status,
                          retired_at = excluded.retired_at
            """;

    private static final String SELECT_AGENTS_SQL = """
            SELECT session_id, agent_id, role, started_at, status, retired_at
            FROM agents WHERE session_id = ? ORDER BY rowid
            """;

    private static final String SELECT_AGENTS_BY_ROLE_SQL = """
            SELECT session_id, agent_id, role, started_at, status, retired_at
            FROM agents WHERE session_id = ? AND role = ? ORDER BY rowid
            """;

    private static final String UPSERT_TASK_SQL = """
            INSERT INTO tasks (session_id, task_id, agent_role, description, status, dependencies,
                               priority, retry_count, attempt, created_at, started_at, completed_at,
                               assigned_agent_id, blocked_reason, history, artifact_summary)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, task_id)
            DO UPDATE SET agent_role = excluded.agent_role,
                          description = excluded.description,
                          status = excluded.status,
                          dependencies = excluded.dependencies,
                          priority = excluded.priority,
                          retry_count = excluded.retry_count,
                          attempt = excluded.attempt,
                          started_at = excluded.started_at,
                          completed_at = excluded.completed_at,
                          assigned_agent_id = excluded.assigned_agent_id,
                          blocked_reason = excluded.blocked_reason,
                          history = excluded.history,
                          artifact_summary = excluded.artifact_summary
            """;

    private static final String SELECT_TASKS_SQL = """
            SELECT * FROM tasks WHERE session_id = ? ORDER BY rowid
            """;

    private static final String SELECT_TASKS_BY_STATUS_SQL = """
            SELECT * FROM tasks WHERE session_id = ? AND status = ? ORDER BY rowid
            """;

    private static final String INSERT_REPORT_SQL = """
            INSERT INTO reports (session_id, timestamp, phase, completed_tasks, data)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SELECT_REPORTS_SQL = """
            SELECT session_id, timestamp, phase, completed_tasks, data
            FROM reports WHERE session_id = ? ORDER BY id
            """;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcProjectStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the store tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        inTransaction("create tables", conn -> {
            for (String ddl : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(ddl)) {
                    stmt.execute();
                }
            }
            if (!hasColumn(conn, "tasks", "attempt")) {
                try (PreparedStatement stmt = conn.prepareStatement(ADD_ATTEMPT_COLUMN_SQL)) {
                    stmt.execute();
                }
                log.info("Added attempt column to tasks table");
            }
            return null;
        });
        log.info("Project store tables ensured");
    }

    // ── Sessions ─────────────────────────────────────────────────────────

    @Override
    public void createSession(Session session) {
        inTransaction("create session " + session.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SESSION_SQL)) {
                stmt.setString(1, session.id());
                stmt.setString(2, session.createdAt().toString());
                stmt.setString(3, session.goal());
                stmt.setString(4, session.phase().key());
                stmt.setInt(5, session.paused() ? 1 : 0);
                stmt.executeUpdate();
            }
            return null;
        });
        log.debug("Created session '{}'", session.id());
    }

    @Override
    public Session loadSession(String sessionId) {
        Session session = inTransaction("load session " + sessionId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_SESSION_SQL)) {
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? sessionFrom(rs) : null;
                }
            }
        });
        if (session == null) {
            throw NotFoundException.session(sessionId);
        }
        return session;
    }

    @Override
    public void updateSession(Session session) {
        int updated = inTransaction("update session " + session.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SESSION_SQL)) {
                stmt.setString(1, session.phase().key());
                stmt.setInt(2, session.paused() ? 1 : 0);
                stmt.setString(3, session.id());
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw NotFoundException.session(session.id());
        }
    }

    @Override
    public List<Session> listSessions() {
        return inTransaction("list sessions", conn -> {
            var sessions = new ArrayList<Session>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_SESSIONS_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sessions.add(sessionFrom(rs));
                }
            }
            return sessions;
        });
    }

    // ── Agents ───────────────────────────────────────────────────────────

    @Override
    public void upsertAgent(Agent agent) {
        inTransaction("upsert agent " + agent.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT_AGENT_SQL)) {
                stmt.setString(1, agent.sessionId());
                stmt.setString(2, agent.id());
                stmt.setString(3, agent.role().key());
                stmt.setString(4, agent.startedAt().toString());
                stmt.setString(5, agent.status().key());
                stmt.setString(6, text(agent.retiredAt()));
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<Agent> listAgents(String sessionId, Role roleFilter) {
        return inTransaction("list agents of " + sessionId, conn -> {
            var agents = new ArrayList<Agent>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    roleFilter == null ? SELECT_AGENTS_SQL : SELECT_AGENTS_BY_ROLE_SQL)) {
                stmt.setString(1, sessionId);
                if (roleFilter != null) {
                    stmt.setString(2, roleFilter.key());
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        agents.add(new Agent(
                                rs.getString("session_id"),
                                rs.getString("agent_id"),
                                Role.fromKey(rs.getString("role")),
                                instant(rs.getString("started_at")),
                                AgentStatus.fromKey(rs.getString("status")),
                                instant(rs.getString("retired_at"))));
                    }
                }
            }
            return agents;
        });
    }

    // ── Tasks ────────────────────────────────────────────────────────────

    @Override
    public void upsertTask(Task task) {
        upsertTasks(List.of(task));
    }

    @Override
    public void upsertTasks(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        inTransaction("upsert " + tasks.size() + " task(s)", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT_TASK_SQL)) {
                for (Task task : tasks) {
                    stmt.setString(1, task.sessionId());
                    stmt.setString(2, task.id());
                    stmt.setString(3, task.role().key());
                    stmt.setString(4, task.description());
                    stmt.setString(5, task.status().key());
                    stmt.setString(6, toJson(task.dependencies()));
                    stmt.setInt(7, task.priority());
                    stmt.setInt(8, task.retryCount());
                    stmt.setInt(9, task.attempt());
                    stmt.setString(10, task.createdAt().toString());
                    stmt.setString(11, text(task.startedAt()));
                    stmt.setString(12, text(task.completedAt()));
                    stmt.setString(13, task.assignedAgentId());
                    stmt.setString(14, task.blockedReason());
                    stmt.setString(15, toJson(task.history()));
                    stmt.setString(16, task.artifactSummary());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        });
        log.debug("Saved {} task(s) for session '{}'", tasks.size(), tasks.get(0).sessionId());
    }

    @Override
    public List<Task> listTasks(String sessionId, TaskStatus statusFilter) {
        return inTransaction("list tasks of " + sessionId, conn -> {
            var tasks = new ArrayList<Task>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    statusFilter == null ? SELECT_TASKS_SQL : SELECT_TASKS_BY_STATUS_SQL)) {
                stmt.setString(1, sessionId);
                if (statusFilter != null) {
                    stmt.setString(2, statusFilter.key());
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        tasks.add(taskFrom(rs));
                    }
                }
            }
            return tasks;
        });
    }

    // ── Reports ──────────────────────────────────────────────────────────

    @Override
    public void appendReport(Report report) {
        inTransaction("append report for " + report.sessionId(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_REPORT_SQL)) {
                stmt.setString(1, report.sessionId());
                stmt.setString(2, report.timestamp().toString());
                stmt.setString(3, report.phase().key());
                stmt.setInt(4, report.completedTasks());
                stmt.setString(5, toJson(report.payload()));
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<Report> listReports(String sessionId) {
        return inTransaction("list reports of " + sessionId, conn -> {
            var reports = new ArrayList<Report>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_REPORTS_SQL)) {
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        reports.add(new Report(
                                rs.getString("session_id"),
                                instant(rs.getString("timestamp")),
                                Phase.fromKey(rs.getString("phase")),
                                rs.getInt("completed_tasks"),
                                fromJson(rs.getString("data"), PAYLOAD)));
                    }
                }
            }
            return reports;
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface ConnectionWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String operation, ConnectionWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Store failure during " + operation + ": " + e.getMessage(), e);
        }
    }

    private static boolean hasColumn(Connection conn, String table, String column) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, table, column)) {
            return rs.next();
        }
    }

    private Session sessionFrom(ResultSet rs) throws SQLException {
        return new Session(
                rs.getString("session_id"),
                instant(rs.getString("created_at")),
                rs.getString("project_goal"),
                Phase.fromKey(rs.getString("current_phase")),
                rs.getInt("paused") != 0);
    }

    private Task taskFrom(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("session_id"),
                rs.getString("task_id"),
                Role.fromKey(rs.getString("agent_role")),
                rs.getString("description"),
                TaskStatus.fromKey(rs.getString("status")),
                fromJson(rs.getString("dependencies"), STRING_LIST),
                rs.getInt("priority"),
                rs.getInt("retry_count"),
                rs.getInt("attempt"),
                instant(rs.getString("created_at")),
                instant(rs.getString("started_at")),
                instant(rs.getString("completed_at")),
                rs.getString("assigned_agent_id"),
                rs.getString("blocked_reason"),
                fromJson(rs.getString("history"), STRING_LIST),
                rs.getString("artifact_summary"));
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instant(String text) {
        return text == null ? null : Instant.parse(text);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize store column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt JSON column in project store", e);
        }
    }
}
