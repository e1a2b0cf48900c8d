package com.launchpad.core.persistence;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.AgentResultStatus;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchPersistenceException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based {@link LaunchRepository} that persists launches to PostgreSQL.
 * <p>
 * Launch rows live in {@code launches}; results live in {@code agent_results} keyed by
 * {@code (launch_id, seq)} with a unique {@code (launch_id, agent_name)} pair, so a result slot
 * can be claimed at most once even by concurrent writers. Results are removed with their launch.
 * <p>
 * Both tables are created automatically via {@link #createTables()}.
 */
public class JdbcLaunchRepository implements LaunchRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLaunchRepository.class);

    private static final String CREATE_LAUNCHES_SQL = """
            CREATE TABLE IF NOT EXISTS launches (
                id            VARCHAR(64) PRIMARY KEY,
                name          VARCHAR(255) NOT NULL,
                description   TEXT,
                product_type  VARCHAR(255),
                target_market VARCHAR(255),
                status        VARCHAR(32) NOT NULL,
                summary       TEXT,
                created_at    TIMESTAMP NOT NULL,
                updated_at    TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_RESULTS_SQL = """
            CREATE TABLE IF NOT EXISTS agent_results (
                launch_id         VARCHAR(64) NOT NULL REFERENCES launches(id) ON DELETE CASCADE,
                seq               INTEGER NOT NULL,
                agent_name        VARCHAR(128) NOT NULL,
                status            VARCHAR(32) NOT NULL,
                output            TEXT,
                error_message     TEXT,
                error_flag        BOOLEAN NOT NULL,
                "timestamp"       TIMESTAMP NOT NULL,
                attempts          INTEGER NOT NULL,
                execution_time_ms BIGINT NOT NULL,
                PRIMARY KEY (launch_id, seq),
                UNIQUE (launch_id, agent_name)
            )
            """;

    private static final String INSERT_LAUNCH_SQL = """
            INSERT INTO launches (id, name, description, product_type, target_market, status,
                                  summary, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, NULL, ?, ?)
            """;

    private static final String SELECT_LAUNCH_COLUMNS = """
            SELECT id, name, description, product_type, target_market, status, summary,
                   created_at, updated_at
            FROM launches
            """;

    private static final String SELECT_BY_ID_SQL = SELECT_LAUNCH_COLUMNS + " WHERE id = ?";

    private static final String SELECT_ALL_SQL = SELECT_LAUNCH_COLUMNS + " ORDER BY created_at DESC";

    private static final String SELECT_BY_STATUS_SQL =
            SELECT_LAUNCH_COLUMNS + " WHERE status = ? ORDER BY created_at DESC";

    private static final String SELECT_RESULTS_SQL = """
            SELECT agent_name, status, output, error_message, error_flag, "timestamp",
                   attempts, execution_time_ms
            FROM agent_results
            WHERE launch_id = ?
            ORDER BY seq ASC
            """;

    private static final String LOCK_LAUNCH_SQL = "SELECT status FROM launches WHERE id = ? FOR UPDATE";

    private static final String COUNT_RESULTS_SQL = "SELECT COUNT(*) FROM agent_results WHERE launch_id = ?";

    private static final String INSERT_RESULT_SQL = """
            INSERT INTO agent_results (launch_id, seq, agent_name, status, output, error_message,
                                       error_flag, "timestamp", attempts, execution_time_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String TOUCH_LAUNCH_SQL = "UPDATE launches SET updated_at = ? WHERE id = ?";

    private static final String CAS_STATUS_SQL = """
            UPDATE launches
            SET status = ?, summary = COALESCE(?, summary), updated_at = ?
            WHERE id = ? AND status = ?
            """;

    private static final String DELETE_RESULTS_SQL = "DELETE FROM agent_results WHERE launch_id = ?";

    private static final String DELETE_LAUNCH_SQL = "DELETE FROM launches WHERE id = ?";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcLaunchRepository(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Creates the launch tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_LAUNCHES_SQL);
            stmt.execute(CREATE_RESULTS_SQL);
            log.info("Launch tables 'launches' and 'agent_results' ensured");
        }
    }

    @Override
    public Launch create(NewLaunch newLaunch) {
        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_LAUNCH_SQL)) {
            stmt.setString(1, id);
            stmt.setString(2, newLaunch.name());
            stmt.setString(3, newLaunch.description());
            stmt.setString(4, newLaunch.productType());
            stmt.setString(5, newLaunch.targetMarket());
            stmt.setString(6, LaunchStatus.PENDING.wireName());
            stmt.setTimestamp(7, Timestamp.from(now));
            stmt.setTimestamp(8, Timestamp.from(now));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new LaunchPersistenceException(id, "Failed to create launch '" + newLaunch.name() + "'", e);
        }

        log.debug("Created launch '{}' ({})", id, newLaunch.name());
        return findById(id).orElseThrow(() -> new LaunchNotFoundException(id));
    }

    @Override
    public Optional<Launch> findById(String launchId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, launchId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(conn, rs));
                }
            }
        } catch (SQLException e) {
            throw new LaunchPersistenceException(launchId, "Failed to load launch", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Launch> findAll() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            return readLaunches(conn, stmt);
        } catch (SQLException e) {
            throw new LaunchPersistenceException(null, "Failed to list launches", e);
        }
    }

    @Override
    public List<Launch> findByStatus(LaunchStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_STATUS_SQL)) {
            stmt.setString(1, status.wireName());
            return readLaunches(conn, stmt);
        } catch (SQLException e) {
            throw new LaunchPersistenceException(null, "Failed to list " + status.wireName() + " launches", e);
        }
    }

    @Override
    public void appendAgentResult(String launchId, int position, AgentResult result) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                insertResult(conn, launchId, position, result);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new LaunchConflictException(launchId,
                        "Result slot for " + result.agentName() + " already taken", e);
            }
            throw new LaunchPersistenceException(launchId,
                    "Failed to record result for " + result.agentName(), e);
        }
        log.debug("Recorded {} result #{} for '{}' on launch '{}'",
                result.status().wireName(), position, result.agentName(), launchId);
    }

    private void insertResult(Connection conn, String launchId, int position, AgentResult result)
            throws SQLException {
        try (PreparedStatement lock = conn.prepareStatement(LOCK_LAUNCH_SQL)) {
            lock.setString(1, launchId);
            try (ResultSet rs = lock.executeQuery()) {
                if (!rs.next()) {
                    throw new LaunchNotFoundException(launchId);
                }
                LaunchStatus status = LaunchStatus.fromWireName(rs.getString(1));
                if (status != LaunchStatus.IN_PROGRESS) {
                    throw new LaunchConflictException(launchId,
                            "Cannot record " + result.agentName() + ": launch is " + status.wireName());
                }
            }
        }

        try (PreparedStatement count = conn.prepareStatement(COUNT_RESULTS_SQL)) {
            count.setString(1, launchId);
            try (ResultSet rs = count.executeQuery()) {
                rs.next();
                int recorded = rs.getInt(1);
                if (recorded != position) {
                    throw new LaunchConflictException(launchId,
                            "Result position " + position + " is not free (" + recorded + " recorded)");
                }
            }
        }

        try (PreparedStatement insert = conn.prepareStatement(INSERT_RESULT_SQL)) {
            insert.setString(1, launchId);
            insert.setInt(2, position);
            insert.setString(3, result.agentName());
            insert.setString(4, result.status().wireName());
            insert.setString(5, result.output());
            insert.setString(6, result.errorMessage());
            insert.setBoolean(7, result.errorFlag());
            insert.setTimestamp(8, Timestamp.from(result.timestamp()));
            insert.setInt(9, result.attempts());
            insert.setLong(10, result.executionTimeMs());
            insert.executeUpdate();
        }

        try (PreparedStatement touch = conn.prepareStatement(TOUCH_LAUNCH_SQL)) {
            touch.setTimestamp(1, Timestamp.from(clock.instant()));
            touch.setString(2, launchId);
            touch.executeUpdate();
        }
    }

    @Override
    public boolean compareAndSetStatus(String launchId, LaunchStatus expected, LaunchStatus next, String summary) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CAS_STATUS_SQL)) {
            stmt.setString(1, next.wireName());
            stmt.setString(2, summary);
            stmt.setTimestamp(3, Timestamp.from(clock.instant()));
            stmt.setString(4, launchId);
            stmt.setString(5, expected.wireName());
            int updated = stmt.executeUpdate();
            log.debug("Status {} -> {} for launch '{}': {}", expected.wireName(), next.wireName(),
                    launchId, updated == 1 ? "applied" : "rejected");
            return updated == 1;
        } catch (SQLException e) {
            throw new LaunchPersistenceException(launchId,
                    "Failed to move launch to " + next.wireName(), e);
        }
    }

    @Override
    public boolean delete(String launchId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement results = conn.prepareStatement(DELETE_RESULTS_SQL);
                 PreparedStatement launch = conn.prepareStatement(DELETE_LAUNCH_SQL)) {
                results.setString(1, launchId);
                int resultRows = results.executeUpdate();
                launch.setString(1, launchId);
                int launchRows = launch.executeUpdate();
                conn.commit();
                log.debug("Deleted launch '{}' with {} results", launchId, resultRows);
                return launchRows > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new LaunchPersistenceException(launchId, "Failed to delete launch", e);
        }
    }

    // ── Mapping ──────────────────────────────────────────────────────────

    private List<Launch> readLaunches(Connection conn, PreparedStatement stmt) throws SQLException {
        List<Launch> launches = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                launches.add(fromResultSet(conn, rs));
            }
        }
        return launches;
    }

    private Launch fromResultSet(Connection conn, ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return new Launch(
                id,
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("product_type"),
                rs.getString("target_market"),
                LaunchStatus.fromWireName(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                rs.getString("summary"),
                loadResults(conn, id));
    }

    private List<AgentResult> loadResults(Connection conn, String launchId) throws SQLException {
        List<AgentResult> results = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_RESULTS_SQL)) {
            stmt.setString(1, launchId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new AgentResult(
                            rs.getString(1),
                            AgentResultStatus.fromWireName(rs.getString(2)),
                            rs.getString(3),
                            rs.getString(4),
                            rs.getBoolean(5),
                            rs.getTimestamp(6).toInstant(),
                            rs.getInt(7),
                            rs.getLong(8)));
                }
            }
        }
        return results;
    }

    private static boolean isConstraintViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }
}
