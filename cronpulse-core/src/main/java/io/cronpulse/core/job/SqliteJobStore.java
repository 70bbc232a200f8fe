package io.cronpulse.core.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteJobStore implements JobRepository {
    private static final String JOB_COLUMNS = "id, name, url, schedule, enabled, user_id, created_at";
    // Fixed width so that created_at sorts chronologically as text.
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final String jdbcUrl;
    private final Clock clock;

    public SqliteJobStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteJobStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        init();
    }

    @Override
    public synchronized List<Job> listEnabledJobs() throws IOException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM cron_jobs WHERE enabled = 1 ORDER BY id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<Job> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(readJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to list enabled jobs", e);
        }
    }

    @Override
    public synchronized long appendOutcome(ExecutionOutcome outcome) throws IOException {
        Objects.requireNonNull(outcome, "outcome must not be null");
        String sql = """
            INSERT INTO cron_logs (job_id, user_id, status, response_time, error_message, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, outcome.jobId());
            statement.setLong(2, outcome.userId());
            statement.setInt(3, outcome.status());
            statement.setLong(4, outcome.responseTimeMs());
            statement.setString(5, outcome.errorMessage());
            statement.setString(6, TIMESTAMP.format(clock.instant()));
            statement.executeUpdate();
            return lastInsertId(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to append outcome for job " + outcome.jobId(), e);
        }
    }

    @Override
    public synchronized Job createJob(long userId, String name, String url, String schedule) throws IOException {
        String sql = """
            INSERT INTO cron_jobs (name, url, schedule, enabled, user_id, created_at)
            VALUES (?, ?, ?, 1, ?, ?)
            """;
        Instant createdAt = clock.instant();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, name);
            statement.setString(2, url);
            statement.setString(3, schedule);
            statement.setLong(4, userId);
            statement.setString(5, TIMESTAMP.format(createdAt));
            statement.executeUpdate();
            long id = lastInsertId(connection);
            return new Job(id, name, url, schedule, true, userId, createdAt);
        } catch (SQLException e) {
            throw new IOException("Failed to create job", e);
        }
    }

    @Override
    public synchronized Optional<Job> findJob(long jobId, long userId) throws IOException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM cron_jobs WHERE id = ? AND user_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, jobId);
            statement.setLong(2, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readJob(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + jobId, e);
        }
    }

    @Override
    public synchronized List<JobSummary> listJobs(long userId) throws IOException {
        String sql = """
            SELECT j.id, j.name, j.url, j.schedule, j.enabled, j.user_id, j.created_at,
                   (SELECT COUNT(*) FROM cron_logs l WHERE l.job_id = j.id) AS execution_count,
                   (SELECT l.status FROM cron_logs l WHERE l.job_id = j.id
                    ORDER BY l.created_at DESC, l.id DESC LIMIT 1) AS last_status
            FROM cron_jobs j
            WHERE j.user_id = ?
            ORDER BY j.created_at DESC, j.id DESC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<JobSummary> summaries = new ArrayList<>();
                while (resultSet.next()) {
                    int lastStatus = resultSet.getInt("last_status");
                    Integer last = resultSet.wasNull() ? null : lastStatus;
                    summaries.add(new JobSummary(readJob(resultSet), resultSet.getLong("execution_count"), last));
                }
                return summaries;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list jobs for user " + userId, e);
        }
    }

    @Override
    public synchronized boolean setEnabled(long jobId, long userId, boolean enabled) throws IOException {
        String sql = "UPDATE cron_jobs SET enabled = ? WHERE id = ? AND user_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, enabled ? 1 : 0);
            statement.setLong(2, jobId);
            statement.setLong(3, userId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + jobId, e);
        }
    }

    @Override
    public synchronized boolean updateJob(long jobId, long userId, String name, String url, String schedule)
        throws IOException {
        String sql = "UPDATE cron_jobs SET name = ?, url = ?, schedule = ? WHERE id = ? AND user_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, name);
            statement.setString(2, url);
            statement.setString(3, schedule);
            statement.setLong(4, jobId);
            statement.setLong(5, userId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + jobId, e);
        }
    }

    @Override
    public synchronized boolean deleteJob(long jobId, long userId) throws IOException {
        String sql = "DELETE FROM cron_jobs WHERE id = ? AND user_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, jobId);
            statement.setLong(2, userId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + jobId, e);
        }
    }

    @Override
    public synchronized List<ExecutionLog> listLogs(long jobId, long userId, int limit) throws IOException {
        String sql = """
            SELECT id, job_id, user_id, status, response_time, error_message, created_at
            FROM cron_logs
            WHERE job_id = ? AND user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, jobId);
            statement.setLong(2, userId);
            statement.setInt(3, Math.max(1, limit));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExecutionLog> logs = new ArrayList<>();
                while (resultSet.next()) {
                    logs.add(new ExecutionLog(
                        resultSet.getLong("id"),
                        resultSet.getLong("job_id"),
                        resultSet.getLong("user_id"),
                        resultSet.getInt("status"),
                        resultSet.getLong("response_time"),
                        resultSet.getString("error_message"),
                        Instant.parse(resultSet.getString("created_at"))
                    ));
                }
                return logs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list logs for job " + jobId, e);
        }
    }

    private Job readJob(ResultSet resultSet) throws SQLException {
        return new Job(
            resultSet.getLong("id"),
            resultSet.getString("name"),
            resultSet.getString("url"),
            resultSet.getString("schedule"),
            resultSet.getInt("enabled") != 0,
            resultSet.getLong("user_id"),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            return resultSet.next() ? resultSet.getLong(1) : -1;
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String jobs = """
            CREATE TABLE IF NOT EXISTS cron_jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                url TEXT NOT NULL,
                schedule TEXT NOT NULL,
                enabled INTEGER NOT NULL DEFAULT 1,
                user_id INTEGER NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String logs = """
            CREATE TABLE IF NOT EXISTS cron_logs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id INTEGER NOT NULL,
                user_id INTEGER NOT NULL,
                status INTEGER,
                response_time INTEGER,
                error_message TEXT,
                created_at TEXT NOT NULL,
                FOREIGN KEY (job_id) REFERENCES cron_jobs (id) ON DELETE CASCADE
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(jobs);
            statement.execute(logs);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_cron_jobs_user_id ON cron_jobs(user_id)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_cron_logs_job_id ON cron_logs(job_id)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_cron_logs_created_at ON cron_logs(created_at)");
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
