package com.ithacaweather.service.store;

import com.ithacaweather.core.error.StorageException;
import com.ithacaweather.core.model.Reading;
import com.ithacaweather.ingest.api.PersistResult;
import com.ithacaweather.ingest.api.ReadingStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * SQLite-backed reading history. The {@code UNIQUE(location_id, observed_at)} constraint is what
 * keeps history free of duplicates, including across processes sharing the same file.
 */
public class SqliteReadingStore implements ReadingStore {
    private static final Logger LOGGER = Logger.getLogger(SqliteReadingStore.class.getName());

    private static final String COLUMNS = "location_id, observed_at, fetched_at, temperature, feels_like, humidity, "
            + "pressure, visibility, wind_speed, wind_direction, cloud_coverage, condition_code, condition_main, "
            + "condition_description, sunrise, sunset, units, raw_payload";

    private static final String INSERT = "INSERT OR IGNORE INTO readings (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS readings (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                location_id TEXT NOT NULL,
                observed_at INTEGER NOT NULL,
                fetched_at INTEGER NOT NULL,
                temperature REAL NOT NULL,
                feels_like REAL NOT NULL,
                humidity INTEGER NOT NULL,
                pressure REAL NOT NULL,
                visibility REAL,
                wind_speed REAL NOT NULL,
                wind_direction INTEGER,
                cloud_coverage INTEGER,
                condition_code INTEGER NOT NULL,
                condition_main TEXT,
                condition_description TEXT,
                sunrise INTEGER NOT NULL,
                sunset INTEGER NOT NULL,
                units TEXT,
                raw_payload TEXT NOT NULL,
                UNIQUE (location_id, observed_at)
            )
            """,
            """
            CREATE TRIGGER IF NOT EXISTS readings_append_only
            BEFORE UPDATE ON readings
            BEGIN
                SELECT RAISE(ABORT, 'readings are append-only');
            END
            """
    };

    private static final Instant MAX_STORABLE = Instant.ofEpochMilli(Long.MAX_VALUE);
    private static final Instant MIN_STORABLE = Instant.ofEpochMilli(Long.MIN_VALUE);

    private final String jdbcUrl;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SqliteReadingStore(Path databaseFile) {
        this.jdbcUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        try {
            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed creating database directory for " + databaseFile, e);
        }
        initSchema();
    }

    @Override
    public PersistResult persist(List<Reading> readings) {
        if (readings.isEmpty()) {
            return PersistResult.NOTHING;
        }
        writeLock.lock();
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            int inserted = 0;
            try (PreparedStatement statement = connection.prepareStatement(INSERT)) {
                for (Reading reading : readings) {
                    bind(statement, reading);
                    inserted += statement.executeUpdate();
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
            return new PersistResult(inserted, readings.size() - inserted);
        } catch (SQLException | RuntimeException e) {
            throw new StorageException("Failed persisting batch of " + readings.size() + " readings", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Stream<Reading> queryRange(String locationId, Instant from, Instant to) {
        Connection connection = null;
        PreparedStatement statement = null;
        try {
            connection = open();
            statement = connection.prepareStatement("SELECT " + COLUMNS + " FROM readings "
                    + "WHERE location_id = ? AND observed_at >= ? AND observed_at < ? ORDER BY observed_at ASC");
            statement.setString(1, locationId);
            statement.setLong(2, saturatedEpochMilli(from));
            statement.setLong(3, saturatedEpochMilli(to));
            ResultSet rows = statement.executeQuery();
            Connection ownedConnection = connection;
            PreparedStatement ownedStatement = statement;
            return StreamSupport.stream(new RowSpliterator(rows), false)
                    .onClose(() -> closeAll(rows, ownedStatement, ownedConnection));
        } catch (SQLException | RuntimeException e) {
            closeAll(null, statement, connection);
            throw new StorageException("Failed querying readings for " + locationId, e);
        }
    }

    @Override
    public Optional<Reading> latestReading(String locationId) {
        try (Connection connection = open();
             PreparedStatement statement = connection.prepareStatement("SELECT " + COLUMNS + " FROM readings "
                     + "WHERE location_id = ? ORDER BY observed_at DESC LIMIT 1")) {
            statement.setString(1, locationId);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(map(rows)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed reading latest reading for " + locationId, e);
        }
    }

    @Override
    public Map<String, Instant> lastSuccessfulFetches() {
        try (Connection connection = open();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery(
                     "SELECT location_id, MAX(fetched_at) FROM readings GROUP BY location_id")) {
            Map<String, Instant> latest = new HashMap<>();
            while (rows.next()) {
                latest.put(rows.getString(1), Instant.ofEpochMilli(rows.getLong(2)));
            }
            return latest;
        } catch (SQLException e) {
            throw new StorageException("Failed reading last fetch times", e);
        }
    }

    public long count() {
        try (Connection connection = open();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM readings")) {
            return rows.next() ? rows.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Failed counting readings", e);
        }
    }

    private void initSchema() {
        try (Connection connection = open(); Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode = WAL");
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed initializing reading store at " + jdbcUrl, e);
        }
    }

    private Connection open() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private static void bind(PreparedStatement statement, Reading reading) throws SQLException {
        statement.setString(1, reading.locationId());
        statement.setLong(2, reading.observedAt().toEpochMilli());
        statement.setLong(3, reading.fetchedAt().toEpochMilli());
        statement.setDouble(4, reading.temperature());
        statement.setDouble(5, reading.feelsLike());
        statement.setInt(6, reading.humidity());
        statement.setDouble(7, reading.pressure());
        setNullableDouble(statement, 8, reading.visibility());
        statement.setDouble(9, reading.windSpeed());
        setNullableInt(statement, 10, reading.windDirection());
        setNullableInt(statement, 11, reading.cloudCoverage());
        statement.setInt(12, reading.conditionCode());
        statement.setString(13, reading.conditionMain());
        statement.setString(14, reading.conditionDescription());
        statement.setLong(15, reading.sunrise().toEpochMilli());
        statement.setLong(16, reading.sunset().toEpochMilli());
        statement.setString(17, reading.units());
        statement.setString(18, reading.rawPayload());
    }

    private static Reading map(ResultSet rows) throws SQLException {
        return new Reading(
                rows.getString("location_id"),
                Instant.ofEpochMilli(rows.getLong("observed_at")),
                Instant.ofEpochMilli(rows.getLong("fetched_at")),
                rows.getDouble("temperature"),
                rows.getDouble("feels_like"),
                rows.getInt("humidity"),
                rows.getDouble("pressure"),
                nullableDouble(rows, "visibility"),
                rows.getDouble("wind_speed"),
                nullableInt(rows, "wind_direction"),
                nullableInt(rows, "cloud_coverage"),
                rows.getInt("condition_code"),
                rows.getString("condition_main"),
                rows.getString("condition_description"),
                Instant.ofEpochMilli(rows.getLong("sunrise")),
                Instant.ofEpochMilli(rows.getLong("sunset")),
                rows.getString("units"),
                rows.getString("raw_payload")
        );
    }

    private static void setNullableDouble(PreparedStatement statement, int index, Double value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.REAL);
        } else {
            statement.setDouble(index, value);
        }
    }

    private static void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private static Double nullableDouble(ResultSet rows, String column) throws SQLException {
        double value = rows.getDouble(column);
        return rows.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rows, String column) throws SQLException {
        int value = rows.getInt(column);
        return rows.wasNull() ? null : value;
    }

    // Range bounds beyond what a stored row can hold behave as open ends.
    static long saturatedEpochMilli(Instant instant) {
        if (instant.isAfter(MAX_STORABLE)) {
            return Long.MAX_VALUE;
        }
        if (instant.isBefore(MIN_STORABLE)) {
            return Long.MIN_VALUE;
        }
        return instant.toEpochMilli();
    }

    private static void rollbackQuietly(Connection connection, Exception original) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            original.addSuppressed(rollbackError);
        }
    }

    private static void closeAll(ResultSet rows, Statement statement, Connection connection) {
        try {
            if (rows != null) {
                rows.close();
            }
            if (statement != null) {
                statement.close();
            }
            if (connection != null) {
                connection.close();
            }
        } catch (SQLException e) {
            LOGGER.log(Level.WARNING, "Failed releasing reading query resources", e);
        }
    }

    private static final class RowSpliterator extends Spliterators.AbstractSpliterator<Reading> {
        private final ResultSet rows;

        private RowSpliterator(ResultSet rows) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rows = rows;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Reading> action) {
            try {
                if (!rows.next()) {
                    return false;
                }
                action.accept(map(rows));
                return true;
            } catch (SQLException e) {
                throw new StorageException("Failed reading row from reading query", e);
            }
        }
    }
}
