package com.hypecycle.core.cache;

import com.hypecycle.core.model.ExpansionState;
import com.hypecycle.core.model.Phase;
import com.hypecycle.core.model.PhaseOpinion;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link CacheStore} persisting one row per classification in the
 * {@code analyses} table.
 * <p>
 * Per-source metrics, per-source opinions, expansion terms and errors are stored as JSON
 * text columns. The SQL is portable between H2 and PostgreSQL. The table and its indexes
 * are created by {@link #createTables()}.
 */
public class JdbcCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCacheStore.class);

    static final String TABLE_NAME = "analyses";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                       BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                keyword                  VARCHAR(100) NOT NULL,
                phase                    VARCHAR(32) NOT NULL,
                confidence               DOUBLE PRECISION NOT NULL,
                reasoning                TEXT NOT NULL,
                social_data              TEXT,
                papers_data              TEXT,
                patents_data             TEXT,
                news_data                TEXT,
                finance_data             TEXT,
                per_source_analyses_data TEXT,
                query_expansion_applied  BOOLEAN DEFAULT FALSE NOT NULL,
                expanded_terms_data      TEXT,
                errors_data              TEXT,
                created_at               TIMESTAMP WITH TIME ZONE NOT NULL,
                expires_at               TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final List<String> CREATE_INDEX_SQL = List.of(
            "CREATE INDEX IF NOT EXISTS idx_analyses_keyword ON %s (keyword)".formatted(TABLE_NAME),
            "CREATE INDEX IF NOT EXISTS idx_analyses_expires ON %s (expires_at)".formatted(TABLE_NAME));

    private static final String COLUMNS = """
            keyword, phase, confidence, reasoning,
            social_data, papers_data, patents_data, news_data, finance_data,
            per_source_analyses_data, query_expansion_applied, expanded_terms_data, errors_data,
            created_at, expires_at""";

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_LIVE_SQL = """
            SELECT %s
            FROM %s
            WHERE keyword = ? AND expires_at > ?
            ORDER BY created_at DESC, id DESC
            LIMIT 1
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT %s
            FROM %s
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private final DataSource dataSource;
    private final CacheEntryCodec codec;

    public JdbcCacheStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = new CacheEntryCodec();
    }

    /**
     * Creates the analyses table and its indexes if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            for (String sql : CREATE_INDEX_SQL) {
                stmt.execute(sql);
            }
            log.info("Cache table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<CacheEntry> get(String keyword, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LIVE_SQL)) {
            stmt.setString(1, keyword);
            stmt.setObject(2, toTimestamp(now));

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to read cache for keyword '" + keyword + "'", e);
        }
    }

    @Override
    public void put(CacheEntry entry) {
        Map<SourceName, SourceMetrics> metrics = entry.sourceMetrics();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, entry.keyword());
            stmt.setString(2, entry.finalOpinion().phase().wireName());
            stmt.setDouble(3, entry.finalOpinion().confidence());
            stmt.setString(4, entry.finalOpinion().reasoning());
            int index = 5;
            for (SourceName source : SourceName.values()) {
                stmt.setString(index++, codec.writeMetrics(metrics.get(source)));
            }
            stmt.setString(10, codec.writeOpinions(entry.perSourceOpinions()));
            stmt.setBoolean(11, entry.expansion().applied());
            stmt.setString(12, codec.writeStrings(entry.expansion().terms()));
            stmt.setString(13, codec.writeStrings(entry.errors()));
            stmt.setObject(14, toTimestamp(entry.createdAt()));
            stmt.setObject(15, toTimestamp(entry.expiresAt()));
            stmt.executeUpdate();

            log.debug("Stored analysis for '{}' (expires {})", entry.keyword(), entry.expiresAt());
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to store analysis for keyword '" + entry.keyword() + "'", e);
        }
    }

    @Override
    public List<CacheEntry> recent(int limit) {
        List<CacheEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new CacheStoreException("Failed to list recent analyses", e);
        }
        return entries;
    }

    private CacheEntry fromResultSet(ResultSet rs) throws SQLException {
        PhaseOpinion finalOpinion = new PhaseOpinion(
                Phase.fromWireName(rs.getString("phase")),
                rs.getDouble("confidence"),
                rs.getString("reasoning"));

        Map<SourceName, SourceMetrics> metrics = new EnumMap<>(SourceName.class);
        for (SourceName source : SourceName.values()) {
            SourceMetrics sourceMetrics = codec.readMetrics(rs.getString(source.key() + "_data"));
            if (sourceMetrics != null) {
                metrics.put(source, sourceMetrics);
            }
        }

        List<String> terms = codec.readStrings(rs.getString("expanded_terms_data"));
        boolean applied = rs.getBoolean("query_expansion_applied") && !terms.isEmpty();
        return new CacheEntry(
                rs.getString("keyword"),
                finalOpinion,
                codec.readOpinions(rs.getString("per_source_analyses_data")),
                metrics,
                applied ? ExpansionState.applied(terms) : ExpansionState.none(),
                codec.readStrings(rs.getString("errors_data")),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("expires_at", OffsetDateTime.class).toInstant());
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
