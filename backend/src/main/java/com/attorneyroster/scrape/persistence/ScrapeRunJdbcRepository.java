package com.attorneyroster.scrape.persistence;

import com.attorneyroster.scrape.model.ScrapeRunStatus;
import com.attorneyroster.scrape.model.ScrapeRunUpdate;
import com.attorneyroster.scrape.model.ScrapeRunView;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class ScrapeRunJdbcRepository implements ScrapeRunTracker {
    private static final String SELECT_RUN_COLUMNS = """
        SELECT id, jurisdiction, started_at, completed_at, attorneys_found, attorneys_added,
               attorneys_updated, errors, status, notes
        FROM scrape_runs
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeRunJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public long begin(String jurisdiction) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jurisdiction", jurisdiction)
            .addValue("startedAt", toTimestamp(Instant.now()))
            .addValue("status", ScrapeRunStatus.RUNNING.name());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (jurisdiction, started_at, status)
                VALUES (:jurisdiction, :startedAt, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scrape run for " + jurisdiction);
        }
        return key.longValue();
    }

    @Override
    public void update(long runId, ScrapeRunUpdate update) {
        if (update == null || update.isEmpty()) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
        List<String> assignments = new ArrayList<>();
        if (update.found() != null) {
            assignments.add("attorneys_found = :found");
            params.addValue("found", update.found());
        }
        if (update.added() != null) {
            assignments.add("attorneys_added = :added");
            params.addValue("added", update.added());
        }
        if (update.updated() != null) {
            assignments.add("attorneys_updated = :updated");
            params.addValue("updated", update.updated());
        }
        if (update.errors() != null) {
            assignments.add("errors = :errors");
            params.addValue("errors", update.errors());
        }
        if (update.status() != null) {
            assignments.add("status = :status");
            params.addValue("status", update.status().name());
        }
        if (update.notes() != null) {
            assignments.add("notes = :notes");
            params.addValue("notes", update.notes());
        }
        if (update.completedAt() != null) {
            assignments.add("completed_at = :completedAt");
            params.addValue("completedAt", toTimestamp(update.completedAt()));
        }
        jdbc.update(
            "UPDATE scrape_runs SET " + String.join(", ", assignments) + " WHERE id = :runId",
            params
        );
    }

    @Override
    public Optional<ScrapeRunView> findRun(long runId) {
        List<ScrapeRunView> rows = jdbc.query(
            SELECT_RUN_COLUMNS + "WHERE id = :runId",
            new MapSqlParameterSource().addValue("runId", runId),
            runRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ScrapeRunView> findRecentRuns(int limit) {
        return jdbc.query(
            SELECT_RUN_COLUMNS + """
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            runRowMapper()
        );
    }

    @Override
    public List<ScrapeRunView> findRunningRuns() {
        return jdbc.query(
            SELECT_RUN_COLUMNS + """
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            runRowMapper()
        );
    }

    private RowMapper<ScrapeRunView> runRowMapper() {
        return (rs, rowNum) -> new ScrapeRunView(
            rs.getLong("id"),
            rs.getString("jurisdiction"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getInt("attorneys_found"),
            rs.getInt("attorneys_added"),
            rs.getInt("attorneys_updated"),
            rs.getInt("errors"),
            parseStatus(rs.getString("status")),
            rs.getString("notes")
        );
    }

    private ScrapeRunStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ScrapeRunStatus.valueOf(raw.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
