package com.attorneyroster.scrape.persistence;

import com.attorneyroster.scrape.model.AttorneyRecord;
import com.attorneyroster.scrape.model.AttorneySearchCriteria;
import com.attorneyroster.scrape.model.AttorneyView;
import com.attorneyroster.scrape.model.RosterStats;
import com.attorneyroster.scrape.model.UpsertOutcome;
import com.attorneyroster.scrape.model.UpsertResult;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class AttorneyJdbcRepository implements PersistenceGateway {
    private static final int TOP_LIMIT = 20;
    private static final int PRACTICE_AREA_MAX = 255;
    private static final Map<String, Integer> COLUMN_WIDTHS = Map.ofEntries(
        Map.entry("jurisdiction", 16),
        Map.entry("barNumber", 32),
        Map.entry("firstName", 255),
        Map.entry("lastName", 255),
        Map.entry("fullName", 512),
        Map.entry("status", 255),
        Map.entry("admissionDate", 64),
        Map.entry("firmName", 512),
        Map.entry("city", 255),
        Map.entry("county", 255),
        Map.entry("address", 1024),
        Map.entry("email", 255),
        Map.entry("phone", 64),
        Map.entry("website", 1024),
        Map.entry("lawSchool", 512),
        Map.entry("graduationYear", 16)
    );

    private static final String UPDATE_BY_NATURAL_KEY = """
        UPDATE attorneys
        SET first_name = :firstName,
            last_name = :lastName,
            full_name = :fullName,
            status = :status,
            admission_date = COALESCE(:admissionDate, admission_date),
            firm_name = :firmName,
            city = :city,
            county = :county,
            address = :address,
            email = :email,
            phone = :phone,
            website = :website,
            law_school = COALESCE(:lawSchool, law_school),
            graduation_year = COALESCE(:graduationYear, graduation_year),
            updated_at = CURRENT_TIMESTAMP
        WHERE jurisdiction = :jurisdiction
          AND bar_number = :barNumber
        """;

    private static final String SELECT_ATTORNEY_COLUMNS = """
        SELECT a.id, a.jurisdiction, a.bar_number, a.first_name, a.last_name, a.full_name,
               a.status, a.admission_date, a.firm_name, a.city, a.county, a.address,
               a.phone, a.email, a.website, a.law_school, a.graduation_year,
               a.created_at, a.updated_at
        FROM attorneys a
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public AttorneyJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public UpsertResult upsert(AttorneyRecord record) {
        MapSqlParameterSource params = attorneyParams(record);
        if (!record.hasBarNumber()) {
            return new UpsertResult(insertAttorney(params), UpsertOutcome.INSERTED);
        }

        int updated = jdbc.update(UPDATE_BY_NATURAL_KEY, params);
        if (updated > 0) {
            return new UpsertResult(findIdByNaturalKey(params), UpsertOutcome.UPDATED);
        }
        try {
            return new UpsertResult(insertAttorney(params), UpsertOutcome.INSERTED);
        } catch (DuplicateKeyException e) {
            // Lost an insert race on (jurisdiction, bar_number).
            jdbc.update(UPDATE_BY_NATURAL_KEY, params);
            return new UpsertResult(findIdByNaturalKey(params), UpsertOutcome.UPDATED);
        }
    }

    @Override
    public void attachPracticeAreas(long attorneyId, List<String> practiceAreas) {
        if (practiceAreas == null || practiceAreas.isEmpty()) {
            return;
        }
        for (int i = 0; i < practiceAreas.size(); i++) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("attorneyId", attorneyId)
                .addValue("practiceArea", clamp(practiceAreas.get(i), PRACTICE_AREA_MAX))
                .addValue("isPrimary", i == 0);
            int updated = jdbc.update(
                """
                    UPDATE practice_areas
                    SET is_primary = :isPrimary
                    WHERE attorney_id = :attorneyId
                      AND practice_area = :practiceArea
                    """,
                params
            );
            if (updated > 0) {
                continue;
            }
            try {
                jdbc.update(
                    """
                        INSERT INTO practice_areas (attorney_id, practice_area, is_primary)
                        VALUES (:attorneyId, :practiceArea, :isPrimary)
                        """,
                    params
                );
            } catch (DuplicateKeyException e) {
                jdbc.update(
                    """
                        UPDATE practice_areas
                        SET is_primary = :isPrimary
                        WHERE attorney_id = :attorneyId
                          AND practice_area = :practiceArea
                        """,
                    params
                );
            }
        }
        jdbc.update(
            """
                UPDATE practice_areas
                SET is_primary = FALSE
                WHERE attorney_id = :attorneyId
                  AND practice_area <> :primaryArea
                  AND is_primary = TRUE
                """,
            new MapSqlParameterSource()
                .addValue("attorneyId", attorneyId)
                .addValue("primaryArea", clamp(practiceAreas.get(0), PRACTICE_AREA_MAX))
        );
    }

    public Optional<AttorneyView> findById(long attorneyId) {
        List<AttorneyView> rows = jdbc.query(
            SELECT_ATTORNEY_COLUMNS + "WHERE a.id = :attorneyId",
            new MapSqlParameterSource().addValue("attorneyId", attorneyId),
            attorneyRowMapper()
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(withPracticeAreas(rows).get(0));
    }

    public List<AttorneyView> search(AttorneySearchCriteria criteria) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, criteria.limit()));
        StringBuilder sql = new StringBuilder(SELECT_ATTORNEY_COLUMNS).append("WHERE 1 = 1\n");

        if (hasText(criteria.jurisdiction())) {
            sql.append("  AND a.jurisdiction = :jurisdiction\n");
            params.addValue("jurisdiction", criteria.jurisdiction().trim().toUpperCase(Locale.ROOT));
        }
        if (hasText(criteria.name())) {
            sql.append("  AND (LOWER(a.full_name) LIKE :nameLike OR LOWER(a.last_name) LIKE :nameLike)\n");
            params.addValue("nameLike", like(criteria.name()));
        }
        if (hasText(criteria.city())) {
            sql.append("  AND LOWER(a.city) LIKE :cityLike\n");
            params.addValue("cityLike", like(criteria.city()));
        }
        if (hasText(criteria.firm())) {
            sql.append("  AND LOWER(a.firm_name) LIKE :firmLike\n");
            params.addValue("firmLike", like(criteria.firm()));
        }
        if (hasText(criteria.status())) {
            sql.append("  AND LOWER(a.status) = :status\n");
            params.addValue("status", criteria.status().trim().toLowerCase(Locale.ROOT));
        }
        if (hasText(criteria.practiceArea())) {
            sql.append("""
                  AND EXISTS (
                    SELECT 1
                    FROM practice_areas pa
                    WHERE pa.attorney_id = a.id
                      AND LOWER(pa.practice_area) LIKE :practiceAreaLike
                  )
                """);
            params.addValue("practiceAreaLike", like(criteria.practiceArea()));
        }
        sql.append("ORDER BY a.last_name, a.first_name, a.id\nLIMIT :limit");

        return withPracticeAreas(jdbc.query(sql.toString(), params, attorneyRowMapper()));
    }

    public RosterStats stats() {
        Long total = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM attorneys", Long.class);
        Map<String, Long> byJurisdiction = countBy(
            """
                SELECT jurisdiction AS label, COUNT(*) AS total
                FROM attorneys
                GROUP BY jurisdiction
                ORDER BY total DESC, label
                """
        );
        Map<String, Long> byStatus = countBy(
            """
                SELECT COALESCE(status, 'Unknown') AS label, COUNT(*) AS total
                FROM attorneys
                GROUP BY COALESCE(status, 'Unknown')
                ORDER BY total DESC, label
                """
        );
        Map<String, Long> topPracticeAreas = countBy(
            """
                SELECT practice_area AS label, COUNT(*) AS total
                FROM practice_areas
                GROUP BY practice_area
                ORDER BY total DESC, label
                LIMIT %d
                """.formatted(TOP_LIMIT)
        );
        Map<String, Long> topFirms = countBy(
            """
                SELECT firm_name AS label, COUNT(*) AS total
                FROM attorneys
                WHERE firm_name IS NOT NULL AND firm_name <> ''
                GROUP BY firm_name
                ORDER BY total DESC, label
                LIMIT %d
                """.formatted(TOP_LIMIT)
        );
        return new RosterStats(total == null ? 0L : total, byJurisdiction, byStatus, topPracticeAreas, topFirms);
    }

    private long insertAttorney(MapSqlParameterSource params) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO attorneys (
                    jurisdiction, bar_number, first_name, last_name, full_name,
                    status, admission_date, firm_name, city, county,
                    address, email, phone, website, law_school, graduation_year
                )
                VALUES (
                    :jurisdiction, :barNumber, :firstName, :lastName, :fullName,
                    :status, :admissionDate, :firmName, :city, :county,
                    :address, :email, :phone, :website, :lawSchool, :graduationYear
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert attorney " + params.getValue("fullName"));
        }
        return key.longValue();
    }

    private long findIdByNaturalKey(MapSqlParameterSource params) {
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM attorneys
                WHERE jurisdiction = :jurisdiction
                  AND bar_number = :barNumber
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException(
                "Failed to upsert attorney " + params.getValue("jurisdiction") + "/" + params.getValue("barNumber")
            );
        }
        return id;
    }

    private MapSqlParameterSource attorneyParams(AttorneyRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        addClamped(params, "jurisdiction", record.jurisdiction());
        addClamped(params, "barNumber", record.hasBarNumber() ? record.barNumber() : null);
        addClamped(params, "firstName", record.firstName());
        addClamped(params, "lastName", record.lastName());
        addClamped(params, "fullName", record.fullName());
        addClamped(params, "status", record.status());
        addClamped(params, "admissionDate", record.admissionDate());
        addClamped(params, "firmName", record.firmName());
        addClamped(params, "city", record.city());
        addClamped(params, "county", record.county());
        addClamped(params, "address", record.address());
        addClamped(params, "email", record.email());
        addClamped(params, "phone", record.phone());
        addClamped(params, "website", record.website());
        addClamped(params, "lawSchool", record.lawSchool());
        addClamped(params, "graduationYear", record.graduationYear());
        return params;
    }

    private void addClamped(MapSqlParameterSource params, String name, String value) {
        params.addValue(name, clamp(value, COLUMN_WIDTHS.get(name)));
    }

    /**
     * Scraped text is cut to its column width so an oversized value never rejects the row.
     */
    static String clamp(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private List<AttorneyView> withPracticeAreas(List<AttorneyView> attorneys) {
        if (attorneys.isEmpty()) {
            return attorneys;
        }
        List<Long> ids = attorneys.stream().map(AttorneyView::id).toList();
        Map<Long, List<String>> areasById = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT attorney_id, practice_area
                FROM practice_areas
                WHERE attorney_id IN (:ids)
                ORDER BY attorney_id, is_primary DESC, id
                """,
            new MapSqlParameterSource().addValue("ids", ids),
            rs -> {
                areasById.computeIfAbsent(rs.getLong("attorney_id"), ignored -> new ArrayList<>())
                    .add(rs.getString("practice_area"));
            }
        );
        List<AttorneyView> out = new ArrayList<>(attorneys.size());
        for (AttorneyView view : attorneys) {
            out.add(new AttorneyView(
                view.id(),
                view.jurisdiction(),
                view.barNumber(),
                view.firstName(),
                view.lastName(),
                view.fullName(),
                view.status(),
                view.admissionDate(),
                view.firmName(),
                view.city(),
                view.county(),
                view.address(),
                view.phone(),
                view.email(),
                view.website(),
                view.lawSchool(),
                view.graduationYear(),
                areasById.getOrDefault(view.id(), List.of()),
                view.createdAt(),
                view.updatedAt()
            ));
        }
        return out;
    }

    private Map<String, Long> countBy(String sql) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            sql,
            new MapSqlParameterSource(),
            rs -> {
                String label = rs.getString("label");
                if (label != null) {
                    counts.put(label, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    private RowMapper<AttorneyView> attorneyRowMapper() {
        return (rs, rowNum) -> new AttorneyView(
            rs.getLong("id"),
            rs.getString("jurisdiction"),
            rs.getString("bar_number"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("full_name"),
            rs.getString("status"),
            rs.getString("admission_date"),
            rs.getString("firm_name"),
            rs.getString("city"),
            rs.getString("county"),
            rs.getString("address"),
            rs.getString("phone"),
            rs.getString("email"),
            rs.getString("website"),
            rs.getString("law_school"),
            rs.getString("graduation_year"),
            List.of(),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private String like(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
