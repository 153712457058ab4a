package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.KeysetSequence;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to {@code ledger_projections}. Each row is also the lock of its entity.
 */
@Repository
public class ProjectionCacheRepository {

    private static final String COLUMNS = "domain, entity_key, balance, last_sequence_number, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public ProjectionCacheRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the row for an entity unless it exists. Never fails on a concurrent insert.
     */
    public void ensureRow(LedgerDomain domain, String entityKey, Instant now) {
        jdbcTemplate.update(
                "INSERT INTO ledger_projections (domain, entity_key, balance, last_sequence_number, updated_at) " +
                "VALUES (?, ?, 0, 0, ?) ON CONFLICT DO NOTHING",
                domain.name(),
                entityKey,
                toOffset(now));
    }

    /**
     * Reads the row under a row lock held until the surrounding transaction ends.
     */
    public Optional<Projection> lock(LedgerDomain domain, String entityKey) {
        List<Projection> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM ledger_projections WHERE domain = ? AND entity_key = ? FOR UPDATE",
                rowMapper(),
                domain.name(),
                entityKey);
        return rows.stream().findFirst();
    }

    public Optional<Projection> find(LedgerDomain domain, String entityKey) {
        List<Projection> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM ledger_projections WHERE domain = ? AND entity_key = ?",
                rowMapper(),
                domain.name(),
                entityKey);
        return rows.stream().findFirst();
    }

    public void update(LedgerDomain domain, String entityKey, BigDecimal balance,
                       long lastSequenceNumber, Instant updatedAt) {
        jdbcTemplate.update(
                "UPDATE ledger_projections SET balance = ?, last_sequence_number = ?, updated_at = ? " +
                "WHERE domain = ? AND entity_key = ?",
                balance,
                lastSequenceNumber,
                toOffset(updatedAt),
                domain.name(),
                entityKey);
    }

    /**
     * Every cached entity of a domain, in key order.
     */
    public KeysetSequence<Projection> all(LedgerDomain domain, int pageSize) {
        RowMapper<Projection> mapper = rowMapper();
        return new KeysetSequence<>(last -> last == null
                ? jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM ledger_projections WHERE domain = ? " +
                        "ORDER BY entity_key LIMIT " + pageSize,
                        mapper, domain.name())
                : jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM ledger_projections WHERE domain = ? AND entity_key > ? " +
                        "ORDER BY entity_key LIMIT " + pageSize,
                        mapper, domain.name(), last.getEntityKey()),
                pageSize);
    }

    private RowMapper<Projection> rowMapper() {
        return (rs, rowNum) -> new Projection(
                LedgerDomain.valueOf(rs.getString("domain")),
                rs.getString("entity_key"),
                rs.getBigDecimal("balance"),
                rs.getLong("last_sequence_number"),
                rs.getObject("updated_at", OffsetDateTime.class).toInstant());
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
