package com.flagship.pharmacy_ledger.ledger;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.exception.LedgerConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only store for stock and cash movements.
 *
 * Each domain has its own table ({@code stock_movements} keyed by batch,
 * {@code cash_movements} keyed by bank account). A stock quantity or bank balance is never
 * stored as truth: it is whatever the fold of these rows says it is.
 *
 * Invariants enforced here:
 * 1. Rows are only ever inserted (PostgreSQL triggers reject UPDATE/DELETE as well)
 * 2. A deduplicated reference is recorded at most once, with all of its lines in one append
 * 3. Every entry carries the sign its movement kind demands (also a CHECK constraint)
 *
 * Appends are MANDATORY: the caller owns the transaction and holds the lock of every entity
 * key it appends to, so the sequence numbers handed out for a key follow the order in which
 * its movements were validated. Corrections are new compensating entries, never edits.
 *
 * Reads are ordered by {@code (occurred_at, recorded_at, sequence_number)} and paged with a
 * keyset on that triple ({@link KeysetSequence}), so a read of a long history holds no
 * cursor open and can be restarted from the last entry seen.
 *
 * Uses JDBC directly: the ledger tables are facts, not entities.
 */
@Slf4j
@Repository
public class LedgerStore {

    private static final String COLUMNS =
            "sequence_number, entry_id, entity_key, signed_amount, movement_kind, reference_type, " +
            "reference_id, line_number, occurred_at, recorded_at, remarks";

    private static final String LEDGER_ORDER = " ORDER BY occurred_at, recorded_at, sequence_number";

    private static final String AFTER_CURSOR =
            " AND (occurred_at > ? OR (occurred_at = ? AND (recorded_at > ? " +
            "OR (recorded_at = ? AND sequence_number > ?))))";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final int pageSize;

    public LedgerStore(JdbcTemplate jdbcTemplate, Clock clock, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.pageSize = properties.getRead().getPageSize();
    }

    /**
     * Appends all entries of one external event, or none of them.
     *
     * Must run inside the caller's transaction: the caller holds the entity locks and owns
     * the commit.
     *
     * @throws LedgerConflictException if the reference already has entries recorded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LedgerEntry> append(List<LedgerEntryDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to append");
        }
        LedgerDomain domain = drafts.get(0).getDomain();
        Reference reference = drafts.get(0).getReference();
        Set<Integer> lineNumbers = new HashSet<>();
        for (LedgerEntryDraft draft : drafts) {
            if (draft.getDomain() != domain) {
                throw new IllegalArgumentException("An append cannot span ledger domains");
            }
            if (!draft.getReference().equals(reference)) {
                throw new IllegalArgumentException("An append must carry a single reference");
            }
            if (!lineNumbers.add(draft.getLineNumber())) {
                throw new IllegalArgumentException("Duplicate line number " + draft.getLineNumber());
            }
        }

        if (reference.isDeduplicated() && hasEntries(domain, reference)) {
            throw new LedgerConflictException(reference.getType().name(), reference.getId());
        }

        Instant recordedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        List<LedgerEntry> appended = new ArrayList<>(drafts.size());
        try {
            for (LedgerEntryDraft draft : drafts) {
                appended.add(insert(draft, recordedAt));
            }
        } catch (DuplicateKeyException e) {
            // a concurrent append of the same reference won the unique constraint
            throw new LedgerConflictException(reference.getType().name(), reference.getId());
        }

        log.debug("Appended {} {} entries for reference {}", appended.size(), domain, reference);
        return appended;
    }

    private LedgerEntry insert(LedgerEntryDraft draft, Instant recordedAt) {
        UUID entryId = UUID.randomUUID();
        Instant occurredAt = draft.getOccurredAt().truncatedTo(ChronoUnit.MICROS);
        String sql = "INSERT INTO " + draft.getDomain().table() +
                " (entry_id, entity_key, signed_amount, movement_kind, reference_type, reference_id, " +
                "line_number, occurred_at, recorded_at, remarks) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"sequence_number"});
            ps.setObject(1, entryId);
            ps.setString(2, draft.getEntityKey());
            ps.setBigDecimal(3, draft.getSignedAmount());
            ps.setString(4, draft.getKind().name());
            ps.setString(5, draft.getReference().getType().name());
            ps.setString(6, draft.getReference().getId());
            ps.setInt(7, draft.getLineNumber());
            ps.setObject(8, toOffset(occurredAt));
            ps.setObject(9, toOffset(recordedAt));
            ps.setString(10, draft.getRemarks());
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No sequence number generated for entry " + entryId);
        }
        return new LedgerEntry(key.longValue(), entryId, draft.getDomain(), draft.getEntityKey(),
                draft.getSignedAmount(), draft.getKind(), draft.getReference(), draft.getLineNumber(),
                occurredAt, recordedAt, draft.getRemarks());
    }

    public boolean hasEntries(LedgerDomain domain, Reference reference) {
        if (!reference.isDeduplicated()) {
            return false;
        }
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + domain.table() + " WHERE reference_type = ? AND reference_id = ?",
                Integer.class,
                reference.getType().name(),
                reference.getId());
        return count != null && count > 0;
    }

    /**
     * Full history of an entity in ledger order.
     */
    public KeysetSequence<LedgerEntry> read(LedgerDomain domain, String entityKey) {
        return read(domain, entityKey, null);
    }

    /**
     * History of an entity in ledger order, limited to entries that occurred at or before
     * {@code asOf} when given.
     */
    public KeysetSequence<LedgerEntry> read(LedgerDomain domain, String entityKey, Instant asOf) {
        String base = "SELECT " + COLUMNS + " FROM " + domain.table() + " WHERE entity_key = ?" +
                (asOf != null ? " AND occurred_at <= ?" : "");
        RowMapper<LedgerEntry> mapper = rowMapper(domain);

        return new KeysetSequence<>(last -> {
            List<Object> args = new ArrayList<>();
            args.add(entityKey);
            if (asOf != null) {
                args.add(toOffset(asOf));
            }
            String sql = base;
            if (last != null) {
                sql += AFTER_CURSOR;
                OffsetDateTime occurred = toOffset(last.getOccurredAt());
                OffsetDateTime recorded = toOffset(last.getRecordedAt());
                args.add(occurred);
                args.add(occurred);
                args.add(recorded);
                args.add(recorded);
                args.add(last.getSequenceNumber());
            }
            sql += LEDGER_ORDER + " LIMIT " + pageSize;
            return jdbcTemplate.query(sql, mapper, args.toArray());
        }, pageSize);
    }

    /**
     * Entries of an entity appended after the given sequence number, in insertion order.
     */
    public KeysetSequence<LedgerEntry> readAfter(LedgerDomain domain, String entityKey, long afterSequence) {
        String sql = "SELECT " + COLUMNS + " FROM " + domain.table() +
                " WHERE entity_key = ? AND sequence_number > ? ORDER BY sequence_number LIMIT " + pageSize;
        RowMapper<LedgerEntry> mapper = rowMapper(domain);
        return new KeysetSequence<>(last -> jdbcTemplate.query(sql, mapper,
                entityKey, last == null ? afterSequence : last.getSequenceNumber()), pageSize);
    }

    /**
     * All entries recorded for a reference, for audit.
     */
    public List<LedgerEntry> findByReference(LedgerDomain domain, ReferenceType type, String referenceId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM " + domain.table() +
                " WHERE reference_type = ? AND reference_id = ? ORDER BY line_number",
                rowMapper(domain),
                type.name(),
                referenceId);
    }

    public Optional<LedgerEntry> findByEntryId(LedgerDomain domain, UUID entryId) {
        List<LedgerEntry> found = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM " + domain.table() + " WHERE entry_id = ?",
                rowMapper(domain),
                entryId);
        return found.stream().findFirst();
    }

    /**
     * Latest occurrence time recorded for an entity, if it has any entries.
     */
    public Optional<Instant> latestOccurredAt(LedgerDomain domain, String entityKey) {
        List<OffsetDateTime> found = jdbcTemplate.query(
                "SELECT MAX(occurred_at) AS latest FROM " + domain.table() + " WHERE entity_key = ?",
                (rs, rowNum) -> rs.getObject("latest", OffsetDateTime.class),
                entityKey);
        return found.stream().filter(t -> t != null).findFirst().map(OffsetDateTime::toInstant);
    }

    private RowMapper<LedgerEntry> rowMapper(LedgerDomain domain) {
        return (rs, rowNum) -> {
            String referenceId = rs.getString("reference_id");
            ReferenceType referenceType = ReferenceType.valueOf(rs.getString("reference_type"));
            BigDecimal amount = rs.getBigDecimal("signed_amount");
            return new LedgerEntry(
                    rs.getLong("sequence_number"),
                    rs.getObject("entry_id", UUID.class),
                    domain,
                    rs.getString("entity_key"),
                    amount,
                    MovementKind.valueOf(rs.getString("movement_kind")),
                    new Reference(referenceType, referenceId),
                    rs.getInt("line_number"),
                    rs.getObject("occurred_at", OffsetDateTime.class).toInstant(),
                    rs.getObject("recorded_at", OffsetDateTime.class).toInstant(),
                    rs.getString("remarks"));
        };
    }

    static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
