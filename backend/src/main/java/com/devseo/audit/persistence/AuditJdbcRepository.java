package com.devseo.audit.persistence;

import com.devseo.audit.crawl.model.PageHeadings;
import com.devseo.audit.crawl.model.PageIssue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class AuditJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(AuditJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<PageIssue>> ISSUE_LIST = new TypeReference<>() {};
    public static final int DEFAULT_CREDITS = 10;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public AuditJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long createAudit(String userId, String url, String domain) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("url", url)
            .addValue("domain", domain)
            .addValue("status", AuditStatus.PENDING.key());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO seo_audits (user_id, url, domain, status)
                VALUES (:userId, :url, :domain, :status)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public AuditRecord findAudit(long auditId) {
        List<AuditRecord> rows = jdbc.query(
            """
                SELECT id, user_id, url, domain, status,
                       overall_score, meta_score, content_score, performance_score, technical_score,
                       pages_crawled, issues_found, fixes_generated, results, summary,
                       created_at, completed_at
                FROM seo_audits
                WHERE id = :auditId
                """,
            new MapSqlParameterSource("auditId", auditId),
            auditRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<AuditRecord> findAuditsByUser(String userId) {
        return jdbc.query(
            """
                SELECT id, user_id, url, domain, status,
                       overall_score, meta_score, content_score, performance_score, technical_score,
                       pages_crawled, issues_found, fixes_generated, results, summary,
                       created_at, completed_at
                FROM seo_audits
                WHERE user_id = :userId
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource("userId", userId),
            auditRowMapper()
        );
    }

    public List<AuditPageRecord> findAuditPages(long auditId) {
        return jdbc.query(
            """
                SELECT id, audit_id, url, title, meta_description, headings, word_count,
                       internal_links, external_links, images, schema_detected, issues
                FROM audit_pages
                WHERE audit_id = :auditId
                ORDER BY id
                """,
            new MapSqlParameterSource("auditId", auditId),
            (rs, rowNum) -> new AuditPageRecord(
                rs.getLong("id"),
                rs.getLong("audit_id"),
                rs.getString("url"),
                rs.getString("title"),
                rs.getString("meta_description"),
                readHeadings(rs.getString("headings")),
                rs.getInt("word_count"),
                rs.getInt("internal_links"),
                rs.getInt("external_links"),
                rs.getInt("images"),
                readList(rs.getString("schema_detected"), STRING_LIST),
                readList(rs.getString("issues"), ISSUE_LIST)
            )
        );
    }

    public void markAuditStatus(long auditId, AuditStatus status) {
        jdbc.update(
            "UPDATE seo_audits SET status = :status WHERE id = :auditId",
            new MapSqlParameterSource()
                .addValue("auditId", auditId)
                .addValue("status", status.key())
        );
    }

    public void insertAuditPages(long auditId, List<AuditPageRecord> pages) {
        if (pages == null || pages.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = pages.stream()
            .map(page -> new MapSqlParameterSource()
                .addValue("auditId", auditId)
                .addValue("url", page.url())
                .addValue("title", page.title())
                .addValue("metaDescription", page.metaDescription())
                .addValue("headings", writeJson(page.headings()))
                .addValue("wordCount", page.wordCount())
                .addValue("internalLinks", page.internalLinks())
                .addValue("externalLinks", page.externalLinks())
                .addValue("images", page.images())
                .addValue("schemaDetected", writeJson(page.schemaDetected()))
                .addValue("issues", writeJson(page.issues())))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO audit_pages (
                    audit_id, url, title, meta_description, headings, word_count,
                    internal_links, external_links, images, schema_detected, issues
                )
                VALUES (
                    :auditId, :url, :title, :metaDescription, :headings, :wordCount,
                    :internalLinks, :externalLinks, :images, :schemaDetected, :issues
                )
                """,
            batch
        );
    }

    public void completeAudit(long auditId, AuditCompletion completion, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("auditId", auditId)
            .addValue("status", AuditStatus.COMPLETED.key())
            .addValue("overallScore", completion.overallScore())
            .addValue("metaScore", completion.metaScore())
            .addValue("contentScore", completion.contentScore())
            .addValue("performanceScore", completion.performanceScore())
            .addValue("technicalScore", completion.technicalScore())
            .addValue("pagesCrawled", completion.pagesCrawled())
            .addValue("issuesFound", completion.issuesFound())
            .addValue("fixesGenerated", completion.fixesGenerated())
            .addValue("results", writeJson(completion.results()))
            .addValue("summary", completion.summary())
            .addValue("completedAt", toTimestamp(completedAt));
        jdbc.update(
            """
                UPDATE seo_audits
                SET status = :status,
                    overall_score = :overallScore,
                    meta_score = :metaScore,
                    content_score = :contentScore,
                    performance_score = :performanceScore,
                    technical_score = :technicalScore,
                    pages_crawled = :pagesCrawled,
                    issues_found = :issuesFound,
                    fixes_generated = :fixesGenerated,
                    results = :results,
                    summary = :summary,
                    completed_at = :completedAt
                WHERE id = :auditId
                """,
            params
        );
    }

    public void incrementTotalAudits(String userId) {
        jdbc.update(
            "UPDATE user_profiles SET total_audits = total_audits + 1 WHERE user_id = :userId",
            new MapSqlParameterSource("userId", userId)
        );
    }

    /**
     * Returns the user's profile, creating it with the default credit balance on first use.
     */
    public UserProfile ensureProfile(String userId) {
        UserProfile existing = findProfile(userId);
        if (existing != null) {
            return existing;
        }
        try {
            jdbc.update(
                "INSERT INTO user_profiles (user_id, credits, total_audits) VALUES (:userId, :credits, 0)",
                new MapSqlParameterSource()
                    .addValue("userId", userId)
                    .addValue("credits", DEFAULT_CREDITS)
            );
        } catch (DuplicateKeyException e) {
            log.debug("Profile for {} created concurrently", userId);
        }
        return findProfile(userId);
    }

    public UserProfile findProfile(String userId) {
        List<UserProfile> rows = jdbc.query(
            "SELECT user_id, credits, total_audits FROM user_profiles WHERE user_id = :userId",
            new MapSqlParameterSource("userId", userId),
            (rs, rowNum) -> new UserProfile(
                rs.getString("user_id"),
                rs.getInt("credits"),
                rs.getInt("total_audits")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Adds {@code delta} to the balance in a single statement. Returns false, leaving the balance
     * untouched, when the profile is missing or the balance would drop below zero.
     */
    public boolean adjustProfileCredits(String userId, int delta) {
        int updated = jdbc.update(
            """
                UPDATE user_profiles
                SET credits = credits + :delta
                WHERE user_id = :userId AND credits + :delta >= 0
                """,
            new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("delta", delta)
        );
        return updated > 0;
    }

    public long insertCreditTransaction(
        String userId,
        int amount,
        CreditTransactionType type,
        String description,
        Long auditId
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount)
            .addValue("type", type.key())
            .addValue("description", description)
            .addValue("auditId", auditId);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO credit_transactions (user_id, amount, type, description, audit_id)
                VALUES (:userId, :amount, :type, :description, :auditId)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public List<CreditTransaction> findCreditTransactions(String userId) {
        return jdbc.query(
            """
                SELECT id, user_id, amount, type, description, audit_id, created_at
                FROM credit_transactions
                WHERE user_id = :userId
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource("userId", userId),
            (rs, rowNum) -> new CreditTransaction(
                rs.getLong("id"),
                rs.getString("user_id"),
                rs.getInt("amount"),
                rs.getString("type"),
                rs.getString("description"),
                rs.getObject("audit_id", Long.class),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    private RowMapper<AuditRecord> auditRowMapper() {
        return (rs, rowNum) -> new AuditRecord(
            rs.getLong("id"),
            rs.getString("user_id"),
            rs.getString("url"),
            rs.getString("domain"),
            AuditStatus.fromKey(rs.getString("status")),
            rs.getObject("overall_score", Integer.class),
            rs.getObject("meta_score", Integer.class),
            rs.getObject("content_score", Integer.class),
            rs.getObject("performance_score", Integer.class),
            rs.getObject("technical_score", Integer.class),
            rs.getInt("pages_crawled"),
            rs.getInt("issues_found"),
            rs.getInt("fixes_generated"),
            readTree(rs.getString("results")),
            rs.getString("summary"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit results JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private PageHeadings readHeadings(String json) {
        if (json == null || json.isBlank()) {
            return PageHeadings.empty();
        }
        try {
            return objectMapper.readValue(json, PageHeadings.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable page headings JSON: {}", e.getOriginalMessage());
            return PageHeadings.empty();
        }
    }

    private <T> List<T> readList(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> parsed = objectMapper.readValue(json, type);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable page JSON column: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
