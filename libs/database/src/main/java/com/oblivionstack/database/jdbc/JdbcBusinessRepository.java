package com.oblivionstack.database.jdbc;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.tenant.Business;
import com.oblivionstack.security.tenant.BusinessRepository;
import com.oblivionstack.security.tenant.BusinessStatus;
import com.oblivionstack.security.tenant.DuplicateSlugException;
import com.oblivionstack.security.tenant.Industry;
import com.oblivionstack.security.tenant.SubscriptionStatus;
import com.oblivionstack.security.tenant.SubscriptionTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link BusinessRepository} over the {@code businesses} table.
 */
public class JdbcBusinessRepository implements BusinessRepository {

    private static final String SELECT = "SELECT id, name, slug, industry, email, status, subscription_tier,"
            + " subscription_status, trial_ends_at, created_at, updated_at, deleted_at FROM businesses";

    private static final RowMapper<Business> ROW_MAPPER = JdbcBusinessRepository::mapRow;

    private final JdbcTemplate jdbc;

    public JdbcBusinessRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Business> findById(BusinessId id) {
        return jdbc.query(SELECT + " WHERE id = ?", ROW_MAPPER, id.value()).stream().findFirst();
    }

    @Override
    public Optional<Business> findBySlug(String slug) {
        return jdbc.query(SELECT + " WHERE slug = ?", ROW_MAPPER, slug).stream().findFirst();
    }

    @Override
    public void insert(Business business) {
        try {
            jdbc.update("INSERT INTO businesses (id, name, slug, industry, email, status, subscription_tier,"
                            + " subscription_status, trial_ends_at, created_at, updated_at, deleted_at)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    business.id().value(),
                    business.name(),
                    business.slug(),
                    business.industry().value(),
                    business.email(),
                    business.status().value(),
                    business.subscriptionTier().value(),
                    business.subscriptionStatus().value(),
                    JdbcTimestamps.toDb(business.trialEndsAt()),
                    JdbcTimestamps.toDb(business.createdAt()),
                    JdbcTimestamps.toDb(business.updatedAt()),
                    JdbcTimestamps.toDb(business.deletedAt()));
        } catch (DuplicateKeyException e) {
            throw new DuplicateSlugException(business.slug());
        }
    }

    @Override
    public Optional<Business> softDelete(BusinessId id, Instant at) {
        int rows = jdbc.update("UPDATE businesses SET deleted_at = ?, updated_at = ? WHERE id = ? AND deleted_at IS NULL",
                JdbcTimestamps.toDb(at), JdbcTimestamps.toDb(at), id.value());
        return rows == 0 ? Optional.empty() : findById(id);
    }

    private static Business mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Business(
                new BusinessId(rs.getObject("id", UUID.class)),
                rs.getString("name"),
                rs.getString("slug"),
                Industry.fromString(rs.getString("industry")).orElse(Industry.OTHER),
                rs.getString("email"),
                BusinessStatus.fromString(rs.getString("status")).orElse(null),
                SubscriptionTier.fromString(rs.getString("subscription_tier")).orElse(null),
                SubscriptionStatus.fromString(rs.getString("subscription_status")).orElse(null),
                JdbcTimestamps.fromDb(rs, "trial_ends_at"),
                JdbcTimestamps.fromDb(rs, "created_at"),
                JdbcTimestamps.fromDb(rs, "updated_at"),
                JdbcTimestamps.fromDb(rs, "deleted_at"));
    }
}
