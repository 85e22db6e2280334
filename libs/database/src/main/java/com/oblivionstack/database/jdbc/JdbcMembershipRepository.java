package com.oblivionstack.database.jdbc;

import com.oblivionstack.security.BusinessId;
import com.oblivionstack.security.Role;
import com.oblivionstack.security.UserId;
import com.oblivionstack.security.membership.DuplicateMembershipException;
import com.oblivionstack.security.membership.InvalidMembershipTransitionException;
import com.oblivionstack.security.membership.Membership;
import com.oblivionstack.security.membership.MembershipRepository;
import com.oblivionstack.security.membership.MembershipStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link MembershipRepository} over the {@code business_users} table.
 */
public class JdbcMembershipRepository implements MembershipRepository {

    private static final String COLUMNS = "business_id, user_id, role, status, invited_at, joined_at";

    private static final RowMapper<Membership> ROW_MAPPER = JdbcMembershipRepository::mapRow;

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcMembershipRepository(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public List<Membership> findByUser(UserId userId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM business_users WHERE user_id = ?",
                ROW_MAPPER, userId.value());
    }

    @Override
    public List<Membership> findByBusiness(BusinessId businessId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM business_users WHERE business_id = ?",
                ROW_MAPPER, businessId.value());
    }

    @Override
    public Optional<Membership> find(BusinessId businessId, UserId userId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM business_users WHERE business_id = ? AND user_id = ?",
                ROW_MAPPER, businessId.value(), userId.value()).stream().findFirst();
    }

    @Override
    public List<Membership> findAllActive() {
        return jdbc.query("SELECT " + COLUMNS + " FROM business_users WHERE status = ?",
                ROW_MAPPER, MembershipStatus.ACTIVE.value());
    }

    @Override
    public void insert(Membership membership) {
        Instant now = clock.instant();
        try {
            jdbc.update("INSERT INTO business_users (id, business_id, user_id, role, status, invited_at, joined_at,"
                            + " created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    UUID.randomUUID(),
                    membership.businessId().value(),
                    membership.userId().value(),
                    membership.role().value(),
                    membership.status().value(),
                    JdbcTimestamps.toDb(membership.invitedAt()),
                    JdbcTimestamps.toDb(membership.joinedAt()),
                    JdbcTimestamps.toDb(now),
                    JdbcTimestamps.toDb(now));
        } catch (DuplicateKeyException e) {
            throw new DuplicateMembershipException(membership.businessId(), membership.userId());
        }
    }

    @Override
    public Optional<Membership> updateStatus(BusinessId businessId, UserId userId,
                                             MembershipStatus expected, MembershipStatus target) {
        Instant now = clock.instant();
        return find(businessId, userId).map(existing -> {
            Membership updated = existing.withStatus(target, now);
            int rows = jdbc.update("UPDATE business_users SET status = ?, joined_at = ?, updated_at = ?"
                            + " WHERE business_id = ? AND user_id = ? AND status = ?",
                    target.value(), JdbcTimestamps.toDb(updated.joinedAt()), JdbcTimestamps.toDb(now),
                    businessId.value(), userId.value(), expected.value());
            if (rows == 0) {
                MembershipStatus current = find(businessId, userId).map(Membership::status).orElse(existing.status());
                throw new InvalidMembershipTransitionException(current, target);
            }
            return updated;
        });
    }

    @Override
    public Optional<Membership> updateRole(BusinessId businessId, UserId userId, Role role) {
        int rows = jdbc.update("UPDATE business_users SET role = ?, updated_at = ? WHERE business_id = ? AND user_id = ?",
                role.value(), JdbcTimestamps.toDb(clock.instant()), businessId.value(), userId.value());
        return rows == 0 ? Optional.empty() : find(businessId, userId);
    }

    private static Membership mapRow(ResultSet rs, int rowNum) throws SQLException {
        String role = rs.getString("role");
        String status = rs.getString("status");
        return new Membership(
                new BusinessId(rs.getObject("business_id", UUID.class)),
                new UserId(rs.getObject("user_id", UUID.class)),
                Role.fromString(role).orElseThrow(() -> new SQLException("Unknown role in business_users: " + role)),
                MembershipStatus.fromString(status)
                        .orElseThrow(() -> new SQLException("Unknown status in business_users: " + status)),
                JdbcTimestamps.fromDb(rs, "invited_at"),
                JdbcTimestamps.fromDb(rs, "joined_at"));
    }
}
