package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import org.hibernate.query.NativeQuery;
import villagecompute.community.data.models.BadgeAward;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@ApplicationScoped
public class BadgeAwardRepository implements PanacheRepositoryBase<BadgeAward, UUID> {

    private static final String INSERT_IF_ABSENT = """
            INSERT INTO badge_awards (id, badge_id, user_id, awarded_by_user_id, earned_at)
            VALUES (:id, :badgeId, :userId, :awardedBy, :earnedAt)
            ON CONFLICT DO NOTHING
            """;

    public Set<UUID> findBadgeIdsByUser(UUID userId) {
        return new HashSet<>(getEntityManager()
                .createQuery("SELECT a.badgeId FROM BadgeAward a WHERE a.userId = :userId", UUID.class)
                .setParameter("userId", userId).getResultList());
    }

    /**
     * Records the award unless the user already holds the badge. Concurrent callers racing on the same pair see
     * exactly one {@code true}.
     *
     * @param awardedByUserId
     *            admin for manual awards, null for automatic ones
     * @return true when this call created the award
     */
    public boolean insertIfAbsent(UUID badgeId, UUID userId, UUID awardedByUserId, Instant earnedAt) {
        int inserted = getEntityManager().createNativeQuery(INSERT_IF_ABSENT).unwrap(NativeQuery.class)
                .setParameter("id", UUID.randomUUID()).setParameter("badgeId", badgeId).setParameter("userId", userId)
                .setParameter("awardedBy", awardedByUserId, UUID.class).setParameter("earnedAt", earnedAt)
                .executeUpdate();
        return inserted == 1;
    }
}
