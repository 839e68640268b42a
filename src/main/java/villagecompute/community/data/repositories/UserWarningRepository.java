package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.community.data.models.UserWarning;
import villagecompute.community.data.models.WarningType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class UserWarningRepository implements PanacheRepositoryBase<UserWarning, UUID> {

    /**
     * Active warnings for a user, newest first. Runs in its own transaction so a failed read cannot mark the
     * caller's transaction rollback-only.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public List<UserWarning> findActiveByUser(UUID userId) {
        return list("userId = ?1 AND isActive = true ORDER BY issuedAt DESC", userId);
    }

    public List<UserWarning> findByUser(UUID userId) {
        return list("userId = ?1 ORDER BY issuedAt DESC", userId);
    }

    public long countByUser(UUID userId) {
        return count("userId", userId);
    }

    /**
     * Clears {@code isActive} on suspensions whose expiry is at or before {@code now}.
     *
     * @return number of suspensions deactivated
     */
    public int deactivateExpiredSuspensions(Instant now) {
        return update("isActive = false WHERE type = ?1 AND isActive = true AND expiresAt IS NOT NULL AND expiresAt <= ?2",
                WarningType.SUSPENSION, now);
    }
}
