package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.RewardClaim;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class RewardClaimRepository implements PanacheRepositoryBase<RewardClaim, UUID> {

    public long countByRewardAndUser(UUID rewardId, UUID userId) {
        return count("rewardId = ?1 AND userId = ?2", rewardId, userId);
    }

    public List<RewardClaim> findByUser(UUID userId) {
        return list("userId = ?1 ORDER BY claimedAt DESC", userId);
    }
}
