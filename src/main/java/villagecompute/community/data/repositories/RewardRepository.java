package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.Reward;

import java.util.UUID;

@ApplicationScoped
public class RewardRepository implements PanacheRepositoryBase<Reward, UUID> {

    /**
     * Reserves one unit of stock. The increment only applies while stock is unlimited or units remain, so two
     * claims cannot both take the last unit.
     *
     * @return true when a unit was reserved
     */
    public boolean reserveUnit(UUID rewardId) {
        return update("timesClaimed = timesClaimed + 1 WHERE id = ?1 AND (stock = ?2 OR timesClaimed < stock)",
                rewardId, Reward.UNLIMITED_STOCK) == 1;
    }
}
