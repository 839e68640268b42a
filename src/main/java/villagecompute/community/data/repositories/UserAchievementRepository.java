package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.UserAchievement;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class UserAchievementRepository implements PanacheRepositoryBase<UserAchievement, UUID> {

    public List<UserAchievement> findByUser(UUID userId) {
        return list("userId = ?1 ORDER BY earnedAt DESC", userId);
    }
}
