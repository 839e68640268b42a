package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.Badge;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class BadgeRepository implements PanacheRepositoryBase<Badge, UUID> {

    public List<Badge> findActive() {
        return list("isActive = true ORDER BY sortOrder ASC, name ASC");
    }

    public List<Badge> findByIds(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return list("id IN ?1 ORDER BY sortOrder ASC, name ASC", ids);
    }
}
