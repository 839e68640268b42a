package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import villagecompute.community.data.models.User;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class UserRepository implements PanacheRepositoryBase<User, UUID> {

    /**
     * Loads a user holding a {@code SELECT ... FOR UPDATE} lock until the surrounding transaction ends. Must be
     * called inside a transaction.
     */
    public Optional<User> findByIdForUpdate(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return findByIdOptional(id, LockModeType.PESSIMISTIC_WRITE);
    }

    /**
     * Users with the highest balances; ties go to the alphabetically first username.
     */
    public List<User> findTopByPoints(int limit) {
        return findAll(Sort.descending("points").and("username", Sort.Direction.Ascending)).page(0, limit).list();
    }

    public List<User> findByIds(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return list("id IN ?1", ids);
    }
}
