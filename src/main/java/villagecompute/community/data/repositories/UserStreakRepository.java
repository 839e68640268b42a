package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import villagecompute.community.data.models.StreakType;
import villagecompute.community.data.models.UserStreak;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class UserStreakRepository implements PanacheRepositoryBase<UserStreak, UUID> {

    private static final String INSERT_IF_ABSENT = """
            INSERT INTO user_streaks (id, user_id, streak_type, current_count, longest_count)
            VALUES (:id, :userId, :streakType, 0, 0)
            ON CONFLICT DO NOTHING
            """;

    public Optional<UserStreak> findForUpdate(UUID userId, StreakType type) {
        return find("userId = ?1 AND streakType = ?2", userId, type).withLock(LockModeType.PESSIMISTIC_WRITE)
                .firstResultOptional();
    }

    public List<UserStreak> findByUser(UUID userId) {
        return list("userId", userId);
    }

    /**
     * Creates an empty streak row for the pair unless one exists. Two first activities racing on the same pair both
     * succeed here and then serialize on the row lock taken by {@link #findForUpdate}.
     *
     * @return true when this call created the row
     */
    public boolean insertIfAbsent(UUID userId, StreakType type) {
        int inserted = getEntityManager().createNativeQuery(INSERT_IF_ABSENT).setParameter("id", UUID.randomUUID())
                .setParameter("userId", userId).setParameter("streakType", type.name()).executeUpdate();
        return inserted == 1;
    }

    public int currentCount(UUID userId, StreakType type) {
        return find("userId = ?1 AND streakType = ?2", userId, type).firstResultOptional()
                .map(streak -> streak.currentCount).orElse(0);
    }

    /**
     * Zeroes streaks of the given type whose last activity is before {@code cutoff}.
     *
     * @return number of streaks reset
     */
    public int resetInactiveSince(StreakType type, LocalDate cutoff) {
        return update("currentCount = 0 WHERE streakType = ?1 AND currentCount > 0 AND lastActivityDate < ?2", type,
                cutoff);
    }
}
