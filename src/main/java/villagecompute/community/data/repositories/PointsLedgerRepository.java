package villagecompute.community.data.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.community.data.models.PointsLedgerEntry;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class PointsLedgerRepository implements PanacheRepositoryBase<PointsLedgerEntry, UUID> {

    /**
     * Sums the positive adjustments recorded for a user since {@code since}. Deductions (reward claims, penalties)
     * do not reduce points earned within a window.
     */
    public long sumEarnedSince(UUID userId, Instant since) {
        Long sum = getEntityManager()
                .createQuery("SELECT COALESCE(SUM(e.points), 0) FROM PointsLedgerEntry e "
                        + "WHERE e.userId = :userId AND e.points > 0 AND e.createdAt >= :since", Long.class)
                .setParameter("userId", userId).setParameter("since", since).getSingleResult();
        return sum == null ? 0L : sum;
    }

    public List<PointsLedgerEntry> findRecentByUser(UUID userId, int limit) {
        return find("userId = ?1 ORDER BY createdAt DESC", userId).page(0, limit).list();
    }

    /**
     * Net points (credits minus debits) per user since {@code since}, highest first.
     */
    public List<PointsTotal> findTopNetTotalsSince(Instant since, int limit) {
        List<Object[]> rows = getEntityManager()
                .createQuery("SELECT e.userId, SUM(e.points) FROM PointsLedgerEntry e WHERE e.createdAt >= :since "
                        + "GROUP BY e.userId ORDER BY SUM(e.points) DESC, e.userId ASC", Object[].class)
                .setParameter("since", since).setMaxResults(limit).getResultList();
        return rows.stream().map(row -> new PointsTotal((UUID) row[0], ((Number) row[1]).longValue())).toList();
    }

    public record PointsTotal(UUID userId, long points) {
    }
}
