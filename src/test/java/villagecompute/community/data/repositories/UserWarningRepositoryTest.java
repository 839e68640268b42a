package villagecompute.community.data.repositories;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Status;
import jakarta.transaction.SystemException;
import jakarta.transaction.TransactionManager;
import jakarta.transaction.Transactional;
import villagecompute.community.data.models.UserWarning;
import villagecompute.community.data.models.WarningType;
import villagecompute.community.testing.H2TestResource;

/**
 * Database tests for {@link UserWarningRepository}.
 *
 * <p>
 * Test coverage:
 * <ul>
 * <li>Active-warning lookup runs in its own transaction and leaves the caller's transaction active</li>
 * <li>Expired suspensions are deactivated; open-ended and future ones are kept</li>
 * </ul>
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class UserWarningRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Inject
    UserWarningRepository warningRepository;

    @Inject
    TransactionManager transactionManager;

    private UUID userId;

    @BeforeEach
    @Transactional
    void setUp() {
        warningRepository.deleteAll();
        userId = UUID.randomUUID();
    }

    @Test
    @Transactional
    void testFindActiveByUser_callerUncommittedWarning_notVisible() throws SystemException {
        warningRepository.persistAndFlush(UserWarning.create(userId, WarningType.BANNED, "spam", null, NOW, null));

        List<UserWarning> active = warningRepository.findActiveByUser(userId);

        assertTrue(active.isEmpty());
        assertEquals(Status.STATUS_ACTIVE, transactionManager.getStatus());
        assertEquals(1, warningRepository.count("userId", userId));
    }

    @Test
    void testFindActiveByUser_committedWarnings_newestFirstAndActiveOnly() throws SystemException {
        QuarkusTransaction.requiringNew().run(() -> {
            warningRepository.persist(
                    UserWarning.create(userId, WarningType.WARNING, "first", null, NOW.minusSeconds(60), null));
            warningRepository.persist(UserWarning.create(userId, WarningType.WARNING, "second", null, NOW, null));
            UserWarning lifted = UserWarning.create(userId, WarningType.BANNED, "lifted", null, NOW.minusSeconds(30),
                    null);
            lifted.isActive = false;
            warningRepository.persist(lifted);
        });

        List<UserWarning> active = warningRepository.findActiveByUser(userId);

        assertEquals(2, active.size());
        assertEquals("second", active.get(0).reason);
        assertEquals("first", active.get(1).reason);
        assertEquals(Status.STATUS_NO_TRANSACTION, transactionManager.getStatus());
    }

    @Test
    @Transactional
    void testDeactivateExpiredSuspensions_onlyExpiredSuspensions() {
        UserWarning expired = suspension(NOW.minus(Duration.ofHours(1)));
        UserWarning future = suspension(NOW.plus(Duration.ofHours(1)));
        UserWarning openEnded = suspension(null);
        UserWarning boundary = suspension(NOW);
        warningRepository.persist(List.of(expired, future, openEnded, boundary));
        UserWarning warning = UserWarning.create(userId, WarningType.WARNING, "rude", null,
                NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)));
        warningRepository.persistAndFlush(warning);

        int count = warningRepository.deactivateExpiredSuspensions(NOW);
        warningRepository.getEntityManager().clear();

        assertEquals(2, count);
        assertFalse(warningRepository.findById(expired.id).isActive);
        assertFalse(warningRepository.findById(boundary.id).isActive);
        assertTrue(warningRepository.findById(future.id).isActive);
        assertTrue(warningRepository.findById(openEnded.id).isActive);
        assertTrue(warningRepository.findById(warning.id).isActive);
    }

    @Test
    @Transactional
    void testCountByUser_countsInactiveToo() {
        UserWarning lifted = suspension(NOW);
        lifted.isActive = false;
        warningRepository.persist(List.of(lifted, suspension(null)));

        assertEquals(2, warningRepository.countByUser(userId));
        assertEquals(0, warningRepository.countByUser(UUID.randomUUID()));
    }

    private UserWarning suspension(Instant expiresAt) {
        return UserWarning.create(userId, WarningType.SUSPENSION, "cooling off", null, NOW.minus(Duration.ofDays(1)),
                expiresAt);
    }
}
