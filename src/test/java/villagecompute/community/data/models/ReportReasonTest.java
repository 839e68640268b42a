package villagecompute.community.data.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import villagecompute.community.exceptions.ValidationException;

/**
 * Unit tests for {@link ReportReason} and {@link ReportPriority}.
 */
class ReportReasonTest {

    @Test
    void testFromCode_acceptsEveryClientCode() {
        for (ReportReason reason : ReportReason.values()) {
            assertEquals(reason, ReportReason.fromCode(reason.code()));
        }
        assertEquals(ReportReason.PERSONAL_INFORMATION, ReportReason.fromCode("personal_information"));
    }

    @Test
    void testFromCode_unknownOrNull_rejected() {
        assertThrows(ValidationException.class, () -> ReportReason.fromCode("rude"));
        assertThrows(ValidationException.class, () -> ReportReason.fromCode(null));
    }

    @Test
    void testBasePriority_urgentOnlyForViolenceAndSelfHarm() {
        for (ReportReason reason : ReportReason.values()) {
            boolean urgent = reason == ReportReason.VIOLENCE || reason == ReportReason.SELF_HARM;
            assertEquals(urgent, reason.basePriority() == ReportPriority.URGENT, reason.code());
        }
    }

    @Test
    void testAtLeast_neverLowers() {
        assertEquals(ReportPriority.HIGH, ReportPriority.MEDIUM.atLeast(ReportPriority.HIGH));
        assertEquals(ReportPriority.URGENT, ReportPriority.URGENT.atLeast(ReportPriority.HIGH));
    }
}
