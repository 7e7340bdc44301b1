package com.collabim.domain.service;

import com.collabim.common.error.ChatException;
import com.collabim.domain.config.RecruitmentProperties;
import com.collabim.domain.enums.RecruitmentStatus;
import org.junit.jupiter.api.Test;

import static com.collabim.domain.enums.RecruitmentStatus.ACCEPTED;
import static com.collabim.domain.enums.RecruitmentStatus.COMPLETED;
import static com.collabim.domain.enums.RecruitmentStatus.DECLINED;
import static com.collabim.domain.enums.RecruitmentStatus.DISCUSSING;
import static com.collabim.domain.enums.RecruitmentStatus.OFFER_SENT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecruitmentTransitionPolicyTest {

    @Test
    void permissiveByDefault_ShouldAllowEverything() {
        RecruitmentTransitionPolicy policy = new RecruitmentTransitionPolicy(new RecruitmentProperties());
        assertFalse(policy.isStrict());
        for (RecruitmentStatus from : RecruitmentStatus.values()) {
            for (RecruitmentStatus to : RecruitmentStatus.values()) {
                assertTrue(policy.isAllowed(from, to), from + " -> " + to);
            }
        }
    }

    @Test
    void strict_ShouldFollowTheGraph() {
        RecruitmentProperties props = new RecruitmentProperties();
        props.setMode(" STRICT ");
        RecruitmentTransitionPolicy policy = new RecruitmentTransitionPolicy(props);
        assertTrue(policy.isStrict());

        assertTrue(policy.isAllowed(DISCUSSING, OFFER_SENT));
        assertTrue(policy.isAllowed(OFFER_SENT, ACCEPTED));
        assertTrue(policy.isAllowed(OFFER_SENT, DECLINED));
        assertTrue(policy.isAllowed(OFFER_SENT, DISCUSSING));
        assertTrue(policy.isAllowed(ACCEPTED, COMPLETED));
        assertTrue(policy.isAllowed(DECLINED, DISCUSSING));

        assertFalse(policy.isAllowed(DISCUSSING, ACCEPTED));
        assertFalse(policy.isAllowed(DISCUSSING, COMPLETED));
        assertFalse(policy.isAllowed(ACCEPTED, DISCUSSING));
        assertFalse(policy.isAllowed(COMPLETED, DISCUSSING));
        assertFalse(policy.isAllowed(DECLINED, ACCEPTED));
    }

    @Test
    void strict_SameStateAndMissingCurrentState() {
        RecruitmentProperties props = new RecruitmentProperties();
        props.setMode(RecruitmentProperties.MODE_STRICT);
        RecruitmentTransitionPolicy policy = new RecruitmentTransitionPolicy(props);

        assertTrue(policy.isAllowed(COMPLETED, COMPLETED));
        assertTrue(policy.isAllowed(null, OFFER_SENT));
        assertFalse(policy.isAllowed(null, COMPLETED));
        assertTrue(policy.isAllowed(DISCUSSING, null));

        ChatException e = assertThrows(ChatException.class, () -> policy.check(DISCUSSING, COMPLETED));
        assertEquals("illegal_transition", e.getReason());
    }
}
