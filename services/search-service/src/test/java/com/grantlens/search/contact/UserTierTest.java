package com.grantlens.search.contact;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UserTierTest {

    @Test
    void parsesHeaderCaseInsensitively() {
        assertThat(UserTier.fromHeader("advanced")).isEqualTo(UserTier.ADVANCED);
        assertThat(UserTier.fromHeader(" Unlimited ")).isEqualTo(UserTier.UNLIMITED);
    }

    @Test
    void unknownOrMissingHeaderIsFree() {
        assertThat(UserTier.fromHeader(null)).isEqualTo(UserTier.FREE);
        assertThat(UserTier.fromHeader("")).isEqualTo(UserTier.FREE);
        assertThat(UserTier.fromHeader("enterprise")).isEqualTo(UserTier.FREE);
    }

    @Test
    void onlyPaidTiersSeeEmails() {
        assertThat(UserTier.FREE.canSeeEmails()).isFalse();
        assertThat(UserTier.BASIC.canSeeEmails()).isFalse();
        assertThat(UserTier.ADVANCED.canSeeEmails()).isTrue();
        assertThat(UserTier.UNLIMITED.canSeeEmails()).isTrue();
    }
}
