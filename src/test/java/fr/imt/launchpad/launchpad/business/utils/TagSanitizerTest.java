package fr.imt.launchpad.launchpad.business.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TagSanitizerTest {

    @Test
    void keepsValidTags() {
        assertThat(TagSanitizer.sanitizeTag("build-118.rc_1")).isEqualTo("build-118.rc_1");
    }

    @Test
    void replacesInvalidCharactersAndLeadingSeparators() {
        assertThat(TagSanitizer.sanitizeTag("feature/churn v2")).isEqualTo("feature_churn_v2");
        assertThat(TagSanitizer.sanitizeTag("-rc")).isEqualTo("_rc");
    }

    @Test
    void truncatesToTheTagLimit() {
        assertThat(TagSanitizer.sanitizeTag("a".repeat(200))).hasSize(128);
    }
}
