package com.zenith.backend.service.ai;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseSanitizerTest {

    @Test
    void stripsHeadingsBulletsAndEmphasis() {
        String raw = "# Weekly plan\n**Bold** and __strong__ with *soft* and _quiet_ words\n- first\n* second\n+ third";

        assertThat(ResponseSanitizer.strip(raw))
                .isEqualTo("Weekly plan\nBold and strong with soft and quiet words\nfirst\nsecond\nthird");
    }

    @Test
    void keepsNumberedLines() {
        String raw = "1. Track spending\n2. Set a **weekly** cap\n3. Review on Sunday";

        assertThat(ResponseSanitizer.strip(raw))
                .isEqualTo("1. Track spending\n2. Set a weekly cap\n3. Review on Sunday");
    }

    @Test
    void leavesArithmeticAndIdentifiersAlone() {
        assertThat(ResponseSanitizer.strip("2 * 3 = 6 and snake_case_name stays"))
                .isEqualTo("2 * 3 = 6 and snake_case_name stays");
    }

    @Test
    void collapsesBlankRunsAndTrims() {
        assertThat(ResponseSanitizer.strip("  Hello   \r\n\r\n\r\n\r\nWorld  ")).isEqualTo("Hello\n\nWorld");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(ResponseSanitizer.strip(null)).isEmpty();
    }
}
