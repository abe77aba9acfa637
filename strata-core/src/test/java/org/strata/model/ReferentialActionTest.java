package org.strata.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferentialActionTest {

    @Test
    @DisplayName("SQL spellings, lower case and underscores are accepted")
    void parses() {
        assertThat(ReferentialAction.fromSql("CASCADE")).isEqualTo(ReferentialAction.CASCADE);
        assertThat(ReferentialAction.fromSql("set null")).isEqualTo(ReferentialAction.SET_NULL);
        assertThat(ReferentialAction.fromSql("no_action")).isEqualTo(ReferentialAction.NO_ACTION);
        assertThat(ReferentialAction.fromSql("restrict").sql()).isEqualTo("RESTRICT");
    }

    @Test
    @DisplayName("Blank means no action was declared")
    void blankIsNull() {
        assertThat(ReferentialAction.fromSql("")).isNull();
        assertThat(ReferentialAction.fromSql(null)).isNull();
    }

    @Test
    @DisplayName("Unknown actions are rejected")
    void rejectsUnknown() {
        assertThatThrownBy(() -> ReferentialAction.fromSql("SET DEFAULT"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
