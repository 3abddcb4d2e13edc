package org.rtlgraph.builder;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SsaStateTest {

    @Test
    void versionsIncreasePerVariable() {
        SsaState ssa = new SsaState();

        assertThat(ssa.latest("count")).isEqualTo("count");
        assertThat(ssa.newVersion("count")).isEqualTo("count_1");
        assertThat(ssa.newVersion("state")).isEqualTo("state_1");
        assertThat(ssa.newVersion("count")).isEqualTo("count_2");
        assertThat(ssa.latest("count")).isEqualTo("count_2");
        assertThat(ssa.version("count")).isEqualTo(2);
        assertThat(ssa.version("other")).isZero();
    }

    @Test
    void resetForgetsAllVersions() {
        SsaState ssa = new SsaState();
        ssa.newVersion("q");
        ssa.reset();

        assertThat(ssa.latest("q")).isEqualTo("q");
        assertThat(ssa.newVersion("q")).isEqualTo("q_1");
    }
}
