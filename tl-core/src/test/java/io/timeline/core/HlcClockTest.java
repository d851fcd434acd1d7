package io.timeline.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HlcClockTest {

    @Test
    void newPhysicalTimeResetsCounter() {
        var clock = new MutableClock(100);
        var hlc = new HlcClock(clock, "A");

        assertThat(hlc.now()).isEqualTo(new Hlc(100, 0, "A"));
        clock.set(105);
        assertThat(hlc.now()).isEqualTo(new Hlc(105, 0, "A"));
    }

    @Test
    void sameMillisecondAdvancesCounter() {
        var hlc = new HlcClock(new MutableClock(100), "A");

        assertThat(hlc.now()).isEqualTo(new Hlc(100, 0, "A"));
        assertThat(hlc.now()).isEqualTo(new Hlc(100, 1, "A"));
        assertThat(hlc.now()).isEqualTo(new Hlc(100, 2, "A"));
    }

    @Test
    void clockRegressionStillIssuesIncreasingIds() {
        var clock = new MutableClock(500);
        var hlc = new HlcClock(clock, "A");
        var first = hlc.now();

        clock.set(400);
        var second = hlc.now();

        assertThat(second).isEqualTo(new Hlc(500, 1, "A"));
        assertThat(second.isAfter(first)).isTrue();
    }

    @Test
    void epochReadingStartsAtCounterZero() {
        var hlc = new HlcClock(new MutableClock(0), "A");
        assertThat(hlc.now()).isEqualTo(new Hlc(0, 0, "A"));
    }

    @Test
    void sameMillisecondOnTwoNodesBreaksTieByNode() {
        var a = new HlcClock(new MutableClock(100), "A").now("A");
        var b = new HlcClock(new MutableClock(100), "B").now("B");

        for (int run = 0; run < 3; run++) {
            assertThat(Hlc.compare(a, b)).isEqualTo(-1);
            assertThat(Hlc.compare(b, a)).isEqualTo(1);
        }
    }

    @Test
    void observeMovesPastRemoteIdentifier() {
        var hlc = new HlcClock(new MutableClock(100), "A");
        var remote = new Hlc(200, 4, "B");

        var merged = hlc.observe(remote);
        assertThat(merged).isEqualTo(new Hlc(200, 5, "A"));
        assertThat(hlc.now().isAfter(remote)).isTrue();
    }

    @Test
    void observeOlderRemoteKeepsLocalTime() {
        var clock = new MutableClock(300);
        var hlc = new HlcClock(clock, "A");
        hlc.now();

        assertThat(hlc.observe(new Hlc(100, 9, "B"))).isEqualTo(new Hlc(300, 1, "A"));

        clock.set(400);
        assertThat(hlc.observe(new Hlc(100, 9, "B"))).isEqualTo(new Hlc(400, 0, "A"));
    }

    @Test
    void counterRunsToUnsigned32BitLimitBeforeOverflow() {
        var hlc = new HlcClock(new MutableClock(100), "A");

        assertThat(hlc.observe(new Hlc(100, Integer.MAX_VALUE, "B"))).isEqualTo(new Hlc(100, 2_147_483_648L, "A"));
        assertThat(hlc.observe(new Hlc(100, Hlc.MAX_COUNTER - 1, "B"))).isEqualTo(new Hlc(100, Hlc.MAX_COUNTER, "A"));
        assertThatThrownBy(hlc::now)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("overflow");
    }

    @Test
    void blankNodeFallsBackToDefault() {
        var hlc = new HlcClock(new MutableClock(1), " ");
        assertThat(hlc.defaultNode()).isNotBlank();
    }
}
