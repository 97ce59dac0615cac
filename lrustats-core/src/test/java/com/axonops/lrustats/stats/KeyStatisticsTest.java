package com.axonops.lrustats.stats;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for per-key hit/miss counters. */
class KeyStatisticsTest {

  @Test
  void testNewInstance_AllZero() {
    KeyStatistics stats = new KeyStatistics();

    assertThat(stats.hits()).isZero();
    assertThat(stats.misses()).isZero();
    assertThat(stats.accesses()).isZero();
  }

  @Test
  void testAccesses_IsSumOfHitsAndMisses() {
    KeyStatistics stats = new KeyStatistics();

    stats.recordHit();
    stats.recordHit();
    stats.recordMiss();

    assertThat(stats.hits()).isEqualTo(2);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.accesses()).isEqualTo(3);
  }

  @Test
  void testToString() {
    KeyStatistics stats = new KeyStatistics();
    stats.recordMiss();

    assertThat(stats).hasToString("KeyStatistics{hits=0, misses=1}");
  }
}
