package com.axonops.lrustats.stats;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

/**
 * Tests for the read and structural API of {@link Statistics}.
 *
 * <p>Accesses are recorded through a mutator claimed from the tracker under test, the same way an
 * owning cache does it.
 */
class StatisticsTest {

  // ========== Construction ==========

  @Test
  void testDefaultConstructor_EmptyWithZeroTotals() {
    Statistics<String> stats = new Statistics<>();

    assertThat(stats.totalAccesses()).isZero();
    assertThat(stats.totalHits()).isZero();
    assertThat(stats.totalMisses()).isZero();
    assertThat(stats.numberOfMonitoredKeys()).isZero();
    assertThat(stats.isMonitoringKeys()).isFalse();
  }

  @Test
  void testVarargsConstructor_MonitorsEachKey() {
    Statistics<String> stats = new Statistics<>("x", "y");

    assertThat(stats.isMonitoring("x")).isTrue();
    assertThat(stats.isMonitoring("y")).isTrue();
    assertThat(stats.numberOfMonitoredKeys()).isEqualTo(2);
    assertThat(stats.hitsFor("x")).isZero();
    assertThat(stats.totalAccesses()).isZero();
  }

  @Test
  void testVarargsConstructor_DuplicateKeysMonitoredOnce() {
    Statistics<String> stats = new Statistics<>("x", "x", "y");

    assertThat(stats.numberOfMonitoredKeys()).isEqualTo(2);
  }

  @Test
  void testIterableConstructor_MonitorsEachElement() {
    Statistics<Integer> stats = new Statistics<>(List.of(1, 2, 3));

    assertThat(stats.monitoredKeys()).containsExactlyInAnyOrder(1, 2, 3);
  }

  @Test
  void testIteratorConstructor_DrainsIterator() {
    Statistics<Integer> stats = new Statistics<>(List.of(4, 5).iterator());

    assertThat(stats.monitoredKeys()).containsExactlyInAnyOrder(4, 5);
  }

  @Test
  void testStreamConstructor_MonitorsEachElement() {
    Statistics<String> stats = new Statistics<>(Stream.of("a", "b"));

    assertThat(stats.monitoredKeys()).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  void testIterableConstructor_EmptyRange() {
    Statistics<String> stats = new Statistics<>(Set.of());

    assertThat(stats.isMonitoringKeys()).isFalse();
  }

  // ========== Monitoring ==========

  @Test
  void testMonitor_AddsKeyWithZeroCounters() {
    Statistics<String> stats = new Statistics<>();

    stats.monitor("a");

    assertThat(stats.isMonitoring("a")).isTrue();
    assertThat(stats.accessesFor("a")).isZero();
    assertThat(stats.isMonitoringKeys()).isTrue();
  }

  @Test
  void testMonitor_AlreadyMonitored_KeepsCounters() {
    StatisticsMutator<String> mutator = StatisticsMutator.create("a");
    Statistics<String> stats = mutator.statistics();
    mutator.recordAccess("a", true);
    mutator.recordAccess("a", false);

    stats.monitor("a");
    stats.monitor("a");

    assertThat(stats.accessesFor("a")).isEqualTo(2);
    assertThat(stats.hitsFor("a")).isEqualTo(1);
    assertThat(stats.numberOfMonitoredKeys()).isEqualTo(1);
  }

  @Test
  void testMonitor_NullKey_Throws() {
    Statistics<String> stats = new Statistics<>();

    assertThatThrownBy(() -> stats.monitor(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("key");
  }

  @Test
  void testMonitorAll_IterableAndVarargs() {
    Statistics<String> stats = new Statistics<>();

    stats.monitorAll(List.of("a", "b"));
    stats.monitorAll("b", "c");

    assertThat(stats.monitoredKeys()).containsExactlyInAnyOrder("a", "b", "c");
  }

  @Test
  void testUnmonitor_RemovesKey() {
    Statistics<String> stats = new Statistics<>("a", "b");

    stats.unmonitor("a");

    assertThat(stats.isMonitoring("a")).isFalse();
    assertThat(stats.isMonitoring("b")).isTrue();
    assertThat(stats.numberOfMonitoredKeys()).isEqualTo(1);
  }

  @Test
  void testUnmonitor_AbsentKey_NoOp() {
    Statistics<String> stats = new Statistics<>("a");

    assertThatCode(() -> stats.unmonitor("never-monitored")).doesNotThrowAnyException();
    assertThat(stats.numberOfMonitoredKeys()).isEqualTo(1);
  }

  @Test
  void testUnmonitorThenMonitor_ResetsCounters() {
    StatisticsMutator<String> mutator = StatisticsMutator.create("a");
    Statistics<String> stats = mutator.statistics();
    mutator.recordAccess("a", true);
    mutator.recordAccess("a", true);

    stats.unmonitor("a");
    stats.monitor("a");

    assertThat(stats.hitsFor("a")).isZero();
    assertThat(stats.missesFor("a")).isZero();
    assertThat(stats.totalHits()).isEqualTo(2);
  }

  @Test
  void testUnmonitorAll_ClearsKeysKeepsTotals() {
    StatisticsMutator<String> mutator = StatisticsMutator.create("a", "b");
    Statistics<String> stats = mutator.statistics();
    mutator.recordAccess("a", true);
    mutator.recordAccess("b", false);

    stats.unmonitorAll();

    assertThat(stats.numberOfMonitoredKeys()).isZero();
    assertThat(stats.isMonitoringKeys()).isFalse();
    assertThat(stats.totalAccesses()).isEqualTo(2);
    assertThat(stats.totalHits()).isEqualTo(1);
    assertThatThrownBy(() -> stats.statsFor("a")).isInstanceOf(UnmonitoredKeyException.class);
    assertThatThrownBy(() -> stats.statsFor("b")).isInstanceOf(UnmonitoredKeyException.class);
  }

  @Test
  void testMonitoredKeys_IsUnmodifiableLiveView() {
    Statistics<String> stats = new Statistics<>("a");
    Set<String> keys = stats.monitoredKeys();

    stats.monitor("b");

    assertThat(keys).containsExactlyInAnyOrder("a", "b");
    assertThatThrownBy(() -> keys.remove("a")).isInstanceOf(UnsupportedOperationException.class);
  }

  // ========== Per-key queries ==========

  @Test
  void testStatsFor_NeverMonitored_Throws() {
    Statistics<String> stats = new Statistics<>();

    assertThatThrownBy(() -> stats.statsFor("missing"))
        .isInstanceOf(UnmonitoredKeyException.class)
        .isInstanceOf(LruStatsException.class)
        .hasMessageContaining("unmonitored key");
    assertThatThrownBy(() -> stats.get("missing")).isInstanceOf(UnmonitoredKeyException.class);
    assertThatThrownBy(() -> stats.hitsFor("missing")).isInstanceOf(UnmonitoredKeyException.class);
    assertThatThrownBy(() -> stats.missesFor("missing"))
        .isInstanceOf(UnmonitoredKeyException.class);
    assertThatThrownBy(() -> stats.accessesFor("missing"))
        .isInstanceOf(UnmonitoredKeyException.class);
  }

  @Test
  void testStatsFor_ExceptionCarriesKey() {
    Statistics<String> stats = new Statistics<>();

    UnmonitoredKeyException e =
        catchThrowableOfType(() -> stats.statsFor("secret"), UnmonitoredKeyException.class);

    assertThat(e.getKey()).isEqualTo("secret");
    assertThat(e.getMessage()).doesNotContain("secret");
  }

  @Test
  void testStatsFor_ReturnsLiveView() {
    StatisticsMutator<String> mutator = StatisticsMutator.create("a");
    KeyStatistics view = mutator.statistics().statsFor("a");

    mutator.recordAccess("a", true);
    mutator.recordAccess("a", false);

    assertThat(view.hits()).isEqualTo(1);
    assertThat(view.misses()).isEqualTo(1);
    assertThat(mutator.statistics().get("a")).isSameAs(view);
  }

  @Test
  void testStatsFor_DetachedAfterUnmonitor() {
    StatisticsMutator<String> mutator = StatisticsMutator.create("a");
    KeyStatistics view = mutator.statistics().statsFor("a");
    mutator.recordAccess("a", true);

    mutator.statistics().unmonitor("a");
    mutator.recordAccess("a", true);

    assertThat(view.hits()).isEqualTo(1);
  }

  // ========== Rates ==========

  @Test
  void testHitRate_NoAccesses_IsNaN() {
    Statistics<String> stats = new Statistics<>();

    assertThat(stats.hitRate()).isNaN();
    assertThat(stats.missRate()).isNaN();
  }

  @Test
  void testHitAndMissRate() {
    StatisticsMutator<String> mutator = StatisticsMutator.create();
    mutator.recordAccess("a", true);
    mutator.recordAccess("b", true);
    mutator.recordAccess("c", true);
    mutator.recordAccess("d", false);

    Statistics<String> stats = mutator.statistics();
    assertThat(stats.hitRate()).isEqualTo(0.75);
    assertThat(stats.missRate()).isEqualTo(0.25);
    assertThat(stats.totalMisses()).isEqualTo(1);
  }

  @Test
  void testToString() {
    Statistics<String> stats = new Statistics<>("a");

    assertThat(stats)
        .hasToString("Statistics{totalAccesses=0, totalHits=0, monitoredKeys=1}");
  }
}
