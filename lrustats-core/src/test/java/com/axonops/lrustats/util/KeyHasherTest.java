package com.axonops.lrustats.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for key hashing used in logs and exception messages. */
class KeyHasherTest {

  @Test
  void testHash_Deterministic() {
    assertThat(KeyHasher.hash("user:42")).isEqualTo(KeyHasher.hash("user:42"));
    assertThat(KeyHasher.hash("user:42")).isEqualTo(Integer.toHexString("user:42".hashCode()));
  }

  @Test
  void testHash_DoesNotLeakKey() {
    assertThat(KeyHasher.hash("user@example.com")).doesNotContain("user");
  }

  @Test
  void testHash_Null() {
    assertThat(KeyHasher.hash(null)).isEqualTo("null");
    assertThat(KeyHasher.hashWithType(null)).isEqualTo("null");
  }

  @Test
  void testHashWithType() {
    assertThat(KeyHasher.hashWithType(7)).isEqualTo("Integer#7");
  }
}
