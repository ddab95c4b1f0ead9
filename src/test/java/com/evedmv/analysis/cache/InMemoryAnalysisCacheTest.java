package com.evedmv.analysis.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class InMemoryAnalysisCacheTest {

  private final InMemoryAnalysisCache cache = new InMemoryAnalysisCache(100);

  @Test
  void get_shouldReturnStoredValue() {
    cache.put("analysis", "char:1", 0.87, Duration.ofMinutes(5));

    assertThat(cache.get("analysis", "char:1")).contains(0.87);
  }

  @Test
  void get_shouldKeepNamespacesApart() {
    cache.put("analysis", "char:1", "threat", Duration.ofMinutes(5));

    assertThat(cache.get("fleet", "char:1")).isEmpty();
  }

  @Test
  void get_shouldMissAfterTtlExpires() throws InterruptedException {
    cache.put("analysis", "char:2", "stale", Duration.ofMillis(20));

    Thread.sleep(100);

    assertThat(cache.get("analysis", "char:2")).isEmpty();
  }

  @Test
  void put_shouldReplaceValueAndTtl() throws InterruptedException {
    cache.put("analysis", "corp:9", "old", Duration.ofMinutes(5));
    cache.put("analysis", "corp:9", "new", Duration.ofMillis(20));

    assertThat(cache.get("analysis", "corp:9")).contains("new");

    Thread.sleep(100);

    assertThat(cache.get("analysis", "corp:9")).isEmpty();
  }

  @Test
  void put_shouldRejectNullValue() {
    assertThatThrownBy(() -> cache.put("analysis", "k", null, Duration.ofMinutes(1)))
        .isInstanceOf(NullPointerException.class);
  }
}
