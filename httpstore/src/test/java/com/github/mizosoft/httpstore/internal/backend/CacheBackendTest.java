/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.httpstore.internal.backend;

import static com.github.mizosoft.httpstore.testing.TestUtils.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.backend.CacheBackend.Capability;
import com.github.mizosoft.httpstore.testing.MockClock;
import com.github.mizosoft.httpstore.testing.TestUtils;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behaviour shared by all {@link CacheBackend} implementations. */
abstract class CacheBackendTest {
  final MockClock clock = new MockClock();
  CacheBackend backend;

  abstract CacheBackend createBackend(MockClock clock) throws IOException;

  @BeforeEach
  void setUp() throws IOException {
    backend = createBackend(clock);
  }

  @AfterEach
  void tearDown() throws IOException {
    backend.close();
  }

  Optional<String> getString(String key) throws IOException {
    return backend.get(key).map(TestUtils::toUtf8String);
  }

  @Test
  void absentKey() throws IOException {
    assertThat(backend.get("absent")).isEmpty();
  }

  @Test
  void deferredValueIsVisibleBeforeCommit() throws IOException {
    assertThat(backend.saveDeferred("k", utf8("Pikachu"))).isTrue();
    assertThat(getString("k")).hasValue("Pikachu");

    assertThat(backend.commit()).isTrue();
    assertThat(getString("k")).hasValue("Pikachu");
  }

  @Test
  void overwriteValue() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"));
    backend.commit();
    backend.saveDeferred("k", utf8("Eevee"));
    backend.commit();
    assertThat(getString("k")).hasValue("Eevee");
  }

  @Test
  void emptyValue() throws IOException {
    backend.saveDeferred("k", utf8(""));
    backend.commit();
    assertThat(getString("k")).hasValue("");
  }

  @Test
  void valueExpiresAfterTtl() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"), Duration.ofSeconds(10), Set.of());
    backend.commit();

    clock.advanceSeconds(9);
    assertThat(getString("k")).hasValue("Pikachu");

    clock.advanceSeconds(1);
    assertThat(backend.get("k")).isEmpty();
  }

  @Test
  void zeroTtlIsImmediatelyExpired() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"), Duration.ZERO, Set.of());
    assertThat(backend.get("k")).isEmpty();
    backend.commit();
    assertThat(backend.get("k")).isEmpty();
  }

  @Test
  void nullTtlNeverExpires() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"), null, Set.of());
    backend.commit();
    clock.advance(Duration.ofDays(1000));
    assertThat(getString("k")).hasValue("Pikachu");
  }

  @Test
  void negativeTtl() {
    assertThatIllegalArgumentException()
        .isThrownBy(
            () -> backend.saveDeferred("k", utf8("Pikachu"), Duration.ofSeconds(-1), Set.of()));
  }

  @Test
  void deleteCommittedValue() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"));
    backend.commit();
    assertThat(backend.delete("k")).isTrue();
    assertThat(backend.get("k")).isEmpty();
    assertThat(backend.delete("k")).isFalse();
  }

  @Test
  void deleteDeferredValue() throws IOException {
    backend.saveDeferred("k", utf8("Pikachu"));
    assertThat(backend.delete("k")).isTrue();
    backend.commit();
    assertThat(backend.get("k")).isEmpty();
  }

  @Test
  void pruneRemovesExpiredValues() throws IOException {
    assumeTrue(backend.capabilities().contains(Capability.PRUNE));

    backend.saveDeferred("expiring", utf8("Pikachu"), Duration.ofSeconds(1), Set.of());
    backend.saveDeferred("lasting", utf8("Eevee"), Duration.ofDays(1), Set.of());
    backend.commit();
    clock.advanceSeconds(2);
    backend.prune();

    assertThat(backend.get("expiring")).isEmpty();
    assertThat(getString("lasting")).hasValue("Eevee");
  }

  @Test
  void clearRemovesAllValues() throws IOException {
    assumeTrue(backend.capabilities().contains(Capability.CLEAR));

    backend.saveDeferred("k1", utf8("Pikachu"));
    backend.saveDeferred("k2", utf8("Eevee"));
    backend.commit();
    backend.saveDeferred("k3", utf8("Ditto"));
    backend.clear();

    assertThat(backend.get("k1")).isEmpty();
    assertThat(backend.get("k2")).isEmpty();
    assertThat(backend.get("k3")).isEmpty();
  }

  @Test
  void invalidateTags() throws IOException {
    assumeTrue(backend.capabilities().contains(Capability.TAGS));

    backend.saveDeferred("k1", utf8("Pikachu"), null, Set.of("electric"));
    backend.saveDeferred("k2", utf8("Eevee"), null, Set.of("normal"));
    backend.saveDeferred("k3", utf8("Jolteon"), null, Set.of("electric", "normal"));
    backend.saveDeferred("k4", utf8("Ditto"));
    backend.commit();

    assertThat(backend.invalidateTags(Set.of("electric"))).isTrue();
    assertThat(backend.get("k1")).isEmpty();
    assertThat(getString("k2")).hasValue("Eevee");
    assertThat(backend.get("k3")).isEmpty();
    assertThat(getString("k4")).hasValue("Ditto");
  }

  @Test
  void valueSavedAfterInvalidationIsVisible() throws IOException {
    assumeTrue(backend.capabilities().contains(Capability.TAGS));

    backend.saveDeferred("k", utf8("Pikachu"), null, Set.of("electric"));
    backend.commit();
    backend.invalidateTags(Set.of("electric"));
    backend.saveDeferred("k", utf8("Raichu"), null, Set.of("electric"));
    backend.commit();
    assertThat(getString("k")).hasValue("Raichu");
  }

  @Test
  void invalidatingUnknownTags() throws IOException {
    assumeTrue(backend.capabilities().contains(Capability.TAGS));

    backend.saveDeferred("k", utf8("Pikachu"), null, Set.of("electric"));
    backend.commit();
    assertThat(backend.invalidateTags(Set.of("fire"))).isTrue();
    assertThat(getString("k")).hasValue("Pikachu");
  }

  @Test
  void illegalTags() {
    assumeTrue(backend.capabilities().contains(Capability.TAGS));

    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.saveDeferred("k", utf8("Pikachu"), null, Set.of("a:b")));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.saveDeferred("k", utf8("Pikachu"), null, Set.of("")));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.invalidateTags(Set.of("{electric}")));
  }

  @Test
  void closedBackend() throws IOException {
    backend.close();
    assertThatIllegalStateException().isThrownBy(() -> backend.get("k"));
  }
}
