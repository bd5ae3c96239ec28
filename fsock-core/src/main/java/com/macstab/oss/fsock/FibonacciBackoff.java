/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import java.time.Duration;

import lombok.Getter;
import lombok.NonNull;

/**
 * Fibonacci delay sequence: 1, 1, 2, 3, 5, 8, ... times a base unit.
 *
 * <p>Stateful and not thread-safe. {@link EventSocketConnection#connect()} creates a fresh
 * instance per call so every connect starts again at one unit.
 *
 * <p>Multipliers saturate at {@link Long#MAX_VALUE} instead of overflowing.
 */
public final class FibonacciBackoff {

  @Getter private final Duration unit;
  private long previous;
  private long current;

  public FibonacciBackoff(@NonNull final Duration unit) {
    if (unit.isNegative()) {
      throw new IllegalArgumentException("unit must not be negative, got: " + unit);
    }
    this.unit = unit;
    this.previous = 0;
    this.current = 1;
  }

  /** Next multiplier of the sequence (1, 1, 2, 3, 5, ...). */
  public long nextMultiplier() {
    final var result = current;
    final var next = previous > Long.MAX_VALUE - current ? Long.MAX_VALUE : previous + current;
    previous = current;
    current = next;
    return result;
  }

  /** Next delay: {@code unit * nextMultiplier()}, saturating at the largest duration. */
  public Duration nextDelay() {
    final var multiplier = nextMultiplier();
    try {
      return unit.multipliedBy(multiplier);
    } catch (final ArithmeticException e) {
      return Duration.ofMillis(Long.MAX_VALUE);
    }
  }
}
