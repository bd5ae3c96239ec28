/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import java.time.Duration;

/** Blocking pause between dial attempts. Replaced in tests to record delays instead of waiting. */
@FunctionalInterface
interface Sleeper {

  Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
