/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

import com.macstab.oss.fsock.error.EventSocketException;

/** Creates connected connections for {@link EventSocketPool}. Replaced in tests. */
@FunctionalInterface
interface ConnectionFactory {

  ConnectionFactory DEFAULT = EventSocketConnection::open;

  EventSocketConnection create(EventSocketConfig config)
      throws EventSocketException, InterruptedException;
}
