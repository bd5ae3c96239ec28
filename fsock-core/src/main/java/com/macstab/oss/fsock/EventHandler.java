/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock;

/**
 * Callback receiving event bodies.
 *
 * <p>Invoked on a dispatch executor thread, never on the socket reader thread. Invocations for
 * consecutive events may run concurrently and in any order. Exceptions are logged and otherwise
 * ignored.
 *
 * @see EventDispatcher
 * @see com.macstab.oss.fsock.text.EventSocketText#eventToMap(String, java.util.Collection)
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles one event.
   *
   * @param event raw {@code text/event-plain} body (header lines with url-encoded values)
   */
  void onEvent(String event);
}
