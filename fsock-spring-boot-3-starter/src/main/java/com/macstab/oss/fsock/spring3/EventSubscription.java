/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.spring3;

import com.macstab.oss.fsock.EventHandler;
import com.macstab.oss.fsock.frame.EslHeaders;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Binds an {@link EventHandler} to an event name. Declare as a bean to have the pool's
 * connections subscribe to the event.
 *
 * <pre>{@code
 * @Bean
 * EventSubscription hangups(CallRecorder recorder) {
 *   return EventSubscription.of("CHANNEL_HANGUP", recorder::onHangup);
 * }
 * }</pre>
 *
 * <p>Several subscriptions may share an event name; all their handlers run for each matching
 * event, in bean order.
 */
@Getter
@ToString
@RequiredArgsConstructor(staticName = "of")
public final class EventSubscription {

  /** Event name, or {@code ALL} for every event without a dedicated subscription. */
  @NonNull private final String eventName;

  @ToString.Exclude @NonNull private final EventHandler handler;

  /**
   * Subscription receiving every event that has no dedicated subscription.
   *
   * @param handler handler
   * @return subscription for {@code ALL}
   */
  public static EventSubscription all(final EventHandler handler) {
    return of(EslHeaders.ALL_EVENTS, handler);
  }
}
