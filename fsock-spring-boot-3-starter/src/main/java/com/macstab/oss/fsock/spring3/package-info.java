/* (C)2026 Macstab GmbH */
/**
 * Spring Boot 3 auto-configuration for the event socket connection pool.
 *
 * <p>Set {@code fsock.enabled=true} and the switch address under {@code fsock.*}; declare {@link
 * com.macstab.oss.fsock.spring3.EventSubscription} beans for the events to receive, then inject
 * {@link com.macstab.oss.fsock.EventSocketPool}:
 *
 * <pre>{@code
 * final var connection = pool.acquire();
 * try {
 *   final var status = connection.sendApiCommand("status");
 * } finally {
 *   pool.release(connection);
 * }
 * }</pre>
 */
package com.macstab.oss.fsock.spring3;
