/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.error;

import lombok.Getter;

/**
 * Switch replied to an API or generic command with {@code -ERR}.
 *
 * <p>Does not affect connection health: the connection stays usable and no reconnect happens.
 */
public class CommandFailedException extends EventSocketException {

  private static final long serialVersionUID = 1L;

  /** Command as sent (without trailing blank line). */
  @Getter private final String command;

  /** Raw reply (API body or {@code Reply-Text} value). */
  @Getter private final String reply;

  public CommandFailedException(final String command, final String reply) {
    super("Command <" + command + "> failed: " + reply);
    this.command = command;
    this.reply = reply;
  }
}
