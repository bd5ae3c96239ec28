/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.fsock.frame;

import lombok.experimental.UtilityClass;

/**
 * Header names, content types and reply markers of the event socket protocol.
 *
 * <pre>
 * Content-Type: command/reply
 * Reply-Text: +OK accepted
 *
 * Content-Type: api/response
 * Content-Length: 12
 *
 * +OK 1234567
 * </pre>
 */
@UtilityClass
public class EslHeaders {

  public static final String CONTENT_TYPE = "Content-Type";
  public static final String CONTENT_LENGTH = "Content-Length";
  public static final String REPLY_TEXT = "Reply-Text";
  public static final String EVENT_NAME = "Event-Name";

  /** Unsolicited challenge sent by the switch right after the TCP accept. */
  public static final String AUTH_REQUEST = "auth/request";

  /** Reply to {@code api} commands, result in the body. */
  public static final String API_RESPONSE = "api/response";

  /** Reply to every other command, result in {@code Reply-Text}. */
  public static final String COMMAND_REPLY = "command/reply";

  public static final String EVENT_PLAIN = "text/event-plain";
  public static final String DISCONNECT_NOTICE = "text/disconnect-notice";

  public static final String OK = "+OK";
  public static final String AUTH_ACCEPTED = "+OK accepted";
  public static final String ERR = "-ERR";

  /** Subscription key matching every event (handlers and {@code event plain all}). */
  public static final String ALL_EVENTS = "ALL";
}
