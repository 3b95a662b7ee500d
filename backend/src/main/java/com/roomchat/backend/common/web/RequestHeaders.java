package com.roomchat.backend.common.web;

public final class RequestHeaders {

  /** Authenticated user id, set by the gateway in front of this service. */
  public static final String USER_ID = "X-User-Id";

  private RequestHeaders() {}
}
