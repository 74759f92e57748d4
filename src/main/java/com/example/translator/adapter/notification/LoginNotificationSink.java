package com.example.translator.adapter.notification;

import com.example.translator.domain.entity.LoginEvent;

/**
 * Out-of-band receiver of login events.
 */
public interface LoginNotificationSink {

  /**
   * Whether the sink is configured well enough to attempt delivery.
   */
  boolean isAvailable();

  /**
   * Delivers the event. May block; callers run it off the request thread.
   */
  void send(LoginEvent event) throws Exception;
}
