package com.example.translator.service;

import com.example.translator.adapter.notification.LoginNotificationSink;
import com.example.translator.domain.entity.LoginEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget dispatch of login notifications. Failures are logged here and never reach
 * the login flow.
 */
@Slf4j
@Service
public class LoginNotificationService {

  private final LoginNotificationSink sink;
  private final TaskExecutor executor;

  public LoginNotificationService(
      LoginNotificationSink sink,
      @Qualifier("notificationTaskExecutor") TaskExecutor executor) {
    this.sink = sink;
    this.executor = executor;
  }

  /**
   * @return whether a notification was queued
   */
  public boolean dispatch(LoginEvent event) {
    try {
      if (!sink.isAvailable()) {
        log.debug("Login notification sink not configured, skipping");
        return false;
      }
      executor.execute(() -> deliver(event));
      return true;
    } catch (Exception e) {
      log.warn("Could not queue login notification for user {}", event.username(), e);
      return false;
    }
  }

  private void deliver(LoginEvent event) {
    try {
      sink.send(event);
    } catch (Exception e) {
      log.warn("Login notification for user {} failed", event.username(), e);
    }
  }
}
