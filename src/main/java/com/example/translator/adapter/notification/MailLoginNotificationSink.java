package com.example.translator.adapter.notification;

import com.example.translator.domain.entity.LoginEvent;
import com.example.translator.properties.ApplicationProperties;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

/**
 * Sends a plain-text e-mail per login. Available only when {@code app.notification.enabled},
 * a recipient, and a mail transport ({@code spring.mail.host}) are all configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailLoginNotificationSink implements LoginNotificationSink {

  private final ObjectProvider<JavaMailSender> mailSender;
  private final ApplicationProperties properties;

  @Override
  public boolean isAvailable() {
    ApplicationProperties.NotificationProperties notification = properties.notification();
    return notification.enabled()
        && notification.to() != null && !notification.to().isBlank()
        && hasTransport(mailSender.getIfAvailable());
  }

  @Override
  public void send(LoginEvent event) {
    JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null) {
      throw new IllegalStateException("Mail transport not configured");
    }
    sender.send(buildMessage(event));
    log.debug("Login notification sent for user {}", event.username());
  }

  // an empty spring.mail.host still creates a sender
  private static boolean hasTransport(JavaMailSender sender) {
    if (sender instanceof JavaMailSenderImpl) {
      String host = ((JavaMailSenderImpl) sender).getHost();
      return host != null && !host.isBlank();
    }
    return sender != null;
  }

  SimpleMailMessage buildMessage(LoginEvent event) {
    ApplicationProperties.NotificationProperties notification = properties.notification();
    String when = DateTimeFormatter.ISO_INSTANT.format(event.occurredAt());

    SimpleMailMessage message = new SimpleMailMessage();
    message.setTo(notification.to());
    message.setFrom(notification.from());
    message.setSubject("Login: %s (%s) %s".formatted(event.username(), notification.source(), when));
    message.setText(String.join("\n",
        "Login detected",
        "",
        "Username: " + event.username(),
        "Source: " + notification.source(),
        "Host: " + event.host(),
        "Time: " + when,
        "IP: " + event.clientIp(),
        "User-Agent: " + event.userAgent()));
    return message;
  }
}
