package com.example.translator.adapter.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.translator.TestProperties;
import com.example.translator.domain.entity.LoginEvent;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

class MailLoginNotificationSinkTest {

  private static final LoginEvent EVENT = new LoginEvent(
      "mara", "10.1.2.3", "Mozilla/5.0", "translator.local", Instant.parse("2026-03-01T10:15:30Z"));

  private final JavaMailSender mailSender = mock(JavaMailSender.class);

  @Test
  void availableOnlyWhenEnabledWithRecipientAndTransport() {
    assertThat(sink(true, "ops@example.com", mailSender).isAvailable()).isTrue();
    assertThat(sink(false, "ops@example.com", mailSender).isAvailable()).isFalse();
    assertThat(sink(true, " ", mailSender).isAvailable()).isFalse();
    assertThat(sink(true, "ops@example.com", null).isAvailable()).isFalse();
    assertThat(sink(true, "ops@example.com", new JavaMailSenderImpl()).isAvailable()).isFalse();
  }

  @Test
  void messageCarriesLoginDetails() {
    SimpleMailMessage message = sink(true, "ops@example.com", mailSender).buildMessage(EVENT);

    assertThat(message.getTo()).containsExactly("ops@example.com");
    assertThat(message.getFrom()).isEqualTo("no-reply@localhost");
    assertThat(message.getSubject()).isEqualTo("Login: mara (test) 2026-03-01T10:15:30Z");
    assertThat(message.getText())
        .contains("Username: mara")
        .contains("Host: translator.local")
        .contains("IP: 10.1.2.3")
        .contains("User-Agent: Mozilla/5.0");
  }

  @Test
  void sendDelegatesToTransport() {
    sink(true, "ops@example.com", mailSender).send(EVENT);

    verify(mailSender).send(any(SimpleMailMessage.class));
  }

  @Test
  void sendWithoutTransportFails() {
    assertThatThrownBy(() -> sink(true, "ops@example.com", null).send(EVENT))
        .isInstanceOf(IllegalStateException.class);
  }

  @SuppressWarnings("unchecked")
  private MailLoginNotificationSink sink(boolean enabled, String to, JavaMailSender sender) {
    ObjectProvider<JavaMailSender> provider = mock(ObjectProvider.class);
    when(provider.getIfAvailable()).thenReturn(sender);
    return new MailLoginNotificationSink(provider, TestProperties.builder().notification(enabled, to).build());
  }
}
