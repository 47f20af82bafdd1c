package io.localaid.backend.integration.email;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class NoOpEmailProviderTest {

  private final NoOpEmailProvider provider = new NoOpEmailProvider();

  @Test
  void sendEmail_returns_success_with_noop_id() {
    var message =
        new EmailMessage(
            "volunteer@example.org", "You were invited", "<p>Hi</p>", "Hi", null, Map.of());

    var result = provider.sendEmail(message);

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).startsWith("NOOP-");
    assertThat(result.errorMessage()).isNull();
    assertThat(provider.providerId()).isEqualTo("noop");
  }
}
