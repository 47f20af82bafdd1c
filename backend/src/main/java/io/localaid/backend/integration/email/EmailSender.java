package io.localaid.backend.integration.email;

import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Mail collaborator used by background delivery: renders a named template with the given data and
 * hands the result to the active {@link EmailProvider}.
 */
@Service
public class EmailSender {

  private static final Logger log = LoggerFactory.getLogger(EmailSender.class);

  private final EmailTemplateRenderer templateRenderer;
  private final EmailProvider emailProvider;

  public EmailSender(EmailTemplateRenderer templateRenderer, EmailProvider emailProvider) {
    this.templateRenderer = templateRenderer;
    this.emailProvider = emailProvider;
  }

  /**
   * Renders {@code template} with {@code data} and sends it to {@code to}. Rendering or provider
   * exceptions propagate; an unsuccessful provider hand-off is returned as a failed result.
   */
  public SendResult send(String to, String template, Map<String, Object> data) {
    var rendered = templateRenderer.render(template, data);
    var metadata = new HashMap<String, String>();
    metadata.put("template", template);
    var message =
        new EmailMessage(
            to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody(), null, metadata);
    var result = emailProvider.sendEmail(message);
    log.debug(
        "Email '{}' to {} via provider={}, success={}",
        template,
        to,
        emailProvider.providerId(),
        result.success());
    return result;
  }
}
