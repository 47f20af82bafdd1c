package io.localaid.backend.job.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobHandlerRegistryTest {

  @Test
  void finds_exact_type_ignoring_case() {
    var reminder = new RecordingHandler("reminder", null);
    var registry = new JobHandlerRegistry(List.of(reminder));

    assertThat(registry.find("Reminder")).containsSame(reminder);
    assertThat(registry.find(" REMINDER ")).containsSame(reminder);
  }

  @Test
  void family_handler_serves_prefixed_types() {
    var imports = new RecordingHandler("import", "import:");
    var registry = new JobHandlerRegistry(List.of(imports));

    assertThat(registry.find("import:volunteers_csv")).containsSame(imports);
    assertThat(registry.find("export:csv")).isEmpty();
  }

  @Test
  void exact_match_wins_over_family() {
    var family = new RecordingHandler("import", "import:");
    var special = new RecordingHandler("import:legacy", null);
    var registry = new JobHandlerRegistry(List.of(family, special));

    assertThat(registry.find("import:legacy")).containsSame(special);
    assertThat(registry.find("import:other")).containsSame(family);
  }

  @Test
  void blank_or_null_type_has_no_handler() {
    var registry = new JobHandlerRegistry(List.of(new RecordingHandler("reminder", null)));

    assertThat(registry.find(null)).isEmpty();
    assertThat(registry.find("  ")).isEmpty();
  }

  @Test
  void duplicate_exact_type_is_rejected_at_startup() {
    var first = new RecordingHandler("reminder", null);
    var second = new RecordingHandler("REMINDER", null);

    assertThatThrownBy(() -> new JobHandlerRegistry(List.of(first, second)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate job handler for type 'reminder'");
  }

  @Test
  void execute_passes_normalized_type_and_parsed_payload() {
    var imports = new RecordingHandler("import", "import:");
    var registry = new JobHandlerRegistry(List.of(imports));

    registry.execute(imports, "Import:CSV", Map.of("file", "volunteers.csv"));

    assertThat(imports.handled).hasSize(1);
    assertThat(imports.handled.get(0).type()).isEqualTo("import:csv");
    assertThat(imports.handled.get(0).values()).containsEntry("file", "volunteers.csv");
  }

  @Test
  void execute_treats_missing_payload_as_empty() {
    var imports = new RecordingHandler("import", "import:");
    var registry = new JobHandlerRegistry(List.of(imports));

    registry.execute(imports, "import:csv", null);

    assertThat(imports.handled.get(0).values()).isEmpty();
  }

  private static final class RecordingHandler implements JobHandler<GenericPayload> {

    private final String type;
    private final String prefix;
    private final List<GenericPayload> handled = new ArrayList<>();

    RecordingHandler(String type, String prefix) {
      this.type = type;
      this.prefix = prefix;
    }

    @Override
    public String type() {
      return type;
    }

    @Override
    public boolean supports(String candidate) {
      return prefix != null && candidate.startsWith(prefix);
    }

    @Override
    public GenericPayload parsePayload(String type, Map<String, Object> raw) {
      return new GenericPayload(type, raw);
    }

    @Override
    public void handle(GenericPayload payload) {
      handled.add(payload);
    }
  }
}
