package uk.curriculum.triplestore.validation;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import uk.curriculum.triplestore.source.SourceParseException;

import java.util.List;

import static java.util.Optional.ofNullable;

@Data
@Builder(toBuilder = true)
public class ValidationResult {
  private final boolean conforms;
  private final int files;
  private final long triples;
  @Singular
  private final List<SourceParseException> syntaxErrors;
  @Singular
  private final List<Violation> violations;

  public boolean hasSyntaxErrors() {
    return !syntaxErrors.isEmpty();
  }

  /**
   * Renders the result as a plain text report.
   */
  public String toHumanReadable() {
    StringBuilder sb = new StringBuilder();
    if (hasSyntaxErrors()) {
      sb.append("Syntax errors (").append(syntaxErrors.size()).append("):\n");
      syntaxErrors.forEach(e -> sb.append("\t").append(e.getMessage()).append('\n'));
      return sb.toString();
    }
    sb.append("Validation Report\n")
      .append("Conforms: ").append(conforms ? "True" : "False").append('\n');
    if (!violations.isEmpty()) {
      sb.append("Results (").append(violations.size()).append("):\n");
    }
    for (Violation v : violations) {
      sb.append("Constraint Violation in ").append(v.component()).append(":\n")
        .append("\tSeverity: ").append(v.severity()).append('\n')
        .append("\tFocus Node: ").append(v.focusNode()).append('\n');
      ofNullable(v.path()).ifPresent(p -> sb.append("\tResult Path: ").append(p).append('\n'));
      ofNullable(v.value()).ifPresent(val -> sb.append("\tValue Node: ").append(val).append('\n'));
      ofNullable(v.message()).ifPresent(m -> sb.append("\tMessage: ").append(m).append('\n'));
    }
    return sb.toString();
  }
}
