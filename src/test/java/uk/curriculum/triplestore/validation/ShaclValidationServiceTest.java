package uk.curriculum.triplestore.validation;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.shacl.ShaclValidator;
import org.apache.jena.shacl.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.curriculum.triplestore.source.SourceDiscovery;
import uk.curriculum.triplestore.source.SourceMerger;
import uk.curriculum.triplestore.source.SourceProperties;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShaclValidationServiceTest {
  private static final Path FIXTURES = Path.of("src/test/resources/fixtures");

  @TempDir
  Path tmp;

  private ValidationProperties properties;
  private ShaclValidationService service;

  @BeforeEach
  void setUp() {
    SourceProperties sourceProperties = new SourceProperties();
    sourceProperties.setCombinedOutput(tmp.resolve("combined-data.ttl").toString());
    properties = new ValidationProperties();
    properties.setAbortOnFirst(false);
    service = new ShaclValidationService(new SourceDiscovery(sourceProperties), new SourceMerger(sourceProperties), properties);
  }

  @Test
  void repositoryDataConforms() {
    ValidationResult result = service.validate();

    assertThat(result.isConforms())
            .withFailMessage("SHACL validation failed:\n%s", result.toHumanReadable())
            .isTrue();
    assertThat(result.getTriples()).isPositive();
    assertThat(result.toHumanReadable()).contains("Conforms: True");
    assertThat(tmp.resolve("combined-data.ttl")).exists();
  }

  @Test
  void validFixtureConforms() {
    ValidationResult result = service.validate(List.of(FIXTURES.resolve("valid/key-stage.ttl")));

    assertThat(result.isConforms()).isTrue();
    assertThat(result.getViolations()).isEmpty();
    assertThat(result.getFiles()).isEqualTo(1);
  }

  @Test
  void reportsEveryViolation() {
    ValidationResult result = service.validate(List.of(FIXTURES.resolve("invalid/key-stage-without-phase.ttl")));

    assertThat(result.isConforms()).isFalse();
    assertThat(result.getViolations()).hasSize(2);
    assertThat(result.getViolations()).allMatch(v -> v.focusNode().contains("key-stage-1"));
    assertThat(result.getViolations()).extracting(Violation::component).contains("MinCountConstraintComponent");
    assertThat(result.toHumanReadable())
            .contains("Conforms: False")
            .contains("Results (2):")
            .contains("Constraint Violation in MinCountConstraintComponent");
  }

  @Test
  void abortOnFirstKeepsOneViolation() {
    properties.setAbortOnFirst(true);

    ValidationResult result = service.validate(List.of(FIXTURES.resolve("invalid/key-stage-without-phase.ttl")));

    assertThat(result.isConforms()).isFalse();
    assertThat(result.getViolations()).hasSize(1);
  }

  @Test
  void checksClassConstraintsAcrossTheTaxonomy() {
    ValidationResult result = service.validate(List.of(FIXTURES.resolve("invalid/strand-under-substrand.ttl")));

    assertThat(result.isConforms()).isFalse();
    assertThat(result.getViolations()).extracting(Violation::component).contains("ClassConstraintComponent");
  }

  @Test
  void syntaxErrorsStopBeforeShacl() {
    ValidationResult result = service.validate(List.of(FIXTURES.resolve("valid/key-stage.ttl"),
                                                       FIXTURES.resolve("syntax/broken.ttl")));

    assertThat(result.isConforms()).isFalse();
    assertThat(result.hasSyntaxErrors()).isTrue();
    assertThat(result.getViolations()).isEmpty();
    assertThat(result.toHumanReadable()).startsWith("Syntax errors (1):").contains("broken.ttl");
    assertThat(tmp.resolve("combined-data.ttl")).doesNotExist();
  }

  @Test
  void missingShapesFileIsAnError() {
    properties.setShapes(tmp.resolve("missing-shapes.ttl").toString());

    assertThatThrownBy(() -> service.validate(List.of(FIXTURES.resolve("valid/key-stage.ttl"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shapes file not found");
  }

  @Test
  void writesTheReportWhenAsked() {
    Path reportFile = tmp.resolve("reports/validation-report.ttl");
    properties.setReportFile(reportFile.toString());

    service.validate(List.of(FIXTURES.resolve("invalid/key-stage-without-phase.ttl")));

    assertThat(reportFile).exists();
    Model report = RDFDataMgr.loadModel(reportFile.toString());
    assertThat(report.isEmpty()).isFalse();
  }

  @Test
  void shapesFileIsWellFormedShacl() {
    Model shapes = RDFDataMgr.loadModel(properties.getShapes());
    Model data = RDFDataMgr.loadModel(FIXTURES.resolve("valid/key-stage.ttl").toString());

    ValidationReport report = ShaclValidator.get().validate(shapes.getGraph(), data.getGraph());

    assertThat(report.conforms()).isTrue();
  }
}
