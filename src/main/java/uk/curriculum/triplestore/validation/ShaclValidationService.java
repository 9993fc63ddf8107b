package uk.curriculum.triplestore.validation;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.jena.graph.Node;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.shacl.ShaclValidator;
import org.apache.jena.shacl.Shapes;
import org.apache.jena.shacl.ValidationReport;
import org.apache.jena.shacl.validation.ReportEntry;
import org.apache.jena.shared.PrefixMapping;
import org.apache.jena.sparql.util.FmtUtils;
import org.springframework.stereotype.Service;
import uk.curriculum.triplestore.source.MergedSources;
import uk.curriculum.triplestore.source.SourceDiscovery;
import uk.curriculum.triplestore.source.SourceMerger;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.util.Optional.ofNullable;

/**
 * Syntax check, merge and SHACL validation of the curriculum sources. The data graph is the merged
 * sources plus the ontology, optionally closed under RDFS entailment so that shapes targeting a
 * superclass also see instances typed with a subclass.
 */
@Service
@Slf4j
public class ShaclValidationService {
  private final SourceDiscovery discovery;
  private final SourceMerger merger;
  private final ValidationProperties properties;

  public ShaclValidationService(SourceDiscovery discovery, SourceMerger merger, ValidationProperties properties) {
    this.discovery = discovery;
    this.merger = merger;
    this.properties = properties;
  }

  public ValidationResult validate() {
    return validate(discovery.discover());
  }

  public ValidationResult validate(List<Path> files) {
    log.info("step 1: merge turtle files");
    MergedSources sources = merger.merge(files);
    if (sources.hasFailures()) {
      log.error("syntax errors found, fix these before SHACL validation");
      return ValidationResult.builder()
                             .conforms(false)
                             .files(files.size())
                             .triples(sources.model().size())
                             .syntaxErrors(sources.failures())
                             .build();
    }
    merger.checkImports(sources.model());
    merger.writeCombined(sources.model());

    log.info("step 2: run SHACL validation");
    Model shapesModel = merger.parse(requireFile(properties.getShapes(), "shapes"));
    Model ontology = merger.parse(requireFile(properties.getOntology(), "ontology"));
    Model data = dataGraph(sources.model(), ontology);

    ValidationReport report = ShaclValidator.get().validate(Shapes.parse(shapesModel.getGraph()), data.getGraph());
    writeReport(report);

    PrefixMapping prefixes = sources.model();
    List<Violation> violations = report.getEntries()
                                       .stream()
                                       .map(entry -> toViolation(entry, prefixes))
                                       .limit(properties.isAbortOnFirst() ? 1 : Long.MAX_VALUE)
                                       .toList();

    return ValidationResult.builder()
                           .conforms(report.conforms())
                           .files(files.size())
                           .triples(sources.model().size())
                           .violations(violations)
                           .build();
  }

  Model dataGraph(Model merged, Model ontology) {
    Model data = ModelFactory.createUnion(merged, ontology);
    return switch (properties.getInference()) {
      case RDFS -> ModelFactory.createRDFSModel(data);
      case NONE -> data;
    };
  }

  private Path requireFile(String location, String kind) {
    Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new IllegalStateException("%s file not found: %s".formatted(kind, path));
    }
    return path;
  }

  @SneakyThrows
  private void writeReport(ValidationReport report) {
    if (StringUtils.isBlank(properties.getReportFile())) {
      return;
    }
    Path target = Path.of(properties.getReportFile());
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target)) {
      RDFDataMgr.write(out, report.getModel(), Lang.TURTLE);
    }
    log.info("validation report written to {}", target);
  }

  private static Violation toViolation(ReportEntry entry, PrefixMapping prefixes) {
    return new Violation(format(entry.focusNode(), prefixes),
                         ofNullable(entry.resultPath()).map(Object::toString).orElse(null),
                         format(entry.value(), prefixes),
                         format(entry.severity().level(), prefixes),
                         entry.message(),
                         ofNullable(entry.sourceConstraintComponent()).map(Node::getLocalName).orElse("Constraint"));
  }

  private static String format(Node node, PrefixMapping prefixes) {
    return node == null ? null : FmtUtils.stringForNode(node, prefixes);
  }
}
