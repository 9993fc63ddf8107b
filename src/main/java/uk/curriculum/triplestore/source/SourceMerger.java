package uk.curriculum.triplestore.source;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.vocabulary.OWL;
import org.springframework.stereotype.Component;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@Component
@Slf4j
public class SourceMerger {
  private static final String W3C_PREFIX = "http://www.w3.org/";

  private final SourceProperties properties;

  public SourceMerger(SourceProperties properties) {
    this.properties = properties;
  }

  public Model parse(Path file) {
    Model model = ModelFactory.createDefaultModel();
    try {
      RDFParser.source(file).lang(Lang.TURTLE).parse(model);
      return model;
    }
    catch (RiotException exc) {
      throw new SourceParseException(file, exc);
    }
  }

  /**
   * Parses every file and unions the ones that parse. Failures are collected rather than thrown,
   * so one run reports every broken file.
   */
  public MergedSources merge(List<Path> files) {
    Model merged = ModelFactory.createDefaultModel();
    List<SourceParseException> failures = new ArrayList<>();
    for (Path file : files) {
      log.info("parsing: {}", file);
      try {
        Model model = parse(file);
        merged.add(model);
        model.getNsPrefixMap().forEach((prefix, uri) -> {
          if (merged.getNsPrefixURI(prefix) == null) {
            merged.setNsPrefix(prefix, uri);
          }
        });
      }
      catch (SourceParseException exc) {
        log.error("error parsing {}", exc.getMessage());
        failures.add(exc);
      }
    }
    log.info("merged {} of {} files, {} triples", files.size() - failures.size(), files.size(), merged.size());
    return new MergedSources(merged, List.copyOf(files), List.copyOf(failures));
  }

  public MergedSources mergeStrict(List<Path> files) {
    MergedSources sources = merge(files);
    if (sources.hasFailures()) {
      throw sources.failures().get(0);
    }
    return sources;
  }

  public ImportCheck checkImports(Model model) {
    var local = new TreeSet<String>();
    var external = new TreeSet<String>();
    model.listObjectsOfProperty(OWL.imports)
         .filterKeep(RDFNode::isURIResource)
         .mapWith(node -> node.asResource().getURI())
         .toList()
         .forEach(uri -> {
           if (uri.contains(properties.getLocalImportPrefix())) {
             local.add(uri);
           }
           else if (!uri.startsWith(W3C_PREFIX)) {
             external.add(uri);
           }
         });

    local.forEach(uri -> log.info("local curriculum import: {}", uri));
    if (!external.isEmpty()) {
      external.forEach(uri -> log.warn("external import: {}", uri));
      log.warn("external imports should resolve via w3id.org or be standard vocabularies");
    }
    return new ImportCheck(local, external);
  }

  public Path writeCombined(Model model) {
    return writeCombined(model, Path.of(properties.getCombinedOutput()));
  }

  @SneakyThrows
  public Path writeCombined(Model model, Path target) {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target)) {
      RDFDataMgr.write(out, model, RDFFormat.TURTLE_PRETTY);
    }
    log.info("combined graph written to {}", target);
    return target;
  }
}
