package uk.curriculum.triplestore.tdb;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.jena.query.Dataset;
import org.apache.jena.rdf.model.AnonId;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.sparql.core.assembler.AssemblerUtils;
import org.apache.jena.tdb2.assembler.VocabTDB2;
import org.apache.jena.vocabulary.RDF;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConditionalOnWebApplication
@Slf4j
public class TDBConfig {
  @Value("${triplestore.database.dir}")
  private String tripleStoreDir;
  @Value("${triplestore.database.unionDefaultGraph}")
  private boolean unionDefaultGraph;

  @Bean(destroyMethod = "close")
  @SneakyThrows
  public Dataset database() {
    Path location = Path.of(tripleStoreDir);
    if (Files.notExists(location)) {
      log.info("creating TDB2 directory {}", Files.createDirectories(location));
    }
    log.info("opening TDB2 dataset at {}, union default graph: {}", location, unionDefaultGraph);
    return (Dataset) AssemblerUtils.build(assemblerModel(location), VocabTDB2.tDatasetTDB);
  }

  private Model assemblerModel(Path location) {
    Model assemblerModel = ModelFactory.createDefaultModel();
    Resource dataset = assemblerModel.createResource(AnonId.create("dataset"));
    dataset.addProperty(RDF.type, VocabTDB2.tDatasetTDB);
    dataset.addProperty(VocabTDB2.pLocation, location.toString());
    dataset.addLiteral(VocabTDB2.pUnionDefaultGraph, unionDefaultGraph);
    return assemblerModel;
  }
}
