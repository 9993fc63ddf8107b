package uk.curriculum.triplestore.source;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties("curriculum.sources")
public class SourceProperties {
  private List<String> roots = new ArrayList<>(List.of("ontology", "data"));
  private Set<String> excludedDirectories = new HashSet<>(Set.of("versions"));
  private String combinedOutput = Path.of(System.getProperty("java.io.tmpdir"), "combined-data.ttl").toString();
  private String localImportPrefix = "w3id.org/uk/curriculum";
}
