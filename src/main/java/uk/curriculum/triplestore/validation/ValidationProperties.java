package uk.curriculum.triplestore.validation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties("curriculum.validation")
public class ValidationProperties {
  private String shapes = "ontology/curriculum-constraints.ttl";
  private String ontology = "ontology/curriculum-ontology.ttl";
  private Inference inference = Inference.RDFS;
  private boolean abortOnFirst = true;
  private String reportFile;

  public enum Inference {NONE, RDFS}
}
