package uk.curriculum.triplestore.build;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties("curriculum.build")
public class BuildProperties {
  private String outputDir = "distributions";
  private String queryDir = "queries";
  private List<Job> jobs = new ArrayList<>();

  /**
   * One static file: the query (a file name in the query directory, possibly a FreeMarker template)
   * and where its results go, relative to the output directory.
   */
  @Data
  public static class Job {
    private String name;
    private String query;
    private String output;
    private Map<String, Object> parameters = new HashMap<>();
  }
}
