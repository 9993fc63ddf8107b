package uk.curriculum.triplestore.sanity;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties("curriculum.sanity")
public class SanityProperties {
  private String sampleFile = "sanity-sample-data/sample-data.json";
  private String outputDir = "data/national-curriculum-for-england";
  private String projectId;
  private String dataset = "production";
  private String token;
  private String apiVersion = "v2021-10-21";
  /**
   * Overrides the project API host, e.g. {@code http://localhost:8089}.
   */
  private String apiUrl;
  private int timeoutSeconds = 30;
  /**
   * GROQ query per document collection of the export.
   */
  private Map<String, String> queries = new LinkedHashMap<>(SanityExport.DEFAULT_QUERIES);

  public String queryUrl() {
    String base = StringUtils.isBlank(apiUrl) ? "https://%s.api.sanity.io".formatted(projectId) : StringUtils.removeEnd(apiUrl, "/");
    return "%s/%s/data/query/%s".formatted(base, apiVersion, dataset);
  }
}
