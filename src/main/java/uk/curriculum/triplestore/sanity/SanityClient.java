package uk.curriculum.triplestore.sanity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

@Service
@Slf4j
public class SanityClient {
  private final SanityProperties properties;
  private final ObjectMapper objectMapper;

  public SanityClient(SanityProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public SanityExport readSample() {
    return readFile(Path.of(properties.getSampleFile()));
  }

  public SanityExport readFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new SanityException("sample data file not found: " + file);
    }
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      SanityExport.Builder builder = SanityExport.builder();
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (field.getValue().isArray()) {
          builder.collection(field.getKey(), toList(field.getValue()));
        }
      }
      return builder.build();
    }
    catch (IOException exc) {
      throw new SanityException("cannot read " + file + ": " + exc.getMessage(), exc);
    }
  }

  public SanityExport fetch() {
    requireCredentials();
    log.info("fetching from Sanity project {} dataset {}", properties.getProjectId(), properties.getDataset());
    SanityExport.Builder builder = SanityExport.builder();
    try (CloseableHttpClient httpClient = buildHttpClient()) {
      for (Map.Entry<String, String> query : properties.getQueries().entrySet()) {
        List<JsonNode> documents = executeQuery(httpClient, query.getValue());
        log.info("  {}: {} documents", query.getKey(), documents.size());
        builder.collection(query.getKey(), documents);
      }
    }
    catch (IOException exc) {
      throw new SanityException("Sanity API request failed: " + exc.getMessage(), exc);
    }
    return builder.build();
  }

  void requireCredentials() {
    if (StringUtils.isAnyBlank(properties.getProjectId(), properties.getDataset(), properties.getToken())) {
      throw new SanityException("missing Sanity credentials, set SANITY_PROJECT_ID, SANITY_DATASET, SANITY_TOKEN");
    }
  }

  URI queryUri(String groq) {
    try {
      return new URIBuilder(properties.queryUrl()).addParameter("query", groq).build();
    }
    catch (URISyntaxException exc) {
      throw new SanityException("invalid Sanity query url: " + exc.getMessage(), exc);
    }
  }

  private List<JsonNode> executeQuery(CloseableHttpClient httpClient, String groq) throws IOException {
    HttpGet get = new HttpGet(queryUri(groq));
    get.setHeader("Authorization", "Bearer " + properties.getToken());
    get.setHeader("Accept", "application/json");
    try (CloseableHttpResponse response = httpClient.execute(get)) {
      String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), UTF_8);
      int status = response.getStatusLine().getStatusCode();
      if (status != HttpStatus.SC_OK) {
        throw new SanityException("Sanity API returned %d for %s: %s".formatted(status, groq, body));
      }
      return toList(objectMapper.readTree(body).path("result"));
    }
  }

  private CloseableHttpClient buildHttpClient() {
    int timeout = properties.getTimeoutSeconds() * 1000;
    return HttpClients.custom()
                      .setDefaultRequestConfig(RequestConfig.custom()
                                                            .setConnectTimeout(timeout)
                                                            .setSocketTimeout(timeout)
                                                            .build())
                      .build();
  }

  private static List<JsonNode> toList(JsonNode array) {
    List<JsonNode> documents = new ArrayList<>();
    array.forEach(documents::add);
    return documents;
  }
}
