package uk.curriculum.triplestore.sparql;

import freemarker.template.Configuration;
import freemarker.template.Template;
import lombok.SneakyThrows;

import java.io.StringReader;
import java.util.HashMap;
import java.util.Map;

import static org.springframework.ui.freemarker.FreeMarkerTemplateUtils.processTemplateIntoString;

public interface SparqlQueryStore {
  Map<String, String> asMap();

  default String getQuery(String queryName) {
    return asMap().get(queryName);
  }

  default long size() {
    return asMap().size();
  }

  default boolean isPresent(String queryName) {
    return asMap().containsKey(queryName);
  }

  default String getQueryWithParameters(String queryName, Map<String, Object> parameters) {
    String query = getQuery(queryName);
    if (query == null) {
      throw new IllegalArgumentException("unknown query " + queryName);
    }
    return computeQueryWithParameters(queryName, query, parameters);
  }

  @SneakyThrows
  static String computeQueryWithParameters(String name, String query, Map<String, Object> parameters) {
    Configuration cfg = new Configuration(Configuration.VERSION_2_3_31);
    Template template = new Template(name, new StringReader(query), cfg);
    return processTemplateIntoString(template, new HashMap<>(parameters));
  }
}
