package uk.curriculum.triplestore.sanity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

public record SanityExport(Map<String, List<JsonNode>> collections) {
  public static final String PHASES = "phases";
  public static final String KEY_STAGES = "keyStages";
  public static final String YEAR_GROUPS = "yearGroups";
  public static final String DISCIPLINES = "disciplines";
  public static final String SUBJECTS = "subjects";
  public static final String STRANDS = "strands";
  public static final String SUBSTRANDS = "substrands";
  public static final String CONTENT_DESCRIPTORS = "contentDescriptors";
  public static final String CONTENT_SUBDESCRIPTORS = "contentSubdescriptors";
  public static final String SUBSUBJECTS = "subsubjects";
  public static final String SCHEMES = "schemes";
  public static final String PROGRESSIONS = "progressions";
  public static final String THEMES = "themes";

  static final Map<String, String> DEFAULT_QUERIES = Map.ofEntries(
          entry(PHASES, "*[_type == \"phase\"]"),
          entry(KEY_STAGES, "*[_type == \"keyStage\"]"),
          entry(YEAR_GROUPS, "*[_type == \"yearGroup\"]"),
          entry(DISCIPLINES, "*[_type == \"discipline\"]"),
          entry(SUBJECTS, "*[_type == \"subject\"]"),
          entry(STRANDS, "*[_type == \"strand\"]"),
          entry(SUBSTRANDS, "*[_type == \"substrand\"]"),
          entry(CONTENT_DESCRIPTORS, "*[_type == \"contentDescriptor\"]"),
          entry(CONTENT_SUBDESCRIPTORS, "*[_type == \"contentSubdescriptor\"]"),
          entry(SUBSUBJECTS, "*[_type == \"subsubject\"]"),
          entry(SCHEMES, "*[_type == \"scheme\"]"),
          entry(PROGRESSIONS, "*[_type == \"progression\"]"),
          entry(THEMES, "*[_type == \"theme\"]")
  );

  public SanityExport {
    collections = Map.copyOf(collections);
  }

  public List<JsonNode> documents(String collection) {
    return collections.getOrDefault(collection, List.of());
  }

  public int totalDocuments() {
    return collections.values().stream().mapToInt(List::size).sum();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final Map<String, List<JsonNode>> collections = new LinkedHashMap<>();

    public Builder collection(String name, List<JsonNode> documents) {
      collections.put(name, List.copyOf(documents));
      return this;
    }

    public SanityExport build() {
      return new SanityExport(collections);
    }
  }
}
