package uk.curriculum.triplestore.sanity;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import uk.curriculum.triplestore.vocabulary.ENG;

import java.util.Optional;

/**
 * Identifiers of Sanity documents. A document is named by its slug ({@code id.current}) when it has
 * one and by its {@code _id} otherwise, in both cases without the {@code drafts.} prefix.
 */
public final class SanityIds {
  private static final String DRAFTS_PREFIX = "drafts.";
  private static final String SUBJECT_PREFIX = "subject-";

  private SanityIds() {
  }

  public static String slug(JsonNode document) {
    JsonNode id = document.get("id");
    if (id != null && id.isObject()) {
      return id.path("current").asText("");
    }
    return stripDrafts(document.path("_id").asText(""));
  }

  public static String uri(String id) {
    return ENG.uri(stripDrafts(id));
  }

  /**
   * Target id of a reference: a plain {@code {"_ref": ...}} or a dereferenced document as returned
   * by a GROQ projection.
   */
  public static Optional<String> reference(JsonNode ref) {
    if (ref == null || !ref.isObject()) {
      return Optional.empty();
    }
    if (ref.hasNonNull("_ref")) {
      return Optional.of(stripDrafts(ref.get("_ref").asText()));
    }
    if (ref.hasNonNull("_id") || ref.has("id")) {
      return Optional.of(slug(ref));
    }
    return Optional.empty();
  }

  public static Optional<String> reference(JsonNode document, String field) {
    return reference(document.get(field)).filter(StringUtils::isNotEmpty);
  }

  public static String subjectName(String subjectId) {
    return StringUtils.removeStart(subjectId, SUBJECT_PREFIX);
  }

  public static boolean isSubjectId(String id) {
    return id.startsWith(SUBJECT_PREFIX);
  }

  static String stripDrafts(String id) {
    return StringUtils.remove(id, DRAFTS_PREFIX);
  }
}
