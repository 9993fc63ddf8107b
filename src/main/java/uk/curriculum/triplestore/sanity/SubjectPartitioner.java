package uk.curriculum.triplestore.sanity;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static uk.curriculum.triplestore.sanity.SanityExport.CONTENT_DESCRIPTORS;
import static uk.curriculum.triplestore.sanity.SanityExport.CONTENT_SUBDESCRIPTORS;
import static uk.curriculum.triplestore.sanity.SanityExport.DISCIPLINES;
import static uk.curriculum.triplestore.sanity.SanityExport.PROGRESSIONS;
import static uk.curriculum.triplestore.sanity.SanityExport.SCHEMES;
import static uk.curriculum.triplestore.sanity.SanityExport.STRANDS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBJECTS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBSTRANDS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBSUBJECTS;
import static uk.curriculum.triplestore.sanity.SanityIds.reference;
import static uk.curriculum.triplestore.sanity.SanityIds.slug;
import static uk.curriculum.triplestore.sanity.SanityIds.subjectName;

/**
 * Splits an export per subject by following references down from the subject document:
 * disciplines, then the strands pointing at them, their sub-strands, content descriptors and
 * sub-descriptors; and from the sub-subjects to their schemes and progressions.
 */
@Component
public class SubjectPartitioner {

  public SortedSet<String> discoverSubjects(SanityExport export) {
    SortedSet<String> subjects = new TreeSet<>();
    export.documents(SUBJECTS)
          .stream()
          .map(SanityIds::slug)
          .filter(SanityIds::isSubjectId)
          .map(SanityIds::subjectName)
          .forEach(subjects::add);
    export.documents(SUBSUBJECTS)
          .stream()
          .flatMap(doc -> reference(doc, "subject").stream())
          .map(SanityIds::subjectName)
          .forEach(subjects::add);
    return subjects;
  }

  public SanityExport partition(SanityExport export, String subject) {
    List<JsonNode> subjects = filter(export, SUBJECTS, doc -> subjectName(slug(doc)).equals(subject));
    List<JsonNode> subSubjects = filter(export, SUBSUBJECTS,
                                        doc -> reference(doc, "subject").map(id -> id.endsWith("subject-" + subject)).orElse(false));

    Set<String> disciplineIds = subjects.stream()
                                        .flatMap(doc -> stream(doc.path("disciplines")))
                                        .flatMap(ref -> reference(ref).stream())
                                        .collect(Collectors.toSet());
    List<JsonNode> disciplines = filter(export, DISCIPLINES, doc -> disciplineIds.contains(slug(doc)));
    List<JsonNode> strands = filter(export, STRANDS, referencing("discipline", disciplineIds));
    List<JsonNode> substrands = filter(export, SUBSTRANDS, referencing("strand", slugs(strands)));
    List<JsonNode> descriptors = filter(export, CONTENT_DESCRIPTORS, referencing("substrand", slugs(substrands)));
    List<JsonNode> subDescriptors = filter(export, CONTENT_SUBDESCRIPTORS, referencing("contentDescriptor", slugs(descriptors)));
    List<JsonNode> schemes = filter(export, SCHEMES, referencing("subsubject", slugs(subSubjects)));
    List<JsonNode> progressions = filter(export, PROGRESSIONS, referencing("scheme", slugs(schemes)));

    return SanityExport.builder()
                       .collection(SUBJECTS, subjects)
                       .collection(SUBSUBJECTS, subSubjects)
                       .collection(DISCIPLINES, disciplines)
                       .collection(STRANDS, strands)
                       .collection(SUBSTRANDS, substrands)
                       .collection(CONTENT_DESCRIPTORS, descriptors)
                       .collection(CONTENT_SUBDESCRIPTORS, subDescriptors)
                       .collection(SCHEMES, schemes)
                       .collection(PROGRESSIONS, progressions)
                       .build();
  }

  private static List<JsonNode> filter(SanityExport export, String collection, Predicate<JsonNode> predicate) {
    return export.documents(collection).stream().filter(predicate).toList();
  }

  private static Predicate<JsonNode> referencing(String field, Set<String> ids) {
    return doc -> reference(doc, field).map(ids::contains).orElse(false);
  }

  private static Set<String> slugs(List<JsonNode> documents) {
    return documents.stream().map(SanityIds::slug).collect(Collectors.toSet());
  }

  private static Stream<JsonNode> stream(JsonNode array) {
    return StreamSupport.stream(array.spliterator(), false);
  }
}
