package uk.curriculum.triplestore.sanity;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;
import org.springframework.stereotype.Service;
import uk.curriculum.triplestore.vocabulary.ENG;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

import static uk.curriculum.triplestore.sanity.SanityExport.CONTENT_DESCRIPTORS;
import static uk.curriculum.triplestore.sanity.SanityExport.CONTENT_SUBDESCRIPTORS;
import static uk.curriculum.triplestore.sanity.SanityExport.DISCIPLINES;
import static uk.curriculum.triplestore.sanity.SanityExport.KEY_STAGES;
import static uk.curriculum.triplestore.sanity.SanityExport.PHASES;
import static uk.curriculum.triplestore.sanity.SanityExport.PROGRESSIONS;
import static uk.curriculum.triplestore.sanity.SanityExport.SCHEMES;
import static uk.curriculum.triplestore.sanity.SanityExport.STRANDS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBJECTS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBSTRANDS;
import static uk.curriculum.triplestore.sanity.SanityExport.SUBSUBJECTS;
import static uk.curriculum.triplestore.sanity.SanityExport.THEMES;
import static uk.curriculum.triplestore.sanity.SanityExport.YEAR_GROUPS;

@Service
@Slf4j
public class SanityToTurtleConverter {
  static final String TITLE_PREFIX = "National Curriculum for England - ";

  private final CurriculumGraphs graphs;
  private final SubjectPartitioner partitioner;

  public SanityToTurtleConverter(CurriculumGraphs graphs, SubjectPartitioner partitioner) {
    this.graphs = graphs;
    this.partitioner = partitioner;
  }

  /**
   * @param subjects subject names to write, empty for every subject found in the export
   */
  public ConversionSummary convert(SanityExport export, Set<String> subjects, Path outputDir) {
    log.info("converting {} documents", export.totalDocuments());
    List<Path> files = new ArrayList<>();
    files.add(writeProgrammeStructure(export, outputDir));
    if (!export.documents(THEMES).isEmpty()) {
      files.add(writeThemes(export, outputDir));
    }

    SortedSet<String> discovered = partitioner.discoverSubjects(export);
    if (discovered.isEmpty()) {
      log.warn("no subjects found in data");
    }
    else {
      log.info("found subjects: {}", String.join(", ", discovered));
    }
    subjects.stream()
            .filter(s -> !discovered.contains(s))
            .forEach(s -> log.warn("subject {} not found in data", s));

    List<String> converted = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (String subject : discovered) {
      if (!subjects.isEmpty() && !subjects.contains(subject)) {
        continue;
      }
      SanityExport subjectData = partitioner.partition(export, subject);
      if (subjectData.documents(SUBJECTS).isEmpty()) {
        log.warn("no data found for {}, skipping", title(subject));
        skipped.add(subject);
        continue;
      }
      files.addAll(writeSubject(subject, subjectData, outputDir.resolve("subjects").resolve(subject)));
      converted.add(subject);
    }
    return new ConversionSummary(export.totalDocuments(), converted, skipped, files);
  }

  Path writeProgrammeStructure(SanityExport export, Path outputDir) {
    log.info("converting programme structure");
    Model model = graphs.createModel();
    graphs.addOntologyHeader(model, ENG.uri("programme-structure"),
                             TITLE_PREFIX + "Programme Structure",
                             "Programme structure defining phases, key stages, and year groups.");
    graphs.convertPhases(export.documents(PHASES), model);
    graphs.convertKeyStages(export.documents(KEY_STAGES), model);
    graphs.convertYearGroups(export.documents(YEAR_GROUPS), model);
    return write(model, outputDir.resolve("programme-structure.ttl"));
  }

  Path writeThemes(SanityExport export, Path outputDir) {
    log.info("converting themes");
    Model model = graphs.createModel();
    graphs.addOntologyHeader(model, ENG.uri("themes"),
                             TITLE_PREFIX + "Themes",
                             "Cross-cutting themes spanning multiple subjects.");
    graphs.addThemesScheme(model);
    graphs.convertThemes(export.documents(THEMES), model);
    return write(model, outputDir.resolve("themes.ttl"));
  }

  List<Path> writeSubject(String subject, SanityExport data, Path subjectDir) {
    String title = title(subject);
    log.info("converting {}", title);

    Model subjectModel = graphs.createModel();
    graphs.addOntologyHeader(subjectModel, ENG.uri(subject + "-subject"),
                             TITLE_PREFIX + title + " Subject",
                             title + " subject definition, including aims and strands.");
    graphs.convertSubjects(data.documents(SUBJECTS), subjectModel);
    graphs.convertSubSubjects(data.documents(SUBSUBJECTS), subjectModel);

    Model taxonomy = graphs.createModel();
    graphs.addOntologyHeader(taxonomy, ENG.uri(subject + "-knowledge-taxonomy"),
                             TITLE_PREFIX + title + " Knowledge Taxonomy",
                             title + " knowledge taxonomy from disciplines to content descriptors.");
    graphs.convertDisciplines(data.documents(DISCIPLINES), taxonomy);
    graphs.convertStrands(data.documents(STRANDS), taxonomy);
    graphs.convertSubStrands(data.documents(SUBSTRANDS), taxonomy);
    graphs.convertContentDescriptors(data.documents(CONTENT_DESCRIPTORS), taxonomy);
    graphs.convertContentSubDescriptors(data.documents(CONTENT_SUBDESCRIPTORS), taxonomy);

    Model schemes = graphs.createModel();
    graphs.addOntologyHeader(schemes, ENG.uri(subject + "-schemes"),
                             TITLE_PREFIX + title + " Schemes",
                             title + " schemes mapping content to key stages.");
    graphs.convertSchemes(data.documents(SCHEMES), schemes);
    graphs.convertProgressions(data.documents(PROGRESSIONS), schemes);

    List<Path> files = List.of(write(subjectModel, subjectDir.resolve(subject + "-subject.ttl")),
                               write(taxonomy, subjectDir.resolve(subject + "-knowledge-taxonomy.ttl")),
                               write(schemes, subjectDir.resolve(subject + "-schemes.ttl")));
    log.info("✓ {} subjects, {} disciplines, {} strands, {} descriptors, {} schemes",
             data.documents(SUBJECTS).size(), data.documents(DISCIPLINES).size(), data.documents(STRANDS).size(),
             data.documents(CONTENT_DESCRIPTORS).size(), data.documents(SCHEMES).size());
    return files;
  }

  static String title(String subject) {
    return Arrays.stream(subject.split("-"))
                 .map(StringUtils::capitalize)
                 .collect(Collectors.joining(" "));
  }

  @SneakyThrows
  private Path write(Model model, Path target) {
    Files.createDirectories(target.toAbsolutePath().getParent());
    try (OutputStream out = Files.newOutputStream(target)) {
      RDFDataMgr.write(out, model, RDFFormat.TURTLE_PRETTY);
    }
    log.info("✓ written: {}", target);
    return target;
  }
}
