package uk.curriculum.triplestore.command;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.sanity.ConversionSummary;
import uk.curriculum.triplestore.sanity.SanityClient;
import uk.curriculum.triplestore.sanity.SanityExport;
import uk.curriculum.triplestore.sanity.SanityProperties;
import uk.curriculum.triplestore.sanity.SanityToTurtleConverter;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Optional.ofNullable;

/**
 * {@code convert [--sample|--api] [--subjects=science,history|all] [--output=dir]}
 */
@Component
@Slf4j
public class ConvertCommand implements Command {
  static final String ALL_SUBJECTS = "all";

  private final SanityClient sanityClient;
  private final SanityToTurtleConverter converter;
  private final SanityProperties properties;

  public ConvertCommand(SanityClient sanityClient, SanityToTurtleConverter converter, SanityProperties properties) {
    this.sanityClient = sanityClient;
    this.converter = converter;
    this.properties = properties;
  }

  @Override
  public String name() {
    return "convert";
  }

  @Override
  public int run(ApplicationArguments args) {
    SanityExport export;
    if (args.containsOption("api")) {
      log.info("source: Sanity API");
      export = sanityClient.fetch();
    }
    else {
      log.info("source: sample JSON file {}", properties.getSampleFile());
      export = sanityClient.readSample();
    }
    log.info("loaded {} documents", export.totalDocuments());

    Path outputDir = Path.of(ofNullable(Command.option(args, "output")).orElse(properties.getOutputDir()));
    ConversionSummary summary = converter.convert(export, subjects(Command.option(args, "subjects")), outputDir);
    log.info("✓ conversion complete: {} files in {}, subjects {}", summary.files().size(), outputDir, summary.subjects());
    return 0;
  }

  static Set<String> subjects(String option) {
    if (StringUtils.isBlank(option) || ALL_SUBJECTS.equalsIgnoreCase(option.trim())) {
      return Set.of();
    }
    return Arrays.stream(option.split(","))
                 .map(String::trim)
                 .filter(StringUtils::isNotEmpty)
                 .collect(Collectors.toUnmodifiableSet());
  }
}
