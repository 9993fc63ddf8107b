package uk.curriculum.triplestore.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.build.BuildSummary;
import uk.curriculum.triplestore.build.StaticDataBuilder;

@Component
@Slf4j
public class BuildCommand implements Command {
  private final StaticDataBuilder builder;

  public BuildCommand(StaticDataBuilder builder) {
    this.builder = builder;
  }

  @Override
  public String name() {
    return "build";
  }

  @Override
  public int run(ApplicationArguments args) {
    BuildSummary summary = builder.build();
    log.info("✓ static data build complete, {} files", summary.files());
    return 0;
  }
}
