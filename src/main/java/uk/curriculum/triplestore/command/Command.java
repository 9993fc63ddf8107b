package uk.curriculum.triplestore.command;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

public interface Command {
  String name();

  int run(ApplicationArguments args);

  static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }
}
