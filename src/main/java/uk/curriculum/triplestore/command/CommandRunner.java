package uk.curriculum.triplestore.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@Slf4j
public class CommandRunner implements ApplicationRunner, ExitCodeGenerator {
  private final Map<String, Command> commands = new TreeMap<>();
  private int exitCode;

  public CommandRunner(List<Command> commands) {
    commands.forEach(command -> this.commands.put(command.name(), command));
  }

  public static boolean isCommand(String[] args) {
    return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"));
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> nonOptionArgs = args.getNonOptionArgs();
    if (nonOptionArgs.isEmpty()) {
      return;
    }
    String name = nonOptionArgs.get(0);
    Command command = commands.get(name);
    if (command == null) {
      log.error("unknown command '{}', expected one of {}", name, commands.keySet());
      exitCode = 1;
      return;
    }
    try {
      exitCode = command.run(args);
    }
    catch (Exception exc) {
      log.error("{} failed: {}", name, exc.getMessage(), exc);
      exitCode = 1;
    }
    log.info("{} finished with exit code {}", name, exitCode);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
