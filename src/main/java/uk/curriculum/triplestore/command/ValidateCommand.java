package uk.curriculum.triplestore.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.validation.ShaclValidationService;
import uk.curriculum.triplestore.validation.ValidationResult;

@Component
@Slf4j
public class ValidateCommand implements Command {
  private final ShaclValidationService validationService;

  public ValidateCommand(ShaclValidationService validationService) {
    this.validationService = validationService;
  }

  @Override
  public String name() {
    return "validate";
  }

  @Override
  public int run(ApplicationArguments args) {
    ValidationResult result = validationService.validate();
    log.info("\n{}", result.toHumanReadable());
    if (result.isConforms()) {
      log.info("✓ validation passed: {} files, {} triples", result.getFiles(), result.getTriples());
      return 0;
    }
    log.error("✗ validation failed");
    return 1;
  }
}
