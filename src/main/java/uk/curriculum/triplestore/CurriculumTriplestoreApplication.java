package uk.curriculum.triplestore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import uk.curriculum.triplestore.command.CommandRunner;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CurriculumTriplestoreApplication {

  public static void main(String[] args) {
    if (CommandRunner.isCommand(args)) {
      ConfigurableApplicationContext ctx = new SpringApplicationBuilder(CurriculumTriplestoreApplication.class)
              .web(WebApplicationType.NONE)
              .run(args);
      System.exit(SpringApplication.exit(ctx));
    }
    else {
      SpringApplication.run(CurriculumTriplestoreApplication.class, args);
    }
  }
}
