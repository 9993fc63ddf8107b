package uk.curriculum.triplestore.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import uk.curriculum.triplestore.build.BuildSummary;
import uk.curriculum.triplestore.build.StaticDataBuilder;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BuildCommandTest {
  @Mock
  private StaticDataBuilder builder;
  @InjectMocks
  private BuildCommand command;

  @Test
  void successfulBuildExitsWithZero() {
    when(builder.build()).thenReturn(new BuildSummary(List.of(Path.of("distributions/subjects/index.json")), 512));

    assertThat(command.name()).isEqualTo("build");
    assertThat(command.run(new DefaultApplicationArguments("build"))).isZero();
  }

  @Test
  void failingJobPropagates() {
    when(builder.build()).thenThrow(new IllegalStateException("job subjects-index: query subjects-index not found"));

    assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("build")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("subjects-index");
  }
}
