package uk.curriculum.triplestore.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import uk.curriculum.triplestore.sanity.ConversionSummary;
import uk.curriculum.triplestore.sanity.SanityClient;
import uk.curriculum.triplestore.sanity.SanityExport;
import uk.curriculum.triplestore.sanity.SanityProperties;
import uk.curriculum.triplestore.sanity.SanityToTurtleConverter;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConvertCommandTest {
  private static final SanityExport EXPORT = SanityExport.builder().build();

  @Mock
  private SanityClient sanityClient;
  @Mock
  private SanityToTurtleConverter converter;

  private ConvertCommand command;

  @BeforeEach
  void setUp() {
    command = new ConvertCommand(sanityClient, converter, new SanityProperties());
  }

  @Test
  void subjectsOption() {
    assertThat(ConvertCommand.subjects(null)).isEmpty();
    assertThat(ConvertCommand.subjects("all")).isEmpty();
    assertThat(ConvertCommand.subjects(" ALL ")).isEmpty();
    assertThat(ConvertCommand.subjects("science, history,,")).containsExactlyInAnyOrder("science", "history");
  }

  @Test
  void sampleIsTheDefaultSource() {
    when(sanityClient.readSample()).thenReturn(EXPORT);
    when(converter.convert(any(), any(), any())).thenReturn(new ConversionSummary(0, List.of(), List.of(), List.of()));

    int exitCode = command.run(new DefaultApplicationArguments("convert", "--subjects=science"));

    assertThat(exitCode).isZero();
    verify(sanityClient, never()).fetch();
    verify(converter).convert(EXPORT, Set.of("science"), Path.of("data/national-curriculum-for-england"));
  }

  @Test
  void apiSourceAndOutputDirectory() {
    when(sanityClient.fetch()).thenReturn(EXPORT);
    when(converter.convert(any(), any(), any())).thenReturn(new ConversionSummary(0, List.of(), List.of(), List.of()));

    command.run(new DefaultApplicationArguments("convert", "--api", "--output=target/converted"));

    verify(converter).convert(eq(EXPORT), eq(Set.of()), eq(Path.of("target/converted")));
  }
}
