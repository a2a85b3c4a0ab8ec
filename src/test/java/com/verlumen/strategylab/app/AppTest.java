package com.verlumen.strategylab.app;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import com.verlumen.strategylab.evolution.EvolutionConfig;
import com.verlumen.strategylab.genome.Genome;
import java.time.Duration;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AppTest {
  @Test
  public void evolutionConfig_defaultFlags_matchDefaultConfig() throws Exception {
    // Act
    EvolutionConfig config = App.evolutionConfig(parse());

    // Assert
    assertThat(config).isEqualTo(EvolutionConfig.builder().build());
  }

  @Test
  public void evolutionConfig_flags_overrideDefaults() throws Exception {
    // Act
    EvolutionConfig config =
        App.evolutionConfig(
            parse("--populationSize", "12", "--patience", "2", "--generationTimeoutMinutes", "5"));

    // Assert
    assertThat(config.populationSize()).isEqualTo(12);
    assertThat(config.patience()).isEqualTo(2);
    assertThat(config.generationTimeout()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  public void seed_withoutSeedFile_usesBundledSignal() throws Exception {
    // Act
    Genome seed = App.seed(parse());

    // Assert
    assertThat(seed.name()).isEqualTo("exhaustion_signal");
    assertThat(seed.source()).contains("@pyne");
    assertThat(seed.parameters()).containsExactly("level1", 9.0, "level2", 12.0, "level3", 14.0);
  }

  @Test
  public void parseParameters_trimsAndSkipsEmptyPairs() {
    assertThat(App.parseParameters(" fast = 5, slow=20.5,, "))
        .containsExactly("fast", 5.0, "slow", 20.5);
  }

  @Test
  public void parseParameters_missingValue_throws() {
    assertThrows(IllegalArgumentException.class, () -> App.parseParameters("fast"));
  }

  @Test
  public void parse_unknownRunMode_throws() {
    assertThrows(ArgumentParserException.class, () -> parse("--runMode", "paper"));
  }

  @Test
  public void modules_dryRunInMemory_wireTheWholeApp() throws Exception {
    // Arrange
    Namespace namespace = parse("--runMode", "dry", "--inMemoryRegistry", "--randomSeed", "7");

    // Act
    App app = Guice.createInjector(App.modules(namespace)).getInstance(App.class);

    // Assert
    assertThat(app).isNotNull();
    app.shutdown();
  }

  private static Namespace parse(String... args) throws ArgumentParserException {
    return App.createArgumentParser().parseArgs(args);
  }
}
