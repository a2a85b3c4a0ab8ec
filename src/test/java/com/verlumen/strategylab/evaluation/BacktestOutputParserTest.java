package com.verlumen.strategylab.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BacktestOutputParserTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void parse_bothFiles_readsTradesAndEquity() throws Exception {
    // Arrange
    File dir = folder.newFolder();
    write(dir, "trades.json", "[{\"pnl\": 1.5, \"size\": 2}, {\"pnl\": -0.5}]");
    write(dir, "equity.json", "{\"equity\": [100, 101.5, 101]}");

    // Act
    Optional<BacktestOutput> output = BacktestOutputParser.parse(dir.toPath());

    // Assert
    assertThat(output).isPresent();
    assertThat(output.get().trades())
        .containsExactly(Trade.create(1.5, 2), Trade.create(-0.5, 0))
        .inOrder();
    assertThat(output.get().equity()).containsExactly(100.0, 101.5, 101.0).inOrder();
  }

  @Test
  public void parse_missingEquity_isEmpty() throws Exception {
    // Arrange
    File dir = folder.newFolder();
    write(dir, "trades.json", "[]");

    // Act & Assert
    assertThat(BacktestOutputParser.parse(dir.toPath())).isEmpty();
  }

  @Test
  public void parse_malformedTrades_throws() throws Exception {
    // Arrange
    File dir = folder.newFolder();
    write(dir, "trades.json", "{\"not\": \"an array\"}");
    write(dir, "equity.json", "{\"equity\": []}");

    // Act & Assert
    assertThrows(IOException.class, () -> BacktestOutputParser.parse(dir.toPath()));
  }

  private static void write(File dir, String name, String content) throws IOException {
    Files.writeString(dir.toPath().resolve(name), content, StandardCharsets.UTF_8);
  }
}
