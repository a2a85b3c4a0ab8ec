package com.verlumen.strategylab.evaluation;

import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.util.List;

/** Runs one candidate version against one candle series. */
public interface CandidateRunner {
  /**
   * Materializes the version, runs the executor and turns its output into a record. When the
   * executor finishes without writing output, the record is estimated from the candles alone and
   * flagged {@link MetricsRecord#estimated()}.
   *
   * @throws EvaluationException if the executor fails, times out or writes malformed output
   */
  BacktestOutcome run(Version version, MarketConfig market, List<Candle> candles)
      throws EvaluationException;
}
