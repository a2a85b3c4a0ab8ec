package com.verlumen.strategylab.deployment;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Stage results that clear every default check, for tests to degrade one field at a time. */
final class TestStages {
  static MultiMarketResult.Builder multiMarket() {
    return MultiMarketResult.builder()
        .setVerdicts(ImmutableList.of())
        .setMarketsPassed(5)
        .setMarketsFailed(0)
        .setPassRate(1.0)
        .setMeanSharpe(1.8)
        .setMedianSharpe(1.8)
        .setMinSharpe(1.5)
        .setMaxSharpe(2.1)
        .setMeanDrawdown(0.1)
        .setMaxDrawdown(0.12)
        .setMeanWinRate(0.6)
        .setMeanProfitFactor(1.8)
        .setSharpeCiLower(1.4)
        .setSharpeCiUpper(2.2)
        .setPerformanceConsistent(true);
  }

  static TradeAnalysis.Builder trades() {
    return TradeAnalysis.builder()
        .setTotalTrades(40)
        .setWinningTrades(24)
        .setLosingTrades(16)
        .setWinRate(0.6)
        .setLossRate(0.4)
        .setGrossProfit(480)
        .setGrossLoss(160)
        .setNetProfit(320)
        .setProfitFactor(3.0)
        .setAvgWin(20)
        .setAvgLoss(10)
        .setLargestWin(60)
        .setLargestLoss(-25)
        .setMaxConsecutiveWins(5)
        .setMaxConsecutiveLosses(3)
        .setRiskRewardRatio(2.0)
        .setKellyFraction(0.2)
        .setExpectancy(8);
  }

  static ProfitMetrics.Builder profit() {
    return ProfitMetrics.builder()
        .setPeriods(500)
        .setTotalReturn(0.4)
        .setAnnualizedReturn(0.2)
        .setCagr(0.18)
        .setSharpeRatio(1.9)
        .setSortinoRatio(2.6)
        .setCalmarRatio(1.7)
        .setOmegaRatio(1.6)
        .setTestStatistic(3.2)
        .setTestPValue(0.002)
        .setStatisticallySignificant(true)
        .setReturnCiLower(0.05)
        .setReturnCiUpper(0.35)
        .setSharpeCiLower(1.2)
        .setSharpeCiUpper(2.6)
        .setTradeAnalysis(Optional.of(trades().build()))
        .setQualityScore(80)
        .setQuality(ProfitQuality.GOOD);
  }

  static WalkForwardResult.Builder walkForward() {
    return WalkForwardResult.builder()
        .setPeriods(ImmutableList.of())
        .setPeriodsPassed(4)
        .setPassRate(0.8)
        .setMeanInSampleReturn(0.12)
        .setMeanOutOfSampleReturn(0.1)
        .setMeanInSampleSharpe(2.0)
        .setMeanOutOfSampleSharpe(1.7)
        .setMeanDegradation(0.15)
        .setMeanSharpeDegradation(0.15)
        .setDegradationStd(0.05)
        .setOverfittingScore(15)
        .setOutOfSampleConsistency(0.8)
        .setPerformanceStable(true);
  }

  static SimulationResult.Builder simulation() {
    return SimulationResult.builder()
        .setSimulations(1000)
        .setMeanReturn(0.3)
        .setMedianReturn(0.29)
        .setStdReturn(0.1)
        .setMinReturn(-0.05)
        .setMaxReturn(0.7)
        .setReturnCiLower(0.1)
        .setReturnCiUpper(0.5)
        .setSharpeCiLower(1.1)
        .setSharpeCiUpper(2.5)
        .setProbabilityOfProfit(0.95)
        .setProbabilityOfRuin(0.01)
        .setValueAtRisk95(0.12)
        .setConditionalValueAtRisk95(0.08)
        .setRobustnessScore(85);
  }

  static StageResults.Builder allStages() {
    return StageResults.builder()
        .setMultiMarket(multiMarket().build())
        .setProfit(profit().build())
        .setWalkForward(walkForward().build())
        .setSimulation(simulation().build());
  }

  private TestStages() {}
}
