package com.flexledger.trialbalance;

import java.math.BigDecimal;
import java.util.List;

/**
 * Open investment positions at cost, with the figures needed to reconcile the schedule against
 * the investments-at-cost account. Lots of classes kept out of the schedule still sit in that
 * account, so the two differ by {@link #getExcludedLotCost()}.
 */
public final class HoldingsSchedule {
    private final List<HoldingLine> lines;
    private final BigDecimal totalCost;
    private final BigDecimal investmentsAtCostBalance;
    private final BigDecimal excludedLotCost;
    private final List<String> shortfallSymbols;

    HoldingsSchedule(
            List<HoldingLine> lines,
            BigDecimal totalCost,
            BigDecimal investmentsAtCostBalance,
            BigDecimal excludedLotCost,
            List<String> shortfallSymbols) {
        this.lines = List.copyOf(lines);
        this.totalCost = totalCost;
        this.investmentsAtCostBalance = investmentsAtCostBalance;
        this.excludedLotCost = excludedLotCost;
        this.shortfallSymbols = List.copyOf(shortfallSymbols);
    }

    public List<HoldingLine> getLines() {
        return lines;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }

    /** Net debit balance of account 1200. */
    public BigDecimal getInvestmentsAtCostBalance() {
        return investmentsAtCostBalance;
    }

    /** Remaining cost of open lots whose class is not scheduled. */
    public BigDecimal getExcludedLotCost() {
        return excludedLotCost;
    }

    /**
     * Every instrument disposed of at zero cost for want of open lots, including instruments with
     * nothing left open and therefore no line in the schedule.
     */
    public List<String> getShortfallSymbols() {
        return shortfallSymbols;
    }

    /** Account 1200 balance minus the schedule total. */
    public BigDecimal getTransitDifference() {
        return investmentsAtCostBalance.subtract(totalCost);
    }

    /** Part of the transit difference not explained by excluded lots; zero in a consistent run. */
    public BigDecimal getUnexplainedDifference() {
        return getTransitDifference().subtract(excludedLotCost);
    }
}
