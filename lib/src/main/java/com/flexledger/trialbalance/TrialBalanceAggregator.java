package com.flexledger.trialbalance;

import com.flexledger.inventory.Lot;
import com.flexledger.inventory.LotLedger;
import com.flexledger.journal.Posting;
import com.flexledger.ledger.Account;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.PositionSnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Folds postings into a trial balance and open lots into the holdings schedule. */
public final class TrialBalanceAggregator {

    private final BigDecimal tolerance;

    public TrialBalanceAggregator(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance").abs();
    }

    public TrialBalance aggregate(List<Posting> postings) {
        // EnumMap iterates in declaration order, which is account code order.
        Map<Account, BigDecimal[]> totals = new EnumMap<>(Account.class);
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (Posting posting : postings) {
            BigDecimal[] sides = totals.computeIfAbsent(
                    posting.getAccount(), account -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            sides[0] = sides[0].add(posting.getDebit());
            sides[1] = sides[1].add(posting.getCredit());
            totalDebits = totalDebits.add(posting.getDebit());
            totalCredits = totalCredits.add(posting.getCredit());
        }
        List<AccountBalance> balances = new ArrayList<>(totals.size());
        for (Map.Entry<Account, BigDecimal[]> entry : totals.entrySet()) {
            balances.add(new AccountBalance(entry.getKey(), entry.getValue()[0], entry.getValue()[1]));
        }
        return new TrialBalance(balances, totalDebits, totalCredits, tolerance);
    }

    /**
     * Builds the schedule from the lots still open at the end of the run.
     *
     * @param positions broker position report used for the mismatch flag
     * @param positionsReported whether the export had a position section at all; without one no
     *     line is flagged as a mismatch
     */
    public HoldingsSchedule holdings(
            LotLedger lotLedger,
            List<PositionSnapshot> positions,
            boolean positionsReported,
            TrialBalance trialBalance) {
        Map<String, BigDecimal> brokerQuantities = new HashMap<>();
        for (PositionSnapshot position : positions) {
            brokerQuantities.merge(position.getSymbol(), position.getQuantity(), BigDecimal::add);
        }

        Map<String, Aggregate> bySymbol = new LinkedHashMap<>();
        BigDecimal excludedLotCost = BigDecimal.ZERO;
        for (Lot lot : lotLedger.openLots()) {
            if (!lot.getInstrumentClass().isInHoldingsSchedule()) {
                excludedLotCost = excludedLotCost.add(lot.getCost());
                continue;
            }
            Aggregate aggregate = bySymbol.computeIfAbsent(
                    lot.getSymbol() + "\u0000" + lot.getInstrumentClass(),
                    key -> new Aggregate(lot.getSymbol(), lot.getInstrumentClass()));
            aggregate.quantity = aggregate.quantity.add(lot.getQuantity());
            aggregate.cost = aggregate.cost.add(lot.getCost());
        }

        List<HoldingLine> lines = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;
        for (Aggregate aggregate : bySymbol.values()) {
            if (aggregate.quantity.signum() <= 0) {
                continue;
            }
            EnumSet<HoldingFlag> flags = EnumSet.noneOf(HoldingFlag.class);
            if (lotLedger.hadShortfall(aggregate.symbol, aggregate.instrumentClass)) {
                flags.add(HoldingFlag.SHORTFALL);
            }
            BigDecimal brokerQuantity = brokerQuantities.get(aggregate.symbol);
            if (positionsReported
                    && (brokerQuantity == null || brokerQuantity.compareTo(aggregate.quantity) != 0)) {
                flags.add(HoldingFlag.BROKER_MISMATCH);
            }
            lines.add(new HoldingLine(
                    aggregate.symbol,
                    aggregate.instrumentClass,
                    aggregate.quantity,
                    aggregate.cost,
                    brokerQuantity,
                    flags));
            totalCost = totalCost.add(aggregate.cost);
        }
        return new HoldingsSchedule(
                lines,
                totalCost,
                trialBalance.netOf(Account.INVESTMENTS_AT_COST),
                excludedLotCost,
                lotLedger.shortfallSymbols());
    }

    private static final class Aggregate {
        private final String symbol;
        private final InstrumentClass instrumentClass;
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;

        Aggregate(String symbol, InstrumentClass instrumentClass) {
            this.symbol = symbol;
            this.instrumentClass = instrumentClass;
        }
    }
}
