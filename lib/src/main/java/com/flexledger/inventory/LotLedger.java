package com.flexledger.inventory;

import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-run lot book keyed by (symbol, instrument class).
 *
 * <p>Acquisitions append a lot; disposals consume from the head (FIFO) or the tail (LIFO) until
 * the disposed quantity is met. A disposal larger than every open lot consumes what exists and
 * treats the excess as zero cost. Lots are matched strictly by symbol, so an instrument roll shows
 * up as an orphaned lot on one symbol and a zero-cost disposal on the other.
 */
public final class LotLedger {

    private record LotKey(String symbol, InstrumentClass instrumentClass) {}

    private final Map<LotKey, Deque<Lot>> lotsByKey = new LinkedHashMap<>();
    private final Set<LotKey> shortfallKeys = new LinkedHashSet<>();
    private final BookingMethod bookingMethod;
    private final int scale;

    public LotLedger(BookingMethod bookingMethod, int scale) {
        this.bookingMethod = bookingMethod != null ? bookingMethod : BookingMethod.FIFO;
        this.scale = scale;
    }

    public BookingMethod getBookingMethod() {
        return bookingMethod;
    }

    public void acquire(Trade trade, BigDecimal cost) {
        Objects.requireNonNull(trade, "trade");
        Objects.requireNonNull(cost, "cost");
        if (!trade.isAcquisition()) {
            throw new IllegalArgumentException("Not an acquisition: " + trade);
        }
        lotsByKey
                .computeIfAbsent(keyOf(trade), key -> new ArrayDeque<>())
                .addLast(
                        new Lot(
                                trade.getSymbol(),
                                trade.getInstrumentClass(),
                                trade.getDate(),
                                trade.getSourceLine(),
                                trade.getQuantity(),
                                cost));
    }

    public DisposalResult dispose(Trade trade) {
        Objects.requireNonNull(trade, "trade");
        if (trade.isAcquisition()) {
            throw new IllegalArgumentException("Not a disposal: " + trade);
        }
        LotKey key = keyOf(trade);
        Deque<Lot> lots = lotsByKey.getOrDefault(key, new ArrayDeque<>());
        BigDecimal remaining = trade.getQuantity();
        BigDecimal consumedCost = BigDecimal.ZERO;
        int touched = 0;
        while (!lots.isEmpty() && remaining.signum() > 0) {
            Lot lot = bookingMethod == BookingMethod.LIFO ? lots.peekLast() : lots.peekFirst();
            touched++;
            if (lot.getQuantity().compareTo(remaining) <= 0) {
                consumedCost = consumedCost.add(lot.getCost());
                remaining = remaining.subtract(lot.getQuantity());
                if (bookingMethod == BookingMethod.LIFO) {
                    lots.removeLast();
                } else {
                    lots.removeFirst();
                }
            } else {
                BigDecimal partialCost =
                        lot.getCost()
                                .multiply(remaining)
                                .divide(lot.getQuantity(), scale, RoundingMode.HALF_EVEN);
                consumedCost = consumedCost.add(partialCost);
                lot.reduce(remaining, partialCost);
                remaining = BigDecimal.ZERO;
            }
        }
        if (lots.isEmpty()) {
            lotsByKey.remove(key);
        }
        if (remaining.signum() > 0) {
            shortfallKeys.add(key);
        }
        return new DisposalResult(trade.getQuantity().subtract(remaining), consumedCost, remaining, touched);
    }

    /** Copies of every open lot ordered by symbol, class, then acquisition order. */
    public List<Lot> openLots() {
        List<LotKey> keys = new ArrayList<>(lotsByKey.keySet());
        keys.sort(Comparator.comparing(LotKey::symbol).thenComparing(LotKey::instrumentClass));
        List<Lot> result = new ArrayList<>();
        for (LotKey key : keys) {
            for (Lot lot : lotsByKey.get(key)) {
                result.add(lot.copy());
            }
        }
        return result;
    }

    // Visible for tests.
    List<Lot> lots(String symbol, InstrumentClass instrumentClass) {
        Deque<Lot> lots = lotsByKey.get(new LotKey(symbol, instrumentClass));
        if (lots == null) {
            return List.of();
        }
        List<Lot> result = new ArrayList<>(lots.size());
        for (Lot lot : lots) {
            result.add(lot.copy());
        }
        return result;
    }

    /** Whether any disposal of this instrument ran past its open lots during the run. */
    public boolean hadShortfall(String symbol, InstrumentClass instrumentClass) {
        return shortfallKeys.contains(new LotKey(symbol, instrumentClass));
    }

    /** Symbols that ran past their open lots, in the order the first shortfall happened. */
    public List<String> shortfallSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (LotKey key : shortfallKeys) {
            symbols.add(key.symbol());
        }
        return List.copyOf(symbols);
    }

    private static LotKey keyOf(Trade trade) {
        return new LotKey(trade.getSymbol(), trade.getInstrumentClass());
    }
}
