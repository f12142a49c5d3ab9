package com.flexledger.inventory;

import com.flexledger.ledger.Trade;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Global trade order required before lot matching: by date, and within a date every acquisition
 * before any disposal. Remaining ties keep input order.
 *
 * <p>A same-day round trip processed sell-first would match the sell against no lots (a zero-cost
 * gain) and leave the buy as a lot that is never consumed.
 */
public final class TradeSequencer {

    private static final Comparator<Trade> ORDER =
            Comparator.comparing(Trade::getDate).thenComparingInt(trade -> trade.isAcquisition() ? 0 : 1);

    private TradeSequencer() {}

    public static List<Trade> sequence(List<Trade> trades) {
        List<Trade> ordered = new ArrayList<>(trades);
        // List.sort is stable.
        ordered.sort(ORDER);
        return ordered;
    }
}
