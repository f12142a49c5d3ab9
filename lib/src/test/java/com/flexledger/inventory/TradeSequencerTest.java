package com.flexledger.inventory;

import static com.flexledger.inventory.LotLedgerTest.buy;
import static com.flexledger.inventory.LotLedgerTest.sell;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.flexledger.ledger.Trade;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TradeSequencerTest {

    @Test
    void acquisitionsPrecedeDisposalsOnTheSameDay() {
        Trade sale = sell(1, "2024-03-01", "AAPL", "10");
        Trade purchase = buy(2, "2024-03-01", "AAPL", "10");

        List<Trade> ordered = TradeSequencer.sequence(List.of(sale, purchase));

        assertEquals(List.of(purchase, sale), ordered);
    }

    @Test
    void ordersByDateAndKeepsInputOrderForTies() {
        Trade late = buy(1, "2024-03-05", "AAPL", "1");
        Trade firstBuy = buy(2, "2024-03-01", "MSFT", "1");
        Trade secondBuy = buy(3, "2024-03-01", "AAPL", "1");
        Trade earlySale = sell(4, "2024-03-01", "MSFT", "1");

        List<Trade> ordered = TradeSequencer.sequence(List.of(late, firstBuy, earlySale, secondBuy));

        assertEquals(List.of(firstBuy, secondBuy, earlySale, late), ordered);
    }
}
