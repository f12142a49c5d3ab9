package com.flexledger.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.flexledger.ledger.CashKind;
import com.flexledger.ledger.CashMovement;
import com.flexledger.ledger.Direction;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.LedgerData;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.Trade;
import com.flexledger.testing.TestResources;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FlexQueryLoaderTest {

    private static final String TRADES_HEADER =
            "HEADER,TRNT,TradeDate,Symbol,Description,AssetClass,Buy/Sell,Quantity,Proceeds,IBCommission,CurrencyPrimary";
    private static final String CASH_HEADER = "HEADER,CTRN,Date,Type,Symbol,Description,Amount,CurrencyPrimary";

    @Test
    void loadsSampleExport() throws Exception {
        Path export = TestResources.sampleExport();

        LoaderResult result = new FlexQueryLoader().load(export);
        LedgerData data = result.getLedgerData();

        assertEquals(3, data.getTrades().size());
        assertEquals(3, data.getCashMovements().size());
        assertEquals(1, data.getPositions().size());
        assertTrue(data.isPositionsReported());
        Trade sale = data.getTrades().get(2);
        assertEquals(Direction.DISPOSAL, sale.getDirection());
        assertEquals(new BigDecimal("4"), sale.getQuantity());
        assertEquals(new BigDecimal("1.25"), sale.getCommission());
        assertEquals(LocalDate.parse("2024-02-15"), sale.getDate());
        assertEquals(InstrumentClass.CURRENCY_CONVERSION, data.getTrades().get(1).getInstrumentClass());
        CashMovement deposit = data.getCashMovements().get(2);
        assertEquals(CashKind.CAPITAL, deposit.getKind());
        assertEquals(new BigDecimal("1000"), deposit.getAmount());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void routesRowsByDeclaredSectionNotPosition() throws Exception {
        String csv =
                String.join(
                        "\n",
                        TRADES_HEADER,
                        CASH_HEADER,
                        "DATA,CTRN,2024-01-05,Dividends,AAPL,AAPL DIVIDEND,50,USD",
                        "DATA,TRNT,2024-01-02,AAPL,APPLE INC,STK,BUY,10,-1500,-1,USD",
                        "DATA,CTRN,2024-01-06,Other Fees,,DATA FEE,-10,USD",
                        "DATA,TRNT,20240103;101500,MSFT,MICROSOFT,STK,SELL,-5,2000,-1,USD");

        LoaderResult result = new FlexQueryLoader().load(new StringReader(csv), "routing.csv");
        LedgerData data = result.getLedgerData();

        assertEquals(List.of("AAPL", "MSFT"), data.getTrades().stream().map(Trade::getSymbol).toList());
        assertEquals(4, data.getTrades().get(0).getSourceLine());
        assertEquals(LocalDate.parse("2024-01-03"), data.getTrades().get(1).getDate());
        assertEquals(2, data.getCashMovements().size());
        assertEquals(CashKind.DIVIDEND, data.getCashMovements().get(0).getKind());
        assertEquals(CashKind.FEE, data.getCashMovements().get(1).getKind());
        assertFalse(data.isPositionsReported());
    }

    @Test
    void skipsTradesWithoutRecognizedInstrumentClass() throws Exception {
        String csv =
                String.join(
                        "\n",
                        TRADES_HEADER,
                        "DATA,TRNT,2024-01-02,AAPL,APPLE INC,STK,BUY,10,-1500,-1,USD",
                        "DATA,TRNT,2024-01-02,XYZ,MYSTERY,WAR,BUY,10,-1500,-1,USD",
                        "DATA,TRNT,2024-01-02,1234,PLAIN NUMBER,,BUY,10,-1500,-1,USD",
                        "DATA,TRNT,2024-01-02,IBM,IBM,STK,HOLD,10,-1500,-1,USD",
                        "DATA,TRNT,2024-01-02,IBM,IBM,STK,BUY,0,0,0,USD",
                        "DATA,TRNT,2024-01-02,IBM,IBM,STK,BUY,ten,-1500,-1,USD");

        LoaderResult result = new FlexQueryLoader().load(new StringReader(csv), "classes.csv");

        assertEquals(1, result.getLedgerData().getTrades().size());
        List<LedgerMessage> warnings = result.getMessages();
        assertEquals(5, warnings.size());
        assertTrue(warnings.stream().allMatch(message -> message.getLevel() == LedgerMessage.Level.WARNING));
        assertTrue(warnings.get(0).getMessage().contains("WAR"));
        assertEquals(3, warnings.get(0).getSourceLineno());
        assertEquals("classes.csv", warnings.get(0).getSourceFilename());
        assertTrue(warnings.get(1).getMessage().contains("no instrument class"));
    }

    @Test
    void reportsUnrecognizedSectionsAndCorporateActions() throws Exception {
        String csv =
                String.join(
                        "\n",
                        "BOF,U1234567,Activity",
                        TRADES_HEADER,
                        "HEADER,ZZZZ,Foo,Bar",
                        "DATA,ZZZZ,1,2",
                        "DATA,ZZZZ,3,4",
                        "HEADER,CORP,Symbol,Description",
                        "DATA,CORP,AAPL,SPLIT 4 FOR 1",
                        "EOF");

        LoaderResult result = new FlexQueryLoader().load(new StringReader(csv), "sections.csv");

        assertEquals(1, result.getLedgerData().getCorporateActionCount());
        assertTrue(result.getLedgerData().getTrades().isEmpty());
        List<String> texts = result.getMessages().stream().map(LedgerMessage::getMessage).toList();
        assertTrue(texts.stream().anyMatch(text -> text.contains("Unrecognized section 'ZZZZ'")));
        assertTrue(texts.contains("2 rows of unrecognized sections skipped"));
        assertTrue(texts.contains("1 corporate action rows recognized but not posted"));
    }

    @Test
    void dataBeforeItsHeaderIsFatal() {
        String csv = String.join("\n", "DATA,TRNT,2024-01-02,AAPL,APPLE INC,STK,BUY,10,-1500,-1,USD", TRADES_HEADER);

        LoaderException ex =
                assertThrows(LoaderException.class, () -> new FlexQueryLoader().load(new StringReader(csv), "order.csv"));
        assertTrue(ex.getMessage().contains("precedes its HEADER"));
    }

    @Test
    void missingTradesSectionIsFatal() {
        String csv = String.join("\n", CASH_HEADER, "DATA,CTRN,2024-01-05,Dividends,AAPL,AAPL DIVIDEND,50,USD");

        assertThrows(LoaderException.class, () -> new FlexQueryLoader().load(new StringReader(csv), "cash-only.csv"));
    }

    @Test
    void exportWithoutHeadersIsFatal() {
        assertThrows(
                LoaderException.class,
                () -> new FlexQueryLoader().load(new StringReader("Symbol,Quantity\nAAPL,10\n"), "flat.csv"));
    }

    @Test
    void missingFileIsFatal() {
        assertThrows(LoaderException.class, () -> new FlexQueryLoader().load(Path.of("does-not-exist.csv")));
    }
}
