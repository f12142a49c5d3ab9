package com.flexledger.jdbc.testing;

import com.flexledger.engine.RunResult;
import com.flexledger.engine.RunStatus;
import com.flexledger.inventory.BookingMethod;
import com.flexledger.inventory.LotLedger;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.trialbalance.TrialBalance;
import com.flexledger.trialbalance.TrialBalanceAggregator;
import java.io.IOException;
import java.math.BigDecimal;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/** Materializes the export, rate and owner's loan fixtures into a scratch directory. */
public final class TestResources {

    public static final String SAMPLE_EXPORT = "fixtures/sample-flex.csv";
    public static final String OWNERS_LOAN = "fixtures/owners-loan.csv";
    private static final String[] RATE_FILES = {
        "fixtures/rates/monthly_csv_2024-1.csv", "fixtures/rates/monthly_csv_2024-2.csv"
    };

    /** A sale of shares never bought; the disposal runs short of open lots. */
    public static final String SHORTFALL_EXPORT =
            String.join(
                    "\n",
                    "\"HEADER\",\"TRNT\",\"TradeDate\",\"Symbol\",\"Description\",\"AssetClass\",\"Buy/Sell\","
                            + "\"Quantity\",\"Proceeds\",\"IBCommission\",\"CurrencyPrimary\"",
                    "\"DATA\",\"TRNT\",\"20240110\",\"MSFT\",\"MICROSOFT\",\"STK\",\"BUY\",\"5\",\"-500\",\"0\",\"GBP\"",
                    "\"DATA\",\"TRNT\",\"20240112\",\"MSFT\",\"MICROSOFT\",\"STK\",\"SELL\",\"-8\",\"960\",\"0\",\"GBP\"",
                    "");

    private TestResources() {}

    public static Path copy(String resourceName, Path directory) throws IOException {
        Path target = directory.resolve(resourceName.substring(resourceName.lastIndexOf('/') + 1));
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Missing test resource: " + resourceName);
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    public static Path ratesDirectory(Path parent) throws IOException {
        Path directory = Files.createDirectories(parent.resolve("rates"));
        for (String rateFile : RATE_FILES) {
            copy(rateFile, directory);
        }
        return directory;
    }

    public static Path write(Path directory, String fileName, String content) throws IOException {
        return Files.writeString(directory.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    /** Driver URL for {@code export} with the fixture rates and any extra query parameters. */
    public static String jdbcUrl(Path export, Path rates, String extraParams) {
        String url = "jdbc:flexledger:" + export.toUri() + "?rateDirectory=" + rates.toAbsolutePath();
        return extraParams == null || extraParams.isEmpty() ? url : url + "&" + extraParams;
    }

    /** A completed run whose debit and credit columns disagree beyond the tolerance. */
    public static RunResult unbalancedResult(String sourceName) {
        BigDecimal tolerance = new BigDecimal("0.01");
        TrialBalance trialBalance =
                new TrialBalance(List.of(), new BigDecimal("100.00"), new BigDecimal("100.05"), tolerance);
        return new RunResult(
                sourceName,
                RunStatus.UNBALANCED,
                trialBalance,
                new TrialBalanceAggregator(tolerance)
                        .holdings(new LotLedger(BookingMethod.FIFO, 2), List.of(), false, trialBalance),
                List.of(),
                List.of(),
                List.of(),
                List.of(LedgerMessage.error("Trial balance does not balance: difference -0.05")));
    }
}
