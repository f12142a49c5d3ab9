package com.flexledger.jdbc.tools;

import com.flexledger.engine.EngineConfig;
import com.flexledger.engine.LedgerEngine;
import com.flexledger.engine.RunResult;
import com.flexledger.journal.TransactionCostPolicy;
import com.flexledger.ledger.LedgerException;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.trialbalance.AccountBalance;
import com.flexledger.trialbalance.HoldingFlag;
import com.flexledger.trialbalance.HoldingLine;
import com.flexledger.trialbalance.HoldingsSchedule;
import com.flexledger.trialbalance.TrialBalance;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: posts one export and prints the trial balance and holdings.
 *
 * <p>Exit codes: 0 balanced, 2 unbalanced, 1 usage error or aborted run.
 */
public final class FlexLedgerCli {

    static final int EXIT_BALANCED = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_UNBALANCED = 2;

    private static final Logger LOGGER = Logger.getLogger(FlexLedgerCli.class.getName());
    private static final String USAGE =
            "Usage: FlexLedgerCli <flex.csv> [--period-end YYYY-MM-DD] [--rates-dir DIR]"
                    + " [--owners-loan CSV] [--expense-commissions]";

    private FlexLedgerCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path export = null;
        EngineConfig.Builder config = EngineConfig.builder();
        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--period-end" -> config.periodEnd(LocalDate.parse(value(args, ++i, arg)));
                    case "--rates-dir" -> config.rateDirectory(Path.of(value(args, ++i, arg)));
                    case "--owners-loan" -> config.ownersLoan(Path.of(value(args, ++i, arg)));
                    case "--expense-commissions" -> config.transactionCostPolicy(TransactionCostPolicy.EXPENSE);
                    default -> {
                        if (arg.startsWith("--") || export != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        export = Path.of(arg);
                    }
                }
            }
        } catch (IllegalArgumentException | DateTimeParseException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_ABORTED;
        }
        if (export == null) {
            err.println(USAGE);
            return EXIT_ABORTED;
        }
        if (!Files.isRegularFile(export)) {
            err.println("Export file not found: " + export.toAbsolutePath().normalize());
            return EXIT_ABORTED;
        }

        RunResult result;
        try {
            result = new LedgerEngine(config.build()).run(export);
        } catch (LedgerException ex) {
            LOGGER.log(Level.SEVERE, "Run aborted for " + export, ex);
            err.println("Run aborted: " + ex.getMessage());
            return EXIT_ABORTED;
        }
        return report(result, out, err);
    }

    /** Prints {@code result} and maps its status to the exit code. */
    static int report(RunResult result, PrintStream out, PrintStream err) {
        print(result, out, err);
        return result.isBalanced() ? EXIT_BALANCED : EXIT_UNBALANCED;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void print(RunResult result, PrintStream out, PrintStream err) {
        out.printf(
                "%s: %d entries, %d postings, %d open lots%n",
                result.getSourceName(),
                result.getEntries().size(),
                result.getPostings().size(),
                result.getOpenLots().size());

        TrialBalance trialBalance = result.getTrialBalance();
        out.println();
        out.println("Trial balance");
        for (AccountBalance balance : trialBalance.getBalances()) {
            out.printf(
                    "  %-6s %-34s %14s %14s%n",
                    balance.getAccount().getCode(),
                    balance.getAccount().getDisplayName(),
                    balance.getDebitTotal().toPlainString(),
                    balance.getCreditTotal().toPlainString());
        }
        out.printf(
                "  %-41s %14s %14s%n",
                "Total",
                trialBalance.getTotalDebits().toPlainString(),
                trialBalance.getTotalCredits().toPlainString());
        out.println("  Status: " + result.getStatus() + " (difference " + trialBalance.getDifference().toPlainString() + ")");

        HoldingsSchedule holdings = result.getHoldings();
        out.println();
        out.println("Holdings at cost");
        for (HoldingLine line : holdings.getLines()) {
            StringBuilder flags = new StringBuilder();
            for (HoldingFlag flag : line.getFlags()) {
                flags.append(' ').append(flag);
            }
            out.printf(
                    "  %-12s %-8s %16s %14s %12s%s%n",
                    line.getSymbol(),
                    line.getInstrumentClass().getCode(),
                    line.getQuantity().toPlainString(),
                    line.getCost().toPlainString(),
                    line.getAverageCost().toPlainString(),
                    flags);
        }
        out.println("  Total cost: " + holdings.getTotalCost().toPlainString());
        out.println("  Investments at cost (1200): " + holdings.getInvestmentsAtCostBalance().toPlainString());
        if (!holdings.getShortfallSymbols().isEmpty()) {
            out.println("  Zero-cost shortfalls: " + String.join(", ", holdings.getShortfallSymbols()));
        }
        if (holdings.getUnexplainedDifference().signum() != 0) {
            out.println("  Unexplained difference: " + holdings.getUnexplainedDifference().toPlainString());
        }

        for (LedgerMessage message : result.getMessages()) {
            if (message.getLevel() != LedgerMessage.Level.INFO) {
                err.println(message);
            }
        }
    }
}
