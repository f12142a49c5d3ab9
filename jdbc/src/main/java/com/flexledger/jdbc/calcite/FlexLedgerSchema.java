package com.flexledger.jdbc.calcite;

import com.flexledger.engine.EngineConfig;
import com.flexledger.engine.LedgerEngine;
import com.flexledger.engine.RunResult;
import com.flexledger.jdbc.schema.HoldingsTable;
import com.flexledger.jdbc.schema.MessagesTable;
import com.flexledger.jdbc.schema.OpenLotsTable;
import com.flexledger.jdbc.schema.PostingsTable;
import com.flexledger.jdbc.schema.TrialBalanceTable;
import com.flexledger.ledger.LedgerException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/**
 * Calcite schema over one engine run. Built either from a finished {@link RunResult} (the driver
 * path) or from a model operand naming the export, in which case the run happens on first access.
 */
public final class FlexLedgerSchema extends AbstractSchema {

    static final String LEDGER_OPERAND = "ledger";

    private final Path ledgerPath;
    private final EngineConfig config;
    private volatile RunResult runResult;
    private volatile Map<String, Table> tables;

    public FlexLedgerSchema(RunResult runResult) {
        this.ledgerPath = null;
        this.config = null;
        this.runResult = runResult;
    }

    FlexLedgerSchema(Map<String, Object> operand) {
        Object ledger = operand.get(LEDGER_OPERAND);
        if (ledger == null) {
            throw new IllegalArgumentException("FlexLedger schema operand must include '" + LEDGER_OPERAND + "'");
        }
        this.ledgerPath = Paths.get(ledger.toString()).toAbsolutePath().normalize();
        Properties properties = new Properties();
        for (Map.Entry<String, Object> entry : operand.entrySet()) {
            if (entry.getValue() != null && !LEDGER_OPERAND.equals(entry.getKey())) {
                properties.setProperty(entry.getKey(), entry.getValue().toString());
            }
        }
        this.config = EngineConfig.fromProperties(properties);
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            local = buildTables(runResult());
            tables = local;
        }
        return local;
    }

    private static Map<String, Table> buildTables(RunResult result) {
        Map<String, Table> map = new LinkedHashMap<>();
        map.put(
                PostingsTable.NAME,
                new LedgerCalciteTable(PostingsTable.getDefinition(), PostingsTable.materializeRows(result.getEntries())));
        map.put(
                TrialBalanceTable.NAME,
                new LedgerCalciteTable(
                        TrialBalanceTable.getDefinition(), TrialBalanceTable.materializeRows(result.getTrialBalance())));
        map.put(
                HoldingsTable.NAME,
                new LedgerCalciteTable(HoldingsTable.getDefinition(), HoldingsTable.materializeRows(result.getHoldings())));
        map.put(
                OpenLotsTable.NAME,
                new LedgerCalciteTable(OpenLotsTable.getDefinition(), OpenLotsTable.materializeRows(result.getOpenLots())));
        map.put(
                MessagesTable.NAME,
                new LedgerCalciteTable(MessagesTable.getDefinition(), MessagesTable.materializeRows(result.getMessages())));
        return Map.copyOf(map);
    }

    RunResult runResult() {
        RunResult current = runResult;
        if (current == null) {
            synchronized (this) {
                current = runResult;
                if (current == null) {
                    try {
                        current = new LedgerEngine(config).run(ledgerPath);
                    } catch (LedgerException ex) {
                        throw new IllegalStateException("Failed to post ledger: " + ledgerPath, ex);
                    }
                    runResult = current;
                }
            }
        }
        return current;
    }
}
