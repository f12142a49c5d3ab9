package com.flexledger.jdbc.schema;

import com.flexledger.trialbalance.AccountBalance;
import com.flexledger.trialbalance.TrialBalance;
import java.util.ArrayList;
import java.util.List;

public final class TrialBalanceTable {
    public static final String NAME = "trial_balance";

    private static final TableDefinition DEFINITION = createDefinition();

    private TrialBalanceTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(TrialBalance trialBalance) {
        List<Object[]> rows = new ArrayList<>(trialBalance.getBalances().size());
        for (AccountBalance balance : trialBalance.getBalances()) {
            rows.add(
                    new Object[] {
                        balance.getAccount().getCode(),
                        balance.getAccount().getDisplayName(),
                        balance.getAccount().getCategory().name(),
                        balance.getDebitTotal(),
                        balance.getCreditTotal(),
                        balance.getNet(),
                        balance.getNaturalBalance()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.varchar("account", false));
        columns.add(Columns.varchar("account_name", false));
        columns.add(Columns.varchar("category", false));
        columns.add(Columns.money("debit"));
        columns.add(Columns.money("credit"));
        columns.add(Columns.money("net"));
        columns.add(Columns.money("balance"));
        return new TableDefinition(NAME, "Account totals in code order", columns);
    }
}
