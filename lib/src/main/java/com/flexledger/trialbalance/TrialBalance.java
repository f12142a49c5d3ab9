package com.flexledger.trialbalance;

import com.flexledger.ledger.Account;
import java.math.BigDecimal;
import java.util.List;

/**
 * Account balances in code order with their column totals. Balanced means the debit and credit
 * columns agree within the configured tolerance.
 */
public final class TrialBalance {
    private final List<AccountBalance> balances;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;
    private final BigDecimal tolerance;

    public TrialBalance(List<AccountBalance> balances, BigDecimal totalDebits, BigDecimal totalCredits, BigDecimal tolerance) {
        this.balances = List.copyOf(balances);
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
        this.tolerance = tolerance;
    }

    public List<AccountBalance> getBalances() {
        return balances;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getDifference() {
        return totalDebits.subtract(totalCredits);
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    public boolean isBalanced() {
        return getDifference().abs().compareTo(tolerance) <= 0;
    }

    /** Net (debit minus credit) for an account, zero when it had no activity. */
    public BigDecimal netOf(Account account) {
        for (AccountBalance balance : balances) {
            if (balance.getAccount() == account) {
                return balance.getNet();
            }
        }
        return BigDecimal.ZERO;
    }
}
