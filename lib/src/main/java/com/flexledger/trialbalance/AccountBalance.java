package com.flexledger.trialbalance;

import com.flexledger.ledger.Account;
import java.math.BigDecimal;
import java.util.Objects;

/** Debit and credit totals for one account. */
public final class AccountBalance {
    private final Account account;
    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public AccountBalance(Account account, BigDecimal debitTotal, BigDecimal creditTotal) {
        this.account = Objects.requireNonNull(account, "account");
        this.debitTotal = Objects.requireNonNull(debitTotal, "debitTotal");
        this.creditTotal = Objects.requireNonNull(creditTotal, "creditTotal");
    }

    public Account getAccount() {
        return account;
    }

    public BigDecimal getDebitTotal() {
        return debitTotal;
    }

    public BigDecimal getCreditTotal() {
        return creditTotal;
    }

    /** Debits minus credits. */
    public BigDecimal getNet() {
        return debitTotal.subtract(creditTotal);
    }

    /** Balance on the account's normal side; negative when the account is on its contra side. */
    public BigDecimal getNaturalBalance() {
        return account.getCategory().isDebitNormal() ? getNet() : getNet().negate();
    }
}
