package com.flexledger.ledger;

/**
 * Fixed chart of accounts for an investment holding company reporting under historical cost.
 * Codes are stable and drive the ordering of the trial balance.
 */
public enum Account {
    CASH_REPORTING("1100", "Cash at Bank - Reporting CCY", AccountCategory.ASSET),
    CASH_USD("1101", "Cash at Bank - USD", AccountCategory.ASSET),
    CASH_OTHER_CURRENCY("1102", "Cash at Bank - Other CCY", AccountCategory.ASSET),
    CASH_SECONDARY("1103", "Cash at Bank - Other", AccountCategory.ASSET),
    INVESTMENTS_AT_COST("1200", "Listed Investments at Cost", AccountCategory.ASSET),
    ACCRUALS("2100", "Accruals and Deferred Income", AccountCategory.LIABILITY),
    OWNERS_LOAN("2101", "Director's / Owner's Loan", AccountCategory.LIABILITY),
    SHARE_CAPITAL("3000", "Share Capital", AccountCategory.EQUITY),
    RETAINED_EARNINGS("3100", "Retained Earnings B/F", AccountCategory.EQUITY),
    PROFIT_FOR_PERIOD("3200", "Profit/(Loss) for Period", AccountCategory.EQUITY),
    DIVIDEND_INCOME("4000", "Dividend Income (Gross)", AccountCategory.INCOME),
    INTEREST_RECEIVED("4100", "Bank Interest Received", AccountCategory.INCOME),
    REALIZED_GAINS("4200", "Realized Gains on Investments", AccountCategory.INCOME),
    FX_GAINS("4300", "Foreign Exchange Gains", AccountCategory.INCOME),
    WITHHOLDING_TAX("5000", "Foreign Withholding Tax", AccountCategory.EXPENSE),
    BROKER_COMMISSIONS("5100", "Broker Commissions", AccountCategory.EXPENSE),
    BROKER_FEES("5200", "Broker Fees", AccountCategory.EXPENSE),
    BANK_CHARGES("5300", "Bank Charges", AccountCategory.EXPENSE),
    REALIZED_LOSSES("5400", "Realized Losses on Investments", AccountCategory.EXPENSE),
    FX_LOSSES("5500", "Foreign Exchange Losses", AccountCategory.EXPENSE),
    INTEREST_PAID("5600", "Interest Paid", AccountCategory.EXPENSE);

    private final String code;
    private final String displayName;
    private final AccountCategory category;

    Account(String code, String displayName, AccountCategory category) {
        this.code = code;
        this.displayName = displayName;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public AccountCategory getCategory() {
        return category;
    }

    public static Account fromCode(String code) {
        for (Account account : values()) {
            if (account.code.equals(code)) {
                return account;
            }
        }
        return null;
    }
}
