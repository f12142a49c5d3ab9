package com.flexledger.journal;

import com.flexledger.ledger.Account;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** One leg of a journal entry. Amounts are always positive; the side carries the direction. */
public final class Posting {
    private final int postingId;
    private final int entryId;
    private final LocalDate date;
    private final Account account;
    private final PostingSide side;
    private final BigDecimal amount;
    private final String memo;

    Posting(int postingId, int entryId, LocalDate date, Account account, PostingSide side, BigDecimal amount, String memo) {
        this.postingId = postingId;
        this.entryId = entryId;
        this.date = Objects.requireNonNull(date, "date");
        this.account = Objects.requireNonNull(account, "account");
        this.side = Objects.requireNonNull(side, "side");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.memo = memo == null ? "" : memo;
    }

    public int getPostingId() {
        return postingId;
    }

    public int getEntryId() {
        return entryId;
    }

    public LocalDate getDate() {
        return date;
    }

    public Account getAccount() {
        return account;
    }

    public PostingSide getSide() {
        return side;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getDebit() {
        return side == PostingSide.DEBIT ? amount : BigDecimal.ZERO;
    }

    public BigDecimal getCredit() {
        return side == PostingSide.CREDIT ? amount : BigDecimal.ZERO;
    }

    public String getMemo() {
        return memo;
    }
}
