package com.flexledger.journal;

import com.flexledger.ledger.Account;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only journal for one run. Entries are built through {@link EntryBuilder}, which refuses
 * to post an unbalanced group; nothing is edited after posting.
 */
public final class Journal {

    private final List<JournalEntry> entries = new ArrayList<>();
    private final List<Posting> postings = new ArrayList<>();

    public EntryBuilder begin(
            LocalDate date, EntryKind kind, String description, String sourceFilename, int sourceLineno) {
        return new EntryBuilder(date, kind, description, sourceFilename, sourceLineno);
    }

    public List<JournalEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Posting> getPostings() {
        return Collections.unmodifiableList(postings);
    }

    public final class EntryBuilder {
        private final LocalDate date;
        private final EntryKind kind;
        private final String description;
        private final String sourceFilename;
        private final int sourceLineno;
        private final List<Leg> legs = new ArrayList<>();
        private boolean posted;

        private EntryBuilder(
                LocalDate date, EntryKind kind, String description, String sourceFilename, int sourceLineno) {
            this.date = Objects.requireNonNull(date, "date");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.description = description == null ? "" : description;
            this.sourceFilename = sourceFilename;
            this.sourceLineno = sourceLineno;
        }

        public EntryBuilder debit(Account account, BigDecimal amount, String memo) {
            return leg(account, PostingSide.DEBIT, amount, memo);
        }

        public EntryBuilder credit(Account account, BigDecimal amount, String memo) {
            return leg(account, PostingSide.CREDIT, amount, memo);
        }

        private EntryBuilder leg(Account account, PostingSide side, BigDecimal amount, String memo) {
            Objects.requireNonNull(account, "account");
            Objects.requireNonNull(amount, "amount");
            if (amount.signum() == 0) {
                return this;
            }
            // A negative leg is the same leg on the other side.
            if (amount.signum() < 0) {
                legs.add(new Leg(account, side.opposite(), amount.negate(), memo));
            } else {
                legs.add(new Leg(account, side, amount, memo));
            }
            return this;
        }

        public JournalEntry post() {
            if (posted) {
                throw new IllegalStateException("Entry already posted: " + description);
            }
            BigDecimal debits = BigDecimal.ZERO;
            BigDecimal credits = BigDecimal.ZERO;
            for (Leg leg : legs) {
                if (leg.side == PostingSide.DEBIT) {
                    debits = debits.add(leg.amount);
                } else {
                    credits = credits.add(leg.amount);
                }
            }
            if (debits.compareTo(credits) != 0) {
                throw new IllegalStateException(
                        "Unbalanced entry '" + description + "': debits " + debits + " credits " + credits);
            }
            posted = true;
            int entryId = entries.size();
            List<Posting> entryPostings = new ArrayList<>(legs.size());
            for (Leg leg : legs) {
                Posting posting =
                        new Posting(postings.size(), entryId, date, leg.account, leg.side, leg.amount, leg.memo);
                postings.add(posting);
                entryPostings.add(posting);
            }
            JournalEntry entry =
                    new JournalEntry(entryId, date, kind, description, sourceFilename, sourceLineno, entryPostings);
            entries.add(entry);
            return entry;
        }
    }

    private record Leg(Account account, PostingSide side, BigDecimal amount, String memo) {}
}
