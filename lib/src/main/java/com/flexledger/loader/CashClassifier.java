package com.flexledger.loader;

import com.flexledger.ledger.CashKind;
import java.util.Locale;

/** Keyword classification of the cash transaction {@code Type} column. */
public final class CashClassifier {

    private CashClassifier() {}

    public static CashKind classify(String type) {
        String text = type == null ? "" : type.toLowerCase(Locale.ROOT);
        if (text.contains("dividend") && !text.contains("withhold")) {
            return CashKind.DIVIDEND;
        }
        if (text.contains("withhold") || text.contains("tax")) {
            return CashKind.WITHHOLDING_TAX;
        }
        if (text.contains("interest")) {
            return CashKind.INTEREST;
        }
        if (text.contains("fee") || text.contains("commission")) {
            return CashKind.FEE;
        }
        if (text.contains("deposit") || text.contains("withdraw") || text.contains("transfer")) {
            return CashKind.CAPITAL;
        }
        return CashKind.OTHER;
    }
}
