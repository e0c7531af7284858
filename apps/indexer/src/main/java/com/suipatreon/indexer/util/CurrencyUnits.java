package com.suipatreon.indexer.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Payment token units. Prices and amounts are stored in base units (USDC, 6 decimals).
 */
public final class CurrencyUnits {

    public static final int CURRENCY_DECIMALS = 6;
    public static final String CURRENCY_NAME = "USDC";

    private CurrencyUnits() {
    }

    public static BigDecimal toStandardUnit(BigInteger baseUnits) {
        return new BigDecimal(baseUnits, CURRENCY_DECIMALS);
    }

    public static String format(BigInteger baseUnits) {
        return toStandardUnit(baseUnits).setScale(2, RoundingMode.HALF_UP).toPlainString() + " " + CURRENCY_NAME;
    }
}
