package com.hindsight.core.commission;

import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.LiquiditySide;

/**
 * Calculates the commission charged for a fill.
 */
public interface CommissionModel {

    /**
     * Commission for a fill, in account currency.
     *
     * @param exchangeRate rate converting the instrument's quote currency into account currency
     */
    default double calculate(Instrument instrument, double quantity, double fillPrice,
                             double exchangeRate, LiquiditySide liquiditySide) {
        double notional = quantity * fillPrice * exchangeRate;
        return calculateForNotional(instrument, notional, liquiditySide);
    }

    /**
     * Commission for a notional value already expressed in account currency.
     */
    double calculateForNotional(Instrument instrument, double notional, LiquiditySide liquiditySide);

    /**
     * Round a monetary amount to cents.
     */
    static double roundMoney(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
