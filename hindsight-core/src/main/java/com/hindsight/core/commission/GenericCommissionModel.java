package com.hindsight.core.commission;

import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.LiquiditySide;

/**
 * Flat rate in basis points of notional, with an optional minimum per fill.
 */
public class GenericCommissionModel implements CommissionModel {

    public static final double DEFAULT_RATE_BP = 0.20;

    private final double rateBp;
    private final double minimum;

    public GenericCommissionModel() {
        this(DEFAULT_RATE_BP, 0.0);
    }

    public GenericCommissionModel(double rateBp, double minimum) {
        if (rateBp < 0) throw new IllegalArgumentException("rateBp must not be negative");
        if (minimum < 0) throw new IllegalArgumentException("minimum must not be negative");
        this.rateBp = rateBp;
        this.minimum = minimum;
    }

    @Override
    public double calculateForNotional(Instrument instrument, double notional, LiquiditySide liquiditySide) {
        double commission = Math.abs(notional) * rateBp * 0.0001;
        return CommissionModel.roundMoney(Math.max(commission, minimum));
    }

    public double getRateBp() {
        return rateBp;
    }

    public double getMinimum() {
        return minimum;
    }
}
