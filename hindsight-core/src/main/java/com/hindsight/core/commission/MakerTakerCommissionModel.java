package com.hindsight.core.commission;

import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.LiquiditySide;

/**
 * Separate rates for adding and removing liquidity, as fractions of notional.
 */
public class MakerTakerCommissionModel implements CommissionModel {

    public static final double DEFAULT_MAKER_RATE = 0.00025;
    public static final double DEFAULT_TAKER_RATE = 0.00075;

    private final double makerRate;
    private final double takerRate;

    public MakerTakerCommissionModel() {
        this(DEFAULT_MAKER_RATE, DEFAULT_TAKER_RATE);
    }

    public MakerTakerCommissionModel(double makerRate, double takerRate) {
        this.makerRate = makerRate;
        this.takerRate = takerRate;
    }

    @Override
    public double calculateForNotional(Instrument instrument, double notional, LiquiditySide liquiditySide) {
        double rate = liquiditySide == LiquiditySide.MAKER ? makerRate : takerRate;
        return CommissionModel.roundMoney(Math.abs(notional) * rate);
    }

    public double getMakerRate() {
        return makerRate;
    }

    public double getTakerRate() {
        return takerRate;
    }
}
