package com.hindsight.core.model;

/**
 * Order as submitted by a strategy, before the simulated exchange accepts it.
 *
 * @param price        limit price, required for LIMIT
 * @param triggerPrice trigger price, required for STOP_MARKET
 */
public record OrderRequest(
    Symbol symbol,
    OrderSide side,
    OrderType type,
    double quantity,
    Double price,
    Double triggerPrice,
    String clientOrderId
) {
    public static OrderRequest market(Symbol symbol, OrderSide side, double quantity) {
        return builder().symbol(symbol).side(side).type(OrderType.MARKET).quantity(quantity).build();
    }

    public static OrderRequest limit(Symbol symbol, OrderSide side, double quantity, double price) {
        return builder().symbol(symbol).side(side).type(OrderType.LIMIT).quantity(quantity).price(price).build();
    }

    public static OrderRequest stop(Symbol symbol, OrderSide side, double quantity, double triggerPrice) {
        return builder().symbol(symbol).side(side).type(OrderType.STOP_MARKET)
            .quantity(quantity).triggerPrice(triggerPrice).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Symbol symbol;
        private OrderSide side;
        private OrderType type = OrderType.MARKET;
        private double quantity;
        private Double price;
        private Double triggerPrice;
        private String clientOrderId;

        public Builder symbol(Symbol symbol) { this.symbol = symbol; return this; }
        public Builder side(OrderSide side) { this.side = side; return this; }
        public Builder type(OrderType type) { this.type = type; return this; }
        public Builder quantity(double quantity) { this.quantity = quantity; return this; }
        public Builder price(Double price) { this.price = price; return this; }
        public Builder triggerPrice(Double triggerPrice) { this.triggerPrice = triggerPrice; return this; }
        public Builder clientOrderId(String clientOrderId) { this.clientOrderId = clientOrderId; return this; }

        public OrderRequest build() {
            if (symbol == null) throw new IllegalArgumentException("symbol is required");
            if (side == null) throw new IllegalArgumentException("side is required");
            if (type == null) throw new IllegalArgumentException("type is required");
            return new OrderRequest(symbol, side, type, quantity, price, triggerPrice, clientOrderId);
        }
    }
}
