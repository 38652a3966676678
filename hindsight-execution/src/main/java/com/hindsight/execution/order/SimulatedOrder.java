package com.hindsight.execution.order;

import com.hindsight.core.model.Fill;
import com.hindsight.core.model.OrderRequest;
import com.hindsight.core.model.OrderSide;
import com.hindsight.core.model.OrderStatus;
import com.hindsight.core.model.OrderType;
import com.hindsight.core.model.Symbol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Order state held by the simulated exchange. Times are simulated time.
 */
public class SimulatedOrder {

    private final String orderId;
    private final String strategyId;
    private final OrderRequest request;
    private final Instant createdAt;

    private OrderStatus status = OrderStatus.WORKING;
    private double filledQuantity;
    private double avgFillPrice;
    private final List<Fill> fills = new ArrayList<>();
    private Instant updatedAt;
    private String reason;

    public SimulatedOrder(String orderId, String strategyId, OrderRequest request, Instant createdAt) {
        this.orderId = orderId;
        this.strategyId = strategyId;
        this.request = request;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void applyFill(Fill fill) {
        fills.add(fill);
        double totalValue = avgFillPrice * filledQuantity + fill.price() * fill.quantity();
        filledQuantity += fill.quantity();
        avgFillPrice = filledQuantity > 0 ? totalValue / filledQuantity : 0;
        updatedAt = fill.timestamp();
        if (filledQuantity >= request.quantity()) {
            status = OrderStatus.FILLED;
        }
    }

    public void cancel(Instant time) {
        status = OrderStatus.CANCELLED;
        updatedAt = time;
    }

    public void reject(String reason, Instant time) {
        this.status = OrderStatus.REJECTED;
        this.reason = reason;
        this.updatedAt = time;
    }

    public String getOrderId() { return orderId; }
    public String getStrategyId() { return strategyId; }
    public OrderRequest getRequest() { return request; }
    public Symbol getSymbol() { return request.symbol(); }
    public OrderSide getSide() { return request.side(); }
    public OrderType getType() { return request.type(); }
    public double getQuantity() { return request.quantity(); }
    public OrderStatus getStatus() { return status; }
    public double getFilledQuantity() { return filledQuantity; }
    public double getAvgFillPrice() { return avgFillPrice; }
    public List<Fill> getFills() { return List.copyOf(fills); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public String getReason() { return reason; }

    public boolean isWorking() {
        return status == OrderStatus.WORKING;
    }

    public double getRemainingQuantity() {
        return request.quantity() - filledQuantity;
    }

    @Override
    public String toString() {
        return orderId + " " + request.side() + " " + request.quantity() + " " + request.symbol()
            + " " + request.type() + " " + status;
    }
}
