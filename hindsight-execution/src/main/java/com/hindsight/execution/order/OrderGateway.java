package com.hindsight.execution.order;

import com.hindsight.core.model.OrderRequest;

import java.util.List;

/**
 * Order entry as seen by strategies.
 */
public interface OrderGateway {

    /**
     * Submit an order on behalf of a strategy.
     *
     * @throws com.hindsight.core.exception.InvalidArgumentException if the request is malformed
     *         or names an instrument outside the universe
     */
    SimulatedOrder submitOrder(String strategyId, OrderRequest request);

    /**
     * Cancel a working order. Returns false if the order is unknown or already terminal.
     */
    boolean cancelOrder(String orderId);

    List<SimulatedOrder> workingOrders(String strategyId);

    /**
     * Every order the strategy submitted, in submission order.
     */
    List<SimulatedOrder> orders(String strategyId);
}
