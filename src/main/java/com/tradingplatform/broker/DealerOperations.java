package com.tradingplatform.broker;

import com.tradingplatform.domain.model.Order;
import com.tradingplatform.domain.model.Position;
import java.util.List;

/**
 * Optional capability of connectors whose venue supports dealer accounts acting on behalf
 * of client accounts. Exposed through {@link BrokerConnector#dealerOperations()}.
 */
public interface DealerOperations {

    /**
     * Places {@code order} on the account of {@code clientId}.
     *
     * @return the venue order id
     * @throws com.tradingplatform.exception.BrokerException if the venue rejects the order
     */
    String placeDealerOrder(String clientId, Order order);

    List<BrokerOrder> getDealerOrderBook(String clientId);

    List<Position> getDealerPositions(String clientId);
}
