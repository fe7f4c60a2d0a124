package org.nowstart.cadence.port;

import java.math.BigDecimal;
import org.nowstart.cadence.data.dto.OrderFill;
import org.nowstart.cadence.data.type.OrderSide;

public interface OrderPlacer {

    CollaboratorResult<OrderFill> placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, int leverage);
}
