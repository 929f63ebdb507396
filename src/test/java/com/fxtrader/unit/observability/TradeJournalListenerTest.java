package com.fxtrader.unit.observability;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.enums.OrderType;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.TradeInfo;
import com.fxtrader.event.OrderEvent;
import com.fxtrader.event.OrderEventType;
import com.fxtrader.event.TradeExecutedEvent;
import com.fxtrader.exception.VenueRejectionException;
import com.fxtrader.observability.DecisionLogger;
import com.fxtrader.observability.TradeJournalListener;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeJournalListenerTest {

    @Mock
    private DecisionLogger decisionLogger;

    private TradeJournalListener listener;

    @BeforeEach
    void setUp() {
        listener = new TradeJournalListener(decisionLogger);
    }

    private static TradeInfo trade(OrderSide side, String comment, String pnl) {
        return TradeInfo.builder()
                .orderId("ORD-1")
                .symbol("EURUSD")
                .side(side)
                .orderType(OrderType.MARKET)
                .volume(new BigDecimal("0.20"))
                .price(new BigDecimal("1.1000"))
                .profitLoss(new BigDecimal(pnl))
                .stopLoss(new BigDecimal("1.0950"))
                .takeProfit(new BigDecimal("1.1100"))
                .comment(comment)
                .build();
    }

    @Test
    void openingTrade_loggedWithItsSide() {
        listener.onTradeExecuted(new TradeExecutedEvent(this, trade(OrderSide.BUY, "OPEN", "0")));

        verify(decisionLogger)
                .trade(
                        "EURUSD",
                        "BUY",
                        new BigDecimal("1.1000"),
                        new BigDecimal("0.20"),
                        new BigDecimal("1.0950"),
                        new BigDecimal("1.1100"));
    }

    @Test
    void protectiveExit_loggedWithReasonAndPnl() {
        listener.onTradeExecuted(new TradeExecutedEvent(this, trade(OrderSide.SELL, "SL", "-100.00")));

        verify(decisionLogger)
                .trade(
                        "EURUSD",
                        "CLOSE SL P&L -100.00",
                        new BigDecimal("1.1000"),
                        new BigDecimal("0.20"),
                        new BigDecimal("1.0950"),
                        new BigDecimal("1.1100"));
    }

    @Test
    void venueRejection_loggedAsError() {
        Order order = Order.builder()
                .id("ORD-7")
                .symbol("EURUSD")
                .status(OrderStatus.REJECTED)
                .rejectionReason("Not enough free margin")
                .build();

        listener.onOrderEvent(new OrderEvent(
                this,
                order,
                OrderEventType.REJECTED,
                OrderStatus.PENDING,
                new VenueRejectionException("ORD-7", "Not enough free margin")));

        verify(decisionLogger).error("EURUSD", "Order ORD-7 rejected by venue: Not enough free margin");
    }

    @Test
    void otherOrderEvents_ignored() {
        Order order = Order.builder().id("ORD-8").symbol("EURUSD").status(OrderStatus.FILLED).build();

        listener.onOrderEvent(new OrderEvent(this, order, OrderEventType.FILLED, OrderStatus.ACCEPTED));

        verify(decisionLogger, never()).error(anyString(), any());
    }
}
