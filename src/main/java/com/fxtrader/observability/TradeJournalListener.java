package com.fxtrader.observability;

import com.fxtrader.domain.model.TradeInfo;
import com.fxtrader.event.OrderEvent;
import com.fxtrader.event.OrderEventType;
import com.fxtrader.event.TradeExecutedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Writes executions and venue rejections to the decision log. */
@Component
public class TradeJournalListener {

    private final DecisionLogger decisionLogger;

    public TradeJournalListener(DecisionLogger decisionLogger) {
        this.decisionLogger = decisionLogger;
    }

    @EventListener
    public void onTradeExecuted(TradeExecutedEvent event) {
        TradeInfo trade = event.getTradeInfo();
        String action = "OPEN".equals(trade.getComment())
                ? trade.getSide().name()
                : "CLOSE " + trade.getComment() + " P&L " + trade.getProfitLoss().toPlainString();
        decisionLogger.trade(
                trade.getSymbol(),
                action,
                trade.getPrice(),
                trade.getVolume(),
                trade.getStopLoss(),
                trade.getTakeProfit());
    }

    @EventListener
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() != OrderEventType.REJECTED) {
            return;
        }
        String reason = event.getRejection()
                .map(Throwable::getMessage)
                .orElse("Order " + event.getOrder().getId() + " rejected: " + event.getOrder().getRejectionReason());
        decisionLogger.error(event.getOrder().getSymbol(), reason);
    }
}
