package com.comanda.orderservice.event;

import com.comanda.orderservice.model.MenuItem;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Raised inside the stock transaction when a tracked item drops to or below
 * its low-stock threshold. The listener turns it into an outbox row, so the
 * alert is only published if the transaction commits.
 */
@Getter
public class StockLevelEvent extends ApplicationEvent {

    public static final String LOW = "stock.low";
    public static final String DEPLETED = "stock.depleted";

    private final MenuItem menuItem;
    private final String routingKey;

    public StockLevelEvent(Object source, MenuItem menuItem, String routingKey) {
        super(source);
        this.menuItem = menuItem;
        this.routingKey = routingKey;
    }
}
