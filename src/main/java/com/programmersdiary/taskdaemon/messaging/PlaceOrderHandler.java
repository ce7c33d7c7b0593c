package com.programmersdiary.taskdaemon.messaging;

import com.programmersdiary.taskdaemon.dispatch.ActionHandler;
import com.programmersdiary.taskdaemon.dispatch.ActionKind;
import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "taskdaemon.telegram.enabled", havingValue = "true")
public class PlaceOrderHandler implements ActionHandler<TaskAction.PlaceOrder> {

    private static final Logger log = LoggerFactory.getLogger(PlaceOrderHandler.class);

    private final TelegramClient telegramClient;

    public PlaceOrderHandler(TelegramClient telegramClient) {
        this.telegramClient = telegramClient;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.PLACE_ORDER;
    }

    @Override
    public void handle(TaskAction.PlaceOrder order) {
        if (order.storeIdentifier() == null || order.storeIdentifier().isBlank()) {
            throw new IllegalArgumentException("Order has no store");
        }
        telegramClient.sendMessage(order.storeIdentifier(),
                "🛒 New order from buyer " + order.buyerChatId() + ": " + order.item());
        log.info("Order for '{}' sent to store {}", order.item(), order.storeIdentifier());
        try {
            telegramClient.sendMessage(order.buyerChatId(),
                    "✅ Your order for " + order.item() + " was sent to " + order.storeIdentifier() + ".");
        } catch (RuntimeException e) {
            // the order itself went through
            log.warn("Could not confirm order to buyer {}: {}", order.buyerChatId(), e.getMessage());
        }
    }
}
