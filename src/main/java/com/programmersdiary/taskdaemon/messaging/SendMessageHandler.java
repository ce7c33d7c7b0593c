package com.programmersdiary.taskdaemon.messaging;

import com.programmersdiary.taskdaemon.dispatch.ActionHandler;
import com.programmersdiary.taskdaemon.dispatch.ActionKind;
import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "taskdaemon.telegram.enabled", havingValue = "true")
public class SendMessageHandler implements ActionHandler<TaskAction.SendMessage> {

    private final TelegramClient telegramClient;

    public SendMessageHandler(TelegramClient telegramClient) {
        this.telegramClient = telegramClient;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SEND_MESSAGE;
    }

    @Override
    public void handle(TaskAction.SendMessage action) {
        if (action.chatId() == null || action.chatId().isBlank()) {
            throw new IllegalArgumentException("Reminder has no chat id");
        }
        telegramClient.sendMessage(action.chatId(), "⏰ " + action.text());
    }
}
