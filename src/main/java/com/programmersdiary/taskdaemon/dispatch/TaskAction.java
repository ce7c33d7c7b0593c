package com.programmersdiary.taskdaemon.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskAction.SendMessage.class, name = "SEND_MESSAGE"),
        @JsonSubTypes.Type(value = TaskAction.PlaceOrder.class, name = "PLACE_ORDER"),
        @JsonSubTypes.Type(value = TaskAction.EmailSummary.class, name = "EMAIL_SUMMARY")
})
public sealed interface TaskAction permits TaskAction.SendMessage, TaskAction.PlaceOrder, TaskAction.EmailSummary {

    @JsonIgnore
    ActionKind kind();

    @JsonIgnore
    String summary();

    record SendMessage(String chatId, String text) implements TaskAction {
        @Override
        public ActionKind kind() {
            return ActionKind.SEND_MESSAGE;
        }

        @Override
        public String summary() {
            return text != null ? text : "";
        }
    }

    record PlaceOrder(String buyerChatId, String storeIdentifier, String item) implements TaskAction {
        @Override
        public ActionKind kind() {
            return ActionKind.PLACE_ORDER;
        }

        @Override
        public String summary() {
            return "Order " + item + " from " + storeIdentifier;
        }
    }

    record EmailSummary(String chatId, int maxResults) implements TaskAction {
        public static final int DEFAULT_MAX_RESULTS = 5;

        public EmailSummary {
            if (maxResults <= 0) maxResults = DEFAULT_MAX_RESULTS;
        }

        @Override
        public ActionKind kind() {
            return ActionKind.EMAIL_SUMMARY;
        }

        @Override
        public String summary() {
            return "Email summary (" + maxResults + " latest)";
        }
    }
}
