package com.programmersdiary.taskdaemon.dispatch;

public enum ActionKind {
    SEND_MESSAGE(TaskAction.SendMessage.class),
    PLACE_ORDER(TaskAction.PlaceOrder.class),
    EMAIL_SUMMARY(TaskAction.EmailSummary.class);

    private final Class<? extends TaskAction> actionType;

    ActionKind(Class<? extends TaskAction> actionType) {
        this.actionType = actionType;
    }

    public Class<? extends TaskAction> actionType() {
        return actionType;
    }
}
