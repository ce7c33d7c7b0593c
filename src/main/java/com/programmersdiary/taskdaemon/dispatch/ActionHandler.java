package com.programmersdiary.taskdaemon.dispatch;

public interface ActionHandler<A extends TaskAction> {

    ActionKind kind();

    void handle(A action) throws Exception;
}
