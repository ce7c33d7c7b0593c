package com.programmersdiary.taskdaemon.dispatch;

public record DispatchResult(boolean ok, String error) {

    private static final DispatchResult OK = new DispatchResult(true, null);

    public static DispatchResult success() {
        return OK;
    }

    public static DispatchResult failed(String error) {
        return new DispatchResult(false, error);
    }

    public static DispatchResult failed(Throwable cause) {
        var message = cause.getMessage();
        return failed(message != null ? message : cause.getClass().getSimpleName());
    }
}
