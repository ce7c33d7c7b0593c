package com.programmersdiary.taskdaemon.dispatch;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Map<ActionKind, ActionHandler<?>> handlers = new EnumMap<>(ActionKind.class);

    @Autowired
    public ActionDispatcher(ObjectProvider<ActionHandler<?>> handlers) {
        this(handlers.orderedStream().toList());
    }

    public ActionDispatcher(List<? extends ActionHandler<?>> handlers) {
        for (var handler : handlers) {
            var previous = this.handlers.putIfAbsent(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.kind() + ": "
                        + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
    }

    @PostConstruct
    void reportMissingHandlers() {
        Arrays.stream(ActionKind.values())
                .filter(kind -> !handlers.containsKey(kind))
                .forEach(kind -> log.warn("No handler registered for action kind {}; such tasks will fail to dispatch", kind));
    }

    public Set<ActionKind> supportedKinds() {
        return Set.copyOf(handlers.keySet());
    }

    public DispatchResult dispatch(TaskAction action) {
        if (action == null) {
            return DispatchResult.failed("No action to dispatch");
        }
        var handler = handlers.get(action.kind());
        if (handler == null) {
            return DispatchResult.failed("No handler registered for " + action.kind());
        }
        try {
            invoke(handler, action);
            return DispatchResult.success();
        } catch (Exception e) {
            log.debug("Handler for {} failed", action.kind(), e);
            return DispatchResult.failed(e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <A extends TaskAction> void invoke(ActionHandler<A> handler, TaskAction action) throws Exception {
        handler.handle((A) handler.kind().actionType().cast(action));
    }
}
