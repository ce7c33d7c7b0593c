package com.programmersdiary.taskdaemon.tools;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolsConfig {

    @Bean
    public ToolCallbackProvider schedulingToolCallbacks(SchedulingTools schedulingTools) {
        return MethodToolCallbackProvider.builder().toolObjects(schedulingTools).build();
    }
}
