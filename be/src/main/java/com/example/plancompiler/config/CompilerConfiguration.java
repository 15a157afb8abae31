package com.example.plancompiler.config;

import com.example.plancompiler.compiler.CompilerSettings;
import com.example.plancompiler.compiler.StateMachineCompiler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public CompilerSettings compilerSettings(
            @Value("${plan-compiler.callback-resource:" + CompilerSettings.DEFAULT_CALLBACK_RESOURCE + "}") String callbackResource,
            @Value("${plan-compiler.max-wait-seconds:" + CompilerSettings.DEFAULT_MAX_WAIT_SECONDS + "}") int maxWaitSeconds) {
        return new CompilerSettings(callbackResource, maxWaitSeconds);
    }

    @Bean
    public StateMachineCompiler stateMachineCompiler(CompilerSettings compilerSettings) {
        return new StateMachineCompiler(compilerSettings);
    }
}
