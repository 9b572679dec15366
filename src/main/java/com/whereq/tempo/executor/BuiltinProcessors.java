package com.whereq.tempo.executor;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Registers the processors shipped with the service
 */
@Component
@RequiredArgsConstructor
public class BuiltinProcessors {

    private final ProcessorRegistry registry;

    private final Clock clock;

    @PostConstruct
    public void registerBuiltins() {
        registry.register(EchoProcessor.TYPE, new EchoProcessor());
        registry.register(SimulatedWorkProcessor.TYPE, new SimulatedWorkProcessor(clock));
    }
}
