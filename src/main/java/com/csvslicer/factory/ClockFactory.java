package com.csvslicer.factory;

import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class ClockFactory {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
