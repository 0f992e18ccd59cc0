package com.infomedia.abacox.storemigration.config;

import com.infomedia.abacox.storemigration.component.ratelimit.TimeSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeSourceConfiguration {

    @Bean
    public TimeSource timeSource() {
        return TimeSource.SYSTEM;
    }
}
