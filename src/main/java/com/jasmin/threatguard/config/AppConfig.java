package com.jasmin.threatguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.InstantSource;

@Configuration
public class AppConfig {

    @Bean
    public InstantSource instantSource() {
        return InstantSource.system();
    }
}
