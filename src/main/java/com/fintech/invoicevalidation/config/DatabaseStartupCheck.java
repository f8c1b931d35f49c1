package com.fintech.invoicevalidation.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Verifies the database connection once the application is up.
 * A failure here stops the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatabaseStartupCheck {

    private final JdbcTemplate jdbcTemplate;

    @EventListener(ApplicationReadyEvent.class)
    public void checkConnection() {
        Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        log.info("Database connection OK -> {}", result);
    }
}
