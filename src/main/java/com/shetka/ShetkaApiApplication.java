package com.shetka;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Shetka API.
 *
 * Serves the Telegram WebApp order list and the admin order upsert endpoint.
 * Startup fails fast when BOT_TOKEN, ADMIN_API_TOKEN or DATABASE_URL is missing.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ShetkaApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShetkaApiApplication.class, args);
    }
}
