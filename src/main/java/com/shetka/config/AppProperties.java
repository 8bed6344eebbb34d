package com.shetka.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration properties bound from application.yml.
 *
 * The secrets are fed from environment variables (BOT_TOKEN, ADMIN_API_TOKEN,
 * DATABASE_URL, WEBAPP_ORIGINS); blank required values abort startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private Telegram telegram = new Telegram();
    @Valid
    private Admin admin = new Admin();
    @Valid
    private Db db = new Db();
    private Cors cors = new Cors();

    @Data
    public static class Telegram {
        @NotBlank(message = "BOT_TOKEN env is required")
        private String botToken;

        /** Zero disables the auth_date freshness check. */
        private Duration initDataMaxAge = Duration.ZERO;
    }

    @Data
    public static class Admin {
        @NotBlank(message = "ADMIN_API_TOKEN env is required")
        private String apiToken;
    }

    @Data
    public static class Db {
        @NotBlank(message = "DATABASE_URL env is required")
        private String url;

        private String dialect = "postgresql";

        @Valid
        private Pool pool = new Pool();
    }

    @Data
    public static class Pool {
        @Min(1)
        private int maxSize = 5;
        @Min(0)
        private int minIdle = 1;
    }

    @Data
    public static class Cors {
        private String origins = "";

        /**
         * Parsed allow-list; empty means every origin is allowed.
         */
        public List<String> originList() {
            if (origins == null || origins.isBlank()) {
                return List.of();
            }
            return Arrays.stream(origins.split(","))
                    .map(String::trim)
                    .filter(o -> !o.isEmpty())
                    .toList();
        }
    }
}
