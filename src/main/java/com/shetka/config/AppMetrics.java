package com.shetka.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics.
 *
 * Key metrics (see /actuator/metrics):
 * - orders.db.list     → owner order list query time
 * - orders.db.upsert   → upsert statement time
 * - orders.upserted    → successful admin upserts
 * - orders.listed      → order lists served to WebApp users
 * - auth.rejected      → 401 responses, tagged by endpoint
 */
@Component
@Getter
public class AppMetrics {

    private final Timer listQueryTimer;
    private final Timer upsertTimer;

    private final Counter ordersUpsertedCounter;
    private final Counter ordersListedCounter;
    private final Counter userAuthRejectedCounter;
    private final Counter adminAuthRejectedCounter;

    public AppMetrics(MeterRegistry registry) {
        this.listQueryTimer = Timer.builder("orders.db.list")
                .description("Orders-by-owner query time")
                .tag("database", "postgresql")
                .register(registry);

        this.upsertTimer = Timer.builder("orders.db.upsert")
                .description("Order upsert statement time")
                .tag("database", "postgresql")
                .register(registry);

        this.ordersUpsertedCounter = Counter.builder("orders.upserted")
                .description("Orders created or updated through the admin endpoint")
                .register(registry);

        this.ordersListedCounter = Counter.builder("orders.listed")
                .description("Order lists returned to WebApp users")
                .register(registry);

        this.userAuthRejectedCounter = Counter.builder("auth.rejected")
                .description("Rejected initData payloads")
                .tag("endpoint", "me")
                .register(registry);

        this.adminAuthRejectedCounter = Counter.builder("auth.rejected")
                .description("Rejected admin tokens")
                .tag("endpoint", "admin")
                .register(registry);
    }

    public void recordListQueryTime(long millis) {
        listQueryTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordUpsertTime(long millis) {
        upsertTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementOrdersUpserted() {
        ordersUpsertedCounter.increment();
    }

    public void incrementOrdersListed() {
        ordersListedCounter.increment();
    }

    public void incrementUserAuthRejected() {
        userAuthRejectedCounter.increment();
    }

    public void incrementAdminAuthRejected() {
        adminAuthRejectedCounter.increment();
    }
}
