package com.shetka.repository;

import com.shetka.config.JacksonConfig;
import com.shetka.model.Order;
import com.shetka.model.OrderInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Repository against a real PostgreSQL with the default dialect, i.e. the
 * INSERT ... ON CONFLICT upsert that production runs. Skipped where Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class OrderRepositoryPostgresTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static final Instant T1 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T11:30:00Z");
    private static final Instant T3 = Instant.parse("2024-03-02T08:15:00Z");

    private NamedParameterJdbcTemplate jdbcTemplate;
    private SqlTemplateLoader loader;
    private Clock clock;
    private OrderRepository repo;

    @BeforeEach
    void setup() {
        DriverManagerDataSource ds = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        this.jdbcTemplate = new NamedParameterJdbcTemplate(ds);

        jdbcTemplate.getJdbcTemplate().execute("DROP TABLE IF EXISTS orders, users");
        SchemaScript.apply(jdbcTemplate.getJdbcTemplate());

        this.clock = mock(Clock.class);
        this.loader = new SqlTemplateLoader(new DefaultResourceLoader(), "postgresql");
        ServicesJsonCodec codec = new ServicesJsonCodec(new JacksonConfig().objectMapper());
        this.repo = new OrderRepository(jdbcTemplate, loader, codec, clock);
    }

    @Test
    void defaultDialect_usesOnConflictUpsert() {
        assertThat(loader.load("upsertOrder")).contains("ON CONFLICT (public_no)");
    }

    @Test
    void upsert_samePublicNoTwice_keepsCreatedAtAndAdvancesUpdatedAt() {
        when(clock.instant()).thenReturn(T1, T2);

        repo.upsert(input("A-100", 42L, "Jacket", "accepted", List.of("wash")));
        repo.upsert(input("A-100", 42L, "Coat", "ready", List.of("wash", "iron")));

        Integer count = jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM orders WHERE public_no = 'A-100'", Integer.class);
        assertThat(count).isEqualTo(1);

        Order order = repo.listByOwner(42L).get(0);
        assertThat(order.item()).isEqualTo("Coat");
        assertThat(order.status()).isEqualTo("ready");
        assertThat(order.services()).containsExactly("wash", "iron");
        assertThat(order.createdAt().toInstant()).isEqualTo(T1);
        assertThat(order.updatedAt().toInstant()).isEqualTo(T2);
    }

    @Test
    void upsert_overwritesOptionalFieldsWithNulls() {
        when(clock.instant()).thenReturn(T1, T2);

        repo.upsert(new OrderInput("A-200", 42L, "+79990001122", "Boots", List.of("polish"), "accepted", 1500, "urgent"));
        repo.upsert(new OrderInput("A-200", 42L, null, "Boots", List.of(), "accepted", null, null));

        Order order = repo.listByOwner(42L).get(0);
        assertThat(order.ownerPhone()).isNull();
        assertThat(order.price()).isNull();
        assertThat(order.comment()).isNull();
        assertThat(order.services()).isEmpty();
    }

    @Test
    void listByOwner_returnsNewestFirstAndOnlyOwnOrders() {
        when(clock.instant()).thenReturn(T2, T1, T3, T3);

        repo.upsert(input("B-2", 7L, "Shirt", "accepted", List.of()));
        repo.upsert(input("B-1", 7L, "Dress", "accepted", List.of()));
        repo.upsert(input("B-3", 7L, "Suit", "accepted", List.of()));
        repo.upsert(input("C-1", 8L, "Scarf", "accepted", List.of()));

        assertThat(repo.listByOwner(7L)).extracting(Order::publicNo).containsExactly("B-3", "B-2", "B-1");
        assertThat(repo.listByOwner(999L)).isEmpty();
    }

    @Test
    void upsert_storesNonAsciiServicesAsJsonArray() {
        when(clock.instant()).thenReturn(T1);

        repo.upsert(input("D-2", 5L, "Пальто", "принят", List.of("чистка", "wash", "чистка")));

        String raw = jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT services_json FROM orders WHERE public_no = 'D-2'", String.class);
        assertThat(raw).isEqualTo("[\"чистка\",\"wash\",\"чистка\"]");
    }

    private static OrderInput input(String publicNo, Long owner, String item, String status, List<String> services) {
        return new OrderInput(publicNo, owner, null, item, services, status, null, null);
    }
}
