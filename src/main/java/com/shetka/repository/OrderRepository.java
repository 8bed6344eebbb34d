package com.shetka.repository;

import com.shetka.error.InfrastructureException;
import com.shetka.model.Order;
import com.shetka.model.OrderInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;

/**
 * Orders table access.
 *
 * SQL text comes from sql/queries.sql via {@link SqlTemplateLoader}. Failures are not retried;
 * any {@link DataAccessException} surfaces as {@link InfrastructureException}.
 */
@Repository
@Slf4j
public class OrderRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final ServicesJsonCodec servicesCodec;
    private final Clock clock;

    private final RowMapper<Order> orderRowMapper;

    public OrderRepository(
            NamedParameterJdbcTemplate jdbcTemplate,
            SqlTemplateLoader sqlLoader,
            ServicesJsonCodec servicesCodec,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.servicesCodec = servicesCodec;
        this.clock = clock;
        this.orderRowMapper = (rs, rowNum) -> new Order(
                rs.getLong("id"),
                rs.getString("public_no"),
                rs.getObject("owner_tg_id", Long.class),
                rs.getString("owner_phone"),
                rs.getString("item"),
                servicesCodec.decode(rs.getString("services_json")),
                rs.getString("status"),
                rs.getObject("price", Integer.class),
                rs.getString("comment"),
                rs.getBoolean("is_closed"),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    /**
     * Orders owned by a Telegram user, newest first. Empty when the user has none.
     */
    public List<Order> listByOwner(long ownerTgId) {
        return execute("listOrdersByOwner", () -> {
            String sql = sqlLoader.load("listOrdersByOwner");
            MapSqlParameterSource params = new MapSqlParameterSource("ownerTgId", ownerTgId);
            return jdbcTemplate.query(sql, params, orderRowMapper);
        });
    }

    /**
     * Insert-or-update by public number in a single statement.
     * On conflict every mutable field is overwritten and updated_at refreshed; created_at is kept.
     */
    public void upsert(OrderInput input) {
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("publicNo", input.publicNo(), Types.VARCHAR)
                .addValue("ownerTgId", input.ownerTgId(), Types.BIGINT)
                .addValue("ownerPhone", input.ownerPhone(), Types.VARCHAR)
                .addValue("item", input.item(), Types.VARCHAR)
                .addValue("servicesJson", servicesCodec.encode(input.services()), Types.VARCHAR)
                .addValue("status", input.status(), Types.VARCHAR)
                .addValue("price", input.price(), Types.INTEGER)
                .addValue("comment", input.comment(), Types.VARCHAR)
                .addValue("now", now, Types.TIMESTAMP_WITH_TIMEZONE);

        int rows = execute("upsertOrder", () -> jdbcTemplate.update(sqlLoader.load("upsertOrder"), params));
        log.debug("Upserted order publicNo={} ({} row(s) affected)", input.publicNo(), rows);
    }

    private <T> T execute(String operationName, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            log.error("Operation '{}' failed: {}", operationName, e.getMessage());
            throw new InfrastructureException("Database operation failed: " + operationName, e);
        }
    }
}
