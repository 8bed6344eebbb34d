package com.shetka.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shetka.config.AppMetrics;
import com.shetka.error.AuthException;
import com.shetka.model.ApiResponses;
import com.shetka.model.OrderInput;
import com.shetka.model.OrderUpsertRequest;
import com.shetka.service.OrderService;
import com.shetka.service.auth.AdminTokenGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin order maintenance.
 *
 * POST /api/admin/order/upsert with X-Admin-Token and a JSON order body.
 * The body is taken raw and only parsed once the token has been accepted,
 * so unauthenticated callers always get 401 whatever they send.
 */
@RestController
@RequestMapping("/api/admin/order")
@RequiredArgsConstructor
public class AdminOrderController {

    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final AdminTokenGuard adminTokenGuard;
    private final OrderService orderService;
    private final AppMetrics metrics;
    private final ObjectMapper objectMapper;

    @PostMapping("/upsert")
    public ApiResponses.Ok upsert(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false, defaultValue = "") String adminToken,
            @RequestBody(required = false) String body) throws JsonProcessingException {
        try {
            adminTokenGuard.require(adminToken);
        } catch (AuthException e) {
            metrics.incrementAdminAuthRejected();
            throw e;
        }

        OrderInput input = parse(body).toInput();
        orderService.upsert(input);
        return ApiResponses.Ok.INSTANCE;
    }

    private OrderUpsertRequest parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return emptyRequest();
        }
        OrderUpsertRequest request = objectMapper.readValue(body, OrderUpsertRequest.class);
        // a literal JSON null body
        return request == null ? emptyRequest() : request;
    }

    private static OrderUpsertRequest emptyRequest() {
        return new OrderUpsertRequest(null, null, null, null, null, null, null, null);
    }
}
