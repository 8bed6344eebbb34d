package com.shetka.controller;

import com.shetka.config.AppMetrics;
import com.shetka.error.AuthException;
import com.shetka.model.ApiResponses;
import com.shetka.model.AuthenticatedUser;
import com.shetka.service.OrderService;
import com.shetka.service.auth.InitDataVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Orders of the Telegram user behind the WebApp session.
 *
 * GET /api/me/orders with the raw initData in X-Telegram-InitData.
 */
@RestController
@RequestMapping("/api/me")
@RequiredArgsConstructor
@Slf4j
public class MeOrdersController {

    static final String INIT_DATA_HEADER = "X-Telegram-InitData";

    private final InitDataVerifier initDataVerifier;
    private final OrderService orderService;
    private final AppMetrics metrics;

    @GetMapping("/orders")
    public ApiResponses.Orders myOrders(
            @RequestHeader(value = INIT_DATA_HEADER, required = false, defaultValue = "") String initData) {
        long tgId;
        try {
            AuthenticatedUser user = initDataVerifier.verify(initData);
            tgId = user.tgId();
            log.debug("initData verified: tgId={}, username={}", tgId, user.username());
        } catch (AuthException e) {
            metrics.incrementUserAuthRejected();
            throw e;
        }
        return ApiResponses.Orders.of(orderService.listForOwner(tgId));
    }
}
