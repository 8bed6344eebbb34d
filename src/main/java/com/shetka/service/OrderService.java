package com.shetka.service;

import com.shetka.config.AppMetrics;
import com.shetka.model.Order;
import com.shetka.model.OrderInput;
import com.shetka.model.OrderView;
import com.shetka.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Order use cases behind the two endpoints: timing, counting and logging around the repository.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final AppMetrics metrics;

    public List<OrderView> listForOwner(long ownerTgId) {
        long start = System.currentTimeMillis();
        List<Order> orders = orderRepository.listByOwner(ownerTgId);
        metrics.recordListQueryTime(System.currentTimeMillis() - start);
        metrics.incrementOrdersListed();

        log.info("Listed {} order(s) for tgId={}", orders.size(), ownerTgId);
        return orders.stream().map(OrderView::from).toList();
    }

    public void upsert(OrderInput input) {
        long start = System.currentTimeMillis();
        orderRepository.upsert(input);
        metrics.recordUpsertTime(System.currentTimeMillis() - start);
        metrics.incrementOrdersUpserted();

        log.info("Upserted order publicNo={}, ownerTgId={}, status={}, services={}",
                input.publicNo(), input.ownerTgId(), input.status(), input.services().size());
    }
}
