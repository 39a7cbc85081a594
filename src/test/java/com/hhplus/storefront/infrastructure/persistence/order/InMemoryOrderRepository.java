package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderItem;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory Order Repository (테스트용)
 * ID는 JPA와 같이 저장 시점에 부여된다.
 */
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final AtomicLong orderIdGenerator = new AtomicLong(1);
    private final AtomicLong orderItemIdGenerator = new AtomicLong(1);

    @Override
    public Order save(Order order) {
        if (order.getOrderId() == null) {
            ReflectionTestUtils.setField(order, "orderId", orderIdGenerator.getAndIncrement());
        }
        for (OrderItem item : order.getOrderItems()) {
            if (item.getOrderItemId() == null) {
                ReflectionTestUtils.setField(item, "orderItemId", orderItemIdGenerator.getAndIncrement());
            }
        }
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findAllByUserIdWithItems(Long userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .sorted(Comparator.comparing(Order::getCreatedAt)
                        .thenComparing(Order::getOrderId)
                        .reversed())
                .collect(Collectors.toList());
    }

    @Override
    public long countByUserId(Long userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .count();
    }
}
