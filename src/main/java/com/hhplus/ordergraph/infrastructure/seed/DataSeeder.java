package com.hhplus.ordergraph.infrastructure.seed;

import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import com.hhplus.ordergraph.domain.user.User;
import com.hhplus.ordergraph.infrastructure.persistence.order.OrderItemJpaRepository;
import com.hhplus.ordergraph.infrastructure.persistence.order.OrderJpaRepository;
import com.hhplus.ordergraph.infrastructure.persistence.user.UserJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * DataSeeder - 개발/부하 테스트용 시드 데이터 적재
 *
 * seed 프로필에서만 실행된다.
 * 1. 기존 주문 항목, 주문, 사용자 행을 모두 삭제
 * 2. 사용자 × 사용자당 주문 × 주문당 항목을 batchSize 사용자 단위 트랜잭션으로 INSERT
 *
 * 생성 값은 인덱스로부터 결정된다 (seed-user-00001@example.com 등).
 * 주문 총액은 항목 소계의 합이다.
 */
@Component
@Profile("seed")
@EnableConfigurationProperties(SeedProperties.class)
public class DataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final OrderStatus[] STATUSES = OrderStatus.values();

    private final UserJpaRepository userJpaRepository;
    private final OrderJpaRepository orderJpaRepository;
    private final OrderItemJpaRepository orderItemJpaRepository;
    private final TransactionTemplate transactionTemplate;
    private final SeedProperties properties;

    public DataSeeder(UserJpaRepository userJpaRepository,
                      OrderJpaRepository orderJpaRepository,
                      OrderItemJpaRepository orderItemJpaRepository,
                      TransactionTemplate transactionTemplate,
                      SeedProperties properties) {
        this.userJpaRepository = userJpaRepository;
        this.orderJpaRepository = orderJpaRepository;
        this.orderItemJpaRepository = orderItemJpaRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    public void seed() {
        log.info("[DataSeeder] 시드 시작: users={}, ordersPerUser={}, itemsPerOrder={}, batchSize={}",
                properties.getUsers(), properties.getOrdersPerUser(),
                properties.getItemsPerOrder(), properties.getBatchSize());

        clear();

        int total = properties.getUsers();
        for (int from = 0; from < total; from += properties.getBatchSize()) {
            int to = Math.min(from + properties.getBatchSize(), total);
            int batchStart = from;
            transactionTemplate.executeWithoutResult(status -> insertBatch(batchStart, to));
            log.info("[DataSeeder] 사용자 {}/{} 적재", to, total);
        }

        log.info("[DataSeeder] 시드 완료: users={}, orders={}, orderItems={}",
                userJpaRepository.count(), orderJpaRepository.count(), orderItemJpaRepository.count());
    }

    private void clear() {
        transactionTemplate.executeWithoutResult(status -> {
            orderItemJpaRepository.deleteAllInBatch();
            orderJpaRepository.deleteAllInBatch();
            userJpaRepository.deleteAllInBatch();
        });
        log.info("[DataSeeder] 기존 데이터 삭제 완료");
    }

    private void insertBatch(int fromIndex, int toIndex) {
        List<User> users = new ArrayList<>(toIndex - fromIndex);
        for (int i = fromIndex; i < toIndex; i++) {
            int n = i + 1;
            users.add(User.createUser(
                    String.format("Seed User %05d", n),
                    String.format("seed-user-%05d@example.com", n)));
        }
        userJpaRepository.saveAll(users);

        List<Order> orders = new ArrayList<>();
        List<OrderItem> orderItems = new ArrayList<>();
        for (int u = 0; u < users.size(); u++) {
            User user = users.get(u);
            for (int o = 0; o < properties.getOrdersPerUser(); o++) {
                BigDecimal totalCost = BigDecimal.ZERO;
                for (int k = 0; k < properties.getItemsPerOrder(); k++) {
                    totalCost = totalCost.add(unitPriceOf(o, k).multiply(BigDecimal.valueOf(quantityOf(k))));
                }

                Order order = Order.createOrder(user, STATUSES[(fromIndex + u + o) % STATUSES.length], totalCost);
                orders.add(order);
                for (int k = 0; k < properties.getItemsPerOrder(); k++) {
                    orderItems.add(OrderItem.createOrderItem(order, quantityOf(k), unitPriceOf(o, k)));
                }
            }
        }
        orderJpaRepository.saveAll(orders);
        orderItemJpaRepository.saveAll(orderItems);
    }

    private int quantityOf(int itemIndex) {
        return itemIndex % 5 + 1;
    }

    private BigDecimal unitPriceOf(int orderIndex, int itemIndex) {
        // 1.99 ~ 100.99
        return BigDecimal.valueOf((orderIndex * 7L + itemIndex * 13L) % 100 + 1).add(new BigDecimal("0.99"));
    }
}
