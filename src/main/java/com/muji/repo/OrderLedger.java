package com.muji.repo;

import com.muji.model.Document;
import com.muji.model.Order;
import com.muji.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Жизненный цикл заказа: unpaid → booked, либо unpaid → удалён по истечении срока.
 * Из booked назад в unpaid пути нет. Все операции меняют только переданный документ,
 * сохраняет их вызывающий.
 */
public class OrderLedger {
    private static final Logger log = LoggerFactory.getLogger(OrderLedger.class);

    public static final Duration PAYMENT_WINDOW = Duration.ofHours(1);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Comparator<Order> BY_CREATION =
            Comparator.comparing((Order o) -> o.createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparingLong(o -> o.id);

    private final Clock clock;
    private final OrderCodes codes;

    public OrderLedger(Clock clock, OrderCodes codes) {
        this.clock = clock;
        this.codes = codes;
    }

    /**
     * Счёт на оплату. Неоплаченный заказ этой пары (профиль, пользователь) обновляется на месте
     * и получает новый час на оплату; иначе создаётся новый.
     *
     * @throws IllegalArgumentException сумма не положительна или кошелёк неизвестен
     */
    public Order quote(Document doc, long profileId, String userId, BigDecimal amount, String wallet, String currency) {
        // сумма меньше цента после округления тоже не годится
        if (amount == null || amount.setScale(2, RoundingMode.HALF_UP).signum() <= 0) {
            throw new IllegalArgumentException("Amount must be at least 0.01");
        }
        if (wallet == null || !doc.settings.cryptoWallets.containsKey(wallet)) {
            throw new IllegalArgumentException("Unknown wallet: " + wallet);
        }
        String uid = UserIds.normalize(userId);
        Instant now = clock.instant();
        BigDecimal pct = doc.settings.bonusPercentage;
        BigDecimal base = amount.setScale(2, RoundingMode.HALF_UP);
        BigDecimal bonus = amount.multiply(pct).divide(HUNDRED, 2, RoundingMode.HALF_UP);

        Order o = findUnpaid(doc, profileId, uid).orElse(null);
        if (o == null) {
            o = new Order();
            o.id = doc.nextOrderId();
            o.orderNumber = codes.next();
            o.profileId = profileId;
            o.externalUserId = uid;
            o.status = OrderStatus.UNPAID;
            o.createdAt = now;
            doc.orders.add(o);
            log.info("New order #{} for profile {} user {}", o.orderNumber, profileId, uid);
        } else {
            log.info("Re-quoted order #{} for profile {} user {}", o.orderNumber, profileId, uid);
        }
        o.amount = base;
        o.bonusAmount = bonus;
        o.totalAmount = base.add(bonus);
        o.cryptoType = wallet;
        o.currency = currency == null || currency.isBlank() ? "USD" : currency;
        o.expiresAt = now.plus(PAYMENT_WINDOW);
        return o;
    }

    /**
     * Бронирует самый свежий неоплаченный заказ профиля. Если пользователь известен, выбор
     * сужается до его заказов; без пользователя берётся последний заказ профиля вообще.
     */
    public Optional<Order> book(Document doc, long profileId, String userId) {
        String uid = UserIds.normalize(userId);
        Optional<Order> latest = doc.orders.stream()
                .filter(o -> o.profileId == profileId && o.isUnpaid())
                .filter(o -> uid == null || UserIds.same(o.externalUserId, uid))
                .max(BY_CREATION);
        latest.ifPresent(this::markBooked);
        return latest;
    }

    /** Подтверждение конкретного заказа из админки. Уже забронированный остаётся как есть. */
    public Optional<Order> confirm(Document doc, long orderId) {
        Optional<Order> order = find(doc, orderId);
        order.filter(Order::isUnpaid).ifPresent(this::markBooked);
        return order;
    }

    public Optional<Order> find(Document doc, long orderId) {
        return doc.orders.stream().filter(o -> o.id == orderId).findFirst();
    }

    /** Удаляет неоплаченные заказы с expires_at раньше {@code now}. */
    public int sweep(Document doc, Instant now) {
        int before = doc.orders.size();
        doc.orders.removeIf(o -> o.isUnpaid() && (o.expiresAt == null || o.expiresAt.isBefore(now)));
        return before - doc.orders.size();
    }

    /** Заказы пользователя, новые первыми; при {@code status == null} все. */
    public List<Order> ordersOf(Document doc, String userId, OrderStatus status) {
        return doc.orders.stream()
                .filter(o -> UserIds.same(o.externalUserId, userId))
                .filter(o -> status == null || o.status == status)
                .sorted(BY_CREATION.reversed())
                .collect(Collectors.toList());
    }

    /** Удаление заказа владельцем. Для чужого или отсутствующего заказа false. */
    public boolean cancel(Document doc, long orderId, String userId) {
        String uid = UserIds.normalize(userId);
        return doc.orders.removeIf(o -> o.id == orderId && uid != null && UserIds.same(o.externalUserId, uid));
    }

    private Optional<Order> findUnpaid(Document doc, long profileId, String userId) {
        return doc.orders.stream()
                .filter(o -> o.profileId == profileId && o.isUnpaid() && UserIds.same(o.externalUserId, userId))
                .findFirst();
    }

    private void markBooked(Order o) {
        o.status = OrderStatus.BOOKED;
        o.bookedAt = clock.instant();
        log.info("Order #{} booked (profile {}, user {})", o.orderNumber, o.profileId, o.externalUserId);
    }
}
