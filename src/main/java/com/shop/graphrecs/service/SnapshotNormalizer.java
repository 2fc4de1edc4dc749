package com.shop.graphrecs.service;

import com.shop.graphrecs.entity.Customer;
import com.shop.graphrecs.entity.Event;
import com.shop.graphrecs.entity.Order;
import com.shop.graphrecs.entity.SourceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rewrites the temporal columns of a snapshot into canonical strings.
 * The input snapshot and its rows are left untouched; unreadable values become null.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotNormalizer {

    private final TemporalParser temporalParser;

    public SourceSnapshot normalize(SourceSnapshot snapshot) {
        SourceSnapshot normalized = snapshot.toBuilder()
                .customers(rewrite(snapshot.getCustomers(), customer -> customer.toBuilder()
                        .joinDate(temporalParser.parseDate(customer.getJoinDate()).orElse(null))
                        .build()))
                .orders(rewrite(snapshot.getOrders(), order -> order.toBuilder()
                        .ts(temporalParser.parseTimestamp(order.getTs()).orElse(null))
                        .build()))
                .events(rewrite(snapshot.getEvents(), event -> event.toBuilder()
                        .ts(temporalParser.parseTimestamp(event.getTs()).orElse(null))
                        .build()))
                .build();

        log.info("Normalized temporal fields: {} customer join dates, {} order timestamps, {} event timestamps unreadable",
                countDropped(snapshot.getCustomers(), normalized.getCustomers(), Customer::getJoinDate),
                countDropped(snapshot.getOrders(), normalized.getOrders(), Order::getTs),
                countDropped(snapshot.getEvents(), normalized.getEvents(), Event::getTs));
        return normalized;
    }

    private static <T> List<T> rewrite(List<T> rows, Function<T, T> rewriter) {
        if (rows == null) {
            return null;
        }
        return rows.stream().map(rewriter).collect(Collectors.toList());
    }

    /**
     * Rows that carried some text before normalization and none after
     */
    private static <T> long countDropped(List<T> before, List<T> after, Function<T, String> field) {
        if (before == null) {
            return 0;
        }
        long dropped = 0;
        for (int i = 0; i < before.size(); i++) {
            String raw = field.apply(before.get(i));
            if (raw != null && !raw.isBlank() && Objects.isNull(field.apply(after.get(i)))) {
                dropped++;
            }
        }
        return dropped;
    }
}
