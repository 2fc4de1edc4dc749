package com.shop.graphrecs.repository;

import com.shop.graphrecs.entity.Category;
import com.shop.graphrecs.entity.Customer;
import com.shop.graphrecs.entity.Event;
import com.shop.graphrecs.entity.Order;
import com.shop.graphrecs.entity.OrderItem;
import com.shop.graphrecs.entity.Product;
import com.shop.graphrecs.entity.SourceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;

/**
 * Full-snapshot reads of the shop relations.
 * Temporal and numeric columns are read as text; the normalizer and the loader coerce them.
 * Key columns are required. Any other column missing from a relation reads as null.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ShopSourceRepository {

    private static final RowMapper<Customer> CUSTOMER = (rs, rowNum) -> Customer.builder()
            .id(nullableLong(rs, "id"))
            .name(optionalString(rs, "name"))
            .joinDate(optionalString(rs, "join_date"))
            .build();

    private static final RowMapper<Category> CATEGORY = (rs, rowNum) -> Category.builder()
            .id(nullableLong(rs, "id"))
            .name(optionalString(rs, "name"))
            .build();

    private static final RowMapper<Product> PRODUCT = (rs, rowNum) -> Product.builder()
            .id(nullableLong(rs, "id"))
            .name(optionalString(rs, "name"))
            .categoryId(optionalLong(rs, "category_id"))
            .price(optionalString(rs, "price"))
            .build();

    private static final RowMapper<Order> ORDER = (rs, rowNum) -> Order.builder()
            .id(nullableLong(rs, "id"))
            .customerId(optionalLong(rs, "customer_id"))
            .ts(optionalString(rs, "ts"))
            .build();

    private static final RowMapper<OrderItem> ORDER_ITEM = (rs, rowNum) -> OrderItem.builder()
            .orderId(nullableLong(rs, "order_id"))
            .productId(nullableLong(rs, "product_id"))
            .quantity(optionalString(rs, "quantity"))
            .build();

    private static final RowMapper<Event> EVENT = (rs, rowNum) -> Event.builder()
            .customerId(nullableLong(rs, "customer_id"))
            .productId(nullableLong(rs, "product_id"))
            .eventType(optionalString(rs, "event_type"))
            .ts(optionalString(rs, "ts"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /**
     * Read every row of the six relations.
     * Runs in one read-only transaction, so a single connection is held for the whole call.
     */
    @Transactional(readOnly = true)
    public SourceSnapshot extract() {
        SourceSnapshot snapshot = SourceSnapshot.builder()
                .customers(readAll("customers", CUSTOMER))
                .categories(readAll("categories", CATEGORY))
                .products(readAll("products", PRODUCT))
                .orders(readAll("orders", ORDER))
                .orderItems(readAll("order_items", ORDER_ITEM))
                .events(readAll("events", EVENT))
                .build();

        log.info("Extracted {} customers, {} categories, {} products, {} orders, {} order items, {} events",
                snapshot.getCustomers().size(), snapshot.getCategories().size(),
                snapshot.getProducts().size(), snapshot.getOrders().size(),
                snapshot.getOrderItems().size(), snapshot.getEvents().size());
        return snapshot;
    }

    private <T> List<T> readAll(String relation, RowMapper<T> mapper) {
        // quoted so a relation name is never read as a keyword
        List<T> rows = jdbcTemplate.query("SELECT * FROM \"" + relation + "\"", mapper);
        log.debug("Read {} rows from {}", rows.size(), relation);
        return rows;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Long optionalLong(ResultSet rs, String column) throws SQLException {
        int index = columnIndex(rs, column);
        if (index < 0) {
            return null;
        }
        long value = rs.getLong(index);
        return rs.wasNull() ? null : value;
    }

    private static String optionalString(ResultSet rs, String column) throws SQLException {
        int index = columnIndex(rs, column);
        return index < 0 ? null : rs.getString(index);
    }

    /**
     * @return 1-based index of the column in the current result, or -1 when the relation lacks it
     */
    private static int columnIndex(ResultSet rs, String column) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            if (column.equalsIgnoreCase(metaData.getColumnLabel(i))) {
                return i;
            }
        }
        return -1;
    }
}
