package com.shop.graphrecs.graph;

import com.shop.graphrecs.entity.Category;
import com.shop.graphrecs.entity.Customer;
import com.shop.graphrecs.entity.Event;
import com.shop.graphrecs.entity.Order;
import com.shop.graphrecs.entity.OrderItem;
import com.shop.graphrecs.entity.Product;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * A named, key-based upsert: one UNWIND statement plus the mapping of a source row to the
 * element it receives. Nodes are merged on {@code id}; relationships are merged on their
 * endpoints and are only written when every MATCHed endpoint already exists.
 */
public final class GraphUpsert<T> {

    public static final GraphUpsert<Category> CATEGORIES = new GraphUpsert<>("categories", """
            UNWIND $rows AS row
            MERGE (g:Category {id: row.id})
            SET g.name = row.name
            """, category -> params(
            "id", category.getId(),
            "name", category.getName()));

    public static final GraphUpsert<Product> PRODUCTS = new GraphUpsert<>("products", """
            UNWIND $rows AS row
            MERGE (p:Product {id: row.id})
            SET p.name = row.name, p.price = row.price
            WITH row, p
            MATCH (g:Category {id: row.category_id})
            MERGE (p)-[:IN_CATEGORY]->(g)
            """, product -> params(
            "id", product.getId(),
            "name", product.getName(),
            "price", GraphValues.toFloat(product.getPrice()),
            "category_id", product.getCategoryId()));

    public static final GraphUpsert<Customer> CUSTOMERS = new GraphUpsert<>("customers", """
            UNWIND $rows AS row
            MERGE (c:Customer {id: row.id})
            SET c.name = row.name, c.join_date = row.join_date
            """, customer -> params(
            "id", customer.getId(),
            "name", customer.getName(),
            "join_date", GraphValues.toDate(customer.getJoinDate())));

    public static final GraphUpsert<Order> ORDERS = new GraphUpsert<>("orders", """
            UNWIND $rows AS row
            MERGE (o:Order {id: row.id})
            SET o.ts = row.ts
            WITH row, o
            MATCH (c:Customer {id: row.customer_id})
            MERGE (c)-[:PLACED]->(o)
            """, order -> params(
            "id", order.getId(),
            "ts", GraphValues.toDateTime(order.getTs()),
            "customer_id", order.getCustomerId()));

    public static final GraphUpsert<OrderItem> ORDER_ITEMS = new GraphUpsert<>("order_items", """
            UNWIND $rows AS row
            MATCH (o:Order {id: row.order_id})
            MATCH (p:Product {id: row.product_id})
            MERGE (o)-[r:CONTAINS]->(p)
            SET r.quantity = row.quantity
            """, item -> params(
            "order_id", item.getOrderId(),
            "product_id", item.getProductId(),
            "quantity", GraphValues.toInteger(item.getQuantity())));

    private static final Map<EventEdgeType, GraphUpsert<Event>> EVENTS = new EnumMap<>(EventEdgeType.class);

    static {
        for (EventEdgeType type : EventEdgeType.values()) {
            // relationship types cannot be parameters; the name comes from a fixed enum
            EVENTS.put(type, new GraphUpsert<>("events:" + type.getEventType(), String.format("""
                    UNWIND $rows AS row
                    MATCH (c:Customer {id: row.customer_id})
                    MATCH (p:Product {id: row.product_id})
                    MERGE (c)-[r:%s]->(p)
                    SET r.ts = row.ts
                    """, type.name()), event -> params(
                    "customer_id", event.getCustomerId(),
                    "product_id", event.getProductId(),
                    "ts", GraphValues.toDateTime(event.getTs()))));
        }
    }

    private final String name;
    private final String statement;
    private final Function<T, Map<String, Object>> rowMapper;

    private GraphUpsert(String name, String statement, Function<T, Map<String, Object>> rowMapper) {
        this.name = name;
        this.statement = statement;
        this.rowMapper = rowMapper;
    }

    public static GraphUpsert<Event> events(EventEdgeType type) {
        return EVENTS.get(type);
    }

    public String getName() {
        return name;
    }

    public String getStatement() {
        return statement;
    }

    public Map<String, Object> toParameters(T row) {
        return rowMapper.apply(row);
    }

    // LinkedHashMap rather than Map.of: absent values are sent as explicit nulls
    private static Map<String, Object> params(Object... keysAndValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return params;
    }
}
