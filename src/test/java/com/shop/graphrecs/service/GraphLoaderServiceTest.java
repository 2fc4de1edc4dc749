package com.shop.graphrecs.service;

import com.shop.graphrecs.config.GraphRecsProperties;
import com.shop.graphrecs.dto.LoadSummary;
import com.shop.graphrecs.entity.Category;
import com.shop.graphrecs.entity.Customer;
import com.shop.graphrecs.entity.Event;
import com.shop.graphrecs.entity.Order;
import com.shop.graphrecs.entity.OrderItem;
import com.shop.graphrecs.entity.Product;
import com.shop.graphrecs.entity.SourceSnapshot;
import com.shop.graphrecs.graph.RecordingGraphWriter;
import com.shop.graphrecs.graph.SchemaScript;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GraphLoaderServiceTest {

    private RecordingGraphWriter writer;
    private GraphRecsProperties properties;

    @BeforeEach
    void setUp() {
        writer = new RecordingGraphWriter();
        properties = new GraphRecsProperties();
        properties.getLoad().setBatchSize(2);
    }

    private GraphLoaderService loader() {
        return new GraphLoaderService(() -> writer,
                new SchemaScript(new DefaultResourceLoader(), properties), properties);
    }

    private SourceSnapshot snapshot() {
        return SourceSnapshot.builder()
                .categories(List.of(Category.builder().id(1L).name("Books").build()))
                .products(List.of(
                        Product.builder().id(10L).name("Dune").categoryId(1L).price("9.99").build(),
                        Product.builder().id(11L).name("Orphan").categoryId(99L).price("12").build()))
                .customers(List.of(
                        Customer.builder().id(100L).name("Ada").joinDate("2023-03-05").build(),
                        Customer.builder().id(101L).name("Bob").joinDate(null).build()))
                .orders(List.of(Order.builder().id(1000L).customerId(100L).ts("2023-03-05T14:30:00Z").build()))
                .orderItems(List.of(OrderItem.builder().orderId(1000L).productId(10L).quantity("3").build()))
                .events(List.of(
                        Event.builder().customerId(100L).productId(10L).eventType("view").ts("2023-03-05T14:30:00Z").build(),
                        Event.builder().customerId(100L).productId(10L).eventType("purchase").ts("2023-03-05T14:31:00Z").build(),
                        Event.builder().customerId(101L).productId(11L).eventType("add_to_cart").ts(null).build()))
                .build();
    }

    private int firstBatchContaining(String fragment) {
        for (int i = 0; i < writer.batchStatements.size(); i++) {
            if (writer.batchStatements.get(i).contains(fragment)) {
                return i;
            }
        }
        return -1;
    }

    @Test
    void testSchemaIsAppliedBeforeAnyData() {
        loader().load(snapshot());

        assertFalse(writer.schemaStatements.isEmpty());
        assertTrue(writer.schemaStatements.stream().allMatch(s -> s.startsWith("CREATE CONSTRAINT")));
        assertTrue(writer.closed);
    }

    @Test
    void testStepsRunCreatorsBeforeReferencers() {
        LoadSummary summary = loader().load(snapshot());

        int categories = firstBatchContaining("MERGE (g:Category");
        int products = firstBatchContaining("MERGE (p:Product");
        int customers = firstBatchContaining("MERGE (c:Customer");
        int orders = firstBatchContaining("MERGE (o:Order");
        int items = firstBatchContaining(":CONTAINS]");
        int viewed = firstBatchContaining(":VIEWED]");

        assertTrue(categories < products);
        assertTrue(products < customers);
        assertTrue(customers < orders);
        assertTrue(orders < items);
        assertTrue(items < viewed);
        assertThat(summary.getRowsByStep().keySet()).containsExactly(
                "categories", "products", "customers", "orders", "order_items",
                "events:view", "events:click", "events:add_to_cart");
    }

    @Test
    void testRowsAreCoercedToTypedParameters() {
        loader().load(snapshot());

        Map<String, Object> dune = writer.batches.get(firstBatchContaining("MERGE (p:Product")).get(0);
        assertEquals(9.99, dune.get("price"));
        assertEquals(1L, dune.get("category_id"));

        List<Map<String, Object>> customers = writer.batches.get(firstBatchContaining("MERGE (c:Customer"));
        assertEquals(LocalDate.of(2023, 3, 5), customers.get(0).get("join_date"));
        assertTrue(customers.get(1).containsKey("join_date"));
        assertNull(customers.get(1).get("join_date"));

        Map<String, Object> order = writer.batches.get(firstBatchContaining("MERGE (o:Order")).get(0);
        assertEquals(ZonedDateTime.of(2023, 3, 5, 14, 30, 0, 0, ZoneOffset.UTC), order.get("ts"));

        Map<String, Object> item = writer.batches.get(firstBatchContaining(":CONTAINS]")).get(0);
        assertEquals(3L, item.get("quantity"));
    }

    @Test
    void testEventsAreRoutedByTypeAndUnknownTypesDropped() {
        LoadSummary summary = loader().load(snapshot());

        List<Map<String, Object>> viewed = writer.batches.get(firstBatchContaining(":VIEWED]"));
        assertEquals(1, viewed.size());
        assertEquals(ZonedDateTime.of(2023, 3, 5, 14, 30, 0, 0, ZoneOffset.UTC), viewed.get(0).get("ts"));

        assertEquals(-1, firstBatchContaining(":CLICKED]"));
        assertEquals(0, summary.getRowsByStep().get("events:click"));

        List<Map<String, Object>> added = writer.batches.get(firstBatchContaining(":ADDED_TO_CART]"));
        assertEquals(1, added.size());
        assertNull(added.get(0).get("ts"));

        assertEquals(Map.of("purchase", 1L), summary.getSkippedEventTypes());
        assertTrue(writer.batchStatements.stream().noneMatch(s -> s.contains("purchase") || s.contains("PURCHASE")));
    }

    @Test
    void testRowsAreSentInBatchesOfConfiguredSize() {
        List<Customer> customers = LongStream.rangeClosed(1, 5)
                .mapToObj(id -> Customer.builder().id(id).name("c" + id).build())
                .collect(Collectors.toList());

        LoadSummary summary = loader().load(SourceSnapshot.builder().customers(customers).build());

        assertEquals(3, writer.batchStatements.stream().filter(s -> s.contains("MERGE (c:Customer")).count());
        assertEquals(List.of(2, 2, 1), writer.batches.stream().map(List::size).collect(Collectors.toList()));
        assertEquals(5, summary.getRowsByStep().get("customers"));
        assertEquals(3, summary.getBatchesByStep().get("customers"));
    }

    @Test
    void testMissingRelationsLoadNothing() {
        LoadSummary summary = loader().load(SourceSnapshot.builder().build());

        assertTrue(writer.batches.isEmpty());
        assertEquals(0, summary.getRowsByStep().get("products"));
    }

    @Test
    void testBatchFailureAbortsLoadAndPropagatesUnchanged() {
        IllegalStateException storeError = new IllegalStateException("write failed");
        writer.failOnBatch(1, storeError);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> loader().load(snapshot()));

        assertSame(storeError, thrown);
        assertEquals(1, writer.batches.size());
        assertTrue(writer.closed);
    }

    @Test
    void testRejectsNonPositiveBatchSize() {
        properties.getLoad().setBatchSize(0);

        assertThrows(IllegalArgumentException.class, this::loader);
    }
}
