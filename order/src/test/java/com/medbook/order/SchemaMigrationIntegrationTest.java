package com.medbook.order;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration Tests — Flyway migrations against a real PostgreSQL.
 *
 * Uses plain JDBC: the assertions are about the schema (shape, defaults, cascades, triggers),
 * not about the JPA mapping.
 *
 * Note: these tests require Docker to be running and are skipped otherwise.
 */
@Testcontainers(disabledWithoutDocker = true)
class SchemaMigrationIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    static JdbcTemplate jdbc;

    @BeforeAll
    static void migrate() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .load()
                .migrate();
        jdbc = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void cleanTables() {
        jdbc.execute("TRUNCATE outbox, payments, orders, cart_items, carts RESTART IDENTITY CASCADE");
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private int insertCart(int patientId) {
        return jdbc.queryForObject("INSERT INTO carts (patient_id) VALUES (?) RETURNING id", Integer.class, patientId);
    }

    private int insertOrder(int cartId) {
        return jdbc.queryForObject("INSERT INTO orders (cart_id, patient_id) VALUES (?, 1) RETURNING id",
                Integer.class, cartId);
    }

    private UUID insertPayment(int orderId) {
        return jdbc.queryForObject("INSERT INTO payments (order_id, amount) VALUES (?, 12.5) RETURNING id",
                UUID.class, orderId);
    }

    private Map<String, Object> column(String table, String column) {
        return jdbc.queryForMap("""
                SELECT data_type, is_nullable, column_default, character_maximum_length
                FROM information_schema.columns
                WHERE table_schema = 'public' AND table_name = ? AND column_name = ?
                """, table, column);
    }

    private static void pause() throws InterruptedException {
        // now() is the transaction start time; separate statements must be apart
        Thread.sleep(20);
    }

    // ─── Shape ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("creates the five tables with their columns")
    void migrations_createAllTables() {
        List<String> tables = jdbc.queryForList("""
                SELECT table_name FROM information_schema.tables
                WHERE table_schema = 'public' AND table_name <> 'flyway_schema_history'
                """, String.class);
        assertThat(tables).containsExactlyInAnyOrder("carts", "cart_items", "orders", "payments", "outbox");

        assertThat(jdbc.queryForList("""
                SELECT column_name FROM information_schema.columns
                WHERE table_schema = 'public' AND table_name = 'orders'
                """, String.class))
                .containsExactlyInAnyOrder("id", "cart_id", "patient_id", "status", "order_type", "delivery_id",
                        "delivery_address", "created_at", "updated_at", "deleted_at");
        assertThat(jdbc.queryForList("""
                SELECT column_name FROM information_schema.columns
                WHERE table_schema = 'public' AND table_name = 'payments'
                """, String.class))
                .containsExactlyInAnyOrder("id", "order_id", "amount", "status", "provider", "provider_ref",
                        "failure_reason", "created_at", "updated_at");
    }

    @Test
    @DisplayName("column types, nullability and defaults")
    void migrations_defineTypesAndDefaults() {
        assertThat(column("orders", "delivery_id")).containsEntry("data_type", "uuid").containsEntry("is_nullable", "YES");
        assertThat(column("orders", "delivery_address")).containsEntry("data_type", "jsonb");
        assertThat(column("orders", "deleted_at")).containsEntry("data_type", "timestamp with time zone")
                .containsEntry("is_nullable", "YES");
        assertThat(column("cart_items", "quantity")).containsEntry("data_type", "integer")
                .containsEntry("column_default", "1");
        assertThat(column("payments", "amount")).containsEntry("data_type", "real").containsEntry("is_nullable", "NO");
        assertThat(column("payments", "status")).containsEntry("character_maximum_length", 32);
        assertThat(column("payments", "provider")).containsEntry("character_maximum_length", 64);
        assertThat(column("payments", "provider_ref")).containsEntry("character_maximum_length", 128);
        assertThat((String) column("payments", "id").get("column_default")).contains("gen_random_uuid");
        assertThat(column("outbox", "payload")).containsEntry("data_type", "text").containsEntry("is_nullable", "NO");
        assertThat(column("carts", "created_at")).containsEntry("is_nullable", "NO");
    }

    @Test
    @DisplayName("cart_items primary key is (cart_id, product_id)")
    void cartItems_rejectDuplicateProductInCart() {
        int cartId = insertCart(1);
        jdbc.update("INSERT INTO cart_items (cart_id, product_id, quantity) VALUES (?, 7, 2)", cartId);

        assertThatThrownBy(() ->
                jdbc.update("INSERT INTO cart_items (cart_id, product_id, quantity) VALUES (?, 7, 3)", cartId))
                .isInstanceOf(org.springframework.dao.DuplicateKeyException.class);
    }

    @Test
    @DisplayName("orders and payments need an existing parent")
    void foreignKeys_rejectOrphans() {
        assertThatThrownBy(() -> insertOrder(999))
                .isInstanceOf(org.springframework.dao.DataIntegrityViolationException.class);
        assertThatThrownBy(() -> insertPayment(999))
                .isInstanceOf(org.springframework.dao.DataIntegrityViolationException.class);
    }

    // ─── Cascades ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("deleting a cart deletes its items")
    void deleteCart_cascadesToItems() {
        int cartId = insertCart(1);
        jdbc.update("INSERT INTO cart_items (cart_id, product_id) VALUES (?, 1), (?, 2)", cartId, cartId);

        jdbc.update("DELETE FROM carts WHERE id = ?", cartId);

        assertThat(jdbc.queryForObject("SELECT count(*) FROM cart_items", Integer.class)).isZero();
    }

    @Test
    @DisplayName("deleting a cart deletes its orders and their payments")
    void deleteCart_cascadesToOrdersAndPayments() {
        int cartId = insertCart(1);
        int orderId = insertOrder(cartId);
        insertPayment(orderId);
        insertPayment(orderId);

        jdbc.update("DELETE FROM carts WHERE id = ?", cartId);

        assertThat(jdbc.queryForObject("SELECT count(*) FROM orders", Integer.class)).isZero();
        assertThat(jdbc.queryForObject("SELECT count(*) FROM payments", Integer.class)).isZero();
    }

    // ─── Defaults ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("an order inserted without status or type is PENDING / PICKUP")
    void insertOrder_appliesDefaults() {
        int orderId = insertOrder(insertCart(1));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM orders WHERE id = ?", orderId);
        assertThat(row).containsEntry("status", "PENDING").containsEntry("order_type", "PICKUP");
        assertThat(row.get("delivery_id")).isNull();
        assertThat(row.get("deleted_at")).isNull();
    }

    @Test
    @DisplayName("a payment inserted with order and amount only gets an id, PENDING and provider internal")
    void insertPayment_appliesDefaults() {
        UUID paymentId = insertPayment(insertOrder(insertCart(1)));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM payments WHERE id = ?", paymentId);
        assertThat(paymentId).isNotNull();
        assertThat(row).containsEntry("status", "PENDING").containsEntry("provider", "internal");
    }

    @Test
    @DisplayName("an outbox row inserted with type and payload only is PENDING with both timestamps set")
    void insertOutbox_appliesDefaults() {
        jdbc.update("INSERT INTO outbox (event_type, payload) VALUES ('inventory.reserve_order', '{\"order_id\":1}')");

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM outbox");
        assertThat(row).containsEntry("status", "PENDING");
        assertThat(row.get("created_at")).isNotNull();
        assertThat(row.get("updated_at")).isEqualTo(row.get("created_at"));
    }

    // ─── updated_at triggers ──────────────────────────────────────────────────

    @Test
    @DisplayName("updating a row moves its updated_at and nothing else")
    void update_touchesOnlyUpdatedAtOfThatRow() throws InterruptedException {
        int first = insertCart(1);
        int second = insertCart(2);
        Map<String, Object> before = jdbc.queryForMap("SELECT * FROM carts WHERE id = ?", first);
        Timestamp secondBefore = jdbc.queryForObject("SELECT updated_at FROM carts WHERE id = ?", Timestamp.class, second);
        pause();

        jdbc.update("UPDATE carts SET patient_id = patient_id WHERE id = ?", first);

        Map<String, Object> after = jdbc.queryForMap("SELECT * FROM carts WHERE id = ?", first);
        assertThat((Timestamp) after.get("updated_at")).isAfter((Timestamp) before.get("updated_at"));
        assertThat(after.get("created_at")).isEqualTo(before.get("created_at"));
        assertThat(after.get("patient_id")).isEqualTo(before.get("patient_id"));
        assertThat(jdbc.queryForObject("SELECT updated_at FROM carts WHERE id = ?", Timestamp.class, second))
                .isEqualTo(secondBefore);
    }

    @Test
    @DisplayName("every table carries the updated_at trigger")
    void update_triggersExistOnAllTables() throws InterruptedException {
        int cartId = insertCart(1);
        jdbc.update("INSERT INTO cart_items (cart_id, product_id) VALUES (?, 1)", cartId);
        int orderId = insertOrder(cartId);
        UUID paymentId = insertPayment(orderId);
        jdbc.update("INSERT INTO outbox (event_type, payload) VALUES ('x', '{}')");
        pause();

        jdbc.update("UPDATE cart_items SET quantity = 3");
        jdbc.update("UPDATE orders SET status = 'RESERVED'");
        jdbc.update("UPDATE payments SET status = 'PAID' WHERE id = ?", paymentId);
        jdbc.update("UPDATE outbox SET status = 'PUBLISHED'");

        for (String table : List.of("cart_items", "orders", "payments", "outbox")) {
            Boolean moved = jdbc.queryForObject(
                    "SELECT bool_and(updated_at > created_at) FROM " + table, Boolean.class);
            assertThat(moved).as(table).isTrue();
        }
    }
}
