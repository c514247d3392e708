package io.github.drompincen.restochat.persistence.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Creates the chat tables and the restaurant tables on first start. Every statement is
 * idempotent so it runs on each boot.
 */
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final List<String> CHAT_TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS checkpoints (
                thread_id VARCHAR(255) PRIMARY KEY,
                persona VARCHAR(16),
                messages CLOB NOT NULL,
                summary CLOB,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            // files created before threads recorded their persona
            "ALTER TABLE checkpoints ADD COLUMN IF NOT EXISTS persona VARCHAR(16)",
            """
            CREATE TABLE IF NOT EXISTS memories (
                id VARCHAR(64) PRIMARY KEY,
                seq BIGINT GENERATED BY DEFAULT AS IDENTITY,
                thread_id VARCHAR(255) NOT NULL,
                content CLOB NOT NULL,
                tags VARCHAR(1024),
                importance INT DEFAULT 1 NOT NULL,
                source VARCHAR(20) NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memories_thread ON memories(thread_id)",
            "CREATE INDEX IF NOT EXISTS idx_memories_updated ON memories(updated_at)"
    );

    static final List<String> RESTAURANT_TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS employees (
                employee_id VARCHAR(64) PRIMARY KEY,
                first_name VARCHAR(100) NOT NULL,
                last_name VARCHAR(100) NOT NULL,
                email VARCHAR(255) NOT NULL,
                phone VARCHAR(50) NOT NULL,
                position VARCHAR(100) NOT NULL,
                department VARCHAR(100) NOT NULL,
                hire_date DATE NOT NULL,
                tenure_months INT NOT NULL,
                salary DECIMAL(10, 2) NOT NULL,
                performance_rating DOUBLE NOT NULL,
                shift_type VARCHAR(20) NOT NULL,
                status VARCHAR(20) DEFAULT 'active' NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS storage_items (
                item_id VARCHAR(64) PRIMARY KEY,
                item_name VARCHAR(200) NOT NULL,
                category VARCHAR(50) NOT NULL,
                current_stock DECIMAL(10, 3) NOT NULL,
                unit VARCHAR(20) NOT NULL,
                minimum_stock DECIMAL(10, 3) NOT NULL,
                maximum_stock DECIMAL(10, 3) NOT NULL,
                cost_per_unit DECIMAL(10, 2) NOT NULL,
                supplier VARCHAR(200) NOT NULL,
                storage_location VARCHAR(50) NOT NULL,
                expiry_date DATE,
                last_restocked DATE NOT NULL,
                is_low_stock BOOLEAN DEFAULT FALSE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS recipes (
                recipe_id VARCHAR(64) PRIMARY KEY,
                dish_name VARCHAR(200) NOT NULL,
                category VARCHAR(100) NOT NULL,
                cuisine_type VARCHAR(100) NOT NULL,
                difficulty_level INT NOT NULL,
                prep_time_minutes INT NOT NULL,
                cook_time_minutes INT NOT NULL,
                serving_size INT NOT NULL,
                instructions VARCHAR(8000),
                allergens VARCHAR(1024),
                cost_per_serving DECIMAL(10, 2) NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS recipe_ingredients (
                id VARCHAR(64) PRIMARY KEY,
                recipe_id VARCHAR(64) NOT NULL,
                ingredient_name VARCHAR(200) NOT NULL,
                quantity DECIMAL(10, 3) NOT NULL,
                unit VARCHAR(20) NOT NULL,
                timing VARCHAR(20) NOT NULL,
                notes VARCHAR(1024)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS daily_menus (
                menu_id VARCHAR(64) PRIMARY KEY,
                menu_date DATE NOT NULL,
                restaurant_location VARCHAR(200) NOT NULL,
                special_offers VARCHAR(1024),
                chef_recommendation VARCHAR(500)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS daily_menu_items (
                menu_item_id VARCHAR(64) PRIMARY KEY,
                menu_id VARCHAR(64) NOT NULL,
                recipe_id VARCHAR(64),
                dish_name VARCHAR(200) NOT NULL,
                description VARCHAR(2000) NOT NULL,
                category VARCHAR(100) NOT NULL,
                price DECIMAL(10, 2) NOT NULL,
                status VARCHAR(20) DEFAULT 'available' NOT NULL,
                estimated_prep_time INT NOT NULL,
                available_quantity INT,
                spicy_level INT,
                is_vegetarian BOOLEAN DEFAULT FALSE,
                is_vegan BOOLEAN DEFAULT FALSE,
                is_gluten_free BOOLEAN DEFAULT FALSE,
                calories INT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_menu_date ON daily_menus(menu_date)",
            "CREATE INDEX IF NOT EXISTS idx_menu_items_menu ON daily_menu_items(menu_id)",
            "CREATE INDEX IF NOT EXISTS idx_ingredients_recipe ON recipe_ingredients(recipe_id)"
    );

    private final JdbcTemplate jdbcTemplate;

    public SchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return false when the database could not be reached; callers decide how to degrade
     */
    public boolean initialize() {
        try {
            CHAT_TABLES.forEach(jdbcTemplate::execute);
            RESTAURANT_TABLES.forEach(jdbcTemplate::execute);
            log.info("Schema ready ({} chat, {} restaurant statements)", CHAT_TABLES.size(), RESTAURANT_TABLES.size());
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to initialize schema: {}", e.getMessage());
            return false;
        }
    }
}
