package com.ryuqq.tabular.testkit.contract;

import com.ryuqq.tabular.core.filter.Filter;
import com.ryuqq.tabular.core.model.Column;
import com.ryuqq.tabular.core.model.ColumnType;
import com.ryuqq.tabular.core.model.Row;
import com.ryuqq.tabular.core.model.TableSchema;
import com.ryuqq.tabular.core.spi.RowCursor;
import com.ryuqq.tabular.core.spi.TabularStore;
import com.ryuqq.tabular.engine.crud.CrudEngine;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Every {@link TabularStore} adapter runs the same contract suites by extending them
 * and implementing {@link #createStore(List)}. The store must contain the fixture tables
 * (empty) when it is returned.</p>
 *
 * <p><strong>Fixture Tables:</strong></p>
 * <ul>
 *   <li>{@code orders}: OBJECTID, orderid, supplier, total, status</li>
 *   <li>{@code order_archive}: OBJECTID, orderid, supplier, total, archived_by</li>
 *   <li>{@code parcels}: OBJECTID, parcel_no, owner, area, Shape (geometry)</li>
 *   <li>{@code bad_audit} and {@code bad_audit_log}: audit table missing a column</li>
 *   <li>{@code flagged}: table with its own {@code action} column</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreCrudContractTest extends CrudContractTest {
 *     {@literal @}Override
 *     protected TabularStore createStore(List&lt;TableSchema&gt; tables) {
 *         return MyStore.withTables(tables);
 *     }
 * }
 * </pre>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    public static final String ORDERS = "orders";
    public static final String ORDER_ARCHIVE = "order_archive";
    public static final String PARCELS = "parcels";
    public static final String BAD_AUDIT = "bad_audit";
    public static final String FLAGGED = "flagged";

    protected TabularStore store;

    /**
     * Creates a store containing the given empty tables.
     *
     * @param tables fixture schemas
     * @return a fresh store
     */
    protected abstract TabularStore createStore(List<TableSchema> tables);

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpStore() {
        store = createStore(fixtures());
    }

    /**
     * Fixture schemas created for every test.
     *
     * @return table schemas
     */
    public static List<TableSchema> fixtures() {
        return List.of(
            ordersSchema(),
            TableSchema.of(ORDER_ARCHIVE,
                Column.objectId("OBJECTID"),
                Column.of("orderid", ColumnType.INTEGER),
                Column.text("supplier", 50),
                Column.of("total", ColumnType.DOUBLE),
                Column.text("archived_by", 20)),
            TableSchema.of(PARCELS,
                Column.objectId("OBJECTID"),
                Column.text("parcel_no", 20),
                Column.text("owner", 50),
                Column.of("area", ColumnType.DOUBLE),
                Column.geometry("Shape")),
            TableSchema.of(BAD_AUDIT,
                Column.objectId("OBJECTID"),
                Column.text("code", 10),
                Column.text("label", 50)),
            TableSchema.of(BAD_AUDIT + "_log",
                Column.objectId("OBJECTID"),
                Column.text("code", 10),
                Column.text("action", 16)),
            TableSchema.of(FLAGGED,
                Column.objectId("OBJECTID"),
                Column.text("code", 10),
                Column.text("Action", 16))
        );
    }

    public static TableSchema ordersSchema() {
        return TableSchema.of(ORDERS,
            Column.objectId("OBJECTID"),
            Column.of("orderid", ColumnType.INTEGER),
            Column.text("supplier", 50),
            Column.of("total", ColumnType.DOUBLE),
            Column.text("status", 20));
    }

    /**
     * Inserts an order row.
     *
     * @return the new OBJECTID
     */
    protected long insertOrder(int orderid, String supplier, double total) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("orderid", orderid);
        values.put("supplier", supplier);
        values.put("total", total);
        return new CrudEngine(store, ORDERS).insert(values);
    }

    /**
     * Reads every row of a table in cursor order, geometry under {@code SHAPE@}.
     *
     * @param table the table name
     * @return row maps
     */
    protected List<Map<String, Object>> snapshot(String table) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (RowCursor cursor = store.openReadCursor(table, null, Filter.all())) {
            while (cursor.hasNext()) {
                Row row = cursor.next();
                Map<String, Object> map = row.toMap();
                if (row.layout().hasGeometry()) {
                    map.put("SHAPE@", row.geometry());
                }
                rows.add(map);
            }
        }
        return rows;
    }

    /**
     * Asserts the number of rows in a table.
     *
     * @param table the table name
     * @param expected expected row count
     */
    protected void assertRowCount(String table, long expected) {
        long actual = store.rowCount(table, Filter.all());
        assertEquals(expected, actual,
            String.format("Expected %d rows in %s but found %d", expected, table, actual));
    }
}
