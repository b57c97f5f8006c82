package org.iomclient.manager.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ColumnDescriptor data class.
 * Verifies that column metadata is captured and the converter follows the format.
 */
class ColumnDescriptorTest {

    @Test
    void testConstructor_allFieldsSet() {
        // Given: Column metadata values
        String columnName = "MSRP";

        // When: ColumnDescriptor is created
        ColumnDescriptor descriptor = new ColumnDescriptor(columnName, ColumnDescriptor.DataType.NUMERIC,
                "DOLLAR", 8, 0);

        // Then: All fields should be accessible
        assertEquals(columnName, descriptor.getColumnName(), "Column name should match");
        assertEquals(ColumnDescriptor.DataType.NUMERIC, descriptor.getDataType(), "Data type should match");
        assertEquals("DOLLAR", descriptor.getFormatName(), "Format name should match");
        assertEquals(8, descriptor.getFormatLength(), "Format length should match");
        assertEquals(0, descriptor.getFormatDecimal(), "Format decimal should match");
        assertEquals(ValueConverter.IDENTITY, descriptor.getConverter(), "Currency is not a calendar format");
    }

    @Test
    void testConstructor_dateFormat() {
        // Given: Numeric column displayed as a date
        ColumnDescriptor descriptor = new ColumnDescriptor("BIRTH", ColumnDescriptor.DataType.NUMERIC,
                "DATE", 9, 0);

        // Then
        assertTrue(descriptor.isDate());
        assertFalse(descriptor.isDatetime());
        assertEquals(ValueConverter.DAYS_SINCE_EPOCH, descriptor.getConverter());
    }

    @Test
    void testConstructor_datetimeFormat() {
        // Given: Numeric column displayed as a timestamp, name with padding and in lower case
        ColumnDescriptor descriptor = new ColumnDescriptor("CREATED", ColumnDescriptor.DataType.NUMERIC,
                " e8601dt ", 26, 6);

        // Then: Name is trimmed and the lookup ignores case
        assertEquals("e8601dt", descriptor.getFormatName());
        assertTrue(descriptor.isDatetime());
    }

    @Test
    void testConstructor_characterColumnIgnoresFormat() {
        // Given: Character column that happens to carry a date-like format name
        ColumnDescriptor descriptor = new ColumnDescriptor("NAME", ColumnDescriptor.DataType.CHARACTER,
                "DATE", 9, 0);

        // Then: Character values are never converted
        assertEquals(ValueConverter.IDENTITY, descriptor.getConverter());
        assertFalse(descriptor.isDate());
    }

    @Test
    void testConstructor_nullFormat() {
        ColumnDescriptor descriptor = new ColumnDescriptor("X", ColumnDescriptor.DataType.NUMERIC, null, 0, 0);

        assertEquals("", descriptor.getFormatName());
        assertEquals("", descriptor.formatSpec());
    }

    @Test
    void testFormatSpec() {
        assertEquals("DOLLAR10.2",
                new ColumnDescriptor("P", ColumnDescriptor.DataType.NUMERIC, "DOLLAR", 10, 2).formatSpec());
        assertEquals("DATE9.",
                new ColumnDescriptor("D", ColumnDescriptor.DataType.NUMERIC, "DATE", 9, 0).formatSpec());
        assertEquals("BEST.",
                new ColumnDescriptor("B", ColumnDescriptor.DataType.NUMERIC, "BEST", 0, 0).formatSpec());
    }

    @Test
    void testToString() {
        // Given: A descriptor
        ColumnDescriptor descriptor = new ColumnDescriptor("price", ColumnDescriptor.DataType.NUMERIC,
                "DOLLAR", 10, 2);

        // When: toString is called
        String result = descriptor.toString();

        // Then: Should contain all field values
        assertTrue(result.contains("price"), "Should contain column name");
        assertTrue(result.contains("NUMERIC"), "Should contain data type");
        assertTrue(result.contains("DOLLAR"), "Should contain format name");
        assertTrue(result.contains("10"), "Should contain format length");
    }
}
