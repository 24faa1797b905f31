package com.salesanalytics.infrastructure.io;

import com.salesanalytics.domain.exception.SalesDataReadException;
import com.salesanalytics.domain.model.ColumnMapping;
import com.salesanalytics.domain.model.RawSalesTable;
import com.salesanalytics.domain.service.DatasetPreparer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SalesCsvReaderTest {

    private final SalesCsvReader reader = new SalesCsvReader();

    @Test
    void testRead_HeaderAndRows() {
        RawSalesTable table = reader.read(
                " date , model,units_sold,avg_price\n"
                        + "2022-01-01,X5,100,62000\n"
                        + "2022-02-01,\"3 Series, Touring\",80,45000.50\n");

        assertEquals(List.of("date", "model", "units_sold", "avg_price"), table.getColumns());
        assertEquals(2, table.size());
        assertEquals("X5", table.getRows().get(0).get("model"));
        assertEquals("3 Series, Touring", table.getRows().get(1).get("model"));
        assertEquals("45000.50", table.getRows().get(1).get("avg_price"));
    }

    @Test
    void testRead_ShortRowLeavesMissingCellsNull() {
        RawSalesTable table = reader.read("date,model,units_sold,avg_price\n2022-01-01,X5\n");

        assertEquals(1, table.size());
        assertEquals("X5", table.getRows().get(0).get("model"));
        assertNull(table.getRows().get(0).get("units_sold"));
        assertNull(table.getRows().get(0).get("avg_price"));
    }

    @Test
    void testRead_SkipsBlankLines() {
        RawSalesTable table = reader.read("date,model,units_sold,avg_price\n\n2022-01-01,X5,1,2\n\n");

        assertEquals(1, table.size());
    }

    @Test
    void testRead_HeaderOnly() {
        RawSalesTable table = reader.read("date,model,units_sold,avg_price\n");

        assertEquals(4, table.getColumns().size());
        assertEquals(0, table.size());
    }

    @Test
    void testRead_RowLongerThanHeaderIsFatal() {
        SalesDataReadException ex = assertThrows(SalesDataReadException.class,
                () -> reader.read("date,model\n2022-01-01,X5,100\n"));

        assertTrue(ex.getMessage().contains("Line 2"));
    }

    @Test
    void testRead_EmptyContent() {
        assertThrows(SalesDataReadException.class, () -> reader.read(""));
        assertThrows(SalesDataReadException.class, () -> reader.read("   \n"));
    }

    @Test
    void testRead_File(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sales.csv");
        Files.write(file, List.of("date,model,units_sold,avg_price", "2022-01-01,i3,12,39000"), StandardCharsets.UTF_8);

        RawSalesTable table = reader.read(file);

        assertEquals(1, table.size());
        assertEquals("i3", table.getRows().get(0).get("model"));
    }

    @Test
    void testRead_MissingFile(@TempDir Path dir) {
        SalesDataReadException ex = assertThrows(SalesDataReadException.class,
                () -> reader.read(dir.resolve("missing.csv")));

        assertTrue(ex.getMessage().startsWith("Data file not found"));
    }

    @Test
    void testRead_StripsByteOrderMarkFromText() {
        RawSalesTable table = reader.read("\uFEFFdate,model,units_sold,avg_price\n2022-01-01,A,10,5\n");

        assertEquals(List.of("date", "model", "units_sold", "avg_price"), table.getColumns());
        assertEquals("2022-01-01", table.getRows().get(0).get("date"));
    }

    @Test
    void testRead_StripsByteOrderMarkFromFile(@TempDir Path dir) throws IOException {
        // Given: a spreadsheet "CSV UTF-8" export, BOM bytes first
        Path file = dir.resolve("export.csv");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "date,model,units_sold,avg_price\n2022-01-01,A,10,5\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(file, content);

        // When
        RawSalesTable table = reader.read(file);

        // Then
        assertTrue(table.hasColumn("date"));
        assertEquals("2022-01-01", table.getRows().get(0).get("date"));
        assertTrue(new DatasetPreparer(ColumnMapping.defaults()).validate(table).isOk());
    }
}
