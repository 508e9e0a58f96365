package com.cloud.costspike.service;

import com.cloud.costspike.exception.SchemaException;
import com.cloud.costspike.model.RawCostTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvCostTableReaderTest {

    private final CsvCostTableReader reader = new CsvCostTableReader();

    @Test
    void read_splitsHeaderFromRows() {
        RawCostTable table = reader.read(csv("Date,Service,Cost\n2025-01-01,EC2,10.5\n2025-01-02,S3,3\n"));

        assertThat(table.getColumns()).containsExactly("Date", "Service", "Cost");
        assertThat(table.getRows()).hasSize(2);
        assertThat(table.getRows().get(0)).containsExactly("2025-01-01", "EC2", "10.5");
    }

    @Test
    void read_handlesQuotedCellsAndBlankLines() {
        RawCostTable table = reader.read(csv("date,service,cost\n\n2025-01-01,\"Amazon EC2, Compute\",7\n\n"));

        assertThat(table.getRows()).hasSize(1);
        assertThat(table.getRows().get(0).get(1)).isEqualTo("Amazon EC2, Compute");
    }

    @Test
    void read_headerOnly_hasNoRows() {
        RawCostTable table = reader.read(csv("date,service,cost\n"));

        assertThat(table.getColumns()).isEqualTo(List.of("date", "service", "cost"));
        assertThat(table.getRows()).isEmpty();
    }

    @Test
    void read_emptyFile_throwsSchemaException() {
        assertThatThrownBy(() -> reader.read(csv("")))
                .isInstanceOf(SchemaException.class);
    }

    private static InputStream csv(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
