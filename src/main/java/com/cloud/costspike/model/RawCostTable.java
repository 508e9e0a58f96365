package com.cloud.costspike.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Untyped billing table as uploaded: a header row plus cell values")
public class RawCostTable {

    @Schema(description = "Column names, matched case-insensitively after trimming",
            example = "[\"Date\", \"Service\", \"Cost\"]")
    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Schema(description = "Row values in column order. Cells may be strings or numbers.",
            example = "[[\"2025-01-01\", \"EC2\", 10.0]]")
    @Builder.Default
    private List<List<Object>> rows = new ArrayList<>();

    public int rowCount() {
        return rows == null ? 0 : rows.size();
    }
}
