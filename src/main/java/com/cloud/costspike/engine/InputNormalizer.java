package com.cloud.costspike.engine;

import com.cloud.costspike.exception.SchemaException;
import com.cloud.costspike.exception.ValueParseException;
import com.cloud.costspike.model.CostRecord;
import com.cloud.costspike.model.RawCostTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an untyped billing table into typed {@link CostRecord}s sorted by (service, date).
 *
 * Only the three required columns are read; extra columns are ignored. Costs are not
 * bounded and duplicates are kept.
 */
public class InputNormalizer {

    private static final Logger log = LoggerFactory.getLogger(InputNormalizer.class);

    public static final String DATE = "date";
    public static final String SERVICE = "service";
    public static final String COST = "cost";

    private static final List<String> REQUIRED_COLUMNS = List.of(DATE, SERVICE, COST);

    // Plain decimal or scientific notation; no type suffixes or hex literals
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("([+-]?)(inf|infinity)", Pattern.CASE_INSENSITIVE);

    // Tried in order; date-time forms keep only their date part
    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            LocalDate::parse,
            text -> LocalDateTime.parse(text).toLocalDate(),
            text -> OffsetDateTime.parse(text).toLocalDate(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)).toLocalDate(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT)).toLocalDate(),
            text -> LocalDate.parse(text, DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT)),
            text -> LocalDate.parse(text, DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT)),
            text -> LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE));

    /** Keeps row order for equal keys (List.sort is stable). */
    private static final Comparator<CostRecord> SERVICE_THEN_DATE =
            Comparator.comparing(CostRecord::getService).thenComparing(CostRecord::getDate);

    public List<CostRecord> normalize(RawCostTable table) {
        if (table == null || table.getColumns() == null) {
            throw new SchemaException(REQUIRED_COLUMNS);
        }
        Map<String, Integer> columnIndex = resolveColumns(table.getColumns());

        int dateIdx = columnIndex.get(DATE);
        int serviceIdx = columnIndex.get(SERVICE);
        int costIdx = columnIndex.get(COST);

        List<List<Object>> rows = table.getRows() == null ? List.of() : table.getRows();
        List<CostRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            records.add(CostRecord.builder()
                    .date(parseDate(cell(row, dateIdx), i))
                    .service(parseService(cell(row, serviceIdx), i))
                    .cost(parseCost(cell(row, costIdx), i))
                    .build());
        }

        records.sort(SERVICE_THEN_DATE);
        log.debug("Normalized {} rows", records.size());
        return records;
    }

    /**
     * Maps each required column name to its position. The first header matching a name wins.
     */
    private Map<String, Integer> resolveColumns(List<String> columns) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            if (name == null) continue;
            index.putIfAbsent(name.strip().toLowerCase(Locale.ROOT), i);
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !index.containsKey(c))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Rejecting table with columns {}: missing {}", columns, missing);
            throw new SchemaException(missing);
        }
        return index;
    }

    private static Object cell(List<Object> row, int idx) {
        if (row == null || idx >= row.size()) return null;
        return row.get(idx);
    }

    static LocalDate parseDate(Object raw, int rowIndex) {
        if (raw instanceof LocalDate) return (LocalDate) raw;
        if (raw instanceof LocalDateTime) return ((LocalDateTime) raw).toLocalDate();
        if (raw == null) {
            throw new ValueParseException(DATE, null, rowIndex, "missing value");
        }

        String text = raw.toString().strip();
        if (text.isEmpty()) {
            throw new ValueParseException(DATE, raw, rowIndex, "missing value");
        }

        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            LocalDate date = tryParse(parser, text);
            if (date != null) return date;
        }
        throw new ValueParseException(DATE, raw, rowIndex, "unrecognized date format");
    }

    // null means "not this layout"; the caller reports the failure once all layouts are tried
    private static LocalDate tryParse(Function<String, LocalDate> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String parseService(Object raw, int rowIndex) {
        if (raw == null) {
            throw new ValueParseException(SERVICE, null, rowIndex, "missing value");
        }
        String service = raw.toString().strip();
        if (service.isEmpty()) {
            throw new ValueParseException(SERVICE, raw, rowIndex, "missing value");
        }
        return service;
    }

    static double parseCost(Object raw, int rowIndex) {
        if (raw == null) {
            throw new ValueParseException(COST, null, rowIndex, "missing value");
        }

        double cost;
        if (raw instanceof Number) {
            cost = ((Number) raw).doubleValue();
        } else {
            String text = raw.toString().strip();
            if (text.isEmpty()) {
                throw new ValueParseException(COST, raw, rowIndex, "missing value");
            }
            cost = parseCostText(text, raw, rowIndex);
        }

        if (Double.isNaN(cost)) {
            throw new ValueParseException(COST, raw, rowIndex, "not a number");
        }
        return cost;
    }

    private static double parseCostText(String text, Object raw, int rowIndex) {
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        Matcher infinity = INFINITY.matcher(text);
        if (infinity.matches()) {
            return "-".equals(infinity.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new ValueParseException(COST, raw, rowIndex, "not a number");
    }
}
