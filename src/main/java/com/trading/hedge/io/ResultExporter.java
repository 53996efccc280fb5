package com.trading.hedge.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.trading.hedge.engine.ResultRow;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Tabular export of a result series as CSV or JSON.
 */
public final class ResultExporter {
    static final String CSV_HEADER = "date,spot,total_pnl,stock_pos,gamma_hedge_pos,vega_hedge_pos,txn_costs,funding_cost,cash";

    private ResultExporter() {
        // Utility class
    }

    public static void writeCsv(List<ResultRow> rows, Writer out) throws IOException {
        out.write(CSV_HEADER);
        out.write('\n');
        for (ResultRow r : rows) {
            out.write(String.format(Locale.ROOT, "%s,%.10g,%.10g,%.10g,%.10g,%.10g,%.10g,%.10g,%.10g%n",
                    r.date(), r.spot(), r.totalPnl(), r.stockPosition(), r.gammaHedgePosition(),
                    r.vegaHedgePosition(), r.transactionCost(), r.fundingCost(), r.cash()));
        }
        out.flush();
    }

    public static void writeCsv(List<ResultRow> rows, Path path) throws IOException {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeCsv(rows, w);
        }
    }

    public static String toCsv(List<ResultRow> rows) {
        StringWriter sw = new StringWriter();
        try {
            writeCsv(rows, sw);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }

    public static String toJson(List<ResultRow> rows) {
        try {
            return ScenarioLoader.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + rows.size() + " result rows", e);
        }
    }

    public static void writeJson(List<ResultRow> rows, Path path) throws IOException {
        ScenarioLoader.MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), rows);
    }
}
