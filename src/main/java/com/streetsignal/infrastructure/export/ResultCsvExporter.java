package com.streetsignal.infrastructure.export;

import com.opencsv.CSVWriter;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.StreetCount;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders district results as one CSV row per district with interleaved
 * street/count columns for the top N streets.
 */
@Component
public class ResultCsvExporter {

    public static final String STATUS_SUCCESS = "Success";
    public static final String STATUS_ERROR = "Error";

    public String export(List<DistrictResult> results, int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be positive: " + topN);
        }
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header(topN), false);
            for (DistrictResult result : results) {
                writer.writeNext(row(result, topN), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export", e);
        }
        return out.toString();
    }

    String[] header(int topN) {
        List<String> columns = new ArrayList<>();
        columns.add("District");
        for (int i = 1; i <= topN; i++) {
            columns.add("Street " + i);
            columns.add("Count " + i);
        }
        columns.add("Total POIs");
        columns.add("Total Streets");
        columns.add("Status");
        columns.add("Notes");
        return columns.toArray(new String[0]);
    }

    String[] row(DistrictResult result, int topN) {
        List<String> cells = new ArrayList<>();
        cells.add(result.getDistrict().getCode());

        List<StreetCount> top = result.getTopStreets();
        for (int i = 0; i < topN; i++) {
            if (!result.isSuccess()) {
                // failed rows leave the street block empty
                cells.add("");
                cells.add("");
            } else if (i < top.size()) {
                cells.add(top.get(i).getName());
                cells.add(String.valueOf(top.get(i).getCount()));
            } else {
                cells.add("");
                cells.add("0");
            }
        }

        cells.add(String.valueOf(result.getTotalPois()));
        cells.add(String.valueOf(result.getTotalStreets()));
        cells.add(result.isSuccess() ? STATUS_SUCCESS : STATUS_ERROR);
        cells.add(result.getError() == null ? "" : result.getError());
        return cells.toArray(new String[0]);
    }
}
