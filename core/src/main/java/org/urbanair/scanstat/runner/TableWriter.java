/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package org.urbanair.scanstat.runner;

import java.io.IOException;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.urbanair.scanstat.returntypes.CellScore;
import org.urbanair.scanstat.returntypes.SearchRegion;

/**
 * Writes scan output as delimited text with a header row.
 */
public class TableWriter {

    public static final String[] REGION_COLUMNS = { "row_min", "row_max", "col_min", "col_max",
            "measurement_start_utc", "measurement_end_utc", "baseline", "baseline_upper", "baseline_lower", "actual",
            "ebp", "ebp_lower", "ebp_upper", "kulldorff", "kulldorff_lower", "kulldorff_upper", "ebp_asym",
            "ebp_asym_lower", "ebp_asym_upper" };

    public static final String[] CELL_COLUMNS = { "row", "col", "measurement_start_utc", "measurement_end_utc",
            "ebp_mean", "ebp_lower_mean", "ebp_upper_mean", "kulldorff_mean", "kulldorff_lower_mean",
            "kulldorff_upper_mean", "ebp_asym_mean", "ebp_asym_lower_mean", "ebp_asym_upper_mean", "ebp_std" };

    private final char delimiter;

    public TableWriter(char delimiter) {
        this.delimiter = delimiter;
    }

    public void writeRegions(List<SearchRegion> regions, Appendable out) throws IOException {
        CSVPrinter printer = printer(out, REGION_COLUMNS);
        for (SearchRegion r : regions) {
            printer.printRecord(r.getRowMin(), r.getRowMax(), r.getColMin(), r.getColMax(),
                    r.getMeasurementStartUtc(), r.getMeasurementEndUtc(), r.getBaseline(), r.getBaselineUpper(),
                    r.getBaselineLower(), r.getActual(), r.getEbp(), r.getEbpLower(), r.getEbpUpper(),
                    r.getKulldorff(), r.getKulldorffLower(), r.getKulldorffUpper(), r.getEbpAsym(),
                    r.getEbpAsymLower(), r.getEbpAsymUpper());
        }
        printer.flush();
    }

    public void writeCells(List<CellScore> cells, Appendable out) throws IOException {
        CSVPrinter printer = printer(out, CELL_COLUMNS);
        for (CellScore c : cells) {
            printer.printRecord(c.getRow(), c.getCol(), c.getMeasurementStartUtc(), c.getMeasurementEndUtc(),
                    c.getEbpMean(), c.getEbpLowerMean(), c.getEbpUpperMean(), c.getKulldorffMean(),
                    c.getKulldorffLowerMean(), c.getKulldorffUpperMean(), c.getEbpAsymMean(), c.getEbpAsymLowerMean(),
                    c.getEbpAsymUpperMean(), c.getEbpStandardDeviation());
        }
        printer.flush();
    }

    private CSVPrinter printer(Appendable out, String[] header) throws IOException {
        return new CSVPrinter(out,
                CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader(header).setRecordSeparator('\n').build());
    }
}
