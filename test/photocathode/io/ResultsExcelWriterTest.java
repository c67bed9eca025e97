package photocathode.io;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import photocathode.ScenarioFactory;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;
import photocathode.engine.ResultSummary;
import photocathode.model.Bin;

import java.io.FileInputStream;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultsExcelWriterTest {

    @TempDir
    Path tmp;

    private final ApparatusParameters apparatus = ScenarioFactory.defaultApparatus();
    private final SimulationConfig cfg = ScenarioFactory.defaultConfig(1);

    private static ResultSummary summary(double xPeak) {
        return new ResultSummary(2.0e-12, 3.0, 4.0e-50, 5.0e-37, 6.0e-25,
                xPeak, 8.0e5, 100.0, 12, 6e-11, 1e6);
    }

    @Test
    void writesBinsAndSummarySheets() throws Exception {
        Bin a = new Bin(0.0, 1e-6);
        Bin b = new Bin(1e-6, 2e-6);
        b.addSlice(42.0, 1e5, 1e5);

        Path out = tmp.resolve("run.xlsx");
        ResultsExcelWriter.writeXlsx(out.toString(), apparatus, cfg, List.of(a, b), summary(7e-5));

        try (FileInputStream in = new FileInputStream(out.toFile()); Workbook wb = new XSSFWorkbook(in)) {
            Sheet bins = wb.getSheet(ResultsExcelWriter.BINS_SHEET);
            assertNotNull(bins);
            assertTrue(bins.getRow(0).getCell(0).getStringCellValue().startsWith("tau="));
            assertEquals("bin position", bins.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1e-6, bins.getRow(2).getCell(0).getNumericCellValue());
            assertEquals(0.0, bins.getRow(2).getCell(1).getNumericCellValue());
            assertEquals(2e-6, bins.getRow(3).getCell(0).getNumericCellValue());
            assertEquals(42.0, bins.getRow(3).getCell(1).getNumericCellValue());

            Sheet sum = wb.getSheet(ResultsExcelWriter.SUMMARY_SHEET);
            assertNotNull(sum);
            Row xPeak = findRow(sum, "x_peak");
            assertNotNull(xPeak);
            assertEquals(7e-5, xPeak.getCell(1).getNumericCellValue());
            assertEquals(apparatus.getTau(), findRow(sum, "tau").getCell(1).getNumericCellValue());
        }
    }

    @Test
    void writesSweepSheet() throws Exception {
        double[] taus = {1e-13, 1e-12};
        Path out = tmp.resolve("sweep.xlsx");
        ResultsExcelWriter.writeSweepXlsx(out.toString(), apparatus, cfg, "tau", taus,
                List.of(summary(1e-5), summary(2e-5)));

        try (FileInputStream in = new FileInputStream(out.toFile()); Workbook wb = new XSSFWorkbook(in)) {
            Sheet sweep = wb.getSheet(ResultsExcelWriter.SWEEP_SHEET);
            assertNotNull(sweep);
            assertEquals("tau", sweep.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1e-12, sweep.getRow(3).getCell(0).getNumericCellValue());
            assertEquals(2e-5, sweep.getRow(3).getCell(1).getNumericCellValue());
            assertEquals(3, sweep.getLastRowNum());
        }
    }

    @Test
    void sweepRejectsMismatchedLengths() {
        Path out = tmp.resolve("bad.xlsx");
        assertThrows(IllegalArgumentException.class, () -> ResultsExcelWriter.writeSweepXlsx(
                out.toString(), apparatus, cfg, "tau", new double[]{1e-12}, List.of()));
    }

    private static Row findRow(Sheet sh, String name) {
        for (Row r : sh) {
            if (r.getCell(0) != null && name.equals(r.getCell(0).getStringCellValue())) {
                return r;
            }
        }
        return null;
    }
}
