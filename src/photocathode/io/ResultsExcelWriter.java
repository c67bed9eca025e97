package photocathode.io;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;
import photocathode.engine.ResultSummary;
import photocathode.model.Bin;
import photocathode.model.BinResult;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Выгрузка результатов в xlsx (Apache POI):
 * - BINS: гистограмма по бинам,
 * - SUMMARY: параметры AG-модели,
 * - SWEEP: по строке на точку перебора параметра.
 */
public final class ResultsExcelWriter {

    public static final String BINS_SHEET = "BINS";
    public static final String SUMMARY_SHEET = "SUMMARY";
    public static final String SWEEP_SHEET = "SWEEP";

    private static final int COLUMN_WIDTH_CHARS = 22;

    private ResultsExcelWriter() {}

    public static void writeXlsx(String path,
                                 ApparatusParameters apparatus,
                                 SimulationConfig cfg,
                                 List<Bin> bins,
                                 ResultSummary summary) throws IOException {

        try (Workbook wb = new XSSFWorkbook()) {
            Styles st = new Styles(wb);

            // ===== BINS sheet =====
            Sheet binsSheet = wb.createSheet(BINS_SHEET);
            int r = 0;

            Row passport = binsSheet.createRow(r++);
            passport.createCell(0).setCellValue(buildPassport(apparatus, cfg));
            // колонка A узкая: паспорт её ширину не задаёт
            binsSheet.setColumnWidth(0, 14 * 256);

            Row hdr = binsSheet.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, "bin position", st.header);
            c = writeHeader(hdr, c, "number of electrons", st.header);
            c = writeHeader(hdr, c, "bin average momentum", st.header);
            c = writeHeader(hdr, c, "bin momentum uncertainty", st.header);

            for (Bin bin : bins) {
                BinResult res = bin.result();
                Row row = binsSheet.createRow(r++);
                int cc = 0;
                writeNumber(row, cc++, bin.getEnd(), st.scientific);
                writeNumber(row, cc++, res.getTotalCount(), st.number);
                writeNumber(row, cc++, res.getAvgMomentum(), st.scientific);
                writeNumber(row, cc++, res.getMomentumUncertainty(), st.scientific);
            }
            setWidthsFrom(binsSheet, c, 1);

            // ===== SUMMARY sheet =====
            Sheet sum = wb.createSheet(SUMMARY_SHEET);
            int s = 0;
            s = writePair(sum, s, "tau", apparatus.getTau(), st);
            s = writePair(sum, s, "WF", apparatus.getWorkFunction(), st);
            s = writePair(sum, s, "photon_energy", apparatus.getPhotonEnergy(), st);
            s = writePair(sum, s, "DC_field", apparatus.getDcField(), st);
            s = writePair(sum, s, "num_electrons", apparatus.getNumElectrons(), st);
            s++;
            s = writeSummaryRows(sum, s, summary, st);
            setWidthsFrom(sum, 2, 0);

            try (FileOutputStream out = new FileOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    /**
     * @param paramName имя перебираемого параметра (заголовок первого столбца)
     * @param values    значения параметра, по одному на элемент summaries
     */
    public static void writeSweepXlsx(String path,
                                      ApparatusParameters baseApparatus,
                                      SimulationConfig cfg,
                                      String paramName,
                                      double[] values,
                                      List<ResultSummary> summaries) throws IOException {

        if (values.length != summaries.size()) {
            throw new IllegalArgumentException("values.length != summaries.size");
        }

        try (Workbook wb = new XSSFWorkbook()) {
            Styles st = new Styles(wb);

            Sheet sweep = wb.createSheet(SWEEP_SHEET);
            int r = 0;

            Row passport = sweep.createRow(r++);
            passport.createCell(0).setCellValue(buildPassport(baseApparatus, cfg));
            sweep.setColumnWidth(0, 14 * 256);

            Row hdr = sweep.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, paramName, st.header);
            c = writeHeader(hdr, c, "x_peak", st.header);
            c = writeHeader(hdr, c, "v_peak", st.header);
            c = writeHeader(hdr, c, "sigma_z", st.header);
            c = writeHeader(hdr, c, "eta_z", st.header);
            c = writeHeader(hdr, c, "gamma_z", st.header);
            c = writeHeader(hdr, c, "gamma_offset", st.header);
            c = writeHeader(hdr, c, "sigma_coeff", st.header);
            c = writeHeader(hdr, c, "emission_time", st.header);

            for (int k = 0; k < values.length; k++) {
                ResultSummary e = summaries.get(k);
                Row row = sweep.createRow(r++);
                int cc = 0;
                writeNumber(row, cc++, values[k], st.scientific);
                writeNumber(row, cc++, e.getXPeak(), st.scientific);
                writeNumber(row, cc++, e.getVPeak(), st.scientific);
                writeNumber(row, cc++, e.getSigma(), st.scientific);
                writeNumber(row, cc++, e.getEta(), st.scientific);
                writeNumber(row, cc++, e.getGamma(), st.scientific);
                writeNumber(row, cc++, e.getGammaOffset(), st.scientific);
                writeNumber(row, cc++, e.getSigmaCoeff(), st.scientific);
                writeNumber(row, cc++, e.getEmissionTimeOffset(), st.scientific);
            }
            setWidthsFrom(sweep, c, 1);

            try (FileOutputStream out = new FileOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    private static int writeSummaryRows(Sheet sh, int r, ResultSummary s, Styles st) {
        r = writePair(sh, r, "x_peak", s.getXPeak(), st);
        r = writePair(sh, r, "v_peak", s.getVPeak(), st);
        r = writePair(sh, r, "sigma_z", s.getSigma(), st);
        r = writePair(sh, r, "eta_z", s.getEta(), st);
        r = writePair(sh, r, "gamma_z", s.getGamma(), st);
        r = writePair(sh, r, "gamma_offset", s.getGammaOffset(), st);
        r = writePair(sh, r, "sigma_coeff", s.getSigmaCoeff(), st);
        r = writePair(sh, r, "fit_bins", s.getFitBinCount(), st);
        r = writePair(sh, r, "emission_time", s.getEmissionTimeOffset(), st);
        r = writePair(sh, r, "allocated", s.getTotalAllocated(), st);
        return r;
    }

    private static int writePair(Sheet sh, int r, String name, double value, Styles st) {
        Row row = sh.createRow(r);
        writeHeader(row, 0, name, st.header);
        writeNumber(row, 1, value, st.scientific);
        return r + 1;
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    // autoSizeColumn требует шрифтов AWT, на сервере без fontconfig падает
    private static void setWidthsFrom(Sheet sh, int cols, int fromCol) {
        for (int i = fromCol; i < cols; i++) sh.setColumnWidth(i, COLUMN_WIDTH_CHARS * 256);
    }

    private static String buildPassport(ApparatusParameters p, SimulationConfig cfg) {
        return String.format(Locale.ROOT,
                "tau=%.3e; N=%.3e; WF=%.2f; hv=%.2f; E=%.3e; bins=%d; slices=%d; taus=%d; simple=%b; epsAbs=%.1e",
                p.getTau(),
                p.getNumElectrons(),
                p.getWorkFunction(),
                p.getPhotonEnergy(),
                p.getDcField(),
                cfg.getNumSpaceBins(),
                cfg.getNumTimeSlices(),
                cfg.getNumTaus(),
                cfg.isSimple(),
                cfg.getEpsAbs()
        );
    }

    private static final class Styles {
        final CellStyle header;
        final CellStyle number;
        final CellStyle scientific;

        Styles(Workbook wb) {
            DataFormat df = wb.createDataFormat();

            header = wb.createCellStyle();
            header.setAlignment(HorizontalAlignment.CENTER);
            header.setVerticalAlignment(VerticalAlignment.CENTER);

            number = wb.createCellStyle();
            number.setAlignment(HorizontalAlignment.CENTER);
            number.setDataFormat(df.getFormat("0.00"));

            // импульсы ~1e-25, положения ~1e-6: только научный формат
            scientific = wb.createCellStyle();
            scientific.setAlignment(HorizontalAlignment.CENTER);
            scientific.setDataFormat(df.getFormat("0.000E+00"));
        }
    }
}
