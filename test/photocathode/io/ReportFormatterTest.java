package photocathode.io;

import org.junit.jupiter.api.Test;
import photocathode.config.ApparatusParameters;
import photocathode.engine.ResultSummary;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportFormatterTest {

    @Test
    void reportHasConditionsAndResults() {
        ApparatusParameters p = new ApparatusParameters(1e-11, 1e6, 4.25, 4.75, 1e6);
        ResultSummary s = new ResultSummary(2.0e-12, 3.0, 4.0e-50, 5.0e-37, 6.0e-25,
                7.0e-5, 8.0e5, 100.0, 12, 6e-11, 1e6);

        String r = ReportFormatter.report(p, s);

        assertTrue(r.startsWith("### Conditions ###\n"));
        assertTrue(r.contains("tau = 1.0E-11\n"));
        assertTrue(r.contains("WF = 4.25\n"));
        assertTrue(r.contains("photon_energy = 4.75\n"));
        assertTrue(r.contains("DC_field = 1000000.0\n"));
        assertTrue(r.indexOf("### Results ###") > r.indexOf("DC_field"));
        assertTrue(r.contains("Electron pulse peak position = 7.0E-5\n"));
        assertTrue(r.contains("Electron pulse peak velocity = 800000.0\n"));
        assertTrue(r.contains("sigma_z = 2.0E-12\n"));
        assertTrue(r.contains("gamma_offset = 6.0E-25\n"));
        assertTrue(r.contains("3.0 * exp(-(x - 7.0E-5)^2 / (2 * 2.0E-12))"));
        assertTrue(r.contains("(5.0E-37 / 2.0E-12) * x + 6.0E-25"));
        assertTrue(r.endsWith("Emission time offset = 6.0E-11\n"));
    }
}
