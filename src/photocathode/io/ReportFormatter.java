package photocathode.io;

import photocathode.config.ApparatusParameters;
import photocathode.engine.ResultSummary;

/**
 * Текстовый отчёт: условия прогона и параметры AG-модели с уравнениями подгонки.
 */
public final class ReportFormatter {

    private ReportFormatter() {}

    public static String conditions(ApparatusParameters p) {
        return "### Conditions ###\n"
                + "tau = " + p.getTau() + "\n"
                + "WF = " + p.getWorkFunction() + "\n"
                + "photon_energy = " + p.getPhotonEnergy() + "\n"
                + "DC_field = " + p.getDcField() + "\n";
    }

    public static String results(ResultSummary s) {
        return "### Results ###\n"
                + "Electron pulse peak position = " + s.getXPeak() + "\n"
                + "Electron pulse peak velocity = " + s.getVPeak() + "\n"
                + "sigma_z = " + s.getSigma() + "\n"
                + "eta_z = " + s.getEta() + "\n"
                + "gamma_z = " + s.getGamma() + "\n"
                + "\n"
                + "gamma_offset = " + s.getGammaOffset() + "\n"
                + "\n"
                + "Fit Equation for sigma:\n"
                + s.getSigmaCoeff() + " * exp(-(x - " + s.getXPeak() + ")^2 / (2 * " + s.getSigma() + "))\n"
                + "Fit Equation for gamma:\n"
                + "(" + s.getGamma() + " / " + s.getSigma() + ") * x + " + s.getGammaOffset() + "\n"
                + "\n"
                + "Emission time offset = " + s.getEmissionTimeOffset() + "\n";
    }

    public static String report(ApparatusParameters p, ResultSummary s) {
        return conditions(p) + results(s);
    }
}
