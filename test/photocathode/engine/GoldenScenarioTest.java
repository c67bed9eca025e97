package photocathode.engine;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import photocathode.ScenarioFactory;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;
import photocathode.config.SimulationConfigBuilder;
import photocathode.engine.emission.TransmissionFractionModel;
import photocathode.model.Bin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Контрольный прогон: tau = 100 фс, физическая модель, сетка 200 x 200.
 */
class GoldenScenarioTest {

    /** Допуск относительно эталонного прогона: расчёт детерминирован, расхождение только от округлений. */
    private static final double REL_TOL = 1e-6;

    // эталон: tau = 100 фс, N = 1e6, WF = 4.25 эВ, hv = 4.75 эВ, E = 1e6 В/м, 200 x 200
    private static final double REF_SIGMA = 1.4710768566758892e-15;
    private static final double REF_ETA = 2.16026885063753e-51;
    private static final double REF_GAMMA = 3.101608159676719e-33;
    private static final double REF_GAMMA_OFFSET = 1.152319378131025e-25;
    private static final double REF_X_PEAK = 8.92196e-8;

    private static ApparatusParameters params;
    private static SimulationEngine engine;
    private static ResultSummary summary;

    @BeforeAll
    static void runOnce() throws InterruptedException {
        params = ScenarioFactory.goldenApparatus();
        SimulationConfig cfg = new SimulationConfigBuilder().setGrid(200, 200).build();
        engine = new SimulationEngine(params, cfg);
        engine.simulate();
        summary = engine.process();
    }

    @Test
    void physicalModelIsUsed() {
        TransmissionFractionModel m = assertInstanceOf(TransmissionFractionModel.class, engine.getFractionModel());
        double vnorm = m.getIntegrator().normalization();
        assertTrue(vnorm > 5e-5 && vnorm < 6e-5, "vnorm=" + vnorm);
    }

    @Test
    void electronsAreConserved() {
        assertEquals(params.getNumElectrons(), engine.getTotalElectronsAllocated(), params.getNumElectrons() * 0.01);
        assertEquals(engine.getTotalElectronsAllocated(), summary.getTotalAllocated());
    }

    @Test
    void peakIsInsideTheDomain() {
        assertTrue(summary.getXPeak() > 0.0 && summary.getXPeak() <= engine.getDmax() * (1 + 1e-12));
        // за 600 фс поле добавляет ~1e5 м/с, но пик всё ещё медленнее vmax
        assertTrue(summary.getVPeak() > 0.0 && summary.getVPeak() < params.getMaxVelocity(),
                "vPeak=" + summary.getVPeak());
    }

    @Test
    void matchesReferenceRun() {
        assertEquals(REF_SIGMA, summary.getSigma(), REF_SIGMA * REL_TOL);
        assertEquals(REF_ETA, summary.getEta(), REF_ETA * REL_TOL);
        assertEquals(REF_GAMMA, summary.getGamma(), REF_GAMMA * REL_TOL);
        assertEquals(REF_GAMMA_OFFSET, summary.getGammaOffset(), REF_GAMMA_OFFSET * REL_TOL);
        // эталон пика записан с 6 знаками, бин шириной ~1.4e-9 м
        assertEquals(REF_X_PEAK, summary.getXPeak(), REF_X_PEAK * 1e-5);
    }

    @Test
    void pulseShapeParameters() {
        assertTrue(summary.getSigma() > 0.0);
        assertTrue(Math.sqrt(summary.getSigma()) < engine.getDmax());
        assertTrue(summary.getEta() >= 0.0);
        assertTrue(summary.getFitBinCount() >= 2);
        // быстрые электроны уходят дальше: положительная корреляция x-p
        assertTrue(summary.getGamma() > 0.0, "gamma=" + summary.getGamma());
        assertEquals(6 * 100e-15, summary.getEmissionTimeOffset(), 1e-27);
    }

    @Test
    void parallelRunReproducesHistogram() throws InterruptedException {
        SimulationConfig cfg = new SimulationConfigBuilder().setGrid(200, 200).setThreads(2).build();
        SimulationEngine par = new SimulationEngine(params, cfg);
        par.simulate();

        for (int i = 0; i < 200; i++) {
            Bin a = engine.getBins().get(i);
            Bin b = par.getBins().get(i);
            assertEquals(a.result().getTotalCount(), b.result().getTotalCount(), 0.0, "bin " + i);
            assertEquals(a.result().getMomentumUncertainty(), b.result().getMomentumUncertainty(), 0.0, "bin " + i);
        }
        ResultSummary s = par.process();
        assertEquals(summary.getXPeak(), s.getXPeak());
        assertEquals(summary.getVPeak(), s.getVPeak());
        assertEquals(summary.getSigma(), s.getSigma());
        assertEquals(summary.getEta(), s.getEta());
    }
}
