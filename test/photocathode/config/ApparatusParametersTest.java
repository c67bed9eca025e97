package photocathode.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApparatusParametersTest {

    @Test
    void derivedQuantitiesFollowFromInputs() {
        ApparatusParameters p = new ApparatusParameters(10e-12, 1e6, 4.25, 4.75, 1e6);

        double energy = PhysicalConstants.ELECTRON_CHARGE * 0.5;
        assertEquals(energy, p.getMaxEnergy(), energy * 1e-12);
        double vmax = Math.sqrt(2 * energy / PhysicalConstants.ELECTRON_MASS);
        assertEquals(vmax, p.getMaxVelocity(), vmax * 1e-12);
        double acc = PhysicalConstants.ELECTRON_CHARGE * 1e6 / PhysicalConstants.ELECTRON_MASS;
        assertEquals(acc, p.getAcceleration(), acc * 1e-12);

        // ~4.2e5 м/с для избытка 0.5 эВ
        assertTrue(p.getMaxVelocity() > 4.0e5 && p.getMaxVelocity() < 4.4e5);
    }

    @Test
    void barrierWavenumberUsesWorkFunctionInElectronVolts() {
        ApparatusParameters p = new ApparatusParameters(10e-12, 1e6, 4.25, 4.75, 1e6);
        double kv = Math.sqrt(2 * PhysicalConstants.ELECTRON_MASS * 4.25) / PhysicalConstants.HBAR;
        assertEquals(kv, p.getBarrierWavenumber(), kv * 1e-12);
    }

    @Test
    void zeroFieldIsAllowed() {
        ApparatusParameters p = new ApparatusParameters(1e-12, 10, 4.25, 4.75, 0.0);
        assertEquals(0.0, p.getAcceleration());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(0.0, 1e6, 4.25, 4.75, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(-1e-12, 1e6, 4.25, 4.75, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 0.0, 4.25, 4.75, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 1e6, 0.0, 4.75, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 1e6, 4.25, 4.25, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 1e6, 4.25, 4.0, 1e6));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 1e6, 4.25, 4.75, -1.0));
        assertThrows(IllegalArgumentException.class, () -> new ApparatusParameters(1e-12, 1e6, 4.25, 4.75, Double.NaN));
    }

    @Test
    void builderCopiesAndOverrides() {
        ApparatusParameters base = new ApparatusParametersBuilder().build();
        assertEquals(10e-12, base.getTau());
        assertEquals(1e6, base.getNumElectrons());
        assertEquals(4.25, base.getWorkFunction());
        assertEquals(4.75, base.getPhotonEnergy());
        assertEquals(1e6, base.getDcField());

        ApparatusParameters p = ApparatusParametersBuilder.from(base).setTau(100e-15).setNumElectrons(500).build();
        assertEquals(100e-15, p.getTau());
        assertEquals(500, p.getNumElectrons());
        assertEquals(base.getPhotonEnergy(), p.getPhotonEnergy());

        ApparatusParametersBuilder bad = ApparatusParametersBuilder.from(base).setPhotonEnergy(4.0);
        assertThrows(IllegalArgumentException.class, bad::build);
    }
}
