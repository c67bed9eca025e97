package photocathode.engine.emission;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AdaptiveQuadratureTest {

    @Test
    void integratesSmoothFunctions() {
        AdaptiveQuadrature q = new AdaptiveQuadrature(0.0, 1e-10);
        assertEquals(2.0, q.integrate(Math::sin, 0.0, Math.PI), 1e-9);
        assertEquals(1.0 / 3.0, q.integrate(x -> x * x, 0.0, 1.0), 1e-12);
    }

    @Test
    void emptyIntervalGivesZero() {
        AdaptiveQuadrature q = new AdaptiveQuadrature(0.0, 1e-6);
        assertEquals(0.0, q.integrate(x -> 1.0, 3.0, 3.0));
    }

    @Test
    void reversedBoundsRejected() {
        AdaptiveQuadrature q = new AdaptiveQuadrature(0.0, 1e-6);
        assertThrows(IllegalArgumentException.class, () -> q.integrate(x -> 1.0, 1.0, 0.0));
    }

    @Test
    void nonConvergenceReportsToleranceAndInterval() {
        // особенность 1/sqrt(x) в нуле не даёт сойтись за 3 итерации
        AdaptiveQuadrature q = new AdaptiveQuadrature(0.0, 1e-12, 3, 1_000_000);

        IntegrationException e = assertThrows(IntegrationException.class,
                () -> q.integrate(x -> 1.0 / Math.sqrt(x), 0.0, 1.0));

        assertEquals(0.0, e.getEpsRel());
        assertEquals(1e-12, e.getEpsAbs());
        assertEquals(0.0, e.getLower());
        assertEquals(1.0, e.getUpper());
        assertNotNull(e.getCause());
    }

    @Test
    void rejectsNegativeTolerances() {
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveQuadrature(-1.0, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveQuadrature(0.0, -1e-6));
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveQuadrature(0.0, 1e-6, 1, 100));
    }
}
