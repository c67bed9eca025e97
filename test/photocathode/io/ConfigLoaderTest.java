package photocathode.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import photocathode.ScenarioFactory;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @TempDir
    Path tmp;

    private final ApparatusParameters baseApparatus = ScenarioFactory.defaultApparatus();
    private final SimulationConfig baseConfig = ScenarioFactory.defaultConfig(1);
    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void emptyPropertiesKeepBase() {
        ConfigLoader.LoadedConfig lc = loader.fromProperties(new Properties(), baseApparatus, baseConfig);

        assertEquals(baseApparatus.getTau(), lc.apparatus().getTau());
        assertEquals(baseApparatus.getDcField(), lc.apparatus().getDcField());
        assertEquals(baseConfig.getNumSpaceBins(), lc.config().getNumSpaceBins());
        assertFalse(lc.config().isSimple());
    }

    @Test
    void overridesAndLenientFormats() {
        Properties props = new Properties();
        props.setProperty("tau", "100e-15");
        props.setProperty("photonEnergy", "4,5");
        props.setProperty("numSpaceBins", "1e3");
        props.setProperty("numTimeSlices", "500.0");
        props.setProperty("simple", "yes");
        props.setProperty("verbose", "1");
        props.setProperty("threads", " 4 ");
        props.setProperty("somethingElse", "ignored");

        ConfigLoader.LoadedConfig lc = loader.fromProperties(props, baseApparatus, baseConfig);

        assertEquals(100e-15, lc.apparatus().getTau());
        assertEquals(4.5, lc.apparatus().getPhotonEnergy());
        assertEquals(baseApparatus.getWorkFunction(), lc.apparatus().getWorkFunction());
        assertEquals(1000, lc.config().getNumSpaceBins());
        assertEquals(500, lc.config().getNumTimeSlices());
        assertTrue(lc.config().isSimple());
        assertTrue(lc.config().isVerbose());
        assertEquals(4, lc.config().getThreads());
    }

    @Test
    void invalidValuesNameTheKey() {
        Properties frac = new Properties();
        frac.setProperty("numSpaceBins", "10.5");
        IllegalArgumentException e1 = assertThrows(IllegalArgumentException.class,
                () -> loader.fromProperties(frac, baseApparatus, baseConfig));
        assertTrue(e1.getMessage().contains("numSpaceBins"));

        Properties bool = new Properties();
        bool.setProperty("simple", "maybe");
        IllegalArgumentException e2 = assertThrows(IllegalArgumentException.class,
                () -> loader.fromProperties(bool, baseApparatus, baseConfig));
        assertTrue(e2.getMessage().contains("simple"));

        Properties num = new Properties();
        num.setProperty("tau", "ten");
        IllegalArgumentException e3 = assertThrows(IllegalArgumentException.class,
                () -> loader.fromProperties(num, baseApparatus, baseConfig));
        assertTrue(e3.getMessage().contains("tau"));
    }

    @Test
    void domainViolationsAreRejected() {
        Properties props = new Properties();
        props.setProperty("photonEnergy", "4.0");
        assertThrows(IllegalArgumentException.class, () -> loader.fromProperties(props, baseApparatus, baseConfig));

        Properties grid = new Properties();
        grid.setProperty("numTimeSlices", "0");
        assertThrows(IllegalArgumentException.class, () -> loader.fromProperties(grid, baseApparatus, baseConfig));
    }

    @Test
    void loadsFile() throws Exception {
        Path file = tmp.resolve("run.properties");
        Files.writeString(file, "# прогон\nnumElectrons = 2e5\ndcField = 5e5\nnumTaus = 8\n", StandardCharsets.UTF_8);

        ConfigLoader.LoadedConfig lc = loader.load(file, baseApparatus, baseConfig);

        assertEquals(2e5, lc.apparatus().getNumElectrons());
        assertEquals(5e5, lc.apparatus().getDcField());
        assertEquals(8, lc.config().getNumTaus());
    }
}
