package photocathode.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.ApparatusParameters;
import photocathode.config.ApparatusParametersBuilder;
import photocathode.config.SimulationConfig;
import photocathode.config.SimulationConfigBuilder;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

/**
 * Загрузка параметров прогона из .properties.
 * Отсутствующие ключи оставляют значения базовых параметров; десятичная запятая допускается.
 */
public final class ConfigLoader {

    private static final Logger log = LogManager.getLogger(ConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            "tau", "numElectrons", "workFunction", "photonEnergy", "dcField",
            "numSpaceBins", "numTimeSlices", "numTaus", "simple",
            "epsRel", "epsAbs", "threads", "verbose"
    );

    public LoadedConfig load(Path path, ApparatusParameters baseApparatus, SimulationConfig baseConfig)
            throws IOException {
        Properties props = new Properties();
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(r);
        }
        log.info("Loaded configuration from {}", path.toAbsolutePath());
        return fromProperties(props, baseApparatus, baseConfig);
    }

    public LoadedConfig fromProperties(Properties props,
                                       ApparatusParameters baseApparatus,
                                       SimulationConfig baseConfig) {

        for (String key : props.stringPropertyNames()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Unknown configuration key '{}' ignored", key);
            }
        }

        ApparatusParametersBuilder ab = ApparatusParametersBuilder.from(baseApparatus);
        if (props.containsKey("tau")) ab.setTau(parseDouble(props, "tau"));
        if (props.containsKey("numElectrons")) ab.setNumElectrons(parseDouble(props, "numElectrons"));
        if (props.containsKey("workFunction")) ab.setWorkFunction(parseDouble(props, "workFunction"));
        if (props.containsKey("photonEnergy")) ab.setPhotonEnergy(parseDouble(props, "photonEnergy"));
        if (props.containsKey("dcField")) ab.setDcField(parseDouble(props, "dcField"));

        SimulationConfigBuilder cb = SimulationConfigBuilder.from(baseConfig);
        if (props.containsKey("numSpaceBins")) cb.setNumSpaceBins(parseInt(props, "numSpaceBins"));
        if (props.containsKey("numTimeSlices")) cb.setNumTimeSlices(parseInt(props, "numTimeSlices"));
        if (props.containsKey("numTaus")) cb.setNumTaus(parseInt(props, "numTaus"));
        if (props.containsKey("simple")) cb.setSimple(parseBoolean(props, "simple"));
        if (props.containsKey("epsRel")) cb.setEpsRel(parseDouble(props, "epsRel"));
        if (props.containsKey("epsAbs")) cb.setEpsAbs(parseDouble(props, "epsAbs"));
        if (props.containsKey("threads")) cb.setThreads(parseInt(props, "threads"));
        if (props.containsKey("verbose")) cb.setVerbose(parseBoolean(props, "verbose"));

        return new LoadedConfig(ab.build(), cb.build());
    }

    private static double parseDouble(Properties props, String key) {
        String raw = props.getProperty(key).trim();
        try {
            return Double.parseDouble(raw.replace(",", "."));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for '" + key + "': " + raw, e);
        }
    }

    private static int parseInt(Properties props, String key) {
        String raw = props.getProperty(key).trim();
        try {
            // допускаем 1e3 и 1000.0, но не дробные значения
            double v = Double.parseDouble(raw.replace(",", "."));
            if (v != Math.rint(v) || Math.abs(v) > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Expected an integer for '" + key + "': " + raw);
            }
            return (int) v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + raw, e);
        }
    }

    private static boolean parseBoolean(Properties props, String key) {
        String raw = props.getProperty(key).trim().toLowerCase(java.util.Locale.ROOT);
        switch (raw) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException("Invalid boolean for '" + key + "': " + raw);
        }
    }

    public record LoadedConfig(ApparatusParameters apparatus, SimulationConfig config) {}
}
