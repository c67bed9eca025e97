package photocathode.io;

import photocathode.model.Bin;
import photocathode.model.BinResult;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Построчная выгрузка бинов: положение (конец бина), число электронов, средний импульс, неопределённость.
 */
public final class BinResultsCsvWriter {

    public static final String HEADER =
            "\"bin position\",\"number of electrons\",\"bin average momentum\",\"bin momentum uncertainty\"";

    private BinResultsCsvWriter() {}

    public static void writeCsv(String path, List<Bin> bins) throws IOException {
        try (BufferedWriter w = new BufferedWriter(new FileWriter(path, StandardCharsets.UTF_8, false))) {
            write(w, bins);
        }
    }

    public static void write(Writer w, List<Bin> bins) throws IOException {
        w.write(HEADER);
        w.write('\n');
        for (Bin bin : bins) {
            w.write(row(bin));
            w.write('\n');
        }
        w.flush();
    }

    static String row(Bin bin) {
        BinResult r = bin.result();
        return bin.getEnd() + ","
                + r.getTotalCount() + ","
                + r.getAvgMomentum() + ","
                + r.getMomentumUncertainty();
    }
}
