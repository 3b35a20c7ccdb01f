package com.gridcalc;

import com.gridcalc.api.CommitResult;
import com.gridcalc.io.SheetConfig;
import com.gridcalc.io.SheetConfigLoader;
import com.gridcalc.util.LatencyTrackingListener;
import com.gridcalc.wiring.SheetWriteGate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * End-to-end demo: several producer threads push edits through the
 * {@link SheetWriteGate} while one consumer keeps the sheet consistent.
 * <p>
 * Usage: {@code SheetDemo [config.json]}. Without an argument the bundled
 * {@code gridcalc.json} is used.
 */
public class SheetDemo {
    private static final Logger log = LogManager.getLogger(SheetDemo.class);

    private static final int PRODUCERS = 4;
    private static final int EDITS_PER_PRODUCER = 250;

    public static void main(String[] args) throws Exception {
        log.info("Starting sheet demo...");

        SheetConfig config = args.length > 0
                ? SheetConfigLoader.load(Path.of(args[0]))
                : SheetConfigLoader.loadDefault();
        Spreadsheet sheet = new Spreadsheet(config);
        LatencyTrackingListener latency = sheet.enableLatencyTracking();

        try (SheetWriteGate gate = new SheetWriteGate(sheet, config.getRingBufferSize())) {
            // A column of inputs, a chain reading them and aggregates over the column.
            gate.submit("B1", "A1*2");
            gate.submit("C1", "B1+1");
            gate.submit("D1", "SUM(A1:A10)");
            gate.submit("D2", "MAX(A1:A10)");
            gate.submit("D3", "AVG(A1:A10)");
            gate.submit("D4", "STDEV(A1:A10)");
            CommitResult cycle = gate.submit("A1", "C1").join();
            log.info("A1=C1 -> {}", cycle.status().message());

            List<Thread> producers = new ArrayList<>();
            for (int p = 0; p < PRODUCERS; p++) {
                final int row = p + 1;
                Thread t = new Thread(() -> {
                    CompletableFuture<CommitResult> last = null;
                    for (int i = 1; i <= EDITS_PER_PRODUCER; i++)
                        last = gate.submit("A" + row, Integer.toString(i * row));
                    if (last != null)
                        last.join();
                }, "producer-" + row);
                producers.add(t);
                t.start();
            }
            for (Thread t : producers)
                t.join();

            gate.submit("A10", "5/0").join();
        }

        for (String ref : new String[] { "A1", "B1", "C1", "D1", "D2", "D3", "D4", "A10" })
            log.info("{} = {} ({})", ref, sheet.getValue(ref).display(), sheet.getFormulaText(ref));
        log.info("Last commit: {}", sheet.explain().explainLastCommit());
        log.info(latency.dump());
    }
}
