package com.skyassoc;

import com.skyassoc.association.SimpleAssociation;
import com.skyassoc.config.AssociationConfig;
import com.skyassoc.model.AssociationResult;
import com.skyassoc.model.DiaObject;
import com.skyassoc.serde.TableJson;
import com.skyassoc.sim.SyntheticFieldGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the association engine over a synthetic field and prints a report.
 *
 * Tuning comes from ASSOC_TOLERANCE_ARCSEC, ASSOC_H3_RESOLUTION and
 * ASSOC_WITHIN_VISIT_ORDER; the field from the command line:
 * <pre>
 *   --objects 500 --visits 20 --jitter 0.05 --detect 0.8 --cell 1234 --bits 20
 * </pre>
 */
public class AssociationDemo {

    private static final Logger log = LoggerFactory.getLogger(AssociationDemo.class);

    public static void main(String[] args) {
        var config = AssociationConfig.fromEnv(System.getenv());
        int objects   = Integer.parseInt(parseArg(args, "--objects", "500"));
        int visits    = Integer.parseInt(parseArg(args, "--visits", "20"));
        double jitter = Double.parseDouble(parseArg(args, "--jitter", "0.05"));
        double detect = Double.parseDouble(parseArg(args, "--detect", "0.8"));
        long cellId   = Long.parseLong(parseArg(args, "--cell", "1234"));
        int bits      = Integer.parseInt(parseArg(args, "--bits", "20"));

        log.info("=== Simple association demo ===");
        log.info("tolerance={}\" resolution={} order={} | objects={} visits={} jitter={}\" detect={}",
            config.toleranceArcsec(), config.resolution(), config.withinVisitOrder(),
            objects, visits, jitter, detect);

        var field = SyntheticFieldGenerator.deterministic("demo-field", "scenario-1",
            150.0, 2.2, 300.0, jitter, detect);
        var sources = field.generate(objects, visits, 1000L);
        log.info("Generated {} DiaSources (seed={})", sources.size(), field.seed());

        var association = new SimpleAssociation(config);
        AssociationResult result = association.associate(sources, cellId, bits);

        printReport(result, objects);
        System.out.println(TableJson.statsToJson(result.stats()));
    }

    private static void printReport(AssociationResult result, int truePositions) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (DiaObject o : result.diaObjects()) {
            histogram.merge(o.nDiaSources(), 1, Integer::sum);
        }

        System.out.println("\n==================================================");
        System.out.println("  ASSOCIATION REPORT");
        System.out.println("==================================================");
        System.out.printf("  DiaSources        : %,d%n", result.assocDiaSources().size());
        System.out.printf("  DiaObjects        : %,d (true positions: %,d)%n",
            result.diaObjects().size(), truePositions);
        System.out.printf("  Candidates/query  : %.2f%n", result.stats().meanCandidatesPerQuery());
        System.out.println("  nDiaSources histogram:");
        histogram.forEach((n, count) ->
            System.out.printf("    %3d sources : %,d objects%n", n, count));
        System.out.println("==================================================\n");
    }

    private static String parseArg(String[] args, String flag, String defaultValue) {
        String prefix = flag + "=";
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(flag) && i + 1 < args.length) {
                return args[i + 1];
            }
            if (args[i].startsWith(prefix)) {
                return args[i].substring(prefix.length());
            }
        }
        return defaultValue;
    }
}
