package com.conveyal.ithim;

import com.conveyal.ithim.burden.ComparisonReport;
import com.conveyal.ithim.exposure.ExposureScenario;
import com.conveyal.ithim.io.GbdTableReader;
import com.conveyal.ithim.io.JsonUtil;
import com.conveyal.ithim.io.ParameterFile;
import com.conveyal.ithim.model.BurdenType;
import com.conveyal.ithim.model.Disease;
import com.conveyal.ithim.model.GbdTable;
import com.conveyal.ithim.model.ScenarioParameters;
import com.conveyal.ithim.util.ExceptionUtils;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

/**
 * Command line entry point: compares a scenario against a baseline and prints the total change in burden.
 * The full comparison report can optionally be written out as JSON.
 */
public abstract class IthimMain {

    private static final Logger LOG = LoggerFactory.getLogger(IthimMain.class);

    private static final String BASELINE_OPT = "b";
    private static final String SCENARIO_OPT = "s";
    private static final String GBD_OPT = "g";
    private static final String CONFIG_OPT = "c";
    private static final String BURDEN_TYPE_OPT = "t";
    private static final String DISEASE_OPT = "d";
    private static final String OUTPUT_OPT = "o";
    private static final String HELP_OPT = "h";

    public static void main (String... args) {
        Options options = options();
        if (Arrays.asList(args).contains("-" + HELP_OPT) || Arrays.asList(args).contains("--help")) {
            printHelp(options);
            return;
        }
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            System.exit(-1);
            return;
        }
        try {
            double delta = run(cmd);
            System.out.println(delta);
        } catch (Exception e) {
            LOG.error("Comparison failed: {}", ExceptionUtils.shortCauseString(e));
            System.exit(1);
        }
    }

    static double run (CommandLine cmd) throws IOException {
        IthimConfig config = cmd.hasOption(CONFIG_OPT)
                ? IthimConfig.fromFile(cmd.getOptionValue(CONFIG_OPT))
                : IthimConfig.fromDefaults();
        String burdenType = cmd.getOptionValue(BURDEN_TYPE_OPT);
        String disease = cmd.getOptionValue(DISEASE_OPT);
        // Fail on a bad query before spending time on the simulation.
        if (burdenType != null) BurdenType.fromName(burdenType);
        if (disease != null && !Disease.ALL.equalsIgnoreCase(disease.trim())) Disease.fromName(disease);

        GbdTable gbd = GbdTableReader.read(new File(cmd.getOptionValue(GBD_OPT)));
        ScenarioParameters baselineParameters = parameters(cmd.getOptionValue(BASELINE_OPT), gbd, config);
        ScenarioParameters scenarioParameters = parameters(cmd.getOptionValue(SCENARIO_OPT), gbd, config);

        IthimComponents components = new IthimComponents(config);
        try {
            ExposureScenario baseline = components.scenario(baselineParameters);
            ExposureScenario scenario = components.scenario(scenarioParameters);
            ComparisonReport report = components.comparator.compareModels(baseline, scenario);
            double delta = components.comparator.getBurden(report, burdenType, disease);
            if (cmd.hasOption(OUTPUT_OPT)) {
                File output = new File(cmd.getOptionValue(OUTPUT_OPT));
                JsonUtil.objectMapper.writeValue(output, report);
                LOG.info("Wrote comparison report to {}", output);
            }
            return delta;
        } finally {
            components.shutdown();
        }
    }

    private static ScenarioParameters parameters (String filename, GbdTable gbd, IthimConfig config) {
        File file = new File(filename);
        return ParameterFile.read(file).toParameters(file.getAbsoluteFile().getParentFile(), gbd, config.quantiles());
    }

    private static Options options () {
        Options options = new Options();
        options.addOption(Option.builder(BASELINE_OPT).longOpt("baseline").hasArg().required()
                .desc("JSON parameter file describing the baseline scenario.").build());
        options.addOption(Option.builder(SCENARIO_OPT).longOpt("scenario").hasArg().required()
                .desc("JSON parameter file describing the alternative scenario.").build());
        options.addOption(Option.builder(GBD_OPT).longOpt("gbd").hasArg().required()
                .desc("CSV file of burden of disease values.").build());
        options.addOption(CONFIG_OPT, "config", true, "Properties file overriding model constants. (Optional)");
        options.addOption(BURDEN_TYPE_OPT, "burden", true, "One of deaths, yll, yld or daly. Defaults to daly.");
        options.addOption(DISEASE_OPT, "disease", true, "A single disease, or all. Defaults to all.");
        options.addOption(OUTPUT_OPT, "output", true, "Write the full comparison report to this JSON file. (Optional)");
        options.addOption(HELP_OPT, "help", false, "Print all command line options, then exit.");
        return options;
    }

    private static void printHelp (Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(120);
        formatter.printHelp("ithim-pa [options]", options);
    }

}
