package main.java.wte;

import com.google.common.base.Splitter;
import main.java.input.SParameter;
import main.java.util.Cloger;
import org.apache.commons.cli.*;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class WTEMain {

    private static final Splitter tab_splitter = Splitter.on('\t');

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the command line tool.
     * @param args command line arguments
     * @return exit status
     */
    public static int run(String[] args) {
        Options options = new Options();
        options.addOption("i", true, "Input file: one value per line or tab-separated columns");
        options.addOption("c", true, "0-based column of the values in the input file, default is 0");
        options.addOption("s", true, "0-based column of the sample spacing in the input file, default is unit spacing");
        options.addOption("l", true, "Smoothing parameter lambda, default is " + SParameter.lambda);
        options.addOption("d", true, "Order of the differences, default is " + SParameter.order);
        options.addOption("o", true, "Output file, default is stdout");
        options.addOption("v", false, "Print version");
        options.addOption("h", false, "Help");

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser(false);
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            Cloger.getInstance().logger.error("Invalid arguments: {}", e.getMessage());
            return 1;
        }

        if (cmd.hasOption("v")) {
            System.out.println("wte " + SParameter.getVersion());
            return 0;
        }

        if (cmd.hasOption("h") || !cmd.hasOption("i")) {
            HelpFormatter f = new HelpFormatter();
            f.setWidth(100);
            f.setOptionComparator(null);
            System.out.println("java -jar wte.jar");
            f.printHelp("Options", options);
            return cmd.hasOption("h") ? 0 : 1;
        }

        Cloger.getInstance().set_job_start_time();
        try {
            if (cmd.hasOption("l")) {
                SParameter.lambda = Double.parseDouble(cmd.getOptionValue("l"));
            }
            if (cmd.hasOption("d")) {
                SParameter.order = Integer.parseInt(cmd.getOptionValue("d"));
            }
            int value_column = Integer.parseInt(cmd.getOptionValue("c", "0"));

            String input = cmd.getOptionValue("i");
            double[] data = read_column(input, value_column);
            double[] spacing = null;
            if (cmd.hasOption("s")) {
                spacing = read_column(input, Integer.parseInt(cmd.getOptionValue("s")));
            }

            double[] smoothed = WTESmoother.smooth(data, SParameter.lambda, SParameter.order, spacing);
            String out = StringUtils.join(smoothed, '\n') + "\n";
            if (cmd.hasOption("o")) {
                FileUtils.writeStringToFile(new File(cmd.getOptionValue("o")), out, StandardCharsets.UTF_8);
            } else {
                System.out.print(out);
            }
            Cloger.getInstance().logger.info("Smoothed {} data points in {}", data.length, Cloger.getInstance().get_job_run_time());
        } catch (NumberFormatException e) {
            Cloger.getInstance().logger.error("Invalid number: {}", e.getMessage());
            return 1;
        } catch (WTEException e) {
            Cloger.getInstance().logger.error("Smoothing failed ({}): {}", e.getKind(), e.getMessage());
            return 1;
        } catch (IOException e) {
            Cloger.getInstance().logger.error("I/O error: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    /**
     * Read one column of numbers from a text file. Blank lines and lines starting with # are skipped.
     * @param file text file, tab-separated when it has more than one column
     * @param column 0-based column index
     * @return the values in file order
     */
    public static double[] read_column(String file, int column) throws IOException {
        List<String> lines = FileUtils.readLines(new File(file), StandardCharsets.UTF_8);
        ArrayList<Double> values = new ArrayList<>(lines.size());
        int line_number = 0;
        for (String line : lines) {
            line_number++;
            if (StringUtils.isBlank(line) || line.startsWith("#")) {
                continue;
            }
            List<String> d = tab_splitter.splitToList(line.trim());
            if (column < 0 || column >= d.size()) {
                throw new IOException(file + ":" + line_number + ": no column " + column);
            }
            try {
                values.add(Double.parseDouble(d.get(column).trim()));
            } catch (NumberFormatException e) {
                throw new IOException(file + ":" + line_number + ": not a number: " + d.get(column), e);
            }
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
