package civiltime.bench;

import java.util.Collection;
import java.util.List;

import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;
import org.openjdk.jmh.util.Statistics;

import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

public class RunBench {

    public static void main(String[] args) throws Exception {
        OptionParser parser = new OptionParser("f");
        OptionSpec<String> testsOption = parser.accepts("t").withOptionalArg().ofType(String.class);
        OptionSpec<String> packagesNameOption = parser.accepts("p").withOptionalArg().ofType(String.class).defaultsTo("format");
        OptionSet options = parser.parse(args);

        String packageName = options.valueOf(packagesNameOption);

        long warmupTime;
        int warmupIterations;
        long measurementTime;
        int measurementIterations;
        int forks;
        if (options.has("f")) {
            warmupTime = 1;
            warmupIterations = 1;
            measurementTime = 1;
            measurementIterations = 1;
            forks = 1;
        } else {
            warmupTime = 1;
            warmupIterations = 10;
            measurementTime = 10;
            measurementIterations = 5;
            forks = 5;
        }
        List<String> tests = options.valuesOf(testsOption);
        ChainedOptionsBuilder builder = new OptionsBuilder()
                                                .shouldFailOnError(false)
                                                .warmupIterations(warmupIterations)
                                                .warmupTime(TimeValue.seconds(warmupTime))
                                                .measurementIterations(measurementIterations)
                                                .measurementTime(TimeValue.seconds(measurementTime))
                                                .shouldDoGC(true)
                                                .forks(forks);

        if (tests.isEmpty()) {
            if ("format".equals(packageName)) {
                builder.include("civiltime\\.bench\\.format\\..*RFC3339")
                       .include("civiltime\\.bench\\.format\\.CivilTimeLocal")
                       .include("civiltime\\.bench\\.format\\.Printer");
            } else if ("zone".equals(packageName)) {
                builder.include("civiltime\\.bench\\.zone\\..*");
            } else {
                throw new IllegalArgumentException(packageName);
            }
        } else {
            tests.stream().map(t -> "civiltime.bench." + packageName + "." + t).forEach(builder::include);
        }

        Options opt = builder.build();

        Collection<RunResult> results = new Runner(opt).run();

        for (RunResult rr : results) {
            Statistics stats = rr.getPrimaryResult().getStatistics();
            System.out.println("******");
            System.out.println("    Benchmark: " + benchName(rr.getParams().getBenchmark()) + " " + rr.getParams().getParam("zoneName"));
            System.out.println("    min; " + stats.getMin());
            System.out.println("    %25; " + stats.getPercentile(25));
            System.out.println("    %50; " + stats.getPercentile(50));
            System.out.println("    %75; " + stats.getPercentile(75));
            System.out.println("    max; " + stats.getMax());
        }
    }

    private static String benchName(String benchName) {
        return benchName.replace("civiltime.bench.", "")
                        .replace(".scan", "");
    }

}
