package amc.cli;

import amc.eval.CompilerKind;
import amc.eval.Strategy;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Turns {@code <command> [options] [file]} into {@link CliOptions}. */
final class CliArguments {

  private CliArguments() {}

  static CliOptions parse(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    if (args == null || args.length == 0) {
      return builder.help(true).build();
    }
    int start = 0;
    CliOptions.Command command = parseCommand(args[0]);
    if (command != null) {
      builder.command(command);
      start = 1;
    }
    Map<String, OptionSpec> specs = optionSpecs();
    for (int i = start; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        builder.inputFile(arg);
        continue;
      }
      ParsedArg parsed = ParsedArg.parse(arg);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + arg);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static String usage() {
    return String.join(
        "\n",
        "Usage: amc evaluate [options] [file.cnf]   (reads stdin without a file)",
        "       amc treewidth [--decot <seconds>] <file.cnf>",
        "",
        "Options:",
        "  --strategy flexible|compilation   answer idempotent/probabilistic instances without"
            + " compiling when possible (default flexible)",
        "  --preprocess                      simplify the CNF with the exact preprocessor first",
        "  --compiler c2d|d4|sharpsat-td|sharpsat-td-live   knowledge compiler (default c2d)",
        "  --decot <seconds>                 tree decomposition timeout (default 1)",
        "  --precision <digits>              significant digits of MaxSAT weights (default 8)",
        "  --write <file>                    write the preprocessed CNF (needs --preprocess)",
        "  --json <file>                     write a JSON report of the result",
        "  --verbosity debug|info|warn|error log level (default info)",
        "  --help                            show this message");
  }

  private static CliOptions.Command parseCommand(String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "evaluate", "eval" -> CliOptions.Command.EVALUATE;
      case "treewidth", "tw" -> CliOptions.Command.TREEWIDTH;
      default -> null;
    };
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--strategy", OptionSpec.withValue((b, raw) -> b.strategy(Strategy.fromName(raw))));
    specs.put("--preprocess", OptionSpec.flag(b -> b.preprocess(true)));
    specs.put(
        "--compiler", OptionSpec.withValue((b, raw) -> b.compiler(CompilerKind.fromName(raw))));
    specs.put(
        "--decot",
        OptionSpec.withValue(
            (b, raw) -> b.decompositionTimeout(CliParsers.parseSeconds(raw, "--decot"))));
    specs.put(
        "--precision",
        OptionSpec.withValue((b, raw) -> b.precision(CliParsers.parseInt(raw, "--precision"))));
    specs.put("--write", OptionSpec.withValue((b, raw) -> b.writePath(Path.of(raw))));
    specs.put("--json", OptionSpec.withValue((b, raw) -> b.jsonPath(Path.of(raw))));
    specs.put(
        "--verbosity",
        OptionSpec.withValue((b, raw) -> b.verbosity(CliParsers.parseVerbosity(raw))));
    specs.put("--help", OptionSpec.flag(b -> b.help(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      int equalsIndex = raw.indexOf('=');
      if (equalsIndex > 0) {
        String value = raw.substring(equalsIndex + 1);
        return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
