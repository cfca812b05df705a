package amc.cli;

import amc.eval.EvaluationResult;
import amc.graph.TreeDecomposition;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(CliOptions options, EvaluationResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    Map<String, Object> meta = meta(options);
    meta.put("strategy", options.strategy().cliName());
    meta.put("compiler", options.compiler().cliName());
    meta.put("preprocessing", options.preprocess());
    meta.put("method", result.method().name().toLowerCase(Locale.ROOT));
    meta.put("time_ms", result.elapsedMillis());
    root.put("meta", meta);
    root.put("semiring", result.semiring().name());
    root.put("results", queries(result));
    return gson.toJson(root);
  }

  String build(CliOptions options, TreeDecomposition decomposition, long elapsedMillis) {
    Map<String, Object> root = new LinkedHashMap<>();
    Map<String, Object> meta = meta(options);
    meta.put("time_ms", elapsedMillis);
    meta.put("timeout_ms", options.decompositionTimeout().toMillis());
    root.put("meta", meta);
    Map<String, Object> treewidth = new LinkedHashMap<>();
    treewidth.put("bags", decomposition.bagCount());
    treewidth.put("width", decomposition.width());
    treewidth.put("vertices", decomposition.vertexCount());
    root.put("treewidth", treewidth);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(CliOptions options) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("command", options.command().name().toLowerCase(Locale.ROOT));
    meta.put("input", options.readsStdin() ? "<stdin>" : options.inputFile());
    return meta;
  }

  private List<Map<String, Object>> queries(EvaluationResult result) {
    List<String> formatted = result.formatted();
    List<Map<String, Object>> entries = new ArrayList<>(formatted.size());
    for (int i = 0; i < formatted.size(); i++) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("query", i);
      entry.put("value", formatted.get(i));
      entries.add(entry);
    }
    return entries;
  }
}
