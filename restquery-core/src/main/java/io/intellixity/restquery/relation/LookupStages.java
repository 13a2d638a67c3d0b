package io.intellixity.restquery.relation;

import io.intellixity.restquery.query.SelectClause;
import io.intellixity.restquery.query.SortClause;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for document-shaped lookup stages shared by the relationship variants. */
final class LookupStages {
  static final String LOCAL_VALUE = "local_value";
  static final String JUNCTION_IDS = "junction_ids";
  static final String JUNCTION_PREFIX = "_junction_";

  private LookupStages() {}

  /** {@code $lookup} whose pipeline matches {@code foreignField == $$local_value}. */
  static Map<String, Object> correlatedLookup(String from, String localField, String foreignField,
                                              List<Map<String, Object>> tail, String as) {
    List<Map<String, Object>> pipeline = new ArrayList<>();
    pipeline.add(stage("$match", doc("$expr", doc("$eq", List.of("$" + foreignField, "$$" + LOCAL_VALUE)))));
    pipeline.addAll(tail);
    return stage("$lookup", doc(
        "from", from,
        "let", doc(LOCAL_VALUE, "$" + localField),
        "pipeline", pipeline,
        "as", as));
  }

  static Map<String, Object> unwind(String alias, boolean preserveNull) {
    return stage("$unwind", doc("path", "$" + alias, "preserveNullAndEmptyArrays", preserveNull));
  }

  /** Filter, nested lookups, sort, skip, limit and projection applied inside the joined collection. */
  static List<Map<String, Object>> basePipeline(EmbedRequest req) {
    List<Map<String, Object>> out = new ArrayList<>();
    if (!req.filter().isEmpty()) out.add(stage("$match", req.filter()));
    out.addAll(req.nestedStages());
    if (!req.orderBy().isEmpty()) {
      Map<String, Object> sort = new LinkedHashMap<>();
      for (SortClause s : req.orderBy()) sort.put(s.field(), s.direction() == SortClause.Direction.DESC ? -1 : 1);
      out.add(stage("$sort", sort));
    }
    if (req.offset() != null && req.offset() > 0) out.add(stage("$skip", req.offset()));
    if (req.limit() != null && req.limit() > 0) out.add(stage("$limit", req.limit()));
    Map<String, Object> project = projection(req.fields());
    if (!project.isEmpty()) out.add(stage("$project", project));
    return out;
  }

  /** {@code title} becomes {@code title:1}, {@code comments.*} becomes {@code comments:1}; {@code *} disables it. */
  static Map<String, Object> projection(List<String> fields) {
    Map<String, Object> project = new LinkedHashMap<>();
    if (fields.contains(SelectClause.WILDCARD)) return project;
    for (String f : fields) {
      String path = f.endsWith("." + SelectClause.WILDCARD) ? f.substring(0, f.length() - 2) : f;
      project.put(path, 1);
    }
    return project;
  }

  static Map<String, Object> stage(String name, Object body) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(name, body);
    return m;
  }

  static Map<String, Object> doc(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) m.put(String.valueOf(kv[i]), kv[i + 1]);
    return m;
  }
}
