package io.intellixity.restquery.mongo;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.query.JoinType;
import io.intellixity.restquery.spi.exec.*;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Mongo backend adapter using the official MongoDB Java sync driver.
 * <p>
 * Pipelines run with {@code maxTime} set from the execution timeout and {@code allowDiskUse(true)}. Updates and
 * replaces re-read the document when something was modified.
 */
public final class MongoBackendAdapter extends AbstractBackendAdapter<MongoStatement, MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoBackendAdapter.class);

  public static final String NAME = "mongodb";
  public static final String VERSION = "1.0.0";

  private static final BackendCapabilities CAPABILITIES = BackendCapabilities
      .allOperators(EnumSet.of(JoinType.LOOKUP, JoinType.LEFT, JoinType.INNER,
          JoinType.ONE_TO_ONE, JoinType.ONE_TO_MANY, JoinType.MANY_TO_ONE, JoinType.MANY_TO_MANY))
      .withFullTextSearch(true)
      .withTransactions(true)
      .withMaxComplexity(100)
      .withMaxResultSize(1_000_000);

  public MongoBackendAdapter(MongoHandle handle, MongoDialect dialect, QueryValidationStrategy validation) {
    super(NAME, VERSION, dialect, handle, validation);
  }

  public MongoBackendAdapter(MongoHandle handle, MongoDialect dialect) {
    this(handle, dialect, null);
  }

  @Override
  public BackendType type() {
    return BackendType.MONGODB;
  }

  @Override
  public BackendCapabilities getCapabilities() {
    return CAPABILITIES;
  }

  @Override
  protected BackendResult doExecute(MongoStatement st, IntermediateQuery query, ExecutionOptions options) {
    MongoCollection<Document> col = handle().client().getDatabase(handle().database()).getCollection(st.collection());
    if (log.isDebugEnabled()) {
      log.debug("restquery.mongo op={} collection={} stages={}", st.kind(), st.collection(), st.pipeline().size());
    }
    return switch (st.kind()) {
      case AGGREGATE -> {
        List<Document> docs = col.aggregate(st.pipeline())
            .maxTime(options.timeoutOrDefault().toMillis(), TimeUnit.MILLISECONDS)
            .allowDiskUse(true)
            .into(new ArrayList<>());
        yield BackendResult.rows(new ArrayList<Map<String, Object>>(docs));
      }
      case INSERT_ONE -> {
        Document doc = new Document(st.document());
        col.insertOne(doc);
        yield BackendResult.inserted(List.of(doc), 1);
      }
      case UPDATE_ONE -> {
        UpdateResult r = col.updateOne(st.filter(), st.document());
        yield reread(col, st.filter(), r);
      }
      case REPLACE_ONE -> {
        UpdateResult r = col.replaceOne(st.filter(), st.document());
        yield reread(col, st.filter(), r);
      }
      case DELETE_ONE -> {
        DeleteResult r = col.deleteOne(st.filter());
        yield BackendResult.deleted(r.getDeletedCount());
      }
    };
  }

  private static BackendResult reread(MongoCollection<Document> col, Document filter, UpdateResult r) {
    List<Map<String, Object>> rows = new ArrayList<>();
    if (r.getModifiedCount() > 0) {
      Document d = col.find(filter).first();
      if (d != null) rows.add(d);
    }
    return new BackendResult(rows, null, null, r.getModifiedCount(), null, r.getMatchedCount());
  }
}
