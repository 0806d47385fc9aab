package org.hypertrace.core.metrics.etl.store;

import java.util.List;
import org.hypertrace.core.metrics.etl.executor.ExecutionRecord;
import org.hypertrace.core.metrics.etl.normalize.NormalizedRecord;

/** Persistence for normalized samples and execution audit records. Must be thread safe. */
public interface RecordStore {

  void insertExecutionRecord(ExecutionRecord record) throws StoreException;

  /** Writes the batch atomically. An empty batch is a no-op. */
  void insertNormalizedRecords(List<NormalizedRecord> records) throws StoreException;

  void ping() throws StoreException;
}
