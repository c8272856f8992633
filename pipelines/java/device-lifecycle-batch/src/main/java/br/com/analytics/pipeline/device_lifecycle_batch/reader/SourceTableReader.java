package br.com.analytics.pipeline.device_lifecycle_batch.reader;

import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;

public interface SourceTableReader {

    SourceTable read(String name, String query);
}
