package com.evidencevault.export.cassandra;

import java.io.Serializable;
import java.util.UUID;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

@PrimaryKeyClass
public record ExportAccessLogKey(
    @PrimaryKeyColumn(name = "request_id", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String requestId,

    @PrimaryKeyColumn(name = "entry_id", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    UUID entryId
) implements Serializable {}
