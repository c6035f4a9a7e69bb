package com.edgesentinel.flink;

import com.edgesentinel.core.model.FlowRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link FlowRecord}.
 *
 * <p>
 * Expected payload:
 * </p>
 *
 * <pre>
 * {"src":"10.0.0.1","dst":"10.0.0.2","timestamp":1700000000.0,"count":1}
 * </pre>
 *
 * <p>
 * {@code timestamp}, {@code count} and {@code label} are optional; a record
 * without a timestamp is stamped by the monitor's wall clock. A malformed
 * message, or one that violates the record's constraints (missing endpoint,
 * non-finite timestamp, count below 1), is logged and dropped by returning
 * {@code null}.
 * </p>
 */
public class FlowRecordDeserializationSchema implements DeserializationSchema<FlowRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FlowRecordDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public FlowRecord deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, FlowRecord.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize flow record, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(FlowRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<FlowRecord> getProducedType() {
        return TypeInformation.of(FlowRecord.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
