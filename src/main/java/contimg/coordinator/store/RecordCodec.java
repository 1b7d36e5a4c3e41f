package contimg.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON mapping between stored payloads and document records.
 */
public final class RecordCodec {

    private final ObjectMapper mapper;

    public RecordCodec() {
        this(new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .findAndRegisterModules());
    }

    public RecordCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Object document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode " + document.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode a stored payload. An unreadable payload means the keyspace is corrupt.
     */
    public <T> T read(StoredRecord record, Class<T> type) {
        try {
            return mapper.readValue(record.payload(), type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt record " + record.key(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
