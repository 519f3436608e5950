package org.rgen.runtime.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.snapshot.WorldSnapshot;

import java.io.IOException;

/**
 * Pretty-printed JSON encoding, meant to be readable and hand-editable.
 */
public class JsonSnapshotCodec implements ISnapshotCodec {

    private final ObjectMapper mapper;

    public JsonSnapshotCodec() {
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public SnapshotFormat getFormat() {
        return SnapshotFormat.JSON;
    }

    @Override
    public boolean matches(byte[] data) {
        for (byte b : data) {
            if (b == ' ' || b == '\n' || b == '\r' || b == '\t') {
                continue;
            }
            return b == '{';
        }
        return false;
    }

    @Override
    public byte[] encode(WorldSnapshot snapshot) throws IOException {
        return mapper.writeValueAsBytes(snapshot);
    }

    @Override
    public WorldSnapshot decode(byte[] data) throws VersionMismatchException, CorruptDataException {
        JsonNode tree;
        try {
            tree = mapper.readTree(data);
        } catch (IOException e) {
            throw new CorruptDataException("Snapshot is not valid JSON: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new CorruptDataException("Snapshot JSON must be an object");
        }
        JsonNode version = tree.get("version");
        if (version == null || !version.canConvertToInt()) {
            throw new CorruptDataException("Snapshot JSON has no integer 'version'");
        }
        if (version.intValue() != WorldSnapshot.CURRENT_VERSION) {
            throw new VersionMismatchException(version.intValue(), WorldSnapshot.CURRENT_VERSION);
        }
        try {
            return mapper.treeToValue(tree, WorldSnapshot.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptDataException("Snapshot JSON does not match the expected structure: " + e.getMessage(), e);
        }
    }
}
