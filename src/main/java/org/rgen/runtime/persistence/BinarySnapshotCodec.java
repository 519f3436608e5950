package org.rgen.runtime.persistence;

import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.snapshot.ClockRecord;
import org.rgen.runtime.persistence.snapshot.EntityRecord;
import org.rgen.runtime.persistence.snapshot.EventRecord;
import org.rgen.runtime.persistence.snapshot.LocationRecord;
import org.rgen.runtime.persistence.snapshot.NpcRecord;
import org.rgen.runtime.persistence.snapshot.WorldSnapshot;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact binary encoding.
 * <p>
 * Layout: the magic {@code "RGWS"}, an int format version, then every snapshot field in
 * declaration order. Strings are an int byte length (-1 for null) followed by UTF-8 bytes; lists
 * are an int count followed by their elements. Only the clock's minute counter is stored, the
 * calendar fields are derived on decode. Event payload values carry a one-byte type tag.
 * </p>
 */
public class BinarySnapshotCodec implements ISnapshotCodec {

    static final byte[] MAGIC = {'R', 'G', 'W', 'S'};

    private static final byte ENTITY_NPC = 1;
    private static final byte ENTITY_LOCATION = 2;

    private static final byte VALUE_NULL = 0;
    private static final byte VALUE_STRING = 1;
    private static final byte VALUE_BOOLEAN = 2;
    private static final byte VALUE_LONG = 3;
    private static final byte VALUE_DOUBLE = 4;
    private static final byte VALUE_LIST = 5;
    private static final byte VALUE_MAP = 6;

    /** Upper bound for any length prefix, protects against allocating huge arrays for garbage input. */
    private static final int MAX_LENGTH = 64 * 1024 * 1024;

    @Override
    public SnapshotFormat getFormat() {
        return SnapshotFormat.BINARY;
    }

    @Override
    public boolean matches(byte[] data) {
        return data != null && data.length >= MAGIC.length
            && Arrays.equals(Arrays.copyOf(data, MAGIC.length), MAGIC);
    }

    @Override
    public byte[] encode(WorldSnapshot snapshot) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(16 * 1024);
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.write(MAGIC);
            out.writeInt(snapshot.version());
            writeString(out, snapshot.name());
            out.writeLong(snapshot.seed());
            out.writeLong(snapshot.clock().totalMinutes());
            out.writeLong(snapshot.tickCount());
            out.writeLong(snapshot.nextNpcNumber());
            out.writeLong(snapshot.nextEventSequence());
            out.writeLong(snapshot.totalEventsPublished());
            out.writeInt(snapshot.rngState().length);
            out.write(snapshot.rngState());

            out.writeInt(snapshot.entities().size());
            for (EntityRecord entity : snapshot.entities()) {
                if (entity instanceof NpcRecord) {
                    out.writeByte(ENTITY_NPC);
                    writeNpc(out, (NpcRecord) entity);
                } else {
                    out.writeByte(ENTITY_LOCATION);
                    writeLocation(out, (LocationRecord) entity);
                }
            }

            out.writeInt(snapshot.eventTail().size());
            for (EventRecord event : snapshot.eventTail()) {
                out.writeLong(event.sequence());
                writeString(out, event.kind());
                out.writeLong(event.simMinute());
                writeString(out, event.sourceId());
                writeString(out, event.locationId());
                writeValue(out, event.payload());
            }
        }
        return buffer.toByteArray();
    }

    private static void writeNpc(DataOutputStream out, NpcRecord npc) throws IOException {
        writeString(out, npc.id());
        writeString(out, npc.name());
        out.writeBoolean(npc.active());
        out.writeLong(npc.createdAtMinute());
        writeString(out, npc.race());
        writeString(out, npc.title());
        writeStrings(out, npc.professions());
        out.writeDouble(npc.energy());
        out.writeDouble(npc.hunger());
        out.writeDouble(npc.mood());
        out.writeDouble(npc.moodBaseline());
        writeString(out, npc.state());
        writeString(out, npc.locationId());
        writeString(out, npc.workLocationId());
        writeStrings(out, npc.travelPath());
        out.writeInt(npc.memoryCapacity());
        out.writeInt(npc.memory().size());
        for (NpcRecord.MemoryRecord entry : npc.memory()) {
            out.writeLong(entry.minute());
            writeString(out, entry.kind());
            out.writeDouble(entry.impact());
            writeString(out, entry.detail());
        }
    }

    private static void writeLocation(DataOutputStream out, LocationRecord location) throws IOException {
        writeString(out, location.id());
        writeString(out, location.name());
        out.writeBoolean(location.active());
        out.writeLong(location.createdAtMinute());
        writeString(out, location.type());
        writeString(out, location.biome());
        writeStrings(out, location.tags());
        writeStrings(out, location.connections());
        writeStrings(out, location.npcIds());
        writeString(out, location.weather());
        out.writeDouble(location.temperature());
        out.writeBoolean(location.marketOpen());
        out.writeBoolean(location.foodAvailable());
        out.writeBoolean(location.marketCapable());
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        if (value == null) {
            out.writeInt(-1);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static void writeStrings(DataOutputStream out, List<String> values) throws IOException {
        out.writeInt(values.size());
        for (String value : values) {
            writeString(out, value);
        }
    }

    private static void writeValue(DataOutputStream out, Object value) throws IOException {
        if (value == null) {
            out.writeByte(VALUE_NULL);
        } else if (value instanceof String) {
            out.writeByte(VALUE_STRING);
            writeString(out, (String) value);
        } else if (value instanceof Boolean) {
            out.writeByte(VALUE_BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else if (value instanceof Long) {
            out.writeByte(VALUE_LONG);
            out.writeLong((Long) value);
        } else if (value instanceof Double) {
            out.writeByte(VALUE_DOUBLE);
            out.writeDouble((Double) value);
        } else if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            out.writeByte(VALUE_LIST);
            out.writeInt(list.size());
            for (Object element : list) {
                writeValue(out, element);
            }
        } else if (value instanceof Map<?, ?>) {
            Map<?, ?> map = (Map<?, ?>) value;
            out.writeByte(VALUE_MAP);
            out.writeInt(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                writeString(out, (String) entry.getKey());
                writeValue(out, entry.getValue());
            }
        } else {
            throw new IOException("Cannot encode payload value of type " + value.getClass().getName());
        }
    }

    @Override
    public WorldSnapshot decode(byte[] data) throws VersionMismatchException, CorruptDataException {
        if (!matches(data)) {
            throw new CorruptDataException("Data does not start with the binary snapshot magic");
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data, MAGIC.length,
            data.length - MAGIC.length))) {
            int version = in.readInt();
            if (version != WorldSnapshot.CURRENT_VERSION) {
                throw new VersionMismatchException(version, WorldSnapshot.CURRENT_VERSION);
            }
            String name = readString(in);
            long seed = in.readLong();
            long totalMinutes = in.readLong();
            if (totalMinutes < 0) {
                throw new CorruptDataException("Negative clock minute counter " + totalMinutes);
            }
            long tickCount = in.readLong();
            long nextNpcNumber = in.readLong();
            long nextEventSequence = in.readLong();
            long totalEventsPublished = in.readLong();
            byte[] rngState = new byte[readLength(in)];
            in.readFully(rngState);

            int entityCount = readLength(in);
            List<EntityRecord> entities = new ArrayList<>(entityCount);
            for (int i = 0; i < entityCount; i++) {
                byte kind = in.readByte();
                if (kind == ENTITY_NPC) {
                    entities.add(readNpc(in));
                } else if (kind == ENTITY_LOCATION) {
                    entities.add(readLocation(in));
                } else {
                    throw new CorruptDataException("Unknown entity tag " + kind + " at entity " + i);
                }
            }

            int eventCount = readLength(in);
            List<EventRecord> events = new ArrayList<>(eventCount);
            for (int i = 0; i < eventCount; i++) {
                long sequence = in.readLong();
                String kind = readString(in);
                long simMinute = in.readLong();
                String sourceId = readString(in);
                String locationId = readString(in);
                Object payload = readValue(in);
                if (!(payload instanceof Map<?, ?>)) {
                    throw new CorruptDataException("Payload of event #" + sequence + " is not a map");
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> map = (Map<String, Object>) payload;
                events.add(new EventRecord(sequence, kind, simMinute, sourceId, locationId, map));
            }
            if (in.available() > 0) {
                throw new CorruptDataException(in.available() + " unexpected trailing bytes");
            }
            return new WorldSnapshot(version, name, seed, ClockRecord.of(totalMinutes), tickCount, nextNpcNumber,
                nextEventSequence, totalEventsPublished, rngState, entities, events);
        } catch (EOFException e) {
            throw new CorruptDataException("Binary snapshot is truncated", e);
        } catch (IOException e) {
            throw new CorruptDataException("Binary snapshot cannot be read: " + e.getMessage(), e);
        }
    }

    private static NpcRecord readNpc(DataInputStream in) throws IOException, CorruptDataException {
        String id = readString(in);
        String name = readString(in);
        boolean active = in.readBoolean();
        long createdAt = in.readLong();
        String race = readString(in);
        String title = readString(in);
        List<String> professions = readStrings(in);
        double energy = in.readDouble();
        double hunger = in.readDouble();
        double mood = in.readDouble();
        double moodBaseline = in.readDouble();
        String state = readString(in);
        String locationId = readString(in);
        String workLocationId = readString(in);
        List<String> travelPath = readStrings(in);
        int memoryCapacity = in.readInt();
        int memoryCount = readLength(in);
        List<NpcRecord.MemoryRecord> memory = new ArrayList<>(memoryCount);
        for (int i = 0; i < memoryCount; i++) {
            memory.add(new NpcRecord.MemoryRecord(in.readLong(), readString(in), in.readDouble(), readString(in)));
        }
        return new NpcRecord(id, name, active, createdAt, race, title, professions, energy, hunger, mood, moodBaseline,
            state, locationId, workLocationId, travelPath, memoryCapacity, memory);
    }

    private static LocationRecord readLocation(DataInputStream in) throws IOException, CorruptDataException {
        return new LocationRecord(readString(in), readString(in), in.readBoolean(), in.readLong(), readString(in),
            readString(in), readStrings(in), readStrings(in), readStrings(in), readString(in), in.readDouble(),
            in.readBoolean(), in.readBoolean(), in.readBoolean());
    }

    private static int readLength(DataInputStream in) throws IOException, CorruptDataException {
        int length = in.readInt();
        if (length < 0 || length > MAX_LENGTH) {
            throw new CorruptDataException("Invalid length prefix " + length);
        }
        return length;
    }

    private static String readString(DataInputStream in) throws IOException, CorruptDataException {
        int length = in.readInt();
        if (length == -1) {
            return null;
        }
        if (length < 0 || length > MAX_LENGTH) {
            throw new CorruptDataException("Invalid string length " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static List<String> readStrings(DataInputStream in) throws IOException, CorruptDataException {
        int count = readLength(in);
        List<String> values = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            values.add(readString(in));
        }
        return values;
    }

    private static Object readValue(DataInputStream in) throws IOException, CorruptDataException {
        byte tag = in.readByte();
        switch (tag) {
            case VALUE_NULL:
                return null;
            case VALUE_STRING:
                return readString(in);
            case VALUE_BOOLEAN:
                return in.readBoolean();
            case VALUE_LONG:
                return in.readLong();
            case VALUE_DOUBLE:
                return in.readDouble();
            case VALUE_LIST: {
                int count = readLength(in);
                List<Object> list = new ArrayList<>(Math.min(count, 1024));
                for (int i = 0; i < count; i++) {
                    list.add(readValue(in));
                }
                return list;
            }
            case VALUE_MAP: {
                int count = readLength(in);
                Map<String, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    String key = readString(in);
                    if (key == null) {
                        throw new CorruptDataException("Null payload key");
                    }
                    map.put(key, readValue(in));
                }
                return map;
            }
            default:
                throw new CorruptDataException("Unknown payload value tag " + tag);
        }
    }
}
