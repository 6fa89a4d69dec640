package kulim;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary dictionary file.
 *
 * Layout (big-endian):
 * <pre>
 *   header    magic "KLGM", major (1), minor (1), section count (2), reserved (8)
 *   table     per section: id (2), offset (8), length (8), CRC32 (4)
 *   payloads  TRIE, ENTRIES, TRANSITIONS, METADATA (JSON)
 * </pre>
 * Files are written to a temporary sibling and renamed into place. Reading
 * validates the header, the section bounds and every checksum before any
 * payload is decoded.
 */
public final class DictionaryContainer {

    private static final Logger log = LoggerFactory.getLogger(DictionaryContainer.class);

    static final byte[] MAGIC = {'K', 'L', 'G', 'M'};
    static final int VERSION_MAJOR = 1;
    static final int VERSION_MINOR = 0;
    static final int HEADER_SIZE = 16;
    static final int TABLE_ENTRY_SIZE = 22;

    static final short SECTION_TRIE = 1;
    static final short SECTION_ENTRIES = 2;
    static final short SECTION_TRANSITIONS = 3;
    static final short SECTION_METADATA = 4;

    private static final short[] SECTIONS = {SECTION_TRIE, SECTION_ENTRIES, SECTION_TRANSITIONS, SECTION_METADATA};

    private DictionaryContainer() {} // Utility class

    /**
     * Dictionary, transition table and metadata read from a container.
     */
    public static final class Contents {
        private final DictionaryStore store;
        private final TransitionCostTable transitions;
        private final Map<String, String> metadata;

        Contents(DictionaryStore store, TransitionCostTable transitions, Map<String, String> metadata) {
            this.store = store;
            this.transitions = transitions;
            this.metadata = Collections.unmodifiableMap(metadata);
        }

        public DictionaryStore store() {
            return store;
        }

        public TransitionCostTable transitions() {
            return transitions;
        }

        public Map<String, String> metadata() {
            return metadata;
        }
    }

    public static void write(Path path, DictionaryStore store, TransitionCostTable transitions,
                             Map<String, String> metadata) throws IOException {
        byte[][] dictionary;
        try {
            dictionary = store.read(s -> {
                try {
                    return new byte[][] {trieBytes(s), entryBytes(s)};
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        ByteArrayOutputStream transitionBuffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(transitionBuffer)) {
            transitions.writeTo(out);
        }
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("format", VERSION_MAJOR + "." + VERSION_MINOR);
        meta.put("entries", Integer.toString(store.size()));
        meta.put("transitions", Integer.toString(transitions.size()));
        if (metadata != null) {
            meta.putAll(metadata);
        }
        byte[] metaBytes = new Gson().toJson(meta).getBytes(StandardCharsets.UTF_8);

        byte[][] payloads = {dictionary[0], dictionary[1], transitionBuffer.toByteArray(), metaBytes};
        byte[] file = assemble(payloads);
        writeAtomically(path, file);
        log.info("Wrote dictionary container {} ({} bytes, {} entries)", path, file.length, store.size());
    }

    /**
     * Reads and validates a whole container. Nothing is returned unless every section is intact.
     *
     * @throws DictionaryFormatException if the file is corrupt, truncated or of another version
     */
    public static Contents read(Path path) throws IOException {
        long start = System.currentTimeMillis();
        byte[] file = Files.readAllBytes(path);
        byte[][] payloads = sections(file);
        try {
            List<DictionaryEntry> entries = readEntries(payloads[1]);
            TrieIndex trie;
            try (DataInputStream in = stream(payloads[0])) {
                trie = TrieIndex.readFrom(in, entries);
                requireConsumed(in, "TRIE");
            }
            DictionaryStore store = DictionaryStore.restore(entries, trie);
            TransitionCostTable transitions;
            try (DataInputStream in = stream(payloads[2])) {
                transitions = TransitionCostTable.readFrom(in);
                requireConsumed(in, "TRANSITIONS");
            }
            Map<String, String> metadata = readMetadata(payloads[3]);
            log.info("Loaded dictionary container {} in {} ms: {} entries", path,
                System.currentTimeMillis() - start, store.size());
            return new Contents(store, transitions, metadata);
        } catch (DictionaryFormatException e) {
            throw e;
        } catch (EOFException e) {
            throw new DictionaryFormatException("Truncated section payload in " + path, e);
        } catch (IOException | EntryConflictException | IllegalArgumentException e) {
            throw new DictionaryFormatException("Invalid dictionary container " + path + ": " + e.getMessage(), e);
        }
    }

    // --- Layout ---

    static byte[] assemble(byte[][] payloads) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.write(MAGIC);
            out.writeByte(VERSION_MAJOR);
            out.writeByte(VERSION_MINOR);
            out.writeShort(SECTIONS.length);
            out.write(new byte[8]);
            long offset = HEADER_SIZE + (long) TABLE_ENTRY_SIZE * SECTIONS.length;
            for (int i = 0; i < SECTIONS.length; i++) {
                CRC32 crc = new CRC32();
                crc.update(payloads[i]);
                out.writeShort(SECTIONS[i]);
                out.writeLong(offset);
                out.writeLong(payloads[i].length);
                out.writeInt((int) crc.getValue());
                offset += payloads[i].length;
            }
            for (byte[] payload : payloads) {
                out.write(payload);
            }
        }
        return buffer.toByteArray();
    }

    /**
     * Validates header, table and checksums; returns the payloads in section id order.
     */
    static byte[][] sections(byte[] file) throws DictionaryFormatException {
        if (file.length < HEADER_SIZE) {
            throw new DictionaryFormatException("File too short for a container header: " + file.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(file);
        byte[] magic = new byte[4];
        buf.get(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new DictionaryFormatException("Not a dictionary container (bad magic)");
        }
        int major = buf.get() & 0xFF;
        int minor = buf.get() & 0xFF;
        if (major != VERSION_MAJOR || minor > VERSION_MINOR) {
            throw new DictionaryFormatException("Unsupported container version " + major + "." + minor
                + " (supported " + VERSION_MAJOR + "." + VERSION_MINOR + ")");
        }
        int count = buf.getShort() & 0xFFFF;
        buf.position(HEADER_SIZE);
        if (count != SECTIONS.length) {
            throw new DictionaryFormatException("Expected " + SECTIONS.length + " sections, found " + count);
        }
        long tableEnd = HEADER_SIZE + (long) TABLE_ENTRY_SIZE * count;
        if (file.length < tableEnd) {
            throw new DictionaryFormatException("Truncated section table");
        }
        byte[][] payloads = new byte[SECTIONS.length][];
        for (int i = 0; i < count; i++) {
            int id = buf.getShort() & 0xFFFF;
            long offset = buf.getLong();
            long length = buf.getLong();
            int checksum = buf.getInt();
            if (id < 1 || id > SECTIONS.length) {
                throw new DictionaryFormatException("Unknown section id " + id);
            }
            if (payloads[id - 1] != null) {
                throw new DictionaryFormatException("Duplicate section id " + id);
            }
            if (offset < tableEnd || length < 0 || offset > file.length || length > file.length - offset) {
                throw new DictionaryFormatException("Section " + id + " out of bounds: offset " + offset
                    + ", length " + length + ", file " + file.length);
            }
            CRC32 crc = new CRC32();
            crc.update(file, (int) offset, (int) length);
            if ((int) crc.getValue() != checksum) {
                throw new DictionaryFormatException("Checksum mismatch in section " + id);
            }
            payloads[id - 1] = Arrays.copyOfRange(file, (int) offset, (int) (offset + length));
        }
        return payloads;
    }

    // --- Payloads ---

    private static byte[] trieBytes(DictionaryStore store) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            store.trie().writeTo(out);
        }
        return buffer.toByteArray();
    }

    private static byte[] entryBytes(DictionaryStore store) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            List<DictionaryEntry> slots = store.slots();
            out.writeInt(slots.size());
            for (DictionaryEntry entry : slots) {
                if (entry == null) {
                    out.writeBoolean(false);
                    continue;
                }
                out.writeBoolean(true);
                out.writeUTF(entry.surface());
                out.writeUTF(entry.pos());
                out.writeUTF(entry.lemma());
                out.writeInt(entry.cost());
                out.writeInt(entry.components().size());
                for (Morph component : entry.components()) {
                    out.writeUTF(component.surface());
                    out.writeUTF(component.pos());
                    out.writeUTF(component.lemma());
                }
            }
        }
        return buffer.toByteArray();
    }

    private static List<DictionaryEntry> readEntries(byte[] payload) throws IOException {
        try (DataInputStream in = stream(payload)) {
            int count = in.readInt();
            // each slot takes at least one byte
            if (count < 0 || count > payload.length) {
                throw new DictionaryFormatException("Entry table claims " + count + " slots");
            }
            List<DictionaryEntry> entries = new ArrayList<>(count);
            for (int id = 0; id < count; id++) {
                if (!in.readBoolean()) {
                    entries.add(null);
                    continue;
                }
                String surface = in.readUTF();
                String pos = in.readUTF();
                String lemma = in.readUTF();
                int cost = in.readInt();
                int componentCount = in.readInt();
                if (surface.isEmpty() || componentCount < 0 || componentCount > payload.length) {
                    throw new DictionaryFormatException("Malformed entry " + id);
                }
                List<Morph> components = new ArrayList<>(componentCount);
                for (int c = 0; c < componentCount; c++) {
                    components.add(Morph.of(in.readUTF(), in.readUTF(), in.readUTF()));
                }
                entries.add(new DictionaryEntry(id, surface, pos, lemma, cost, components));
            }
            requireConsumed(in, "ENTRIES");
            return entries;
        }
    }

    private static Map<String, String> readMetadata(byte[] payload) throws DictionaryFormatException {
        try {
            Map<String, String> metadata = new Gson().fromJson(new String(payload, StandardCharsets.UTF_8),
                new TypeToken<LinkedHashMap<String, String>>() {}.getType());
            return metadata == null ? new LinkedHashMap<>() : metadata;
        } catch (JsonParseException e) {
            throw new DictionaryFormatException("Invalid metadata section: " + e.getMessage(), e);
        }
    }

    private static DataInputStream stream(byte[] payload) {
        return new DataInputStream(new ByteArrayInputStream(payload));
    }

    private static void requireConsumed(DataInputStream in, String section) throws IOException {
        if (in.available() > 0) {
            throw new DictionaryFormatException(in.available() + " trailing bytes in " + section + " section");
        }
    }

    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing {}", dir, absolute);
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(tmp);
            }
        }
    }
}
