package net.imadata.imatools.rpm;

import net.imadata.imatools.PackageHeaderReader;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the main header of an RPM package without touching its payload.
 * <p>
 * A package starts with a 96 byte lead, followed by the signature header (padded to 8 bytes) and the main header.
 * Both headers share the same structure: a 16 byte intro (magic, reserved, index entry count, data store size),
 * the index entries (tag, type, offset, count; 16 bytes each) and the data store the entries point into.
 */
public final class RpmHeaderReader implements PackageHeaderReader {
    static final byte[] LEAD_MAGIC = {(byte) 0xED, (byte) 0xAB, (byte) 0xEE, (byte) 0xDB};
    static final byte[] HEADER_MAGIC = {(byte) 0x8E, (byte) 0xAD, (byte) 0xE8, (byte) 0x01};
    static final int LEAD_SIZE = 96;
    static final int LEAD_TYPE_SOURCE = 1;
    static final int HEADER_INTRO_SIZE = 16;
    static final int INDEX_ENTRY_SIZE = 16;

    private static final int MAX_INDEX_ENTRIES = 0xFFFF;
    private static final int MAX_DATA_SIZE = 256 * 1024 * 1024;

    @Override
    public RpmHeader read(Path packageFile) throws IOException {
        try (FileChannel channel = FileChannel.open(packageFile, StandardOpenOption.READ)) {
            ByteBuffer lead = readFully(channel, LEAD_SIZE, "lead");
            checkMagic(lead, LEAD_MAGIC, 0, "lead");
            int leadType = lead.getShort(6) & 0xFFFF;

            HeaderStructure signature = readHeaderStructure(channel, "signature header");
            int padding = (int) ((8 - (signature.size() % 8)) % 8);
            channel.position(channel.position() + padding);

            HeaderStructure header = readHeaderStructure(channel, "header");
            return toRpmHeader(header, leadType == LEAD_TYPE_SOURCE);
        }
    }

    private static RpmHeader toRpmHeader(HeaderStructure header, boolean sourceLead) throws RpmFormatException {
        String name = header.getRequiredString(RpmTag.NAME, "NAME");
        String version = header.getRequiredString(RpmTag.VERSION, "VERSION");
        String release = header.getRequiredString(RpmTag.RELEASE, "RELEASE");
        String arch = header.getString(RpmTag.ARCH);
        Integer epoch = header.getInt(RpmTag.EPOCH);
        if (epoch != null && epoch < 0) {
            throw header.error("Negative EPOCH " + epoch);
        }
        Integer sourcePackage = header.getInt(RpmTag.SOURCEPACKAGE);

        Integer algorithmId = header.getInt(RpmTag.FILEDIGESTALGO);
        DigestAlgorithm algorithm = algorithmId == null ? DigestAlgorithm.MD5 : DigestAlgorithm.byPgpId(algorithmId);
        if (algorithm == null) {
            throw header.error("Unknown file digest algorithm " + algorithmId);
        }

        return new RpmHeader(
                name,
                arch == null ? "" : arch,
                (sourcePackage != null && sourcePackage != 0) || sourceLead,
                epoch,
                version,
                release,
                algorithm,
                readFiles(header, algorithm)
        );
    }

    private static List<RpmFile> readFiles(HeaderStructure header, DigestAlgorithm algorithm) throws RpmFormatException {
        List<String> paths;
        String[] baseNames = header.getStringArray(RpmTag.BASENAMES);
        if (baseNames != null) {
            int[] dirIndexes = header.getIntArray(RpmTag.DIRINDEXES);
            String[] dirNames = header.getStringArray(RpmTag.DIRNAMES);
            if (dirIndexes == null || dirNames == null || dirIndexes.length != baseNames.length) {
                throw header.error("Inconsistent BASENAMES/DIRINDEXES/DIRNAMES tables");
            }
            paths = new ArrayList<>(baseNames.length);
            for (int i = 0; i < baseNames.length; i++) {
                int dirIndex = dirIndexes[i];
                if (dirIndex < 0 || dirIndex >= dirNames.length) {
                    throw header.error("Directory index " + dirIndex + " out of range for " + baseNames[i]);
                }
                paths.add(dirNames[dirIndex] + baseNames[i]);
            }
        } else {
            String[] oldFileNames = header.getStringArray(RpmTag.OLDFILENAMES);
            paths = oldFileNames == null ? new ArrayList<String>() : Arrays.asList(oldFileNames);
        }

        String[] digests = header.getStringArray(RpmTag.FILEDIGESTS);
        if (digests != null && digests.length != paths.size()) {
            throw header.error("File digest table has " + digests.length + " entries for " + paths.size() + " files");
        }

        String placeholder = zeros(algorithm.getHexLength());
        List<RpmFile> files = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            String digest = digests == null || digests[i].isEmpty() ? placeholder : digests[i];
            files.add(new RpmFile(paths.get(i), digest));
        }
        return files;
    }

    private static String zeros(int length) {
        char[] buffer = new char[length];
        Arrays.fill(buffer, '0');
        return String.valueOf(buffer);
    }

    private static HeaderStructure readHeaderStructure(FileChannel channel, String what) throws IOException {
        long start = channel.position();
        ByteBuffer intro = readFully(channel, HEADER_INTRO_SIZE, what);
        checkMagic(intro, HEADER_MAGIC, start, what);
        int entryCount = intro.getInt(8);
        int dataSize = intro.getInt(12);
        if (entryCount < 0 || entryCount > MAX_INDEX_ENTRIES) {
            throw new RpmFormatException("Invalid index entry count " + entryCount + " in " + what, start);
        }
        if (dataSize < 0 || dataSize > MAX_DATA_SIZE) {
            throw new RpmFormatException("Invalid data store size " + dataSize + " in " + what, start);
        }

        ByteBuffer index = readFully(channel, entryCount * INDEX_ENTRY_SIZE, what + " index");
        ByteBuffer store = readFully(channel, dataSize, what + " data store");

        Map<Integer, IndexEntry> entries = new HashMap<>(entryCount * 2);
        for (int i = 0; i < entryCount; i++) {
            int base = i * INDEX_ENTRY_SIZE;
            IndexEntry entry = new IndexEntry(index.getInt(base), index.getInt(base + 4), index.getInt(base + 8), index.getInt(base + 12));
            entries.putIfAbsent(entry.tag, entry);
        }
        return new HeaderStructure(what, start, HEADER_INTRO_SIZE + (long) entryCount * INDEX_ENTRY_SIZE + dataSize, entries, store);
    }

    private static ByteBuffer readFully(FileChannel channel, int length, String what) throws IOException {
        long start = channel.position();
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new RpmFormatException("Unexpected end of file while reading " + what, start);
            }
        }
        buffer.flip();
        return buffer;
    }

    private static void checkMagic(ByteBuffer buffer, byte[] magic, long offset, String what) throws RpmFormatException {
        for (int i = 0; i < magic.length; i++) {
            if (buffer.get(i) != magic[i]) {
                throw new RpmFormatException("Bad " + what + " magic, not an RPM package", offset);
            }
        }
    }

    private static final class IndexEntry {
        private final int tag;
        private final int type;
        private final int offset;
        private final int count;

        private IndexEntry(int tag, int type, int offset, int count) {
            this.tag = tag;
            this.type = type;
            this.offset = offset;
            this.count = count;
        }
    }

    private static final class HeaderStructure {
        private final String what;
        private final long start;
        private final long size;
        private final Map<Integer, IndexEntry> entries;
        private final ByteBuffer store;

        private HeaderStructure(String what, long start, long size, Map<Integer, IndexEntry> entries, ByteBuffer store) {
            this.what = what;
            this.start = start;
            this.size = size;
            this.entries = entries;
            this.store = store;
        }

        long size() {
            return size;
        }

        RpmFormatException error(String message) {
            return new RpmFormatException(message + " in " + what, start);
        }

        String getRequiredString(int tag, String tagName) throws RpmFormatException {
            String value = getString(tag);
            if (value == null) {
                throw error("Missing required tag " + tagName);
            }
            return value;
        }

        @Nullable
        String getString(int tag) throws RpmFormatException {
            IndexEntry entry = entries.get(tag);
            if (entry == null) {
                return null;
            }
            if (entry.type != RpmTag.TYPE_STRING && entry.type != RpmTag.TYPE_STRING_ARRAY && entry.type != RpmTag.TYPE_I18NSTRING) {
                throw error("Tag " + tag + " has type " + entry.type + ", expected a string");
            }
            // For arrays and translated strings the first value is the default
            return readStrings(entry, 1)[0];
        }

        @Nullable
        String[] getStringArray(int tag) throws RpmFormatException {
            IndexEntry entry = entries.get(tag);
            if (entry == null) {
                return null;
            }
            if (entry.type != RpmTag.TYPE_STRING_ARRAY && entry.type != RpmTag.TYPE_I18NSTRING) {
                throw error("Tag " + tag + " has type " + entry.type + ", expected a string array");
            }
            return readStrings(entry, entry.count);
        }

        @Nullable
        Integer getInt(int tag) throws RpmFormatException {
            int[] values = getIntArray(tag);
            if (values == null || values.length == 0) {
                return null;
            }
            return values[0];
        }

        @Nullable
        int[] getIntArray(int tag) throws RpmFormatException {
            IndexEntry entry = entries.get(tag);
            if (entry == null) {
                return null;
            }
            if (entry.type != RpmTag.TYPE_INT32) {
                throw error("Tag " + tag + " has type " + entry.type + ", expected INT32");
            }
            if (entry.count < 0 || entry.offset < 0 || (long) entry.offset + (long) entry.count * 4 > store.limit()) {
                throw error("Tag " + tag + " points outside of the data store");
            }
            int[] values = new int[entry.count];
            for (int i = 0; i < values.length; i++) {
                values[i] = store.getInt(entry.offset + i * 4);
            }
            return values;
        }

        private String[] readStrings(IndexEntry entry, int count) throws RpmFormatException {
            if (count < 0 || entry.offset < 0 || entry.offset > store.limit()) {
                throw error("Tag " + entry.tag + " points outside of the data store");
            }
            String[] result = new String[count];
            int position = entry.offset;
            for (int i = 0; i < count; i++) {
                int end = position;
                while (end < store.limit() && store.get(end) != 0) {
                    end++;
                }
                if (end >= store.limit()) {
                    throw error("Unterminated string for tag " + entry.tag);
                }
                byte[] bytes = new byte[end - position];
                for (int j = 0; j < bytes.length; j++) {
                    bytes[j] = store.get(position + j);
                }
                result[i] = new String(bytes, StandardCharsets.UTF_8);
                position = end + 1;
            }
            return result;
        }
    }
}
