/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.lake.columnfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Implementation of the ColumnFileIO interface.
 *
 * <p>File layout:</p>
 * <pre>
 * header:  magic(int) version(short) flags(byte) createdAt(long) writeId(long) rowCount(int)
 *          hasRange(byte) minTimestamp(long) maxTimestamp(long) columnCount(int)
 *          columnCount x [nameLength(short) name(utf8) type(byte)]
 * blocks:  columnCount x [storedLength(int) rawLength(int) bytes]
 * trailer: crc32 of everything before it (long)
 * </pre>
 * Each raw block holds rowCount cells of one column: a presence byte followed by the value.
 */
public class ColumnFileIOImpl implements ColumnFileIO {
    private static final Logger logger = LoggerFactory.getLogger(ColumnFileIOImpl.class);

    static final int MAGIC = 0x4C414B45;
    static final short VERSION = 1;
    private static final byte FLAG_COMPRESSED = 0x01;
    private static final int FIXED_HEADER_SIZE = 4 + 2 + 1 + 8 + 8 + 4 + 1 + 8 + 8 + 4;

    private final String timestampColumn;

    /**
     * Creates a new ColumnFileIOImpl.
     *
     * @param timestampColumn the column whose values define a file's time range
     */
    public ColumnFileIOImpl(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    @Override
    public ColumnFileInfo write(Path path, List<Map<String, Object>> rows, long writeId, long createdAt,
                                boolean compress) throws IOException {
        List<ColumnDescriptor> columns = inferColumns(rows);

        Long minTimestamp = null;
        Long maxTimestamp = null;
        for (Map<String, Object> row : rows) {
            Long ts = TimestampValues.toEpochMillis(row.get(timestampColumn));
            if (ts != null) {
                minTimestamp = minTimestamp == null ? ts : Math.min(minTimestamp, ts);
                maxTimestamp = maxTimestamp == null ? ts : Math.max(maxTimestamp, ts);
            }
        }

        List<byte[]> names = new ArrayList<>(columns.size());
        int headerSize = FIXED_HEADER_SIZE;
        for (ColumnDescriptor column : columns) {
            byte[] name = column.name().getBytes(StandardCharsets.UTF_8);
            if (name.length > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Column name too long: " + column.name());
            }
            names.add(name);
            headerSize += 2 + name.length + 1;
        }

        ByteBuffer header = ByteBuffer.allocate(headerSize);
        header.putInt(MAGIC);
        header.putShort(VERSION);
        header.put(compress ? FLAG_COMPRESSED : 0);
        header.putLong(createdAt);
        header.putLong(writeId);
        header.putInt(rows.size());
        header.put((byte) (minTimestamp != null ? 1 : 0));
        header.putLong(minTimestamp != null ? minTimestamp : 0L);
        header.putLong(maxTimestamp != null ? maxTimestamp : 0L);
        header.putInt(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            header.putShort((short) names.get(i).length);
            header.put(names.get(i));
            header.put(columns.get(i).type().code());
        }
        header.flip();

        CRC32 crc = new CRC32();
        crc.update(header.duplicate());

        Files.createDirectories(path.getParent());
        Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(tempPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            writeFully(channel, header);

            for (ColumnDescriptor column : columns) {
                byte[] raw = encodeColumn(column, rows);
                byte[] stored = compress ? deflate(raw) : raw;

                ByteBuffer block = ByteBuffer.allocate(8 + stored.length);
                block.putInt(stored.length);
                block.putInt(raw.length);
                block.put(stored);
                block.flip();
                crc.update(block.duplicate());
                writeFully(channel, block);
            }

            ByteBuffer trailer = ByteBuffer.allocate(8);
            trailer.putLong(crc.getValue());
            trailer.flip();
            writeFully(channel, trailer);
            channel.force(true);
        } catch (IOException e) {
            Files.deleteIfExists(tempPath);
            throw e;
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        long size = Files.size(path);
        logger.debug("Wrote column file " + path + " with " + rows.size() + " rows, " + size + " bytes");
        return new ColumnFileInfo(size, rows.size(), columns, createdAt, writeId, minTimestamp, maxTimestamp, compress);
    }

    @Override
    public ColumnFileData read(Path path) throws IOException {
        byte[] content = Files.readAllBytes(path);
        if (content.length < FIXED_HEADER_SIZE + 8) {
            throw new IOException("Column file too short: " + path);
        }
        ByteBuffer buffer = ByteBuffer.wrap(content);

        CRC32 crc = new CRC32();
        crc.update(content, 0, content.length - 8);
        long storedCrc = buffer.getLong(content.length - 8);
        if (storedCrc != crc.getValue()) {
            throw new IOException("Checksum mismatch in column file: " + path);
        }

        ColumnFileInfo info = parseHeader(buffer, path, content.length);
        int rowCount = info.rowCount();
        List<Map<String, Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(new LinkedHashMap<>());
        }

        for (ColumnDescriptor column : info.columns()) {
            int storedLength = buffer.getInt();
            int rawLength = buffer.getInt();
            if (storedLength < 0 || storedLength > buffer.remaining() - 8) {
                throw new IOException("Corrupt block length for column " + column.name() + " in " + path);
            }
            byte[] stored = new byte[storedLength];
            buffer.get(stored);
            byte[] raw = info.compressed() ? inflate(stored, rawLength) : stored;
            decodeColumn(column, raw, rows);
        }
        return new ColumnFileData(info, rows);
    }

    @Override
    public ColumnFileInfo readInfo(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size < FIXED_HEADER_SIZE + 8) {
                throw new IOException("Column file too short: " + path);
            }
            ByteBuffer fixed = ByteBuffer.allocate(FIXED_HEADER_SIZE);
            readFully(channel, fixed, 0);
            fixed.flip();
            int columnCount = fixed.getInt(FIXED_HEADER_SIZE - 4);
            if (columnCount < 0) {
                throw new IOException("Corrupt header in column file: " + path);
            }

            // descriptors are variable length, walk them to find the header size
            long position = FIXED_HEADER_SIZE;
            ByteBuffer nameLength = ByteBuffer.allocate(2);
            for (int i = 0; i < columnCount; i++) {
                nameLength.clear();
                readFully(channel, nameLength, position);
                nameLength.flip();
                if (nameLength.remaining() < 2) {
                    throw new IOException("Corrupt header in column file: " + path);
                }
                position += 2 + nameLength.getShort() + 1;
            }
            if (position > size) {
                throw new IOException("Corrupt header in column file: " + path);
            }

            ByteBuffer header = ByteBuffer.allocate((int) position);
            readFully(channel, header, 0);
            header.flip();
            return parseHeader(header, path, size);
        }
    }

    private ColumnFileInfo parseHeader(ByteBuffer buffer, Path path, long size) throws IOException {
        try {
            int magic = buffer.getInt();
            if (magic != MAGIC) {
                throw new IOException("Not a column file: " + path);
            }
            short version = buffer.getShort();
            if (version != VERSION) {
                throw new IOException("Unsupported column file version " + version + ": " + path);
            }
            byte flags = buffer.get();
            long createdAt = buffer.getLong();
            long writeId = buffer.getLong();
            int rowCount = buffer.getInt();
            boolean hasRange = buffer.get() == 1;
            long minTimestamp = buffer.getLong();
            long maxTimestamp = buffer.getLong();
            int columnCount = buffer.getInt();
            if (rowCount < 0 || columnCount < 0) {
                throw new IOException("Corrupt header in column file: " + path);
            }

            List<ColumnDescriptor> columns = new ArrayList<>(columnCount);
            for (int i = 0; i < columnCount; i++) {
                short nameLength = buffer.getShort();
                byte[] name = new byte[nameLength];
                buffer.get(name);
                columns.add(new ColumnDescriptor(new String(name, StandardCharsets.UTF_8),
                    ColumnType.fromCode(buffer.get())));
            }
            return new ColumnFileInfo(size, rowCount, columns, createdAt, writeId,
                hasRange ? minTimestamp : null, hasRange ? maxTimestamp : null,
                (flags & FLAG_COMPRESSED) != 0);
        } catch (RuntimeException e) {
            throw new IOException("Corrupt header in column file: " + path, e);
        }
    }

    private static List<ColumnDescriptor> inferColumns(List<Map<String, Object>> rows) {
        Map<String, List<Object>> valuesByColumn = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                valuesByColumn.computeIfAbsent(cell.getKey(), k -> new ArrayList<>()).add(cell.getValue());
            }
        }
        List<ColumnDescriptor> columns = new ArrayList<>(valuesByColumn.size());
        valuesByColumn.forEach((name, values) -> columns.add(new ColumnDescriptor(name, ColumnType.infer(values))));
        return columns;
    }

    private static byte[] encodeColumn(ColumnDescriptor column, List<Map<String, Object>> rows) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            for (Map<String, Object> row : rows) {
                Object value = column.type().normalize(row.get(column.name()));
                if (value == null) {
                    out.writeByte(0);
                    continue;
                }
                out.writeByte(1);
                switch (column.type()) {
                    case LONG -> out.writeLong((Long) value);
                    case DOUBLE -> out.writeDouble((Double) value);
                    case BOOLEAN -> out.writeBoolean((Boolean) value);
                    case STRING -> {
                        byte[] text = ((String) value).getBytes(StandardCharsets.UTF_8);
                        out.writeInt(text.length);
                        out.write(text);
                    }
                }
            }
        }
        return bytes.toByteArray();
    }

    private static void decodeColumn(ColumnDescriptor column, byte[] raw, List<Map<String, Object>> rows)
            throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(raw))) {
            for (Map<String, Object> row : rows) {
                if (in.readByte() == 0) {
                    continue;
                }
                Object value = switch (column.type()) {
                    case LONG -> in.readLong();
                    case DOUBLE -> in.readDouble();
                    case BOOLEAN -> in.readBoolean();
                    case STRING -> {
                        byte[] text = new byte[in.readInt()];
                        in.readFully(text);
                        yield new String(text, StandardCharsets.UTF_8);
                    }
                };
                row.put(column.name(), value);
            }
        }
    }

    private static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            byte[] chunk = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] stored, int rawLength) throws IOException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(stored);
            byte[] raw = new byte[rawLength];
            int offset = 0;
            while (offset < rawLength && !inflater.finished()) {
                int n = inflater.inflate(raw, offset, rawLength - offset);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                offset += n;
            }
            if (offset != rawLength) {
                throw new IOException("Truncated compressed block: expected " + rawLength + " bytes, got " + offset);
            }
            return raw;
        } catch (DataFormatException e) {
            throw new IOException("Corrupt compressed block", e);
        } finally {
            inflater.end();
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                break;
            }
            pos += n;
        }
    }
}
