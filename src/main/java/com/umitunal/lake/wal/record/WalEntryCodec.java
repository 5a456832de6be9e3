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

package com.umitunal.lake.wal.record;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Converts log entries to and from frames.
 *
 * <pre>
 * frame: bodyLength(int) crc32(int) flags(byte) body
 * body:  JSON of the entry, deflated when flags has FLAG_COMPRESSED
 * </pre>
 */
public class WalEntryCodec {

    public static final int FRAME_HEADER_SIZE = 4 + 4 + 1;
    public static final byte FLAG_COMPRESSED = 0x01;

    private final ObjectMapper objectMapper;
    private final boolean compress;

    public WalEntryCodec(ObjectMapper objectMapper, boolean compress) {
        this.objectMapper = objectMapper;
        this.compress = compress;
    }

    /**
     * @return a buffer positioned at the start of the frame
     * @throws IOException if the entry cannot be serialized
     */
    public ByteBuffer encode(WalEntry entry) throws IOException {
        byte[] body = objectMapper.writeValueAsBytes(entry);
        if (compress) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(body.length);
            try (DeflaterOutputStream deflater = new DeflaterOutputStream(out)) {
                deflater.write(body);
            }
            body = out.toByteArray();
        }
        CRC32 crc = new CRC32();
        crc.update(body);

        ByteBuffer frame = ByteBuffer.allocate(FRAME_HEADER_SIZE + body.length);
        frame.putInt(body.length);
        frame.putInt((int) crc.getValue());
        frame.put(compress ? FLAG_COMPRESSED : 0);
        frame.put(body);
        frame.flip();
        return frame;
    }

    /**
     * Decodes a frame body.
     *
     * @throws IOException if the checksum does not match or the body is not a valid entry
     */
    public WalEntry decode(byte[] body, int expectedCrc, byte flags) throws IOException {
        CRC32 crc = new CRC32();
        crc.update(body);
        if ((int) crc.getValue() != expectedCrc) {
            throw new IOException("WAL frame checksum mismatch");
        }
        byte[] json = body;
        if ((flags & FLAG_COMPRESSED) != 0) {
            try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(body))) {
                json = in.readAllBytes();
            }
        }
        return objectMapper.readValue(json, WalEntry.class);
    }
}
