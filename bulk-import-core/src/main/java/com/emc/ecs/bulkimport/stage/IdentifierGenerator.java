/*
 * Copyright (c) 2022 Dell Inc. or its subsidiaries. All Rights Reserved.
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
package com.emc.ecs.bulkimport.stage;

import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.IndexService;
import com.emc.ecs.bulkimport.service.IndexUnavailableException;
import com.emc.ecs.bulkimport.storage.FileIdentifier;
import com.emc.ecs.bulkimport.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.util.Base64;
import java.util.Random;

/**
 * Builds file IDs in the same shape the storage server gives uploaded files, so imported files are addressed like
 * any other.
 * <p>
 * The file name is 20 bytes (server ID, timestamp, size, CRC32) in the URL-safe base64 alphabet (27 chars), padded
 * with digits so that padding + extension is always 7 chars, plus the extension. The two shard directories come from
 * the PJW hash of the 27 encoded chars. An ID is only handed out if neither the index nor the store path already has
 * it; otherwise a fresh token is drawn, up to the configured number of retries.
 */
public class IdentifierGenerator {
    private static final Logger log = LoggerFactory.getLogger(IdentifierGenerator.class);

    public static final int ENCODED_LENGTH = 27;
    public static final int NAME_SUFFIX_LENGTH = MetadataExtractor.MAX_EXTENSION_LENGTH + 1;

    private static final long SIZE_MARKER = 0x80000000L;
    private static final int SIZE_RANDOM_MASK = 0x007FFFFF;
    private static final int LARGE_SIZE_BITS = 40;

    /**
     * Largest size that leaves room for the token sequence in the size field (1 TiB - 1).
     */
    public static final long MAX_ENCODABLE_SIZE = (1L << LARGE_SIZE_BITS) - 1;
    private static final int SHARD_HASH_MODULUS = 65536;

    public static int pjwHash(byte[] bytes) {
        int h = 0;
        for (byte b : bytes) {
            h = (h << 4) + (b & 0xFF);
            int g = h & 0xF0000000;
            if (g != 0) {
                h ^= g >>> 24;
                h ^= g;
            }
        }
        return h;
    }

    private final StorePaths storePaths;
    private final IndexService indexService;
    private final UniquenessSource uniquenessSource;
    private final int serverId;
    private final int collisionRetries;

    public IdentifierGenerator(StorePaths storePaths, IndexService indexService, UniquenessSource uniquenessSource,
                               int serverId, int collisionRetries) {
        if (collisionRetries < 0) throw new IllegalArgumentException("collision retries must not be negative");
        this.storePaths = storePaths;
        this.indexService = indexService;
        this.uniquenessSource = uniquenessSource;
        this.serverId = serverId;
        this.collisionRetries = collisionRetries;
    }

    public IdentifierGenerator(StorePaths storePaths, IndexService indexService, int serverId) {
        this(storePaths, indexService, new CounterUniquenessSource(), serverId, ImportOptions.DEFAULT_COLLISION_RETRIES);
    }

    public StageResult<String> generate(FileMetadata metadata, String groupName, int storePathIndex) {
        if (!FileIdentifier.isValidGroupName(groupName))
            return StageResult.error(ImportError.INVALID_PATH, "invalid target group: " + groupName);
        if (!storePaths.isValidIndex(storePathIndex))
            return StageResult.error(ImportError.INVALID_PATH, "store path index " + storePathIndex + " is not configured");
        if (metadata.getSize() > MAX_ENCODABLE_SIZE)
            return StageResult.error(ImportError.FILE_TOO_LARGE, "size " + metadata.getSize()
                    + " exceeds the largest size a file ID can carry (" + MAX_ENCODABLE_SIZE + ")");

        for (int attempt = 0; attempt <= collisionRetries; attempt++) {
            UniquenessSource.Token token = uniquenessSource.next();
            FileIdentifier fileId = derive(metadata, groupName, storePathIndex, token);
            String identifier = fileId.toString();
            if (identifier.length() > FileIdentifier.MAX_LENGTH)
                return StageResult.error(ImportError.INVALID_PATH, "generated file ID is too long: " + identifier);
            try {
                if (!indexService.exists(identifier)
                        && !Files.exists(storePaths.resolveStoragePath(fileId), LinkOption.NOFOLLOW_LINKS)) {
                    log.debug("generated file ID {} (token {}, attempt {})", identifier, token, attempt + 1);
                    return StageResult.ok(identifier);
                }
            } catch (IndexUnavailableException e) {
                log.warn("index unavailable while checking file ID {}", identifier, e);
                return StageResult.error(ImportError.INDEX_UPDATE, "index unavailable: " + e.getMessage());
            }
            log.info("file ID {} is already in use (attempt {} of {})", identifier, attempt + 1, collisionRetries + 1);
        }
        return StageResult.error(ImportError.ID_COLLISION,
                "no unique file ID after " + (collisionRetries + 1) + " attempts");
    }

    /**
     * Pure derivation of a file ID from the file facts and a token; does not check for collisions. The token
     * sequence always lands in the size field, so tokens with the same timestamp still give distinct IDs.
     */
    public FileIdentifier derive(FileMetadata metadata, String groupName, int storePathIndex,
                                 UniquenessSource.Token token) {
        if (metadata.getSize() > MAX_ENCODABLE_SIZE)
            throw new IllegalArgumentException("size " + metadata.getSize() + " cannot be encoded in a file ID");
        Random random = new Random(((long) token.getTimestamp() << 32) ^ token.getSequence());

        long sizeField = metadata.getSize();
        if ((sizeField >> 32) == 0) {
            // small sizes carry a marker bit and the token sequence in the high word
            long high = ((token.getSequence() & SIZE_RANDOM_MASK) | SIZE_MARKER);
            sizeField = (high << 32) | sizeField;
        } else {
            // large sizes keep the marker bit clear and carry the sequence above bit 40
            sizeField |= (token.getSequence() & SIZE_RANDOM_MASK) << LARGE_SIZE_BITS;
        }
        long crc = metadata.getChecksum() == null ? 0 : metadata.getChecksum();

        ByteBuffer buffer = ByteBuffer.allocate(20);
        buffer.putInt(serverId);
        buffer.putInt(token.getTimestamp());
        buffer.putLong(sizeField);
        buffer.putInt((int) crc);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());

        String extension = metadata.getExtension() == null ? "" : metadata.getExtension();
        int padLength = extension.isEmpty() ? NAME_SUFFIX_LENGTH : NAME_SUFFIX_LENGTH - 1 - extension.length();
        StringBuilder name = new StringBuilder(encoded);
        for (int i = 0; i < padLength; i++) {
            name.append((char) ('0' + random.nextInt(10)));
        }
        if (!extension.isEmpty()) name.append('.').append(extension);

        long hash = (pjwHash(encoded.getBytes(StandardCharsets.US_ASCII)) & 0xFFFFFFFFL) % SHARD_HASH_MODULUS;
        int subdirCount = storePaths.getSubdirCount();
        int high = (int) ((hash >> 8) & 0xFF) % subdirCount;
        int low = (int) (hash & 0xFF) % subdirCount;

        return new FileIdentifier(groupName, storePathIndex, high, low, name.toString());
    }

    public int getCollisionRetries() {
        return collisionRetries;
    }
}
