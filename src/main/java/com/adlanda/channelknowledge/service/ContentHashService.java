package com.adlanda.channelknowledge.service;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes SHA-256 content hashes.
 *
 * File hashes drive incremental knowledge-base loading; chunk hashes back the
 * index's (source, content hash) dedup rule.
 */
@Service
public class ContentHashService {

    /**
     * @return 64-character hex digest of the file's bytes
     * @throws IOException if the file cannot be read
     */
    public String computeHash(Path filePath) throws IOException {
        return hex(Files.readAllBytes(filePath));
    }

    /**
     * @return 64-character hex digest of the UTF-8 encoded text
     */
    public String computeHash(String content) {
        return hex(content.getBytes(StandardCharsets.UTF_8));
    }

    public long getFileSize(Path filePath) throws IOException {
        return Files.size(filePath);
    }

    private static String hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
