package me.golemcore.adminbot.adapter.inbound.discord;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Verifies the Ed25519 signature Discord puts on every interaction request.
 *
 * <p>
 * The signed message is the {@code X-Signature-Timestamp} header followed by
 * the raw request body; the key is the application's public key from the
 * developer portal ({@code bot.discord.public-key}, hex encoded).
 */
@Component
@Slf4j
public class DiscordSignatureVerifier {

    private static final String ALGORITHM = "Ed25519";
    // DER prefix of an X.509 SubjectPublicKeyInfo holding a raw 32-byte Ed25519 key
    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final BotProperties properties;
    private volatile PublicKey publicKey;

    public DiscordSignatureVerifier(BotProperties properties) {
        this.properties = properties;
        if (!properties.getDiscord().isVerifySignatures()) {
            log.warn("[Discord] Interaction signature verification is DISABLED");
        }
    }

    public boolean verify(String signatureHex, String timestamp, byte[] body) {
        if (!properties.getDiscord().isVerifySignatures()) {
            return true;
        }
        if (signatureHex == null || timestamp == null || body == null) {
            log.debug("[Discord] Missing signature headers");
            return false;
        }

        try {
            PublicKey key = getPublicKey();
            if (key == null) {
                log.warn("[Discord] No public key configured, rejecting interaction");
                return false;
            }
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(key);
            verifier.update(timestamp.getBytes(StandardCharsets.UTF_8));
            verifier.update(body);
            return verifier.verify(HexFormat.of().parseHex(signatureHex));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.debug("[Discord] Signature verification failed: {}", e.getMessage());
            return false;
        }
    }

    private PublicKey getPublicKey() throws GeneralSecurityException {
        PublicKey key = publicKey;
        if (key == null) {
            String hex = properties.getDiscord().getPublicKey();
            if (hex == null || hex.isBlank()) {
                return null;
            }
            byte[] raw = HexFormat.of().parseHex(hex.trim());
            byte[] encoded = new byte[X509_PREFIX.length + raw.length];
            System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
            System.arraycopy(raw, 0, encoded, X509_PREFIX.length, raw.length);
            key = KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
            publicKey = key;
        }
        return key;
    }
}
