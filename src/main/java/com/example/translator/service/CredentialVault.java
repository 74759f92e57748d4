package com.example.translator.service;

import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.CryptoException;
import com.example.translator.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Upstream Credential Vault
 *
 * AES-256-GCM encryption keyed by SHA-256 of the server secret. Blobs are encoded as
 * {@code base64(iv).base64(ciphertext).base64(tag)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialVault {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_TAG_BYTES = GCM_TAG_LENGTH / 8;
  private static final int GCM_IV_LENGTH = 12;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final String BLOB_SEPARATOR = ".";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final ApplicationProperties properties;

  /**
   * Encrypt with the configured server secret
   */
  public String encrypt(String plaintext) {
    return encrypt(plaintext, properties.security().serverSecret());
  }

  /**
   * Decrypt with the configured server secret
   */
  public String decrypt(String blob) {
    return decrypt(blob, properties.security().serverSecret());
  }

  public String encrypt(String plaintext, String serverSecret) {
    SecretKey key = deriveKey(serverSecret);
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      // JCE appends the tag to the ciphertext
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      int ciphertextLength = sealed.length - GCM_TAG_BYTES;
      byte[] ciphertext = new byte[ciphertextLength];
      byte[] tag = new byte[GCM_TAG_BYTES];
      System.arraycopy(sealed, 0, ciphertext, 0, ciphertextLength);
      System.arraycopy(sealed, ciphertextLength, tag, 0, GCM_TAG_BYTES);

      Base64.Encoder encoder = Base64.getEncoder();
      return encoder.encodeToString(iv) + BLOB_SEPARATOR
          + encoder.encodeToString(ciphertext) + BLOB_SEPARATOR
          + encoder.encodeToString(tag);

    } catch (GeneralSecurityException e) {
      log.error("Credential encryption failed", e);
      throw new CryptoException("Failed to encrypt credential", e);
    }
  }

  public String decrypt(String blob, String serverSecret) {
    SecretKey key = deriveKey(serverSecret);
    if (blob == null) {
      throw new CryptoException("Invalid encrypted credential format");
    }
    String[] parts = blob.split("\\.", -1);
    if (parts.length != 3 || parts[0].isEmpty() || parts[2].isEmpty()) {
      throw new CryptoException("Invalid encrypted credential format");
    }

    try {
      Base64.Decoder decoder = Base64.getDecoder();
      byte[] iv = decoder.decode(parts[0]);
      byte[] ciphertext = decoder.decode(parts[1]);
      byte[] tag = decoder.decode(parts[2]);
      if (iv.length != GCM_IV_LENGTH || tag.length != GCM_TAG_BYTES) {
        throw new CryptoException("Invalid encrypted credential format");
      }
      // the decoder ignores unused trailing bits, so only the canonical encoding is accepted
      if (!isCanonical(iv, parts[0]) || !isCanonical(ciphertext, parts[1]) || !isCanonical(tag, parts[2])) {
        throw new CryptoException("Invalid encrypted credential encoding");
      }

      byte[] sealed = new byte[ciphertext.length + tag.length];
      System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
      System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);

    } catch (IllegalArgumentException e) {
      throw new CryptoException("Invalid encrypted credential encoding", e);
    } catch (AEADBadTagException e) {
      throw new CryptoException("Encrypted credential failed authentication", e);
    } catch (GeneralSecurityException e) {
      log.error("Credential decryption failed", e);
      throw new CryptoException("Failed to decrypt credential", e);
    }
  }

  private static boolean isCanonical(byte[] decoded, String encoded) {
    return Base64.getEncoder().encodeToString(decoded).equals(encoded);
  }

  /**
   * 32-byte key material derived from the server secret, shared with token signing.
   */
  public static byte[] deriveKeyBytes(String serverSecret) {
    if (serverSecret == null || serverSecret.isEmpty()) {
      throw new ConfigurationException("Server secret is not configured");
    }
    try {
      return MessageDigest.getInstance("SHA-256").digest(serverSecret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private SecretKey deriveKey(String serverSecret) {
    return new SecretKeySpec(deriveKeyBytes(serverSecret), "AES");
  }
}
