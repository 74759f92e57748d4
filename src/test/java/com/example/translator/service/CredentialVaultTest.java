package com.example.translator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.translator.TestProperties;
import com.example.translator.exception.ConfigurationException;
import com.example.translator.exception.CryptoException;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialVaultTest {

  private static final String SECRET = "s3cret";
  private static final String BASE64_ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
  private CredentialVault vault;

  @BeforeEach
  void setUp() {
    vault = new CredentialVault(TestProperties.defaults());
  }

  @Test
  void decryptReturnsOriginalPlaintext() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThat(vault.decrypt(blob, SECRET)).isEqualTo("sk-live-abc123");
  }

  @Test
  void blobHasThreeComponentsAndNeverContainsPlaintext() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThat(blob.split("\\.")).hasSize(3);
    assertThat(blob).doesNotContain("sk-live-abc123");
  }

  @Test
  void freshNoncePerCall() {
    assertThat(vault.encrypt("sk-same", SECRET)).isNotEqualTo(vault.encrypt("sk-same", SECRET));
  }

  @Test
  void configuredSecretIsUsedByDefault() {
    String blob = vault.encrypt("sk-default");

    assertThat(vault.decrypt(blob, TestProperties.SECRET)).isEqualTo("sk-default");
  }

  @Test
  void decryptFailsWithDifferentSecret() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThatThrownBy(() -> vault.decrypt(blob, "other-secret"))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void decryptFailsOnModifiedCiphertext() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThatThrownBy(() -> vault.decrypt(flipFirstByte(blob, 1), SECRET))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void decryptFailsOnModifiedTag() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThatThrownBy(() -> vault.decrypt(flipFirstByte(blob, 2), SECRET))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void decryptFailsOnModifiedNonce() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    assertThatThrownBy(() -> vault.decrypt(flipFirstByte(blob, 0), SECRET))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void decryptFailsForEverySingleCharacterSubstitution() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);

    for (int position = 0; position < blob.length(); position++) {
      char original = blob.charAt(position);
      if (original == '.') {
        continue;
      }
      for (char replacement : BASE64_ALPHABET.toCharArray()) {
        if (replacement == original) {
          continue;
        }
        String mutated = blob.substring(0, position) + replacement + blob.substring(position + 1);
        assertThatThrownBy(() -> vault.decrypt(mutated, SECRET))
            .as("position %d %s->%s", position, original, replacement)
            .isInstanceOf(CryptoException.class);
      }
    }
  }

  @Test
  void decryptRejectsNonCanonicalTrailingBits() {
    String blob = vault.encrypt("sk-live-abc123", SECRET);
    String[] parts = blob.split("\\.");
    // a 16-byte tag ends in "xx==" where the last data character carries 4 unused bits
    int last = parts[2].length() - 3;
    char current = parts[2].charAt(last);
    char sibling = BASE64_ALPHABET.charAt(BASE64_ALPHABET.indexOf(current) ^ 0x01);
    parts[2] = parts[2].substring(0, last) + sibling + parts[2].substring(last + 1);

    assertThatThrownBy(() -> vault.decrypt(String.join(".", parts), SECRET))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("encoding");
  }

  @Test
  void decryptRejectsWrongComponentCount() {
    assertThatThrownBy(() -> vault.decrypt("abc.def", SECRET))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("format");
    assertThatThrownBy(() -> vault.decrypt("a.b.c.d", SECRET))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void decryptRejectsInvalidBase64() {
    assertThatThrownBy(() -> vault.decrypt("!!!.???.***", SECRET))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void emptySecretIsAConfigurationError() {
    assertThatThrownBy(() -> vault.encrypt("sk-x", ""))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> vault.decrypt("a.b.c", null))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void derivedKeyIsThirtyTwoBytes() {
    assertThat(CredentialVault.deriveKeyBytes("anything")).hasSize(32);
  }

  private static String flipFirstByte(String blob, int part) {
    String[] parts = blob.split("\\.");
    byte[] bytes = Base64.getDecoder().decode(parts[part]);
    bytes[0] ^= 0x01;
    parts[part] = Base64.getEncoder().encodeToString(bytes);
    return String.join(".", parts);
  }
}
