/*
 * どこで: Credential Vault
 * 何を: 接続先 DB パスワードを AES-256-GCM で暗号化/復号する
 * なぜ: 保存時にパスワードを平文で持たず、worker と接続テストだけが復号できるようにするため
 */
package com.chainindexer.common.crypto;

import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM cipher for stored destination secrets.
 *
 * <p>Ciphertext format is {@code ivHex.authTagHex.cipherBase64} with a 12-byte IV and a 16-byte
 * authentication tag. The key is 32 bytes supplied as 64 hex characters.
 */
public class CredentialCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int KEY_HEX_LENGTH = 64;
  private static final int IV_LENGTH = 12;
  private static final int AUTH_TAG_LENGTH = 16;

  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private final SecretKeySpec key;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialCipher(String hexKey) {
    if (hexKey == null || hexKey.length() != KEY_HEX_LENGTH) {
      throw new IllegalArgumentException(
          "encryption key must be " + KEY_HEX_LENGTH + " hex characters");
    }
    final byte[] keyBytes;
    try {
      keyBytes = HEX.decode(hexKey.toLowerCase());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("encryption key is not valid hex", ex);
    }
    this.key = new SecretKeySpec(keyBytes, "AES");
  }

  public String encrypt(String plainText) {
    if (plainText == null) {
      throw new CredentialCipherException("plain text is required");
    }
    final byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
      // JCE は暗号文の末尾に認証タグを連結して返す
      final byte[] sealed = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
      final int cipherLength = sealed.length - AUTH_TAG_LENGTH;
      final byte[] encrypted = Arrays.copyOfRange(sealed, 0, cipherLength);
      final byte[] authTag = Arrays.copyOfRange(sealed, cipherLength, sealed.length);
      return HEX.encode(iv)
          + "."
          + HEX.encode(authTag)
          + "."
          + Base64.getEncoder().encodeToString(encrypted);
    } catch (GeneralSecurityException ex) {
      throw new CredentialCipherException("failed to encrypt data", ex);
    }
  }

  public String decrypt(String cipherText) {
    if (cipherText == null) {
      throw new CredentialCipherException("invalid encrypted data format");
    }
    final String[] parts = cipherText.split("\\.", -1);
    if (parts.length != 3) {
      throw new CredentialCipherException("invalid encrypted data format");
    }
    final byte[] iv;
    final byte[] authTag;
    final byte[] encrypted;
    try {
      iv = HEX.decode(parts[0].toLowerCase());
      authTag = HEX.decode(parts[1].toLowerCase());
      encrypted = Base64.getDecoder().decode(parts[2]);
    } catch (IllegalArgumentException ex) {
      throw new CredentialCipherException("invalid encrypted data format", ex);
    }
    if (iv.length != IV_LENGTH) {
      throw new CredentialCipherException("invalid IV length");
    }
    if (authTag.length != AUTH_TAG_LENGTH) {
      throw new CredentialCipherException("invalid auth tag length");
    }
    final byte[] sealed = new byte[encrypted.length + AUTH_TAG_LENGTH];
    System.arraycopy(encrypted, 0, sealed, 0, encrypted.length);
    System.arraycopy(authTag, 0, sealed, encrypted.length, AUTH_TAG_LENGTH);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(AUTH_TAG_LENGTH * 8, iv));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    } catch (AEADBadTagException ex) {
      throw new CredentialCipherException(
          "authentication tag mismatch; data may be corrupt or key incorrect", ex);
    } catch (GeneralSecurityException ex) {
      throw new CredentialCipherException("failed to decrypt data", ex);
    }
  }
}
