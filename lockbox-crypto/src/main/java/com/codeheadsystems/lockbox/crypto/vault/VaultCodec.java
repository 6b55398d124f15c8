package com.codeheadsystems.lockbox.crypto.vault;

import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import com.codeheadsystems.lockbox.crypto.model.CredentialCollection;
import com.codeheadsystems.lockbox.crypto.model.CredentialRecord;
import com.codeheadsystems.lockbox.crypto.model.LegacyEntry;
import com.codeheadsystems.lockbox.crypto.model.StoredEntry;
import com.codeheadsystems.lockbox.crypto.model.StructuredEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical JSON form of a credential collection.
 * <p>
 * Written form: an object keyed by title, titles in sorted order, each value an object with
 * {@code password}, {@code updatedAt} (ISO-8601 instant), optional {@code category} and any
 * extra string fields. Read form additionally accepts a bare string per title, and timestamps
 * in local date-time or {@code yyyy-MM-dd HH:mm} form interpreted in the configured zone.
 */
public class VaultCodec {

  private static final Logger log = LoggerFactory.getLogger(VaultCodec.class);

  static final String PASSWORD = "password";
  static final String UPDATED_AT = "updatedAt";
  static final String CATEGORY = "category";

  private static final DateTimeFormatter LEGACY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final ObjectMapper objectMapper;
  private final ZoneId zone;

  /**
   * Instantiates a codec that reads zone-less timestamps in the system zone.
   */
  public VaultCodec() {
    this(new ObjectMapper(), ZoneId.systemDefault());
  }

  /**
   * Instantiates a new Vault codec.
   *
   * @param objectMapper the object mapper
   * @param zone         zone for timestamps stored without one
   */
  public VaultCodec(final ObjectMapper objectMapper, final ZoneId zone) {
    this.objectMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    this.zone = zone;
  }

  /**
   * Serializes the collection. Equal collections always produce equal bytes.
   *
   * @param collection the collection
   * @return UTF-8 JSON bytes
   */
  public byte[] encode(final CredentialCollection collection) {
    ObjectNode root = objectMapper.createObjectNode();
    new TreeMap<>(collection.entries()).forEach((title, record) -> root.set(title, toNode(record)));
    try {
      return objectMapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize collection", e);
    }
  }

  /**
   * Parses decrypted bytes into stored entries, without migrating them.
   *
   * @param plaintext the plaintext
   * @return entries by title, in stored order
   * @throws DecryptionFailureException if the bytes are not a JSON object
   */
  public Map<String, StoredEntry> parse(final byte[] plaintext) {
    JsonNode root;
    try {
      root = objectMapper.readTree(plaintext);
    } catch (IOException e) {
      throw new DecryptionFailureException(e);
    }
    if (root == null || !root.isObject()) {
      throw new DecryptionFailureException();
    }
    Map<String, StoredEntry> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      result.put(field.getKey(), toEntry(field.getValue()));
    }
    return result;
  }

  /**
   * Parses and migrates decrypted bytes into a collection.
   *
   * @param plaintext the plaintext
   * @param now       timestamp for entries that carry none
   * @return the credential collection
   */
  public CredentialCollection decode(final byte[] plaintext, final Instant now) {
    CredentialCollection collection = new CredentialCollection();
    parse(plaintext).forEach((title, entry) -> collection.put(title, entry.migrate(now)));
    return collection;
  }

  private ObjectNode toNode(final CredentialRecord record) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(PASSWORD, record.secretValue());
    node.put(UPDATED_AT, record.lastModified().toString());
    if (record.category() != null) {
      node.put(CATEGORY, record.category());
    }
    record.auxiliaryFields().forEach((key, value) -> {
      if (!isReserved(key)) {
        node.put(key, value);
      }
    });
    return node;
  }

  private StoredEntry toEntry(final JsonNode node) {
    if (node.isNull()) {
      return new LegacyEntry("");
    }
    if (!node.isObject()) {
      return new LegacyEntry(node.asText());
    }
    String password = node.hasNonNull(PASSWORD) ? node.get(PASSWORD).asText() : "";
    Instant updatedAt = node.hasNonNull(UPDATED_AT) ? parseTimestamp(node.get(UPDATED_AT).asText()) : null;
    String category = node.hasNonNull(CATEGORY) ? node.get(CATEGORY).asText() : null;
    Map<String, String> aux = new TreeMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!isReserved(field.getKey()) && field.getValue().isValueNode() && !field.getValue().isNull()) {
        aux.put(field.getKey(), field.getValue().asText());
      }
    }
    return new StructuredEntry(password, updatedAt, category, aux);
  }

  private Instant parseTimestamp(final String text) {
    try {
      if (text.indexOf('T') < 0) {
        return LocalDateTime.parse(text, LEGACY_TIMESTAMP).atZone(zone).toInstant();
      }
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return zoned.toInstant();
      }
      return ((LocalDateTime) parsed).atZone(zone).toInstant();
    } catch (DateTimeParseException e) {
      log.debug("parseTimestamp(): unreadable timestamp, treating as missing");
      return null;
    }
  }

  private static boolean isReserved(final String key) {
    return PASSWORD.equals(key) || UPDATED_AT.equals(key) || CATEGORY.equals(key);
  }
}
