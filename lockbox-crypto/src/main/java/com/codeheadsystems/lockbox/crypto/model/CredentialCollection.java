package com.codeheadsystems.lockbox.crypto.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * The decrypted credential collection: unique entry titles mapped to records.
 * <p>
 * Not thread safe. The session that unsealed it is its only writer.
 */
public class CredentialCollection {

  private final Map<String, CredentialRecord> entries;

  /**
   * Instantiates an empty collection.
   */
  public CredentialCollection() {
    this.entries = new LinkedHashMap<>();
  }

  /**
   * Instantiates a collection holding a copy of the given entries.
   *
   * @param entries the entries
   */
  public CredentialCollection(final Map<String, CredentialRecord> entries) {
    this.entries = new LinkedHashMap<>(entries);
  }

  /**
   * Adds or replaces an entry.
   *
   * @param title  the title
   * @param record the record
   * @return the previous record, if any
   */
  public Optional<CredentialRecord> put(final String title, final CredentialRecord record) {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Title must not be blank");
    }
    Objects.requireNonNull(record, "record");
    return Optional.ofNullable(entries.put(title, record));
  }

  /**
   * Get.
   *
   * @param title the title
   * @return the optional
   */
  public Optional<CredentialRecord> get(final String title) {
    return Optional.ofNullable(entries.get(title));
  }

  /**
   * Remove.
   *
   * @param title the title
   * @return true if an entry was removed
   */
  public boolean remove(final String title) {
    return entries.remove(title) != null;
  }

  public boolean contains(final String title) {
    return entries.containsKey(title);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Drops every entry.
   */
  public void clear() {
    entries.clear();
  }

  /**
   * Read-only view of all entries.
   *
   * @return the map
   */
  public Map<String, CredentialRecord> entries() {
    return Collections.unmodifiableMap(entries);
  }

  /**
   * All titles, sorted without regard to case.
   *
   * @return the list
   */
  public List<String> titles() {
    List<String> titles = new ArrayList<>(entries.keySet());
    titles.sort(String.CASE_INSENSITIVE_ORDER);
    return titles;
  }

  /**
   * Titles containing the query, case-insensitively, sorted. A blank query matches everything.
   *
   * @param query the query
   * @return the list
   */
  public List<String> search(final String query) {
    if (query == null || query.isBlank()) {
      return titles();
    }
    String needle = query.toLowerCase(Locale.ROOT);
    return titles().stream()
        .filter(t -> t.toLowerCase(Locale.ROOT).contains(needle))
        .toList();
  }

  /**
   * Titles whose category matches, sorted. Entries without a category belong to
   * {@link CredentialRecord#DEFAULT_CATEGORY}.
   *
   * @param category the category
   * @return the list
   */
  public List<String> inCategory(final String category) {
    return titles().stream()
        .filter(t -> entries.get(t).categoryOrDefault().equalsIgnoreCase(category))
        .toList();
  }

  /**
   * Distinct categories in use, sorted.
   *
   * @return the list
   */
  public List<String> categories() {
    TreeSet<String> categories = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    entries.values().forEach(r -> categories.add(r.categoryOrDefault()));
    return new ArrayList<>(categories);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CredentialCollection that)) {
      return false;
    }
    return entries.equals(that.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "CredentialCollection[size=" + entries.size() + "]";
  }
}
