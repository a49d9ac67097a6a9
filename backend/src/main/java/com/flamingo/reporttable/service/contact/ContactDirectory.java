package com.flamingo.reporttable.service.contact;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.exception.ContactMappingException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the assignment-group to contact mapping from a CSV file with {@code AssignmentGroup},
 * {@code Contact} and {@code Email} columns. Other columns are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactDirectory {

  static final String GROUP_COLUMN = "AssignmentGroup";
  static final String CONTACT_COLUMN = "Contact";
  static final String EMAIL_COLUMN = "Email";

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  private final ExtractionConfig extractionConfig;

  /**
   * Loads the mapping from the configured contact file.
   *
   * @return contacts keyed by assignment group, in file order
   * @throws ContactMappingException if the file is missing, unreadable or lacks required columns
   */
  public Map<String, Contact> load() {
    Path contactFile = Path.of(extractionConfig.getEnrichment().getContactFile());
    log.info("Loading contact mapping from: {}", contactFile);
    if (!Files.isRegularFile(contactFile)) {
      throw new ContactMappingException("Contact mapping file not found: " + contactFile);
    }
    try (Reader reader = Files.newBufferedReader(contactFile, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ContactMappingException(
          "Error reading contact mapping file '" + contactFile + "': " + e.getMessage(), e);
    }
  }

  /**
   * Reads a contact mapping from CSV text. Groups are matched exactly after trimming; a later row
   * for the same group replaces an earlier one.
   */
  public Map<String, Contact> read(Reader reader) {
    List<String[]> lines;
    try (MappingIterator<String[]> iterator =
        CSV_MAPPER
            .readerFor(String[].class)
            .withFeatures(CsvParser.Feature.WRAP_AS_ARRAY, CsvParser.Feature.SKIP_EMPTY_LINES)
            .readValues(reader)) {
      lines = iterator.readAll();
    } catch (IOException e) {
      throw new ContactMappingException("Invalid contact mapping CSV: " + e.getMessage(), e);
    }
    if (lines.isEmpty()) {
      throw new ContactMappingException("Contact mapping file is empty");
    }

    List<String> header = Arrays.stream(lines.get(0)).map(ContactDirectory::clean).toList();
    int groupIndex = header.indexOf(GROUP_COLUMN);
    int contactIndex = header.indexOf(CONTACT_COLUMN);
    int emailIndex = header.indexOf(EMAIL_COLUMN);
    if (groupIndex < 0 || contactIndex < 0 || emailIndex < 0) {
      throw new ContactMappingException(
          "Contact mapping file missing required columns "
              + List.of(GROUP_COLUMN, CONTACT_COLUMN, EMAIL_COLUMN)
              + ", found "
              + header);
    }

    Map<String, Contact> contacts = new LinkedHashMap<>();
    for (int i = 1; i < lines.size(); i++) {
      String[] line = lines.get(i);
      String group = cell(line, groupIndex);
      if (group.isEmpty()) {
        log.warn("Empty AssignmentGroup found in row {}", i + 1);
        continue;
      }
      Contact contact = new Contact(cell(line, contactIndex), cell(line, emailIndex));
      contacts.put(group, contact);
      log.debug("Loaded mapping: {} -> {} ({})", group, contact.name(), contact.email());
    }
    log.info("Loaded {} contact mappings", contacts.size());
    return contacts;
  }

  private static String cell(String[] line, int index) {
    return index < line.length ? clean(line[index]) : "";
  }

  private static String clean(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("\uFEFF", "").strip();
  }
}
