package com.flamingo.reporttable.service.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.exception.ContactMappingException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContactDirectoryTest {

  @TempDir Path tempDir;

  private ExtractionConfig extractionConfig;
  private ContactDirectory contactDirectory;

  @BeforeEach
  void setUp() {
    extractionConfig = new ExtractionConfig();
    contactDirectory = new ContactDirectory(extractionConfig);
  }

  @Test
  void shouldReadContacts_whenColumnsPresent() {
    // Given
    String csv =
        "AssignmentGroup,Contact,Email,Region\n"
            + " Network Ops ,Alice Smith,alice@example.com,EU\n"
            + "Database,Bob Jones,bob@example.com,US\n";

    // When
    Map<String, Contact> contacts = contactDirectory.read(new StringReader(csv));

    // Then
    assertThat(contacts)
        .containsExactly(
            Map.entry("Network Ops", new Contact("Alice Smith", "alice@example.com")),
            Map.entry("Database", new Contact("Bob Jones", "bob@example.com")));
  }

  @Test
  void shouldStripByteOrderMark_whenHeaderStartsWithIt() {
    // Given
    String csv = "\uFEFFAssignmentGroup,Contact,Email\nDatabase,Bob,bob@example.com\n";

    // When
    Map<String, Contact> contacts = contactDirectory.read(new StringReader(csv));

    // Then
    assertThat(contacts).containsKey("Database");
  }

  @Test
  void shouldSkipRow_whenGroupIsBlank() {
    // Given
    String csv =
        "Email,Contact,AssignmentGroup\n"
            + "nobody@example.com,Nobody,  \n"
            + "carol@example.com,Carol,Service Desk\n";

    // When
    Map<String, Contact> contacts = contactDirectory.read(new StringReader(csv));

    // Then
    assertThat(contacts).hasSize(1);
    assertThat(contacts.get("Service Desk")).isEqualTo(new Contact("Carol", "carol@example.com"));
  }

  @Test
  void shouldKeepLastContact_whenGroupRepeats() {
    // Given
    String csv =
        "AssignmentGroup,Contact,Email\n"
            + "Database,Bob,bob@example.com\n"
            + "Database,Dana,dana@example.com\n";

    // When
    Map<String, Contact> contacts = contactDirectory.read(new StringReader(csv));

    // Then
    assertThat(contacts.get("Database").name()).isEqualTo("Dana");
  }

  @Test
  void shouldThrow_whenRequiredColumnMissing() {
    // Given
    String csv = "AssignmentGroup,Owner\nDatabase,Bob\n";

    // When/Then
    assertThatThrownBy(() -> contactDirectory.read(new StringReader(csv)))
        .isInstanceOf(ContactMappingException.class)
        .hasMessageContaining("missing required columns")
        .hasMessageContaining("Owner");
  }

  @Test
  void shouldThrow_whenFileIsEmpty() {
    assertThatThrownBy(() -> contactDirectory.read(new StringReader("")))
        .isInstanceOf(ContactMappingException.class)
        .hasMessage("Contact mapping file is empty");
  }

  @Test
  void shouldLoadConfiguredFile() throws IOException {
    // Given
    Path file = tempDir.resolve("contacts.csv");
    Files.writeString(
        file,
        "AssignmentGroup,Contact,Email\nDatabase,Bob,bob@example.com\n",
        StandardCharsets.UTF_8);
    extractionConfig.getEnrichment().setContactFile(file.toString());

    // When
    Map<String, Contact> contacts = contactDirectory.load();

    // Then
    assertThat(contacts).containsOnlyKeys("Database");
  }

  @Test
  void shouldThrow_whenConfiguredFileMissing() {
    // Given
    extractionConfig.getEnrichment().setContactFile(tempDir.resolve("missing.csv").toString());

    // When/Then
    assertThatThrownBy(() -> contactDirectory.load())
        .isInstanceOf(ContactMappingException.class)
        .hasMessageStartingWith("Contact mapping file not found");
  }
}
