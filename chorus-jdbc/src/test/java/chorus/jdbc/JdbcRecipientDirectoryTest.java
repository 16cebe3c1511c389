package chorus.jdbc;

import chorus.jdbc.directory.JdbcRecipientDirectory;
import chorus.model.Recipient;
import chorus.model.SenderIdentity;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRecipientDirectoryTest {

  private JdbcRecipientDirectory directory;

  @BeforeEach
  void setup() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:members_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("RUNSCRIPT FROM 'classpath:/chorus/schema-h2.sql'");
    }
    directory = JdbcRecipientDirectory.of(dataSource);
  }

  @Test
  void activeRecipientsOrderedByAddressWithExclusion() {
    directory.addMember("+1003", "Carol", false);
    directory.addMember("+1001", "Alice", true);
    directory.addMember("+1002", "Bob", false);

    assertEquals(List.of(
        new Recipient("+1001", "Alice", true),
        new Recipient("+1002", "Bob", false),
        new Recipient("+1003", "Carol", false)), directory.activeRecipients(null));
    assertEquals(List.of("+1001", "+1003"),
        directory.activeRecipients("+1002").stream().map(Recipient::address).toList());
  }

  @Test
  void identityOfActiveMember() {
    directory.addMember("+1001", "Alice", true);

    assertEquals(new SenderIdentity("Alice", true), directory.identity("+1001").orElseThrow());
    assertTrue(directory.identity("+1999").isEmpty());
  }

  @Test
  void deactivatedMemberLeavesRoster() {
    directory.addMember("+1001", "Alice", true);
    directory.addMember("+1002", "Bob", false);

    assertTrue(directory.deactivate("+1002"));
    assertFalse(directory.deactivate("+1002"));
    assertFalse(directory.deactivate("+1999"));

    assertTrue(directory.identity("+1002").isEmpty());
    assertEquals(1, directory.activeRecipients(null).size());
  }

  @Test
  void addMemberReactivatesAndRenames() {
    directory.addMember("+1002", "Bob", false);
    directory.deactivate("+1002");

    directory.addMember("+1002", "Robert", true);

    assertEquals(new SenderIdentity("Robert", true), directory.identity("+1002").orElseThrow());
    assertEquals(1, directory.activeRecipients(null).size());
  }

  @Test
  void addMemberRequiresAddressAndName() {
    assertThrows(NullPointerException.class, () -> directory.addMember(null, "Bob", false));
    assertThrows(NullPointerException.class, () -> directory.addMember("+1002", null, false));
  }
}
