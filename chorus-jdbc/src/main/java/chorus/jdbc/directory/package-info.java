/**
 * JDBC-backed member roster.
 */
package chorus.jdbc.directory;
