/**
 * Spring Boot auto-configuration.
 *
 * <p>Add {@code chorus-spring-boot-starter} with a {@link javax.sql.DataSource} and the
 * {@code chorus_*} tables; a {@link chorus.Chorus} bean and an
 * {@link chorus.InboundMessageHandler} bean become available for injection.
 * Properties live under {@code chorus.*}, see {@link chorus.spring.boot.ChorusProperties}.
 */
package chorus.spring.boot;
