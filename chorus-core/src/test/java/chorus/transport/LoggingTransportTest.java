package chorus.transport;

import chorus.spi.SendResult;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LoggingTransportTest {

  @Test
  void logsAndReportsSuccess() {
    List<LogRecord> records = new CopyOnWriteArrayList<>();
    Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {
      }

      @Override
      public void close() {
      }
    };
    Logger logger = Logger.getLogger(LoggingTransport.class.getName());
    logger.addHandler(handler);
    try {
      SendResult result = new LoggingTransport().send("+1001", "hello");

      assertTrue(result.ok());
      assertTrue(result.providerId().startsWith("test-"));
      assertEquals(1, records.size());
      assertArrayEquals(new Object[]{"+1001", "hello"}, records.get(0).getParameters());
    } finally {
      logger.removeHandler(handler);
    }
  }
}
