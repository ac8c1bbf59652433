package agents.dataagent.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogUtilTest {

  @Test
  void testFormatLogMessageKeepsFiveColumns() {
    String line = LogUtil.formatLogMessage("Loaded 3 tables, 2 relationships\nready", LogUtil.INFO,
      "SchemaDescriptor", "StartUp", "Schema");

    assertEquals("Loaded 3 tables; 2 relationships ready,1,SchemaDescriptor,StartUp,Schema", line);
    assertEquals(5, line.split(",").length);
  }

  @Test
  void testNullMessage() {
    assertEquals("null,0,A,B,C", LogUtil.formatLogMessage(null, LogUtil.ERROR, "A", "B", "C"));
  }
}
