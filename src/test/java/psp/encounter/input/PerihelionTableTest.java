package psp.encounter.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import org.junit.Test;
import psp.encounter.input.PerihelionTable.PerihelionFormatException;

public class PerihelionTableTest {

  @Test
  public void loadEmbedded_knownEncounters() throws Exception {
    PerihelionTable table = PerihelionTable.loadEmbedded();
    assertEquals(Instant.parse("2021-11-21T08:23:00Z"), table.getPerihelion(10));
    assertEquals(Instant.parse("2020-01-29T09:37:00Z"), table.getPerihelion(4));
    assertTrue(table.getAll().containsKey(23));
  }

  @Test
  public void encounterId_zeroPadded() {
    assertEquals("E04", PerihelionTable.encounterId(4));
    assertEquals("E10", PerihelionTable.encounterId(10));
  }

  @Test
  public void getPerihelion_missingEncounterThrows() throws Exception {
    PerihelionTable table = PerihelionTable.loadEmbedded();
    try {
      table.getPerihelion(3);
      fail();
    } catch (MissingInputException e) {
      assertEquals("perihelion E03", e.getVariableName());
    }
  }

  @Test
  public void constructor_readsWithoutHeaderAndIsoTimes() throws Exception {
    String csv = "7, 2021-01-17T17:40:00Z\n\n8, 2021/04/29 08:48:00\n";
    PerihelionTable table = new PerihelionTable(new StringReader(csv));
    assertEquals(2, table.getAll().size());
    assertEquals(Instant.parse("2021-01-17T17:40:00Z"), table.getPerihelion(7));
    assertEquals(Instant.parse("2021-04-29T08:48:00Z"), table.getPerihelion(8));
  }

  @Test(expected = PerihelionFormatException.class)
  public void constructor_wrongFieldCountThrows() throws IOException, PerihelionFormatException {
    new PerihelionTable(new StringReader("encounter, perihelion\n9, 2021/08/09, extra\n"));
  }
}
